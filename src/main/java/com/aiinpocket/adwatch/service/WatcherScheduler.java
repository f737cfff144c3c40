package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.exception.InvalidScheduleException;
import com.aiinpocket.adwatch.job.WatcherRunJob;
import com.aiinpocket.adwatch.model.dto.RunOutcome;
import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.model.enums.WatcherStatus;
import com.aiinpocket.adwatch.repository.WatcherRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.CronExpression;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.TimeZone;

/**
 * 監控器排程器（cron 註冊表）。
 * 為每個 ACTIVE 監控器維持恰好一個 Quartz 任務，JobKey / TriggerKey 皆為監控器 ID。
 *
 * <p>任何排程變更都採「先取消、再重新註冊」，讓註冊結果只取決於當下的監控器設定，
 * 不需要比對新舊差異。觸發後的執行週期跑在 Quartz 工作執行緒上，不會阻塞其他監控器的觸發。
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Order(2)
public class WatcherScheduler implements ApplicationRunner {

    static final String JOB_GROUP = "watchers";

    private final Scheduler scheduler;
    private final WatcherRepository watcherRepo;
    private final WatcherRunService runService;
    private final AdWatchProperties props;

    @Override
    public void run(ApplicationArguments args) {
        start();
    }

    /**
     * 啟動時載入所有 ACTIVE 監控器並註冊。
     * 清單載入失敗視為致命錯誤；單一監控器排程格式錯誤只記錄並略過。
     *
     * @return 成功註冊的數量
     */
    public int start() {
        List<Watcher> active;
        try {
            active = watcherRepo.findByStatus(WatcherStatus.ACTIVE);
        } catch (Exception e) {
            log.error("[排程] 無法載入監控器清單，中止啟動", e);
            throw new IllegalStateException("無法載入監控器清單: " + e.getMessage(), e);
        }

        int registered = 0;
        for (Watcher watcher : active) {
            try {
                register(watcher);
                registered++;
            } catch (InvalidScheduleException e) {
                log.error("[排程] 監控器 {} 的排程 '{}' 無法解析，暫不註冊: {}",
                        watcher.getId(), watcher.getSchedule(), e.getMessage());
            }
        }
        log.info("[排程] 已註冊 {}/{} 個 ACTIVE 監控器", registered, active.size());
        return registered;
    }

    /**
     * 註冊（或重新註冊）監控器的 cron 任務。
     * 排程無法解析時拋出 {@link InvalidScheduleException}，原本的任務保持不動。
     */
    public void register(Watcher watcher) {
        String watcherId = watcher.getId();
        CronExpression cron = CronScheduleParser.parse(watcher.getSchedule(), zone());

        JobKey jobKey = jobKey(watcherId);
        JobDetail job = JobBuilder.newJob(WatcherRunJob.class)
                .withIdentity(jobKey)
                .usingJobData(WatcherRunJob.WATCHER_ID_KEY, watcherId)
                .build();
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity(triggerKey(watcherId))
                .forJob(jobKey)
                .withSchedule(CronScheduleBuilder.cronSchedule(cron)
                        .withMisfireHandlingInstructionDoNothing())
                .build();

        try {
            if (scheduler.checkExists(jobKey)) {
                scheduler.deleteJob(jobKey);
                log.debug("[排程] 監控器 {} 舊任務已取消", watcherId);
            }
            scheduler.scheduleJob(job, trigger);
        } catch (SchedulerException e) {
            throw new IllegalStateException("監控器 " + watcherId + " 排程註冊失敗", e);
        }
        log.info("[排程] 監控器 {} 已註冊: '{}'，下次執行 {}", watcherId, watcher.getSchedule(), trigger.getNextFireTime());
    }

    /** 取消監控器的任務；本來就沒有註冊時不做任何事。執行中的週期不會被中斷。 */
    public void unregister(String watcherId) {
        try {
            if (scheduler.deleteJob(jobKey(watcherId))) {
                log.info("[排程] 監控器 {} 已取消註冊", watcherId);
            }
        } catch (SchedulerException e) {
            throw new IllegalStateException("監控器 " + watcherId + " 取消註冊失敗", e);
        }
    }

    /** Quartz 觸發時由 WatcherRunJob 呼叫 */
    public RunOutcome onTick(String watcherId) {
        RunOutcome outcome = runService.runCycle(watcherId);
        log.debug("[排程] 監控器 {} 本次觸發結果: {}", watcherId, outcome.status());
        return outcome;
    }

    public boolean isRegistered(String watcherId) {
        try {
            return scheduler.checkExists(jobKey(watcherId));
        } catch (SchedulerException e) {
            throw new IllegalStateException("無法查詢監控器 " + watcherId + " 的排程", e);
        }
    }

    public int registeredCount() {
        try {
            return scheduler.getJobKeys(GroupMatcher.jobGroupEquals(JOB_GROUP)).size();
        } catch (SchedulerException e) {
            throw new IllegalStateException("無法查詢排程數量", e);
        }
    }

    /** 下次觸發時間，未註冊時回傳 null */
    public Instant nextFireTime(String watcherId) {
        try {
            Trigger trigger = scheduler.getTrigger(triggerKey(watcherId));
            if (trigger == null || trigger.getNextFireTime() == null) {
                return null;
            }
            return trigger.getNextFireTime().toInstant();
        } catch (SchedulerException e) {
            throw new IllegalStateException("無法查詢監控器 " + watcherId + " 的下次執行時間", e);
        }
    }

    private TimeZone zone() {
        return TimeZone.getTimeZone(ZoneId.of(props.scheduler().zone()));
    }

    static JobKey jobKey(String watcherId) {
        return JobKey.jobKey(watcherId, JOB_GROUP);
    }

    static TriggerKey triggerKey(String watcherId) {
        return TriggerKey.triggerKey(watcherId, JOB_GROUP);
    }
}
