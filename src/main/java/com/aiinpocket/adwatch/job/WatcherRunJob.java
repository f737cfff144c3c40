package com.aiinpocket.adwatch.job;

import com.aiinpocket.adwatch.service.WatcherScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 監控器排程任務。
 * 每個 ACTIVE 監控器各有一個 JobDetail（key = 監控器 ID），觸發時把 ID 交給排程器處理。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WatcherRunJob extends QuartzJobBean {

    public static final String WATCHER_ID_KEY = "watcherId";

    private final WatcherScheduler watcherScheduler;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        String watcherId = context.getMergedJobDataMap().getString(WATCHER_ID_KEY);
        if (watcherId == null) {
            log.warn("[排程] 任務 {} 缺少 watcherId，略過", context.getJobDetail().getKey());
            return;
        }
        watcherScheduler.onTick(watcherId);
    }
}
