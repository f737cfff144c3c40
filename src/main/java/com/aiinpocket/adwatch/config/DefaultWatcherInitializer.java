package com.aiinpocket.adwatch.config;

import com.aiinpocket.adwatch.model.dto.WatcherRequest;
import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.repository.WatcherRepository;
import com.aiinpocket.adwatch.service.WatcherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 應用啟動時確保至少有一個監控器。
 * 資料庫為空且 adwatch.scheduler.seed-default-watcher 開啟時，建立預設監控器（不指定通知目標，使用預設 Webhook）。
 * 需在 WatcherScheduler 載入排程之前執行。
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Order(1)
public class DefaultWatcherInitializer implements ApplicationRunner {

    private final WatcherService watcherService;
    private final WatcherRepository watcherRepo;
    private final AdWatchProperties props;

    @Override
    public void run(ApplicationArguments args) {
        AdWatchProperties.SchedulerParams config = props.scheduler();
        if (!config.seedDefaultWatcher()) {
            log.debug("[預設監控器] 已停用自動建立");
            return;
        }
        long existing = watcherRepo.count();
        if (existing > 0) {
            log.debug("[預設監控器] 已有 {} 個監控器，不需建立", existing);
            return;
        }

        Watcher seeded = watcherService.createWatcher(new WatcherRequest(
                config.defaultQuery(), config.defaultSchedule(), List.of(), null, null));
        log.info("[預設監控器] 已自動建立 '{}' ({})，ID: {}", seeded.getQuery(), seeded.getSchedule(), seeded.getId());
    }
}
