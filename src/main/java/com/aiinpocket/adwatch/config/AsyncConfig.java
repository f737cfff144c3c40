package com.aiinpocket.adwatch.config;

import com.aiinpocket.adwatch.service.notification.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 非同步任務配置。
 *
 * <p>監控器的執行週期本身跑在 Quartz 的工作執行緒上；
 * 這裡只定義通知分發專用的執行緒池，同一週期內的多個通知目標在此平行發送。
 */
@Configuration
public class AsyncConfig {

    /**
     * 通知分發執行緒池。
     * 核心 3 線程 / 最大 8 線程，隊列容量 50。
     * 隊列滿時由呼叫端（執行週期）自己發送，不丟棄通知。
     */
    @Bean
    public TaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /** 通知之間的節流等待，測試時以記錄用的實作取代 */
    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
