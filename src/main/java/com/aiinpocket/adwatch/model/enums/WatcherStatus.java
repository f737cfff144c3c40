package com.aiinpocket.adwatch.model.enums;

/**
 * 監控器狀態。
 * 只有 ACTIVE 的監控器會在排程器中持有 cron 觸發器。
 */
public enum WatcherStatus {
    ACTIVE,
    STOPPED
}
