package com.aiinpocket.adwatch.service.notification;

import java.time.Duration;

/**
 * 發送節流與重試退避時的等待。
 * 正式環境為 {@code Thread.sleep}（見 AsyncConfig），測試時改用記錄等待時間的實作。
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
