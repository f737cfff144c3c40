package com.aiinpocket.adwatch.service.notification;

import com.aiinpocket.adwatch.exception.DeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 指數退避 + 隨機抖動的重試器。
 *
 * <p>最多嘗試 maxRetries 次；第 i 次（從 0 起算）失敗後，等待
 * {@code retryDelay * 1.5^i * (0.9 + random * 0.2)} 再進行下一次，第一次之前不等待。
 * 全部失敗後拋出最後一次的 {@link DeliveryException}。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackoffRetrier {

    static final double MULTIPLIER = 1.5;

    private final Sleeper sleeper;

    /**
     * @param action     要執行的發送動作
     * @param maxRetries 最大嘗試次數（小於 1 時視為 1）
     * @param retryDelay 基礎等待時間
     * @param label      日誌用的描述
     * @throws DeliveryException    全部嘗試都失敗
     * @throws InterruptedException 等待期間被中斷
     */
    public void execute(Runnable action, int maxRetries, Duration retryDelay, String label)
            throws InterruptedException {
        int attempts = Math.max(1, maxRetries);
        DeliveryException lastError = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                action.run();
                return;
            } catch (Exception e) {
                lastError = e instanceof DeliveryException de
                        ? de
                        : new DeliveryException(e.getMessage(), e);
                log.warn("[重試] {} 第 {}/{} 次嘗試失敗: {}", label, attempt + 1, attempts, e.getMessage());

                if (attempt < attempts - 1) {
                    sleeper.sleep(backoffDelay(retryDelay, attempt, ThreadLocalRandom.current().nextDouble()));
                }
            }
        }

        throw lastError;
    }

    /**
     * 第 attempt 次失敗後的等待時間。
     *
     * @param random 0 ~ 1 之間的亂數，決定 ±10% 的抖動
     */
    static Duration backoffDelay(Duration retryDelay, int attempt, double random) {
        double millis = retryDelay.toMillis() * Math.pow(MULTIPLIER, attempt) * (0.9 + random * 0.2);
        return Duration.ofMillis(Math.round(millis));
    }
}
