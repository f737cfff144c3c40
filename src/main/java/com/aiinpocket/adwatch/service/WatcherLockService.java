package com.aiinpocket.adwatch.service;

import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 監控器層級的互斥鎖。
 * 所有會寫入同一個監控器紀錄的操作（暫停、改排程、刪除、執行週期寫回結果）
 * 都必須經過這裡，確保同一個 ID 的讀取-修改-寫入不會交錯。
 *
 * <p>使用固定數量的條帶鎖（striped lock），依 ID 的 hash 分配，不隨監控器數量成長。
 * 只保護單一節點內的並行，不處理多節點協調。
 */
@Service
public class WatcherLockService {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public WatcherLockService() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * 在監控器鎖保護下執行任務並回傳結果。
     *
     * @param watcherId 監控器 ID
     * @param task      要執行的任務
     */
    public <T> T withLock(String watcherId, Supplier<T> task) {
        ReentrantLock lock = lockFor(watcherId);
        lock.lock();
        try {
            return task.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String watcherId, Runnable task) {
        withLock(watcherId, () -> {
            task.run();
            return null;
        });
    }

    private ReentrantLock lockFor(String watcherId) {
        return locks[Math.floorMod(watcherId.hashCode(), STRIPES)];
    }
}
