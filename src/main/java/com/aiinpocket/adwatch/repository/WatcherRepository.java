package com.aiinpocket.adwatch.repository;

import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.model.enums.WatcherStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * 監控器 Repository。
 */
public interface WatcherRepository extends JpaRepository<Watcher, String> {

    /** 啟動時載入所有需要排程的監控器 */
    List<Watcher> findByStatus(WatcherStatus status);

    List<Watcher> findAllByOrderByCreatedAtAsc();

    /**
     * 原子寫回一次執行週期的結果。
     * 只更新執行紀錄欄位，不會覆蓋同時間的暫停 / 改排程等編輯。
     *
     * @return 更新的筆數，0 代表監控器已被刪除
     */
    @Modifying
    @Transactional
    @Query("UPDATE Watcher w SET w.lastRun = :lastRun, w.numberOfRuns = w.numberOfRuns + 1, "
            + "w.seenAdIds = :seenAdIds, w.updatedAt = :lastRun WHERE w.id = :id")
    int updateRunResult(String id, Instant lastRun, String seenAdIds);
}
