package com.aiinpocket.adwatch.model.entity;

import com.aiinpocket.adwatch.model.enums.WatcherStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 監控器 Entity。
 * 一個監控器代表「依 cron 排程重複執行的搜尋」：查詢字串 + 價格區間 + 排程 + 通知目標。
 *
 * <p>執行紀錄欄位（lastRun / numberOfRuns / seenAdIds）只由執行週期透過
 * {@code WatcherRepository#updateRunResult} 原子更新；其餘欄位由 WatcherService 維護。
 */
@Entity
@Table(name = "watcher", indexes = {
        @Index(name = "idx_watcher_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Watcher {

    /** UUID 字串，建立時指定，之後不再變動 */
    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 200)
    private String query;

    /** cron 排程（5 欄位 Unix 格式或 6/7 欄位 Quartz 格式） */
    @Column(name = "cron_schedule", nullable = false, length = 100)
    private String schedule;

    /** 通知目標，空清單代表使用預設的 Discord Webhook */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "watcher_notification", joinColumns = @JoinColumn(name = "watcher_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<NotificationTarget> notifications = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private WatcherStatus status = WatcherStatus.ACTIVE;

    /** 最近一次完成執行週期的時間，從未執行為 null */
    @Column(name = "last_run")
    private Instant lastRun;

    /** 完成的執行週期次數（查詢失敗的週期不計） */
    @Column(name = "number_of_runs", nullable = false)
    @Builder.Default
    private int numberOfRuns = 0;

    @Column(name = "min_price", precision = 12, scale = 2)
    private BigDecimal minPrice;

    @Column(name = "max_price", precision = 12, scale = 2)
    private BigDecimal maxPrice;

    /** 已看過的廣告 ID（AdDeduplicator 編碼），null 代表尚未建立基準 */
    @Column(name = "seen_ad_ids", columnDefinition = "TEXT")
    private String seenAdIds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isActive() {
        return status == WatcherStatus.ACTIVE;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
