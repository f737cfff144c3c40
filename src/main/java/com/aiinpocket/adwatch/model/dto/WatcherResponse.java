package com.aiinpocket.adwatch.model.dto;

import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.model.enums.WatcherStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 監控器的 API 回應格式（snake_case 欄位，與管理介面一致）。
 * 去重標記屬於內部狀態，不對外輸出。
 */
public record WatcherResponse(
        String id,
        String query,
        String schedule,
        List<NotificationTargetDto> notifications,
        WatcherStatus status,
        @JsonProperty("last_run") Instant lastRun,
        @JsonProperty("number_of_runs") int numberOfRuns,
        @JsonProperty("min_price") BigDecimal minPrice,
        @JsonProperty("max_price") BigDecimal maxPrice,
        @JsonProperty("next_run") Instant nextRun,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public static WatcherResponse from(Watcher watcher, Instant nextRun) {
        return new WatcherResponse(
                watcher.getId(),
                watcher.getQuery(),
                watcher.getSchedule(),
                watcher.getNotifications().stream().map(NotificationTargetDto::from).toList(),
                watcher.getStatus(),
                watcher.getLastRun(),
                watcher.getNumberOfRuns(),
                watcher.getMinPrice(),
                watcher.getMaxPrice(),
                nextRun,
                watcher.getCreatedAt(),
                watcher.getUpdatedAt()
        );
    }
}
