package com.aiinpocket.adwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 監控器全域設定（adwatch.*）。
 * 啟動時綁定一次，由建構子注入到排程、查詢與通知元件，不存在任何全域靜態狀態。
 */
@ConfigurationProperties(prefix = "adwatch")
public record AdWatchProperties(
        @DefaultValue SearchParams search,
        @DefaultValue DedupParams dedup,
        @DefaultValue NotificationParams notification,
        @DefaultValue SchedulerParams scheduler
) {
    /**
     * 搜尋預設值，會與每個監控器自己的查詢字串和價格區間合併。
     *
     * @param baseUrl     Blocket API 位址
     * @param searchPath  搜尋端點路徑
     * @param token       Bearer Token（選填）
     * @param limit       每次查詢最多取回幾筆
     * @param sort        排序方式（rel = 相關度）
     * @param listingType 刊登類型（s = 出售）
     * @param status      刊登狀態過濾
     * @param geolocation 地理範圍
     * @param include     額外包含的資料（運費等）
     */
    public record SearchParams(
            @DefaultValue("https://api.blocket.se") String baseUrl,
            @DefaultValue("/search_bff/v2/content") String searchPath,
            String token,
            @DefaultValue("60") int limit,
            @DefaultValue("rel") String sort,
            @DefaultValue("s") String listingType,
            @DefaultValue("active") String status,
            @DefaultValue("3") int geolocation,
            @DefaultValue("extend_with_shipping") String include
    ) {}

    /** markerCapacity：已看過廣告 ID 最多保留幾筆 */
    public record DedupParams(
            @DefaultValue("200") int markerCapacity
    ) {}

    public record NotificationParams(
            @DefaultValue DiscordParams discord,
            @DefaultValue EmailParams email,
            @DefaultValue BatchParams batching,
            @DefaultValue("3") int maxRetries,
            @DefaultValue("1s") Duration retryDelay,
            @DefaultValue("2s") Duration batchDelay,
            @DefaultValue("500ms") Duration messageDelay
    ) {}

    /** webhookUrl 為未設定通知目標的監控器所使用的預設頻道 */
    public record DiscordParams(
            @DefaultValue("true") boolean enabled,
            String webhookUrl,
            @DefaultValue("Blocket Bot") String username,
            String avatarUrl
    ) {}

    public record EmailParams(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("adwatch@localhost") String from
    ) {}

    public record BatchParams(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("5") int size
    ) {}

    /**
     * @param zone               cron 運算使用的時區
     * @param seedDefaultWatcher 資料庫為空時是否建立預設監控器
     * @param defaultQuery       預設監控器的查詢字串
     * @param defaultSchedule    預設監控器的排程
     */
    public record SchedulerParams(
            @DefaultValue("Europe/Stockholm") String zone,
            @DefaultValue("true") boolean seedDefaultWatcher,
            @DefaultValue("Macbook Pro 14") String defaultQuery,
            @DefaultValue("*/5 * * * *") String defaultSchedule
    ) {}
}
