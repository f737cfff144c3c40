package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.exception.SearchProviderException;
import com.aiinpocket.adwatch.exception.WatcherNotFoundException;
import com.aiinpocket.adwatch.exception.WatcherValidationException;
import com.aiinpocket.adwatch.model.dto.AdMarker;
import com.aiinpocket.adwatch.model.dto.DedupResult;
import com.aiinpocket.adwatch.model.dto.DeliveryReport;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.RunOutcome;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.repository.WatcherRepository;
import com.aiinpocket.adwatch.service.notification.NotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 監控器執行週期。
 * 每次排程觸發時對單一監控器執行：查詢 → 去重 → 通知 → 寫回執行紀錄。
 *
 * <p>失敗語意：
 * <ul>
 *   <li>查詢失敗：記錄後中止，不增加執行次數、不更新 lastRun 與去重標記，等待下次排程</li>
 *   <li>通知失敗：每個目標各自隔離，只記錄日誌，不影響其他目標，也不阻擋執行紀錄寫回</li>
 *   <li>寫回時監控器已被刪除：捨棄本次結果</li>
 * </ul>
 * 同一個監控器同時間只會有一個執行週期，重疊的觸發直接略過。
 */
@Service
@Slf4j
public class WatcherRunService {

    private final WatcherRepository watcherRepo;
    private final ListingQueryService queryService;
    private final AdDeduplicator deduplicator;
    private final NotificationDispatcher dispatcher;
    private final WatcherLockService lockService;
    private final AdWatchProperties props;
    private final TaskExecutor notificationExecutor;

    /** 正在執行中的監控器 ID */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * 建構子注入。
     * 使用 @Qualifier 指定通知專用的執行緒池，多個通知目標在該池中平行發送。
     */
    public WatcherRunService(
            WatcherRepository watcherRepo,
            ListingQueryService queryService,
            AdDeduplicator deduplicator,
            NotificationDispatcher dispatcher,
            WatcherLockService lockService,
            AdWatchProperties props,
            @Qualifier("notificationExecutor") TaskExecutor notificationExecutor) {
        this.watcherRepo = watcherRepo;
        this.queryService = queryService;
        this.deduplicator = deduplicator;
        this.dispatcher = dispatcher;
        this.lockService = lockService;
        this.props = props;
        this.notificationExecutor = notificationExecutor;
    }

    /**
     * 執行一次完整週期。此方法不拋出例外，結果以 {@link RunOutcome} 回傳。
     *
     * @param watcherId 監控器 ID
     */
    public RunOutcome runCycle(String watcherId) {
        if (!inFlight.add(watcherId)) {
            log.info("[執行] 監控器 {} 上一次執行尚未結束，略過本次觸發", watcherId);
            return RunOutcome.skipped(watcherId, "上一次執行尚未結束");
        }
        try {
            return doRun(watcherId);
        } catch (Exception e) {
            log.error("[執行] 監控器 {} 執行週期發生未預期錯誤", watcherId, e);
            return RunOutcome.failed(watcherId, e.getMessage());
        } finally {
            inFlight.remove(watcherId);
        }
    }

    public boolean isRunning(String watcherId) {
        return inFlight.contains(watcherId);
    }

    private RunOutcome doRun(String watcherId) {
        Optional<Watcher> found = watcherRepo.findById(watcherId);
        if (found.isEmpty()) {
            log.warn("[執行] 監控器 {} 不存在，略過", watcherId);
            return RunOutcome.failed(watcherId, "監控器不存在");
        }
        Watcher watcher = found.get();
        SearchState startState = SearchState.of(watcher);
        if (!watcher.isActive()) {
            log.debug("[執行] 監控器 {} 已停止，略過", watcherId);
            return RunOutcome.skipped(watcherId, "監控器已停止");
        }

        List<Listing> listings;
        try {
            listings = queryService.execute(watcher);
        } catch (SearchProviderException e) {
            log.warn("[執行] 監控器 {} ('{}') 查詢失敗，等待下次排程: {}",
                    watcherId, watcher.getQuery(), e.getMessage());
            return RunOutcome.failed(watcherId, e.getMessage());
        } catch (WatcherValidationException e) {
            log.error("[執行] 監控器 {} 查詢參數不合法: {}", watcherId, e.getMessage());
            return RunOutcome.failed(watcherId, e.getMessage());
        }

        AdMarker previous = deduplicator.decode(watcher.getSeenAdIds());
        DedupResult result = deduplicator.diff(previous, listings);
        List<Listing> newListings = result.newListings();

        if (!newListings.isEmpty()) {
            log.info("[執行] 監控器 {} ('{}') 發現 {} 筆新廣告", watcherId, watcher.getQuery(), newListings.size());
            notifyTargets(watcher, newListings);
        } else {
            log.debug("[執行] 監控器 {} 沒有新廣告（本次 {} 筆）", watcherId, listings.size());
        }

        recordRun(watcherId, startState, result.marker());
        return RunOutcome.completed(watcherId, newListings, result.marker());
    }

    /** 所有通知目標平行發送，全部結束後才返回 */
    private void notifyTargets(Watcher watcher, List<Listing> newListings) {
        List<NotificationTarget> targets = resolveTargets(watcher);
        if (targets.isEmpty()) {
            log.warn("[執行] 監控器 {} 沒有通知目標，也未設定預設 Discord Webhook", watcher.getId());
            return;
        }

        List<CompletableFuture<DeliveryReport>> futures = targets.stream()
                .map(target -> CompletableFuture
                        .supplyAsync(() -> dispatcher.dispatch(target, newListings), notificationExecutor)
                        .exceptionally(e -> {
                            log.error("[執行] 監控器 {} 的 {} 通知發生錯誤", watcher.getId(), target.getKind(), e);
                            return DeliveryReport.failed(target.getKind(), 1);
                        }))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        for (CompletableFuture<DeliveryReport> future : futures) {
            DeliveryReport report = future.join();
            if (report.skipped()) {
                log.debug("[執行] 監控器 {} 的 {} 通知未啟用", watcher.getId(), report.kind());
            } else if (!report.isFullyDelivered()) {
                log.warn("[執行] 監控器 {} 的 {} 通知部分失敗: 成功 {} 則，失敗 {} 則",
                        watcher.getId(), report.kind(), report.messagesSent(), report.messagesFailed());
            }
        }
    }

    private List<NotificationTarget> resolveTargets(Watcher watcher) {
        if (watcher.getNotifications() != null && !watcher.getNotifications().isEmpty()) {
            return List.copyOf(watcher.getNotifications());
        }
        String defaultWebhook = props.notification().discord().webhookUrl();
        if (defaultWebhook == null || defaultWebhook.isBlank()) {
            return List.of();
        }
        return List.of(NotificationTarget.discord(defaultWebhook));
    }

    /**
     * 寫回執行紀錄，與暫停、刪除等編輯共用同一把監控器鎖。
     * 鎖內重新讀取監控器；查詢條件或去重標記在執行期間被修改過時，保留目前的標記，只更新執行次數與時間。
     */
    private void recordRun(String watcherId, SearchState startState, AdMarker marker) {
        String encoded = deduplicator.encode(marker);
        try {
            lockService.withLock(watcherId, () -> {
                Watcher current = watcherRepo.findById(watcherId)
                        .orElseThrow(() -> new WatcherNotFoundException(watcherId));
                String seenAdIds = encoded;
                if (!startState.matches(current)) {
                    log.info("[執行] 監控器 {} 的查詢條件在執行期間已變更，捨棄本次去重標記", watcherId);
                    seenAdIds = current.getSeenAdIds();
                }
                int updated = watcherRepo.updateRunResult(watcherId, Instant.now(), seenAdIds);
                if (updated == 0) {
                    throw new WatcherNotFoundException(watcherId);
                }
            });
        } catch (WatcherNotFoundException e) {
            log.warn("[執行] 監控器 {} 已在執行期間被刪除，捨棄本次執行結果", watcherId);
        }
    }

    /** 執行週期開始時的查詢條件與去重標記 */
    private record SearchState(String query, BigDecimal minPrice, BigDecimal maxPrice, String seenAdIds) {

        static SearchState of(Watcher watcher) {
            return new SearchState(watcher.getQuery(), watcher.getMinPrice(), watcher.getMaxPrice(),
                    watcher.getSeenAdIds());
        }

        boolean matches(Watcher current) {
            return Objects.equals(query, current.getQuery())
                    && samePrice(minPrice, current.getMinPrice())
                    && samePrice(maxPrice, current.getMaxPrice())
                    && Objects.equals(seenAdIds, current.getSeenAdIds());
        }

        private static boolean samePrice(BigDecimal a, BigDecimal b) {
            if (a == null || b == null) {
                return a == b;
            }
            return a.compareTo(b) == 0;
        }
    }
}
