package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.model.dto.AdMarker;
import com.aiinpocket.adwatch.model.dto.DedupResult;
import com.aiinpocket.adwatch.model.dto.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 廣告去重器。
 * 比對監控器上一次的去重標記與本次查詢結果，找出新出現的廣告。
 *
 * <p>規則：
 * <ul>
 *   <li>同一次結果內重複的 ID 先合併（保留第一筆）</li>
 *   <li>本次結果為空：沒有新廣告，標記原樣返回</li>
 *   <li>沒有舊標記（首次執行）：全部視為基準，不通知</li>
 *   <li>新標記 = 本次 ID + 舊標記中未出現在本次的 ID，截斷到 markerCapacity，
 *       但本次的 ID 一定全部保留</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdDeduplicator {

    private final AdWatchProperties props;
    private final ObjectMapper objectMapper;

    public DedupResult diff(AdMarker previous, List<Listing> current) {
        Map<String, Listing> distinct = new LinkedHashMap<>();
        for (Listing listing : current) {
            if (listing.id() != null) {
                distinct.putIfAbsent(listing.id(), listing);
            }
        }

        if (distinct.isEmpty()) {
            return new DedupResult(List.of(), previous);
        }

        if (previous == null) {
            log.debug("[去重] 首次執行，{} 筆廣告作為基準", distinct.size());
            return new DedupResult(List.of(), AdMarker.of(new ArrayList<>(distinct.keySet())));
        }

        Set<String> seen = previous.asSet();
        List<Listing> newListings = distinct.values().stream()
                .filter(listing -> !seen.contains(listing.id()))
                .toList();

        return new DedupResult(newListings, merge(distinct.keySet(), previous));
    }

    private AdMarker merge(Set<String> currentIds, AdMarker previous) {
        int capacity = Math.max(props.dedup().markerCapacity(), currentIds.size());
        Set<String> merged = new LinkedHashSet<>(currentIds);
        for (String id : previous.adIds()) {
            if (merged.size() >= capacity) {
                break;
            }
            merged.add(id);
        }
        return AdMarker.of(new ArrayList<>(merged));
    }

    /**
     * 解析資料庫中的標記欄位。
     * 欄位損毀時回傳 null，下一次執行會重新建立基準而不是通知全部廣告。
     */
    public AdMarker decode(String stored) {
        if (stored == null || stored.isBlank()) {
            return null;
        }
        try {
            List<String> ids = objectMapper.readValue(stored, new TypeReference<List<String>>() {});
            return ids != null ? AdMarker.of(ids) : null;
        } catch (Exception e) {
            log.warn("[去重] 標記欄位無法解析，將重新建立基準: {}", e.getMessage());
            return null;
        }
    }

    public String encode(AdMarker marker) {
        if (marker == null) {
            return null;
        }
        return objectMapper.writeValueAsString(marker.adIds());
    }
}
