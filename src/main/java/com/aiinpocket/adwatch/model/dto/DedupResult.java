package com.aiinpocket.adwatch.model.dto;

import java.util.List;

/**
 * @param newListings 這次才出現的廣告（維持查詢結果順序）
 * @param marker      更新後的去重標記，可能為 null（首次執行且結果為空）
 */
public record DedupResult(
        List<Listing> newListings,
        AdMarker marker
) {}
