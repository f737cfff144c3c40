package com.aiinpocket.adwatch.model.dto;

import java.util.List;
import java.util.Set;

/**
 * 去重標記：已看過的廣告 ID，依新到舊排列。
 * 內容格式只有 AdDeduplicator 需要知道。
 */
public record AdMarker(List<String> adIds) {

    public AdMarker {
        adIds = List.copyOf(adIds);
    }

    public static AdMarker of(List<String> adIds) {
        return new AdMarker(adIds);
    }

    public Set<String> asSet() {
        return Set.copyOf(adIds);
    }
}
