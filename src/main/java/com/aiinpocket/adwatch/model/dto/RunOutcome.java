package com.aiinpocket.adwatch.model.dto;

import com.aiinpocket.adwatch.model.enums.RunStatus;

import java.util.List;

/**
 * 單次執行週期的結果，不會被持久化，只折疊進監控器的執行紀錄。
 */
public record RunOutcome(
        String watcherId,
        RunStatus status,
        List<Listing> newListings,
        AdMarker marker,
        String reason
) {
    public static RunOutcome completed(String watcherId, List<Listing> newListings, AdMarker marker) {
        return new RunOutcome(watcherId, RunStatus.COMPLETED, newListings, marker, null);
    }

    public static RunOutcome failed(String watcherId, String reason) {
        return new RunOutcome(watcherId, RunStatus.FAILED, List.of(), null, reason);
    }

    public static RunOutcome skipped(String watcherId, String reason) {
        return new RunOutcome(watcherId, RunStatus.SKIPPED, List.of(), null, reason);
    }
}
