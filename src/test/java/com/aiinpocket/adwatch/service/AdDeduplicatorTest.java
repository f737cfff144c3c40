package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.model.dto.AdMarker;
import com.aiinpocket.adwatch.model.dto.DedupResult;
import com.aiinpocket.adwatch.model.dto.Listing;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;

import static com.aiinpocket.adwatch.TestFixtures.listing;
import static com.aiinpocket.adwatch.TestFixtures.listings;
import static com.aiinpocket.adwatch.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;

class AdDeduplicatorTest {

    private final AdDeduplicator deduplicator = new AdDeduplicator(properties(), JsonMapper.builder().build());

    @Nested
    class Diff {

        @Test
        void shouldTreatFirstRunAsBaseline() {
            DedupResult result = deduplicator.diff(null, listings("a1", "a2"));

            assertThat(result.newListings()).isEmpty();
            assertThat(result.marker().adIds()).containsExactly("a1", "a2");
        }

        @Test
        void shouldReportOnlyUnseenListings() {
            AdMarker previous = AdMarker.of(List.of("a1", "a2"));

            DedupResult result = deduplicator.diff(previous, listings("a3", "a1", "a2"));

            assertThat(result.newListings()).extracting(Listing::id).containsExactly("a3");
            assertThat(result.marker().adIds()).containsExactly("a3", "a1", "a2");
        }

        @Test
        void shouldBeIdempotentForSameResult() {
            DedupResult first = deduplicator.diff(AdMarker.of(List.of("a1")), listings("a1", "a2"));

            DedupResult second = deduplicator.diff(first.marker(), listings("a1", "a2"));

            assertThat(first.newListings()).extracting(Listing::id).containsExactly("a2");
            assertThat(second.newListings()).isEmpty();
            assertThat(second.marker()).isEqualTo(first.marker());
        }

        @Test
        void shouldCollapseDuplicateIdsWithinOneResult() {
            DedupResult result = deduplicator.diff(AdMarker.of(List.of("a1")), listings("a2", "a2", "a1"));

            assertThat(result.newListings()).extracting(Listing::id).containsExactly("a2");
            assertThat(result.marker().adIds()).containsExactly("a2", "a1");
        }

        @Test
        void shouldKeepMarkerWhenResultIsEmpty() {
            AdMarker previous = AdMarker.of(List.of("a1", "a2"));

            DedupResult result = deduplicator.diff(previous, List.of());

            assertThat(result.newListings()).isEmpty();
            assertThat(result.marker()).isSameAs(previous);
        }

        @Test
        void shouldIgnoreListingsWithoutId() {
            DedupResult result = deduplicator.diff(AdMarker.of(List.of("a1")), List.of(listing(null), listing("a2")));

            assertThat(result.newListings()).extracting(Listing::id).containsExactly("a2");
        }

        @Test
        void shouldRetainListingThatDisappearsAndReturnsWithinCapacity() {
            DedupResult dropped = deduplicator.diff(AdMarker.of(List.of("a1", "a2")), listings("a2"));

            DedupResult back = deduplicator.diff(dropped.marker(), listings("a1", "a2"));

            assertThat(back.newListings()).isEmpty();
        }
    }

    @Nested
    class Capacity {

        private final AdDeduplicator small =
                new AdDeduplicator(properties(true, 5, 3, 3), JsonMapper.builder().build());

        @Test
        void shouldTrimOldestIdsBeyondCapacity() {
            AdMarker previous = AdMarker.of(List.of("p1", "p2", "p3", "p4"));

            DedupResult result = small.diff(previous, listings("c1", "c2"));

            assertThat(result.marker().adIds()).containsExactly("c1", "c2", "p1");
        }

        @Test
        void shouldNeverDropIdsOfCurrentResult() {
            DedupResult result = small.diff(AdMarker.of(List.of("p1")), listings("c1", "c2", "c3", "c4", "c5"));

            assertThat(result.marker().adIds()).containsExactly("c1", "c2", "c3", "c4", "c5");
            assertThat(result.newListings()).hasSize(5);
        }
    }

    @Nested
    class Persistence {

        @Test
        void shouldRestoreEncodedMarker() {
            AdMarker marker = AdMarker.of(List.of("a2", "a1"));

            AdMarker restored = deduplicator.decode(deduplicator.encode(marker));

            assertThat(restored).isEqualTo(marker);
        }

        @Test
        void shouldTreatMissingOrCorruptMarkerAsNoMarker() {
            assertThat(deduplicator.decode(null)).isNull();
            assertThat(deduplicator.decode("  ")).isNull();
            assertThat(deduplicator.decode("{not json")).isNull();
            assertThat(deduplicator.encode(null)).isNull();
        }
    }
}
