package com.aiinpocket.adwatch;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.model.enums.WatcherStatus;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TestFixtures {

    public static final String WEBHOOK_URL = "https://discord.test/api/webhooks/1/abc";

    private TestFixtures() {
    }

    public static AdWatchProperties properties() {
        return properties(true, 5, 3, 200);
    }

    public static AdWatchProperties properties(boolean batching, int batchSize, int maxRetries, int markerCapacity) {
        return new AdWatchProperties(
                new AdWatchProperties.SearchParams(
                        "https://api.blocket.test", "/search_bff/v2/content", null,
                        60, "rel", "s", "active", 3, "extend_with_shipping"),
                new AdWatchProperties.DedupParams(markerCapacity),
                new AdWatchProperties.NotificationParams(
                        new AdWatchProperties.DiscordParams(true, WEBHOOK_URL, "Blocket Bot", null),
                        new AdWatchProperties.EmailParams(false, "adwatch@localhost"),
                        new AdWatchProperties.BatchParams(batching, batchSize),
                        maxRetries,
                        Duration.ofMillis(10),
                        Duration.ofMillis(20),
                        Duration.ofMillis(5)),
                new AdWatchProperties.SchedulerParams("Europe/Stockholm", true, "Macbook Pro 14", "*/5 * * * *"));
    }

    public static Listing listing(String id) {
        return listing(id, new BigDecimal("4500"));
    }

    public static Listing listing(String id, BigDecimal price) {
        return new Listing(id, "Macbook Pro 14 " + id, price, " kr",
                "https://www.blocket.se/annons/" + id, "https://img.test/" + id + ".jpg",
                "Säljer min dator, " + id);
    }

    public static List<Listing> listings(String... ids) {
        List<Listing> result = new ArrayList<>();
        for (String id : ids) {
            result.add(listing(id));
        }
        return result;
    }

    public static Watcher watcher(String id) {
        return Watcher.builder()
                .id(id)
                .query("Macbook Pro 14")
                .schedule("*/5 * * * *")
                .notifications(new ArrayList<>(List.of(NotificationTarget.discord(WEBHOOK_URL))))
                .status(WatcherStatus.ACTIVE)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
    }
}
