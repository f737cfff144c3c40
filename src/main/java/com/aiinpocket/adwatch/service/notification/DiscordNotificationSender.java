package com.aiinpocket.adwatch.service.notification;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.exception.DeliveryException;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.NotificationMessage;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.enums.ChannelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discord 通知發送器。
 * 透過 Webhook 發送 Embed 訊息，每則訊息最多 10 個 Embed（Discord 上限）。
 *
 * <p>Payload 格式：
 * <pre>
 * {username, avatar_url, content?, embeds: [{title, url, description,
 *   fields: [{name: "Price", value, inline: true}], thumbnail: {url}?, timestamp}]}
 * </pre>
 * 批次訊息另外帶有 content 標題列，說明這次共找到幾筆新廣告。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscordNotificationSender implements NotificationSender {

    static final int MAX_EMBEDS = 10;
    static final int MAX_DESCRIPTION = 200;
    private static final String DEFAULT_USERNAME = "Blocket Bot";

    /** 共用的通用 RestClient Bean（由 RestClientConfig 提供） */
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AdWatchProperties props;

    @Override
    public ChannelType getType() {
        return ChannelType.DISCORD;
    }

    @Override
    public int maxListingsPerMessage() {
        return MAX_EMBEDS;
    }

    @Override
    public boolean isEnabled(NotificationTarget target) {
        return props.notification().discord().enabled()
                && target.getWebhookUrl() != null
                && !target.getWebhookUrl().isBlank();
    }

    @Override
    public void send(NotificationTarget target, NotificationMessage message) {
        String body = objectMapper.writeValueAsString(buildPayload(message));
        try {
            restClient.post()
                    .uri(target.getWebhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (Exception e) {
            throw new DeliveryException("Discord Webhook 發送失敗: " + e.getMessage(), e);
        }
        log.debug("[通知-Discord] 第 {}/{} 則訊息已發送（{} 筆廣告）",
                message.index(), message.count(), message.listings().size());
    }

    Map<String, Object> buildPayload(NotificationMessage message) {
        List<Listing> listings = message.listings();
        AdWatchProperties.DiscordParams discord = props.notification().discord();

        String username = discord.username() != null && !discord.username().isBlank()
                ? discord.username()
                : DEFAULT_USERNAME;
        String avatarUrl = discord.avatarUrl() != null && !discord.avatarUrl().isBlank()
                ? discord.avatarUrl()
                : listings.isEmpty() ? null : listings.get(0).imageUrl();

        String timestamp = Instant.now().toString();
        List<Map<String, Object>> embeds = listings.stream()
                .limit(MAX_EMBEDS)
                .map(listing -> toEmbed(listing, timestamp))
                .toList();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("username", username);
        if (avatarUrl != null) {
            payload.put("avatar_url", avatarUrl);
        }
        if (message.batched()) {
            payload.put("content", header(message));
        }
        payload.put("embeds", embeds);
        return payload;
    }

    private static String header(NotificationMessage message) {
        String header = "Found " + message.totalCount() + " new listings!";
        return message.count() > 1
                ? header + " (" + message.index() + "/" + message.count() + ")"
                : header;
    }

    private static Map<String, Object> toEmbed(Listing listing, String timestamp) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", listing.title());
        embed.put("url", listing.url());
        embed.put("description", truncate(listing.description()));
        embed.put("fields", List.of(Map.of(
                "name", "Price",
                "value", listing.formattedPrice(),
                "inline", true
        )));
        if (listing.imageUrl() != null) {
            embed.put("thumbnail", Map.of("url", listing.imageUrl()));
        }
        embed.put("timestamp", timestamp);
        return embed;
    }

    static String truncate(String description) {
        if (description == null) {
            return "";
        }
        return description.length() > MAX_DESCRIPTION
                ? description.substring(0, MAX_DESCRIPTION) + "..."
                : description;
    }
}
