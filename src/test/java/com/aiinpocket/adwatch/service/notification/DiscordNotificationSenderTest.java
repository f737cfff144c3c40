package com.aiinpocket.adwatch.service.notification;

import com.aiinpocket.adwatch.exception.DeliveryException;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.NotificationMessage;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.aiinpocket.adwatch.TestFixtures.WEBHOOK_URL;
import static com.aiinpocket.adwatch.TestFixtures.listing;
import static com.aiinpocket.adwatch.TestFixtures.listings;
import static com.aiinpocket.adwatch.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;

class DiscordNotificationSenderTest {

    private MockRestServiceServer server;
    private DiscordNotificationSender sender;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        sender = new DiscordNotificationSender(builder.build(), JsonMapper.builder().build(), properties());
    }

    @Nested
    class Payload {

        @Test
        @SuppressWarnings("unchecked")
        void shouldBuildBatchPayloadWithHeader() {
            List<Listing> batch = listings("a1", "a2", "a3", "a4", "a5");

            Map<String, Object> payload = sender.buildPayload(new NotificationMessage(batch, 12, 1, 3, true));

            assertThat(payload).containsEntry("username", "Blocket Bot")
                    .containsEntry("avatar_url", "https://img.test/a1.jpg")
                    .containsEntry("content", "Found 12 new listings! (1/3)");
            List<Map<String, Object>> embeds = (List<Map<String, Object>>) payload.get("embeds");
            assertThat(embeds).hasSize(5);
            assertThat(embeds.get(0))
                    .containsEntry("title", "Macbook Pro 14 a1")
                    .containsEntry("url", "https://www.blocket.se/annons/a1")
                    .containsEntry("thumbnail", Map.of("url", "https://img.test/a1.jpg"))
                    .containsKey("timestamp");
            assertThat(embeds.get(0).get("fields"))
                    .isEqualTo(List.of(Map.of("name", "Price", "value", "4500 kr", "inline", true)));
        }

        @Test
        void shouldOmitPageSuffixForSingleBatch() {
            Map<String, Object> payload = sender.buildPayload(
                    new NotificationMessage(listings("a1", "a2"), 2, 1, 1, true));

            assertThat(payload).containsEntry("content", "Found 2 new listings!");
        }

        @Test
        void shouldOmitContentForIndividualMessage() {
            Map<String, Object> payload = sender.buildPayload(
                    new NotificationMessage(listings("a1"), 3, 1, 3, false));

            assertThat(payload).doesNotContainKey("content");
        }

        @Test
        void shouldCapEmbedsAtDiscordLimit() {
            List<Listing> batch = listings("a1", "a2", "a3", "a4", "a5", "a6", "a7", "a8", "a9", "a10", "a11", "a12");

            Map<String, Object> payload = sender.buildPayload(new NotificationMessage(batch, 12, 1, 1, true));

            assertThat((List<?>) payload.get("embeds")).hasSize(DiscordNotificationSender.MAX_EMBEDS);
            assertThat(sender.maxListingsPerMessage()).isEqualTo(DiscordNotificationSender.MAX_EMBEDS);
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldRenderListingWithoutPriceOrImage() {
            Listing bare = new Listing("b1", "Bytes", null, null, "https://www.blocket.se/annons/b1", null, null);

            Map<String, Object> payload = sender.buildPayload(new NotificationMessage(List.of(bare), 1, 1, 1, false));

            assertThat(payload).doesNotContainKey("avatar_url");
            Map<String, Object> embed = ((List<Map<String, Object>>) payload.get("embeds")).get(0);
            assertThat(embed).doesNotContainKey("thumbnail").containsEntry("description", "");
            assertThat(embed.get("fields")).isEqualTo(List.of(Map.of("name", "Price", "value", "-", "inline", true)));
        }

        @Test
        void shouldTruncateLongDescriptions() {
            String longText = "x".repeat(250);

            assertThat(DiscordNotificationSender.truncate(longText)).hasSize(203).endsWith("...");
            assertThat(DiscordNotificationSender.truncate("short")).isEqualTo("short");
            assertThat(DiscordNotificationSender.truncate(null)).isEmpty();
        }

        @Test
        void shouldFormatDecimalPrice() {
            assertThat(listing("a1", new BigDecimal("4500.00")).formattedPrice()).isEqualTo("4500 kr");
        }
    }

    @Nested
    class Send {

        @Test
        void shouldPostPayloadToWebhook() {
            server.expect(requestTo(WEBHOOK_URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.username").value("Blocket Bot"))
                    .andExpect(jsonPath("$.embeds.length()").value(2))
                    .andRespond(withNoContent());

            sender.send(NotificationTarget.discord(WEBHOOK_URL),
                    new NotificationMessage(listings("a1", "a2"), 2, 1, 1, true));

            server.verify();
        }

        @Test
        void shouldWrapHttpErrorAsDeliveryException() {
            server.expect(requestTo(WEBHOOK_URL)).andRespond(withServerError());

            assertThatThrownBy(() -> sender.send(NotificationTarget.discord(WEBHOOK_URL),
                    new NotificationMessage(listings("a1"), 1, 1, 1, false)))
                    .isInstanceOf(DeliveryException.class);
        }

        @Test
        void shouldRequireWebhookUrl() {
            assertThat(sender.isEnabled(NotificationTarget.discord(" "))).isFalse();
            assertThat(sender.isEnabled(NotificationTarget.discord(WEBHOOK_URL))).isTrue();
        }
    }
}
