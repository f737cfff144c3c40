package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.exception.SearchProviderException;
import com.aiinpocket.adwatch.model.dto.Listing;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.util.List;

import static com.aiinpocket.adwatch.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlocketSearchProviderTest {

    private final BlocketSearchProvider provider =
            new BlocketSearchProvider(RestClient.builder().build(), properties(), JsonMapper.builder().build());

    @Test
    void shouldNormalizeSearchResponse() {
        String json = """
                {
                  "data": [
                    {
                      "ad_id": "1001",
                      "subject": "Macbook Pro 14 M1",
                      "body": "Nästan ny",
                      "price": {"value": 12500, "suffix": " kr"},
                      "share_url": "https://www.blocket.se/annons/1001",
                      "images": [{"url": "https://img.test/1.jpg"}, {"url": "https://img.test/2.jpg"}],
                      "location": [{"name": "Stockholm"}]
                    },
                    {
                      "ad_id": "1002",
                      "subject": "Macbook Pro 14 M3",
                      "share_url": "https://www.blocket.se/annons/1002"
                    },
                    {
                      "subject": "saknar id"
                    }
                  ],
                  "total": 3
                }
                """;

        List<Listing> listings = provider.parseListings(json);

        assertThat(listings).hasSize(2);
        assertThat(listings.get(0)).isEqualTo(new Listing(
                "1001", "Macbook Pro 14 M1", new BigDecimal("12500"), " kr",
                "https://www.blocket.se/annons/1001", "https://img.test/1.jpg", "Nästan ny"));
        assertThat(listings.get(1).price()).isNull();
        assertThat(listings.get(1).imageUrl()).isNull();
        assertThat(listings.get(1).formattedPrice()).isEqualTo("-");
    }

    @Test
    void shouldReturnEmptyListForEmptyData() {
        assertThat(provider.parseListings("{\"data\": []}")).isEmpty();
    }

    @Test
    void shouldRejectMalformedResponses() {
        assertThatThrownBy(() -> provider.parseListings("{\"results\": []}"))
                .isInstanceOf(SearchProviderException.class);
        assertThatThrownBy(() -> provider.parseListings("<html>"))
                .isInstanceOf(SearchProviderException.class);
        assertThatThrownBy(() -> provider.parseListings(""))
                .isInstanceOf(SearchProviderException.class);
    }
}
