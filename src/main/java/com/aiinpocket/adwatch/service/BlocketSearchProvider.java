package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.exception.SearchProviderException;
import com.aiinpocket.adwatch.model.dto.BlocketSearchResponse;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;

/**
 * Blocket 搜尋 API 實作。
 * 把合併後的查詢條件轉成 query string，回應解析成正規化的 {@link Listing}。
 * 網路錯誤、非 2xx、格式錯誤一律拋出 {@link SearchProviderException}，不在這裡重試。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlocketSearchProvider implements SearchProvider {

    private final RestClient searchRestClient;
    private final AdWatchProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public List<Listing> search(SearchQuery query) {
        String json;
        try {
            RestClient.RequestHeadersSpec<?> request = searchRestClient.get()
                    .uri(uriBuilder -> {
                        var builder = uriBuilder
                                .path(props.search().searchPath())
                                .queryParam("q", query.query())
                                .queryParam("lim", query.limit())
                                .queryParam("sort", query.sort())
                                .queryParam("st", query.listingType())
                                .queryParam("status", query.status())
                                .queryParam("gl", query.geolocation())
                                .queryParam("include", query.include());
                        if (query.minPrice() != null) builder.queryParam("price_min", query.minPrice().toPlainString());
                        if (query.maxPrice() != null) builder.queryParam("price_max", query.maxPrice().toPlainString());
                        return builder.build();
                    });
            String token = props.search().token();
            if (token != null && !token.isBlank()) {
                request = request.header("Authorization", "Bearer " + token);
            }
            json = request.retrieve().body(String.class);
        } catch (Exception e) {
            throw new SearchProviderException("Blocket 搜尋失敗: " + e.getMessage(), e);
        }

        List<Listing> listings = parseListings(json);
        log.debug("[搜尋] q='{}' 取回 {} 筆廣告", query.query(), listings.size());
        return listings;
    }

    List<Listing> parseListings(String json) {
        if (json == null || json.isBlank()) {
            throw new SearchProviderException("Blocket 回應為空");
        }
        BlocketSearchResponse response;
        try {
            response = objectMapper.readValue(json, BlocketSearchResponse.class);
        } catch (Exception e) {
            throw new SearchProviderException("Blocket 回應格式不正確", e);
        }
        if (response == null || response.data() == null) {
            throw new SearchProviderException("Blocket 回應缺少 data 欄位");
        }
        return response.data().stream()
                .filter(Objects::nonNull)
                .filter(ad -> ad.adId() != null)
                .map(this::toListing)
                .toList();
    }

    private Listing toListing(BlocketSearchResponse.Ad ad) {
        String imageUrl = ad.images() != null && !ad.images().isEmpty()
                ? ad.images().get(0).url()
                : null;
        return new Listing(
                ad.adId(),
                ad.subject(),
                ad.price() != null ? ad.price().value() : null,
                ad.price() != null ? ad.price().suffix() : null,
                ad.shareUrl(),
                imageUrl,
                ad.body()
        );
    }
}
