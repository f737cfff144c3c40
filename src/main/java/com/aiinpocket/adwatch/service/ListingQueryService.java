package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.exception.SearchProviderException;
import com.aiinpocket.adwatch.exception.WatcherValidationException;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.SearchQuery;
import com.aiinpocket.adwatch.model.entity.Watcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * 查詢執行器。
 * 把監控器的查詢字串、價格區間與全域搜尋預設值合併後呼叫 {@link SearchProvider}。
 *
 * <p>搜尋失敗一律以 {@link SearchProviderException} 往上拋，是否重試由呼叫端決定；
 * 價格區間顛倒時在呼叫 API 之前就拋出 {@link WatcherValidationException}。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ListingQueryService {

    private final SearchProvider searchProvider;
    private final AdWatchProperties props;

    public List<Listing> execute(Watcher watcher) {
        validatePriceRange(watcher.getMinPrice(), watcher.getMaxPrice());
        SearchQuery query = buildQuery(watcher);

        List<Listing> listings;
        try {
            listings = searchProvider.search(query);
        } catch (SearchProviderException e) {
            throw e;
        } catch (Exception e) {
            throw new SearchProviderException("搜尋 API 呼叫失敗: " + e.getMessage(), e);
        }
        if (listings == null) {
            throw new SearchProviderException("搜尋 API 回傳空結果");
        }

        // API 不一定支援價格過濾，這裡再篩一次
        List<Listing> filtered = listings.stream()
                .filter(listing -> withinRange(listing.price(), watcher.getMinPrice(), watcher.getMaxPrice()))
                .toList();
        log.debug("[查詢] 監控器 {} 取得 {} 筆廣告，價格過濾後 {} 筆",
                watcher.getId(), listings.size(), filtered.size());
        return filtered;
    }

    SearchQuery buildQuery(Watcher watcher) {
        AdWatchProperties.SearchParams defaults = props.search();
        return new SearchQuery(
                watcher.getQuery().trim(),
                watcher.getMinPrice(),
                watcher.getMaxPrice(),
                defaults.limit(),
                defaults.sort(),
                defaults.listingType(),
                defaults.status(),
                defaults.geolocation(),
                defaults.include()
        );
    }

    /** 最低價高於最高價時拋出 WatcherValidationException */
    public static void validatePriceRange(BigDecimal minPrice, BigDecimal maxPrice) {
        if (minPrice != null && maxPrice != null && minPrice.compareTo(maxPrice) > 0) {
            throw new WatcherValidationException(
                    "最低價 " + minPrice.toPlainString() + " 不能高於最高價 " + maxPrice.toPlainString());
        }
    }

    private static boolean withinRange(BigDecimal price, BigDecimal minPrice, BigDecimal maxPrice) {
        if (price == null) {
            return minPrice == null && maxPrice == null;
        }
        if (minPrice != null && price.compareTo(minPrice) < 0) return false;
        if (maxPrice != null && price.compareTo(maxPrice) > 0) return false;
        return true;
    }
}
