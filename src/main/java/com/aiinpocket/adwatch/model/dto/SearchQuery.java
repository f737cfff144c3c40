package com.aiinpocket.adwatch.model.dto;

import java.math.BigDecimal;

/**
 * 送給搜尋 API 的完整查詢：監控器自己的條件 + 全域預設值。
 */
public record SearchQuery(
        String query,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        int limit,
        String sort,
        String listingType,
        String status,
        int geolocation,
        String include
) {}
