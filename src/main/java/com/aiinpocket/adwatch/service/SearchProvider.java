package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.SearchQuery;

import java.util.List;

/**
 * 市集搜尋 API。
 * 視為不透明、可能緩慢或不穩定的外部服務；失敗時直接拋出例外，由 ListingQueryService 統一包裝。
 */
public interface SearchProvider {

    List<Listing> search(SearchQuery query);
}
