package com.aiinpocket.adwatch.model.dto;

import java.math.BigDecimal;

/**
 * 正規化後的單筆廣告。
 * 只在執行週期內使用，不會被持久化（去重只保留 ID）。
 *
 * @param id          廣告 ID
 * @param title       標題
 * @param price       價格數值，可能為 null（面議）
 * @param priceSuffix 價格後綴，例如 " kr"
 * @param url         廣告連結
 * @param imageUrl    第一張縮圖，可能為 null
 * @param description 內文
 */
public record Listing(
        String id,
        String title,
        BigDecimal price,
        String priceSuffix,
        String url,
        String imageUrl,
        String description
) {
    /** 價格顯示文字，例如 "4500 kr"；沒有價格時回傳 "-" */
    public String formattedPrice() {
        if (price == null) {
            return "-";
        }
        return price.stripTrailingZeros().toPlainString() + (priceSuffix != null ? priceSuffix : "");
    }
}
