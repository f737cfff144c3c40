package com.aiinpocket.adwatch.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Blocket 搜尋 API 回應中用得到的欄位：
 * data[].ad_id, subject, body, price{value, suffix}, share_url, images[].url
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlocketSearchResponse(
        List<Ad> data
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ad(
            @JsonProperty("ad_id") String adId,
            String subject,
            String body,
            Price price,
            @JsonProperty("share_url") String shareUrl,
            List<Image> images
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Price(
            BigDecimal value,
            String suffix
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Image(
            String url
    ) {}
}
