package com.aiinpocket.adwatch.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

/** 建立 / 更新監控器的請求內容 */
public record WatcherRequest(
        @NotBlank @Size(max = 200) String query,
        @NotBlank String schedule,
        List<@Valid NotificationTargetDto> notifications,
        @JsonProperty("min_price") BigDecimal minPrice,
        @JsonProperty("max_price") BigDecimal maxPrice
) {}
