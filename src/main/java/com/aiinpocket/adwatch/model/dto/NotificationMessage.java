package com.aiinpocket.adwatch.model.dto;

import java.util.List;

/**
 * 一則要發送出去的通知訊息（一個批次或單筆廣告）。
 *
 * @param listings   本訊息包含的廣告
 * @param totalCount 本次分發的新廣告總數
 * @param index      第幾則訊息（從 1 開始）
 * @param count      本次分發共幾則訊息
 * @param batched    是否為批次訊息（批次訊息帶有總數標題列）
 */
public record NotificationMessage(
        List<Listing> listings,
        int totalCount,
        int index,
        int count,
        boolean batched
) {}
