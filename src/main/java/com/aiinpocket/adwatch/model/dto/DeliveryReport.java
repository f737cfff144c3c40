package com.aiinpocket.adwatch.model.dto;

import com.aiinpocket.adwatch.model.enums.ChannelType;

/**
 * 單一通知目標的發送結果，由執行週期檢視並記錄。
 *
 * @param kind           通知管道類型
 * @param messagesSent   成功送出的訊息數
 * @param messagesFailed 重試用盡仍失敗的訊息數
 * @param skipped        管道停用或無對應發送器而未發送
 */
public record DeliveryReport(
        ChannelType kind,
        int messagesSent,
        int messagesFailed,
        boolean skipped
) {
    public static DeliveryReport skipped(ChannelType kind) {
        return new DeliveryReport(kind, 0, 0, true);
    }

    public static DeliveryReport empty(ChannelType kind) {
        return new DeliveryReport(kind, 0, 0, false);
    }

    public static DeliveryReport failed(ChannelType kind, int messages) {
        return new DeliveryReport(kind, 0, messages, false);
    }

    public boolean isFullyDelivered() {
        return !skipped && messagesFailed == 0;
    }
}
