package com.aiinpocket.adwatch.service.notification;

import com.aiinpocket.adwatch.model.dto.NotificationMessage;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.enums.ChannelType;

/**
 * 通知發送器介面（Strategy Pattern）。
 * 每種通知管道各有一個實作，由 NotificationDispatcher 依 {@link ChannelType} 路由。
 *
 * <p>實作只負責「送出一則訊息」；分批、節流、重試都由 Dispatcher 處理。
 */
public interface NotificationSender {

    /** 此發送器對應的管道類型 */
    ChannelType getType();

    /**
     * 此目標目前是否能發送（功能旗標、必要設定是否齊全）。
     * 回傳 false 時 Dispatcher 只記錄意圖，不會呼叫 {@link #send}。
     */
    boolean isEnabled(NotificationTarget target);

    /**
     * 發送一則訊息。
     *
     * @throws com.aiinpocket.adwatch.exception.DeliveryException 發送失敗（可重試）
     */
    void send(NotificationTarget target, NotificationMessage message);

    /** 單則訊息最多能帶幾筆廣告，批次大小超過時由 Dispatcher 切得更細 */
    default int maxListingsPerMessage() {
        return Integer.MAX_VALUE;
    }
}
