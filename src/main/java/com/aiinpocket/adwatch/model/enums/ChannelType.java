package com.aiinpocket.adwatch.model.enums;

/**
 * 通知管道類型。
 * 每種類型對應一個 NotificationSender 實作。
 */
public enum ChannelType {

    /** Discord：透過 Webhook URL 發送 Embed 訊息 */
    DISCORD,

    /** Email：功能旗標控制，預設關閉 */
    EMAIL
}
