package com.aiinpocket.adwatch.model.entity;

import com.aiinpocket.adwatch.model.enums.ChannelType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 監控器的通知目標。
 * 以 Embeddable 形式附屬於 Watcher，沒有獨立的生命週期，也不會被多個監控器共用。
 *
 * <ul>
 *   <li>DISCORD：webhookUrl 必填</li>
 *   <li>EMAIL：email 必填</li>
 * </ul>
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString(exclude = "webhookUrl")
public class NotificationTarget {

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private ChannelType kind;

    @Column(name = "webhook_url", length = 500)
    private String webhookUrl;

    @Column(name = "email", length = 254)
    private String email;

    public static NotificationTarget discord(String webhookUrl) {
        return new NotificationTarget(ChannelType.DISCORD, webhookUrl, null);
    }

    public static NotificationTarget email(String email) {
        return new NotificationTarget(ChannelType.EMAIL, null, email);
    }
}
