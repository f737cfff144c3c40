package com.aiinpocket.adwatch.service.notification;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.exception.DeliveryException;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.NotificationMessage;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.enums.ChannelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Email 通知發送器（功能旗標，預設關閉）。
 * 使用系統的 SMTP 設定（spring.mail）發送純文字郵件。
 *
 * <p>旗標關閉，或系統未配置 SMTP（JavaMailSender Bean 不存在）時，
 * {@link #isEnabled} 回傳 false，Dispatcher 只會記錄本來要發送的內容。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailNotificationSender implements NotificationSender {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final AdWatchProperties props;

    @Override
    public ChannelType getType() {
        return ChannelType.EMAIL;
    }

    @Override
    public boolean isEnabled(NotificationTarget target) {
        return props.notification().email().enabled()
                && target.getEmail() != null
                && !target.getEmail().isBlank()
                && mailSender.getIfAvailable() != null;
    }

    @Override
    public void send(NotificationTarget target, NotificationMessage message) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new DeliveryException("未配置 SMTP，無法發送郵件");
        }

        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(props.notification().email().from());
        mail.setTo(target.getEmail());
        mail.setSubject(String.format("[AdWatch] %d new listings", message.totalCount()));
        mail.setText(toText(message));

        try {
            sender.send(mail);
        } catch (Exception e) {
            throw new DeliveryException("郵件發送失敗: " + e.getMessage(), e);
        }
        log.info("[通知-Email] 郵件已發送至 {}（{} 筆廣告）", target.getEmail(), message.listings().size());
    }

    static String toText(NotificationMessage message) {
        StringBuilder text = new StringBuilder();
        text.append("Found ").append(message.totalCount()).append(" new listings!\n\n");
        for (Listing listing : message.listings()) {
            text.append(listing.title()).append(" - ").append(listing.formattedPrice()).append('\n')
                    .append(listing.url()).append('\n')
                    .append(DiscordNotificationSender.truncate(listing.description())).append("\n\n");
        }
        return text.toString();
    }
}
