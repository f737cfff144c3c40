package com.aiinpocket.adwatch.service.notification;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import com.aiinpocket.adwatch.exception.DeliveryException;
import com.aiinpocket.adwatch.model.dto.DeliveryReport;
import com.aiinpocket.adwatch.model.dto.Listing;
import com.aiinpocket.adwatch.model.dto.NotificationMessage;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.enums.ChannelType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 通知分發器（Dispatcher）。
 * 把一批新廣告可靠地送到「一個」通知目標：
 * <ol>
 *   <li>依目標的 {@link ChannelType} 路由到對應的 NotificationSender</li>
 *   <li>批次模式（enabled 且超過 1 筆）：每 batchSize 筆一則訊息，訊息間隔 batchDelay</li>
 *   <li>單筆模式：每筆廣告一則訊息，訊息間隔 messageDelay</li>
 *   <li>每則訊息各自經過 {@link BackoffRetrier}，用盡次數後記錄錯誤並繼續下一則</li>
 * </ol>
 *
 * <p>{@link #dispatch} 永遠不拋出例外，結果以 {@link DeliveryReport} 回傳給執行週期。
 * 同一目標內的訊息依廣告順序逐一發送，前一則（含重試）結束後才送下一則。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final List<NotificationSender> senders;
    private final BackoffRetrier retrier;
    private final Sleeper sleeper;
    private final AdWatchProperties props;

    /** 管道類型 → 發送器的映射表，在啟動時初始化 */
    private Map<ChannelType, NotificationSender> senderMap;

    @PostConstruct
    void init() {
        senderMap = new EnumMap<>(ChannelType.class);
        for (NotificationSender sender : senders) {
            senderMap.put(sender.getType(), sender);
        }
        log.info("[通知分發] 已註冊 {} 種通知發送器: {}", senderMap.size(), senderMap.keySet());
    }

    public DeliveryReport dispatch(NotificationTarget target, List<Listing> listings) {
        ChannelType kind = target.getKind();
        if (listings == null || listings.isEmpty()) {
            return DeliveryReport.empty(kind);
        }

        try {
            NotificationSender sender = senderMap.get(kind);
            if (sender == null) {
                log.warn("[通知分發] 找不到 {} 類型的發送器", kind);
                return DeliveryReport.skipped(kind);
            }
            if (!sender.isEnabled(target)) {
                logIntent(target, listings);
                return DeliveryReport.skipped(kind);
            }
            return deliver(sender, target, listings);
        } catch (Exception e) {
            log.error("[通知分發] {} 發送時發生未預期錯誤: {} 筆廣告", kind, listings.size(), e);
            return DeliveryReport.failed(kind, 1);
        }
    }

    private DeliveryReport deliver(NotificationSender sender, NotificationTarget target, List<Listing> listings) {
        AdWatchProperties.NotificationParams config = props.notification();
        List<NotificationMessage> messages = toMessages(listings, sender.maxListingsPerMessage());
        boolean batched = messages.get(0).batched();
        Duration pause = batched ? config.batchDelay() : config.messageDelay();

        if (batched) {
            log.info("[通知分發] {} 批次發送 {} 筆新廣告，共 {} 批", target.getKind(), listings.size(), messages.size());
        } else {
            log.info("[通知分發] {} 逐筆發送 {} 筆新廣告", target.getKind(), listings.size());
        }

        int sent = 0;
        int failed = 0;
        for (NotificationMessage message : messages) {
            String label = target.getKind() + " 第 " + message.index() + "/" + message.count() + " 則";
            try {
                retrier.execute(() -> sender.send(target, message),
                        config.maxRetries(), config.retryDelay(), label);
                sent++;
            } catch (DeliveryException e) {
                failed++;
                log.error("[通知分發] {} 重試 {} 次後仍失敗，略過: {}", label, config.maxRetries(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed += message.count() - message.index() + 1;
                log.warn("[通知分發] {} 發送被中斷，剩餘訊息不再發送", target.getKind());
                break;
            }

            if (message.index() < message.count()) {
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failed += message.count() - message.index();
                    log.warn("[通知分發] {} 等待間隔時被中斷，剩餘訊息不再發送", target.getKind());
                    break;
                }
            }
        }
        return new DeliveryReport(target.getKind(), sent, failed, false);
    }

    /** 依批次設定把廣告切成一則一則的訊息，每批不超過發送器的單則上限 */
    List<NotificationMessage> toMessages(List<Listing> listings, int maxPerMessage) {
        AdWatchProperties.BatchParams batching = props.notification().batching();
        int total = listings.size();
        List<NotificationMessage> messages = new ArrayList<>();

        if (batching.enabled() && total > 1) {
            int size = Math.max(1, Math.min(batching.size(), maxPerMessage));
            if (size < batching.size()) {
                log.debug("[通知分發] 批次大小 {} 超過單則上限，改為每則 {} 筆", batching.size(), size);
            }
            int count = (total + size - 1) / size;
            for (int i = 0; i < total; i += size) {
                List<Listing> chunk = List.copyOf(listings.subList(i, Math.min(i + size, total)));
                messages.add(new NotificationMessage(chunk, total, i / size + 1, count, true));
            }
        } else {
            for (int i = 0; i < total; i++) {
                messages.add(new NotificationMessage(List.of(listings.get(i)), total, i + 1, total, false));
            }
        }
        return messages;
    }

    private void logIntent(NotificationTarget target, List<Listing> listings) {
        switch (target.getKind()) {
            case DISCORD -> log.debug("[通知分發] Discord 通知停用或缺少 Webhook URL，略過 {} 筆廣告", listings.size());
            case EMAIL -> log.info("[通知分發] Email 通知未啟用，原本會寄送 {} 筆廣告至 {}",
                    listings.size(), target.getEmail() != null ? target.getEmail() : "default");
        }
    }
}
