package com.aiinpocket.adwatch.model.dto;

import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.enums.ChannelType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationTargetDto(
        @NotNull ChannelType kind,
        @JsonProperty("webhook_url") String webhookUrl,
        String email
) {
    public static NotificationTargetDto from(NotificationTarget target) {
        return new NotificationTargetDto(target.getKind(), target.getWebhookUrl(), target.getEmail());
    }
}
