package com.aiinpocket.adwatch.model.dto;

import jakarta.validation.constraints.NotBlank;

public record RescheduleRequest(
        @NotBlank String schedule
) {}
