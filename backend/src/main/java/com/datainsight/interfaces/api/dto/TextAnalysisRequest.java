package com.datainsight.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

public record TextAnalysisRequest(
        @NotNull(message = "Text is required")
        String text,

        String analysisType,

        String formatHint
) {}
