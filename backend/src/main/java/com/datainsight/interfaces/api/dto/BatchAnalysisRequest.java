package com.datainsight.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record BatchAnalysisRequest(
        @NotNull(message = "Texts are required")
        List<String> texts,

        String analysisType
) {}
