package com.datainsight.interfaces.api.dto;

public record HealthResponse(
        String status,
        String timestamp,
        String version
) {}
