package com.datainsight.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {}
