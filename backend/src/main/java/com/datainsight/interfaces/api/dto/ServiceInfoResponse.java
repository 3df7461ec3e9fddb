package com.datainsight.interfaces.api.dto;

import java.util.Map;

public record ServiceInfoResponse(
        String service,
        String version,
        String status,
        Map<String, String> endpoints
) {}
