package com.datainsight.interfaces.api;

import com.datainsight.interfaces.api.dto.HealthResponse;
import com.datainsight.interfaces.api.dto.ServiceInfoResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ServiceInfoController {

    @Value("${spring.application.name:data-insight}")
    private String serviceName;

    @Value("${analysis.service-version:1.0.0}")
    private String version;

    @GetMapping("/")
    public ResponseEntity<ServiceInfoResponse> info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("models_info", "/api/v1/models/info");
        endpoints.put("analyze_text", "/api/v1/analyze/text");
        endpoints.put("analyze_file", "/api/v1/analyze/file");
        endpoints.put("batch_analyze", "/api/v1/analyze/batch");
        return ResponseEntity.ok(new ServiceInfoResponse(serviceName, version, "healthy", endpoints));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", Instant.now().toString(), version));
    }
}
