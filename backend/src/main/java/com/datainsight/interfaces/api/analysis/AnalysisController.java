package com.datainsight.interfaces.api.analysis;

import com.datainsight.application.analysis.AnalysisAppService;
import com.datainsight.domain.analysis.exception.InvalidInputException;
import com.datainsight.domain.analysis.model.AnalysisResponse;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.BatchResult;
import com.datainsight.domain.analysis.model.BatchSummary;
import com.datainsight.domain.analysis.model.Capabilities;
import com.datainsight.domain.analysis.model.FormatHint;
import com.datainsight.interfaces.api.dto.AnalysisApiResponse;
import com.datainsight.interfaces.api.dto.BatchAnalysisRequest;
import com.datainsight.interfaces.api.dto.BatchAnalysisResponse;
import com.datainsight.interfaces.api.dto.TextAnalysisRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private static final String DEFAULT_ANALYSIS_TYPE = "comprehensive";
    private static final int MAX_FILENAME_LENGTH = 100;

    private final AnalysisAppService analysisAppService;

    @PostMapping("/analyze/text")
    public ResponseEntity<AnalysisApiResponse> analyzeText(@Valid @RequestBody TextAnalysisRequest request) {
        AnalysisType type = resolveType(request.analysisType());
        FormatHint hint = FormatHint.fromId(request.formatHint());

        AnalysisResponse response = analysisAppService.analyzeOne(request.text(), type, hint);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", Instant.now().toString());
        metadata.put("text_length", request.text().length());
        return ResponseEntity.ok(AnalysisApiResponse.of(response, metadata));
    }

    @PostMapping(value = "/analyze/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalysisApiResponse> analyzeFile(
            @RequestPart("file") MultipartFile file,
            @RequestParam(name = "format_type", defaultValue = "auto") String formatType,
            @RequestParam(name = "analysis_type", defaultValue = DEFAULT_ANALYSIS_TYPE) String analysisType) {
        AnalysisType type = resolveType(analysisType);
        FormatHint hint = FormatHint.fromId(formatType);

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read uploaded file", e);
        }

        AnalysisResponse response = analysisAppService.analyzeBytes(content, type, hint);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", Instant.now().toString());
        metadata.put("filename", sanitizeFilename(file.getOriginalFilename()));
        metadata.put("file_size", content.length);
        metadata.put("format_type", hint.id());
        return ResponseEntity.ok(AnalysisApiResponse.of(response, metadata));
    }

    @PostMapping("/analyze/batch")
    public ResponseEntity<BatchAnalysisResponse> analyzeBatch(@Valid @RequestBody BatchAnalysisRequest request) {
        AnalysisType type = resolveType(request.analysisType());

        BatchResult result = analysisAppService.analyzeBatch(request.texts(), type);
        BatchSummary summary = analysisAppService.summarize(request.texts(), result, type);

        return ResponseEntity.ok(new BatchAnalysisResponse(
                true, result.size(), result.successCount(), result.responses(), summary));
    }

    @GetMapping("/models/info")
    public ResponseEntity<Capabilities> modelsInfo() {
        return ResponseEntity.ok(analysisAppService.describeCapabilities());
    }

    private AnalysisType resolveType(String analysisType) {
        return AnalysisType.fromId(analysisType == null ? DEFAULT_ANALYSIS_TYPE : analysisType);
    }

    static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "upload";
        }
        String sanitized = filename.replaceAll("[^\\w.-]", "_");
        return sanitized.length() > MAX_FILENAME_LENGTH ? sanitized.substring(0, MAX_FILENAME_LENGTH) : sanitized;
    }
}
