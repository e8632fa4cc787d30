package com.team.testcaseimport.controller;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.model.dto.BulkImportRequest;
import com.team.testcaseimport.model.dto.BulkImportResponse;
import com.team.testcaseimport.model.dto.FieldMappingSuggestionResponse;
import com.team.testcaseimport.model.dto.SuggestFieldMappingRequest;
import com.team.testcaseimport.service.testimport.BulkImportOrchestrator;
import com.team.testcaseimport.service.testimport.FieldCatalogCache;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Test Plan 匯入 API 端點。
 *
 * 端點：
 * - POST   /api/test-plans/bulk-import              大量匯入或預覽
 * - POST   /api/test-plans/field-mapping/suggest    欄位對應建議
 * - DELETE /api/test-plans/field-catalog            清除欄位清單快取
 * - GET    /api/health                              健康檢查
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class TestPlanImportController {

    private final BulkImportOrchestrator orchestrator;
    private final FieldCatalogCache catalogCache;
    private final BulkImportConfig config;
    private final Bucket rateLimiter;

    public TestPlanImportController(BulkImportOrchestrator orchestrator,
                                    FieldCatalogCache catalogCache,
                                    BulkImportConfig config,
                                    @Qualifier("bulkImportRateLimiter") Bucket rateLimiter) {
        this.orchestrator = orchestrator;
        this.catalogCache = catalogCache;
        this.config = config;
        this.rateLimiter = rateLimiter;
    }

    /**
     * 從 CSV 大量建立或更新 Test Case。
     *
     * 範例請求：
     * POST /api/test-plans/bulk-import
     * {
     *   "project": "MyProject",
     *   "fileContent": "VGl0bGUsU3RlcHMK...",
     *   "fileName": "test-cases.csv",
     *   "previewOnly": true,
     *   "batchSize": 10
     * }
     */
    @PostMapping("/test-plans/bulk-import")
    public Mono<ResponseEntity<BulkImportResponse>> bulkImport(@RequestBody BulkImportRequest request) {
        List<String> errors = validate(request);
        if (!errors.isEmpty()) {
            log.warn("大量匯入請求驗證失敗：{}", errors);
            return Mono.just(ResponseEntity.badRequest().body(BulkImportResponse.validationFailed(errors)));
        }

        if (!rateLimiter.tryConsume(1)) {
            log.warn("大量匯入請求超過速率限制：{}", request.getProject());
            return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(BulkImportResponse.validationFailed(
                            List.of("Rate limit exceeded for bulk import. Please try again later."))));
        }

        log.info("收到大量匯入請求：{}（project={}）", request.getFileName(), request.getProject());
        return orchestrator.importTestCases(request).map(ResponseEntity::ok);
    }

    /**
     * 只讀取 CSV 標題列，回傳欄位對應建議。
     */
    @PostMapping("/test-plans/field-mapping/suggest")
    public Mono<ResponseEntity<FieldMappingSuggestionResponse>> suggestFieldMapping(
            @RequestBody SuggestFieldMappingRequest request) {
        List<String> errors = new ArrayList<>();
        requireText(errors, request.getProject(), "project");
        requireText(errors, request.getFileContent(), "fileContent");
        requireText(errors, request.getFileName(), "fileName");
        if (!errors.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(FieldMappingSuggestionResponse.builder()
                    .success(false)
                    .stage(BulkImportResponse.STAGE_VALIDATION)
                    .errors(errors)
                    .build()));
        }

        log.info("收到欄位對應建議請求：{}（project={}）", request.getFileName(), request.getProject());
        return orchestrator.suggestFieldMapping(request).map(ResponseEntity::ok);
    }

    /**
     * 清除欄位清單快取。沒有指定 project 時清除全部。
     */
    @DeleteMapping("/test-plans/field-catalog")
    public ResponseEntity<Map<String, Object>> invalidateFieldCatalog(
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String workItemType) {
        if (project == null || project.isBlank()) {
            catalogCache.invalidateAll();
            return ResponseEntity.ok(Map.of("status", "cleared", "scope", "all"));
        }

        String type = workItemType != null && !workItemType.isBlank() ? workItemType : config.getWorkItemType();
        catalogCache.invalidate(project, type);
        return ResponseEntity.ok(Map.of("status", "cleared", "project", project, "workItemType", type));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Test Case Import",
                "version", "0.0.1"
        ));
    }

    private List<String> validate(BulkImportRequest request) {
        List<String> errors = new ArrayList<>();
        requireText(errors, request.getProject(), "project");
        requireText(errors, request.getFileContent(), "fileContent");
        requireText(errors, request.getFileName(), "fileName");

        Integer batchSize = request.getBatchSize();
        if (batchSize != null && (batchSize < 1 || batchSize > config.getMaxBatchSize())) {
            errors.add("batchSize must be between 1 and " + config.getMaxBatchSize());
        }
        if (request.isAddToSuite() && (request.getPlanId() == null || request.getSuiteId() == null)) {
            errors.add("planId and suiteId are required when addToSuite is true");
        }
        return errors;
    }

    private void requireText(List<String> errors, String value, String name) {
        if (value == null || value.isBlank()) {
            errors.add(name + " is required");
        }
    }
}
