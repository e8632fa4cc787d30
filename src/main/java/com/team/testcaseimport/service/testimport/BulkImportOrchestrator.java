package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.exception.FieldMappingException;
import com.team.testcaseimport.exception.FileParsingException;
import com.team.testcaseimport.model.bulk.BulkOperationOptions;
import com.team.testcaseimport.model.bulk.BulkOperationResult;
import com.team.testcaseimport.model.bulk.CategorizedTestCases;
import com.team.testcaseimport.model.bulk.OperationError;
import com.team.testcaseimport.model.dto.BulkImportRequest;
import com.team.testcaseimport.model.dto.BulkImportResponse;
import com.team.testcaseimport.model.dto.FieldMappingSuggestionResponse;
import com.team.testcaseimport.model.dto.RowSummary;
import com.team.testcaseimport.model.dto.SuggestFieldMappingRequest;
import com.team.testcaseimport.model.testcase.FieldCatalog;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import com.team.testcaseimport.model.testcase.MappingResult;
import com.team.testcaseimport.model.testcase.MappingSuggestionResult;
import com.team.testcaseimport.model.testcase.ParsedFile;
import com.team.testcaseimport.service.testimport.FieldMappingEngine.ResolvedMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test Case 大量匯入主流程編排器。
 *
 * 1. 解析 CSV（失敗 → stage=file_parsing）
 * 2. 取得欄位清單（快取）
 * 3. 決定欄位對應（明確指定或自動建議）
 * 4. 轉成候選 Test Case（沒有任何可用的列 → stage=field_mapping）
 * 5. 分類：建立 / 更新 / 錯誤
 *    previewOnly 時到此為止，回傳預覽
 * 6. 批次建立、更新
 * 7. 彙整結果
 * 8. 加入 Test Suite（選用）
 *
 * 業務上的失敗都放在回應的 success/stage/errors 中；
 * 只有非預期的例外會走 fatal 路徑，而且一定在這裡被攔下，不會丟給呼叫端。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BulkImportOrchestrator {

    static final String SUGGESTION_NOTE = "Suggestions are advisory only. Pass suggestedMapping (or an edited copy) "
            + "as fieldMapping to the bulk import to apply it.";

    private final BulkImportConfig config;
    private final CsvFileParser fileParser;
    private final FieldCatalogCache catalogCache;
    private final FieldMappingEngine mappingEngine;
    private final TestCaseProjector projector;
    private final TestCaseCategorizer categorizer;
    private final BulkTestCaseExecutor executor;
    private final BulkResultAggregator aggregator;
    private final SuiteEnrollmentService suiteEnrollmentService;
    private final ImportPreviewGenerator previewGenerator;

    /**
     * 執行大量匯入（或只產生預覽）。
     */
    public Mono<BulkImportResponse> importTestCases(BulkImportRequest request) {
        String workItemType = config.getWorkItemType();
        log.info("=== 開始大量匯入：{}（project={}, previewOnly={}, ignoreIds={}）===",
                request.getFileName(), request.getProject(), request.isPreviewOnly(), request.isIgnoreIds());

        return Mono.fromCallable(() -> parse(request))
                .flatMap(parsed -> catalogCache.getOrFetch(request.getProject(), workItemType)
                        .flatMap(catalog -> {
                            MappingResult mapping = map(parsed, catalog, request);
                            String preview = previewGenerator.generate(mapping);
                            BulkOperationOptions options = toOptions(request, workItemType);

                            if (request.isPreviewOnly()) {
                                return categorizer.categorize(mapping.getMappedTestCases(), request.getProject(), workItemType)
                                        .map(categorized -> previewResponse(parsed, mapping, categorized, preview));
                            }
                            return run(mapping.getMappedTestCases(), options)
                                    .map(result -> completedResponse(parsed, mapping, result, preview));
                        }))
                .doOnNext(response -> log.info("=== 大量匯入結束：stage={}, success={} ===",
                        response.getStage(), response.isSuccess()))
                .onErrorResume(FileParsingException.class, e -> {
                    log.warn("檔案解析失敗：{}", e.getErrors());
                    return Mono.just(BulkImportResponse.fileParsingFailed(e.getErrors(), e.getWarnings()));
                })
                .onErrorResume(FieldMappingException.class, e -> {
                    log.warn("欄位對應失敗：{}", e.getErrors());
                    return Mono.just(BulkImportResponse.mappingFailed(e.getErrors(), e.getWarnings(), e.getStats()));
                })
                .onErrorResume(e -> {
                    log.error("大量匯入發生非預期錯誤：{}", e.getMessage(), e);
                    return Mono.just(BulkImportResponse.fatal(
                            e.getMessage() != null ? e.getMessage() : "Unknown error occurred"));
                });
    }

    /**
     * 產生欄位對應建議，不做任何建立或更新。
     */
    public Mono<FieldMappingSuggestionResponse> suggestFieldMapping(SuggestFieldMappingRequest request) {
        String workItemType = request.getWorkItemType() != null && !request.getWorkItemType().isBlank()
                ? request.getWorkItemType()
                : config.getWorkItemType();

        return Mono.fromCallable(() -> fileParser.parse(request.getFileContent(), request.getFileName()))
                .flatMap(parsed -> catalogCache.getOrFetch(request.getProject(), workItemType)
                        .map(catalog -> {
                            MappingSuggestionResult suggestion = mappingEngine.suggest(parsed.getHeaders(), catalog);
                            List<String> warnings = new ArrayList<>(parsed.getWarnings());
                            if (catalog.fallback()) {
                                warnings.add("Could not load the field list for '" + workItemType
                                        + "'; suggestions are based on common Test Case fields only");
                            }
                            return FieldMappingSuggestionResponse.builder()
                                    .success(true)
                                    .stage("suggestion")
                                    .headers(suggestion.getHeaders())
                                    .suggestedMapping(suggestion.getSuggestedMapping())
                                    .suggestions(suggestion.getSuggestions())
                                    .unmappedHeaders(suggestion.getUnmappedHeaders())
                                    .fieldCount(catalog.fields().size())
                                    .fallbackCatalog(catalog.fallback())
                                    .note(SUGGESTION_NOTE)
                                    .warnings(warnings)
                                    .build();
                        }))
                .onErrorResume(FileParsingException.class, e -> Mono.just(FieldMappingSuggestionResponse.builder()
                        .success(false)
                        .stage(BulkImportResponse.STAGE_FILE_PARSING)
                        .errors(e.getErrors())
                        .warnings(e.getWarnings())
                        .build()))
                .onErrorResume(e -> {
                    log.error("產生欄位對應建議失敗：{}", e.getMessage(), e);
                    return Mono.just(FieldMappingSuggestionResponse.builder()
                            .success(false)
                            .stage(BulkImportResponse.STAGE_FATAL_ERROR)
                            .error(e.getMessage() != null ? e.getMessage() : "Unknown error occurred")
                            .build());
                });
    }

    private ParsedFile parse(BulkImportRequest request) {
        ParsedFile parsed = fileParser.parse(request.getFileContent(), request.getFileName());
        List<String> explicitTitleHeaders = request.getFieldMapping() == null
                ? List.of()
                : TestCaseProjector.headersMappedTo(request.getFieldMapping(), FieldMappingEngine.TITLE_FIELD);
        fileParser.requireTitleColumn(parsed, explicitTitleHeaders);
        return parsed;
    }

    private MappingResult map(ParsedFile parsed, FieldCatalog catalog, BulkImportRequest request) {
        ResolvedMapping resolved = mappingEngine.resolve(parsed.getHeaders(), catalog, request.getFieldMapping());
        MappingResult mapping = projector.project(parsed, resolved.mapping(), catalog, request.isIgnoreIds());
        mapping.getWarnings().addAll(0, resolved.warnings());

        if (mapping.getMappedTestCases().isEmpty()) {
            List<String> errors = new ArrayList<>(mapping.getErrors());
            if (errors.isEmpty()) {
                errors.add("No rows could be mapped to test cases");
            }
            throw new FieldMappingException(errors, mapping.getWarnings(), mapping.getStats());
        }
        return mapping;
    }

    /**
     * 第 5 到 8 階段。列以外的非預期錯誤會讓所有列都記為失敗。
     */
    private Mono<BulkOperationResult> run(List<MappedTestCase> testCases, BulkOperationOptions options) {
        return categorizer.categorize(testCases, options.getProject(), options.getWorkItemType())
                .flatMap(categorized -> executor.execute(categorized, options)
                        .map(outcomes -> aggregator.aggregate(testCases.size(), categorized.getErrors(), outcomes)))
                .flatMap(result -> suiteEnrollmentService.enroll(result, options))
                .onErrorResume(e -> Mono.just(aggregator.fatal(testCases.size(), e)));
    }

    private BulkOperationOptions toOptions(BulkImportRequest request, String workItemType) {
        return BulkOperationOptions.builder()
                .project(request.getProject())
                .planId(request.getPlanId())
                .suiteId(request.getSuiteId())
                .batchSize(request.getBatchSize() != null ? request.getBatchSize() : config.getDefaultBatchSize())
                .addToSuite(request.isAddToSuite())
                .workItemType(workItemType)
                .build();
    }

    private BulkImportResponse previewResponse(ParsedFile parsed, MappingResult mapping,
                                               CategorizedTestCases categorized, String preview) {
        Map<Integer, String> planned = new HashMap<>();
        categorized.getToCreate().forEach(tc -> planned.put(tc.getRowIndex(), "create"));
        categorized.getToUpdate().forEach(tc -> planned.put(tc.getRowIndex(), "update"));
        categorized.getErrors().forEach(error -> planned.put(error.getOriginalRowIndex(), "error"));

        List<String> errors = new ArrayList<>(mapping.getErrors());
        for (OperationError error : categorized.getErrors()) {
            errors.add("Row " + error.getOriginalRowIndex() + ": " + error.getErrorMessage());
        }
        List<String> warnings = new ArrayList<>(parsed.getWarnings());
        warnings.addAll(mapping.getWarnings());

        List<RowSummary> rows = mapping.getMappedTestCases().stream()
                .map(tc -> RowSummary.builder()
                        .rowIndex(tc.getRowIndex())
                        .title(tc.getTitle())
                        .id(tc.getId())
                        .hasSteps(tc.getSteps() != null)
                        .priority(tc.getPriority())
                        .areaPath(tc.getAreaPath())
                        .plannedOperation(planned.get(tc.getRowIndex()))
                        .build())
                .toList();

        return BulkImportResponse.builder()
                .success(errors.isEmpty())
                .stage(BulkImportResponse.STAGE_PREVIEW)
                .preview(preview)
                .stats(mapping.getStats())
                .errors(errors)
                .warnings(warnings)
                .mappedTestCases(rows)
                .build();
    }

    private BulkImportResponse completedResponse(ParsedFile parsed, MappingResult mapping,
                                                 BulkOperationResult result, String preview) {
        return BulkImportResponse.builder()
                .success(result.isSuccess())
                .stage(BulkImportResponse.STAGE_COMPLETED)
                .preview(preview)
                .bulkOperationResult(result)
                .fileParsingWarnings(parsed.getWarnings())
                .mappingWarnings(mapping.getWarnings())
                .mappingErrors(mapping.getErrors())
                .operationErrors(result.getErrors())
                .build();
    }
}
