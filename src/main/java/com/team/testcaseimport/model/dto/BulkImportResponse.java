package com.team.testcaseimport.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.team.testcaseimport.model.bulk.BulkOperationResult;
import com.team.testcaseimport.model.bulk.OperationError;
import com.team.testcaseimport.model.testcase.MappingStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 大量匯入的回應。
 * 業務失敗一律以 success=false 與 stage 表示，不透過 HTTP 錯誤碼。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BulkImportResponse {

    public static final String STAGE_VALIDATION = "validation";
    public static final String STAGE_FILE_PARSING = "file_parsing";
    public static final String STAGE_FIELD_MAPPING = "field_mapping";
    public static final String STAGE_PREVIEW = "preview";
    public static final String STAGE_COMPLETED = "completed";
    public static final String STAGE_FATAL_ERROR = "fatal_error";

    private boolean success;
    private String stage;

    // 預覽
    private String preview;
    private MappingStats stats;
    private List<String> errors;
    private List<String> warnings;
    private List<RowSummary> mappedTestCases;

    // 完整執行
    private BulkOperationResult bulkOperationResult;
    private List<String> fileParsingWarnings;
    private List<String> mappingWarnings;
    private List<String> mappingErrors;
    private List<OperationError> operationErrors;

    // 非預期錯誤
    private String error;
    private String message;

    public static BulkImportResponse validationFailed(List<String> errors) {
        return BulkImportResponse.builder()
                .success(false)
                .stage(STAGE_VALIDATION)
                .errors(errors)
                .build();
    }

    public static BulkImportResponse fileParsingFailed(List<String> errors, List<String> warnings) {
        return BulkImportResponse.builder()
                .success(false)
                .stage(STAGE_FILE_PARSING)
                .errors(errors)
                .warnings(warnings)
                .build();
    }

    public static BulkImportResponse mappingFailed(List<String> errors, List<String> warnings, MappingStats stats) {
        return BulkImportResponse.builder()
                .success(false)
                .stage(STAGE_FIELD_MAPPING)
                .errors(errors)
                .warnings(warnings)
                .stats(stats)
                .build();
    }

    public static BulkImportResponse fatal(String error) {
        return BulkImportResponse.builder()
                .success(false)
                .stage(STAGE_FATAL_ERROR)
                .error(error)
                .message("An unexpected error occurred during bulk import. Please check your file format and try again.")
                .build();
    }
}
