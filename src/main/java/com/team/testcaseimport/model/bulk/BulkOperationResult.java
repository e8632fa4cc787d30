package com.team.testcaseimport.model.bulk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 大量建立/更新的彙總結果。
 * success 只有在 errors 為空時才是 true。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperationResult {

    private boolean success;

    @Builder.Default
    private List<TestCaseResult> created = new ArrayList<>();

    @Builder.Default
    private List<TestCaseResult> updated = new ArrayList<>();

    @Builder.Default
    private List<OperationError> errors = new ArrayList<>();

    @Builder.Default
    private Summary summary = new Summary();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalProcessed;
        private int successfulCreations;
        private int successfulUpdates;
        private int failures;
    }
}
