package com.team.testcaseimport.model.bulk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 批次建立/更新的執行選項。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperationOptions {

    private String project;
    private Integer planId;          // addToSuite 時必填
    private Integer suiteId;         // addToSuite 時必填
    private int batchSize;           // 1-50，同時也是並行上限
    private boolean addToSuite;
    private String workItemType;

    /**
     * 將 batchSize 限制在 1 到 max 之間。
     */
    public int effectiveBatchSize(int max) {
        return Math.max(1, Math.min(batchSize, max));
    }

    public boolean shouldEnrollInSuite() {
        return addToSuite && planId != null && suiteId != null;
    }
}
