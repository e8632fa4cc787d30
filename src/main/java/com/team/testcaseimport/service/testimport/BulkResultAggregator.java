package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.model.bulk.BulkOperationResult;
import com.team.testcaseimport.model.bulk.OperationError;
import com.team.testcaseimport.model.bulk.OperationError.OperationKind;
import com.team.testcaseimport.model.bulk.RowOutcome;
import com.team.testcaseimport.model.bulk.TestCaseResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 匯入流程第 7 階段：彙整所有列的結果。
 * success 只有在沒有任何錯誤時才為 true。
 */
@Component
@Slf4j
public class BulkResultAggregator {

    static final String FATAL_ERROR_TITLE = "Bulk Operation";

    /**
     * @param totalRows    進入分類階段的列數
     * @param lookupErrors 分類階段的錯誤
     * @param outcomes     批次執行的每列結果
     */
    public BulkOperationResult aggregate(int totalRows, List<OperationError> lookupErrors, List<RowOutcome> outcomes) {
        BulkOperationResult result = BulkOperationResult.builder().build();
        result.getErrors().addAll(lookupErrors);

        for (RowOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                result.getErrors().add(outcome.getError());
            } else if (outcome.getResult().getOperation() == TestCaseResult.Operation.CREATED) {
                result.getCreated().add(outcome.getResult());
            } else {
                result.getUpdated().add(outcome.getResult());
            }
        }

        result.getSummary().setTotalProcessed(totalRows);
        refreshSummary(result);
        log.info("批次操作完成：建立 {} 筆，更新 {} 筆，失敗 {} 筆",
                result.getCreated().size(), result.getUpdated().size(), result.getErrors().size());
        return result;
    }

    /**
     * 追加一筆階段層級的錯誤（例如加入 Test Suite 失敗），並重新計算統計。
     */
    public void addError(BulkOperationResult result, OperationError error) {
        result.getErrors().add(error);
        refreshSummary(result);
    }

    /**
     * 列以外的非預期錯誤：所有列都視為失敗，只記錄一筆錯誤。
     */
    public BulkOperationResult fatal(int totalRows, Throwable error) {
        log.error("批次操作發生非預期錯誤：{}", error.getMessage(), error);

        BulkOperationResult result = BulkOperationResult.builder().success(false).build();
        result.getErrors().add(OperationError.builder()
                .originalRowIndex(0)
                .title(FATAL_ERROR_TITLE)
                .operation(OperationKind.CREATE)
                .errorMessage("Fatal error during bulk operation: "
                        + (error.getMessage() != null ? error.getMessage() : "Unknown error"))
                .build());
        result.getSummary().setTotalProcessed(totalRows);
        result.getSummary().setFailures(totalRows);
        return result;
    }

    private void refreshSummary(BulkOperationResult result) {
        BulkOperationResult.Summary summary = result.getSummary();
        summary.setSuccessfulCreations(result.getCreated().size());
        summary.setSuccessfulUpdates(result.getUpdated().size());
        summary.setFailures(result.getErrors().size());
        result.setSuccess(result.getErrors().isEmpty());
    }
}
