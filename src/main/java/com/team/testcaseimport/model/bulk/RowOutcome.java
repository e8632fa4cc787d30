package com.team.testcaseimport.model.bulk;

/**
 * 單列執行結果：成功（TestCaseResult）或失敗（OperationError）二擇一。
 */
public final class RowOutcome {

    private final TestCaseResult result;
    private final OperationError error;

    private RowOutcome(TestCaseResult result, OperationError error) {
        this.result = result;
        this.error = error;
    }

    public static RowOutcome success(TestCaseResult result) {
        return new RowOutcome(result, null);
    }

    public static RowOutcome failure(OperationError error) {
        return new RowOutcome(null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public TestCaseResult getResult() {
        return result;
    }

    public OperationError getError() {
        return error;
    }
}
