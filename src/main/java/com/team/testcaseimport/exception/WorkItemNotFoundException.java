package com.team.testcaseimport.exception;

import lombok.Getter;

/**
 * Azure DevOps 回應 404：Work Item 不存在或沒有權限讀取。
 * 與其他查詢失敗分開，呼叫端不應重試這類錯誤。
 */
@Getter
public class WorkItemNotFoundException extends RuntimeException {

    private final int workItemId;

    public WorkItemNotFoundException(int workItemId, Throwable cause) {
        super("Work item " + workItemId + " not found", cause);
        this.workItemId = workItemId;
    }
}
