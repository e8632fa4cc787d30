package com.team.testcaseimport.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 大量匯入 Test Case 的請求物件。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkImportRequest {

    private String project;                    // Azure DevOps project ID 或名稱
    private Integer planId;                    // 選填：addToSuite 時必填
    private Integer suiteId;                   // 選填：addToSuite 時必填
    private String fileContent;                // base64 編碼的 CSV 內容
    private String fileName;                   // 檔名（用來判斷檔案格式）
    private boolean previewOnly;               // true 時只產生預覽，不建立/更新
    private boolean addToSuite;                // 完成後是否加入 Test Suite
    private Integer batchSize;                 // 每批筆數 1-50，預設 10
    private boolean ignoreIds;                 // true 時忽略 ID 欄位，全部建立新的 Test Case
    private Map<String, String> fieldMapping;  // 選填：header → referenceName，指定後不做自動對應
}
