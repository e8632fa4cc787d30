package com.team.testcaseimport.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 欄位對應建議的請求物件。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestFieldMappingRequest {

    private String project;
    private String fileContent;     // base64 編碼的 CSV（只使用標題列）
    private String fileName;
    private String workItemType;    // 預設 "Test Case"
}
