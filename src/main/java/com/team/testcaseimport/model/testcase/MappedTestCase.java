package com.team.testcaseimport.model.testcase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 套用欄位對應後的候選 Test Case。
 * id 保留原始文字，是否為合法數字由分類階段判斷。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MappedTestCase {

    private int rowIndex;            // 原始檔案列號
    private String title;            // 必填
    private String id;               // 空值代表建立新的 Test Case
    private String steps;            // "1. 動作|預期結果" 格式，每行一個步驟
    private Integer priority;
    private String areaPath;
    private String iterationPath;
    private String description;
    private String tags;
    private String automationStatus;

    @Builder.Default
    private Map<String, String> extraFields = new LinkedHashMap<>();   // referenceName → 值

    private RawRow originalData;

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
