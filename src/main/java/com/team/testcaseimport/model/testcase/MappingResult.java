package com.team.testcaseimport.model.testcase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 投影階段的輸出：可匯入的 Test Case、錯誤、警告與統計。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingResult {

    @Builder.Default
    private List<MappedTestCase> mappedTestCases = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private MappingStats stats = new MappingStats();

    /** 實際使用的 header → referenceName 對應 */
    @Builder.Default
    private Map<String, String> appliedMapping = new LinkedHashMap<>();
}
