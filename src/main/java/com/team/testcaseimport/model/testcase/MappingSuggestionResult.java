package com.team.testcaseimport.model.testcase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingSuggestionResult {

    @Builder.Default
    private List<String> headers = new ArrayList<>();

    @Builder.Default
    private List<FieldMappingSuggestion> suggestions = new ArrayList<>();

    @Builder.Default
    private List<String> unmappedHeaders = new ArrayList<>();

    /** 可直接傳回匯入 API 的 header → referenceName 對應 */
    @Builder.Default
    private Map<String, String> suggestedMapping = new LinkedHashMap<>();
}
