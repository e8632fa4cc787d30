package com.team.testcaseimport.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.team.testcaseimport.model.testcase.FieldMappingSuggestion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldMappingSuggestionResponse {

    private boolean success;
    private String stage;
    private List<String> headers;
    private Map<String, String> suggestedMapping;
    private List<FieldMappingSuggestion> suggestions;
    private List<String> unmappedHeaders;
    private Integer fieldCount;
    private Boolean fallbackCatalog;
    private String note;
    private List<String> errors;
    private List<String> warnings;
    private String error;
}
