package com.team.testcaseimport.model.testcase;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 單一 header 的欄位對應建議。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldMappingSuggestion {

    private String header;
    private String suggestedReferenceName;   // 找不到候選時為 null
    private int confidence;                  // 0-100
    private List<Candidate> candidates;      // 多個候選分數接近時才有值
    private String reason;

    public record Candidate(String referenceName, String name, int score) {}
}
