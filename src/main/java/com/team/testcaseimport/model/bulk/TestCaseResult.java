package com.team.testcaseimport.model.bulk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestCaseResult {

    private int originalRowIndex;
    private String title;
    private int workItemId;
    private String url;
    private Operation operation;

    public enum Operation {
        CREATED,
        UPDATED;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }
}
