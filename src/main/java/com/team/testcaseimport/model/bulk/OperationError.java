package com.team.testcaseimport.model.bulk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 單一列（或單一階段）的失敗紀錄，以原始列號與標題對應回檔案。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationError {

    private int originalRowIndex;    // 階段層級的錯誤為 0
    private String title;
    private OperationKind operation;
    private String errorMessage;
    private String originalId;

    public enum OperationKind {
        CREATE,
        UPDATE,
        LOOKUP,
        SUITE;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }
}
