package com.team.testcaseimport.model.bulk;

import com.team.testcaseimport.model.testcase.MappedTestCase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 分類階段的輸出。每一列只會出現在其中一個清單。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategorizedTestCases {

    @Builder.Default
    private List<MappedTestCase> toCreate = new ArrayList<>();

    @Builder.Default
    private List<MappedTestCase> toUpdate = new ArrayList<>();

    @Builder.Default
    private List<OperationError> errors = new ArrayList<>();
}
