package com.team.testcaseimport.model.testcase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingStats {

    private int totalRows;
    private int validRows;
    private int rowsWithId;
    private int rowsWithoutId;
}
