package com.team.testcaseimport.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 預覽中每一列的摘要。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RowSummary {

    private int rowIndex;
    private String title;
    private String id;
    private boolean hasSteps;
    private Integer priority;
    private String areaPath;
    private String plannedOperation;   // create / update / error
}
