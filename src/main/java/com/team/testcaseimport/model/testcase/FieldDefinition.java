package com.team.testcaseimport.model.testcase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Work Item 類型上的單一欄位定義。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDefinition {

    private String referenceName;   // 例如 System.Title
    private String name;            // 顯示名稱，例如 Title
    private boolean required;
}
