package com.team.testcaseimport.model.testcase;

import java.util.List;
import java.util.Locale;

/**
 * 某個 (project, workItemType) 的欄位清單。
 * fallback 為 true 表示遠端查詢失敗，內容是內建的常用欄位，不可用來判斷欄位是否存在。
 */
public record FieldCatalog(String project, String workItemType, List<FieldDefinition> fields, boolean fallback) {

    public FieldCatalog {
        fields = List.copyOf(fields);
    }

    public boolean defines(String referenceName) {
        if (referenceName == null) {
            return false;
        }
        String lowered = referenceName.toLowerCase(Locale.ROOT);
        return fields.stream()
                .anyMatch(f -> f.getReferenceName().toLowerCase(Locale.ROOT).equals(lowered));
    }
}
