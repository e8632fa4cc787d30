package com.team.testcaseimport.exception;

import lombok.Getter;

import java.util.List;

/**
 * 匯入流程中會中止整個流程的階段性錯誤（檔案解析、欄位對應）。
 * 帶有要回報給使用者的錯誤與警告清單。
 */
@Getter
public class BulkImportException extends RuntimeException {

    private final List<String> errors;
    private final List<String> warnings;

    public BulkImportException(List<String> errors, List<String> warnings) {
        super(errors.isEmpty() ? "Bulk import failed" : String.join("; ", errors));
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }
}
