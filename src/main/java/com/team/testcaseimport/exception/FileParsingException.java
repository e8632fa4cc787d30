package com.team.testcaseimport.exception;

import java.util.List;

/**
 * 檔案解碼或驗證失敗，在任何遠端呼叫之前中止流程。
 */
public class FileParsingException extends BulkImportException {

    public FileParsingException(List<String> errors, List<String> warnings) {
        super(errors, warnings);
    }

    public FileParsingException(String error) {
        super(List.of(error), List.of());
    }
}
