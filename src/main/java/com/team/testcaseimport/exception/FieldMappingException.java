package com.team.testcaseimport.exception;

import com.team.testcaseimport.model.testcase.MappingStats;
import lombok.Getter;

import java.util.List;

/**
 * 沒有任何一列可以對應成 Test Case 時拋出。
 */
@Getter
public class FieldMappingException extends BulkImportException {

    private final MappingStats stats;

    public FieldMappingException(List<String> errors, List<String> warnings, MappingStats stats) {
        super(errors, warnings);
        this.stats = stats;
    }
}
