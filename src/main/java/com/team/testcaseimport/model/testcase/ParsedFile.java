package com.team.testcaseimport.model.testcase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 檔案解析階段的輸出：標題列與資料列。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedFile {

    private String fileName;

    @Builder.Default
    private List<String> headers = new ArrayList<>();

    @Builder.Default
    private List<RawRow> rows = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
