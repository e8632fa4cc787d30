package com.team.testcaseimport.model.testcase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 檔案中的一列原始資料（header → 值），保留檔案中的列號以便回報。
 * 列號以試算表方式計算：標題列為第 1 列，第一筆資料為第 2 列。
 */
public record RawRow(int rowIndex, Map<String, String> values) {

    public RawRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 取得欄位值，空白字串視為沒有值。
     */
    public String get(String header) {
        String value = values.get(header);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
