package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.model.testcase.FieldCatalog;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import com.team.testcaseimport.model.testcase.MappingResult;
import com.team.testcaseimport.model.testcase.MappingStats;
import com.team.testcaseimport.model.testcase.ParsedFile;
import com.team.testcaseimport.model.testcase.RawRow;
import com.team.testcaseimport.util.HeaderNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 匯入流程第 4 階段：依欄位對應把每一列轉成 {@link MappedTestCase}。
 *
 * 固定欄位（標題、步驟、優先順序、區域路徑等）放進對應的屬性，
 * 其餘對應到的欄位原樣放進 extraFields，由 patch 建構時寫入。
 * 沒有標題的列會被排除並記錄錯誤，不影響其他列。
 */
@Component
@Slf4j
public class TestCaseProjector {

    public static final String IGNORE_IDS_WARNING =
            "ignoreIds=true: All IDs were removed; all rows will be created as new test cases.";

    static final String STEPS_FIELD = "Microsoft.VSTS.TCM.Steps";

    /**
     * 有專屬屬性的欄位（小寫比對）；這些欄位不會重複出現在 extraFields。
     */
    private static final Set<String> FIXED_FIELDS = Set.of(
            "system.id",
            "system.title",
            "microsoft.vsts.tcm.steps",
            "microsoft.vsts.common.priority",
            "system.areapath",
            "system.area path",
            "system.iterationpath",
            "system.iteration path",
            "system.description",
            "system.tags",
            "microsoft.vsts.tcm.automationstatus");

    /**
     * 套用欄位對應。
     *
     * @param parsed    已解析的檔案
     * @param mapping   標題 → reference name（依檔案標題順序）
     * @param catalog   欄位清單；非 fallback 時會略過清單中不存在的額外欄位
     * @param ignoreIds true 時移除所有 ID，全部列都會建立新的 Test Case
     */
    public MappingResult project(ParsedFile parsed, Map<String, String> mapping,
                                 FieldCatalog catalog, boolean ignoreIds) {
        MappingResult result = MappingResult.builder()
                .appliedMapping(new LinkedHashMap<>(mapping))
                .build();

        List<String> titleHeaders = headersMappedTo(mapping, FieldMappingEngine.TITLE_FIELD);
        if (titleHeaders.isEmpty()) {
            result.getErrors().add("Field mapping does not map any column to 'System.Title'");
            result.setStats(MappingStats.builder().totalRows(parsed.getRows().size()).build());
            return result;
        }

        StepColumns stepColumns = detectStepColumns(parsed.getHeaders(), mapping);
        Set<String> droppedExtras = new LinkedHashSet<>();
        int synthesized = 0;
        boolean anyIdRemoved = false;

        for (RawRow row : parsed.getRows()) {
            String title = firstValue(row, titleHeaders);
            if (title == null) {
                result.getErrors().add("Row " + row.rowIndex() + ": Title is empty; row was skipped");
                continue;
            }

            MappedTestCase testCase = MappedTestCase.builder()
                    .rowIndex(row.rowIndex())
                    .title(title)
                    .originalData(row)
                    .build();

            for (Map.Entry<String, String> entry : mapping.entrySet()) {
                String value = row.get(entry.getKey());
                if (value != null) {
                    applyField(testCase, entry.getValue(), value, catalog, droppedExtras, result.getWarnings());
                }
            }

            if (testCase.getSteps() == null && stepColumns != null) {
                String action = stepColumns.action() == null ? null : row.get(stepColumns.action());
                String expected = stepColumns.expected() == null ? null : row.get(stepColumns.expected());
                if (action != null || expected != null) {
                    if (containsPipe(action) || containsPipe(expected)) {
                        result.getErrors().add("Row " + row.rowIndex()
                                + ": step action/expected text must not contain '|'; row was skipped");
                        continue;
                    }
                    testCase.setSteps("1. " + nullToEmpty(action) + "|" + nullToEmpty(expected));
                    synthesized++;
                }
            }

            if (ignoreIds && testCase.hasId()) {
                testCase.setId(null);
                anyIdRemoved = true;
            }

            result.getMappedTestCases().add(testCase);
        }

        if (ignoreIds) {
            result.getWarnings().add(IGNORE_IDS_WARNING);
            log.debug("ignoreIds=true，是否有移除 ID：{}", anyIdRemoved);
        }
        if (synthesized > 0) {
            List<String> sources = new ArrayList<>();
            if (stepColumns.action() != null) {
                sources.add("'" + stepColumns.action() + "'");
            }
            if (stepColumns.expected() != null) {
                sources.add("'" + stepColumns.expected() + "'");
            }
            result.getWarnings().add(String.format("Steps were built from %s for %d row(s)",
                    String.join(" and ", sources), synthesized));
        }
        if (!droppedExtras.isEmpty()) {
            result.getWarnings().add("Fields not defined for this work item type were ignored: "
                    + String.join(", ", droppedExtras));
        }

        result.setStats(stats(parsed.getRows().size(), result.getMappedTestCases()));
        log.info("欄位對應完成：{} 筆中 {} 筆有效，{} 筆有 ID",
                result.getStats().getTotalRows(), result.getStats().getValidRows(), result.getStats().getRowsWithId());
        return result;
    }

    private void applyField(MappedTestCase testCase, String referenceName, String value,
                            FieldCatalog catalog, Set<String> droppedExtras, List<String> warnings) {
        switch (referenceName.toLowerCase(Locale.ROOT)) {
            case "system.title" -> {
                // 標題已由 titleHeaders 決定
            }
            case "system.id" -> {
                if (testCase.getId() == null) {
                    testCase.setId(value);
                }
            }
            case "microsoft.vsts.tcm.steps" -> testCase.setSteps(value);
            case "microsoft.vsts.common.priority" -> testCase.setPriority(parsePriority(testCase, value, warnings));
            case "system.areapath", "system.area path" -> testCase.setAreaPath(value);
            case "system.iterationpath", "system.iteration path" -> testCase.setIterationPath(value);
            case "system.description" -> testCase.setDescription(value);
            case "system.tags" -> testCase.setTags(value);
            case "microsoft.vsts.tcm.automationstatus" -> testCase.setAutomationStatus(value);
            default -> {
                if (catalog != null && !catalog.fallback() && !catalog.defines(referenceName)) {
                    droppedExtras.add(referenceName);
                } else {
                    testCase.getExtraFields().putIfAbsent(referenceName, value);
                }
            }
        }
    }

    private Integer parsePriority(MappedTestCase testCase, String value, List<String> warnings) {
        try {
            int priority = Integer.parseInt(value.trim());
            if (priority >= 1 && priority <= 4) {
                return priority;
            }
        } catch (NumberFormatException ignored) {
            // 不是數字，下面統一記錄警告
        }
        warnings.add("Row " + testCase.getRowIndex() + ": Priority '" + value
                + "' is not a number between 1 and 4 and was ignored");
        return null;
    }

    /**
     * 沒有任何欄位對應到 Steps 時，找出 "Step Action" / "Step Expected" 類的欄位用來組出單一步驟。
     */
    private StepColumns detectStepColumns(List<String> headers, Map<String, String> mapping) {
        boolean stepsMapped = mapping.values().stream().anyMatch(STEPS_FIELD::equalsIgnoreCase);
        if (stepsMapped) {
            return null;
        }

        String action = null;
        String expected = null;
        for (String header : headers) {
            String normalized = HeaderNormalizer.normalize(header);
            if (action == null && normalized.contains("stepaction")) {
                action = header;
            } else if (expected == null
                    && (normalized.contains("stepexpected") || normalized.contains("expectedresult"))) {
                expected = header;
            }
        }
        // 只有預期結果欄位時仍產生步驟，動作留空
        return action == null && expected == null ? null : new StepColumns(action, expected);
    }

    private MappingStats stats(int totalRows, List<MappedTestCase> mapped) {
        int withId = (int) mapped.stream().filter(MappedTestCase::hasId).count();
        return MappingStats.builder()
                .totalRows(totalRows)
                .validRows(mapped.size())
                .rowsWithId(withId)
                .rowsWithoutId(mapped.size() - withId)
                .build();
    }

    static List<String> headersMappedTo(Map<String, String> mapping, String referenceName) {
        List<String> headers = new ArrayList<>();
        mapping.forEach((header, ref) -> {
            if (referenceName.equalsIgnoreCase(ref)) {
                headers.add(header);
            }
        });
        return headers;
    }

    private String firstValue(RawRow row, List<String> headers) {
        for (String header : headers) {
            String value = row.get(header);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private boolean containsPipe(String value) {
        return value != null && value.indexOf('|') >= 0;
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record StepColumns(String action, String expected) {}
}
