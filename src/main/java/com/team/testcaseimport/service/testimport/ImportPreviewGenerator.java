package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import com.team.testcaseimport.model.testcase.MappingResult;
import com.team.testcaseimport.model.testcase.MappingStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 產生給使用者確認用的 Markdown 預覽：統計、錯誤、警告與前幾筆 Test Case。
 */
@Component
@RequiredArgsConstructor
public class ImportPreviewGenerator {

    private static final int MAX_STEPS_LENGTH = 100;

    private final BulkImportConfig config;

    public String generate(MappingResult mappingResult) {
        MappingStats stats = mappingResult.getStats();
        StringBuilder sb = new StringBuilder();

        sb.append("## Test Case Import Preview\n\n");

        sb.append("### Statistics:\n");
        sb.append("- Total rows processed: ").append(stats.getTotalRows()).append("\n");
        sb.append("- Valid test cases: ").append(stats.getValidRows()).append("\n");
        sb.append("- Test cases with ID (will be updated): ").append(stats.getRowsWithId()).append("\n");
        sb.append("- Test cases without ID (will be created): ").append(stats.getRowsWithoutId()).append("\n\n");

        appendList(sb, "Errors", mappingResult.getErrors());
        appendList(sb, "Warnings", mappingResult.getWarnings());

        List<MappedTestCase> testCases = mappingResult.getMappedTestCases();
        int maxRows = Math.max(0, config.getPreviewRows());
        if (!testCases.isEmpty() && maxRows > 0) {
            int shown = Math.min(maxRows, testCases.size());
            sb.append("### Sample Test Cases (showing first ").append(shown).append("):\n\n");

            for (int i = 0; i < shown; i++) {
                MappedTestCase testCase = testCases.get(i);
                sb.append("**").append(i + 1).append(". ").append(testCase.getTitle()).append("**\n");
                if (testCase.hasId()) {
                    sb.append("   - ID: ").append(testCase.getId()).append(" (will update existing)\n");
                }
                if (testCase.getPriority() != null) {
                    sb.append("   - Priority: ").append(testCase.getPriority()).append("\n");
                }
                if (testCase.getAreaPath() != null) {
                    sb.append("   - Area Path: ").append(testCase.getAreaPath()).append("\n");
                }
                if (testCase.getSteps() != null) {
                    sb.append("   - Steps: ").append(truncate(testCase.getSteps())).append("\n");
                }
                sb.append("\n");
            }

            if (testCases.size() > shown) {
                sb.append("... and ").append(testCases.size() - shown).append(" more test cases\n\n");
            }
        }

        return sb.toString();
    }

    private void appendList(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("### ").append(heading).append(" (").append(items.size()).append("):\n");
        items.forEach(item -> sb.append("- ").append(item).append("\n"));
        sb.append("\n");
    }

    private String truncate(String steps) {
        return steps.length() > MAX_STEPS_LENGTH ? steps.substring(0, MAX_STEPS_LENGTH) + "..." : steps;
    }
}
