package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import com.team.testcaseimport.model.testcase.MappingResult;
import com.team.testcaseimport.model.testcase.MappingStats;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImportPreviewGeneratorTest {

    private final ImportPreviewGenerator generator = new ImportPreviewGenerator(new BulkImportConfig());

    @Test
    void rendersStatisticsIssuesAndSamples() {
        List<MappedTestCase> cases = new ArrayList<>();
        cases.add(MappedTestCase.builder().rowIndex(2).title("Login").id("42").priority(1)
                .steps("1. " + "x".repeat(120) + "|done").build());
        for (int i = 3; i <= 8; i++) {
            cases.add(MappedTestCase.builder().rowIndex(i).title("Case " + i).build());
        }
        MappingResult result = MappingResult.builder()
                .mappedTestCases(cases)
                .errors(new ArrayList<>(List.of("Row 9: Title is empty; row was skipped")))
                .warnings(new ArrayList<>(List.of("Unmapped headers ignored: Notes")))
                .stats(MappingStats.builder().totalRows(8).validRows(7).rowsWithId(1).rowsWithoutId(6).build())
                .build();

        String preview = generator.generate(result);

        assertThat(preview).startsWith("## Test Case Import Preview")
                .contains("- Total rows processed: 8")
                .contains("- Test cases with ID (will be updated): 1")
                .contains("### Errors (1):\n- Row 9: Title is empty; row was skipped")
                .contains("### Warnings (1):")
                .contains("### Sample Test Cases (showing first 5):")
                .contains("**1. Login**")
                .contains("   - ID: 42 (will update existing)")
                .contains("... and 2 more test cases");
        String stepsLine = preview.lines().filter(l -> l.startsWith("   - Steps: ")).findFirst().orElseThrow();
        assertThat(stepsLine).hasSize("   - Steps: ".length() + 100 + 3).endsWith("...");
    }

    @Test
    void omitsEmptySections() {
        MappingResult result = MappingResult.builder()
                .mappedTestCases(List.of(MappedTestCase.builder().rowIndex(2).title("Only").build()))
                .stats(MappingStats.builder().totalRows(1).validRows(1).rowsWithoutId(1).build())
                .build();

        String preview = generator.generate(result);

        assertThat(preview).doesNotContain("### Errors").doesNotContain("### Warnings").doesNotContain("more test cases");
    }
}
