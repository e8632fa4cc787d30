package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.config.FieldAliasConfig;
import com.team.testcaseimport.config.FieldAliasConfig.FieldAliases;
import com.team.testcaseimport.model.bulk.BulkOperationResult;
import com.team.testcaseimport.model.bulk.OperationError;
import com.team.testcaseimport.model.dto.BulkImportRequest;
import com.team.testcaseimport.model.dto.BulkImportResponse;
import com.team.testcaseimport.model.dto.FieldMappingSuggestionResponse;
import com.team.testcaseimport.model.dto.RowSummary;
import com.team.testcaseimport.model.dto.SuggestFieldMappingRequest;
import com.team.testcaseimport.model.testcase.FieldDefinition;
import com.team.testcaseimport.service.azuredevops.TestSuiteService;
import com.team.testcaseimport.service.azuredevops.WorkItemFieldService;
import com.team.testcaseimport.service.azuredevops.WorkItemService;
import com.team.testcaseimport.service.azuredevops.WorkItemService.WorkItemReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkImportOrchestratorTest {

    @Mock
    private WorkItemService workItemService;

    @Mock
    private WorkItemFieldService fieldService;

    @Mock
    private TestSuiteService testSuiteService;

    private BulkImportOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        BulkImportConfig config = new BulkImportConfig();
        FieldAliases aliases = new FieldAliasConfig().fieldAliases();
        BulkResultAggregator aggregator = new BulkResultAggregator();

        orchestrator = new BulkImportOrchestrator(
                config,
                new CsvFileParser(config),
                new FieldCatalogCache(fieldService, aliases, config),
                new FieldMappingEngine(aliases, config),
                new TestCaseProjector(),
                new TestCaseCategorizer(workItemService, config),
                new BulkTestCaseExecutor(workItemService, new PatchDocumentBuilder(), config),
                aggregator,
                new SuiteEnrollmentService(testSuiteService, aggregator),
                new ImportPreviewGenerator(config));
    }

    private void stubCatalog() {
        when(fieldService.listFields("Proj", "Test Case")).thenReturn(Mono.just(List.of(
                FieldDefinition.builder().referenceName("System.Id").name("ID").build(),
                FieldDefinition.builder().referenceName("System.Title").name("Title").required(true).build(),
                FieldDefinition.builder().referenceName("Microsoft.VSTS.TCM.Steps").name("Steps").build(),
                FieldDefinition.builder().referenceName("Microsoft.VSTS.Common.Priority").name("Priority").build())));
    }

    private static String base64(String csv) {
        return Base64.getEncoder().encodeToString(csv.getBytes(StandardCharsets.UTF_8));
    }

    private static BulkImportRequest.BulkImportRequestBuilder request(String csv) {
        return BulkImportRequest.builder()
                .project("Proj")
                .fileName("cases.csv")
                .fileContent(base64(csv));
    }

    private void stubCreateWithSequentialIds() {
        AtomicInteger ids = new AtomicInteger(1000);
        when(workItemService.createWorkItem(eq("Proj"), eq("Test Case"), anyList()))
                .thenAnswer(invocation -> Mono.just(new WorkItemReference(ids.incrementAndGet(), null)));
    }

    @Test
    void createsNewTestCase() {
        stubCatalog();
        stubCreateWithSequentialIds();

        BulkImportRequest request = request("Title,Steps\nLogin works,1. Open app|App launches\n")
                .batchSize(10)
                .build();

        StepVerifier.create(orchestrator.importTestCases(request))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isTrue();
                    assertThat(response.getStage()).isEqualTo(BulkImportResponse.STAGE_COMPLETED);
                    BulkOperationResult result = response.getBulkOperationResult();
                    assertThat(result.getCreated()).singleElement().satisfies(created -> {
                        assertThat(created.getWorkItemId()).isEqualTo(1001);
                        assertThat(created.getTitle()).isEqualTo("Login works");
                    });
                    assertThat(result.getUpdated()).isEmpty();
                    assertThat(result.getErrors()).isEmpty();
                    assertThat(result.getSummary().getTotalProcessed()).isEqualTo(1);
                    assertThat(response.getPreview()).startsWith("## Test Case Import Preview");
                })
                .verifyComplete();
    }

    @Test
    void idOfDifferentWorkItemTypeIsAnErrorAndNeverWritten() {
        stubCatalog();
        when(workItemService.getWorkItemType("Proj", 12345)).thenReturn(Mono.just("Bug"));

        BulkImportRequest request = request("Id,Title,Steps\n12345,Login works,1. Open app|App launches\n").build();

        StepVerifier.create(orchestrator.importTestCases(request))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isFalse();
                    BulkOperationResult result = response.getBulkOperationResult();
                    assertThat(result.getCreated()).isEmpty();
                    assertThat(result.getUpdated()).isEmpty();
                    assertThat(result.getErrors()).singleElement().satisfies(error -> {
                        assertThat(error.getOriginalRowIndex()).isEqualTo(2);
                        assertThat(error.getErrorMessage()).contains("exists but is not a Test Case");
                    });
                    assertThat(response.getOperationErrors()).hasSize(1);
                })
                .verifyComplete();

        verify(workItemService, never()).createWorkItem(anyString(), anyString(), anyList());
        verify(workItemService, never()).updateWorkItem(anyString(), anyInt(), anyList());
    }

    @Test
    void ignoreIdsCreatesEveryRow() {
        stubCatalog();
        stubCreateWithSequentialIds();

        BulkImportRequest request = request("Id,Title\n11,First\n12,Second\n13,Third\n")
                .ignoreIds(true)
                .build();

        StepVerifier.create(orchestrator.importTestCases(request))
                .assertNext(response -> {
                    BulkOperationResult result = response.getBulkOperationResult();
                    assertThat(result.getCreated()).hasSize(3);
                    assertThat(result.getUpdated()).isEmpty();
                    assertThat(response.getMappingWarnings()).contains(TestCaseProjector.IGNORE_IDS_WARNING);
                })
                .verifyComplete();

        verify(workItemService, never()).getWorkItemType(anyString(), anyInt());
        verify(workItemService, times(3)).createWorkItem(eq("Proj"), eq("Test Case"), anyList());
    }

    @Test
    void previewOnlyNeverWritesButReportsProblems() {
        stubCatalog();
        when(workItemService.getWorkItemType("Proj", 77)).thenReturn(Mono.just("Test Case"));
        when(workItemService.getWorkItemType("Proj", 88)).thenReturn(Mono.just("Bug"));

        BulkImportRequest request = request("Id,Title,Priority\n,New case,2\n77,Existing,9\n88,Wrong type,1\n")
                .previewOnly(true)
                .build();

        StepVerifier.create(orchestrator.importTestCases(request))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isFalse();
                    assertThat(response.getStage()).isEqualTo(BulkImportResponse.STAGE_PREVIEW);
                    assertThat(response.getBulkOperationResult()).isNull();
                    assertThat(response.getErrors())
                            .containsExactly("Row 4: Work item 88 exists but is not a Test Case (type: Bug)");
                    assertThat(response.getWarnings()).anyMatch(w -> w.startsWith("Row 3: Priority '9'"));
                    assertThat(response.getMappedTestCases())
                            .extracting(RowSummary::getPlannedOperation)
                            .containsExactly("create", "update", "error");
                    assertThat(response.getStats().getRowsWithId()).isEqualTo(2);
                    assertThat(response.getPreview()).contains("### Sample Test Cases");
                })
                .verifyComplete();

        verify(workItemService, never()).createWorkItem(anyString(), anyString(), anyList());
        verify(workItemService, never()).updateWorkItem(anyString(), anyInt(), anyList());
    }

    @Test
    void excelFileStopsAtFileParsing() {
        BulkImportRequest request = BulkImportRequest.builder()
                .project("Proj")
                .fileName("cases.xlsx")
                .fileContent(base64("whatever"))
                .build();

        StepVerifier.create(orchestrator.importTestCases(request))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isFalse();
                    assertThat(response.getStage()).isEqualTo(BulkImportResponse.STAGE_FILE_PARSING);
                    assertThat(response.getErrors()).isNotEmpty();
                })
                .verifyComplete();

        verify(fieldService, never()).listFields(anyString(), anyString());
    }

    @Test
    void rowsWithoutTitlesStopAtFieldMapping() {
        stubCatalog();

        BulkImportRequest request = request("Title,Steps\n,1. Something\n  ,2. Other\n").build();

        StepVerifier.create(orchestrator.importTestCases(request))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isFalse();
                    assertThat(response.getStage()).isEqualTo(BulkImportResponse.STAGE_FIELD_MAPPING);
                    assertThat(response.getErrors()).containsExactly(
                            "Row 2: Title is empty; row was skipped",
                            "Row 3: Title is empty; row was skipped");
                    assertThat(response.getStats().getTotalRows()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    void unexpectedFailureAfterExecutionMarksAllRowsFailed() {
        stubCatalog();
        stubCreateWithSequentialIds();
        when(testSuiteService.addTestCasesToSuite(anyString(), anyInt(), anyInt(), anyList()))
                .thenThrow(new IllegalStateException("client shut down"));

        BulkImportRequest request = request("Title\nA\nB\n")
                .addToSuite(true)
                .planId(1)
                .suiteId(2)
                .build();

        StepVerifier.create(orchestrator.importTestCases(request))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isFalse();
                    assertThat(response.getStage()).isEqualTo(BulkImportResponse.STAGE_COMPLETED);
                    BulkOperationResult result = response.getBulkOperationResult();
                    assertThat(result.getSummary().getFailures()).isEqualTo(2);
                    assertThat(result.getErrors()).singleElement()
                            .extracting(OperationError::getErrorMessage)
                            .isEqualTo("Fatal error during bulk operation: client shut down");
                })
                .verifyComplete();
    }

    @Test
    void unexpectedFailureBeforeExecutionIsFatalError() {
        when(fieldService.listFields("Proj", "Test Case")).thenThrow(new IllegalStateException("no connection pool"));

        StepVerifier.create(orchestrator.importTestCases(request("Title\nA\n").build()))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isFalse();
                    assertThat(response.getStage()).isEqualTo(BulkImportResponse.STAGE_FATAL_ERROR);
                    assertThat(response.getError()).isEqualTo("no connection pool");
                })
                .verifyComplete();
    }

    @Test
    void suggestionUsesFallbackCatalogWhenFieldsCannotBeLoaded() {
        when(fieldService.listFields("Proj", "Test Case"))
                .thenReturn(Mono.error(new IllegalStateException("401 Unauthorized")));

        SuggestFieldMappingRequest request = SuggestFieldMappingRequest.builder()
                .project("Proj")
                .fileName("cases.csv")
                .fileContent(base64("Test Case Title,Test Steps,Reviewer\nA,1. B,C\n"))
                .build();

        StepVerifier.create(orchestrator.suggestFieldMapping(request))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isTrue();
                    assertThat(response.getStage()).isEqualTo("suggestion");
                    assertThat(response.getFallbackCatalog()).isTrue();
                    assertThat(response.getSuggestedMapping())
                            .containsEntry("Test Case Title", "System.Title")
                            .containsEntry("Test Steps", "Microsoft.VSTS.TCM.Steps");
                    assertThat(response.getUnmappedHeaders()).containsExactly("Reviewer");
                    assertThat(response.getNote()).isEqualTo(BulkImportOrchestrator.SUGGESTION_NOTE);
                    assertThat(response.getWarnings()).anyMatch(w -> w.contains("common Test Case fields"));
                })
                .verifyComplete();
    }

    @Test
    void suggestionReportsFileParsingFailure() {
        SuggestFieldMappingRequest request = SuggestFieldMappingRequest.builder()
                .project("Proj")
                .fileName("cases.xls")
                .fileContent(base64("x"))
                .build();

        FieldMappingSuggestionResponse response = orchestrator.suggestFieldMapping(request).block();

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getStage()).isEqualTo(BulkImportResponse.STAGE_FILE_PARSING);
        assertThat(response.getErrors()).isNotEmpty();
    }
}
