package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.model.bulk.BulkOperationOptions;
import com.team.testcaseimport.model.bulk.CategorizedTestCases;
import com.team.testcaseimport.model.bulk.OperationError;
import com.team.testcaseimport.model.bulk.OperationError.OperationKind;
import com.team.testcaseimport.model.bulk.RowOutcome;
import com.team.testcaseimport.model.bulk.TestCaseResult;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import com.team.testcaseimport.service.azuredevops.WorkItemService;
import com.team.testcaseimport.service.azuredevops.WorkItemService.WorkItemReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 匯入流程第 6 階段：以批次方式建立/更新 Test Case。
 *
 * 建立清單與更新清單分別切成 batchSize 大小的批次：
 * 同一批次內的列同時送出（最多 batchSize 個請求），批次之間依序執行。
 * 因此任何時刻進行中的遠端請求不會超過 batchSize，每個清單共 ceil(n / batchSize) 輪。
 *
 * 單一列失敗只會產生該列的 {@link OperationError}，不會中斷所在批次或其他批次。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BulkTestCaseExecutor {

    private final WorkItemService workItemService;
    private final PatchDocumentBuilder patchDocumentBuilder;
    private final BulkImportConfig config;

    /**
     * 先處理建立清單，再處理更新清單。
     *
     * @return 每一列的結果，順序為建立清單在前、更新清單在後
     */
    public Mono<List<RowOutcome>> execute(CategorizedTestCases categorized, BulkOperationOptions options) {
        int batchSize = options.effectiveBatchSize(config.getMaxBatchSize());
        log.info("開始執行批次操作：{} 筆建立，{} 筆更新，batchSize={}",
                categorized.getToCreate().size(), categorized.getToUpdate().size(), batchSize);

        return runInBatches(categorized.getToCreate(), batchSize, testCase -> create(testCase, options))
                .concatWith(runInBatches(categorized.getToUpdate(), batchSize, testCase -> update(testCase, options)))
                .collectList();
    }

    private Flux<RowOutcome> runInBatches(List<MappedTestCase> partition, int batchSize, RowOperation operation) {
        return Flux.fromIterable(partition)
                .buffer(batchSize)
                .index()
                .concatMap(indexed -> {
                    List<MappedTestCase> batch = indexed.getT2();
                    log.debug("執行第 {} 批，共 {} 筆", indexed.getT1() + 1, batch.size());
                    // 這一批全部完成後才會開始下一批
                    return Flux.fromIterable(batch)
                            .flatMap(operation::apply, batchSize)
                            .collectList()
                            .flatMapIterable(outcomes -> outcomes);
                });
    }

    private Mono<RowOutcome> create(MappedTestCase testCase, BulkOperationOptions options) {
        return Mono.defer(() -> workItemService.createWorkItem(
                        options.getProject(), options.getWorkItemType(), patchDocumentBuilder.forCreate(testCase)))
                .map(reference -> toOutcome(testCase, reference, TestCaseResult.Operation.CREATED))
                .switchIfEmpty(Mono.fromSupplier(() -> failure(testCase, OperationKind.CREATE, null,
                        "Work item was created but no ID was returned")))
                .onErrorResume(e -> Mono.just(failure(testCase, OperationKind.CREATE, null,
                        messageOf(e, "Unknown error during creation"))));
    }

    private Mono<RowOutcome> update(MappedTestCase testCase, BulkOperationOptions options) {
        return Mono.defer(() -> workItemService.updateWorkItem(
                        options.getProject(), Integer.parseInt(testCase.getId()), patchDocumentBuilder.forUpdate(testCase)))
                .map(reference -> toOutcome(testCase, reference, TestCaseResult.Operation.UPDATED))
                .switchIfEmpty(Mono.fromSupplier(() -> failure(testCase, OperationKind.UPDATE, testCase.getId(),
                        "Work item update completed but no confirmation received")))
                .onErrorResume(e -> Mono.just(failure(testCase, OperationKind.UPDATE, testCase.getId(),
                        messageOf(e, "Unknown error during update"))));
    }

    private RowOutcome toOutcome(MappedTestCase testCase, WorkItemReference reference,
                                 TestCaseResult.Operation operation) {
        if (reference.id() == null) {
            return operation == TestCaseResult.Operation.CREATED
                    ? failure(testCase, OperationKind.CREATE, null, "Work item was created but no ID was returned")
                    : failure(testCase, OperationKind.UPDATE, testCase.getId(),
                            "Work item update completed but no confirmation received");
        }
        return RowOutcome.success(TestCaseResult.builder()
                .originalRowIndex(testCase.getRowIndex())
                .title(testCase.getTitle())
                .workItemId(reference.id())
                .url(reference.url())
                .operation(operation)
                .build());
    }

    private RowOutcome failure(MappedTestCase testCase, OperationKind kind, String originalId, String message) {
        log.warn("第 {} 列 {} 失敗：{}", testCase.getRowIndex(), kind.toJson(), message);
        return RowOutcome.failure(OperationError.builder()
                .originalRowIndex(testCase.getRowIndex())
                .title(testCase.getTitle())
                .operation(kind)
                .errorMessage(message)
                .originalId(originalId)
                .build());
    }

    private String messageOf(Throwable e, String fallback) {
        return e.getMessage() != null ? e.getMessage() : fallback;
    }

    @FunctionalInterface
    private interface RowOperation {
        Mono<RowOutcome> apply(MappedTestCase testCase);
    }
}
