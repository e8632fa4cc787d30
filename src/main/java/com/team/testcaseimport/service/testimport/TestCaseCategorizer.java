package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.exception.WorkItemNotFoundException;
import com.team.testcaseimport.model.bulk.CategorizedTestCases;
import com.team.testcaseimport.model.bulk.OperationError;
import com.team.testcaseimport.model.bulk.OperationError.OperationKind;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import com.team.testcaseimport.service.azuredevops.WorkItemService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 匯入流程第 5 階段：決定每一列要建立還是更新。
 *
 * 沒有 ID → 建立；有 ID → 向 Azure DevOps 確認該 Work Item 存在且類型正確後更新。
 * 任何一列查詢失敗只會變成該列的 lookup 錯誤，不影響其他列。
 * 查詢並行數由 workflow.bulk-import.lookup-concurrency 控制（預設 1，逐筆查詢）。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TestCaseCategorizer {

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d+");

    private final WorkItemService workItemService;
    private final BulkImportConfig config;

    /**
     * @param testCases    已對應的列
     * @param project      project ID 或名稱
     * @param workItemType 更新時要求的 Work Item 類型
     * @return 建立清單、更新清單與 lookup 錯誤，各自維持輸入順序
     */
    public Mono<CategorizedTestCases> categorize(List<MappedTestCase> testCases, String project,
                                                 String workItemType) {
        int concurrency = Math.max(1, config.getLookupConcurrency());

        return Flux.fromIterable(testCases)
                .flatMapSequential(testCase -> decide(testCase, project, workItemType), concurrency)
                .collectList()
                .map(decisions -> {
                    CategorizedTestCases result = CategorizedTestCases.builder().build();
                    for (Decision decision : decisions) {
                        if (decision.error() != null) {
                            result.getErrors().add(decision.error());
                        } else if (decision.update()) {
                            result.getToUpdate().add(decision.testCase());
                        } else {
                            result.getToCreate().add(decision.testCase());
                        }
                    }
                    log.info("分類完成：{} 筆建立，{} 筆更新，{} 筆錯誤",
                            result.getToCreate().size(), result.getToUpdate().size(), result.getErrors().size());
                    return result;
                });
    }

    private Mono<Decision> decide(MappedTestCase testCase, String project, String workItemType) {
        if (!testCase.hasId()) {
            return Mono.just(Decision.create(testCase));
        }

        String rawId = testCase.getId().trim();
        Integer workItemId = parseId(rawId);
        if (workItemId == null) {
            return Mono.just(Decision.failed(lookupError(testCase, "Invalid test case ID: " + testCase.getId())));
        }

        return workItemService.getWorkItemType(project, workItemId)
                .map(type -> {
                    if (workItemType.equalsIgnoreCase(type)) {
                        return Decision.update(testCase.toBuilder().id(String.valueOf(workItemId)).build());
                    }
                    if (type.isEmpty()) {
                        return Decision.failed(lookupError(testCase, "Work item " + workItemId + " not found"));
                    }
                    return Decision.failed(lookupError(testCase, "Work item " + workItemId
                            + " exists but is not a " + workItemType + " (type: " + type + ")"));
                })
                .defaultIfEmpty(Decision.failed(lookupError(testCase, "Work item " + workItemId + " not found")))
                .onErrorResume(WorkItemNotFoundException.class, e -> Mono.just(Decision.failed(lookupError(testCase,
                        "Test case with ID " + testCase.getId() + " not found. Cannot update non-existent test case."))))
                .onErrorResume(e -> {
                    log.warn("查詢 Work Item #{} 失敗（第 {} 列）：{}", workItemId, testCase.getRowIndex(), e.getMessage());
                    return Mono.just(Decision.failed(lookupError(testCase,
                            "Error checking test case ID " + testCase.getId() + ": " + e.getMessage())));
                });
    }

    /**
     * 只接受純數字且在 int 範圍內的正整數 ID，其餘視為無效。
     */
    static Integer parseId(String rawId) {
        if (!NUMERIC_ID.matcher(rawId).matches()) {
            return null;
        }
        try {
            int id = Integer.parseInt(rawId);
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private OperationError lookupError(MappedTestCase testCase, String message) {
        return OperationError.builder()
                .originalRowIndex(testCase.getRowIndex())
                .title(testCase.getTitle())
                .operation(OperationKind.LOOKUP)
                .errorMessage(message)
                .originalId(testCase.getId())
                .build();
    }

    private record Decision(MappedTestCase testCase, boolean update, OperationError error) {

        static Decision create(MappedTestCase testCase) {
            return new Decision(testCase, false, null);
        }

        static Decision update(MappedTestCase testCase) {
            return new Decision(testCase, true, null);
        }

        static Decision failed(OperationError error) {
            return new Decision(null, false, error);
        }
    }
}
