package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.model.bulk.BulkOperationOptions;
import com.team.testcaseimport.model.bulk.BulkOperationResult;
import com.team.testcaseimport.model.bulk.OperationError;
import com.team.testcaseimport.model.bulk.OperationError.OperationKind;
import com.team.testcaseimport.model.bulk.TestCaseResult;
import com.team.testcaseimport.service.azuredevops.TestSuiteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Stream;

/**
 * 匯入流程第 8 階段：把成功建立或更新的 Test Case 一次加入指定的 Test Suite。
 *
 * 加入失敗不會讓已完成的建立/更新失效，只會多一筆 operation=suite 的錯誤。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SuiteEnrollmentService {

    static final String SUITE_ERROR_TITLE = "Suite Addition";

    private final TestSuiteService testSuiteService;
    private final BulkResultAggregator aggregator;

    public Mono<BulkOperationResult> enroll(BulkOperationResult result, BulkOperationOptions options) {
        if (!options.shouldEnrollInSuite()) {
            return Mono.just(result);
        }

        List<Integer> ids = Stream.concat(result.getCreated().stream(), result.getUpdated().stream())
                .map(TestCaseResult::getWorkItemId)
                .toList();
        if (ids.isEmpty()) {
            log.info("沒有成功的 Test Case，略過加入 Suite {}", options.getSuiteId());
            return Mono.just(result);
        }

        return testSuiteService.addTestCasesToSuite(options.getProject(), options.getPlanId(), options.getSuiteId(), ids)
                .map(count -> result)
                .onErrorResume(e -> {
                    log.warn("加入 Suite {} 失敗，已完成的 Test Case 不受影響：{}", options.getSuiteId(), e.getMessage());
                    aggregator.addError(result, OperationError.builder()
                            .originalRowIndex(0)
                            .title(SUITE_ERROR_TITLE)
                            .operation(OperationKind.SUITE)
                            .errorMessage("Failed to add test cases to suite " + options.getSuiteId() + ": "
                                    + (e.getMessage() != null ? e.getMessage() : "Unknown error"))
                            .build());
                    return Mono.just(result);
                })
                .defaultIfEmpty(result);
    }
}
