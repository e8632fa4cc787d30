package com.team.testcaseimport.service.azuredevops;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for adding test cases to Azure DevOps test suites.
 */
@Service
@Slf4j
public class TestSuiteService {

    private final WebClient webClient;

    public TestSuiteService(@Qualifier("azureDevOpsWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Add existing test case work items to a suite in a single call.
     * Azure DevOps adds the valid ids and silently ignores invalid ones.
     *
     * API: POST /{project}/_apis/test/Plans/{planId}/suites/{suiteId}/testcases/{ids}?api-version=7.1
     *
     * @return number of suite entries reported by the service
     */
    public Mono<Integer> addTestCasesToSuite(String project, int planId, int suiteId, List<Integer> testCaseIds) {
        String ids = testCaseIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        log.info("Adding {} test case(s) to suite {} in plan {}", testCaseIds.size(), suiteId, planId);

        return webClient.post()
                .uri("/{project}/_apis/test/Plans/{planId}/suites/{suiteId}/testcases/{ids}?api-version=7.1",
                        project, planId, suiteId, ids)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(response -> {
                    Object count = response.get("count");
                    return count instanceof Number ? ((Number) count).intValue() : 0;
                })
                .defaultIfEmpty(0)
                .doOnSuccess(count -> log.info("Suite {} accepted {} test case(s)", suiteId, count))
                .doOnError(e -> log.error("Failed to add test cases to suite {}: {}", suiteId, e.getMessage()));
    }
}
