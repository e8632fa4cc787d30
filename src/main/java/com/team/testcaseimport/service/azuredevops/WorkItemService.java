package com.team.testcaseimport.service.azuredevops;

import com.team.testcaseimport.exception.WorkItemNotFoundException;
import com.team.testcaseimport.model.patch.PatchOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Azure DevOps Work Item 管理服務。
 * 提供大量匯入需要的三個操作：依 ID 查詢、建立、更新。
 *
 * 建立與更新都使用 JSON Patch 格式（application/json-patch+json）。
 */
@Service
@Slf4j
public class WorkItemService {

    public static final String WORK_ITEM_TYPE_FIELD = "System.WorkItemType";

    private static final MediaType JSON_PATCH = MediaType.valueOf("application/json-patch+json");

    private final WebClient webClient;

    public WorkItemService(@Qualifier("azureDevOpsWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * 依 ID 取得 Work Item，只要求指定的欄位以減少回應大小。
     * 404 轉成 {@link WorkItemNotFoundException}，其他錯誤原樣往上傳。
     *
     * @param project    project ID 或名稱
     * @param workItemId Work Item ID
     * @param fields     要取回的欄位 reference name
     * @return Work Item 的 fields 區塊
     */
    @SuppressWarnings("unchecked")
    public Mono<Map<String, Object>> getWorkItemFields(String project, int workItemId, List<String> fields) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/{project}/_apis/wit/workitems/{id}")
                        .queryParam("fields", String.join(",", fields))
                        .queryParam("api-version", "7.1")
                        .build(project, workItemId))
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(response -> {
                    Object workItemFields = response.get("fields");
                    return workItemFields instanceof Map
                            ? (Map<String, Object>) workItemFields
                            : Map.<String, Object>of();
                })
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new WorkItemNotFoundException(workItemId, e));
    }

    /**
     * 取得 Work Item 的類型（例如 "Test Case"、"Bug"）。
     */
    public Mono<String> getWorkItemType(String project, int workItemId) {
        return getWorkItemFields(project, workItemId, List.of(WORK_ITEM_TYPE_FIELD))
                .map(fields -> {
                    Object type = fields.get(WORK_ITEM_TYPE_FIELD);
                    return type != null ? type.toString() : "";
                });
    }

    /**
     * 建立指定類型的 Work Item。
     *
     * API：POST /{project}/_apis/wit/workitems/${type}?api-version=7.1
     */
    public Mono<WorkItemReference> createWorkItem(String project, String workItemType,
                                                  List<PatchOperation> patchDocument) {
        log.debug("正在建立 {}：{} 個欄位操作", workItemType, patchDocument.size());

        return webClient.post()
                .uri("/{project}/_apis/wit/workitems/${type}?api-version=7.1", project, workItemType)
                .contentType(JSON_PATCH)
                .bodyValue(patchDocument)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(this::toReference)
                .doOnError(e -> log.warn("建立 {} 失敗：{}", workItemType, e.getMessage()));
    }

    /**
     * 更新既有 Work Item。
     *
     * API：PATCH /{project}/_apis/wit/workitems/{id}?api-version=7.1
     */
    public Mono<WorkItemReference> updateWorkItem(String project, int workItemId,
                                                  List<PatchOperation> patchDocument) {
        log.debug("正在更新 Work Item #{}：{} 個欄位操作", workItemId, patchDocument.size());

        return webClient.patch()
                .uri("/{project}/_apis/wit/workitems/{id}?api-version=7.1", project, workItemId)
                .contentType(JSON_PATCH)
                .bodyValue(patchDocument)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(this::toReference)
                .doOnError(e -> log.warn("更新 Work Item #{} 失敗：{}", workItemId, e.getMessage()));
    }

    private WorkItemReference toReference(Map<String, Object> response) {
        Object id = response.get("id");
        Object url = response.get("url");
        return new WorkItemReference(
                id instanceof Number ? ((Number) id).intValue() : null,
                url != null ? url.toString() : null);
    }

    /**
     * 建立/更新後回傳的 Work Item 參照。id 為 null 代表回應中沒有 ID。
     */
    public record WorkItemReference(Integer id, String url) {}
}
