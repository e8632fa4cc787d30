package com.team.testcaseimport.service.azuredevops;

import com.team.testcaseimport.model.testcase.FieldDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Service for reading the field definitions of a work item type.
 */
@Service
@Slf4j
public class WorkItemFieldService {

    private final WebClient webClient;

    public WorkItemFieldService(@Qualifier("azureDevOpsWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * List every field defined on a work item type, custom fields included.
     *
     * API: GET /{project}/_apis/wit/workitemtypes/{type}/fields?api-version=7.1
     */
    public Mono<List<FieldDefinition>> listFields(String project, String workItemType) {
        log.info("Fetching field definitions for '{}' in project {}", workItemType, project);

        return webClient.get()
                .uri("/{project}/_apis/wit/workitemtypes/{type}/fields?api-version=7.1", project, workItemType)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(response -> toDefinitions(response, workItemType))
                .doOnSuccess(fields -> log.info("Retrieved {} field(s) for '{}'", fields.size(), workItemType))
                .doOnError(e -> log.error("Failed to fetch fields for '{}': {}", workItemType, e.getMessage()));
    }

    @SuppressWarnings("unchecked")
    private List<FieldDefinition> toDefinitions(Map<String, Object> response, String workItemType) {
        List<Map<String, Object>> values = (List<Map<String, Object>>) response.get("value");
        if (values == null || values.isEmpty()) {
            throw new IllegalStateException("No fields found for work item type: " + workItemType);
        }

        return values.stream()
                .map(field -> {
                    String referenceName = (String) field.get("referenceName");
                    String name = (String) field.get("name");
                    return FieldDefinition.builder()
                            .referenceName(referenceName != null ? referenceName : name)
                            .name(name != null ? name : referenceName)
                            .required(Boolean.TRUE.equals(field.get("alwaysRequired")))
                            .build();
                })
                .filter(field -> field.getReferenceName() != null)
                .toList();
    }
}
