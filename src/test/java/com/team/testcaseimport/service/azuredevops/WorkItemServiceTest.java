package com.team.testcaseimport.service.azuredevops;

import com.team.testcaseimport.exception.WorkItemNotFoundException;
import com.team.testcaseimport.model.patch.PatchOperation;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkItemServiceTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private WorkItemService serviceReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://dev.azure.com/org")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new WorkItemService(webClient);
    }

    @Test
    void readsWorkItemType() {
        WorkItemService service = serviceReturning(HttpStatus.OK,
                "{\"id\":42,\"fields\":{\"System.WorkItemType\":\"Test Case\"}}");

        StepVerifier.create(service.getWorkItemType("Proj", 42))
                .expectNext("Test Case")
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().getPath()).isEqualTo("/org/Proj/_apis/wit/workitems/42");
        assertThat(request.url().getQuery()).contains("fields=System.WorkItemType").contains("api-version=7.1");
    }

    @Test
    void missingTypeFieldIsEmptyString() {
        WorkItemService service = serviceReturning(HttpStatus.OK, "{\"id\":42}");

        StepVerifier.create(service.getWorkItemType("Proj", 42))
                .expectNext("")
                .verifyComplete();
    }

    @Test
    void notFoundBecomesWorkItemNotFoundException() {
        WorkItemService service = serviceReturning(HttpStatus.NOT_FOUND,
                "{\"message\":\"TF401232: Work item 7 does not exist\"}");

        StepVerifier.create(service.getWorkItemType("Proj", 7))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(WorkItemNotFoundException.class);
                    assertThat(((WorkItemNotFoundException) e).getWorkItemId()).isEqualTo(7);
                })
                .verify();
    }

    @Test
    void otherHttpErrorsPropagateUnchanged() {
        WorkItemService service = serviceReturning(HttpStatus.UNAUTHORIZED, "{}");

        StepVerifier.create(service.getWorkItemType("Proj", 7))
                .expectError(WebClientResponseException.Unauthorized.class)
                .verify();
    }

    @Test
    void createPostsJsonPatchAndReadsIdAndUrl() {
        WorkItemService service = serviceReturning(HttpStatus.OK,
                "{\"id\":501,\"url\":\"https://dev.azure.com/org/_apis/wit/workItems/501\"}");

        StepVerifier.create(service.createWorkItem("Proj", "Test Case",
                        List.of(PatchOperation.add("/fields/System.Title", "Login works"))))
                .assertNext(reference -> {
                    assertThat(reference.id()).isEqualTo(501);
                    assertThat(reference.url()).endsWith("/workItems/501");
                })
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/org/Proj/_apis/wit/workitems/$Test Case");
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.valueOf("application/json-patch+json"));
    }

    @Test
    void updateWithoutIdInResponseYieldsNullId() {
        WorkItemService service = serviceReturning(HttpStatus.OK, "{\"rev\":3}");

        StepVerifier.create(service.updateWorkItem("Proj", 9,
                        List.of(PatchOperation.replace("/fields/System.Title", "Renamed"))))
                .assertNext(reference -> assertThat(reference.id()).isNull())
                .verifyComplete();

        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.PATCH);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/org/Proj/_apis/wit/workitems/9");
    }
}
