package com.team.testcaseimport.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Azure DevOps 連線設定。
 * WebClient 只綁定到 organization 層級，project 由每次呼叫的路徑帶入，
 * 因為同一次匯入可以指定任意 project。
 */
@Configuration
@ConfigurationProperties(prefix = "azure-devops")
@Getter
@Setter
public class AzureDevOpsConfig {

    private String organization;
    private String pat;
    private String baseUrl = "https://dev.azure.com";

    @Bean(name = "azureDevOpsWebClient")
    public WebClient azureDevOpsWebClient() {
        String encodedPat = Base64.getEncoder()
                .encodeToString((":" + (pat != null ? pat : "")).getBytes(StandardCharsets.UTF_8));

        return WebClient.builder()
                .baseUrl(getOrganizationUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + encodedPat)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json")
                .build();
    }

    /**
     * Returns the organization-level base URL.
     * Format: https://dev.azure.com/{organization}
     */
    public String getOrganizationUrl() {
        return baseUrl + "/" + organization;
    }
}
