package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.config.FieldAliasConfig.FieldAliases;
import com.team.testcaseimport.model.testcase.FieldCatalog;
import com.team.testcaseimport.service.azuredevops.WorkItemFieldService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 匯入流程第 2 階段：Work Item 類型欄位清單的快取，以 (project, workItemType) 為鍵。
 *
 * 生命週期：建構時指定 TTL → getOrFetch 取得或向遠端查詢 → invalidate 明確清除。
 * 遠端查詢失敗時回傳內建的常用欄位（fallback），fallback 不寫入快取，下次會再試一次。
 */
@Component
@Slf4j
public class FieldCatalogCache {

    private final WorkItemFieldService fieldService;
    private final FieldAliases fieldAliases;
    private final Duration ttl;
    private final Clock clock;
    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

    @Autowired
    public FieldCatalogCache(WorkItemFieldService fieldService, FieldAliases fieldAliases, BulkImportConfig config) {
        this(fieldService, fieldAliases, config.getFieldCatalogTtl(), Clock.systemUTC());
    }

    public FieldCatalogCache(WorkItemFieldService fieldService, FieldAliases fieldAliases,
                             Duration ttl, Clock clock) {
        this.fieldService = fieldService;
        this.fieldAliases = fieldAliases;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * 取得欄位清單；快取未命中或已過期時向 Azure DevOps 查詢。
     */
    public Mono<FieldCatalog> getOrFetch(String project, String workItemType) {
        CacheKey key = new CacheKey(project, workItemType);
        CacheEntry cached = entries.get(key);
        if (cached != null && !cached.isExpired(clock.instant())) {
            log.debug("欄位清單快取命中：{}", key);
            return Mono.just(cached.catalog());
        }

        return fieldService.listFields(project, workItemType)
                .map(fields -> {
                    FieldCatalog catalog = new FieldCatalog(project, workItemType, fields, false);
                    entries.put(key, new CacheEntry(catalog, clock.instant().plus(ttl)));
                    return catalog;
                })
                .onErrorResume(e -> {
                    log.warn("無法取得 {} 的欄位清單，改用內建欄位：{}", key, e.getMessage());
                    return Mono.just(new FieldCatalog(project, workItemType, fieldAliases.getFallbackFields(), true));
                });
    }

    public void invalidate(String project, String workItemType) {
        if (entries.remove(new CacheKey(project, workItemType)) != null) {
            log.info("已清除欄位清單快取：{} / {}", project, workItemType);
        }
    }

    public void invalidateAll() {
        int size = entries.size();
        entries.clear();
        log.info("已清除全部欄位清單快取（{} 筆）", size);
    }

    public int size() {
        return entries.size();
    }

    /**
     * 定期移除過期的快取項目。
     */
    @Scheduled(fixedDelayString = "${workflow.bulk-import.field-catalog-eviction-interval-ms:300000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("已移除 {} 筆過期的欄位清單快取", removed);
        }
    }

    private record CacheKey(String project, String workItemType) {
        @Override
        public String toString() {
            return project + ":" + workItemType;
        }
    }

    private record CacheEntry(FieldCatalog catalog, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
