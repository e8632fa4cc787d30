package com.team.testcaseimport.config;

import com.team.testcaseimport.model.testcase.FieldDefinition;
import com.team.testcaseimport.util.HeaderNormalizer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 欄位別名設定檔讀取器。
 * 從 field-aliases.yml 讀取「欄位 reference name → 常見 CSV 標題」的對應，
 * 同時作為遠端欄位清單取得失敗時的備用欄位清單。
 */
@Configuration
@Slf4j
public class FieldAliasConfig {

    static final String RESOURCE = "field-aliases.yml";

    @Bean
    public FieldAliases fieldAliases() {
        return load(RESOURCE);
    }

    /**
     * 從 classpath 載入指定的別名設定檔。
     * 檔案不存在時回傳空的別名表，讓欄位對應只靠分數比對。
     */
    static FieldAliases load(String resource) {
        try (InputStream inputStream = FieldAliasConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                log.warn("找不到 {}，使用空白別名表", resource);
                return new FieldAliases(List.of(), Map.of());
            }

            Map<String, Object> raw = new Yaml().load(inputStream);
            FieldAliases aliases = parse(raw);
            log.info("已載入 {} 個欄位、{} 個別名", aliases.getFallbackFields().size(), aliases.getAliases().size());
            return aliases;

        } catch (IOException e) {
            throw new IllegalStateException("載入 " + resource + " 失敗：" + e.getMessage(), e);
        }
    }

    /**
     * 將 YAML 原始 Map 解析為 FieldAliases。
     */
    @SuppressWarnings("unchecked")
    static FieldAliases parse(Map<String, Object> raw) {
        List<FieldDefinition> fields = new ArrayList<>();
        Map<String, String> aliases = new LinkedHashMap<>();

        if (raw == null || !raw.containsKey("fields")) {
            return new FieldAliases(fields, aliases);
        }

        List<Map<String, Object>> fieldList = (List<Map<String, Object>>) raw.get("fields");
        for (Map<String, Object> fieldMap : fieldList) {
            String referenceName = (String) fieldMap.get("reference-name");
            fields.add(FieldDefinition.builder()
                    .referenceName(referenceName)
                    .name((String) fieldMap.getOrDefault("name", HeaderNormalizer.referenceTail(referenceName)))
                    .required(Boolean.TRUE.equals(fieldMap.get("required")))
                    .build());

            List<String> fieldAliases = (List<String>) fieldMap.getOrDefault("aliases", List.of());
            for (String alias : fieldAliases) {
                String normalized = HeaderNormalizer.normalize(alias);
                // 同一個別名只認第一個欄位
                if (!normalized.isEmpty() && !aliases.containsKey(normalized)) {
                    aliases.put(normalized, referenceName);
                }
            }
        }

        return new FieldAliases(fields, aliases);
    }

    /**
     * 已正規化的別名表（別名 → reference name）與備用欄位清單。
     */
    @Getter
    public static class FieldAliases {

        private final List<FieldDefinition> fallbackFields;
        private final Map<String, String> aliases;

        public FieldAliases(List<FieldDefinition> fallbackFields, Map<String, String> aliases) {
            this.fallbackFields = Collections.unmodifiableList(new ArrayList<>(fallbackFields));
            this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        }

        /**
         * 以正規化後的標題查詢別名，找不到時回傳 null。
         */
        public String lookup(String normalizedHeader) {
            return aliases.get(normalizedHeader);
        }
    }
}
