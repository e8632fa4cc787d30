package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.BulkImportConfig;
import com.team.testcaseimport.config.FieldAliasConfig.FieldAliases;
import com.team.testcaseimport.model.testcase.FieldCatalog;
import com.team.testcaseimport.model.testcase.FieldDefinition;
import com.team.testcaseimport.model.testcase.FieldMappingSuggestion;
import com.team.testcaseimport.model.testcase.FieldMappingSuggestion.Candidate;
import com.team.testcaseimport.model.testcase.MappingSuggestionResult;
import com.team.testcaseimport.util.HeaderNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 匯入流程第 3 階段：CSV 標題 → Work Item 欄位 reference name 的對應。
 *
 * 兩種模式：
 * 1. 建議模式：以別名表與分數比對，為每個標題挑出最高分且超過門檻的欄位。
 *    結果只是建議，除非呼叫端把它當成 fieldMapping 傳回匯入 API，否則不影響匯入。
 * 2. 明確模式：呼叫端提供的對應原樣使用，完全不做比對。
 *
 * 分數比對是純函式，不呼叫任何遠端 API；相同的標題與欄位清單一定得到相同結果。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FieldMappingEngine {

    public static final String TITLE_FIELD = "System.Title";

    private static final int FALLBACK_TITLE_CONFIDENCE = 60;
    private static final int AMBIGUITY_WINDOW = 5;
    private static final int AMBIGUOUS_AUTO_APPLY = 90;
    private static final int MAX_CANDIDATES = 5;

    private final FieldAliases fieldAliases;
    private final BulkImportConfig config;

    /**
     * 為每個標題產生欄位對應建議。
     */
    public MappingSuggestionResult suggest(List<String> headers, FieldCatalog catalog) {
        MappingSuggestionResult result = MappingSuggestionResult.builder()
                .headers(new ArrayList<>(headers))
                .build();

        Map<String, FieldMappingSuggestion> byHeader = new LinkedHashMap<>();
        for (String header : headers) {
            FieldMappingSuggestion suggestion = suggestForHeader(header, catalog.fields());
            byHeader.put(header, suggestion);
            if (isAutoApplied(suggestion)) {
                result.getSuggestedMapping().put(header, suggestion.getSuggestedReferenceName());
            }
        }

        applyTitleFallback(headers, byHeader, result.getSuggestedMapping());

        result.getSuggestions().addAll(byHeader.values());
        for (String header : headers) {
            if (!result.getSuggestedMapping().containsKey(header)) {
                result.getUnmappedHeaders().add(header);
            }
        }

        log.debug("欄位對應建議：{} 個標題，{} 個已對應，{} 個未對應",
                headers.size(), result.getSuggestedMapping().size(), result.getUnmappedHeaders().size());
        return result;
    }

    /**
     * 決定這次匯入實際使用的對應。
     * 有明確對應時原樣採用（只略過檔案中不存在的標題）；否則採用建議模式的自動對應。
     */
    public ResolvedMapping resolve(List<String> headers, FieldCatalog catalog, Map<String, String> explicitMapping) {
        List<String> warnings = new ArrayList<>();
        Map<String, String> mapping = new LinkedHashMap<>();

        if (explicitMapping != null && !explicitMapping.isEmpty()) {
            explicitMapping.forEach((header, referenceName) -> {
                if (!headers.contains(header)) {
                    warnings.add("Mapped header '" + header + "' was not found in the file and was ignored");
                } else if (referenceName == null || referenceName.isBlank()) {
                    warnings.add("Mapped header '" + header + "' has no field reference name and was ignored");
                } else {
                    mapping.put(header, referenceName.trim());
                }
            });
            if (!mapping.isEmpty()) {
                warnings.add("Dynamic field mapping applied: " + describe(mapping));
            }
            return new ResolvedMapping(orderByHeaders(mapping, headers), warnings, true);
        }

        MappingSuggestionResult suggestion = suggest(headers, catalog);
        mapping.putAll(suggestion.getSuggestedMapping());
        if (!mapping.isEmpty()) {
            warnings.add("Field mappings detected: " + describe(mapping));
        }
        if (!suggestion.getUnmappedHeaders().isEmpty()) {
            warnings.add("Unmapped headers ignored: " + String.join(", ", suggestion.getUnmappedHeaders()));
        }
        return new ResolvedMapping(mapping, warnings, false);
    }

    private FieldMappingSuggestion suggestForHeader(String header, List<FieldDefinition> fields) {
        String normalized = HeaderNormalizer.normalize(header);
        if (normalized.isEmpty()) {
            return unmatched(header);
        }

        String singular = HeaderNormalizer.singularize(normalized);

        String alias = fieldAliases.lookup(normalized);
        if (alias != null) {
            return FieldMappingSuggestion.builder()
                    .header(header).suggestedReferenceName(alias)
                    .confidence(100).reason("Direct synonym match")
                    .build();
        }
        String singularAlias = singular.equals(normalized) ? null : fieldAliases.lookup(singular);
        if (singularAlias != null) {
            return FieldMappingSuggestion.builder()
                    .header(header).suggestedReferenceName(singularAlias)
                    .confidence(95).reason("Singular synonym match")
                    .build();
        }

        List<Candidate> candidates = new ArrayList<>();
        FieldDefinition bestField = null;
        int bestScore = 0;
        for (FieldDefinition field : fields) {
            int score = score(normalized, singular, field);
            if (score > 0) {
                candidates.add(new Candidate(field.getReferenceName(), field.getName(), score));
                // 同分時保留欄位清單中較前面的欄位
                if (score > bestScore) {
                    bestScore = score;
                    bestField = field;
                }
            }
        }

        if (bestField == null || bestScore < config.getSuggestionThreshold()) {
            return unmatched(header);
        }

        int top = bestScore;
        List<Candidate> close = candidates.stream()
                .filter(c -> top - c.score() <= AMBIGUITY_WINDOW)
                .sorted(Comparator.comparingInt(Candidate::score).reversed()
                        .thenComparing(Candidate::referenceName))
                .limit(MAX_CANDIDATES)
                .toList();

        FieldMappingSuggestion.FieldMappingSuggestionBuilder builder = FieldMappingSuggestion.builder()
                .header(header)
                .suggestedReferenceName(bestField.getReferenceName())
                .confidence(bestScore);
        if (close.size() > 1) {
            return builder.candidates(close).reason("Multiple close matches").build();
        }
        return builder.reason("Best heuristic match").build();
    }

    /**
     * 標題與單一欄位的相似度分數（0 代表不相關）。
     *
     * 完全等於顯示名稱 100、等於 reference name 尾段 95、單數形式相等 90、
     * 包含顯示名稱 80、包含尾段 78、編輯距離 1 為 75、編輯距離 2 為 70。
     */
    static int score(String normalizedHeader, String singularHeader, FieldDefinition field) {
        String name = HeaderNormalizer.normalize(field.getName());
        String tail = HeaderNormalizer.normalize(HeaderNormalizer.referenceTail(field.getReferenceName()));

        int score = 0;
        if (normalizedHeader.equals(name)) {
            score = Math.max(score, 100);
        }
        if (normalizedHeader.equals(tail)) {
            score = Math.max(score, 95);
        }
        if (singularHeader.equals(name) || singularHeader.equals(tail)) {
            score = Math.max(score, 90);
        }
        if (!name.isEmpty() && (name.contains(normalizedHeader) || normalizedHeader.contains(name))) {
            score = Math.max(score, 80);
        }
        if (!tail.isEmpty() && (tail.contains(normalizedHeader) || normalizedHeader.contains(tail))) {
            score = Math.max(score, 78);
        }

        int distance = Math.min(
                HeaderNormalizer.editDistance(normalizedHeader, name),
                HeaderNormalizer.editDistance(normalizedHeader, tail));
        if (distance == 1) {
            score = Math.max(score, 75);
        } else if (distance == 2) {
            score = Math.max(score, 70);
        }
        return score;
    }

    /**
     * 沒有任何標題對應到 System.Title 時，挑第一個看起來像標題的欄位。
     */
    private void applyTitleFallback(List<String> headers, Map<String, FieldMappingSuggestion> byHeader,
                                    Map<String, String> suggestedMapping) {
        boolean hasTitle = suggestedMapping.values().stream().anyMatch(TITLE_FIELD::equalsIgnoreCase);
        if (hasTitle) {
            return;
        }

        // 已對應到其他欄位的標題不列入
        Optional<String> titleLike = headers.stream()
                .filter(h -> !suggestedMapping.containsKey(h))
                .filter(h -> CsvFileParser.TITLE_LIKE_HEADER.matcher(h).find())
                .findFirst();
        titleLike.ifPresent(header -> {
            byHeader.put(header, FieldMappingSuggestion.builder()
                    .header(header).suggestedReferenceName(TITLE_FIELD)
                    .confidence(FALLBACK_TITLE_CONFIDENCE).reason("Fallback title heuristic")
                    .build());
            suggestedMapping.put(header, TITLE_FIELD);
        });
    }

    private boolean isAutoApplied(FieldMappingSuggestion suggestion) {
        if (suggestion.getSuggestedReferenceName() == null) {
            return false;
        }
        // 多個候選分數接近時，只有高信心才自動套用
        return suggestion.getCandidates() == null || suggestion.getConfidence() >= AMBIGUOUS_AUTO_APPLY;
    }

    private FieldMappingSuggestion unmatched(String header) {
        return FieldMappingSuggestion.builder()
                .header(header).confidence(0).reason("No confident match found")
                .build();
    }

    private Map<String, String> orderByHeaders(Map<String, String> mapping, List<String> headers) {
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String header : headers) {
            if (mapping.containsKey(header)) {
                ordered.put(header, mapping.get(header));
            }
        }
        return ordered;
    }

    private String describe(Map<String, String> mapping) {
        List<String> pairs = new ArrayList<>();
        mapping.forEach((header, referenceName) -> pairs.add(header + " -> " + referenceName));
        return String.join(", ", pairs);
    }

    /**
     * 這次匯入使用的對應（依檔案標題順序）與過程中產生的警告。
     */
    public record ResolvedMapping(Map<String, String> mapping, List<String> warnings, boolean explicit) {}
}
