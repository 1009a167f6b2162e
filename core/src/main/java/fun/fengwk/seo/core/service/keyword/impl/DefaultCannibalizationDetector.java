package fun.fengwk.seo.core.service.keyword.impl;

import fun.fengwk.seo.core.service.keyword.CannibalizationDetector;
import fun.fengwk.seo.core.service.keyword.KeywordNormalizer;
import fun.fengwk.seo.core.service.keyword.KeywordSimilarity;
import fun.fengwk.seo.core.service.keyword.model.CannibalizationIssue;
import fun.fengwk.seo.core.service.keyword.model.CannibalizationType;
import fun.fengwk.seo.core.service.keyword.model.ConflictingPage;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;
import fun.fengwk.seo.core.service.keyword.model.KeywordRole;
import fun.fengwk.seo.core.service.keyword.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultCannibalizationDetector implements CannibalizationDetector {

    static final String PRIMARY_CONFLICT_RECOMMENDATION =
        "Consolidate content or reassign primary keywords to prevent cannibalization";
    static final String OVERUSE_RECOMMENDATION =
        "Consider consolidating content or creating a more focused topic cluster";
    static final String SEMANTIC_RECOMMENDATION =
        "Differentiate content focus or combine into a single comprehensive page";

    private static final int MAX_DOCUMENTS_PER_KEYWORD = 2;

    private final KeywordNormalizer keywordNormalizer;
    private final KeywordSimilarity keywordSimilarity;

    @Override
    public List<CannibalizationIssue> detect(List<KeywordMapEntry> entries, double similarityThreshold) {
        if (similarityThreshold < 0D || similarityThreshold > 100D) {
            throw new IllegalArgumentException("similarity threshold must be within [0, 100]");
        }
        List<CannibalizationIssue> issues = new ArrayList<>();
        if (entries == null || entries.isEmpty()) {
            return issues;
        }

        Map<String, List<ConflictingPage>> usage = buildUsage(entries);
        usage.forEach((keyword, pages) -> {
            List<ConflictingPage> primaryPages = pages.stream()
                .filter(page -> page.getRole() == KeywordRole.PRIMARY)
                .collect(Collectors.toList());
            if (primaryPages.size() > 1) {
                issues.add(CannibalizationIssue.builder()
                    .type(CannibalizationType.PRIMARY_KEYWORD_CONFLICT)
                    .severity(Severity.HIGH)
                    .keyword(keyword)
                    .keywords(List.of(keyword))
                    .pages(primaryPages)
                    .recommendation(PRIMARY_CONFLICT_RECOMMENDATION)
                    .build());
            }
            if (pages.size() > MAX_DOCUMENTS_PER_KEYWORD) {
                issues.add(CannibalizationIssue.builder()
                    .type(CannibalizationType.KEYWORD_OVERUSE)
                    .severity(Severity.MEDIUM)
                    .keyword(keyword)
                    .keywords(List.of(keyword))
                    .pages(pages)
                    .recommendation(OVERUSE_RECOMMENDATION)
                    .build());
            }
        });

        issues.addAll(detectSemanticConflicts(usage, similarityThreshold));
        log.debug("cannibalization detected, documents={}, issues={}", entries.size(), issues.size());
        return issues;
    }

    @Override
    public List<CannibalizationIssue> findConflicts(List<CannibalizationIssue> issues, String documentId) {
        if (issues == null || documentId == null) {
            return List.of();
        }
        return issues.stream()
            .filter(issue -> issue.involves(documentId))
            .collect(Collectors.toList());
    }

    /**
     * Normalized keyword to the pages using it, one page per document, the primary role winning.
     */
    private Map<String, List<ConflictingPage>> buildUsage(List<KeywordMapEntry> entries) {
        Map<String, Map<String, ConflictingPage>> usage = new LinkedHashMap<>();
        for (KeywordMapEntry entry : entries) {
            if (entry == null || entry.getDocumentId() == null) {
                continue;
            }
            String primary = keywordNormalizer.normalize(entry.getPrimaryKeyword());
            if (!primary.isEmpty()) {
                usage.computeIfAbsent(primary, key -> new LinkedHashMap<>())
                    .put(entry.getDocumentId(), page(entry, KeywordRole.PRIMARY));
            }
            for (String secondary : keywordNormalizer.secondaryKeywords(primary, entry.getSecondaryKeywords())) {
                usage.computeIfAbsent(secondary, key -> new LinkedHashMap<>())
                    .putIfAbsent(entry.getDocumentId(), page(entry, KeywordRole.SECONDARY));
            }
        }
        Map<String, List<ConflictingPage>> result = new LinkedHashMap<>();
        usage.forEach((keyword, pages) -> result.put(keyword, new ArrayList<>(pages.values())));
        return result;
    }

    private List<CannibalizationIssue> detectSemanticConflicts(
        Map<String, List<ConflictingPage>> usage, double similarityThreshold) {
        Map<String, ConflictingPage> primaryKeywords = new LinkedHashMap<>();
        usage.forEach((keyword, pages) -> pages.stream()
            .filter(page -> page.getRole() == KeywordRole.PRIMARY)
            .findFirst()
            .ifPresent(page -> primaryKeywords.put(keyword, page)));

        List<String> keywords = new ArrayList<>(primaryKeywords.keySet());
        List<CannibalizationIssue> issues = new ArrayList<>();
        for (int i = 0; i < keywords.size(); i++) {
            for (int j = i + 1; j < keywords.size(); j++) {
                String first = keywords.get(i);
                String second = keywords.get(j);
                double similarity = keywordSimilarity.similarity(first, second);
                if (similarity >= similarityThreshold) {
                    issues.add(CannibalizationIssue.builder()
                        .type(CannibalizationType.SEMANTIC_SIMILARITY)
                        .severity(Severity.MEDIUM)
                        .keyword(first)
                        .keywords(List.of(first, second))
                        .similarity(similarity)
                        .pages(List.of(primaryKeywords.get(first), primaryKeywords.get(second)))
                        .recommendation(SEMANTIC_RECOMMENDATION)
                        .build());
                }
            }
        }
        return issues;
    }

    private ConflictingPage page(KeywordMapEntry entry, KeywordRole role) {
        return new ConflictingPage(entry.getDocumentId(), entry.getTitle(), entry.getUrl(), role);
    }

}
