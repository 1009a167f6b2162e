package fun.fengwk.seo.core.service.keyword.impl;

import fun.fengwk.seo.core.service.common.LanguageWordLists;
import fun.fengwk.seo.core.service.keyword.KeywordNormalizer;
import fun.fengwk.seo.core.service.keyword.KeywordSimilarity;
import fun.fengwk.seo.core.service.keyword.model.CannibalizationIssue;
import fun.fengwk.seo.core.service.keyword.model.CannibalizationType;
import fun.fengwk.seo.core.service.keyword.model.ConflictingPage;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;
import fun.fengwk.seo.core.service.keyword.model.KeywordRole;
import fun.fengwk.seo.core.service.keyword.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class DefaultCannibalizationDetectorTest {

    private final KeywordNormalizer normalizer = new KeywordNormalizer(LanguageWordLists.defaults());
    private final DefaultCannibalizationDetector detector =
        new DefaultCannibalizationDetector(normalizer, new KeywordSimilarity(normalizer));

    @Test
    public void shouldReportPrimaryKeywordConflict() {
        List<KeywordMapEntry> entries = List.of(
            entry("doc-1", "Best Coffee Maker"),
            entry("doc-2", "best coffee  maker"));

        List<CannibalizationIssue> issues = detector.detect(entries, 70D);

        assertThat(issues).hasSize(1);
        CannibalizationIssue issue = issues.get(0);
        assertThat(issue.getType()).isEqualTo(CannibalizationType.PRIMARY_KEYWORD_CONFLICT);
        assertThat(issue.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(issue.getKeyword()).isEqualTo("best coffee maker");
        assertThat(issue.getPages()).extracting(ConflictingPage::getDocumentId).containsExactly("doc-1", "doc-2");
        assertThat(issue.getRecommendation()).isEqualTo(DefaultCannibalizationDetector.PRIMARY_CONFLICT_RECOMMENDATION);
    }

    @Test
    public void shouldReportKeywordOveruseAcrossDocuments() {
        List<KeywordMapEntry> entries = List.of(
            entry("doc-1", "espresso machine", "espresso"),
            entry("doc-2", "latte art", "espresso"),
            entry("doc-3", "espresso"));

        List<CannibalizationIssue> issues = detector.detect(entries, 95D);

        assertThat(issues).extracting(CannibalizationIssue::getType)
            .containsExactly(CannibalizationType.KEYWORD_OVERUSE);
        CannibalizationIssue overuse = issues.get(0);
        assertThat(overuse.getKeyword()).isEqualTo("espresso");
        assertThat(overuse.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(overuse.getPages()).extracting(ConflictingPage::getRole)
            .containsExactly(KeywordRole.SECONDARY, KeywordRole.SECONDARY, KeywordRole.PRIMARY);
    }

    @Test
    public void shouldReportSemanticSimilarityBetweenDistinctPrimaries() {
        List<KeywordMapEntry> entries = List.of(
            entry("doc-1", "best coffee maker"),
            entry("doc-2", "best coffee makers"),
            entry("doc-3", "gardening tools"));

        List<CannibalizationIssue> issues = detector.detect(entries, 70D);

        assertThat(issues).hasSize(1);
        CannibalizationIssue issue = issues.get(0);
        assertThat(issue.getType()).isEqualTo(CannibalizationType.SEMANTIC_SIMILARITY);
        assertThat(issue.getSimilarity()).isEqualTo(90D);
        assertThat(issue.getKeywords()).containsExactly("best coffee maker", "best coffee makers");
        assertThat(detector.findConflicts(issues, "doc-2")).containsExactly(issue);
        assertThat(detector.findConflicts(issues, "doc-3")).isEmpty();
    }

    @Test
    public void shouldHandleEmptyInputAndRejectBadThreshold() {
        assertThat(detector.detect(List.of(), 70D)).isEmpty();
        assertThat(detector.detect(null, 70D)).isEmpty();
        assertThatThrownBy(() -> detector.detect(List.of(), 120D)).isInstanceOf(IllegalArgumentException.class);
    }

    private KeywordMapEntry entry(String documentId, String primary, String... secondaries) {
        return KeywordMapEntry.builder()
            .documentId(documentId)
            .title("Title " + documentId)
            .url("https://example.com/" + documentId)
            .primaryKeyword(primary)
            .secondaryKeywords(List.of(secondaries))
            .build();
    }

}
