package fun.fengwk.seo.core.service.keyword.impl;

import fun.fengwk.seo.core.configuration.SeoAnalysisProperties;
import fun.fengwk.seo.core.service.common.LanguageWordLists;
import fun.fengwk.seo.core.service.content.model.ContentBlock;
import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.document.PageDocument;
import fun.fengwk.seo.core.service.keyword.KeywordNormalizer;
import fun.fengwk.seo.core.service.keyword.model.BalanceStatus;
import fun.fengwk.seo.core.service.keyword.model.DensityStatus;
import fun.fengwk.seo.core.service.keyword.model.KeywordAnalysis;
import fun.fengwk.seo.core.service.keyword.model.KeywordBalance;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class DefaultKeywordAnalyzerTest {

    private final DefaultKeywordAnalyzer analyzer = new DefaultKeywordAnalyzer(
        new SeoAnalysisProperties(), new KeywordNormalizer(LanguageWordLists.defaults()));

    @Test
    public void shouldCountKeywordAndComputeDensity() {
        ExtractedContent content = content(ContentBlock.paragraph("The quick brown fox jumps. The fox runs fast."));

        KeywordAnalysis analysis = analyzer.analyze("Fox", null, content);

        assertThat(analysis.getKeyword()).isEqualTo("fox");
        assertThat(analysis.getCount()).isEqualTo(2);
        assertThat(analysis.getWordCount()).isEqualTo(9);
        assertThat(analysis.getDensity()).isEqualTo(22.22);
        assertThat(analysis.getDensityStatus()).isEqualTo(DensityStatus.SEVERELY_OVERUSED);
        assertThat(analysis.getDensityScore()).isEqualTo(0D);
        assertThat(analysis.getPositionPercent()).isEqualTo(35.56);
        assertThat(analysis.isInFirstParagraph()).isTrue();
        assertThat(analysis.isSufficientUsage()).isFalse();
        assertThat(analysis.getKeywordReadability().getSentenceCount()).isEqualTo(2);
    }

    @Test
    public void shouldReportZeroDensityWhenKeywordMissing() {
        ExtractedContent content = content(ContentBlock.paragraph("Nothing relevant lives here."));

        KeywordAnalysis analysis = analyzer.analyze("coffee", null, content);

        assertThat(analysis.getCount()).isZero();
        assertThat(analysis.getDensity()).isEqualTo(0D);
        assertThat(analysis.getPositionPercent()).isNull();
        assertThat(analysis.getDensityStatus()).isEqualTo(DensityStatus.SEVERELY_UNDERUSED);
    }

    @Test
    public void shouldDetectKeywordInHeadingsAndMeta() {
        ExtractedContent content = content(
            ContentBlock.heading(1, "Coffee Brewing Guide"),
            ContentBlock.paragraph("Good coffee needs fresh beans."),
            ContentBlock.heading(2, "Water temperature"));
        PageDocument document = PageDocument.builder()
            .html("")
            .baseUrl("")
            .plainText("")
            .title("Coffee at home")
            .metaDescription("Learn to brew")
            .build();

        KeywordAnalysis analysis = analyzer.analyze("coffee", document, content);

        assertThat(analysis.getHeadings().getTotalHeadings()).isEqualTo(2);
        assertThat(analysis.getHeadings().getHeadingsWithKeyword()).isEqualTo(1);
        assertThat(analysis.getHeadings().getLevels().get("h1").getKeywordMatches()).isEqualTo(1);
        assertThat(analysis.getHeadings().getLevels().get("h2").getKeywordMatches()).isZero();
        assertThat(analysis.isInMetaTitle()).isTrue();
        assertThat(analysis.isInMetaDescription()).isFalse();
        assertThat(analysis.getParagraphs().getDistributionPercentage()).isEqualTo(100D);
    }

    @Test
    public void shouldClassifyDensityBands() {
        assertThat(analyzer.densityStatus(0.05)).isEqualTo(DensityStatus.SEVERELY_UNDERUSED);
        assertThat(analyzer.densityStatus(0.3)).isEqualTo(DensityStatus.UNDERUSED);
        assertThat(analyzer.densityStatus(1.5)).isEqualTo(DensityStatus.OPTIMAL);
        assertThat(analyzer.densityStatus(4)).isEqualTo(DensityStatus.OVERUSED);
        assertThat(analyzer.densityStatus(6)).isEqualTo(DensityStatus.SEVERELY_OVERUSED);
        assertThat(analyzer.densityScore(0.25)).isEqualTo(0.5);
        assertThat(analyzer.densityScore(2)).isEqualTo(1D);
    }

    @Test
    public void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> analyzer.analyze("  ", null, ExtractedContent.empty()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.density(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThat(analyzer.density(3, 0)).isEqualTo(0D);
    }

    @Test
    public void shouldScoreEvenDistributionHigher() {
        double even = analyzer.distributionScore(List.of(25, 50, 75), 100);
        double clustered = analyzer.distributionScore(List.of(0, 1, 2), 100);

        assertThat(even).isEqualTo(10D);
        assertThat(clustered).isLessThan(even);
        assertThat(analyzer.distributionScore(List.of(), 100)).isEqualTo(0D);
    }

    @Test
    public void shouldAssessKeywordBalance() {
        KeywordAnalysis primary = KeywordAnalysis.builder().density(2D).build();
        KeywordAnalysis secondary = KeywordAnalysis.builder().density(1D).build();
        KeywordAnalysis unused = KeywordAnalysis.builder().density(0D).build();

        KeywordBalance balanced = analyzer.balance(primary, List.of(secondary));
        KeywordBalance incomplete = analyzer.balance(primary, List.of(unused));
        KeywordBalance dominant = analyzer.balance(KeywordAnalysis.builder().density(10D).build(), List.of(secondary));

        assertThat(balanced.getRatio()).isEqualTo(2D);
        assertThat(balanced.getStatus()).isEqualTo(BalanceStatus.WELL_BALANCED);
        assertThat(balanced.getScore()).isEqualTo(1D);
        assertThat(incomplete.getStatus()).isEqualTo(BalanceStatus.INCOMPLETE);
        assertThat(incomplete.getRatio()).isNull();
        assertThat(dominant.getStatus()).isEqualTo(BalanceStatus.PRIMARY_DOMINANT);
    }

    private ExtractedContent content(ContentBlock... blocks) {
        return ExtractedContent.builder().blocks(List.of(blocks)).fallbackUsed(false).build();
    }

}
