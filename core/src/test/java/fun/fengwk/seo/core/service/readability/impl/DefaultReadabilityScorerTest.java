package fun.fengwk.seo.core.service.readability.impl;

import fun.fengwk.seo.core.configuration.SeoAnalysisProperties;
import fun.fengwk.seo.core.service.common.LanguageWordLists;
import fun.fengwk.seo.core.service.readability.model.ReadabilityReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * @author fengwk
 */
public class DefaultReadabilityScorerTest {

    private final DefaultReadabilityScorer scorer =
        new DefaultReadabilityScorer(new SeoAnalysisProperties(), LanguageWordLists.defaults());

    @Test
    public void shouldClampFleschScoreToHundred() {
        ReadabilityReport report = scorer.score("The cat sat. The dog ran.", List.of(), "en");

        assertThat(report.getWordCount()).isEqualTo(6);
        assertThat(report.getSentenceCount()).isEqualTo(2);
        assertThat(report.getSyllableCount()).isEqualTo(6);
        assertThat(report.getFleschReadingEase()).isEqualTo(100D);
        assertThat(report.getGradeLevel()).isEqualTo("5th grade (Very easy to read)");
        assertThat(report.getAverageWordsPerSentence()).isEqualTo(3D);
    }

    @Test
    public void shouldDecreaseWhenSyllablesGrow() {
        double simple = scorer.fleschReadingEase(100, 5, 150);
        double dense = scorer.fleschReadingEase(100, 5, 180);

        assertThat(dense).isLessThan(simple);
        assertThat(scorer.fleschReadingEase(10, 1, 60)).isEqualTo(0D);
        assertThat(scorer.fleschReadingEase(0, 0, 0)).isEqualTo(0D);
    }

    @Test
    public void shouldRejectNegativeCounts() {
        assertThatThrownBy(() -> scorer.fleschReadingEase(-1, 1, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldSkipSyllableScoresForCjk() {
        ReadabilityReport report = scorer.score("我爱北京。天安门很大。", List.of("我爱北京。天安门很大。"), "zh-CN");

        assertThat(report.isCjk()).isTrue();
        assertThat(report.getLanguage()).isEqualTo("zh");
        assertThat(report.getGradeLevel()).isEqualTo("N/A for CJK languages");
        assertThat(report.getWordCount()).isEqualTo(9);
        assertThat(report.getSentenceCount()).isEqualTo(2);
        assertThat(report.getSyllableCount()).isNull();
        assertThat(report.getFleschReadingEase()).isNull();
        assertThat(report.getPassiveVoice().getPassiveSentenceCount()).isZero();
        assertThat(report.getPassiveVoice().isExceedsThreshold()).isFalse();
        assertThat(report.getTransitionWords().getSentencesWithTransitions()).isZero();
        assertThat(report.getTransitionWords().getPercentage()).isZero();
        assertThat(report.getTransitionWords().isMeetsThreshold()).isFalse();
    }

    @Test
    public void shouldDetectPassiveVoiceAndTransitions() {
        String text = "The cake was baked by mom. However, we ate it quickly. Dogs bark.";

        ReadabilityReport report = scorer.score(text, List.of(text), null);

        assertThat(report.getLanguage()).isEqualTo("en");
        assertThat(report.getPassiveVoice().getPassiveSentenceCount()).isEqualTo(1);
        assertThat(report.getPassiveVoice().getExamples()).containsExactly("The cake was baked by mom.");
        assertThat(report.getPassiveVoice().isExceedsThreshold()).isTrue();
        assertThat(report.getTransitionWords().getSentencesWithTransitions()).isEqualTo(1);
        assertThat(report.getTransitionWords().getWordsUsed()).containsExactly("however");
        assertThat(report.getTransitionWords().isMeetsThreshold()).isTrue();
        assertThat(report.getParagraphLengths().getTotalParagraphs()).isEqualTo(1);
        assertThat(report.getParagraphLengths().getDistribution()).containsEntry("0-20", 1);
    }

    @Test
    public void shouldReturnZeroValuesForEmptyText() {
        ReadabilityReport report = scorer.score("", List.of(), "en");

        assertThat(report.getWordCount()).isZero();
        assertThat(report.getFleschReadingEase()).isEqualTo(0D);
        assertThat(report.getGradeLevel()).isEqualTo("Analysis not applicable for this language");
        assertThat(report.getSmogIndex()).isEqualTo(0D);
    }

    @Test
    public void shouldApplySmogSampleScaling() {
        assertThat(scorer.smog(0, 0)).isEqualTo(0D);
        assertThat(scorer.smog(30, 30)).isCloseTo(8.84D, within(0.01D));
        assertThat(scorer.smog(5, 40)).isCloseTo(5.15D, within(0.01D));
        assertThat(scorer.smog(3, 10)).isCloseTo(8.55D, within(0.01D));
        assertThat(scorer.smog(3, 1)).isCloseTo(57.32D, within(0.01D));
    }

}
