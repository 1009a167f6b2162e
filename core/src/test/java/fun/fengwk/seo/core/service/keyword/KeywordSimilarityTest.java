package fun.fengwk.seo.core.service.keyword;

import fun.fengwk.seo.core.service.common.LanguageWordLists;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class KeywordSimilarityTest {

    private final KeywordSimilarity similarity =
        new KeywordSimilarity(new KeywordNormalizer(LanguageWordLists.defaults()));

    @Test
    public void shouldScoreIdenticalKeywordsAsHundred() {
        assertThat(similarity.similarity("Coffee Maker", "coffee   maker")).isEqualTo(100D);
        assertThat(similarity.similarity("the", "The")).isEqualTo(100D);
    }

    @Test
    public void shouldScoreEmptyKeywordsAsZero() {
        assertThat(similarity.similarity("", "")).isEqualTo(0D);
        assertThat(similarity.similarity("coffee", " ")).isEqualTo(0D);
    }

    @Test
    public void shouldScoreContainmentAsNinety() {
        assertThat(similarity.similarity("coffee", "coffee maker")).isEqualTo(90D);
        assertThat(similarity.similarity("how to brew coffee", "brew coffee")).isEqualTo(90D);
    }

    @Test
    public void shouldBeSymmetric() {
        double forward = similarity.similarity("coffee grinder", "tea kettle");
        double backward = similarity.similarity("tea kettle", "coffee grinder");

        assertThat(forward).isEqualTo(backward);
        assertThat(forward).isBetween(0D, 100D);
    }

    @Test
    public void shouldUseWordOverlapWhenHigher() {
        assertThat(similarity.similarity("coffee beans roast", "roast beans coffee")).isEqualTo(100D);
    }

    @Test
    public void shouldComputeLevenshteinDistance() {
        assertThat(KeywordSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(KeywordSimilarity.levenshtein("", "abc")).isEqualTo(3);
    }

}
