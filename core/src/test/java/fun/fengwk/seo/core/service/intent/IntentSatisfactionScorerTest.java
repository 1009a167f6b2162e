package fun.fengwk.seo.core.service.intent;

import fun.fengwk.seo.core.service.intent.model.SearchIntent;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * @author fengwk
 */
public class IntentSatisfactionScorerTest {

    private final IntentSatisfactionScorer scorer = new IntentSatisfactionScorer();

    @Test
    public void shouldScoreZeroWithoutMarkers() {
        assertThat(scorer.score(Map.of(), SearchIntent.INFORMATIONAL)).isEqualTo(0D);
        assertThat(scorer.score(null, SearchIntent.INFORMATIONAL)).isEqualTo(0D);
    }

    @Test
    public void shouldCapFullySatisfiedPageAtOne() {
        Map<String, Boolean> markers = new LinkedHashMap<>();
        markers.put(IntentMarkerDetector.STRUCTURED_CONTENT, true);
        markers.put(IntentMarkerDetector.MULTIMEDIA, true);
        markers.put(IntentMarkerDetector.SEMANTIC_MARKUP, true);
        markers.put(IntentMarkerDetector.DEFINITION, true);
        markers.put(IntentMarkerDetector.EXAMPLES, true);

        assertThat(scorer.score(markers, SearchIntent.INFORMATIONAL)).isEqualTo(1D);
    }

    @Test
    public void shouldPenalizeMissingCallToAction() {
        Map<String, Boolean> markers = new LinkedHashMap<>();
        markers.put(IntentMarkerDetector.STRUCTURED_CONTENT, false);
        markers.put(IntentMarkerDetector.MULTIMEDIA, false);
        markers.put(IntentMarkerDetector.SEMANTIC_MARKUP, false);
        markers.put(IntentMarkerDetector.PRICING, true);
        markers.put(IntentMarkerDetector.CALL_TO_ACTION, false);

        double expected = 2.5 / 9.2 * 0.8 * 0.6;
        assertThat(scorer.score(markers, SearchIntent.TRANSACTIONAL)).isCloseTo(expected, within(1e-9));
    }

    @Test
    public void shouldHalveNavigationalScoreWithoutDirectLinks() {
        Map<String, Boolean> markers = new LinkedHashMap<>();
        markers.put(IntentMarkerDetector.DIRECT_LINKS, false);
        markers.put(IntentMarkerDetector.CONTACT_INFO, true);

        assertThat(scorer.score(markers, SearchIntent.NAVIGATIONAL)).isCloseTo(0.16, within(1e-9));
    }

    @Test
    public void shouldWeighUnknownMarkersAsOne() {
        Map<String, Double> weights = scorer.weightsFor(SearchIntent.COMMERCIAL);

        assertThat(weights).containsEntry(IntentMarkerDetector.REVIEWS, 2.5)
            .containsEntry(IntentMarkerDetector.STRUCTURED_CONTENT, 1.5)
            .doesNotContainKey(IntentMarkerDetector.PRICING);
        assertThat(scorer.score(Map.of("custom_marker", true), SearchIntent.COMMERCIAL)).isCloseTo(0.8, within(1e-9));
    }

    @Test
    public void shouldDeriveQualityMultiplier() {
        assertThat(scorer.qualityMultiplier(Map.of(
            IntentMarkerDetector.STRUCTURED_CONTENT, true,
            IntentMarkerDetector.MULTIMEDIA, true,
            IntentMarkerDetector.SEMANTIC_MARKUP, true))).isEqualTo(1.2);
        assertThat(scorer.qualityMultiplier(Map.of(IntentMarkerDetector.STRUCTURED_CONTENT, true))).isEqualTo(1.05);
        assertThat(scorer.qualityMultiplier(Map.of(IntentMarkerDetector.SEMANTIC_MARKUP, true))).isEqualTo(1.0);
        assertThat(scorer.qualityMultiplier(Map.of())).isEqualTo(0.8);
    }

}
