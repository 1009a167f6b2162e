package fun.fengwk.seo.core.service.intent;

import fun.fengwk.seo.core.service.intent.model.SearchIntent;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

import static fun.fengwk.seo.core.service.intent.IntentMarkerDetector.*;

/**
 * Turns content markers into a satisfaction score within [0, 1].
 *
 * <p>The base score is the weighted share of satisfied markers, unknown markers weigh 1. It is scaled by a quality
 * multiplier derived from the universal markers, then boosted or penalized depending on the critical markers of
 * the intent.
 *
 * @author fengwk
 */
@Component
public class IntentSatisfactionScorer {

    private static final Map<String, Double> UNIVERSAL_WEIGHTS = Map.of(
        STRUCTURED_CONTENT, 1.5,
        MULTIMEDIA, 1.2,
        SEMANTIC_MARKUP, 1.0);

    private static final Map<SearchIntent, Map<String, Double>> INTENT_WEIGHTS = Map.of(
        SearchIntent.INFORMATIONAL, Map.of(
            DEFINITION, 2.5, EXAMPLES, 2.0, STEP_BY_STEP, 1.8, FAQ, 1.5, DATA_TABLES, 1.3,
            STATISTICS, 1.5, EXPLANATIONS, 2.0, COMPARISONS, 1.5, DIAGRAMS, 1.3),
        SearchIntent.TRANSACTIONAL, Map.of(
            PRICING, 2.5, CALL_TO_ACTION, 3.0, PRODUCT_DETAILS, 2.0, PURCHASE_OPTIONS, 1.8,
            TRUST_SIGNALS, 1.5, URGENCY, 1.2, SHOPPING_CART, 1.5),
        SearchIntent.NAVIGATIONAL, Map.of(
            DIRECT_LINKS, 3.0, CONTACT_INFO, 2.0, LOCATION_DETAILS, 2.0, NAVIGATION_MENU, 1.8,
            SEARCH_FUNCTIONALITY, 1.5, HOURS_INFO, 1.5),
        SearchIntent.COMMERCIAL, Map.of(
            COMPARISON, 2.5, REVIEWS, 2.5, PROS_CONS, 2.0, RECOMMENDATIONS, 2.0,
            DECISION_AIDS, 1.8, EXPERT_OPINIONS, 1.5, VALUE_ASSESSMENT, 1.5));

    public double score(Map<String, Boolean> markers, SearchIntent intent) {
        if (markers == null || markers.isEmpty()) {
            return 0D;
        }
        Map<String, Double> weights = weightsFor(intent);
        double satisfied = 0D;
        double total = 0D;
        for (Map.Entry<String, Boolean> marker : markers.entrySet()) {
            double weight = weights.getOrDefault(marker.getKey(), 1D);
            if (Boolean.TRUE.equals(marker.getValue())) {
                satisfied += weight;
            }
            total += weight;
        }
        double score = total > 0 ? satisfied / total : 0D;
        score *= qualityMultiplier(markers);
        score = adjustForIntent(score, markers, intent);
        return Math.max(0D, Math.min(1D, score));
    }

    public Map<String, Double> weightsFor(SearchIntent intent) {
        Map<String, Double> weights = new HashMap<>(UNIVERSAL_WEIGHTS);
        if (intent != null) {
            weights.putAll(INTENT_WEIGHTS.getOrDefault(intent, Map.of()));
        }
        return weights;
    }

    /**
     * Between 0.8 and 1.2.
     */
    double qualityMultiplier(Map<String, Boolean> markers) {
        boolean structured = isSet(markers, STRUCTURED_CONTENT);
        boolean multimedia = isSet(markers, MULTIMEDIA);
        boolean semantic = isSet(markers, SEMANTIC_MARKUP);
        if (structured && multimedia && semantic) {
            return 1.2;
        }
        if (structured && multimedia) {
            return 1.1;
        }
        if (structured) {
            return 1.05;
        }
        if (!multimedia && !semantic) {
            return 0.8;
        }
        return 1.0;
    }

    private double adjustForIntent(double score, Map<String, Boolean> markers, SearchIntent intent) {
        if (intent == null) {
            return score;
        }
        double adjusted = score;
        switch (intent) {
            case INFORMATIONAL:
                if (isSet(markers, DEFINITION) && isSet(markers, EXAMPLES)) {
                    adjusted = Math.min(1D, adjusted * 1.15);
                    if (isSet(markers, STEP_BY_STEP) && isSet(markers, EXPLANATIONS)) {
                        adjusted = Math.min(1D, adjusted * 1.1);
                    }
                }
                break;
            case TRANSACTIONAL:
                adjusted = adjustCritical(adjusted, markers, CALL_TO_ACTION, PRICING, 0.6,
                    PRODUCT_DETAILS, TRUST_SIGNALS);
                break;
            case NAVIGATIONAL:
                if (isSet(markers, DIRECT_LINKS)) {
                    adjusted = Math.min(1D, adjusted * 1.15);
                    if (isSet(markers, NAVIGATION_MENU) && isSet(markers, SEARCH_FUNCTIONALITY)) {
                        adjusted = Math.min(1D, adjusted * 1.1);
                    }
                } else if (markers.containsKey(DIRECT_LINKS)) {
                    adjusted *= 0.5;
                }
                break;
            case COMMERCIAL:
                adjusted = adjustCritical(adjusted, markers, COMPARISON, REVIEWS, 0.7,
                    PROS_CONS, RECOMMENDATIONS);
                break;
            default:
                break;
        }
        return adjusted;
    }

    /**
     * Boost when both critical markers are present, penalty when the first one is explicitly absent, and a funnel
     * bonus when the two completing markers are present as well.
     */
    private double adjustCritical(double score, Map<String, Boolean> markers, String critical, String companion,
                                  double penalty, String... completing) {
        double adjusted = score;
        boolean hasCritical = isSet(markers, critical);
        if (hasCritical && isSet(markers, companion)) {
            adjusted = Math.min(1D, adjusted * 1.15);
        }
        if (!hasCritical && markers.containsKey(critical)) {
            adjusted *= penalty;
        }
        if (hasCritical && isSet(markers, companion) && isSet(markers, completing[0]) && isSet(markers, completing[1])) {
            adjusted = Math.min(1D, adjusted * 1.1);
        }
        return adjusted;
    }

    private static boolean isSet(Map<String, Boolean> markers, String name) {
        return Boolean.TRUE.equals(markers.get(name));
    }

}
