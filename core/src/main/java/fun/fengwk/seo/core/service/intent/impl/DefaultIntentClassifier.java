package fun.fengwk.seo.core.service.intent.impl;

import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.intent.IntentClassifier;
import fun.fengwk.seo.core.service.intent.IntentMarkerDetector;
import fun.fengwk.seo.core.service.intent.IntentPatterns;
import fun.fengwk.seo.core.service.intent.IntentSatisfactionScorer;
import fun.fengwk.seo.core.service.intent.model.IntentClassification;
import fun.fengwk.seo.core.service.intent.model.IntentProfile;
import fun.fengwk.seo.core.service.intent.model.SearchIntent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Scores each intent by summing matching pattern weights, post type priors and domain term boosts.
 *
 * <p>The highest score wins, earlier categories win ties. A commercial winner becomes transactional when the
 * keyword mentions "buy", and commercial is always reported as transactional.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultIntentClassifier implements IntentClassifier {

    private static final String BUY = "buy";

    private final IntentPatterns intentPatterns;
    private final IntentMarkerDetector markerDetector;
    private final IntentSatisfactionScorer satisfactionScorer;

    @Override
    public IntentClassification classify(String keyword, String postType) {
        String normalizedKeyword = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        String normalizedPostType = postType == null ? "" : postType.trim().toLowerCase(Locale.ROOT);

        Map<SearchIntent, Double> scores = new EnumMap<>(SearchIntent.class);
        for (SearchIntent intent : SearchIntent.values()) {
            scores.put(intent, 0D);
        }
        if (StringUtils.isNotBlank(normalizedKeyword)) {
            for (SearchIntent intent : SearchIntent.values()) {
                for (IntentPatterns.WeightedPattern pattern : intentPatterns.patternsFor(intent)) {
                    if (pattern.matches(normalizedKeyword)) {
                        scores.merge(intent, pattern.weight(), Double::sum);
                    }
                }
            }
            intentPatterns.priorsFor(normalizedPostType).forEach((intent, prior) -> scores.merge(intent, prior, Double::sum));
            if (intentPatterns.getBrandPattern().matcher(normalizedKeyword).find()) {
                scores.merge(SearchIntent.NAVIGATIONAL, intentPatterns.getBrandBoost(), Double::sum);
            }
            for (String term : intentPatterns.getProductTerms()) {
                if (normalizedKeyword.contains(term)) {
                    scores.merge(SearchIntent.COMMERCIAL, 1D, Double::sum);
                    scores.merge(SearchIntent.TRANSACTIONAL, 0.5, Double::sum);
                }
            }
        }

        SearchIntent rawIntent = winner(scores);
        if (rawIntent == SearchIntent.COMMERCIAL && normalizedKeyword.contains(BUY)) {
            scores.put(SearchIntent.TRANSACTIONAL, scores.get(SearchIntent.COMMERCIAL));
            rawIntent = winner(scores);
        }
        if (scores.get(rawIntent) == 0D) {
            rawIntent = SearchIntent.INFORMATIONAL;
        }
        SearchIntent detectedIntent = rawIntent == SearchIntent.COMMERCIAL ? SearchIntent.TRANSACTIONAL : rawIntent;

        Map<String, Double> reportedScores = new LinkedHashMap<>();
        scores.forEach((intent, score) -> reportedScores.put(intent.getValue(), score));
        log.debug("intent classified, keyword={}, postType={}, scores={}, intent={}",
            normalizedKeyword, normalizedPostType, reportedScores, detectedIntent.getValue());
        return IntentClassification.builder()
            .keyword(normalizedKeyword)
            .postType(normalizedPostType)
            .scores(reportedScores)
            .rawIntent(rawIntent)
            .detectedIntent(detectedIntent)
            .build();
    }

    @Override
    public IntentProfile analyze(String keyword, String postType, ExtractedContent content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        IntentClassification classification = classify(keyword, postType);
        Map<String, Boolean> markers = markerDetector.detect(content, classification.getDetectedIntent());
        double score = satisfactionScorer.score(markers, classification.getDetectedIntent());
        return IntentProfile.builder()
            .classification(classification)
            .markers(markers)
            .satisfactionScore(TextUtils.round(score, 4))
            .build();
    }

    private SearchIntent winner(Map<SearchIntent, Double> scores) {
        SearchIntent best = SearchIntent.INFORMATIONAL;
        for (Map.Entry<SearchIntent, Double> entry : scores.entrySet()) {
            if (entry.getValue() > scores.get(best)) {
                best = entry.getKey();
            }
        }
        return best;
    }

}
