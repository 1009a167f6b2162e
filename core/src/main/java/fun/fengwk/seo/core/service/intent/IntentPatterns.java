package fun.fengwk.seo.core.service.intent;

import fun.fengwk.seo.core.service.intent.model.SearchIntent;
import lombok.Getter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Weighted keyword patterns, post type priors and domain term boosts used to classify search intent.
 *
 * @author fengwk
 */
@Getter
public class IntentPatterns {

    private final Map<SearchIntent, List<WeightedPattern>> patterns;
    private final Map<String, Map<SearchIntent, Double>> postTypePriors;
    private final Pattern brandPattern;
    private final double brandBoost;
    private final List<String> productTerms;

    public IntentPatterns(Map<SearchIntent, List<WeightedPattern>> patterns,
                          Map<String, Map<SearchIntent, Double>> postTypePriors,
                          Pattern brandPattern, double brandBoost, List<String> productTerms) {
        this.patterns = Map.copyOf(patterns);
        this.postTypePriors = Map.copyOf(postTypePriors);
        this.brandPattern = brandPattern;
        this.brandBoost = brandBoost;
        this.productTerms = List.copyOf(productTerms);
    }

    public static IntentPatterns defaults() {
        Map<SearchIntent, List<WeightedPattern>> patterns = new EnumMap<>(SearchIntent.class);
        patterns.put(SearchIntent.INFORMATIONAL, List.of(
            WeightedPattern.of("^(?:what|who|when|where|why|how|which|is|are|can|does|do|did|was|were|will|should|could|would|may|might)", 3),
            WeightedPattern.of("(?:how to|what is|why do|how do|why is|what are|who is|where is|when is)", 2.5),
            WeightedPattern.of("(?:guide|tutorial|learn|explanation|examples?|tips|advice|ideas|ways to|steps|strategy|benefits of)", 2),
            WeightedPattern.of("(?:meaning|definition|concept|difference between|vs|versus|compare|comparison|review|history of)", 2),
            WeightedPattern.of("(?:list of|top|best|facts about|overview|complete|ultimate|beginners?|introduction)", 1.5),
            WeightedPattern.of("(?:research|study|analysis|statistics|data|report|survey|results|findings|theory|methodology)", 2)));
        patterns.put(SearchIntent.TRANSACTIONAL, List.of(
            WeightedPattern.of("(?:buy|purchase|order|shop|get|subscribe|book|reserve|apply for|hire|rent|lease)", 3),
            WeightedPattern.of("(?:price|cost|pricing|cheap|affordable|discount|deal|coupon|sale|free shipping|budget)", 2.5),
            WeightedPattern.of("(?:download|free download|get free|sign up|register|join|activate|install)", 2),
            WeightedPattern.of("(?:service|provider|supplier|agency|company for|professional|near me|online)", 1.5)));
        patterns.put(SearchIntent.NAVIGATIONAL, List.of(
            WeightedPattern.of("(?:login|sign in|account|dashboard|website|official site|homepage)", 3),
            WeightedPattern.of("(?:directions to|location of|address|map|store locator|near me|hours)", 2.5),
            WeightedPattern.of("(?:contact|support|help center|customer service|download page|careers)", 2)));
        patterns.put(SearchIntent.COMMERCIAL, List.of(
            WeightedPattern.of("(?:best|top|vs|versus|compared to|cheapest|review|rating|worth it|recommended)", 3),
            WeightedPattern.of("(?:features|specs|specifications|comparison|alternatives|options|models|brands)", 2.5),
            WeightedPattern.of("(?:pros and cons|advantages|disadvantages|benefits|drawbacks|problems with)", 2),
            WeightedPattern.of("(?:before buying|should i buy|should i get|is it worth|which to choose|choose|select)", 2.5)));

        Map<String, Map<SearchIntent, Double>> priors = Map.of(
            "product", Map.of(SearchIntent.TRANSACTIONAL, 2D, SearchIntent.COMMERCIAL, 1D),
            "page", Map.of(SearchIntent.NAVIGATIONAL, 1D),
            "post", Map.of(SearchIntent.INFORMATIONAL, 1D),
            "location", Map.of(SearchIntent.NAVIGATIONAL, 2D),
            "store", Map.of(SearchIntent.NAVIGATIONAL, 2D),
            "review", Map.of(SearchIntent.COMMERCIAL, 2D));

        return new IntentPatterns(
            patterns,
            priors,
            Pattern.compile("(?:facebook|twitter|instagram|linkedin|youtube|amazon|google|reddit)", Pattern.CASE_INSENSITIVE),
            2D,
            List.of("iphone", "samsung", "tv", "laptop", "camera", "shoes", "dress", "furniture",
                "car", "bike", "smartphone", "monitor", "headphones", "watch", "tablet"));
    }

    public List<WeightedPattern> patternsFor(SearchIntent intent) {
        return patterns.getOrDefault(intent, List.of());
    }

    public Map<SearchIntent, Double> priorsFor(String postType) {
        return postType == null ? Map.of() : postTypePriors.getOrDefault(postType, Map.of());
    }

    public record WeightedPattern(Pattern pattern, double weight) {

        public static WeightedPattern of(String regex, double weight) {
            return new WeightedPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight);
        }

        public boolean matches(String text) {
            return pattern.matcher(text).find();
        }

    }

}
