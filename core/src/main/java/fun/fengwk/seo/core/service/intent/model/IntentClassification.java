package fun.fengwk.seo.core.service.intent.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Keyword intent scores and the winning category.
 *
 * @author fengwk
 */
@Data
@Builder
public class IntentClassification {

    private String keyword;
    private String postType;

    /**
     * Score per intent value, in category order.
     */
    private Map<String, Double> scores;

    /**
     * Winning category before commercial is folded into transactional.
     */
    private SearchIntent rawIntent;

    /**
     * Reported category, never {@link SearchIntent#COMMERCIAL}.
     */
    private SearchIntent detectedIntent;

}
