package fun.fengwk.seo.core.service.intent.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * @author fengwk
 */
@Data
@Builder
public class IntentProfile {

    private IntentClassification classification;
    private Map<String, Boolean> markers;

    /**
     * How well the content satisfies the detected intent, within [0, 1].
     */
    private double satisfactionScore;

}
