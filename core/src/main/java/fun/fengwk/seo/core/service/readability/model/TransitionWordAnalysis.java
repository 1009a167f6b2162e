package fun.fengwk.seo.core.service.readability.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class TransitionWordAnalysis {

    private int sentencesWithTransitions;
    private double percentage;
    private boolean meetsThreshold;
    private List<String> wordsUsed;

}
