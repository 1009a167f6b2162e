package fun.fengwk.seo.core.service.readability.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class PassiveVoiceAnalysis {

    private int passiveSentenceCount;
    private double percentage;
    private boolean exceedsThreshold;
    private List<String> examples;

}
