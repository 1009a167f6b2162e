package fun.fengwk.seo.core.service.keyword.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class ProximityAnalysis {

    private int occurrences;

    /**
     * Mean character gap between consecutive occurrences.
     */
    private double averageDistance;

    /**
     * 0-10, 10 means evenly spaced.
     */
    private double distributionScore;

}
