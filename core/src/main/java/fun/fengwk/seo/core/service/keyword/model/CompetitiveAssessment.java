package fun.fengwk.seo.core.service.keyword.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class CompetitiveAssessment {

    private DensityAssessment densityAssessment;
    private int recommendedCount;
    private double countRatio;
    private CountAssessment countAssessment;

}
