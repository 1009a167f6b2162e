package fun.fengwk.seo.core.service.keyword.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Whether keyword-bearing sentences read naturally or look stuffed.
 *
 * @author fengwk
 */
@Data
@Builder
public class NaturalUsageAssessment {

    private List<String> contexts;
    private int stuffedContexts;
    private double forcedUsagePercentage;
    private boolean natural;

}
