package fun.fengwk.seo.core.service.keyword.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class KeywordBalance {

    /**
     * Primary density divided by average secondary density, null when incomplete.
     */
    private Double ratio;

    private BalanceStatus status;
    private double score;

}
