package fun.fengwk.seo.core.service.schema.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class LocalBusinessCompleteness {

    private String schemaType;
    private boolean valid;

    /**
     * Percentage of LocalBusiness properties present and well formed.
     */
    private double completeness;

    private List<String> missingRequired;
    private List<String> missingRecommended;

    /**
     * Address and geo structure problems.
     */
    private List<String> incompleteProperties;

}
