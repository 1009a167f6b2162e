package fun.fengwk.seo.core.service.schema.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Aggregate validation over all schema entities of a page.
 *
 * @author fengwk
 */
@Data
@Builder
public class SchemaValidationSummary {

    private int totalSchemas;
    private List<String> validSchemas;
    private List<String> invalidSchemas;
    private List<SchemaMessage> issues;
    private List<SchemaMessage> warnings;

    /**
     * Share of valid entities in percent.
     */
    private double overallScore;

}
