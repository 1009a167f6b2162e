package fun.fengwk.seo.core.service.schema.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Validation outcome of one schema entity, valid when no issue was found.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class ValidationResult {

    private String schemaType;
    private boolean valid;
    private List<String> issues;
    private List<String> warnings;

}
