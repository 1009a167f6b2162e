package fun.fengwk.seo.core.service.schema;

import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import fun.fengwk.seo.core.service.schema.model.SchemaValidationSummary;
import fun.fengwk.seo.core.service.schema.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
public interface SchemaValidator {

    /**
     * Validates one entity against the rule of its primary type and the structure checks of that type.
     *
     * @param properties entity properties including {@code @type}
     * @return validation result, never null
     */
    ValidationResult validate(Map<String, Object> properties);

    default ValidationResult validate(SchemaEntity entity) {
        return validate(entity.getProperties());
    }

    /**
     * Validates all entities of a page, messages carry the entity index.
     */
    SchemaValidationSummary validateAll(List<SchemaEntity> entities);

}
