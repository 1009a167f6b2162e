package fun.fengwk.seo.core.service.schema;

import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.schema.model.LocalBusinessCompleteness;
import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import fun.fengwk.seo.core.service.schema.support.NestedStructureValidator;
import fun.fengwk.seo.core.service.schema.support.SchemaValues;
import fun.fengwk.seo.core.service.schema.support.ValidationCollector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds LocalBusiness entities, subtypes included, and measures how complete their markup is.
 *
 * @author fengwk
 */
@Component
public class LocalBusinessSchemaInspector {

    private final SchemaRules schemaRules;
    private final SchemaTypeHierarchy typeHierarchy;
    private final NestedStructureValidator nestedValidator = new NestedStructureValidator();

    public LocalBusinessSchemaInspector(SchemaRules schemaRules, SchemaTypeHierarchy typeHierarchy) {
        this.schemaRules = schemaRules;
        this.typeHierarchy = typeHierarchy;
    }

    public boolean isLocalBusiness(SchemaEntity entity) {
        if (entity == null) {
            return false;
        }
        for (String type : entity.getTypes()) {
            if (typeHierarchy.isLocalBusinessType(type)) {
                return true;
            }
        }
        return false;
    }

    public List<SchemaEntity> findLocalBusinesses(List<SchemaEntity> entities) {
        List<SchemaEntity> found = new ArrayList<>();
        if (entities != null) {
            for (SchemaEntity entity : entities) {
                if (isLocalBusiness(entity)) {
                    found.add(entity);
                }
            }
        }
        return found;
    }

    /**
     * Completeness is the share of LocalBusiness properties that are present, minus one point per structural
     * problem in address or geo, never below zero.
     */
    public LocalBusinessCompleteness inspect(SchemaEntity entity) {
        if (!isLocalBusiness(entity)) {
            throw new IllegalArgumentException("entity is not a LocalBusiness");
        }
        Map<String, Object> properties = entity.getProperties();
        SchemaRules.TypeRule rule = schemaRules.localBusinessRule();
        List<String> missingRequired = missing(rule.required(), properties);
        List<String> missingRecommended = missing(rule.recommended(), properties);

        ValidationCollector collector = new ValidationCollector();
        if (!SchemaValues.isStrictEmpty(properties.get("address"))) {
            nestedValidator.validateAddress(properties.get("address"), collector);
        }
        if (!SchemaValues.isStrictEmpty(properties.get("geo"))) {
            nestedValidator.validateGeo(properties.get("geo"), collector);
        }
        List<String> incomplete = collector.getIssues();

        int total = rule.required().size() + rule.recommended().size();
        int present = total - missingRequired.size() - missingRecommended.size() - incomplete.size();
        double completeness = Math.max(0D, TextUtils.percentage(present, total));
        return LocalBusinessCompleteness.builder()
            .schemaType(entity.getPrimaryType())
            .valid(missingRequired.isEmpty() && incomplete.isEmpty())
            .completeness(completeness)
            .missingRequired(missingRequired)
            .missingRecommended(missingRecommended)
            .incompleteProperties(incomplete)
            .build();
    }

    private List<String> missing(List<String> names, Map<String, Object> properties) {
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (SchemaValues.isStrictEmpty(properties.get(name))) {
                missing.add(name);
            }
        }
        return missing;
    }

}
