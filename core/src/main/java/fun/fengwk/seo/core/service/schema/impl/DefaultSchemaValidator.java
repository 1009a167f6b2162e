package fun.fengwk.seo.core.service.schema.impl;

import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.schema.SchemaRules;
import fun.fengwk.seo.core.service.schema.SchemaTypeHierarchy;
import fun.fengwk.seo.core.service.schema.SchemaValidator;
import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import fun.fengwk.seo.core.service.schema.model.SchemaMessage;
import fun.fengwk.seo.core.service.schema.model.SchemaValidationSummary;
import fun.fengwk.seo.core.service.schema.model.ValidationResult;
import fun.fengwk.seo.core.service.schema.support.CollectionStructureValidator;
import fun.fengwk.seo.core.service.schema.support.NestedStructureValidator;
import fun.fengwk.seo.core.service.schema.support.SchemaValues;
import fun.fengwk.seo.core.service.schema.support.ValidationCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @author fengwk
 */
@Slf4j
@Component
public class DefaultSchemaValidator implements SchemaValidator {

    static final String UNKNOWN_TYPE = "Unknown";

    /**
     * Value object types checked by their structure validator only.
     */
    private static final Set<String> STRUCTURE_ONLY_TYPES = Set.of("Offer", "AggregateOffer", "Review", "AggregateRating");

    private final SchemaRules schemaRules;
    private final SchemaTypeHierarchy typeHierarchy;
    private final NestedStructureValidator nestedValidator = new NestedStructureValidator();
    private final CollectionStructureValidator collectionValidator = new CollectionStructureValidator();

    public DefaultSchemaValidator(SchemaRules schemaRules, SchemaTypeHierarchy typeHierarchy) {
        this.schemaRules = schemaRules;
        this.typeHierarchy = typeHierarchy;
    }

    @Override
    public ValidationResult validate(Map<String, Object> properties) {
        if (properties == null) {
            throw new IllegalArgumentException("schema properties cannot be null");
        }
        ValidationCollector collector = new ValidationCollector();
        String type = new SchemaEntity(null, properties).getPrimaryType();
        if (type == null || type.isBlank()) {
            collector.issue("Missing @type property");
            return toResult(UNKNOWN_TYPE, collector);
        }

        if (!STRUCTURE_ONLY_TYPES.contains(type)) {
            checkProperties(type, properties, collector);
        }
        validateStructure(type, properties, collector);
        return toResult(type, collector);
    }

    private void checkProperties(String type, Map<String, Object> properties, ValidationCollector collector) {
        SchemaRules.TypeRule rule = typeHierarchy.isLocalBusinessType(type)
            ? schemaRules.localBusinessRule()
            : schemaRules.ruleFor(type);
        if (rule == null) {
            rule = schemaRules.getGenericRule();
            if (!schemaRules.getGenericallyValidatedTypes().contains(type)) {
                collector.warning("Schema type '" + type + "' is not specifically validated. Using generic validation rules.");
            }
        }

        List<String> missingRequired = missing(rule.required(), properties);
        if (!missingRequired.isEmpty()) {
            collector.issue("Missing required properties: " + String.join(", ", missingRequired));
        }
        List<String> missingRecommended = missing(rule.recommended(), properties);
        if (!missingRecommended.isEmpty()) {
            collector.warning("Missing recommended properties: " + String.join(", ", missingRecommended));
        }
    }

    private void validateStructure(String type, Map<String, Object> properties, ValidationCollector collector) {
        switch (type) {
            case "Product":
                nestedValidator.validateProductStructure(properties, collector);
                break;
            case "FAQPage":
                collectionValidator.validateFaq(properties, collector);
                break;
            case "HowTo":
                collectionValidator.validateHowTo(properties, collector);
                break;
            case "BreadcrumbList":
                collectionValidator.validateBreadcrumb(properties, collector);
                break;
            case "Offer":
                nestedValidator.validateOffer(properties, "Offer", collector);
                break;
            case "AggregateOffer":
                nestedValidator.validateAggregateOffer(properties, collector);
                break;
            case "Review":
                nestedValidator.validateReviews(properties, true, collector);
                break;
            case "AggregateRating":
                nestedValidator.validateAggregateRating(properties, collector);
                break;
            default:
                if (typeHierarchy.isLocalBusinessType(type)) {
                    validateLocalBusinessStructure(properties, collector);
                }
        }
    }

    private void validateLocalBusinessStructure(Map<String, Object> properties, ValidationCollector collector) {
        if (!SchemaValues.isStrictEmpty(properties.get("address"))) {
            nestedValidator.validateAddress(properties.get("address"), collector);
        }
        if (!SchemaValues.isStrictEmpty(properties.get("geo"))) {
            nestedValidator.validateGeo(properties.get("geo"), collector);
        }
        if (!SchemaValues.isStrictEmpty(properties.get("review"))) {
            nestedValidator.validateReviews(properties.get("review"), false, collector);
        }
        if (!SchemaValues.isStrictEmpty(properties.get("aggregateRating"))) {
            nestedValidator.validateAggregateRating(properties.get("aggregateRating"), collector);
        }
    }

    @Override
    public SchemaValidationSummary validateAll(List<SchemaEntity> entities) {
        List<SchemaEntity> safeEntities = entities == null ? List.of() : entities;
        List<String> validSchemas = new ArrayList<>();
        List<String> invalidSchemas = new ArrayList<>();
        List<SchemaMessage> issues = new ArrayList<>();
        List<SchemaMessage> warnings = new ArrayList<>();
        for (int i = 0; i < safeEntities.size(); i++) {
            ValidationResult result = validate(safeEntities.get(i));
            if (result.isValid()) {
                validSchemas.add(result.getSchemaType());
            } else {
                invalidSchemas.add(result.getSchemaType());
            }
            for (String issue : result.getIssues()) {
                issues.add(new SchemaMessage(i, result.getSchemaType(), issue));
            }
            for (String warning : result.getWarnings()) {
                warnings.add(new SchemaMessage(i, result.getSchemaType(), warning));
            }
        }
        log.debug("schemas validated, total={}, valid={}", safeEntities.size(), validSchemas.size());
        return SchemaValidationSummary.builder()
            .totalSchemas(safeEntities.size())
            .validSchemas(validSchemas)
            .invalidSchemas(invalidSchemas)
            .issues(issues)
            .warnings(warnings)
            .overallScore(TextUtils.percentage(validSchemas.size(), safeEntities.size()))
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

    private ValidationResult toResult(String type, ValidationCollector collector) {
        return new ValidationResult(type, !collector.hasIssues(), collector.getIssues(), collector.getWarnings());
    }

}
