package fun.fengwk.seo.core.service.schema;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Required and recommended properties per schema type.
 *
 * @author fengwk
 */
@Getter
public class SchemaRules {

    public static final String LOCAL_BUSINESS = "LocalBusiness";

    private final Map<String, TypeRule> rules;
    private final TypeRule genericRule;

    /**
     * Types validated by the generic rule without the "not specifically validated" warning.
     */
    private final Set<String> genericallyValidatedTypes;

    public SchemaRules(Map<String, TypeRule> rules, TypeRule genericRule, Set<String> genericallyValidatedTypes) {
        this.rules = Map.copyOf(rules);
        this.genericRule = genericRule;
        this.genericallyValidatedTypes = Set.copyOf(genericallyValidatedTypes);
    }

    public static SchemaRules defaults() {
        Map<String, TypeRule> rules = new LinkedHashMap<>();
        TypeRule article = new TypeRule(
            List.of("headline", "author", "datePublished", "publisher"),
            List.of("image", "dateModified", "mainEntityOfPage"));
        rules.put("Article", article);
        rules.put("BlogPosting", article);
        rules.put("NewsArticle", article);
        rules.put("Product", new TypeRule(
            List.of("name", "offers"),
            List.of("image", "description", "brand", "aggregateRating", "review")));
        rules.put("Organization", new TypeRule(
            List.of("name", "url"),
            List.of("logo", "contactPoint", "sameAs", "address")));
        rules.put(LOCAL_BUSINESS, new TypeRule(
            List.of("name", "address", "telephone", "openingHours", "geo", "priceRange"),
            List.of("description", "image", "url", "sameAs", "review", "aggregateRating", "hasMap")));
        rules.put("Person", new TypeRule(
            List.of("name"),
            List.of("image", "jobTitle", "worksFor", "sameAs")));
        rules.put("Event", new TypeRule(
            List.of("name", "startDate", "location"),
            List.of("image", "description", "endDate", "offers", "performer")));
        rules.put("FAQPage", new TypeRule(List.of("mainEntity"), List.of()));
        rules.put("HowTo", new TypeRule(
            List.of("name", "step"),
            List.of("image", "description", "totalTime", "supply", "tool")));
        rules.put("BreadcrumbList", new TypeRule(List.of("itemListElement"), List.of()));
        rules.put("VideoObject", new TypeRule(
            List.of("name", "description", "thumbnailUrl", "uploadDate"),
            List.of("contentUrl", "embedUrl", "duration", "interactionCount")));
        return new SchemaRules(
            rules,
            new TypeRule(List.of("name"), List.of("description")),
            Set.of("Thing", "CreativeWork", "Place", "Event", "Organization", "Person", "Product"));
    }

    /**
     * Rule of a type, null when the type has no dedicated rule.
     */
    public TypeRule ruleFor(String type) {
        return rules.get(type);
    }

    public TypeRule localBusinessRule() {
        return rules.get(LOCAL_BUSINESS);
    }

    public record TypeRule(List<String> required, List<String> recommended) {
    }

}
