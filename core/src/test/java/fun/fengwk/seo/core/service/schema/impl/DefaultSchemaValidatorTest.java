package fun.fengwk.seo.core.service.schema.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.seo.core.service.schema.SchemaRules;
import fun.fengwk.seo.core.service.schema.SchemaTypeHierarchy;
import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import fun.fengwk.seo.core.service.schema.model.SchemaMessage;
import fun.fengwk.seo.core.service.schema.model.SchemaSource;
import fun.fengwk.seo.core.service.schema.model.SchemaValidationSummary;
import fun.fengwk.seo.core.service.schema.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class DefaultSchemaValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DefaultSchemaValidator validator =
        new DefaultSchemaValidator(SchemaRules.defaults(), SchemaTypeHierarchy.defaults());

    @Test
    public void shouldWarnOnBreadcrumbPositionGap() throws JsonProcessingException {
        ValidationResult result = validator.validate(json("{\"@type\":\"BreadcrumbList\",\"itemListElement\":["
            + "{\"@type\":\"ListItem\",\"position\":1,\"item\":\"https://example.com/\"},"
            + "{\"@type\":\"ListItem\",\"position\":2,\"item\":\"https://example.com/a\"},"
            + "{\"@type\":\"ListItem\",\"position\":4,\"item\":\"https://example.com/a/b\"}]}"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getWarnings()).containsExactly("ListItem 2 has incorrect position. Expected position 3 "
            + "but found 4. Positions should be sequential starting from 1.");
    }

    @Test
    public void shouldWarnWhenHighPriceBelowLowPrice() throws JsonProcessingException {
        ValidationResult result = validator.validate(json(
            "{\"@type\":\"AggregateOffer\",\"lowPrice\":10,\"highPrice\":5,\"priceCurrency\":\"USD\"}"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getWarnings()).contains("AggregateOffer highPrice (5) is less than lowPrice (10).");
        assertThat(result.getWarnings()).noneMatch(warning -> warning.contains("priceCurrency"));
    }

    @Test
    public void shouldReportMissingType() {
        ValidationResult result = validator.validate(Map.of("name", "No type"));

        assertThat(result.getSchemaType()).isEqualTo(DefaultSchemaValidator.UNKNOWN_TYPE);
        assertThat(result.isValid()).isFalse();
        assertThat(result.getIssues()).containsExactly("Missing @type property");
        assertThatThrownBy(() -> validator.validate((Map<String, Object>) null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldReportMissingRequiredAndRecommendedProperties() {
        ValidationResult result = validator.validate(Map.of("@type", "Article", "headline", "Hello"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getIssues()).containsExactly("Missing required properties: author, datePublished, publisher");
        assertThat(result.getWarnings()).containsExactly("Missing recommended properties: image, dateModified, mainEntityOfPage");
    }

    @Test
    public void shouldFallbackToGenericRules() {
        ValidationResult unknown = validator.validate(Map.of("@type", "Recipe", "name", "Cake"));
        ValidationResult thing = validator.validate(Map.of("@type", "Thing", "name", "Widget", "description", "A widget"));

        assertThat(unknown.isValid()).isTrue();
        assertThat(unknown.getWarnings()).containsExactly(
            "Schema type 'Recipe' is not specifically validated. Using generic validation rules.",
            "Missing recommended properties: description");
        assertThat(thing.getWarnings()).isEmpty();
    }

    @Test
    public void shouldValidateProductOffers() throws JsonProcessingException {
        ValidationResult result = validator.validate(json("{\"@type\":\"Product\",\"name\":\"Widget\",\"offers\":["
            + "{\"@type\":\"Offer\",\"price\":\"19.99\",\"priceCurrency\":\"USD\",\"availability\":\"https://schema.org/InStock\"},"
            + "{\"@type\":\"Offer\",\"price\":\"free\",\"availability\":\"Maybe\"}]}"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getIssues()).containsExactly(
            "Offer 1 has a non-numeric price: 'free'.",
            "Offer 1 is missing required property: priceCurrency.");
        assertThat(result.getWarnings()).contains(
            "Offer 1 has an invalid availability value: 'Maybe'. Recommended to use standard schema.org values.");
    }

    @Test
    public void shouldValidateFaqQuestions() throws JsonProcessingException {
        ValidationResult result = validator.validate(json("{\"@type\":\"FAQPage\",\"mainEntity\":["
            + "{\"@type\":\"Question\",\"name\":\"Why?\",\"acceptedAnswer\":{\"@type\":\"Answer\",\"text\":\"Because.\"}},"
            + "{\"@type\":\"Question\",\"name\":\"How?\"},"
            + "{\"@type\":\"Thing\"}]}"));

        assertThat(result.getIssues()).containsExactly(
            "Question 1 is missing the required 'acceptedAnswer' property.",
            "Item 2 in mainEntity should have @type: Question (found 'Thing').");
    }

    @Test
    public void shouldValidateHowToSteps() throws JsonProcessingException {
        ValidationResult result = validator.validate(json("{\"@type\":\"HowTo\",\"name\":\"Brew\",\"step\":["
            + "{\"@type\":\"HowToStep\",\"text\":\"Boil water\"},"
            + "{\"@type\":\"HowToSection\",\"name\":\"Serve\"},"
            + "{\"@type\":\"HowToStep\",\"name\":\"Pour\"}]}"));

        assertThat(result.getIssues()).containsExactly("HowToStep 2 is missing the required 'text' property.");
        assertThat(result.getWarnings()).contains("HowToStep 0 is missing the recommended 'name' property.");
    }

    @Test
    public void shouldApplyLocalBusinessRulesToSubtypes() throws JsonProcessingException {
        ValidationResult result = validator.validate(json("{\"@type\":\"Restaurant\",\"name\":\"Chez Nous\","
            + "\"address\":{\"@type\":\"PostalAddress\",\"streetAddress\":\"1 Main St\"},"
            + "\"geo\":{\"@type\":\"GeoCoordinates\",\"latitude\":123,\"longitude\":-74.006}}"));

        assertThat(result.getSchemaType()).isEqualTo("Restaurant");
        assertThat(result.getIssues()).containsExactly(
            "Missing required properties: telephone, openingHours, priceRange",
            "Address is missing required field: addressLocality",
            "Address is missing required field: addressRegion",
            "Address is missing required field: postalCode",
            "Invalid latitude value: must be between -90 and 90.");
    }

    @Test
    public void shouldValidateStandaloneReview() throws JsonProcessingException {
        ValidationResult result = validator.validate(json("{\"@type\":\"Review\","
            + "\"reviewRating\":{\"@type\":\"Rating\",\"ratingValue\":\"4\"},"
            + "\"author\":{\"@type\":\"Person\",\"name\":\"Ann\"}}"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).containsExactly("Review is missing recommended property: itemReviewed.");
    }

    @Test
    public void shouldSummarizeAllEntities() {
        List<SchemaEntity> entities = List.of(
            new SchemaEntity(SchemaSource.JSON_LD, Map.of("@type", "Person", "name", "Ann")),
            new SchemaEntity(SchemaSource.MICRODATA, Map.of("@type", "Event", "name", "Launch")));

        SchemaValidationSummary summary = validator.validateAll(entities);

        assertThat(summary.getTotalSchemas()).isEqualTo(2);
        assertThat(summary.getValidSchemas()).containsExactly("Person");
        assertThat(summary.getInvalidSchemas()).containsExactly("Event");
        assertThat(summary.getOverallScore()).isEqualTo(50D);
        assertThat(summary.getIssues()).extracting(SchemaMessage::getSchemaIndex).containsExactly(1);
        assertThat(validator.validateAll(null).getOverallScore()).isEqualTo(0D);
    }

    private Map<String, Object> json(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
        });
    }

}
