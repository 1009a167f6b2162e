package fun.fengwk.seo.core.service.schema.support;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validators for nested value objects: address, geo coordinates, offers, reviews and ratings.
 *
 * @author fengwk
 */
public class NestedStructureValidator {

    private static final List<String> ADDRESS_FIELDS = List.of("streetAddress", "addressLocality", "addressRegion", "postalCode");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern SCHEMA_ORG_PREFIX = Pattern.compile("^https?://schema\\.org/");
    private static final Set<String> AVAILABILITY_VALUES = Set.of("InStock", "OutOfStock", "PreOrder", "SoldOut", "Discontinued");

    public void validateAddress(Object address, ValidationCollector collector) {
        if (SchemaValues.isStrictEmpty(address)) {
            collector.issue("Address data is empty or missing.");
            return;
        }
        if (!SchemaValues.hasType(address, "PostalAddress")) {
            collector.issue("Address is missing @type: PostalAddress or type is incorrect.");
        }
        Map<String, Object> fields = SchemaValues.asMap(address);
        for (String field : ADDRESS_FIELDS) {
            if (SchemaValues.isStrictEmpty(fields.get(field))) {
                collector.issue("Address is missing required field: " + field);
            }
        }
    }

    public void validateGeo(Object geo, ValidationCollector collector) {
        if (SchemaValues.isStrictEmpty(geo)) {
            collector.issue("Geo data is empty or missing.");
            return;
        }
        if (!SchemaValues.hasType(geo, "GeoCoordinates")) {
            collector.issue("Geo is missing @type: GeoCoordinates or type is incorrect.");
        }
        Map<String, Object> coordinates = SchemaValues.asMap(geo);
        validateCoordinate(coordinates.get("latitude"), "latitude", 90D, "40.7128", collector);
        validateCoordinate(coordinates.get("longitude"), "longitude", 180D, "-74.0060", collector);
    }

    private void validateCoordinate(Object value, String name, double limit, String example, ValidationCollector collector) {
        if (SchemaValues.isStrictEmpty(value)) {
            collector.issue("Geo is missing required field: " + name);
            return;
        }
        Double number = SchemaValues.toDouble(value);
        if (number == null || number < -limit || number > limit) {
            collector.issue(String.format("Invalid %s value: must be between -%d and %d.", name, (int) limit, (int) limit));
            return;
        }
        if (!DECIMAL.matcher(SchemaValues.display(value).trim()).matches()) {
            String label = Character.toUpperCase(name.charAt(0)) + name.substring(1);
            collector.warning(label + " must be in decimal format (e.g., " + example + ").");
        }
    }

    /**
     * Offers, reviews and aggregate rating of a Product.
     */
    public void validateProductStructure(Map<String, Object> product, ValidationCollector collector) {
        if (product.containsKey("offers")) {
            Object offers = product.get("offers");
            if (SchemaValues.isStrictEmpty(offers)) {
                collector.warning("Product schema has an empty \"offers\" property.");
            } else if (SchemaValues.isList(offers)) {
                List<Object> items = SchemaValues.asList(offers);
                for (int i = 0; i < items.size(); i++) {
                    validateOfferOrAggregate(items.get(i), "Offer " + i, collector);
                }
            } else if (SchemaValues.isMap(offers)) {
                validateOfferOrAggregate(offers, "Offer", collector);
            } else {
                collector.issue("Product offers must be an Offer, an AggregateOffer or an array of Offer items.");
            }
        }
        if (!SchemaValues.isStrictEmpty(product.get("review"))) {
            validateReviews(product.get("review"), false, collector);
        }
        if (!SchemaValues.isStrictEmpty(product.get("aggregateRating"))) {
            validateAggregateRating(product.get("aggregateRating"), collector);
        }
    }

    private void validateOfferOrAggregate(Object offer, String label, ValidationCollector collector) {
        if (SchemaValues.hasType(offer, "AggregateOffer")) {
            validateAggregateOffer(SchemaValues.asMap(offer), collector);
        } else {
            validateOffer(offer, label, collector);
        }
    }

    public void validateOffer(Object offer, String label, ValidationCollector collector) {
        if (!SchemaValues.isMap(offer)) {
            collector.issue(label + " is not a valid object.");
            return;
        }
        Map<String, Object> fields = SchemaValues.asMap(offer);
        if (!SchemaValues.hasType(offer, "Offer")) {
            collector.issue(label + " should have @type: Offer.");
        }
        Object price = fields.get("price");
        if (SchemaValues.isStrictEmpty(price)) {
            collector.issue(label + " is missing required property: price.");
        } else if (!SchemaValues.isNumeric(price)) {
            collector.issue(label + " has a non-numeric price: '" + SchemaValues.display(price) + "'.");
        }
        if (SchemaValues.isStrictEmpty(fields.get("priceCurrency"))) {
            collector.issue(label + " is missing required property: priceCurrency.");
        }
        Object availability = fields.get("availability");
        if (SchemaValues.isStrictEmpty(availability)) {
            collector.warning(label + " is missing recommended property: availability.");
        } else if (!isValidAvailability(SchemaValues.display(availability))) {
            collector.warning(label + " has an invalid availability value: '" + SchemaValues.display(availability)
                + "'. Recommended to use standard schema.org values.");
        }
    }

    private boolean isValidAvailability(String availability) {
        return AVAILABILITY_VALUES.contains(SCHEMA_ORG_PREFIX.matcher(availability.trim()).replaceFirst(""));
    }

    public void validateAggregateOffer(Map<String, Object> offer, ValidationCollector collector) {
        Object lowPrice = offer.get("lowPrice");
        Object highPrice = offer.get("highPrice");
        boolean lowValid = false;
        boolean highValid = false;
        if (SchemaValues.isStrictEmpty(lowPrice)) {
            collector.issue("AggregateOffer is missing required property: lowPrice.");
        } else if (!SchemaValues.isNumeric(lowPrice)) {
            collector.issue("AggregateOffer lowPrice must be numeric.");
        } else {
            lowValid = true;
        }
        if (SchemaValues.isStrictEmpty(offer.get("priceCurrency"))) {
            collector.issue("AggregateOffer is missing required property: priceCurrency.");
        }
        if (SchemaValues.isStrictEmpty(highPrice)) {
            collector.warning("AggregateOffer is missing recommended property: highPrice.");
        } else if (!SchemaValues.isNumeric(highPrice)) {
            collector.issue("AggregateOffer highPrice must be numeric.");
        } else {
            highValid = true;
        }
        if (lowValid && highValid && SchemaValues.toDouble(highPrice) < SchemaValues.toDouble(lowPrice)) {
            collector.warning("AggregateOffer highPrice (" + SchemaValues.display(highPrice)
                + ") is less than lowPrice (" + SchemaValues.display(lowPrice) + ").");
        }
        Object offerCount = offer.get("offerCount");
        if (SchemaValues.isStrictEmpty(offerCount)) {
            collector.warning("AggregateOffer is missing recommended property: offerCount.");
        } else {
            Double count = SchemaValues.toDouble(offerCount);
            if (count == null || count <= 0 || count != Math.floor(count)) {
                collector.warning("AggregateOffer offerCount must be a positive integer.");
            }
        }
    }

    /**
     * @param standalone true for a top-level Review entity, which should name what it reviews
     */
    public void validateReviews(Object reviews, boolean standalone, ValidationCollector collector) {
        if (SchemaValues.isList(reviews)) {
            List<Object> items = SchemaValues.asList(reviews);
            for (int i = 0; i < items.size(); i++) {
                validateReview(items.get(i), "Review " + i, standalone, collector);
            }
        } else {
            validateReview(reviews, "Review", standalone, collector);
        }
    }

    private void validateReview(Object review, String label, boolean standalone, ValidationCollector collector) {
        if (!SchemaValues.isMap(review)) {
            collector.issue(label + " is not a valid object.");
            return;
        }
        Map<String, Object> fields = SchemaValues.asMap(review);
        Object rating = fields.get("reviewRating");
        if (SchemaValues.isStrictEmpty(rating)) {
            collector.issue(label + " is missing required property: reviewRating.");
        } else {
            if (!SchemaValues.hasType(rating, "Rating")) {
                collector.issue(label + " reviewRating should have @type: Rating.");
            }
            Object ratingValue = SchemaValues.asMap(rating).get("ratingValue");
            if (SchemaValues.isStrictEmpty(ratingValue)) {
                collector.issue(label + " reviewRating is missing required property: ratingValue.");
            } else if (!SchemaValues.isNumeric(ratingValue)) {
                collector.issue(label + " reviewRating ratingValue must be numeric.");
            }
        }

        Object author = fields.get("author");
        if (SchemaValues.isStrictEmpty(author)) {
            collector.issue(label + " is missing required property: author.");
        } else if (!SchemaValues.hasType(author, "Person", "Organization")) {
            collector.issue(label + " author should have @type: Person or Organization.");
        } else if (SchemaValues.isStrictEmpty(SchemaValues.asMap(author).get("name"))) {
            collector.issue(label + " author is missing required property: name.");
        }

        Object itemReviewed = fields.get("itemReviewed");
        if (SchemaValues.isStrictEmpty(itemReviewed)) {
            if (standalone) {
                collector.warning(label + " is missing recommended property: itemReviewed.");
            }
        } else {
            Map<String, Object> reviewed = SchemaValues.asMap(itemReviewed);
            boolean hasId = !SchemaValues.isStrictEmpty(reviewed.get("@id")) || !SchemaValues.isStrictEmpty(reviewed.get("id"));
            if (SchemaValues.isStrictEmpty(reviewed.get("name")) || !hasId) {
                collector.issue(label + " itemReviewed must include a name and an @id.");
            }
        }
    }

    public void validateAggregateRating(Object aggregateRating, ValidationCollector collector) {
        if (!SchemaValues.isMap(aggregateRating)) {
            collector.issue("AggregateRating is not a valid object.");
            return;
        }
        Map<String, Object> fields = SchemaValues.asMap(aggregateRating);
        if (!SchemaValues.hasType(aggregateRating, "AggregateRating")) {
            collector.issue("AggregateRating should have @type: AggregateRating.");
        }
        Object ratingValue = fields.get("ratingValue");
        if (SchemaValues.isStrictEmpty(ratingValue)) {
            collector.issue("AggregateRating is missing required property: ratingValue.");
        } else if (!SchemaValues.isNumeric(ratingValue)) {
            collector.issue("AggregateRating ratingValue must be numeric.");
        }
        boolean reviewCount = SchemaValues.isNumeric(fields.get("reviewCount"));
        boolean ratingCount = SchemaValues.isNumeric(fields.get("ratingCount"));
        if (!reviewCount && !ratingCount) {
            collector.issue("AggregateRating must include either a numeric reviewCount or a numeric ratingCount property.");
        } else if (reviewCount && ratingCount) {
            collector.warning("AggregateRating includes both reviewCount and ratingCount, one of them is enough.");
        }
    }

}
