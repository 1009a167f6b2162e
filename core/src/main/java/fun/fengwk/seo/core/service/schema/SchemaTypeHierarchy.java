package fun.fengwk.seo.core.service.schema;

import java.util.List;
import java.util.Map;

/**
 * Flat parent to subtype table, one level deep.
 *
 * @author fengwk
 */
public class SchemaTypeHierarchy {

    private final Map<String, List<String>> subtypes;

    public SchemaTypeHierarchy(Map<String, List<String>> subtypes) {
        this.subtypes = Map.copyOf(subtypes);
    }

    public static SchemaTypeHierarchy defaults() {
        return new SchemaTypeHierarchy(Map.of(
            SchemaRules.LOCAL_BUSINESS, List.of(
                "AnimalShelter", "AutomotiveBusiness", "ChildCare", "Dentist", "DryCleaningOrLaundry",
                "EmergencyService", "EmploymentAgency", "EntertainmentBusiness", "FinancialService",
                "FoodEstablishment", "GovernmentOffice", "HealthAndBeautyBusiness", "HomeAndConstructionBusiness",
                "InternetCafe", "LegalService", "Library", "LodgingBusiness", "MedicalBusiness",
                "ProfessionalService", "RadioStation", "RealEstateAgent", "RecyclingCenter", "SelfStorage",
                "ShoppingCenter", "SportsActivityLocation", "Store", "TelevisionStation",
                "TouristInformationCenter", "TravelAgency", "Restaurant", "Cafe", "Bar", "Hotel", "Motel", "Resort"),
            "CreativeWork", List.of(
                "Article", "BlogPosting", "NewsArticle", "WebPage", "Book", "Recipe", "Movie", "TVSeries",
                "SoftwareApplication", "FAQPage", "HowTo", "Course", "Review"),
            "Organization", List.of(
                "Corporation", "EducationalOrganization", "GovernmentOrganization", "MedicalOrganization", "NGO",
                "School", "SportsOrganization", "LocalBusiness"),
            "WebPage", List.of(
                "AboutPage", "CheckoutPage", "ContactPage", "CollectionPage", "FAQPage", "ItemPage", "ProfilePage",
                "SearchResultsPage"),
            "Product", List.of("IndividualProduct", "ProductGroup", "Vehicle", "Offer")
        ));
    }

    /**
     * True when type equals parent or is listed as its direct subtype.
     */
    public boolean belongsTo(String type, String parent) {
        if (type == null || parent == null) {
            return false;
        }
        if (type.equals(parent)) {
            return true;
        }
        return subtypes.getOrDefault(parent, List.of()).contains(type);
    }

    public boolean isLocalBusinessType(String type) {
        return belongsTo(type, SchemaRules.LOCAL_BUSINESS);
    }

}
