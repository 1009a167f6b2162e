package fun.fengwk.seo.core.service.intent;

import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.intent.model.SearchIntent;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects boolean content markers telling whether a page serves a given search intent.
 *
 * <p>Markup markers are jsoup selectors over the content region, wording markers run on the region text. Both
 * ignore case. Page chrome never reaches the detector since the region has its boilerplate removed.
 *
 * @author fengwk
 */
@Component
public class IntentMarkerDetector {

    public static final String STRUCTURED_CONTENT = "has_structured_content";
    public static final String MULTIMEDIA = "has_multimedia";
    public static final String SEMANTIC_MARKUP = "has_semantic_markup";

    public static final String DEFINITION = "has_definition";
    public static final String EXAMPLES = "has_examples";
    public static final String STEP_BY_STEP = "has_step_by_step";
    public static final String FAQ = "has_faq";
    public static final String DATA_TABLES = "has_data_tables";
    public static final String STATISTICS = "has_statistics";
    public static final String EXPLANATIONS = "has_explanations";
    public static final String COMPARISONS = "has_comparisons";
    public static final String DIAGRAMS = "has_diagrams";

    public static final String PRICING = "has_pricing";
    public static final String CALL_TO_ACTION = "has_call_to_action";
    public static final String PRODUCT_DETAILS = "has_product_details";
    public static final String PURCHASE_OPTIONS = "has_purchase_options";
    public static final String TRUST_SIGNALS = "has_trust_signals";
    public static final String URGENCY = "has_urgency";
    public static final String SHOPPING_CART = "has_shopping_cart";

    public static final String DIRECT_LINKS = "has_direct_links";
    public static final String CONTACT_INFO = "has_contact_info";
    public static final String LOCATION_DETAILS = "has_location_details";
    public static final String NAVIGATION_MENU = "has_navigation_menu";
    public static final String SEARCH_FUNCTIONALITY = "has_search_functionality";
    public static final String HOURS_INFO = "has_hours_info";

    public static final String COMPARISON = "has_comparison";
    public static final String REVIEWS = "has_reviews";
    public static final String PROS_CONS = "has_pros_cons";
    public static final String RECOMMENDATIONS = "has_recommendations";
    public static final String DECISION_AIDS = "has_decision_aids";
    public static final String EXPERT_OPINIONS = "has_expert_opinions";
    public static final String VALUE_ASSESSMENT = "has_value_assessment";

    private static final String HEADINGS = "h1, h2, h3, h4, h5, h6";
    private static final Pattern ANY_TEXT = Pattern.compile("[\\p{L}\\p{N}]");
    private static final Pattern LAYOUT_SECTION_ATTR = attr("(?:class|id)=\"[^\"]*(?:section|container|wrapper|block)");
    private static final int LONG_PARAGRAPH_CHARS = 40;

    private static final String MEDIA = "video, iframe, audio, canvas, svg, object, embed";
    private static final String SEMANTIC_TAGS = "article, section, nav, aside, header, footer, main, figure, figcaption, time, mark";
    private static final String SCHEMA_ORG = "[itemscope], [itemtype*=schema.org], script[type=\"application/ld+json\"]";
    private static final String SOCIAL_META = "meta[property^=og:], meta[name^=twitter:]";

    private static final Pattern DEFINITION_TEXT = text("is a|refers to|defined as|means|describes|represents|constitutes|signifies|denotes|stands for|indicates");
    private static final Pattern EXAMPLES_TEXT = text("example|for instance|such as|e\\.g\\.|to illustrate|case in point|specifically|in particular|notably|for example|like");
    private static final Pattern STEPS_TEXT = text("step \\d|first|second|third|fourth|fifth|next|finally|lastly|initially|begin by|start with|follow with");
    private static final Pattern FAQ_TEXT = text("faq|frequently asked questions|common questions|questions and answers");
    private static final Pattern FAQ_ATTR = attr("faq|accordion");
    private static final Pattern STATISTICS_TEXT = text("\\d+%|\\d+\\s*percent|statistics|data shows|research indicates|according to|study found|survey|poll results");
    private static final Pattern EXPLANATIONS_TEXT = text("because|therefore|thus|hence|as a result|consequently|due to|since|explains why|reason for|cause of");
    private static final Pattern COMPARISONS_TEXT = text("compared to|in contrast|on the other hand|whereas|while|unlike|similarly|likewise|however|although|despite");
    private static final Pattern DIAGRAM_ATTR = attr("diagram|chart|graph|infographic");

    private static final Pattern PRICING_TEXT = text("\\$\\d+|\\d+\\s*(?:dollars|USD|EUR|GBP)|(?:price|cost|pricing|fee|charge|payment|subscription|plan)(?:\\s+(?:is|of|at))?\\s+\\$?\\d+");
    private static final Pattern BUTTON_ATTR = attr("btn|button|cta");
    private static final Pattern ACTION_TEXT = text("buy|shop|order|get|purchase|add to cart|checkout|subscribe|sign up|register|join now|start|try|download|book|reserve");
    private static final Pattern PRODUCT_DETAILS_TEXT = text("specifications|features|details|dimensions|weight|size|measurements|materials?|ingredients|components|technical specs");
    private static final Pattern PURCHASE_OPTIONS_TEXT = text("options|variations|models|packages|bundles|plans|tiers|editions|versions|colors|sizes|styles|configurations");
    private static final Pattern TRUST_TEXT = text("guarantee|warranty|secure checkout|money back|return policy|free returns|satisfaction|trusted|certified|official|authorized");
    private static final Pattern URGENCY_TEXT = text("limited time|offer ends|sale ends|expires|only \\d+ left|while supplies last|act now|don't miss|hurry|today only");
    private static final Pattern CART_ATTR = attr("cart|checkout|basket");

    private static final Pattern DIRECT_LINK_TEXT = text("official|website|login|sign in|portal|dashboard|account|homepage|main page");
    private static final Pattern CONTACT_TEXT = text("contact|email|phone|call us|reach us|get in touch|support team|help desk|customer service");
    private static final Pattern EMAIL = text("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE = text("\\b(?:\\+\\d{1,3}[-\\s]?)?\\(?\\d{3}\\)?[-\\s]?\\d{3}[-\\s]?\\d{4}\\b");
    private static final Pattern LOCATION_TEXT = text("address|location|map|directions|where to find|how to get to|visit us|our office|headquarters|branch|store location");
    private static final Pattern MAP_ATTR = attr("maps?\\.google|maps?\\.apple|openstreetmap");
    private static final Pattern NAVIGATION_ATTR = attr("menu|navigation|navbar|nav-bar");
    private static final Pattern SEARCH_ATTR = attr("search|find");
    private static final Pattern HOURS_TEXT = text("hours|open from|available from|schedule|availability|opening times|business hours|working hours");

    private static final Pattern COMPARISON_TEXT = text("compare|vs\\.|versus|alternative|differences?|similarities|better than|worse than|compared to|in contrast to");
    private static final Pattern REVIEWS_TEXT = text("review|rating|stars?\\b|score|feedback|testimonials?|opinions?|experiences?|what others say|customer reviews");
    private static final Pattern REVIEW_ATTR = attr("rating|stars|reviews");
    private static final Pattern PROS_CONS_TEXT = text("pros?\\b|cons?\\b|advantages?|disadvantages?|benefits?|drawbacks?|strengths?|weaknesses?|positives?|negatives?|good points|bad points");
    private static final Pattern RECOMMENDATIONS_TEXT = text("recommend|best|top|suggested|ideal for|perfect for|suited for|designed for|made for|great for|excellent for|suitable for");
    private static final Pattern DECISION_AIDS_TEXT = text("buying guide|comparison chart|decision matrix|feature comparison|side by side|head to head|face off|showdown");
    private static final Pattern EXPERT_TEXT = text("expert|specialist|professional opinion|according to|authority|industry leader|thought leader");
    private static final Pattern VALUE_TEXT = text("value for money|worth the price|investment|cost-effective|budget-friendly|premium|luxury|affordable|expensive|overpriced|underpriced");

    /**
     * Detects the markers of {@code intent} in the extracted content region and its text.
     */
    public Map<String, Boolean> detect(ExtractedContent content, SearchIntent intent) {
        if (content == null) {
            return detectInRegion(null, intent, "");
        }
        return detectInRegion(content.getRegion(), intent, content.getRegionText());
    }

    /**
     * Detects markers in an html fragment, for callers holding markup without an extracted region.
     *
     * @param html html fragment, may be empty
     * @param text text without markup, may be empty
     */
    public Map<String, Boolean> detect(String html, String text, SearchIntent intent) {
        Element region = StringUtils.isBlank(html) ? null : Jsoup.parseBodyFragment(html).body();
        return detectInRegion(region, intent, text);
    }

    /**
     * Universal quality markers first, then the markers of {@code intent}, in a stable order.
     */
    private Map<String, Boolean> detectInRegion(Element region, SearchIntent intent, String text) {
        Element content = region == null ? new Element("div") : region;
        String clean = text == null ? "" : text;
        Map<String, Boolean> markers = new LinkedHashMap<>();
        markers.put(STRUCTURED_CONTENT, hasStructuredContent(content));
        markers.put(MULTIMEDIA, hasMultimedia(content));
        markers.put(SEMANTIC_MARKUP, hasSemanticMarkup(content));

        switch (intent) {
            case INFORMATIONAL:
                markers.put(DEFINITION, find(DEFINITION_TEXT, clean));
                markers.put(EXAMPLES, find(EXAMPLES_TEXT, clean));
                markers.put(STEP_BY_STEP, !content.select("ol").isEmpty() || find(STEPS_TEXT, clean));
                markers.put(FAQ, find(FAQ_TEXT, clean) || anyText(content, HEADINGS, FAQ_TEXT) || anyAttribute(content, "*", FAQ_ATTR));
                markers.put(DATA_TABLES, !content.select("table").isEmpty());
                markers.put(STATISTICS, find(STATISTICS_TEXT, clean));
                markers.put(EXPLANATIONS, find(EXPLANATIONS_TEXT, clean));
                markers.put(COMPARISONS, find(COMPARISONS_TEXT, clean));
                markers.put(DIAGRAMS, anyAttribute(content, "img", DIAGRAM_ATTR));
                break;
            case TRANSACTIONAL:
                markers.put(PRICING, find(PRICING_TEXT, clean));
                markers.put(CALL_TO_ACTION, !content.select("button").isEmpty()
                    || anyAttribute(content, "a", BUTTON_ATTR) || anyText(content, "a", ACTION_TEXT));
                markers.put(PRODUCT_DETAILS, find(PRODUCT_DETAILS_TEXT, clean));
                markers.put(PURCHASE_OPTIONS, find(PURCHASE_OPTIONS_TEXT, clean));
                markers.put(TRUST_SIGNALS, find(TRUST_TEXT, clean));
                markers.put(URGENCY, find(URGENCY_TEXT, clean));
                markers.put(SHOPPING_CART, anyAttribute(content, "form, div, button, a", CART_ATTR));
                break;
            case NAVIGATIONAL:
                markers.put(DIRECT_LINKS, anyText(content, "a", DIRECT_LINK_TEXT));
                markers.put(CONTACT_INFO, find(CONTACT_TEXT, clean) || find(EMAIL, clean) || find(PHONE, clean));
                markers.put(LOCATION_DETAILS, find(LOCATION_TEXT, clean) || anyAttribute(content, "iframe", MAP_ATTR));
                markers.put(NAVIGATION_MENU, anyAttribute(content, "nav, ul, ol, div", NAVIGATION_ATTR));
                markers.put(SEARCH_FUNCTIONALITY, anyAttribute(content, "form, input, div", SEARCH_ATTR));
                markers.put(HOURS_INFO, find(HOURS_TEXT, clean));
                break;
            case COMMERCIAL:
                markers.put(COMPARISON, find(COMPARISON_TEXT, clean));
                markers.put(REVIEWS, find(REVIEWS_TEXT, clean) || anyAttribute(content, "div, span", REVIEW_ATTR));
                markers.put(PROS_CONS, find(PROS_CONS_TEXT, clean));
                markers.put(RECOMMENDATIONS, find(RECOMMENDATIONS_TEXT, clean));
                markers.put(DECISION_AIDS, find(DECISION_AIDS_TEXT, clean));
                markers.put(EXPERT_OPINIONS, find(EXPERT_TEXT, clean));
                markers.put(VALUE_ASSESSMENT, find(VALUE_TEXT, clean));
                break;
            default:
                break;
        }
        return markers;
    }

    boolean hasStructuredContent(Element content) {
        if (!anyText(content, HEADINGS, ANY_TEXT)) {
            return false;
        }
        if (!content.select("ul > li, ol > li").isEmpty() || anyAttribute(content, "section, div", LAYOUT_SECTION_ATTR)) {
            return true;
        }
        for (Element paragraph : content.select("p")) {
            if (paragraph.text().length() >= LONG_PARAGRAPH_CHARS) {
                return true;
            }
        }
        return false;
    }

    boolean hasMultimedia(Element content) {
        for (Element image : content.select("img[src]")) {
            if (StringUtils.isNotBlank(image.attr("src"))) {
                return true;
            }
        }
        return !content.select(MEDIA).isEmpty();
    }

    boolean hasSemanticMarkup(Element content) {
        return !content.select(SCHEMA_ORG).isEmpty()
            || !content.select(SEMANTIC_TAGS).isEmpty()
            || !content.select("[^aria-]").isEmpty()
            || !content.select(SOCIAL_META).isEmpty();
    }

    private static boolean anyText(Element content, String cssQuery, Pattern pattern) {
        for (Element element : content.select(cssQuery)) {
            if (pattern.matcher(element.text()).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Matches {@code pattern} against the rendered attributes, such as {@code class="cart-widget" id="x"}.
     */
    private static boolean anyAttribute(Element content, String cssQuery, Pattern pattern) {
        for (Element element : content.select(cssQuery)) {
            if (element.attributesSize() > 0 && pattern.matcher(element.attributes().html()).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean find(Pattern pattern, String input) {
        return !input.isEmpty() && pattern.matcher(input).find();
    }

    private static Pattern attr(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static Pattern text(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

}
