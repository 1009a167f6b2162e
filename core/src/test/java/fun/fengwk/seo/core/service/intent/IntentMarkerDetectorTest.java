package fun.fengwk.seo.core.service.intent;

import fun.fengwk.seo.core.service.content.impl.DefaultContentExtractor;
import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.document.HtmlDocumentParser;
import fun.fengwk.seo.core.service.intent.model.SearchIntent;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class IntentMarkerDetectorTest {

    private final IntentMarkerDetector detector = new IntentMarkerDetector();
    private final HtmlDocumentParser parser = new HtmlDocumentParser();
    private final DefaultContentExtractor extractor = new DefaultContentExtractor();

    @Test
    public void shouldDetectUniversalMarkers() {
        Element content = body("<article><h1>Guide</h1><ul><li>One</li></ul><img src=\"a.png\"></article>");

        assertThat(detector.hasStructuredContent(content)).isTrue();
        assertThat(detector.hasMultimedia(content)).isTrue();
        assertThat(detector.hasSemanticMarkup(content)).isTrue();
        assertThat(detector.hasStructuredContent(body("<h1>Only a heading</h1>"))).isFalse();
        assertThat(detector.hasMultimedia(body("<img src=\"\">"))).isFalse();
    }

    @Test
    public void shouldReadSingleQuotedMarkup() {
        String html = "<img src='a.jpg'><script type='application/ld+json'>{\"@type\":\"Article\"}</script>";

        Map<String, Boolean> markers = detector.detect(html, "", SearchIntent.INFORMATIONAL);

        assertThat(markers)
            .containsEntry(IntentMarkerDetector.MULTIMEDIA, true)
            .containsEntry(IntentMarkerDetector.SEMANTIC_MARKUP, true);
    }

    @Test
    public void shouldDetectInformationalMarkersInOrder() {
        String html = "<h2>Frequently Asked Questions</h2><ol><li>Close the valve</li></ol>";
        String text = "A faucet is a valve. For example, turn it left because water flows.";

        Map<String, Boolean> markers = detector.detect(html, text, SearchIntent.INFORMATIONAL);

        assertThat(markers.keySet()).startsWith(
            IntentMarkerDetector.STRUCTURED_CONTENT, IntentMarkerDetector.MULTIMEDIA, IntentMarkerDetector.SEMANTIC_MARKUP,
            IntentMarkerDetector.DEFINITION);
        assertThat(markers)
            .containsEntry(IntentMarkerDetector.DEFINITION, true)
            .containsEntry(IntentMarkerDetector.EXAMPLES, true)
            .containsEntry(IntentMarkerDetector.STEP_BY_STEP, true)
            .containsEntry(IntentMarkerDetector.FAQ, true)
            .containsEntry(IntentMarkerDetector.EXPLANATIONS, true)
            .containsEntry(IntentMarkerDetector.DATA_TABLES, false)
            .doesNotContainKey(IntentMarkerDetector.PRICING);
    }

    @Test
    public void shouldDetectTransactionalMarkers() {
        String html = "<div class=\"cart-widget\"></div><a class=\"btn\" href=\"/buy\">Buy now</a>";
        String text = "Price $49. Money back guarantee. Limited time offer.";

        Map<String, Boolean> markers = detector.detect(html, text, SearchIntent.TRANSACTIONAL);

        assertThat(markers)
            .containsEntry(IntentMarkerDetector.PRICING, true)
            .containsEntry(IntentMarkerDetector.CALL_TO_ACTION, true)
            .containsEntry(IntentMarkerDetector.TRUST_SIGNALS, true)
            .containsEntry(IntentMarkerDetector.URGENCY, true)
            .containsEntry(IntentMarkerDetector.SHOPPING_CART, true)
            .hasSize(10);
    }

    @Test
    public void shouldDetectNavigationalMarkers() {
        String html = "<nav class=\"main-menu\"><a href=\"/login\">Login</a></nav>";
        String text = "Call us at 555-123-4567. Business hours 9 to 5.";

        Map<String, Boolean> markers = detector.detect(html, text, SearchIntent.NAVIGATIONAL);

        assertThat(markers)
            .containsEntry(IntentMarkerDetector.DIRECT_LINKS, true)
            .containsEntry(IntentMarkerDetector.CONTACT_INFO, true)
            .containsEntry(IntentMarkerDetector.NAVIGATION_MENU, true)
            .containsEntry(IntentMarkerDetector.HOURS_INFO, true)
            .containsEntry(IntentMarkerDetector.SEARCH_FUNCTIONALITY, false);
    }

    @Test
    public void shouldIgnoreCallToActionInPageChrome() {
        ExtractedContent content = extract("<html><body>"
            + "<nav><a href=\"/shop\">Buy now</a></nav>"
            + "<main><h1>Espresso machines</h1><p>Our espresso machines brew rich coffee every morning.</p></main>"
            + "<footer><p>Contact us for opening hours.</p></footer>"
            + "</body></html>");

        Map<String, Boolean> markers = detector.detect(content, SearchIntent.TRANSACTIONAL);

        assertThat(content.getRegionText()).doesNotContain("Buy now").doesNotContain("Contact us");
        assertThat(markers).containsEntry(IntentMarkerDetector.CALL_TO_ACTION, false);
    }

    @Test
    public void shouldDetectCallToActionInContent() {
        ExtractedContent content = extract("<html><body>"
            + "<div class=\"menu\"><a href=\"/login\">Sign in</a></div>"
            + "<p>Our espresso machines brew rich coffee every morning.</p>"
            + "<p><a href=\"/buy\">Buy now</a></p>"
            + "</body></html>");

        Map<String, Boolean> markers = detector.detect(content, SearchIntent.TRANSACTIONAL);

        assertThat(content.getRegion()).isNotNull();
        assertThat(content.getRegionText()).doesNotContain("Sign in");
        assertThat(markers).containsEntry(IntentMarkerDetector.CALL_TO_ACTION, true);
    }

    @Test
    public void shouldHandleMissingContent() {
        Map<String, Boolean> markers = detector.detect(null, null, SearchIntent.COMMERCIAL);

        assertThat(markers).hasSize(10).doesNotContainValue(true);
        assertThat(detector.detect((ExtractedContent) null, SearchIntent.NAVIGATIONAL)).doesNotContainValue(true);
    }

    private Element body(String html) {
        return Jsoup.parseBodyFragment(html).body();
    }

    private ExtractedContent extract(String html) {
        return extractor.extract(parser.parse(html, "https://example.com").getData());
    }

}
