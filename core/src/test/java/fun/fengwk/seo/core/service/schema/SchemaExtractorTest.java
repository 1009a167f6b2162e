package fun.fengwk.seo.core.service.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.seo.core.service.document.HtmlDocumentParser;
import fun.fengwk.seo.core.service.document.PageDocument;
import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import fun.fengwk.seo.core.service.schema.model.SchemaSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class SchemaExtractorTest {

    private final HtmlDocumentParser parser = new HtmlDocumentParser();
    private final SchemaExtractor extractor = new SchemaExtractor(new ObjectMapper());

    @Test
    public void shouldFlattenJsonLdGraphsAndArrays() {
        String html = "<html><head>"
            + "<script type=\"application/ld+json\">{\"@context\":\"https://schema.org\",\"@graph\":["
            + "{\"@type\":\"Organization\",\"name\":\"Acme\"},{\"@type\":\"WebSite\",\"name\":\"Acme site\"}]}</script>"
            + "<script type=\"application/ld+json\">[{\"@type\":\"Person\",\"name\":\"Jane\"}]</script>"
            + "<script type=\"application/ld+json\">{ not json </script>"
            + "</head><body></body></html>";

        List<SchemaEntity> entities = extractor.extract(document(html));

        assertThat(entities).extracting(SchemaEntity::getSource).containsOnly(SchemaSource.JSON_LD);
        assertThat(entities).extracting(SchemaEntity::getPrimaryType).containsExactly("Organization", "WebSite", "Person");
        assertThat(entities.get(0).getProperties()).containsEntry("name", "Acme");
    }

    @Test
    public void shouldKeepNestedMicrodataInsideParent() {
        String html = "<html><body>"
            + "<div itemscope itemtype=\"https://schema.org/Product\">"
            + "<h1 itemprop=\"name\">Widget</h1>"
            + "<meta itemprop=\"image\" content=\"a.jpg\"><meta itemprop=\"image\" content=\"b.jpg\">"
            + "<div itemprop=\"offers\" itemscope itemtype=\"https://schema.org/Offer\">"
            + "<span itemprop=\"price\">10</span><meta itemprop=\"priceCurrency\" content=\"USD\">"
            + "<link itemprop=\"availability\" href=\"https://schema.org/InStock\">"
            + "</div></div>"
            + "<div itemscope itemtype=\"https://example.org/Thing\"><span itemprop=\"name\">Other</span></div>"
            + "</body></html>";

        List<SchemaEntity> entities = extractor.extract(document(html));

        assertThat(entities).hasSize(1);
        SchemaEntity product = entities.get(0);
        assertThat(product.getSource()).isEqualTo(SchemaSource.MICRODATA);
        assertThat(product.getProperties())
            .containsEntry("@type", "Product")
            .containsEntry("name", "Widget")
            .containsEntry("image", List.of("a.jpg", "b.jpg"))
            .containsEntry("offers", Map.of(
                "@type", "Offer",
                "price", "10",
                "priceCurrency", "USD",
                "availability", "https://schema.org/InStock"))
            .doesNotContainKey("price");
    }

    @Test
    public void shouldExtractRdfaWithVocabulary() {
        String html = "<html><body><div vocab=\"https://schema.org/\" typeof=\"Person\">"
            + "<span property=\"name\">Bob</span>"
            + "<div property=\"address\" typeof=\"PostalAddress\"><span property=\"addressLocality\">Paris</span></div>"
            + "</div></body></html>";

        List<SchemaEntity> entities = extractor.extract(document(html));

        assertThat(entities).hasSize(1);
        assertThat(entities.get(0).getSource()).isEqualTo(SchemaSource.RDFA);
        assertThat(entities.get(0).getProperties())
            .containsEntry("@type", "Person")
            .containsEntry("name", "Bob")
            .containsEntry("address", Map.of("@type", "PostalAddress", "addressLocality", "Paris"));
    }

    @Test
    public void shouldCollectUniqueTypesInOrder() {
        List<SchemaEntity> entities = List.of(
            new SchemaEntity(SchemaSource.JSON_LD, Map.of("@type", List.of("Restaurant", "LocalBusiness"))),
            new SchemaEntity(SchemaSource.MICRODATA, Map.of("@type", "Restaurant")),
            new SchemaEntity(SchemaSource.RDFA, Map.of("name", "untyped")));

        assertThat(extractor.extractTypes(entities)).containsExactly("Restaurant", "LocalBusiness");
    }

    @Test
    public void shouldReturnNothingForUnparsedDocument() {
        PageDocument unparsed = parser.unparsed("<script type=\"application/ld+json\">{\"@type\":\"Thing\"}</script>", "");

        assertThat(extractor.extract(unparsed)).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    private PageDocument document(String html) {
        return parser.parse(html, "https://example.com/").getData();
    }

}
