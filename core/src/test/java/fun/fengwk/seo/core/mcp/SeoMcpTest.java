package fun.fengwk.seo.core.mcp;

import fun.fengwk.seo.core.service.analysis.SeoAnalysisService;
import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisRequest;
import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisResponse;
import fun.fengwk.seo.core.service.analysis.model.SiteKeywordResponse;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
public class SeoMcpTest {

    @Mock
    private SeoAnalysisService seoAnalysisService;

    @Mock
    private McpFormatter mcpFormatter;

    private SeoMcp seoMcp;

    @BeforeEach
    void setUp() {
        seoMcp = new SeoMcp(seoAnalysisService, mcpFormatter);
    }

    @Test
    public void testSeoAnalyze() {
        SeoAnalysisResponse response = SeoAnalysisResponse.builder()
            .statusCode(200)
            .build();
        when(seoAnalysisService.analyze(any(SeoAnalysisRequest.class))).thenReturn(response);
        when(mcpFormatter.format("seo_analyze_result.ftl", response, ReportFormat.TEXT)).thenReturn("ok");

        String result = seoMcp.analyze("<p>coffee</p>", "coffee", List.of("beans"), "post", "en",
            "https://example.com", null);
        log.info("seo_analyze result:\n{}", result);
        assertThat(result).isEqualTo("ok");

        ArgumentCaptor<SeoAnalysisRequest> captor = ArgumentCaptor.forClass(SeoAnalysisRequest.class);
        verify(seoAnalysisService).analyze(captor.capture());
        SeoAnalysisRequest request = captor.getValue();
        assertThat(request.getHtml()).isEqualTo("<p>coffee</p>");
        assertThat(request.getPrimaryKeyword()).isEqualTo("coffee");
        assertThat(request.getSecondaryKeywords()).containsExactly("beans");
        assertThat(request.getPostType()).isEqualTo("post");
        assertThat(request.getLanguage()).isEqualTo("en");
        assertThat(request.getBaseUrl()).isEqualTo("https://example.com");
    }

    @Test
    public void testSeoAnalyzeJsonFormat() {
        SeoAnalysisResponse response = SeoAnalysisResponse.builder()
            .statusCode(200)
            .build();
        when(seoAnalysisService.analyze(any(SeoAnalysisRequest.class))).thenReturn(response);
        when(mcpFormatter.format("seo_analyze_result.ftl", response, ReportFormat.JSON)).thenReturn("{}");

        String result = seoMcp.analyze("<p>coffee</p>", null, null, null, null, null, "JSON");

        assertThat(result).isEqualTo("{}");
        verify(mcpFormatter).format("seo_analyze_result.ftl", response, ReportFormat.JSON);
    }

    @Test
    public void testSeoAnalyzeRejectsUnknownFormat() {
        ArgumentCaptor<SeoAnalysisResponse> captor = ArgumentCaptor.forClass(SeoAnalysisResponse.class);
        when(mcpFormatter.format(eq("seo_analyze_result.ftl"), captor.capture())).thenReturn("Error: unsupported format: xml");

        String result = seoMcp.analyze("<p>coffee</p>", "coffee", null, null, null, null, "xml");

        assertThat(result).isEqualTo("Error: unsupported format: xml");
        assertThat(captor.getValue().getStatusCode()).isEqualTo(400);
        assertThat(captor.getValue().getError()).isEqualTo("unsupported format: xml");
        verifyNoInteractions(seoAnalysisService);
    }

    @Test
    public void testSeoCannibalization() {
        List<KeywordMapEntry> documents = List.of(
            KeywordMapEntry.builder().documentId("a").primaryKeyword("coffee maker").build());
        SiteKeywordResponse response = SiteKeywordResponse.builder()
            .statusCode(200)
            .build();
        when(seoAnalysisService.analyzeSite(documents, 80D)).thenReturn(response);
        when(mcpFormatter.format("seo_cannibalization_result.ftl", response, ReportFormat.TEXT)).thenReturn("ok");

        String result = seoMcp.cannibalization(documents, 80D, "text");

        assertThat(result).isEqualTo("ok");
        verify(seoAnalysisService).analyzeSite(documents, 80D);
        verify(mcpFormatter).format("seo_cannibalization_result.ftl", response, ReportFormat.TEXT);
    }

}
