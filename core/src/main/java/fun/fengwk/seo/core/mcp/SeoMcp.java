package fun.fengwk.seo.core.mcp;

import fun.fengwk.seo.core.service.analysis.SeoAnalysisService;
import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisRequest;
import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisResponse;
import fun.fengwk.seo.core.service.analysis.model.SiteKeywordResponse;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;
import fun.fengwk.seo.core.utils.ReportToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class SeoMcp {

    static final String ANALYZE_TEMPLATE = "seo_analyze_result.ftl";
    static final String CANNIBALIZATION_TEMPLATE = "seo_cannibalization_result.ftl";

    private final SeoAnalysisService seoAnalysisService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "seo_analyze",
        description = """
            Analyze the SEO signals of one already fetched html page.
            Reports the extracted main content, primary and secondary keyword usage, readability scores, \
            schema.org markup with validation issues, and the search intent of the primary keyword with \
            a satisfaction score.
            Return format: a text report, or the full report as JSON when format is json; or an error message.""",
        resultConverter = ReportToolCallResultConverter.class)
    public String analyze(
        @ToolParam(description = "full html of the page") String html,
        @ToolParam(description = "primary keyword the page targets", required = false) String primaryKeyword,
        @ToolParam(description = "secondary keywords the page targets", required = false) List<String> secondaryKeywords,
        @ToolParam(description = "content type: post/page/product/location/store/review", required = false) String postType,
        @ToolParam(description = "language tag such as en, de, fr or zh, default en", required = false) String language,
        @ToolParam(description = "page url, used to resolve relative links", required = false) String baseUrl,
        @ToolParam(description = "output format: text/json, default text", required = false) String format
    ) {
        ReportFormat reportFormat;
        try {
            reportFormat = ReportFormat.fromValue(format);
        } catch (IllegalArgumentException ex) {
            SeoAnalysisResponse error = SeoAnalysisResponse.builder().statusCode(400).error(ex.getMessage()).build();
            return mcpFormatter.format(ANALYZE_TEMPLATE, error);
        }
        SeoAnalysisRequest request = SeoAnalysisRequest.builder()
            .html(html)
            .primaryKeyword(primaryKeyword)
            .secondaryKeywords(secondaryKeywords)
            .postType(postType)
            .language(language)
            .baseUrl(baseUrl)
            .build();
        SeoAnalysisResponse response = seoAnalysisService.analyze(request);
        return mcpFormatter.format(ANALYZE_TEMPLATE, response, reportFormat);
    }

    @Tool(name = "seo_cannibalization",
        description = """
            Detect keyword cannibalization across the documents of a site.
            Each document declares one primary keyword and optional secondary keywords. Reports documents \
            sharing a primary keyword, keywords used by more than two documents, semantically similar primary \
            keywords, keyword coverage and topic clusters.
            Return format: a text report, or the full report as JSON when format is json; or an error message.""",
        resultConverter = ReportToolCallResultConverter.class)
    public String cannibalization(
        @ToolParam(description = "keyword map, one entry per document with documentId, title, url, "
            + "primaryKeyword, secondaryKeywords and categories") List<KeywordMapEntry> documents,
        @ToolParam(description = "semantic similarity threshold within 0-100, default 70", required = false) Double similarityThreshold,
        @ToolParam(description = "output format: text/json, default text", required = false) String format
    ) {
        ReportFormat reportFormat;
        try {
            reportFormat = ReportFormat.fromValue(format);
        } catch (IllegalArgumentException ex) {
            SiteKeywordResponse error = SiteKeywordResponse.builder().statusCode(400).error(ex.getMessage()).build();
            return mcpFormatter.format(CANNIBALIZATION_TEMPLATE, error);
        }
        SiteKeywordResponse response = seoAnalysisService.analyzeSite(documents, similarityThreshold);
        return mcpFormatter.format(CANNIBALIZATION_TEMPLATE, response, reportFormat);
    }

}
