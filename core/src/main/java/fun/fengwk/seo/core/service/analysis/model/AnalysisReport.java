package fun.fengwk.seo.core.service.analysis.model;

import fun.fengwk.seo.core.service.common.AnalysisOutcome;
import fun.fengwk.seo.core.service.intent.model.IntentProfile;
import fun.fengwk.seo.core.service.keyword.model.KeywordAnalysis;
import fun.fengwk.seo.core.service.keyword.model.KeywordBalance;
import fun.fengwk.seo.core.service.readability.model.ReadabilityReport;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Analysis report of one page. It only depends on the request, so analyzing the same input twice yields equal
 * reports.
 *
 * @author fengwk
 */
@Data
@Builder
public class AnalysisReport {

    /**
     * {@code empty} for blank html, {@code parse_failure} when only regex extraction was possible.
     */
    private AnalysisOutcome outcome;

    private String title;
    private String metaDescription;
    private String baseUrl;
    private String language;
    private ContentSummary content;

    /**
     * Null when no primary keyword was given.
     */
    private KeywordAnalysis primaryKeyword;

    private List<KeywordAnalysis> secondaryKeywords;
    private KeywordBalance keywordBalance;
    private ReadabilityReport readability;
    private SchemaReport schema;
    private IntentProfile intent;

}
