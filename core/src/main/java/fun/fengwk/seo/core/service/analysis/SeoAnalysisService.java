package fun.fengwk.seo.core.service.analysis;

import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisRequest;
import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisResponse;
import fun.fengwk.seo.core.service.analysis.model.SiteKeywordResponse;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;

import java.util.List;

/**
 * Analysis entry, failures are reported through the response status code and never thrown.
 *
 * @author fengwk
 */
public interface SeoAnalysisService {

    SeoAnalysisResponse analyze(SeoAnalysisRequest request);

    /**
     * @param similarityThreshold semantic cannibalization threshold within [0, 100], the configured one when null
     */
    SiteKeywordResponse analyzeSite(List<KeywordMapEntry> entries, Double similarityThreshold);

}
