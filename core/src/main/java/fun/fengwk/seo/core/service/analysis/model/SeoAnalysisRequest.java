package fun.fengwk.seo.core.service.analysis.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Single page analysis request, the html is supplied already fetched.
 *
 * @author fengwk
 */
@Data
@Builder
public class SeoAnalysisRequest {

    private String html;
    private String baseUrl;
    private String primaryKeyword;
    private List<String> secondaryKeywords;

    /**
     * Content type such as post, page, product, location, store or review.
     */
    private String postType;

    /**
     * Language tag, the configured default language when blank.
     */
    private String language;

}
