package fun.fengwk.seo.core.service.analysis.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class SiteKeywordResponse {

    private int statusCode;
    private SiteKeywordReport report;
    private Long elapsedMs;
    private String error;

}
