package fun.fengwk.seo.core.service.analysis.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class SeoAnalysisResponse {

    private int statusCode;
    private AnalysisReport report;
    private Long elapsedMs;
    private String error;

}
