package fun.fengwk.seo.core.service.analysis.model;

import fun.fengwk.seo.core.service.keyword.model.CannibalizationIssue;
import fun.fengwk.seo.core.service.keyword.model.KeywordCoverage;
import fun.fengwk.seo.core.service.keyword.model.TopicCluster;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Keyword usage across the documents of a site.
 *
 * @author fengwk
 */
@Data
@Builder
public class SiteKeywordReport {

    private int totalDocuments;
    private double similarityThreshold;
    private List<CannibalizationIssue> issues;
    private KeywordCoverage coverage;
    private List<TopicCluster> clusters;

}
