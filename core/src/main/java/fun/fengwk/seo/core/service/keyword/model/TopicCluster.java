package fun.fengwk.seo.core.service.keyword.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A pillar page and the pages supporting its topic.
 *
 * @author fengwk
 */
@Data
@Builder
public class TopicCluster {

    private String mainTopic;
    private ClusterPage pillarPage;
    private List<ClusterPage> supportingPages;
    private List<String> relatedKeywords;

}
