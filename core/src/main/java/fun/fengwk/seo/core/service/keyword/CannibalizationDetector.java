package fun.fengwk.seo.core.service.keyword;

import fun.fengwk.seo.core.service.keyword.model.CannibalizationIssue;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;

import java.util.List;

/**
 * Detects documents of one site competing for the same keywords.
 *
 * @author fengwk
 */
public interface CannibalizationDetector {

    /**
     * Detect keyword collisions across a site.
     *
     * <p>Reports, per normalized keyword, a high severity issue when several documents target it as primary
     * keyword and a medium severity issue when more than two documents use it at all; then a medium severity
     * issue for every pair of distinct primary keywords whose similarity reaches the threshold.
     *
     * @param entries keyword map of the site
     * @param similarityThreshold similarity (0-100) at which distinct primary keywords collide
     * @return issues in detection order, empty when nothing collides
     */
    List<CannibalizationIssue> detect(List<KeywordMapEntry> entries, double similarityThreshold);

    /**
     * Issues that list the given document among their pages.
     */
    List<CannibalizationIssue> findConflicts(List<CannibalizationIssue> issues, String documentId);

}
