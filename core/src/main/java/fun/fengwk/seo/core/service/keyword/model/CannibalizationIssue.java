package fun.fengwk.seo.core.service.keyword.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A keyword collision between documents of one site.
 *
 * @author fengwk
 */
@Data
@Builder
public class CannibalizationIssue {

    private CannibalizationType type;
    private Severity severity;

    /**
     * Shared keyword, the first keyword of the pair for semantic similarity issues.
     */
    private String keyword;

    /**
     * Both keywords of a semantic similarity issue, otherwise the shared keyword only.
     */
    private List<String> keywords;

    /**
     * Similarity score, only set for semantic similarity issues.
     */
    private Double similarity;

    private List<ConflictingPage> pages;
    private String recommendation;

    public boolean involves(String documentId) {
        return pages != null && pages.stream().anyMatch(page -> page.getDocumentId().equals(documentId));
    }

}
