package fun.fengwk.seo.core.service.keyword.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Site-wide keyword usage summary.
 *
 * @author fengwk
 */
@Data
@Builder
public class KeywordCoverage {

    private int totalKeywords;
    private int uniqueKeywords;

    /**
     * Average number of assignments per unique keyword.
     */
    private double keywordDiversityScore;

    private List<TermFrequency> mostUsedKeywords;

    /**
     * Keywords assigned more than three times.
     */
    private List<TermFrequency> overusedKeywords;

    /**
     * Keywords assigned exactly once.
     */
    private List<TermFrequency> underusedKeywords;

    private List<String> keywordGaps;

}
