package fun.fengwk.seo.core.service.keyword.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Usage metrics of one keyword within one page.
 *
 * @author fengwk
 */
@Data
@Builder
public class KeywordAnalysis {

    private String keyword;
    private List<String> variations;
    private int count;
    private int wordCount;

    /**
     * Occurrences per hundred words.
     */
    private double density;

    private DensityStatus densityStatus;

    /**
     * 1 inside the sufficient band, decreasing towards 0 outside it.
     */
    private double densityScore;

    /**
     * Offset of the first occurrence as a share of the text length, null when absent.
     */
    private Double positionPercent;

    /**
     * Distance between first and last occurrence relative to the text length.
     */
    private double spread;

    private int contextualScore;
    private HeadingPresence headings;
    private ParagraphPresence paragraphs;
    private boolean inFirstParagraph;
    private boolean inMetaTitle;
    private boolean inMetaDescription;
    private NaturalUsageAssessment naturalUsage;
    private ProximityAnalysis proximity;
    private CompetitiveAssessment competitive;
    private KeywordReadability keywordReadability;
    private List<TermFrequency> lsiKeywords;

    /**
     * Frequent terms that outnumber the keyword itself.
     */
    private List<TermFrequency> competingTerms;

    private boolean sufficientUsage;
    private boolean fallbackUsed;

}
