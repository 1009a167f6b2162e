package fun.fengwk.seo.core.service.keyword;

import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.document.PageDocument;
import fun.fengwk.seo.core.service.keyword.model.DensityStatus;
import fun.fengwk.seo.core.service.keyword.model.KeywordAnalysis;
import fun.fengwk.seo.core.service.keyword.model.KeywordBalance;

import java.util.List;

/**
 * Keyword usage analysis of a single page.
 *
 * @author fengwk
 */
public interface KeywordAnalyzer {

    /**
     * Analyze keyword usage against the extracted content of a page.
     *
     * @param keyword keyword, matched case-insensitively after whitespace normalization
     * @param document page document, provides meta title and description
     * @param content extracted content of the same page
     * @return keyword analysis, zero valued when the content is empty
     * @throws IllegalArgumentException when the keyword is blank
     */
    KeywordAnalysis analyze(String keyword, PageDocument document, ExtractedContent content);

    /**
     * Balance between the primary keyword and the average of the secondary keywords.
     */
    KeywordBalance balance(KeywordAnalysis primary, List<KeywordAnalysis> secondaries);

    int countOccurrences(String keyword, String text);

    /**
     * {@code 100 * count / wordCount} rounded to two places, 0 when either is 0.
     */
    double density(int count, int wordCount);

    DensityStatus densityStatus(double density);

    double densityScore(double density);

    /**
     * Evenness of occurrence offsets on a 0-10 scale.
     */
    double distributionScore(List<Integer> offsets, int textLength);

    boolean containsKeyword(String keyword, String text);

}
