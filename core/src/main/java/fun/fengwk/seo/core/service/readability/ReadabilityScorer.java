package fun.fengwk.seo.core.service.readability;

import fun.fengwk.seo.core.service.readability.model.ReadabilityReport;

import java.util.List;

/**
 * Language-aware readability scoring.
 *
 * @author fengwk
 */
public interface ReadabilityScorer {

    /**
     * @param text plain text to score
     * @param paragraphs paragraphs of the same text, used for paragraph length analysis
     * @param language language tag such as {@code en} or {@code zh-hans}, blank means the default language
     * @return readability report, zero valued for empty text
     */
    ReadabilityReport score(String text, List<String> paragraphs, String language);

    /**
     * Flesch reading ease clamped to [0, 100], 0 when words or sentences are 0.
     */
    double fleschReadingEase(int words, int sentences, int syllables);

}
