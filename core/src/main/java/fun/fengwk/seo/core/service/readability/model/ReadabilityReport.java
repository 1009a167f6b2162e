package fun.fengwk.seo.core.service.readability.model;

import lombok.Builder;
import lombok.Data;

/**
 * Readability statistics and indices of one text.
 *
 * <p>Syllable based values are null for CJK text.
 *
 * @author fengwk
 */
@Data
@Builder
public class ReadabilityReport {

    private String language;
    private boolean cjk;
    private int wordCount;
    private int sentenceCount;
    private Integer syllableCount;
    private Integer complexWordCount;
    private double averageWordsPerSentence;
    private Double averageSyllablesPerWord;
    private Double fleschReadingEase;
    private String gradeLevel;
    private Double smogIndex;
    private Double colemanLiauIndex;
    private SentenceLengthAnalysis sentenceLengths;
    private ParagraphLengthAnalysis paragraphLengths;
    private PassiveVoiceAnalysis passiveVoice;
    private TransitionWordAnalysis transitionWords;

}
