package fun.fengwk.seo.core.service.keyword.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Readability of the sentences carrying a keyword, scored 0-10 around a 15 word ideal.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class KeywordReadability {

    private int sentenceCount;
    private double averageSentenceLength;
    private double score;
    private String status;

}
