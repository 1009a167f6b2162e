package fun.fengwk.seo.core.service.readability.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Data
@Builder
public class SentenceLengthAnalysis {

    private int totalSentences;
    private double averageLength;

    /**
     * Bucket name to sentence count, buckets in ascending length.
     */
    private Map<String, Integer> distribution;

    /**
     * Bucket name to share of sentences in percent.
     */
    private Map<String, Double> percentages;

    private int longSentenceCount;
    private List<String> longSentences;

}
