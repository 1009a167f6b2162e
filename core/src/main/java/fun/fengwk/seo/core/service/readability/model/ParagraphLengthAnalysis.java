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
public class ParagraphLengthAnalysis {

    private int totalParagraphs;
    private double averageLength;
    private int longParagraphCount;
    private List<String> longParagraphExamples;
    private Map<String, Integer> distribution;

}
