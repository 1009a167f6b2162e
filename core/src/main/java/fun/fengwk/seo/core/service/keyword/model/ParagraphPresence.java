package fun.fengwk.seo.core.service.keyword.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class ParagraphPresence {

    private int totalParagraphs;
    private int paragraphsWithKeyword;
    private double distributionPercentage;

}
