package fun.fengwk.seo.core.service.analysis.model;

import fun.fengwk.seo.core.service.content.model.ContentBlock;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class ContentSummary {

    private int wordCount;
    private int paragraphCount;
    private int headingCount;
    private String firstParagraph;
    private List<ContentBlock> headings;

    /**
     * True when content came from regex extraction because no element tree was available.
     */
    private boolean fallbackUsed;

}
