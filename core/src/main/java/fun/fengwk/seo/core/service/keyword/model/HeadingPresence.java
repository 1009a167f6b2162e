package fun.fengwk.seo.core.service.keyword.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * @author fengwk
 */
@Data
@Builder
public class HeadingPresence {

    private int totalHeadings;
    private int headingsWithKeyword;

    /**
     * Keyed h1 to h6.
     */
    private Map<String, HeadingLevelStats> levels;

}
