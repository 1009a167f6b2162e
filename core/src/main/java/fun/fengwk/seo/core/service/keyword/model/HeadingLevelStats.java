package fun.fengwk.seo.core.service.keyword.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class HeadingLevelStats {

    private int count;
    private int keywordMatches;
    private List<String> texts;

}
