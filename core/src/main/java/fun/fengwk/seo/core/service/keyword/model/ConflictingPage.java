package fun.fengwk.seo.core.service.keyword.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class ConflictingPage {

    private String documentId;
    private String title;
    private String url;
    private KeywordRole role;

}
