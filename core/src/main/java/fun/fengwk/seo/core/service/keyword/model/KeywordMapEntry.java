package fun.fengwk.seo.core.service.keyword.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword assignment of one document within a site.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordMapEntry {

    private String documentId;
    private String title;
    private String url;
    private String primaryKeyword;

    @Builder.Default
    private List<String> secondaryKeywords = new ArrayList<>();

    @Builder.Default
    private List<String> categories = new ArrayList<>();

}
