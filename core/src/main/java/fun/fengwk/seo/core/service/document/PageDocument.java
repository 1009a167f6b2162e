package fun.fengwk.seo.core.service.document;

import lombok.Builder;
import lombok.Getter;
import org.jsoup.nodes.Document;

/**
 * Immutable view of one page prepared for analysis.
 *
 * <p>{@code root} is null when the HTML could not be parsed; consumers then work from {@code html} and
 * {@code plainText} only.
 *
 * @author fengwk
 */
@Getter
@Builder
public class PageDocument {

    private final String html;
    private final Document root;
    private final String baseUrl;
    private final String plainText;
    private final String title;
    private final String metaDescription;

    public boolean isParsed() {
        return root != null;
    }

}
