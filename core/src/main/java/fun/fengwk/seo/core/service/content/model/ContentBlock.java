package fun.fengwk.seo.core.service.content.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One heading or paragraph of main content.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class ContentBlock {

    private ContentBlockType type;

    /**
     * Heading level 1-6, 0 for paragraphs.
     */
    private int level;

    private String text;

    public static ContentBlock heading(int level, String text) {
        return new ContentBlock(ContentBlockType.HEADING, level, text);
    }

    public static ContentBlock paragraph(String text) {
        return new ContentBlock(ContentBlockType.PARAGRAPH, 0, text);
    }

    @JsonIgnore
    public boolean isHeading() {
        return type == ContentBlockType.HEADING;
    }

}
