package fun.fengwk.seo.core.service.content.model;

import fun.fengwk.seo.core.service.common.TextUtils;
import lombok.Builder;
import lombok.Getter;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Main content of a page in document order.
 *
 * @author fengwk
 */
@Getter
@Builder
public class ExtractedContent {

    private final List<ContentBlock> blocks;

    /**
     * True when blocks come from regex scanning because no parsed tree was available.
     */
    private final boolean fallbackUsed;

    /**
     * Detached copy of the content region with boilerplate removed, null when no parsed tree was available.
     */
    private final Element region;

    public static ExtractedContent empty() {
        return ExtractedContent.builder().blocks(List.of()).fallbackUsed(false).build();
    }

    public List<String> getParagraphs() {
        return blocks.stream()
            .filter(block -> !block.isHeading())
            .map(ContentBlock::getText)
            .collect(Collectors.toList());
    }

    public List<ContentBlock> getHeadings() {
        return blocks.stream()
            .filter(ContentBlock::isHeading)
            .collect(Collectors.toList());
    }

    public String getFirstParagraph() {
        List<String> paragraphs = getParagraphs();
        return paragraphs.isEmpty() ? "" : paragraphs.get(0);
    }

    /**
     * Blocks joined with blank lines.
     */
    public String getPlainText() {
        return blocks.stream()
            .map(ContentBlock::getText)
            .collect(Collectors.joining("\n\n"));
    }

    /**
     * Text of the content region, falls back to the joined blocks when there is no region.
     */
    public String getRegionText() {
        return region == null ? getPlainText() : TextUtils.collapseWhitespace(region.text());
    }

    public String getParagraphText() {
        return String.join("\n\n", getParagraphs());
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

}
