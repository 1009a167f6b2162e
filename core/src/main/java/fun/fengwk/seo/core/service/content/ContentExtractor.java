package fun.fengwk.seo.core.service.content;

import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.document.PageDocument;

/**
 * Extracts main content blocks from a page, excluding chrome.
 *
 * @author fengwk
 */
public interface ContentExtractor {

    /**
     * Extract headings and meaningful paragraphs in document order.
     *
     * <p>Documents without a parsed tree fall back to regex scanning of the raw HTML with no boilerplate
     * filtering, and the result is flagged {@link ExtractedContent#isFallbackUsed()}.
     *
     * @param document page document, must not be null
     * @return extracted content, never null
     */
    ExtractedContent extract(PageDocument document);

}
