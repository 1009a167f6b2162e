package fun.fengwk.seo.core.service.content.impl;

import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.content.BoilerplateRules;
import fun.fengwk.seo.core.service.content.ContentExtractor;
import fun.fengwk.seo.core.service.content.model.ContentBlock;
import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.document.PageDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * jsoup based main content extractor.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DefaultContentExtractor implements ContentExtractor {

    private static final List<String> MAIN_REGION_SELECTORS = List.of(
        "main",
        "article",
        "div.entry-content",
        "div.post-content",
        "div[class*=content]",
        "section[class*=content]",
        "div#content",
        "div#primary"
    );

    private static final String HEADING_OR_PARAGRAPH = "h1, h2, h3, h4, h5, h6, p";

    private static final Pattern FALLBACK_BLOCK = Pattern.compile(
        "<(p|h[1-6])\\b[^>]*>(.*?)</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final BoilerplateRules boilerplateRules;

    public DefaultContentExtractor() {
        this(BoilerplateRules.defaults());
    }

    @Autowired
    public DefaultContentExtractor(BoilerplateRules boilerplateRules) {
        this.boilerplateRules = boilerplateRules;
    }

    @Override
    public ExtractedContent extract(PageDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        if (!document.isParsed()) {
            log.debug("no parsed tree, extract content with regex, baseUrl={}", document.getBaseUrl());
            return extractWithRegex(document.getHtml());
        }

        Document root = document.getRoot();
        String regionSelector = findRegionSelector(root);
        Set<Element> paragraphs = filterParagraphs(root.select(regionSelector == null ? "p" : regionSelector + " p"));
        List<ContentBlock> blocks = new ArrayList<>();
        for (Element element : root.select(HEADING_OR_PARAGRAPH)) {
            if ("p".equals(element.normalName())) {
                if (paragraphs.contains(element)) {
                    blocks.add(ContentBlock.paragraph(TextUtils.collapseWhitespace(element.text())));
                }
            } else if (isContentHeading(element)) {
                int level = element.normalName().charAt(1) - '0';
                blocks.add(ContentBlock.heading(level, TextUtils.collapseWhitespace(element.text())));
            }
        }
        return ExtractedContent.builder()
            .blocks(blocks)
            .fallbackUsed(false)
            .region(buildRegion(root, regionSelector))
            .build();
    }

    /**
     * First main region selector holding a meaningful paragraph, null when only the whole body is left.
     */
    private String findRegionSelector(Document root) {
        for (String selector : MAIN_REGION_SELECTORS) {
            Set<Element> selected = filterParagraphs(root.select(selector + " p"));
            if (!selected.isEmpty()) {
                log.debug("main region selected, selector={}, paragraphs={}", selector, selected.size());
                return selector;
            }
        }
        return null;
    }

    /**
     * Copies the outermost containers matched by {@code regionSelector}, or the body when there is none, then
     * removes every boilerplate element from the copy.
     */
    Element buildRegion(Document root, String regionSelector) {
        Element region;
        if (regionSelector == null) {
            region = root.body().clone();
        } else {
            region = new Element("div");
            Set<Element> containers = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Element container : root.select(regionSelector)) {
                if (boilerplateRules.isBoilerplate(container) || container.parents().stream().anyMatch(containers::contains)) {
                    continue;
                }
                containers.add(container);
                region.appendChild(container.clone());
            }
        }

        List<Element> boilerplate = new ArrayList<>();
        for (Element element : region.getAllElements()) {
            if (element != region && boilerplateRules.isBoilerplate(element)) {
                boilerplate.add(element);
            }
        }
        boilerplate.forEach(Element::remove);
        return region;
    }

    private Set<Element> filterParagraphs(Elements candidates) {
        Set<Element> selected = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Element candidate : candidates) {
            if (isMeaningfulParagraph(candidate) && !boilerplateRules.isBoilerplate(candidate)) {
                selected.add(candidate);
            }
        }
        return selected;
    }

    private boolean isContentHeading(Element heading) {
        return TextUtils.containsWordCharacter(heading.text()) && !boilerplateRules.isBoilerplate(heading);
    }

    /**
     * A paragraph counts when its text or one of its anchor labels carries a letter or digit.
     * Paragraphs holding only media or line breaks have no text and are rejected here.
     */
    boolean isMeaningfulParagraph(Element paragraph) {
        if (TextUtils.containsWordCharacter(paragraph.text())) {
            return true;
        }
        for (Element anchor : paragraph.select("a")) {
            if (TextUtils.containsWordCharacter(anchor.attr("aria-label"))
                || TextUtils.containsWordCharacter(anchor.attr("title"))) {
                return true;
            }
        }
        return false;
    }

    private ExtractedContent extractWithRegex(String html) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (StringUtils.isNotBlank(html)) {
            Matcher matcher = FALLBACK_BLOCK.matcher(html);
            while (matcher.find()) {
                String tag = matcher.group(1).toLowerCase();
                String text = TextUtils.stripTags(matcher.group(2));
                if (!TextUtils.containsWordCharacter(text)) {
                    continue;
                }
                if (tag.startsWith("h")) {
                    blocks.add(ContentBlock.heading(tag.charAt(1) - '0', text));
                } else {
                    blocks.add(ContentBlock.paragraph(text));
                }
            }
        }
        return ExtractedContent.builder()
            .blocks(blocks)
            .fallbackUsed(true)
            .build();
    }

}
