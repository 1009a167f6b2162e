package fun.fengwk.seo.core.service.document;

import fun.fengwk.seo.core.service.common.AnalysisResult;
import fun.fengwk.seo.core.service.common.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link PageDocument} instances from raw HTML using jsoup.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class HtmlDocumentParser {

    private static final Pattern TITLE = Pattern.compile(
        "<title[^>]*>(.*?)</title>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern META = Pattern.compile("<meta\\b[^>]*>", Pattern.CASE_INSENSITIVE);

    public AnalysisResult<PageDocument> parse(String html, String baseUrl) {
        if (StringUtils.isBlank(html)) {
            return AnalysisResult.empty();
        }
        String base = StringUtils.defaultString(baseUrl);
        Document root;
        try {
            root = Jsoup.parse(html, base);
        } catch (RuntimeException ex) {
            log.warn("parse html failed, fallback to regex, baseUrl={}, error={}", base, ex.getMessage());
            return AnalysisResult.parseFailure(unparsed(html, base));
        }
        return AnalysisResult.ok(PageDocument.builder()
            .html(html)
            .root(root)
            .baseUrl(resolveBaseUrl(root, base))
            .plainText(TextUtils.collapseWhitespace(root.body() == null ? root.text() : root.body().text()))
            .title(extractTitle(root))
            .metaDescription(extractMetaDescription(root))
            .build());
    }

    /**
     * Document without a tree, built with regex extraction only.
     */
    public PageDocument unparsed(String html, String baseUrl) {
        return PageDocument.builder()
            .html(html)
            .root(null)
            .baseUrl(StringUtils.defaultString(baseUrl))
            .plainText(TextUtils.stripTags(html))
            .title(regexTitle(html))
            .metaDescription(regexMetaDescription(html))
            .build();
    }

    private String resolveBaseUrl(Document root, String base) {
        Element baseElement = root.selectFirst("base[href]");
        if (baseElement != null) {
            String resolved = baseElement.absUrl("href");
            if (StringUtils.isNotBlank(resolved)) {
                return resolved;
            }
            return baseElement.attr("href");
        }
        return base;
    }

    private String extractTitle(Document root) {
        String title = TextUtils.collapseWhitespace(root.title());
        if (StringUtils.isNotBlank(title)) {
            return title;
        }
        String metaTitle = metaContent(root, "meta[name=title]");
        if (StringUtils.isNotBlank(metaTitle)) {
            return metaTitle;
        }
        return metaContent(root, "meta[property=og:title]");
    }

    private String extractMetaDescription(Document root) {
        String description = metaContent(root, "meta[name=description]");
        if (StringUtils.isNotBlank(description)) {
            return description;
        }
        return metaContent(root, "meta[property=og:description]");
    }

    private String metaContent(Document root, String selector) {
        Element meta = root.selectFirst(selector);
        return meta == null ? "" : TextUtils.collapseWhitespace(meta.attr("content"));
    }

    private String regexTitle(String html) {
        Matcher matcher = TITLE.matcher(html);
        if (matcher.find()) {
            return TextUtils.stripTags(matcher.group(1));
        }
        String metaTitle = regexMeta(html, "title");
        return StringUtils.isNotBlank(metaTitle) ? metaTitle : regexMeta(html, "og:title");
    }

    private String regexMetaDescription(String html) {
        String description = regexMeta(html, "description");
        return StringUtils.isNotBlank(description) ? description : regexMeta(html, "og:description");
    }

    private String regexMeta(String html, String name) {
        Matcher matcher = META.matcher(html);
        Pattern namePattern = Pattern.compile(
            "(?:name|property)\\s*=\\s*[\"']" + Pattern.quote(name) + "[\"']", Pattern.CASE_INSENSITIVE);
        Pattern contentPattern = Pattern.compile("content\\s*=\\s*[\"']([^\"']*)[\"']", Pattern.CASE_INSENSITIVE);
        while (matcher.find()) {
            String tag = matcher.group();
            if (namePattern.matcher(tag).find()) {
                Matcher content = contentPattern.matcher(tag);
                if (content.find()) {
                    return TextUtils.stripTags(content.group(1));
                }
            }
        }
        return "";
    }

}
