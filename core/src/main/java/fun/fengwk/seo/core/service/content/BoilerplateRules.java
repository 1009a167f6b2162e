package fun.fengwk.seo.core.service.content;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rules that mark page chrome (navigation, header, footer, sidebar, ads and so on).
 *
 * <p>An element is boilerplate when it or one of its ancestors, up to {@code maxDepth} levels, matches a tag,
 * an ARIA role, or contains a fragment in its class, id or label attributes.
 *
 * @author fengwk
 */
@Getter
@Builder
public class BoilerplateRules {

    @Singular
    private final Set<String> tags;

    @Singular
    private final Set<String> roles;

    @Singular
    private final List<String> classFragments;

    @Singular
    private final List<String> idFragments;

    @Singular
    private final List<String> labelAttributes;

    @Singular
    private final List<String> labelFragments;

    @Builder.Default
    private final int maxDepth = 50;

    public static BoilerplateRules defaults() {
        return BoilerplateRules.builder()
            .tags(List.of("aside", "nav", "header", "footer", "form"))
            .roles(List.of("navigation", "complementary", "contentinfo", "banner", "search"))
            .classFragments(List.of(
                "site-header", "header", "top-bar", "masthead", "navbar", "menu", "navigation", "nav",
                "breadcrumb", "sidebar", "widget", "footer", "site-footer", "bottom-bar", "copyright",
                "comments", "comment", "reply", "related", "sharing", "share", "social", "pagination", "pager",
                "author-box", "modal", "popup", "notice", "alert", "announcement", "newsletter", "subscribe",
                "cookie", "gdpr", "consent", "promo", "ads", "ad-", "advert", "sponsor"
            ))
            .idFragments(List.of(
                "header", "masthead", "top", "nav", "menu", "footer", "bottom", "copyright", "breadcrumb",
                "cookie", "gdpr", "notice", "modal", "popup"
            ))
            .labelAttributes(List.of("aria-label", "data-label", "data-component"))
            .labelFragments(List.of("menu", "navigation", "header", "footer", "breadcrumb"))
            .build();
    }

    public boolean isBoilerplate(Element element) {
        Element current = element;
        int depth = 0;
        while (current != null && depth <= maxDepth) {
            if (matches(current)) {
                return true;
            }
            current = current.parent();
            depth++;
        }
        return false;
    }

    private boolean matches(Element element) {
        String tag = element.normalName();
        if ("html".equals(tag) || "body".equals(tag) || "#root".equals(tag)) {
            return false;
        }
        if (tags.contains(tag)) {
            return true;
        }
        String role = lower(element.attr("role"));
        if (!role.isEmpty() && roles.contains(role)) {
            return true;
        }
        if (containsAny(lower(element.className()), classFragments)) {
            return true;
        }
        if (containsAny(lower(element.id()), idFragments)) {
            return true;
        }
        for (String attribute : labelAttributes) {
            if (element.hasAttr(attribute) && containsAny(lower(element.attr(attribute)), labelFragments)) {
                return true;
            }
        }
        return false;
    }

    private boolean containsAny(String value, List<String> fragments) {
        if (value.isEmpty()) {
            return false;
        }
        for (String fragment : fragments) {
            if (!fragment.isEmpty() && value.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

}
