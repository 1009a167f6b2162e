package fun.fengwk.seo.core.service.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.document.PageDocument;
import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import fun.fengwk.seo.core.service.schema.model.SchemaSource;
import fun.fengwk.seo.core.service.schema.support.SchemaValues;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts schema.org entities from JSON-LD, Microdata and RDFa.
 *
 * <p>All encodings end up as {@link SchemaEntity} maps. Properties of nested items stay inside the nested map,
 * and a property name seen twice within one item turns into a list keeping the first value first.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SchemaExtractor {

    private static final Pattern SCHEMA_ORG_PREFIX = Pattern.compile("^https?://schema\\.org/", Pattern.CASE_INSENSITIVE);
    private static final String RDFA_PREFIX = "schema:";
    private static final Markup MICRODATA = new Markup("itemscope", "itemtype", "itemprop");
    private static final Markup RDFA = new Markup("typeof", "typeof", "property");

    private final ObjectMapper objectMapper;

    public SchemaExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<SchemaEntity> extract(PageDocument document) {
        List<SchemaEntity> entities = new ArrayList<>();
        if (document == null || !document.isParsed()) {
            return entities;
        }
        Document root = document.getRoot();
        entities.addAll(extractJsonLd(root));
        entities.addAll(extractMicrodata(root));
        entities.addAll(extractRdfa(root));
        log.debug("schema extracted, baseUrl={}, count={}", document.getBaseUrl(), entities.size());
        return entities;
    }

    /**
     * Unique types across entities in order of appearance.
     */
    public List<String> extractTypes(List<SchemaEntity> entities) {
        Set<String> types = new LinkedHashSet<>();
        for (SchemaEntity entity : entities) {
            types.addAll(entity.getTypes());
        }
        return new ArrayList<>(types);
    }

    List<SchemaEntity> extractJsonLd(Document root) {
        List<SchemaEntity> entities = new ArrayList<>();
        for (Element script : root.select("script[type=application/ld+json]")) {
            String json = script.data().trim();
            if (json.isEmpty()) {
                continue;
            }
            Object parsed;
            try {
                parsed = objectMapper.readValue(json, Object.class);
            } catch (JsonProcessingException ex) {
                log.warn("skip invalid json-ld block, error={}", ex.getOriginalMessage());
                continue;
            }
            for (Object item : SchemaValues.asList(parsed)) {
                collectJsonLd(item, entities);
            }
        }
        return entities;
    }

    private void collectJsonLd(Object item, List<SchemaEntity> entities) {
        if (!SchemaValues.isMap(item)) {
            return;
        }
        Map<String, Object> map = SchemaValues.asMap(item);
        Object graph = map.get("@graph");
        if (graph != null) {
            for (Object node : SchemaValues.asList(graph)) {
                collectJsonLd(node, entities);
            }
            return;
        }
        entities.add(new SchemaEntity(SchemaSource.JSON_LD, new LinkedHashMap<>(map)));
    }

    List<SchemaEntity> extractMicrodata(Document root) {
        List<SchemaEntity> entities = new ArrayList<>();
        for (Element item : root.select("[itemscope]")) {
            if (item.hasAttr("itemprop") || !item.attr("itemtype").toLowerCase(Locale.ROOT).contains("schema.org")) {
                continue;
            }
            entities.add(new SchemaEntity(SchemaSource.MICRODATA, readItem(item, MICRODATA)));
        }
        return entities;
    }

    List<SchemaEntity> extractRdfa(Document root) {
        List<SchemaEntity> entities = new ArrayList<>();
        for (Element item : root.select("[typeof]")) {
            if (item.hasAttr("property") || !isSchemaOrgRdfa(item)) {
                continue;
            }
            entities.add(new SchemaEntity(SchemaSource.RDFA, readItem(item, RDFA)));
        }
        return entities;
    }

    private boolean isSchemaOrgRdfa(Element item) {
        String type = item.attr("typeof").toLowerCase(Locale.ROOT);
        if (type.contains(RDFA_PREFIX) || type.contains("schema.org")) {
            return true;
        }
        for (Element current = item; current != null; current = current.parent()) {
            if (current.attr("vocab").toLowerCase(Locale.ROOT).contains("schema.org")) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> readItem(Element item, Markup markup) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> types = new ArrayList<>();
        for (String type : StringUtils.split(item.attr(markup.typeAttribute))) {
            String stripped = stripPrefix(type);
            if (!stripped.isEmpty()) {
                types.add(stripped);
            }
        }
        if (!types.isEmpty()) {
            properties.put("@type", types.size() == 1 ? types.get(0) : types);
        }
        collectProperties(item, markup, properties);
        return properties;
    }

    private void collectProperties(Element parent, Markup markup, Map<String, Object> properties) {
        for (Element child : parent.children()) {
            boolean nestedItem = child.hasAttr(markup.scopeAttribute);
            if (child.hasAttr(markup.propertyAttribute)) {
                Object value = nestedItem ? readItem(child, markup) : resolveValue(child);
                if (!SchemaValues.isStrictEmpty(value)) {
                    for (String name : StringUtils.split(child.attr(markup.propertyAttribute))) {
                        String propertyName = stripPrefix(name);
                        if (!propertyName.isEmpty()) {
                            addProperty(properties, propertyName, value);
                        }
                    }
                }
            }
            if (!nestedItem) {
                collectProperties(child, markup, properties);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void addProperty(Map<String, Object> properties, String name, Object value) {
        Object existing = properties.get(name);
        if (existing == null) {
            properties.put(name, value);
        } else if (existing instanceof RepeatedValues) {
            ((List<Object>) existing).add(value);
        } else {
            RepeatedValues values = new RepeatedValues();
            values.add(existing);
            values.add(value);
            properties.put(name, values);
        }
    }

    private Object resolveValue(Element element) {
        String tag = element.normalName();
        switch (tag) {
            case "meta":
                return element.attr("content").trim();
            case "img":
            case "link":
                return element.hasAttr("href") ? url(element, "href") : url(element, "src");
            case "time":
                return element.hasAttr("datetime") ? element.attr("datetime").trim() : TextUtils.collapseWhitespace(element.text());
            case "a":
                return url(element, "href");
            default:
                break;
        }
        if (element.hasAttr("content")) {
            return element.attr("content").trim();
        }
        if (element.hasAttr("resource")) {
            return element.attr("resource").trim();
        }
        return TextUtils.collapseWhitespace(element.text());
    }

    private String url(Element element, String attribute) {
        String absolute = element.absUrl(attribute);
        return absolute.isEmpty() ? element.attr(attribute).trim() : absolute;
    }

    private String stripPrefix(String name) {
        String stripped = name.trim();
        if (stripped.startsWith(RDFA_PREFIX)) {
            stripped = stripped.substring(RDFA_PREFIX.length());
        }
        return SCHEMA_ORG_PREFIX.matcher(stripped).replaceFirst("");
    }

    private record Markup(String scopeAttribute, String typeAttribute, String propertyAttribute) {
    }

    /**
     * Marks lists built from repeated property names, as opposed to list values.
     */
    private static class RepeatedValues extends ArrayList<Object> {
    }

}
