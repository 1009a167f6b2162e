package fun.fengwk.seo.core.service.schema.support;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Helpers for loosely typed schema property values.
 *
 * @author fengwk
 */
public final class SchemaValues {

    private static final Pattern NUMERIC = Pattern.compile("^\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?\\s*$");

    private SchemaValues() {
    }

    /**
     * Null, blank strings, empty maps and collections whose items are all empty count as empty.
     */
    public static boolean isStrictEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return StringUtils.isBlank(text);
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (!isStrictEmpty(item)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    public static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        return value instanceof CharSequence text && NUMERIC.matcher(text).matches();
    }

    public static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (isNumeric(value)) {
            return Double.parseDouble(value.toString().trim());
        }
        return null;
    }

    public static boolean isMap(Object value) {
        return value instanceof Map<?, ?>;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    public static boolean isList(Object value) {
        return value instanceof List<?>;
    }

    public static List<Object> asList(Object value) {
        List<Object> list = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            list.addAll(collection);
        } else if (value != null) {
            list.add(value);
        }
        return list;
    }

    /**
     * First {@code @type} of a nested object, empty string when missing.
     */
    public static String typeOf(Object value) {
        Object type = asMap(value).get("@type");
        if (type instanceof List<?> types) {
            return types.isEmpty() || types.get(0) == null ? "" : types.get(0).toString();
        }
        return type == null ? "" : type.toString();
    }

    public static boolean hasType(Object value, String... types) {
        String type = typeOf(value);
        for (String candidate : types) {
            if (candidate.equals(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders a value for messages, numbers without trailing zeros.
     */
    public static String display(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
            } catch (NumberFormatException ex) {
                return number.toString();
            }
        }
        return value.toString();
    }

}
