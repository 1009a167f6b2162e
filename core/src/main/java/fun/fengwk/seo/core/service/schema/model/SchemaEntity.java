package fun.fengwk.seo.core.service.schema.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A schema.org entity in canonical shape.
 *
 * <p>{@code properties} holds {@code @type} plus every property; values are strings, numbers, booleans, nested
 * maps or lists of those, whatever the source encoding was.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class SchemaEntity {

    private SchemaSource source;
    private Map<String, Object> properties;

    public List<String> getTypes() {
        Object type = properties.get("@type");
        List<String> types = new ArrayList<>();
        if (type instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    types.add(String.valueOf(item));
                }
            }
        } else if (type != null) {
            types.add(String.valueOf(type));
        }
        return types;
    }

    /**
     * First declared type, null when untyped.
     */
    public String getPrimaryType() {
        List<String> types = getTypes();
        return types.isEmpty() ? null : types.get(0);
    }

}
