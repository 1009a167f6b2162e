package fun.fengwk.seo.core.service.schema.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Encoding a schema entity was extracted from.
 *
 * @author fengwk
 */
public enum SchemaSource {

    JSON_LD("json-ld"),
    MICRODATA("microdata"),
    RDFA("rdfa");

    private final String value;

    SchemaSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
