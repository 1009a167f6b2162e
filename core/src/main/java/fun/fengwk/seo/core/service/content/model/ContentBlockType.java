package fun.fengwk.seo.core.service.content.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * @author fengwk
 */
public enum ContentBlockType {

    HEADING("heading"),
    PARAGRAPH("paragraph");

    private final String value;

    ContentBlockType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
