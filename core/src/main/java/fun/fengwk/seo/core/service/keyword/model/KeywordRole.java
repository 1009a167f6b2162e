package fun.fengwk.seo.core.service.keyword.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * @author fengwk
 */
public enum KeywordRole {

    PRIMARY("primary"),
    SECONDARY("secondary");

    private final String value;

    KeywordRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
