package fun.fengwk.seo.core.service.intent.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * @author fengwk
 */
public enum SearchIntent {

    INFORMATIONAL("informational"),
    TRANSACTIONAL("transactional"),
    NAVIGATIONAL("navigational"),
    COMMERCIAL("commercial");

    private final String value;

    SearchIntent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SearchIntent fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            return INFORMATIONAL;
        }
        for (SearchIntent intent : values()) {
            if (intent.value.equalsIgnoreCase(value.trim())) {
                return intent;
            }
        }
        throw new IllegalArgumentException("unsupported intent: " + value);
    }

}
