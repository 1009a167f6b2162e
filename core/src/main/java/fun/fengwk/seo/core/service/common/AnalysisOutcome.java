package fun.fengwk.seo.core.service.common;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of an analysis stage.
 *
 * @author fengwk
 */
public enum AnalysisOutcome {

    /**
     * Stage produced data from a parsed document.
     */
    OK("ok"),

    /**
     * Input carried nothing to analyze.
     */
    EMPTY("empty"),

    /**
     * HTML could not be parsed, data (if any) comes from the regex fallback.
     */
    PARSE_FAILURE("parse_failure");

    private final String value;

    AnalysisOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
