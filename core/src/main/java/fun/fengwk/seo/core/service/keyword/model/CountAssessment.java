package fun.fengwk.seo.core.service.keyword.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Occurrence count compared with the one per hundred words heuristic.
 *
 * @author fengwk
 */
public enum CountAssessment {

    INSUFFICIENT("insufficient"),
    OPTIMAL("optimal"),
    EXCESSIVE("excessive");

    private final String value;

    CountAssessment(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
