package fun.fengwk.seo.core.service.keyword.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Primary keyword density relative to the average secondary keyword density.
 *
 * @author fengwk
 */
public enum BalanceStatus {

    SECONDARY_DOMINANT("secondary_dominant"),
    WELL_BALANCED("well_balanced"),
    PRIMARY_HEAVY("primary_heavy"),
    PRIMARY_DOMINANT("primary_dominant"),
    INCOMPLETE("incomplete");

    private final String value;

    BalanceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
