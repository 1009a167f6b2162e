package fun.fengwk.seo.core.service.keyword.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Keyword density classification against the sufficient usage band.
 *
 * @author fengwk
 */
public enum DensityStatus {

    SEVERELY_UNDERUSED("severely_underused"),
    UNDERUSED("underused"),
    OPTIMAL("optimal"),
    OVERUSED("overused"),
    SEVERELY_OVERUSED("severely_overused");

    private final String value;

    DensityStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
