package fun.fengwk.seo.core.service.keyword.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Density compared with the competitive ideal band.
 *
 * @author fengwk
 */
public enum DensityAssessment {

    UNDERDENSITY("underdensity"),
    OPTIMAL("optimal"),
    OVERDENSITY("overdensity");

    private final String value;

    DensityAssessment(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
