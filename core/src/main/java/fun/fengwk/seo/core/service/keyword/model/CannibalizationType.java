package fun.fengwk.seo.core.service.keyword.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of keyword collision between documents.
 *
 * @author fengwk
 */
public enum CannibalizationType {

    PRIMARY_KEYWORD_CONFLICT("primary_keyword_conflict"),
    KEYWORD_OVERUSE("keyword_overuse"),
    SEMANTIC_SIMILARITY("semantic_similarity");

    private final String value;

    CannibalizationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
