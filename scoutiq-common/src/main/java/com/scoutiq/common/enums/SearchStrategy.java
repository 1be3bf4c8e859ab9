package com.scoutiq.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which backends the retriever dispatches to.
 */
public enum SearchStrategy {
    CATALOG_ONLY,
    WEB_ONLY,
    HYBRID;

    public boolean usesCatalog() {
        return this != WEB_ONLY;
    }

    public boolean usesWeb() {
        return this != CATALOG_ONLY;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
