package com.scoutiq.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Backend a search result came from.
 * Declaration order is the tie-break priority when ranking (catalog first).
 */
public enum ResultSource {
    CATALOG,
    WEB;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
