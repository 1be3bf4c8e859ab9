package com.scoutiq.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Router classification of an incoming query.
 */
public enum IntentType {
    PRODUCT_QUERY,
    OUT_OF_SCOPE,
    CLARIFICATION;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse of model output such as "product_query" or "Out-Of-Scope".
     *
     * @return matching type, or null when the value is not recognized
     */
    public static IntentType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (IntentType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
