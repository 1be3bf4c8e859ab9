package com.scoutiq.common.enums;

/**
 * Which price wins when the catalog and the web both priced the same item.
 */
public enum PricePrecedence {
    /** Structured catalog metadata wins over free-text extraction. */
    CATALOG,
    /** The freshly resolved web price wins. */
    WEB
}
