package com.eainde.bidding.model;

import java.util.Locale;

/**
 * How a session's namespace treats previously indexed documents.
 */
public enum IsolationMode {

    /** The namespace is cleared before every new document is indexed. */
    ISOLATED,

    /** Chunks accumulate in one namespace shared by every session and are never cleared. */
    CUMULATIVE;

    public static IsolationMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ISOLATED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown isolation mode: '" + value
                    + "'. Expected 'isolated' or 'cumulative'", e);
        }
    }
}
