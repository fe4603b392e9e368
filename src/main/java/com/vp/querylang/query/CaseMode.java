package com.vp.querylang.query;

import java.util.Locale;

/**
 * How a compiler treats letter case. Each compiler accepts only the modes that make sense for its target.
 */
public enum CaseMode {
    /** The compiler lower-cases both sides itself. */
    FOLD,
    /** Values are passed through and the target decides (git {@code -i}, database collation). */
    DELEGATE,
    /** Comparisons are exact. */
    SENSITIVE;

    public static CaseMode fromString(String value) {
        return CaseMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
