package com.vp.querylang.query;

/**
 * A single {@code [-][field:]value} term scanned from a raw query string.
 *
 * @param negated whether the term carried a leading {@code -}; recorded but not yet applied by any compiler
 * @param field   the field name as written, or {@code null} for unlabeled text
 * @param value   the value with escaped quote characters decoded
 * @param quoting how the value was written
 */
public record QueryTerm(boolean negated, String field, String value, Quoting quoting) {

    public enum Quoting {
        NONE,
        SINGLE,
        DOUBLE
    }

    public static final String TEXT_FIELD = "text";

    public boolean hasField() {
        return field != null;
    }

    /**
     * The field the value belongs to; unlabeled values belong to {@value #TEXT_FIELD}.
     */
    public String effectiveField() {
        return field != null ? field : TEXT_FIELD;
    }
}
