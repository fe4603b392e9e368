package com.vp.querylang.query;

import java.util.Objects;

/**
 * One unit of a tokenized field value: either a wildcard ({@code *}) or a piece of literal text
 * with escapes already resolved.
 *
 * @param kind the token kind
 * @param text decoded literal text, empty for wildcards
 */
public record ValueToken(Kind kind, String text) {

    public enum Kind {
        WILDCARD,
        LITERAL
    }

    private static final ValueToken WILDCARD_TOKEN = new ValueToken(Kind.WILDCARD, "");

    public ValueToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static ValueToken wildcard() {
        return WILDCARD_TOKEN;
    }

    public static ValueToken literal(String text) {
        return new ValueToken(Kind.LITERAL, text);
    }

    public boolean isWildcard() {
        return kind == Kind.WILDCARD;
    }

    @Override
    public String toString() {
        return isWildcard() ? "Wildcard" : "Literal(" + text + ")";
    }
}
