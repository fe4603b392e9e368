package com.vp.querylang.query;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The token sequence of one field value, with the conversions the compilers need.
 */
public final class TokenizedValue {

    private static final String REGEX_METACHARACTERS = "\\.+*?[^]$(){}=!<>|:-#/";

    private final List<ValueToken> tokens;

    TokenizedValue(List<ValueToken> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public List<ValueToken> getTokens() {
        return tokens;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean containsWildcard() {
        return tokens.stream().anyMatch(ValueToken::isWildcard);
    }

    /**
     * Anchored regular expression for the value; literals are escaped and each wildcard
     * becomes {@code .*}. For {@code prefix*} this is {@code ^prefix.*$}.
     */
    public String toRegex() {
        StringBuilder regex = new StringBuilder("^");
        for (ValueToken token : tokens) {
            if (token.isWildcard()) {
                regex.append(".*");
            } else {
                appendEscaped(regex, token.text());
            }
        }
        return regex.append('$').toString();
    }

    public Pattern toPattern(boolean caseInsensitive) {
        int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
        return Pattern.compile(toRegex(), flags);
    }

    /**
     * SQL {@code LIKE} form of the value: literals verbatim, wildcards as {@code %}.
     */
    public String toFilterString() {
        StringBuilder sb = new StringBuilder();
        for (ValueToken token : tokens) {
            sb.append(token.isWildcard() ? "%" : token.text());
        }
        return sb.toString();
    }

    /**
     * Decoded literal text with wildcards written back as {@code *}.
     */
    public String toLiteralText() {
        StringBuilder sb = new StringBuilder();
        for (ValueToken token : tokens) {
            sb.append(token.isWildcard() ? "*" : token.text());
        }
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder regex, String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                regex.append('\\');
            }
            regex.append(c);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenizedValue)) return false;
        return tokens.equals(((TokenizedValue) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
