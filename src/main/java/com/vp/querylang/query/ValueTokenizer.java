package com.vp.querylang.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a single field value into literal and wildcard tokens.
 *
 * <p>Grammar, matched left to right:
 * <ul>
 *   <li>{@code \\} - a literal backslash</li>
 *   <li>{@code \*} - a literal asterisk</li>
 *   <li>{@code *} - a wildcard</li>
 *   <li>any other run of characters without {@code *} or {@code \} - literal text</li>
 * </ul>
 * A backslash that does not start one of the two escapes is kept inside the surrounding literal run.
 * Adjacent literal pieces are merged, so {@code a\*b} is the single literal {@code a*b}.
 * Any input tokenizes; empty input gives no tokens.
 */
public final class ValueTokenizer {

    private static final char WILDCARD = '*';
    private static final char ESCAPE = '\\';

    private ValueTokenizer() {
    }

    public static TokenizedValue tokenize(String value) {
        if (value == null || value.isEmpty()) {
            return new TokenizedValue(List.of());
        }

        List<ValueToken> tokens = new ArrayList<>();
        int length = value.length();
        int pos = 0;

        while (pos < length) {
            char c = value.charAt(pos);

            if (startsEscape(value, pos)) {
                appendLiteral(tokens, String.valueOf(value.charAt(pos + 1)));
                pos += 2;
            } else if (c == WILDCARD) {
                tokens.add(ValueToken.wildcard());
                pos++;
            } else {
                int end = pos + 1;
                while (end < length && value.charAt(end) != WILDCARD && !startsEscape(value, end)) {
                    end++;
                }
                appendLiteral(tokens, value.substring(pos, end));
                pos = end;
            }
        }

        return new TokenizedValue(tokens);
    }

    private static void appendLiteral(List<ValueToken> tokens, String text) {
        int last = tokens.size() - 1;
        if (last >= 0 && !tokens.get(last).isWildcard()) {
            tokens.set(last, ValueToken.literal(tokens.get(last).text() + text));
        } else {
            tokens.add(ValueToken.literal(text));
        }
    }

    private static boolean startsEscape(String value, int pos) {
        if (value.charAt(pos) != ESCAPE || pos + 1 >= value.length()) {
            return false;
        }
        char next = value.charAt(pos + 1);
        return next == ESCAPE || next == WILDCARD;
    }
}
