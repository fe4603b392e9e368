package com.vp.querylang.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses raw query strings into {@link Rule}s.
 *
 * <p>Rules of the language:
 * <ul>
 *   <li>{@code just text} - unlabeled words are values of the {@code text} field</li>
 *   <li>{@code "just text"} or {@code 'just text'} - quoted values may contain spaces and
 *       backslash-escaped quote characters</li>
 *   <li>{@code field:value}, {@code field: value}, {@code field:"quoted value"} - labeled values</li>
 *   <li>{@code -field:value} - a leading minus is recorded on the term but has no effect yet</li>
 *   <li>{@code w*ldcards} - handled by the compilers, see {@link ValueTokenizer}</li>
 * </ul>
 * Each raw string becomes one rule (its fields are AND-ed); the resulting list of rules is OR-ed.
 *
 * <p>Parsing never fails. Whitespace between terms is skipped, an unterminated quote is read as a
 * bare word, and a query string that yields no value contributes no rule.
 */
public final class QueryParser {

    private static final Logger log = LoggerFactory.getLogger(QueryParser.class);

    private static final char NEGATION = '-';
    private static final char FIELD_SEPARATOR = ':';
    private static final char ESCAPE = '\\';

    private QueryParser() {
    }

    public static List<Rule> parseRules(List<String> queries) {
        return parseRules(queries, false);
    }

    /**
     * Parses every query string into a rule; strings without values are left out.
     *
     * @param queries    raw query strings
     * @param allowEmpty keep empty quoted values ({@code field:""}) instead of dropping them
     */
    public static List<Rule> parseRules(List<String> queries, boolean allowEmpty) {
        List<Rule> rules = new ArrayList<>();
        for (String query : queries) {
            parseRule(query, allowEmpty).ifPresent(rules::add);
        }
        log.debug("Parsed {} rule(s) from {} query string(s)", rules.size(), queries.size());
        return rules;
    }

    public static Optional<Rule> parseRule(String query, boolean allowEmpty) {
        if (query == null) {
            return Optional.empty();
        }

        Rule.Builder builder = Rule.builder();
        for (QueryTerm term : tokenize(query)) {
            if (term.value().isEmpty() && !allowEmpty) {
                continue;
            }
            builder.add(term);
        }
        return builder.isEmpty() ? Optional.empty() : Optional.of(builder.build());
    }

    /**
     * Scans a raw query string into terms, left to right.
     */
    public static List<QueryTerm> tokenize(String query) {
        List<QueryTerm> terms = new ArrayList<>();
        int length = query.length();
        int pos = 0;

        while (pos < length) {
            if (Character.isWhitespace(query.charAt(pos))) {
                pos++;
                continue;
            }
            Scanned scanned = scanTerm(query, pos);
            terms.add(scanned.term);
            pos = scanned.end;
        }
        return terms;
    }

    private static Scanned scanTerm(String query, int start) {
        if (query.charAt(start) == NEGATION) {
            Scanned negated = scanLabeledOrValue(query, start + 1, true);
            if (negated != null) {
                return negated;
            }
        }
        // a non-whitespace character always starts at least a bare word
        return scanLabeledOrValue(query, start, false);
    }

    private static Scanned scanLabeledOrValue(String query, int start, boolean negated) {
        int separator = findFieldSeparator(query, start);
        if (separator > start) {
            int valueStart = skipWhitespace(query, separator + 1);
            Scanned value = scanValue(query, valueStart, negated, query.substring(start, separator));
            if (value != null) {
                return value;
            }
        }
        return scanValue(query, start, negated, null);
    }

    /**
     * Position of the colon ending a field name that starts at {@code start}, or -1. Field names
     * run up to the first colon, contain no whitespace and do not start with a quote.
     * Unlike a greedy {@code (\S+):} match, {@code time:10:30} gives field {@code time}.
     */
    private static int findFieldSeparator(String query, int start) {
        if (start >= query.length() || isQuote(query.charAt(start))) {
            return -1;
        }
        for (int i = start; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == FIELD_SEPARATOR) {
                return i;
            }
            if (Character.isWhitespace(c)) {
                return -1;
            }
        }
        return -1;
    }

    private static Scanned scanValue(String query, int start, boolean negated, String field) {
        if (start >= query.length() || Character.isWhitespace(query.charAt(start))) {
            return null;
        }

        char first = query.charAt(start);
        if (isQuote(first)) {
            Scanned quoted = scanQuoted(query, start, negated, field);
            if (quoted != null) {
                return quoted;
            }
        }

        int end = start;
        while (end < query.length() && !Character.isWhitespace(query.charAt(end))) {
            end++;
        }
        return new Scanned(new QueryTerm(negated, field, query.substring(start, end), QueryTerm.Quoting.NONE), end);
    }

    private static Scanned scanQuoted(String query, int start, boolean negated, String field) {
        char quote = query.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;

        while (i < query.length()) {
            char c = query.charAt(i);
            if (c == ESCAPE) {
                if (i + 1 >= query.length() || query.charAt(i + 1) == '\n') {
                    return null;
                }
                char escaped = query.charAt(i + 1);
                if (escaped != quote) {
                    value.append(c);
                }
                value.append(escaped);
                i += 2;
            } else if (c == quote) {
                QueryTerm.Quoting quoting = quote == '"' ? QueryTerm.Quoting.DOUBLE : QueryTerm.Quoting.SINGLE;
                return new Scanned(new QueryTerm(negated, field, value.toString(), quoting), i + 1);
            } else {
                value.append(c);
                i++;
            }
        }
        return null;
    }

    private static int skipWhitespace(String query, int pos) {
        while (pos < query.length() && Character.isWhitespace(query.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private record Scanned(QueryTerm term, int end) {
    }
}
