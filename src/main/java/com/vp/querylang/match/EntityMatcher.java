package com.vp.querylang.match;

import com.vp.querylang.query.CaseMode;
import com.vp.querylang.query.Rule;
import com.vp.querylang.query.TokenizedValue;
import com.vp.querylang.query.ValueTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Tests records against rules in memory.
 *
 * <p>A record matches a rule list when it satisfies at least one rule; it satisfies a rule when every
 * field of the rule matches. Only the first value of each field is used. A value with a wildcard is
 * matched as an anchored pattern, any other value by equality of the decoded text.
 *
 * <p>Supports {@link CaseMode#FOLD} (the default: field names and values compared case-insensitively)
 * and {@link CaseMode#SENSITIVE}.
 */
public class EntityMatcher {

    private static final Logger log = LoggerFactory.getLogger(EntityMatcher.class);

    private final CaseMode caseMode;

    public EntityMatcher() {
        this(CaseMode.FOLD);
    }

    public EntityMatcher(CaseMode caseMode) {
        Objects.requireNonNull(caseMode, "caseMode");
        if (caseMode == CaseMode.DELEGATE) {
            throw new IllegalArgumentException("Entity matcher has no target to delegate case handling to");
        }
        this.caseMode = caseMode;
    }

    public CaseMode getCaseMode() {
        return caseMode;
    }

    /**
     * Returns whether the record satisfies at least one of the rules.
     *
     * @param record field name to value; values are compared as strings
     * @param rules  rules combined with OR
     */
    public boolean matches(Map<String, ?> record, List<Rule> rules) {
        Map<String, String> fields = normalizeRecord(record);
        for (Rule rule : rules) {
            if (matchesRule(fields, rule)) {
                log.debug("Record matched rule {}", rule);
                return true;
            }
        }
        return false;
    }

    public boolean matches(Map<String, ?> record, Rule rule) {
        return matchesRule(normalizeRecord(record), rule);
    }

    private boolean matchesRule(Map<String, String> fields, Rule rule) {
        for (String field : rule.fieldNames()) {
            String actual = fields.get(foldField(field));
            if (actual == null) {
                return false;
            }
            if (!matchesValue(actual, rule.firstValue(field))) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesValue(String actual, String expected) {
        TokenizedValue tokens = ValueTokenizer.tokenize(expected);
        if (tokens.containsWildcard()) {
            return tokens.toPattern(caseMode == CaseMode.FOLD).matcher(actual).matches();
        }

        String literal = tokens.toLiteralText();
        return caseMode == CaseMode.FOLD
            ? actual.toLowerCase(Locale.ROOT).equals(literal.toLowerCase(Locale.ROOT))
            : actual.equals(literal);
    }

    private Map<String, String> normalizeRecord(Map<String, ?> record) {
        Map<String, String> fields = new HashMap<>();
        for (Map.Entry<String, ?> entry : record.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                fields.put(foldField(entry.getKey()), String.valueOf(entry.getValue()));
            }
        }
        return fields;
    }

    private String foldField(String field) {
        return caseMode == CaseMode.FOLD ? field.toLowerCase(Locale.ROOT) : field;
    }
}
