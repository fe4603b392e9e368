package com.vp.querylang.sql;

import com.vp.querylang.query.CaseMode;
import com.vp.querylang.query.Rule;
import com.vp.querylang.query.TokenizedValue;
import com.vp.querylang.query.UnsanitizedFragment;
import com.vp.querylang.query.ValueTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts rules into parts of an SQL {@code WHERE} clause.
 *
 * <p>Example: rule {@code field:value other_field:with_prefix*} becomes
 * <pre>
 * (`field` = "value" AND `other_field` LIKE "with_prefix%")
 * </pre>
 * Only the first value of each field is used. Double quotes in values are backslash-escaped, and
 * underscores too when the value is a {@code LIKE} pattern. Field names are not escaped.
 *
 * <p>Supports {@link CaseMode#DELEGATE} (the default, case handling is up to the column collation)
 * and {@link CaseMode#SENSITIVE} (adds {@code BINARY} to each comparison).
 */
public class SqlRestrictionBuilder {

    private static final Logger log = LoggerFactory.getLogger(SqlRestrictionBuilder.class);

    private final CaseMode caseMode;

    public SqlRestrictionBuilder() {
        this(CaseMode.DELEGATE);
    }

    public SqlRestrictionBuilder(CaseMode caseMode) {
        Objects.requireNonNull(caseMode, "caseMode");
        if (caseMode == CaseMode.FOLD) {
            throw new IllegalArgumentException("SQL restriction leaves case folding to the collation; use DELEGATE or SENSITIVE");
        }
        this.caseMode = caseMode;
    }

    public CaseMode getCaseMode() {
        return caseMode;
    }

    /**
     * Builds the bracketed AND restriction for one rule.
     */
    public UnsanitizedFragment buildRestriction(Rule rule) {
        List<String> parts = new ArrayList<>();

        for (String field : rule.fieldNames()) {
            TokenizedValue tokens = ValueTokenizer.tokenize(rule.firstValue(field));
            boolean isWildcard = tokens.containsWildcard();

            String escapedValue = tokens.toFilterString().replace("\"", "\\\"");
            if (isWildcard) {
                escapedValue = escapedValue.replace("_", "\\_");
            }

            String operator = isWildcard ? "LIKE" : "=";
            if (caseMode == CaseMode.SENSITIVE) {
                operator += " BINARY";
            }

            parts.add(String.format("`%s` %s \"%s\"", field, operator, escapedValue));
        }

        String restriction = "(" + String.join(" AND ", parts) + ")";
        log.debug("Built SQL restriction for rule {}: {}", rule, restriction);
        return new UnsanitizedFragment(UnsanitizedFragment.Target.SQL_RESTRICTION, restriction);
    }

    /**
     * Builds one restriction per rule joined with {@code OR}; empty when there are no rules.
     */
    public UnsanitizedFragment buildRestriction(List<Rule> rules) {
        if (rules.isEmpty()) {
            return UnsanitizedFragment.empty(UnsanitizedFragment.Target.SQL_RESTRICTION);
        }

        List<String> restrictions = new ArrayList<>();
        for (Rule rule : rules) {
            restrictions.add(buildRestriction(rule).toTrustedString());
        }
        return new UnsanitizedFragment(UnsanitizedFragment.Target.SQL_RESTRICTION, String.join(" OR ", restrictions));
    }
}
