package com.vp.querylang.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field constraints parsed from one raw query string.
 *
 * <p>Fields keep the order and letter case they were written in. A field written more than once
 * collects all its values, but compilers only use the first one: OR semantics come from separate
 * rules, not from repeated fields.
 */
public final class Rule {

    private final Map<String, List<String>> fields;
    private final List<QueryTerm> terms;

    private Rule(Map<String, List<String>> fields, List<QueryTerm> terms) {
        this.fields = fields;
        this.terms = terms;
    }

    public static Rule of(Map<String, List<String>> fields) {
        Builder builder = builder();
        fields.forEach((field, values) -> values.forEach(value -> builder.add(field, value)));
        return builder.build();
    }

    public static Rule of(String field, String value) {
        return builder().add(field, value).build();
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, List<String>> fields() {
        return fields;
    }

    public List<String> values(String field) {
        return fields.getOrDefault(field, List.of());
    }

    public String firstValue(String field) {
        List<String> values = fields.get(field);
        return values == null ? null : values.get(0);
    }

    public boolean hasField(String field) {
        return fields.containsKey(field);
    }

    /**
     * The terms the rule was built from, in source order, including negation markers.
     */
    public List<QueryTerm> terms() {
        return terms;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, List<String>> fields = new LinkedHashMap<>();
        private final List<QueryTerm> terms = new ArrayList<>();

        public Builder add(String field, String value) {
            return add(new QueryTerm(false, field, value, QueryTerm.Quoting.NONE));
        }

        public Builder add(QueryTerm term) {
            fields.computeIfAbsent(term.effectiveField(), k -> new ArrayList<>()).add(term.value());
            terms.add(term);
            return this;
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        public Rule build() {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            fields.forEach((field, values) -> copy.put(field, List.copyOf(values)));
            return new Rule(Collections.unmodifiableMap(copy), List.copyOf(terms));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rule)) return false;
        return fields.equals(((Rule) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
