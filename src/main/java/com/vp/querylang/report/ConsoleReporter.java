package com.vp.querylang.report;

import com.vp.querylang.query.QueryTerm;
import com.vp.querylang.query.Rule;
import com.vp.querylang.query.UnsanitizedFragment;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Console reporter for parse and compile results.
 * In quiet mode only the compiled output is printed, one item per line, so it can be piped.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);

    private final boolean quiet;
    private final PrintStream out;

    public ConsoleReporter(boolean quiet) {
        this(quiet, System.out);
    }

    public ConsoleReporter(boolean quiet, PrintStream out) {
        this.quiet = quiet;
        this.out = out;
    }

    public void printHeader(String title, List<String> queries) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.printf("              Query Language - %s%n", title);
        out.println(SEPARATOR);
        out.println();
        out.println("Queries:");
        for (String query : queries) {
            out.printf("  %s%n", query);
        }
        out.println();
    }

    public void printRules(List<Rule> rules) {
        if (quiet) {
            rules.forEach(rule -> out.println(rule));
            return;
        }

        int index = 1;
        for (Rule rule : rules) {
            out.println(THIN_SEPARATOR);
            out.printf("Rule %d%n", index++);
            for (QueryTerm term : rule.terms()) {
                out.printf("  %-20s %s%s%n",
                    term.effectiveField(),
                    term.negated() ? "NOT " : "",
                    quote(term));
            }
        }
        printSummary(rules.size(), "rule(s)");
    }

    public void printFragments(List<UnsanitizedFragment> fragments) {
        for (UnsanitizedFragment fragment : fragments) {
            out.println(fragment.toTrustedString());
        }
        printSummary(fragments.size(), "fragment(s)");
    }

    public void printRecords(List<Map<String, String>> records, int total) {
        for (Map<String, String> record : records) {
            out.println(record);
        }
        if (quiet) return;

        out.println(THIN_SEPARATOR);
        out.printf("Matched %,d of %,d record(s)%n", records.size(), total);
    }

    private void printSummary(int count, String what) {
        if (quiet) return;

        out.println(THIN_SEPARATOR);
        out.printf("Total: %d %s%n", count, what);
    }

    private static String quote(QueryTerm term) {
        switch (term.quoting()) {
            case SINGLE:
                return "'" + term.value() + "'";
            case DOUBLE:
                return "\"" + term.value() + "\"";
            default:
                return term.value();
        }
    }
}
