package com.vp.querylang.report;

import com.vp.querylang.query.QueryParser;
import com.vp.querylang.query.Rule;
import com.vp.querylang.query.UnsanitizedFragment;
import com.vp.querylang.sql.SqlRestrictionBuilder;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private ConsoleReporter reporter(boolean quiet) {
        return new ConsoleReporter(quiet, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Nested
    class QuietTests {

        @Test
        void shouldPrintOnlyTrustedFragmentText() {
            // Given
            UnsanitizedFragment fragment = new SqlRestrictionBuilder()
                .buildRestriction(Rule.of("post_type", "post"));

            // When
            reporter(true).printFragments(List.of(fragment));

            // Then
            assertThat(output()).isEqualTo("(`post_type` = \"post\")" + System.lineSeparator());
        }

        @Test
        void shouldSkipHeaderAndSummary() {
            ConsoleReporter reporter = reporter(true);

            reporter.printHeader("Parse", List.of("a:b"));
            reporter.printRecords(List.of(), 3);

            assertThat(output()).isEmpty();
        }

        @Test
        void shouldPrintOneRulePerLine() {
            reporter(true).printRules(QueryParser.parseRules(List.of("a:b", "c:d")));

            assertThat(output().split(System.lineSeparator())).containsExactly("{a=[b]}", "{c=[d]}");
        }
    }

    @Nested
    class VerboseTests {

        @Test
        void shouldPrintHeaderWithQueries() {
            reporter(false).printHeader("Parse", List.of("post_type:post"));

            assertThat(output()).contains("Query Language - Parse").contains("  post_type:post");
        }

        @Test
        void shouldPrintTermsWithQuotingAndNegation() {
            reporter(false).printRules(QueryParser.parseRules(List.of("-author:'Joe Doe' draft")));

            assertThat(output())
                .contains("Rule 1")
                .contains("NOT 'Joe Doe'")
                .contains("text")
                .contains("Total: 1 rule(s)");
        }

        @Test
        void shouldPrintMatchSummary() {
            reporter(false).printRecords(List.of(Map.of("a", "b")), 4);

            assertThat(output()).contains("{a=b}").contains("Matched 1 of 4 record(s)");
        }
    }
}
