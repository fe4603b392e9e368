package com.vp.querylang;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class QueryLanguageCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void redirect() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restore() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).trim();
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String resource(String name) throws URISyntaxException {
        return Path.of(QueryLanguageCliTest.class.getResource(name).toURI()).toString();
    }

    @Nested
    class SqlTests {

        @Test
        void shouldPrintRestrictionForQueries() {
            int exitCode = QueryLanguageCli.execute("sql", "-q", "post_type:post", "post_status:draft*");

            assertThat(exitCode).isZero();
            assertThat(stdout()).isEqualTo("(`post_type` = \"post\") OR (`post_status` LIKE \"draft%\")");
        }

        @Test
        void shouldAddBinaryWhenCaseSensitive() {
            int exitCode = QueryLanguageCli.execute("sql", "-q", "--case-sensitive", "post_type:post");

            assertThat(exitCode).isZero();
            assertThat(stdout()).isEqualTo("(`post_type` = BINARY \"post\")");
        }

        @Test
        void shouldPrintEntityRestrictionFromConfig() throws Exception {
            int exitCode = QueryLanguageCli.execute("sql", "-q", "-f", resource("/entity-config.yml"), "-e", "option");

            assertThat(exitCode).isZero();
            assertThat(stdout()).isEqualTo("(`option_name` = \"cron\")");
        }

        @Test
        void shouldRejectUnknownEntity() throws Exception {
            int exitCode = QueryLanguageCli.execute("sql", "-f", resource("/entity-config.yml"), "-e", "nope");

            assertThat(exitCode).isEqualTo(1);
            assertThat(stderr()).contains("No entity found with name: nope");
        }

        @Test
        void shouldRequireQueriesOrEntity() {
            assertThat(QueryLanguageCli.execute("sql")).isEqualTo(2);
        }
    }

    @Nested
    class GitLogTests {

        @Test
        void shouldPrintArgumentsPerQuery() {
            int exitCode = QueryLanguageCli.execute("git-log", "-q", "author:Joe", "text:fix");

            assertThat(exitCode).isZero();
            assertThat(stdout().split("\\R")).containsExactly(
                "-i --all-match --author=\"^Joe <.*>$\"",
                "-i --all-match --grep=\"fix\"");
        }

        @Test
        void shouldOmitIgnoreCaseFlagWhenCaseSensitive() {
            int exitCode = QueryLanguageCli.execute("git-log", "-q", "--case-sensitive", "author:Joe");

            assertThat(exitCode).isZero();
            assertThat(stdout()).startsWith("--all-match ");
        }
    }

    @Nested
    class MatchTests {

        @Test
        void shouldListMatchingRecords() throws Exception {
            int exitCode = QueryLanguageCli.execute("match", "-q", "-r", resource("/records.yml"), "post_type:rev*");

            assertThat(exitCode).isZero();
            assertThat(stdout()).contains("post_type=revision").doesNotContain("post_type=post");
        }

        @Test
        void shouldListRecordsIgnoredByEntity() throws Exception {
            int exitCode = QueryLanguageCli.execute("match", "-q",
                "-r", resource("/records.yml"), "-f", resource("/entity-config.yml"), "-e", "post");

            assertThat(exitCode).isZero();
            assertThat(stdout().split("\\R")).hasSize(2);
        }

        @Test
        void shouldFailOnMissingRecordFile() {
            int exitCode = QueryLanguageCli.execute("match", "-r", "no-such-records.yml", "a:b");

            assertThat(exitCode).isEqualTo(1);
            assertThat(stderr()).contains("no-such-records.yml");
        }
    }

    @Test
    void shouldParseQueries() {
        int exitCode = QueryLanguageCli.execute("parse", "-q", "author:Joe", "\"\"");

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("{author=[Joe]}");
    }

    @Test
    void shouldShipLoggingConfigAtInfoOnStderr() throws IOException {
        try (InputStream input = QueryLanguageCliTest.class.getResourceAsStream("/logback.xml")) {
            String config = new String(input.readAllBytes(), StandardCharsets.UTF_8);

            assertThat(config)
                .contains("<target>System.err</target>")
                .contains("<root level=\"INFO\">");
        }
    }
}
