package com.vp.querylang.git;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GitLogEscaperTest {

    @Test
    void shouldEscapeBackslashAndDollarForShellAndRegex() {
        assertThat(GitLogEscaper.escape("a\\b")).isEqualTo("a\\\\\\\\b");
        assertThat(GitLogEscaper.escape("$price")).isEqualTo("\\\\\\$price");
    }

    @Test
    void shouldEscapeDotAndBracket() {
        assertThat(GitLogEscaper.escape("v1.0 [beta]")).isEqualTo("v1\\.0 \\[beta]");
    }

    @Test
    void shouldTurnAsteriskIntoRegexWildcard() {
        assertThat(GitLogEscaper.escape("Jo*n")).isEqualTo("Jo.*n");
    }

    @Test
    void shouldLeaveOtherCharactersUnchanged() {
        assertThat(GitLogEscaper.escape("post/create-1 \"x\"")).isEqualTo("post/create-1 \"x\"");
    }
}
