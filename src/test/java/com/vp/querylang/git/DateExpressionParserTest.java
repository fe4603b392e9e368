package com.vp.querylang.git;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DateExpressionParserTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2020-06-15T12:00:00Z"), ZoneOffset.UTC);

    private final DateExpressionParser parser = new DateExpressionParser(CLOCK);

    @Nested
    class AbsoluteDateTests {

        @Test
        void shouldParseIsoDate() {
            assertThat(parser.parse("2020-01-31")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("2020/1/5")).contains(LocalDate.of(2020, 1, 5));
        }

        @Test
        void shouldParseIsoDateTime() {
            assertThat(parser.parse("2020-01-31T10:15:30")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("2020-01-31 10:15")).contains(LocalDate.of(2020, 1, 31));
        }

        @Test
        void shouldParseUsAndEuropeanDates() {
            assertThat(parser.parse("01/31/2020")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("31.01.2020")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("31-01-2020")).contains(LocalDate.of(2020, 1, 31));
        }

        @Test
        void shouldParseMonthNames() {
            assertThat(parser.parse("Jan 31 2020")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("January 31, 2020")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("31 January 2020")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("3rd March 2021")).contains(LocalDate.of(2021, 3, 3));
        }

        @Test
        void shouldParseFormsWithWhitespaceRemoved() {
            assertThat(parser.parse("Jan312020")).contains(LocalDate.of(2020, 1, 31));
            assertThat(parser.parse("2020-01-3110:15")).contains(LocalDate.of(2020, 1, 31));
        }
    }

    @Nested
    class RelativeDateTests {

        @Test
        void shouldResolveKeywords() {
            assertThat(parser.parse("today")).contains(LocalDate.of(2020, 6, 15));
            assertThat(parser.parse("Now")).contains(LocalDate.of(2020, 6, 15));
            assertThat(parser.parse("yesterday")).contains(LocalDate.of(2020, 6, 14));
            assertThat(parser.parse("tomorrow")).contains(LocalDate.of(2020, 6, 16));
        }

        @Test
        void shouldResolveOffsets() {
            assertThat(parser.parse("-1 week")).contains(LocalDate.of(2020, 6, 8));
            assertThat(parser.parse("+3 days")).contains(LocalDate.of(2020, 6, 18));
            assertThat(parser.parse("2 months ago")).contains(LocalDate.of(2020, 4, 15));
            assertThat(parser.parse("1yearago")).contains(LocalDate.of(2019, 6, 15));
            assertThat(parser.parse("last month")).contains(LocalDate.of(2020, 5, 15));
        }
    }

    @Nested
    class InvalidDateTests {

        @Test
        void shouldRejectUnknownText() {
            assertThat(parser.parse("soon")).isEmpty();
            assertThat(parser.parse("")).isEmpty();
            assertThat(parser.parse(null)).isEmpty();
            assertThat(parser.parse("Foo 31 2020")).isEmpty();
        }

        @Test
        void shouldRejectImpossibleDates() {
            assertThat(parser.parse("2020-02-31")).isEmpty();
            assertThat(parser.parse("13/01/2020")).isEmpty();
        }

        @Test
        void shouldRejectRelativeOffsetsOutOfRange() {
            assertThat(parser.parse("99999999999999999999 days")).isEmpty();
            assertThat(parser.parse("9223372036854775807days")).isEmpty();
            assertThat(parser.parse("9223372036854775807 weeks ago")).isEmpty();
            assertThat(parser.parse("9223372036854775807 months")).isEmpty();
        }
    }

    @Test
    void shouldFormatAsIsoDate() {
        assertThat(DateExpressionParser.format(LocalDate.of(2020, 2, 1))).isEqualTo("2020-02-01");
    }
}
