package com.vp.querylang.git;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient date parser for the {@code date}, {@code before} and {@code after} query fields.
 *
 * <p>Accepted forms (spaces are optional, so values with whitespace removed still parse):
 * <ul>
 *   <li>{@code 2020-01-31}, {@code 2020/01/31}, {@code 2020-01-31T10:15:30}, {@code 2020-01-31 10:15}</li>
 *   <li>{@code 01/31/2020} (month first), {@code 31.01.2020}, {@code 31-01-2020}</li>
 *   <li>{@code Jan 31 2020}, {@code January 31, 2020}, {@code 31 January 2020}</li>
 *   <li>{@code now}, {@code today}, {@code yesterday}, {@code tomorrow}</li>
 *   <li>{@code -1 week}, {@code +3 days}, {@code 2 months ago}, {@code last year}</li>
 * </ul>
 * Relative forms are resolved against the clock given at construction.
 */
public class DateExpressionParser {

    private static final Pattern ISO_DATE = Pattern.compile(
        "(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})(?:[T\\s]*\\d{1,2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?)?");
    private static final Pattern US_DATE = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");
    private static final Pattern EUROPEAN_DATE = Pattern.compile("(\\d{1,2})[.-](\\d{1,2})[.-](\\d{4})");
    private static final Pattern MONTH_FIRST = Pattern.compile("([a-z]{3,9})\\.?\\s*(\\d{1,2})(?:st|nd|rd|th)?,?\\s*(\\d{4})");
    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{1,2})(?:st|nd|rd|th)?\\s*([a-z]{3,9})\\.?,?\\s*(\\d{4})");
    private static final Pattern RELATIVE = Pattern.compile("([+-]?\\d+)\\s*(day|week|month|year)s?(\\s*ago)?");
    private static final Pattern LAST_NEXT = Pattern.compile("(last|next)\\s*(day|week|month|year)");

    private static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final Map<String, Month> MONTHS = buildMonthNames();

    private final Clock clock;

    public DateExpressionParser() {
        this(Clock.systemDefaultZone());
    }

    public DateExpressionParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Parses a date expression; empty when the text is not a recognised date.
     */
    public Optional<LocalDate> parse(String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        String text = expression.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(parseKeyword(text))
                .or(() -> Optional.ofNullable(parseAbsolute(text)))
                .or(() -> Optional.ofNullable(parseRelative(text)));
        } catch (DateTimeException e) {
            // 2020-02-31 and the like
            return Optional.empty();
        } catch (ArithmeticException | NumberFormatException e) {
            // relative offsets too large for a long or for LocalDate
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return date.format(OUTPUT_FORMAT);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private LocalDate parseKeyword(String text) {
        switch (text) {
            case "now":
            case "today":
                return today();
            case "yesterday":
                return today().minusDays(1);
            case "tomorrow":
                return today().plusDays(1);
            default:
                return null;
        }
    }

    private LocalDate parseAbsolute(String text) {
        Matcher m = ISO_DATE.matcher(text);
        if (m.matches()) {
            // the time of day is accepted and dropped
            return date(m.group(1), m.group(2), m.group(3));
        }

        m = US_DATE.matcher(text);
        if (m.matches()) {
            return date(m.group(3), m.group(1), m.group(2));
        }

        m = EUROPEAN_DATE.matcher(text);
        if (m.matches()) {
            return date(m.group(3), m.group(2), m.group(1));
        }

        m = MONTH_FIRST.matcher(text);
        if (m.matches() && MONTHS.containsKey(m.group(1))) {
            return LocalDate.of(Integer.parseInt(m.group(3)), MONTHS.get(m.group(1)), Integer.parseInt(m.group(2)));
        }

        m = DAY_FIRST.matcher(text);
        if (m.matches() && MONTHS.containsKey(m.group(2))) {
            return LocalDate.of(Integer.parseInt(m.group(3)), MONTHS.get(m.group(2)), Integer.parseInt(m.group(1)));
        }

        return null;
    }

    private LocalDate parseRelative(String text) {
        Matcher m = RELATIVE.matcher(text);
        if (m.matches()) {
            long amount = Long.parseLong(m.group(1));
            if (m.group(3) != null) {
                amount = -amount;
            }
            return shift(today(), m.group(2), amount);
        }

        m = LAST_NEXT.matcher(text);
        if (m.matches()) {
            return shift(today(), m.group(2), m.group(1).equals("last") ? -1 : 1);
        }

        return null;
    }

    private static LocalDate shift(LocalDate base, String unit, long amount) {
        switch (unit) {
            case "day":
                return base.plusDays(amount);
            case "week":
                return base.plusWeeks(amount);
            case "month":
                return base.plusMonths(amount);
            default:
                return base.plusYears(amount);
        }
    }

    private static LocalDate date(String year, String month, String day) {
        return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
    }

    private static Map<String, Month> buildMonthNames() {
        Map<String, Month> names = new HashMap<>();
        for (Month month : Month.values()) {
            String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            names.put(full, month);
            names.put(full.substring(0, 3), month);
        }
        names.put("sept", Month.SEPTEMBER);
        return names;
    }
}
