package com.vp.querylang.git;

import com.vp.querylang.query.CaseMode;
import com.vp.querylang.query.Rule;
import com.vp.querylang.query.UnsanitizedFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles a rule into {@code git log} arguments that select the matching commits.
 *
 * <p>Example: {@code author:Joe date:>=2020-01-01 "post draft"} becomes
 * <pre>
 * -i --all-match --author="^Joe &lt;.*&gt;$" --after=2019-12-31 --grep="post draft"
 * </pre>
 *
 * <p>Field handling:
 * <ul>
 *   <li>{@code author} - {@code Name}, {@code email@host} or {@code Name <email@host>}</li>
 *   <li>{@code date} - {@code d}, {@code <d}, {@code <=d}, {@code >d}, {@code >=d} or {@code from..to}
 *       with {@code *} for an open end; ranges are inclusive</li>
 *   <li>{@code before}, {@code after} - passed to git as they are</li>
 *   <li>{@code action}, {@code vp-action}, {@code entity}, {@code scope}, {@code vpid} - matched
 *       against the {@code VP-Action: scope/action/id} trailer</li>
 *   <li>{@code text} - commit message grep</li>
 *   <li>anything else - a {@code VP-} / {@code X-VP-} trailer with that name</li>
 * </ul>
 * Every value of a field is used. Known field names are recognised regardless of case.
 *
 * <p>Supports {@link CaseMode#DELEGATE} (the default, emits {@code -i}) and {@link CaseMode#SENSITIVE}.
 */
public class GitLogQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(GitLogQueryBuilder.class);

    private static final String AUTHOR = "author";
    private static final String DATE = "date";
    private static final String BEFORE = "before";
    private static final String AFTER = "after";
    private static final String ACTION = "action";
    private static final String VP_ACTION = "vp-action";
    private static final String ENTITY = "entity";
    private static final String SCOPE = "scope";
    private static final String VPID = "vpid";
    private static final String TEXT = "text";

    private static final Set<String> KNOWN_FIELDS =
        Set.of(AUTHOR, DATE, BEFORE, AFTER, ACTION, VP_ACTION, ENTITY, SCOPE, VPID, TEXT);

    private static final String ACTION_TRAILER = "VP-Action: ";
    private static final String OR = "\\|";

    private final CaseMode caseMode;
    private final DateExpressionParser dateParser;

    public GitLogQueryBuilder() {
        this(CaseMode.DELEGATE, Clock.systemDefaultZone());
    }

    public GitLogQueryBuilder(CaseMode caseMode, Clock clock) {
        Objects.requireNonNull(caseMode, "caseMode");
        if (caseMode == CaseMode.FOLD) {
            throw new IllegalArgumentException("git log query leaves case folding to git; use DELEGATE or SENSITIVE");
        }
        this.caseMode = caseMode;
        this.dateParser = new DateExpressionParser(clock);
    }

    public CaseMode getCaseMode() {
        return caseMode;
    }

    public UnsanitizedFragment buildQuery(Rule rule) {
        StringBuilder query = new StringBuilder(caseMode == CaseMode.DELEGATE ? "-i --all-match" : "--all-match");

        Map<String, List<String>> known = new LinkedHashMap<>();
        Map<String, List<String>> trailers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> field : rule.fields().entrySet()) {
            String name = field.getKey().toLowerCase(Locale.ROOT);
            if (KNOWN_FIELDS.contains(name)) {
                known.computeIfAbsent(name, k -> new ArrayList<>()).addAll(field.getValue());
            } else {
                trailers.computeIfAbsent(GitLogEscaper.escape(field.getKey()), k -> new ArrayList<>())
                    .addAll(escapeAll(field.getValue()));
            }
        }

        appendAuthors(query, escapeAll(known.getOrDefault(AUTHOR, List.of())));
        appendDates(query, known.getOrDefault(DATE, List.of()));
        for (String value : known.getOrDefault(BEFORE, List.of())) {
            parseDate(value).ifPresent(date -> appendBefore(query, date));
        }
        for (String value : known.getOrDefault(AFTER, List.of())) {
            parseDate(value).ifPresent(date -> appendAfter(query, date));
        }
        appendActions(query, known);
        for (String value : escapeAll(known.getOrDefault(TEXT, List.of()))) {
            query.append(" --grep=\"").append(value).append('"');
        }
        trailers.forEach((field, values) -> appendTrailer(query, field, values));

        log.debug("Built git log query for rule {}: {}", rule, query);
        return new UnsanitizedFragment(UnsanitizedFragment.Target.GIT_LOG_ARGUMENTS, query.toString());
    }

    private void appendAuthors(StringBuilder query, List<String> authors) {
        for (String author : authors) {
            // "@" or "<" at position 0 does not count, e.g. "<joe@example.com>" is treated as a name
            boolean hasEmail = author.indexOf('@') > 0;
            boolean hasBracket = author.indexOf('<') > 0;

            if (hasEmail && hasBracket) {
                query.append(" --author=\"^").append(author).append("$\"");
            } else if (hasEmail) {
                query.append(" --author=\"^.* <").append(author).append(">$\"");
            } else {
                query.append(" --author=\"^").append(author).append(" <.*>$\"");
            }
        }
    }

    private void appendDates(StringBuilder query, List<String> values) {
        for (String raw : values) {
            String value = raw.replaceAll("\\s+", "");

            String[] bounds = value.split("\\.\\.", -1);
            if (bounds.length > 1) {
                if (!bounds[0].equals("*")) {
                    parseDate(bounds[0]).ifPresent(date -> appendAfter(query, date.minusDays(1)));
                }
                if (!bounds[1].equals("*")) {
                    parseDate(bounds[1]).ifPresent(date -> appendBefore(query, date.plusDays(1)));
                }
                continue;
            }

            String operator;
            if (value.startsWith("<=") || value.startsWith(">=")) {
                operator = value.substring(0, 2);
            } else if (value.startsWith("<") || value.startsWith(">")) {
                operator = value.substring(0, 1);
            } else {
                operator = "";
            }

            Optional<LocalDate> parsed = parseDate(value.substring(operator.length()));
            if (parsed.isEmpty()) {
                continue;
            }
            LocalDate date = parsed.get();

            switch (operator) {
                case ">=":
                    appendAfter(query, date.minusDays(1));
                    break;
                case ">":
                    appendAfter(query, date);
                    break;
                case "<=":
                    appendBefore(query, date);
                    break;
                case "<":
                    appendBefore(query, date.minusDays(1));
                    break;
                default:
                    appendAfter(query, date.minusDays(1));
                    appendBefore(query, date);
            }
        }
    }

    private void appendActions(StringBuilder query, Map<String, List<String>> known) {
        List<String> actions = new ArrayList<>();
        List<String> vpActions = new ArrayList<>();
        for (String value : escapeAll(known.getOrDefault(ACTION, List.of()))) {
            // "post/create" is a full VP action, "create" only the action part
            if (value.contains("/")) {
                vpActions.add(value);
            } else {
                actions.add(value);
            }
        }
        vpActions.addAll(escapeAll(known.getOrDefault(VP_ACTION, List.of())));

        if (!vpActions.isEmpty()) {
            query.append(" --grep=\"^").append(ACTION_TRAILER)
                .append(group(vpActions)).append("\\(/.*\\)\\?$\"");
        }

        List<String> scopes = new ArrayList<>(escapeAll(known.getOrDefault(ENTITY, List.of())));
        scopes.addAll(escapeAll(known.getOrDefault(SCOPE, List.of())));
        List<String> vpids = escapeAll(known.getOrDefault(VPID, List.of()));

        if (!scopes.isEmpty() || !actions.isEmpty() || !vpids.isEmpty()) {
            query.append(" --grep=\"^").append(ACTION_TRAILER)
                .append(scopes.isEmpty() ? ".*" : group(scopes))
                .append('/')
                .append(actions.isEmpty() ? ".*" : group(actions))
                .append(vpids.isEmpty() ? "\\(/.*\\)\\?" : "/" + group(vpids))
                .append("$\"");
        }
    }

    private void appendTrailer(StringBuilder query, String field, List<String> values) {
        String lower = field.toLowerCase(Locale.ROOT);
        String prefix;
        if (lower.startsWith("x-vp-")) {
            prefix = "";
        } else if (lower.startsWith("vp-")) {
            prefix = "\\(X-\\)\\?";
        } else {
            prefix = "\\(X-VP-\\|VP-\\)";
        }
        query.append(" --grep=\"^").append(prefix).append(field).append(": ").append(group(values)).append("$\"");
    }

    private Optional<LocalDate> parseDate(String value) {
        Optional<LocalDate> date = dateParser.parse(value);
        if (date.isEmpty()) {
            log.warn("Ignoring unrecognised date '{}' in history query", value);
        }
        return date;
    }

    private static void appendBefore(StringBuilder query, LocalDate date) {
        query.append(" --before=").append(DateExpressionParser.format(date));
    }

    private static void appendAfter(StringBuilder query, LocalDate date) {
        query.append(" --after=").append(DateExpressionParser.format(date));
    }

    private static String group(List<String> alternatives) {
        return "\\(" + String.join(OR, alternatives) + "\\)";
    }

    private static List<String> escapeAll(List<String> values) {
        return values.stream().map(GitLogEscaper::escape).collect(Collectors.toList());
    }
}
