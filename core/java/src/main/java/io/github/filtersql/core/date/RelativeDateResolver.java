package io.github.filtersql.core.date;

import io.github.filtersql.core.api.Operator;
import io.github.filtersql.core.exception.InvalidFilterValueException;
import io.github.filtersql.core.exception.MalformedRangeValueException;
import io.github.filtersql.core.utils.OperatorMapper;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses relative date tokens and resolves them into concrete instant ranges.
 * <p>
 * A relative date token is a filter value such as {@code "__rel_date:last7Days"}. Resolution
 * is a pure function of {@code (option, referenceInstant, zone)}: the resolver never reads the
 * wall clock, so one compilation that resolves the same token twice gets identical ranges.
 * </p>
 *
 * <p><strong>Calendar rules</strong> (all in the reference time zone):</p>
 * <ul>
 *   <li>a day runs from {@code 00:00:00} to {@code 23:59:59.999999}</li>
 *   <li>weeks start on Monday and end on Sunday</li>
 *   <li>{@code last7Days}/{@code last30Days} end today and start N-1 days earlier</li>
 *   <li>{@code next7Days}/{@code next30Days} start today and end N-1 days later</li>
 * </ul>
 *
 * <pre>{@code
 * Instant ref = Instant.parse("2024-01-17T15:30:00Z"); // a Wednesday
 * DateRange week = RelativeDateResolver.resolveRange(RelativeDateOption.THIS_WEEK, ref, ZoneOffset.UTC);
 * // 2024-01-15T00:00:00Z .. 2024-01-21T23:59:59.999999Z
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RelativeDateResolver {

    /** Reserved prefix marking a value as a relative date token. */
    public static final String TOKEN_PREFIX = "__rel_date:";

    private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final DateTimeFormatter SPACED_LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private RelativeDateResolver() {
    }

    /**
     * @param value any filter value
     * @return {@code true} iff the value is a string carrying the relative date prefix
     */
    public static boolean isRelative(Object value) {
        return value instanceof String s && s.startsWith(TOKEN_PREFIX);
    }

    /**
     * Strips the prefix from a relative token.
     *
     * @param value a filter value
     * @return the option, or empty for non-relative values and unknown options
     */
    public static Optional<RelativeDateOption> extractOption(String value) {
        if (!isRelative(value)) {
            return Optional.empty();
        }
        return RelativeDateOption.fromCode(value.substring(TOKEN_PREFIX.length()));
    }

    /**
     * Inverse of {@link #extractOption(String)}.
     *
     * @param option the option
     * @return the token, e.g. {@code "__rel_date:today"}
     */
    public static String createToken(RelativeDateOption option) {
        return TOKEN_PREFIX + Objects.requireNonNull(option, "option").getCode();
    }

    /**
     * Resolves an option into the calendar range it denotes around the reference instant.
     *
     * @param option           the relative option
     * @param referenceInstant the instant "now" stands for
     * @param zone             the zone whose calendar defines day boundaries
     * @return the inclusive range
     */
    public static DateRange resolveRange(RelativeDateOption option, Instant referenceInstant, ZoneId zone) {
        Objects.requireNonNull(option, "option");
        Objects.requireNonNull(referenceInstant, "referenceInstant");
        Objects.requireNonNull(zone, "zone");

        LocalDate today = referenceInstant.atZone(zone).toLocalDate();
        LocalDate weekStart = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));

        return switch (option) {
            case TODAY, CUSTOM -> days(today, today, zone);
            case YESTERDAY -> days(today.minusDays(1), today.minusDays(1), zone);
            case TOMORROW -> days(today.plusDays(1), today.plusDays(1), zone);
            case THIS_WEEK -> days(weekStart, weekStart.plusDays(6), zone);
            case LAST_WEEK -> days(weekStart.minusWeeks(1), weekStart.minusDays(1), zone);
            case NEXT_WEEK -> days(weekStart.plusWeeks(1), weekStart.plusDays(13), zone);
            case THIS_MONTH -> month(today, zone);
            case LAST_MONTH -> month(today.minusMonths(1), zone);
            case NEXT_MONTH -> month(today.plusMonths(1), zone);
            case LAST_7_DAYS -> days(today.minusDays(6), today, zone);
            case NEXT_7_DAYS -> days(today, today.plusDays(6), zone);
            case LAST_30_DAYS -> days(today.minusDays(29), today, zone);
            case NEXT_30_DAYS -> days(today, today.plusDays(29), zone);
            case THIS_YEAR -> year(today, zone);
            case LAST_YEAR -> year(today.minusYears(1), zone);
        };
    }

    /**
     * Single-instant resolution used by comparison operators: the start of the option's range.
     *
     * @param option           the relative option
     * @param referenceInstant the instant "now" stands for
     * @param zone             calendar zone
     * @return the start of the resolved range
     */
    public static Instant resolveStart(RelativeDateOption option, Instant referenceInstant, ZoneId zone) {
        return resolveRange(option, referenceInstant, zone).start();
    }

    /**
     * Resolves the value of a range operator into an explicit range.
     * <p>
     * Relative tokens resolve through {@link #resolveRange}; literal {@code "start,end"} pairs are
     * parsed with {@link #parseDateTime}. A date-only end bound is widened to the end of that day so
     * the range stays inclusive.
     * </p>
     *
     * @param value            token or {@code "start,end"} literal
     * @param operator         the operator the value belongs to
     * @param referenceInstant the instant "now" stands for
     * @param zone             calendar zone
     * @return the range, or empty if {@code operator} is not a range operator
     * @throws MalformedRangeValueException  if a literal does not split into exactly two parts
     * @throws InvalidFilterValueException   if a token option or a bound cannot be parsed
     */
    public static Optional<DateRange> rangeForOperator(String value, Operator operator,
                                                       Instant referenceInstant, ZoneId zone) {
        if (!OperatorMapper.isRangeOperator(operator)) {
            return Optional.empty();
        }
        if (isRelative(value)) {
            return Optional.of(resolveRange(requireOption(value), referenceInstant, zone));
        }

        String[] parts = value == null ? new String[0] : value.split(",", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new MalformedRangeValueException(
                    "Operator " + operator + " requires a 'start,end' pair, got '" + value + "'");
        }
        return Optional.of(literalRange(parts[0].trim(), parts[1].trim(), zone));
    }

    /**
     * Builds the inclusive range between two date literals. Date-only bounds cover whole days.
     *
     * @param start start literal
     * @param end   end literal
     * @param zone  zone for literals without offset
     * @return the range
     */
    public static DateRange literalRange(String start, String end, ZoneId zone) {
        Instant from = parseDateTime(start, zone).toInstant();
        Instant to = isDateOnly(end)
                ? endOfDay(LocalDate.parse(end.trim()), zone)
                : parseDateTime(end, zone).toInstant();
        return new DateRange(from, to);
    }

    /**
     * Returns the calendar-day range (in {@code zone}) containing the given literal.
     *
     * @param literal an ISO date or date-time
     * @param zone    calendar zone
     * @return start-of-day through end-of-day
     */
    public static DateRange dayRange(String literal, ZoneId zone) {
        LocalDate day = parseDateTime(literal, zone).withZoneSameInstant(zone).toLocalDate();
        return days(day, day, zone);
    }

    /**
     * Parses an absolute date literal.
     * <p>
     * Accepted forms: {@code 2024-01-15} (start of day in {@code zone}), {@code 2024-01-15T10:00:00}
     * and {@code 2024-01-15 10:00:00} (local time in {@code zone}), {@code 2024-01-15T10:00:00+02:00}
     * and {@code 2024-01-15T10:00:00Z}.
     * </p>
     *
     * @param literal the literal
     * @param zone    zone for literals without offset
     * @return the parsed date-time
     * @throws InvalidFilterValueException if the literal matches none of the accepted forms
     */
    public static ZonedDateTime parseDateTime(String literal, ZoneId zone) {
        if (literal == null || literal.isBlank()) {
            throw new InvalidFilterValueException("Date value cannot be empty");
        }
        String text = literal.trim();
        try {
            if (isDateOnly(text)) {
                return LocalDate.parse(text).atStartOfDay(zone);
            }
            if (text.endsWith("Z") || text.endsWith("z")) {
                return Instant.parse(text.toUpperCase(Locale.ROOT)).atZone(zone);
            }
            if (text.indexOf('T') > 0) {
                return hasOffset(text)
                        ? OffsetDateTime.parse(text).atZoneSameInstant(zone)
                        : LocalDateTime.parse(text).atZone(zone);
            }
            return LocalDateTime.parse(text, SPACED_LOCAL_DATE_TIME).atZone(zone);
        } catch (DateTimeParseException e) {
            throw new InvalidFilterValueException("Invalid date value '" + literal + "'", e);
        }
    }

    /**
     * Extracts the option of a token that is known to be relative.
     *
     * @param token a relative date token
     * @return the option
     * @throws InvalidFilterValueException if the option behind the prefix is unknown
     */
    public static RelativeDateOption requireOption(String token) {
        return extractOption(token).orElseThrow(() ->
                new InvalidFilterValueException("Unknown relative date option in '" + token + "'"));
    }

    private static boolean isDateOnly(String text) {
        return DATE_ONLY.matcher(text.trim()).matches();
    }

    private static boolean hasOffset(String text) {
        int timeStart = text.indexOf('T');
        String time = text.substring(timeStart);
        return time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }

    private static DateRange month(LocalDate anyDay, ZoneId zone) {
        return days(anyDay.withDayOfMonth(1), anyDay.with(TemporalAdjusters.lastDayOfMonth()), zone);
    }

    private static DateRange year(LocalDate anyDay, ZoneId zone) {
        return days(anyDay.withDayOfYear(1), anyDay.with(TemporalAdjusters.lastDayOfYear()), zone);
    }

    private static DateRange days(LocalDate first, LocalDate last, ZoneId zone) {
        return new DateRange(first.atStartOfDay(zone).toInstant(), endOfDay(last, zone));
    }

    private static Instant endOfDay(LocalDate day, ZoneId zone) {
        return day.plusDays(1).atStartOfDay(zone).toInstant().minus(1, ChronoUnit.MICROS);
    }
}
