package com.podscope.filter.support;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the value of an {@code until} filter into an absolute instant.
 *
 * <p>Accepted forms: a duration such as {@code 10m} or {@code 1h30m} (counted back from now), an
 * RFC 3339 timestamp, a local date-time or date (read in the zone of the clock), or Unix seconds
 * with an optional fraction.
 */
public final class UntilTimestamps {

    private static final Pattern DURATION = Pattern.compile("(?:\\d+(?:\\.\\d+)?(?:ns|us|µs|ms|s|m|h))+");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
    private static final Pattern UNIX_SECONDS = Pattern.compile("(\\d+)(?:\\.(\\d{1,9}))?");
    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private UntilTimestamps() {
    }

    /**
     * @throws IllegalArgumentException when there is not exactly one value, it cannot be parsed, or it
     *     lies outside the range of {@link Instant}
     */
    public static Instant compute(List<String> values, Clock clock) {
        if (values == null || values.size() != 1) {
            throw new IllegalArgumentException("specify exactly one timestamp for until");
        }
        String value = values.get(0).trim();
        try {
            return resolve(value, clock);
        } catch (DateTimeException | ArithmeticException e) {
            throw new IllegalArgumentException("invalid until value: " + value, e);
        }
    }

    private static Instant resolve(String value, Clock clock) {
        if (DURATION.matcher(value).matches()) {
            return clock.instant().minus(parseDuration(value));
        }
        Optional<Instant> timestamp = parseTimestamp(value, clock.getZone());
        if (timestamp.isPresent()) {
            return timestamp.get();
        }
        Matcher unix = UNIX_SECONDS.matcher(value);
        if (unix.matches()) {
            long seconds = Long.parseLong(unix.group(1));
            String fraction = unix.group(2);
            long nanos = fraction == null ? 0 : Long.parseLong((fraction + "000000000").substring(0, 9));
            return Instant.ofEpochSecond(seconds, nanos);
        }
        throw new IllegalArgumentException("invalid until value: " + value);
    }

    static Duration parseDuration(String value) {
        Duration total = Duration.ZERO;
        Matcher part = DURATION_PART.matcher(value);
        while (part.find()) {
            double amount = Double.parseDouble(part.group(1));
            long unitNanos = switch (part.group(2)) {
                case "ns" -> 1L;
                case "us", "µs" -> 1_000L;
                case "ms" -> 1_000_000L;
                case "s" -> 1_000_000_000L;
                case "m" -> 60_000_000_000L;
                default -> 3_600_000_000_000L;
            };
            total = total.plusNanos(Math.round(amount * unitNanos));
        }
        return total;
    }

    private static Optional<Instant> parseTimestamp(String value, ZoneId zone) {
        try {
            TemporalAccessor parsed = TIMESTAMP.parseBest(value, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            if (parsed instanceof LocalDateTime) {
                return Optional.of(((LocalDateTime) parsed).atZone(zone).toInstant());
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
