package com.fuelsight.ingestion.service;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns the date and epoch representations found in vendor payloads into UTC instants.
 *
 * Never throws. Absent or unparseable input is logged as a data-quality warning and
 * replaced by the current time, so a bad device clock can never block ingestion.
 * Parsed values are range-checked and suspicious ones are logged but kept:
 * <ul>
 *   <li>year before 2020</li>
 *   <li>more than one year in the future</li>
 *   <li>more than 60 minutes in the future</li>
 *   <li>more than 7 days in the past</li>
 * </ul>
 */
@Singleton
public class TimestampNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimestampNormalizer.class);

    /** Numeric epochs above this are milliseconds, at or below it seconds. */
    static final double MILLIS_THRESHOLD = 1e12;

    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter();

    /** Tried in order; offset-less values are taken as UTC. */
    private static final List<Function<String, Instant>> TEXT_PARSERS = List.of(
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            TimestampNormalizer::parseSpaceSeparated,
            text -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant(),
            text -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());

    private static final Duration FUTURE_TOLERANCE = Duration.ofMinutes(60);
    private static final Duration STALE_AFTER = Duration.ofDays(7);
    private static final Duration FAR_FUTURE = Duration.ofDays(365);
    private static final int EARLIEST_PLAUSIBLE_YEAR = 2020;

    private final Clock clock;

    @Inject
    public TimestampNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Normalizes to an ISO-8601 UTC string, falling back to now.
     *
     * @param rawValue  null, a numeric epoch, or a date/time string
     * @param fieldName vendor field name, used in warnings
     */
    public String normalize(Object rawValue, String fieldName) {
        return normalizeInstant(rawValue, fieldName).toString();
    }

    /**
     * Same as {@link #normalize} but returns the instant.
     */
    public Instant normalizeInstant(Object rawValue, String fieldName) {
        Instant now = clock.instant();
        if (rawValue == null || (rawValue instanceof String && ((String) rawValue).isBlank())) {
            log.warn("Timestamp missing field={} using now={}", fieldName, now);
            return now;
        }

        Instant parsed = parse(rawValue);
        if (parsed == null) {
            log.warn("Unparseable timestamp field={} value={} using now={}", fieldName, rawValue, now);
            return now;
        }

        checkRange(parsed, now, fieldName);
        return parsed;
    }

    /**
     * Normalizes optional timestamps: absent input stays {@code null}, anything else
     * goes through {@link #normalizeInstant}.
     */
    public Instant normalizeIfPresent(Object rawValue, String fieldName) {
        if (rawValue == null || (rawValue instanceof String && ((String) rawValue).isBlank())) {
            return null;
        }
        return normalizeInstant(rawValue, fieldName);
    }

    /**
     * Floors a possibly fractional numeric epoch for storage in a BIGINT column.
     *
     * @return the floored value, or {@code null} when the input is absent or not numeric
     */
    public static Long epochToLong(Object value) {
        Double parsed = SafeNumbers.parseDouble(value);
        if (parsed == null || parsed > Long.MAX_VALUE || parsed < Long.MIN_VALUE) {
            return null;
        }
        return (long) Math.floor(parsed);
    }

    // -----------------------------------------------------------------------
    // Parsing
    // -----------------------------------------------------------------------

    private Instant parse(Object rawValue) {
        if (rawValue instanceof Number) {
            return fromEpoch(((Number) rawValue).doubleValue());
        }
        String text = rawValue.toString().trim();
        if (NUMERIC.matcher(text).matches()) {
            return fromEpoch(Double.parseDouble(text));
        }
        return parseText(text);
    }

    private static Instant fromEpoch(double epoch) {
        if (!Double.isFinite(epoch)) {
            return null;
        }
        long millis = epoch > MILLIS_THRESHOLD ? (long) epoch : (long) (epoch * 1000);
        return Instant.ofEpochMilli(millis);
    }

    private static Instant parseText(String text) {
        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : TEXT_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("No date format matched value={}: {}", text, lastError.getMessage());
        return null;
    }

    private static Instant parseSpaceSeparated(String text) {
        TemporalAccessor parsed = SPACE_SEPARATED.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    private static void checkRange(Instant value, Instant now, String fieldName) {
        int year = value.atZone(ZoneOffset.UTC).getYear();
        if (year < EARLIEST_PLAUSIBLE_YEAR || value.isAfter(now.plus(FAR_FUTURE))) {
            log.warn("Suspicious timestamp field={} value={} year={}", fieldName, value, year);
        } else if (value.isAfter(now.plus(FUTURE_TOLERANCE))) {
            log.warn("Timestamp in the future field={} value={} now={}", fieldName, value, now);
        } else if (value.isBefore(now.minus(STALE_AFTER))) {
            log.warn("Stale timestamp field={} value={} now={}", fieldName, value, now);
        }
    }
}
