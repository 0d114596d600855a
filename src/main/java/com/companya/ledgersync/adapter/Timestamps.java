package com.companya.ledgersync.adapter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Time conversions shared by the adapters.
 */
public final class Timestamps {

    /** Millisecond-precision UTC rendering, e.g. {@code 2024-01-15T10:30:00.000Z}. */
    public static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public static final Instant POSITIVE_INFINITY = Instant.parse("9999-12-31T23:59:59Z");
    public static final Instant NEGATIVE_INFINITY = Instant.parse("0001-01-01T00:00:00Z");

    static final double MICROS_THRESHOLD = 1e15;
    static final double MILLIS_THRESHOLD = 1e12;

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalStart().appendLiteral('[').parseCaseSensitive().appendZoneRegionId().appendLiteral(']').optionalEnd()
            .optionalEnd()
            .toFormatter();

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    /**
     * Interprets an epoch number by magnitude: above 1e15 microseconds, above 1e12 milliseconds,
     * otherwise seconds.
     */
    public static Instant fromEpochNumber(long value) {
        double magnitude = Math.abs((double) value);
        if (magnitude > MICROS_THRESHOLD) {
            return Instant.EPOCH.plus(value, ChronoUnit.MICROS);
        }
        if (magnitude > MILLIS_THRESHOLD) {
            return Instant.ofEpochMilli(value);
        }
        return Instant.ofEpochSecond(value);
    }

    static boolean isInteger(String text) {
        return INTEGER.matcher(text).matches();
    }

    /**
     * Parses a textual datetime. Accepts ISO-8601 with or without zone, with {@code T} or a space
     * between date and time, and bare dates.
     *
     * @return the parsed value, or {@code null} when the text is not a datetime
     */
    public static ParsedText parseText(String text) {
        String candidate = text.trim();
        if (candidate.length() > 10 && candidate.charAt(10) == ' ') {
            candidate = candidate.substring(0, 10) + 'T' + candidate.substring(11);
        }
        TemporalAccessor parsed;
        try {
            parsed = FLEXIBLE.parseBest(candidate, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException ex) {
            return null;
        }
        if (parsed instanceof ZonedDateTime zoned) {
            return new ParsedText(zoned.toInstant(), true);
        }
        if (parsed instanceof LocalDateTime local) {
            return new ParsedText(local.toInstant(ZoneOffset.UTC), false);
        }
        return new ParsedText(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC), false);
    }

    /**
     * @param instant the parsed instant, read as UTC when the text had no zone
     * @param zoned   whether the text carried its own offset or zone
     */
    public record ParsedText(Instant instant, boolean zoned) {
    }
}
