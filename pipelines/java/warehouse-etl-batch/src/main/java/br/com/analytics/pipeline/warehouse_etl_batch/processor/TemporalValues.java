package br.com.analytics.pipeline.warehouse_etl_batch.processor;

import org.jspecify.annotations.Nullable;

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
import java.util.Date;
import java.util.Optional;

/**
 * Lenient conversion of raw temporal values. Anything that cannot be read as a date yields an empty result
 * instead of an error, since raw snapshots mix formats and carry garbage in date columns.
 * Instants are interpreted in UTC.
 */
public final class TemporalValues {

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private TemporalValues() {
    }

    public static Optional<LocalDateTime> toDateTime(@Nullable Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime);
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay());
        }
        if (value instanceof Instant instant) {
            return Optional.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return Optional.of(offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return Optional.of(zonedDateTime.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return Optional.of(timestamp.toLocalDateTime());
        }
        if (value instanceof java.sql.Date sqlDate) {
            return Optional.of(sqlDate.toLocalDate().atStartOfDay());
        }
        if (value instanceof Date date) {
            return Optional.of(LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC));
        }
        if (value instanceof CharSequence text) {
            return parse(text.toString().trim());
        }
        return Optional.empty();
    }

    public static Optional<LocalDate> toDate(@Nullable Object value) {
        return toDateTime(value).map(LocalDateTime::toLocalDate);
    }

    /**
     * The calendar surrogate key of the value's date, or null when it has none.
     */
    public static @Nullable Integer toTimeKey(@Nullable Object value) {
        return toDate(value).map(TemporalValues::timeKey).orElse(null);
    }

    public static int timeKey(LocalDate date) {
        return date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    private static Optional<LocalDateTime> parse(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            if (text.length() == 10) {
                return Optional.of(LocalDate.parse(text).atStartOfDay());
            }
            if (text.indexOf('T') == 10) {
                if (text.endsWith("Z") || hasOffset(text)) {
                    return Optional.of(OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
                }
                return Optional.of(LocalDateTime.parse(text));
            }
            return Optional.of(LocalDateTime.parse(text, SPACE_SEPARATED));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static boolean hasOffset(String text) {
        int time = text.indexOf('T');
        return text.indexOf('+', time) > 0 || text.indexOf('-', time) > 0;
    }
}
