package org.waabox.restless;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Objects;
import java.util.Set;

/**
 * Converts temporal values between their Java types and their JSON API
 * wire form.
 *
 * <p>Dates, times and timestamps travel as ISO-8601 text, with seconds
 * always written. Durations travel as a floating point count of seconds.
 *
 * <p>When reading, the SQL markers {@code CURRENT_TIMESTAMP},
 * {@code LOCALTIMESTAMP}, {@code CURRENT_DATE} and {@code CURRENT_TIME}
 * stand for the current instant of the given {@link Clock}, and a blank
 * string stands for null.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TemporalValues {

  /** The Java types handled by this class. */
  private static final Set<Class<?>> TEMPORAL_TYPES = Set.of(
      LocalDate.class, LocalTime.class, LocalDateTime.class,
      OffsetDateTime.class, OffsetTime.class, ZonedDateTime.class,
      Instant.class, Duration.class, Date.class, java.sql.Date.class,
      Time.class, Timestamp.class);

  /** Markers that resolve to the current date and time. */
  private static final Set<String> NOW_MARKERS = Set.of(
      "CURRENT_TIMESTAMP", "LOCALTIMESTAMP", "CURRENT_TIME");

  /** Marker that resolves to the start of the current day. */
  private static final String TODAY_MARKER = "CURRENT_DATE";

  /** Nanoseconds per second, for duration conversions. */
  private static final BigDecimal NANOS_PER_SECOND =
      BigDecimal.valueOf(1_000_000_000L);

  /** Private constructor to prevent instantiation. */
  private TemporalValues() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Tells whether values of the given type are converted by this class.
   *
   * @param type the Java type, never null
   *
   * @return true if the type is a supported temporal type
   */
  public static boolean isTemporalType(final Class<?> type) {
    Objects.requireNonNull(type, "type must not be null");
    return TEMPORAL_TYPES.contains(type);
  }

  /**
   * Converts a value into its wire form.
   *
   * <p>Values that are not temporal are returned unchanged.
   *
   * @param value the value, may be null
   *
   * @return the ISO-8601 text, the number of seconds, or the value itself
   */
  public static Object toWire(final Object value) {
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate().toString();
    } else if (value instanceof Time) {
      return format(((Time) value).toLocalTime());
    } else if (value instanceof Timestamp) {
      return format(((Timestamp) value).toLocalDateTime());
    } else if (value instanceof Date) {
      return format(((Date) value).toInstant());
    } else if (value instanceof Duration) {
      final Duration duration = (Duration) value;
      return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    } else if (value instanceof TemporalAccessor) {
      return format((TemporalAccessor) value);
    }
    return value;
  }

  /**
   * Converts a wire value into the given temporal type.
   *
   * @param value the wire value, may be null
   * @param type  the target type, must be a supported temporal type
   * @param clock the clock the "now" markers read, never null
   *
   * @return the converted value, null for a null or blank value
   *
   * @throws java.time.DateTimeException if the text cannot be parsed
   * @throws IllegalArgumentException if the value cannot be converted to
   *                                  the type
   * @throws ArithmeticException if a number of seconds does not fit a
   *                             duration
   */
  public static Object fromWire(final Object value, final Class<?> type,
      final Clock clock) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(clock, "clock must not be null");
    if (!isTemporalType(type)) {
      throw new IllegalArgumentException(
          "Not a temporal type: " + type.getName());
    }
    if (value == null || type.isInstance(value)) {
      return value;
    }
    if (type == Duration.class) {
      return duration(value);
    }
    if (!(value instanceof String)) {
      throw new IllegalArgumentException("Expected ISO-8601 text for "
          + type.getSimpleName() + " but got " + value);
    }
    final String text = ((String) value).trim();
    if (text.isEmpty()) {
      return null;
    }
    if (NOW_MARKERS.contains(text)) {
      return fromZoned(ZonedDateTime.now(clock), type);
    }
    if (TODAY_MARKER.equals(text)) {
      return fromZoned(ZonedDateTime.now(clock).truncatedTo(ChronoUnit.DAYS),
          type);
    }
    if (type == LocalTime.class) {
      return LocalTime.parse(text);
    } else if (type == OffsetTime.class) {
      return OffsetTime.parse(text);
    } else if (type == Time.class) {
      return Time.valueOf(LocalTime.parse(text));
    }
    return fromZoned(parseDateTime(text, clock), type);
  }

  /** Formats a temporal value as ISO-8601 text.
   *
   * @param value the value, never null.
   * @return the text, never null.
   */
  private static String format(final TemporalAccessor value) {
    if (value instanceof LocalDate) {
      return DateTimeFormatter.ISO_LOCAL_DATE.format(value);
    } else if (value instanceof LocalTime) {
      return DateTimeFormatter.ISO_LOCAL_TIME.format(value);
    } else if (value instanceof LocalDateTime) {
      return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value);
    } else if (value instanceof OffsetTime) {
      return DateTimeFormatter.ISO_OFFSET_TIME.format(value);
    } else if (value instanceof OffsetDateTime
        || value instanceof ZonedDateTime) {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
    } else if (value instanceof Instant) {
      return DateTimeFormatter.ISO_INSTANT.format(value);
    }
    return value.toString();
  }

  /** Parses date or date-time text, assuming the clock's zone when the
   * text carries no offset.
   *
   * @param text the text, never null.
   * @param clock the clock supplying the default zone.
   * @return the parsed value, never null.
   */
  private static ZonedDateTime parseDateTime(final String text,
      final Clock clock) {
    if (text.indexOf('T') < 0) {
      return LocalDate.parse(text).atStartOfDay(clock.getZone());
    }
    final TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
        .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
    if (parsed instanceof ZonedDateTime) {
      return (ZonedDateTime) parsed;
    }
    return ((LocalDateTime) parsed).atZone(clock.getZone());
  }

  /** Narrows a zoned date-time to the requested type.
   *
   * @param value the date-time, never null.
   * @param type the target type, never null.
   * @return the converted value, never null.
   */
  private static Object fromZoned(final ZonedDateTime value,
      final Class<?> type) {
    if (type == LocalDate.class) {
      return value.toLocalDate();
    } else if (type == LocalDateTime.class) {
      return value.toLocalDateTime();
    } else if (type == LocalTime.class) {
      return value.toLocalTime();
    } else if (type == OffsetDateTime.class) {
      return value.toOffsetDateTime();
    } else if (type == OffsetTime.class) {
      return value.toOffsetDateTime().toOffsetTime();
    } else if (type == ZonedDateTime.class) {
      return value;
    } else if (type == Instant.class) {
      return value.toInstant();
    } else if (type == java.sql.Date.class) {
      return java.sql.Date.valueOf(value.toLocalDate());
    } else if (type == Time.class) {
      return Time.valueOf(value.toLocalTime());
    } else if (type == Timestamp.class) {
      return Timestamp.valueOf(value.toLocalDateTime());
    } else if (type == Date.class) {
      return Date.from(value.toInstant());
    }
    throw new IllegalArgumentException(
        "Cannot convert a date-time into " + type.getSimpleName());
  }

  /** Reads a duration from a number of seconds or from ISO-8601 text.
   *
   * @param value the wire value, never null.
   * @return the duration, null for blank text.
   */
  private static Duration duration(final Object value) {
    final BigDecimal seconds;
    if (value instanceof Number) {
      seconds = new BigDecimal(value.toString());
    } else if (value instanceof String) {
      final String text = ((String) value).trim();
      if (text.isEmpty()) {
        return null;
      }
      if (text.startsWith("P") || text.startsWith("-P")) {
        return Duration.parse(text);
      }
      seconds = new BigDecimal(text);
    } else {
      throw new IllegalArgumentException(
          "Expected a number of seconds but got " + value);
    }
    final BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
    final long nanos = seconds.subtract(whole).multiply(NANOS_PER_SECOND)
        .longValue();
    return Duration.ofSeconds(whole.longValueExact(), nanos);
  }
}
