package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Collection;
import java.util.StringJoiner;

/** Renders bound parameter values as SQL literals. */
public class ParameterFormatter {
  static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

  static final DateTimeFormatter DATETIME_FORMATTER =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .appendLiteral(' ')
          .appendPattern("HH:mm:ss")
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .toFormatter();

  static final DateTimeFormatter DATETIME_WITH_OFFSET_FORMATTER =
      new DateTimeFormatterBuilder().append(DATETIME_FORMATTER).appendPattern("xxx").toFormatter();

  private ParameterFormatter() {}

  /**
   * Formats a single value as a SQL literal.
   *
   * @param value parameter value, may be null
   * @return SQL literal text
   * @throws FireboltSQLException if the value type is not supported
   */
  public static String format(Object value) throws FireboltSQLException {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? "true" : "false";
    }
    if (value instanceof Double || value instanceof Float) {
      return formatFloatingPoint((Number) value);
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    if (value instanceof Byte
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long
        || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof CharSequence || value instanceof Character) {
      return quote(value.toString());
    }
    if (value instanceof byte[]) {
      return formatBytes((byte[]) value);
    }
    if (value instanceof java.sql.Date) {
      return quote(((java.sql.Date) value).toLocalDate().format(DATE_FORMATTER));
    }
    if (value instanceof java.sql.Timestamp) {
      return quote(((java.sql.Timestamp) value).toLocalDateTime().format(DATETIME_FORMATTER));
    }
    if (value instanceof LocalDate) {
      return quote(((LocalDate) value).format(DATE_FORMATTER));
    }
    if (value instanceof LocalDateTime) {
      return quote(((LocalDateTime) value).format(DATETIME_FORMATTER));
    }
    if (value instanceof OffsetDateTime) {
      return quote(((OffsetDateTime) value).format(DATETIME_WITH_OFFSET_FORMATTER));
    }
    if (value instanceof ZonedDateTime) {
      return quote(
          ((ZonedDateTime) value).toOffsetDateTime().format(DATETIME_WITH_OFFSET_FORMATTER));
    }
    if (value instanceof Instant) {
      return quote(
          ((Instant) value).atOffset(ZoneOffset.UTC).format(DATETIME_WITH_OFFSET_FORMATTER));
    }
    if (value instanceof Collection) {
      StringJoiner joiner = new StringJoiner(", ", "[", "]");
      for (Object element : (Collection<?>) value) {
        joiner.add(format(element));
      }
      return joiner.toString();
    }
    if (value.getClass().isArray()) {
      StringJoiner joiner = new StringJoiner(", ", "[", "]");
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        joiner.add(format(Array.get(value, i)));
      }
      return joiner.toString();
    }
    throw new FireboltSQLException(
        ErrorCode.DATA_ERROR, "Unsupported parameter type: " + value.getClass().getName());
  }

  /**
   * Quotes a string literal. Single quotes are doubled and NUL characters are replaced with the
   * digit {@code 0}, which is how the engine stores them anyway.
   */
  static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 2);
    sb.append('\'');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\'') {
        sb.append("''");
      } else if (c == '\0') {
        sb.append('0');
      } else {
        sb.append(c);
      }
    }
    return sb.append('\'').toString();
  }

  static String formatBytes(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length * 4 + 12);
    sb.append("E'");
    for (byte b : bytes) {
      sb.append("\\x").append(Character.forDigit((b >> 4) & 0xF, 16));
      sb.append(Character.forDigit(b & 0xF, 16));
    }
    return sb.append("'::BYTEA").toString();
  }

  private static String formatFloatingPoint(Number number) {
    double value = number.doubleValue();
    if (Double.isNaN(value)) {
      return "'nan'";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "'inf'" : "'-inf'";
    }
    return number instanceof Float ? number.toString() : Double.toString(value);
  }
}
