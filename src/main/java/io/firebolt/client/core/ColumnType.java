package io.firebolt.client.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A column type as declared in the response metadata, e.g. {@code int}, {@code decimal(38, 2)},
 * {@code array(text null) null} or {@code Nullable(Int32)}, together with the coercion of raw JSON
 * cells into Java values.
 */
public final class ColumnType {
  private static final Pattern PARAMETERIZED = Pattern.compile("(?s)^([^(]+)\\((.*)\\)$");

  private static final Pattern PRECISION_SCALE =
      Pattern.compile("^\\s*(\\d+)\\s*(?:,\\s*(\\d+)\\s*)?$");

  // optional offset at the end of a timestamptz value: Z, +05, +0530, +05:30, -05:30:15
  private static final Pattern TIMESTAMP_OFFSET =
      Pattern.compile("^(.*?)(Z|[+-]\\d{2}(?::?\\d{2}(?::?\\d{2})?)?)$");

  private static final DateTimeFormatter TIMESTAMP_FORMATTER =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral(' ')
          .optionalEnd()
          .optionalStart()
          .appendLiteral('T')
          .optionalEnd()
          .appendPattern("HH:mm")
          .optionalStart()
          .appendPattern(":ss")
          .optionalEnd()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .toFormatter();

  private final String name;
  private final FireboltDataType dataType;
  private final ColumnType innerType;
  private final Integer precision;
  private final Integer scale;
  private final boolean nullable;

  private ColumnType(
      String name,
      FireboltDataType dataType,
      ColumnType innerType,
      Integer precision,
      Integer scale,
      boolean nullable) {
    this.name = name;
    this.dataType = dataType;
    this.innerType = innerType;
    this.precision = precision;
    this.scale = scale;
    this.nullable = nullable;
  }

  /**
   * Parses a declared type name.
   *
   * @param typeName type name as sent by the server
   * @return parsed type; unknown names yield {@link FireboltDataType#UNKNOWN}
   */
  public static ColumnType of(String typeName) {
    String name = typeName == null ? "" : typeName.trim();
    String lower = name.toLowerCase(Locale.ROOT);

    if (lower.startsWith("nullable(") && lower.endsWith(")")) {
      return of(name.substring("nullable(".length(), name.length() - 1)).withNullable(name, true);
    }
    if (lower.endsWith(" not null")) {
      return of(name.substring(0, name.length() - " not null".length())).withNullable(name, false);
    }
    if (lower.endsWith(" null")) {
      return of(name.substring(0, name.length() - " null".length())).withNullable(name, true);
    }

    Matcher matcher = PARAMETERIZED.matcher(name);
    if (!matcher.matches()) {
      return new ColumnType(name, FireboltDataType.fromString(name), null, null, null, false);
    }
    FireboltDataType base = FireboltDataType.fromString(matcher.group(1));
    String arguments = matcher.group(2);
    if (base == FireboltDataType.ARRAY) {
      return new ColumnType(name, base, of(arguments), null, null, false);
    }
    if (base == FireboltDataType.NUMERIC) {
      Matcher ps = PRECISION_SCALE.matcher(arguments);
      if (ps.matches()) {
        Integer precision = Integer.valueOf(ps.group(1));
        Integer scale = ps.group(2) == null ? null : Integer.valueOf(ps.group(2));
        return new ColumnType(name, base, null, precision, scale, false);
      }
    }
    // other parameters, e.g. DateTime64(3), do not change decoding
    return new ColumnType(name, base, null, null, null, false);
  }

  private ColumnType withNullable(String fullName, boolean nullable) {
    return new ColumnType(fullName, dataType, innerType, precision, scale, nullable);
  }

  public String getName() {
    return name;
  }

  public FireboltDataType getDataType() {
    return dataType;
  }

  /** @return element type of an array, null for other types */
  public ColumnType getInnerType() {
    return innerType;
  }

  public Integer getPrecision() {
    return precision;
  }

  public Integer getScale() {
    return scale;
  }

  public boolean isNullable() {
    return nullable;
  }

  /**
   * Coerces one raw cell into the Java value for this type. JSON null decodes to null whatever the
   * declared type.
   *
   * @param raw raw cell
   * @param sessionZone zone applied to timestamptz values that carry no offset
   * @return decoded value
   * @throws FireboltSQLException if the cell cannot be coerced
   */
  public Object decode(JsonNode raw, ZoneId sessionZone) throws FireboltSQLException {
    if (raw == null || raw.isNull() || raw.isMissingNode()) {
      return null;
    }
    try {
      switch (dataType) {
        case INTEGER:
          return toBigDecimal(raw).intValueExact();
        case BIG_INTEGER:
          return toBigDecimal(raw).longValueExact();
        case UNSIGNED_BIG_INTEGER:
          return toUnsignedBigInteger(raw);
        case REAL:
        case DOUBLE_PRECISION:
          return toDouble(raw);
        case NUMERIC:
          BigDecimal decimal = toBigDecimal(raw);
          return scale == null ? decimal : decimal.setScale(scale, RoundingMode.HALF_UP);
        case DATE:
          return LocalDate.parse(scalarText(raw).trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        case TIMESTAMP:
          return toLocalDateTime(scalarText(raw).trim());
        case TIMESTAMP_WITH_TIMEZONE:
          return toOffsetDateTime(scalarText(raw).trim(), sessionZone);
        case BOOLEAN:
          return toBoolean(raw);
        case BYTEA:
          return toBytes(scalarText(raw));
        case ARRAY:
          return toList(raw, sessionZone);
        case TEXT:
        case UNKNOWN:
        default:
          return raw.isValueNode() ? raw.asText() : raw.toString();
      }
    } catch (ArithmeticException | IllegalArgumentException | DateTimeParseException ex) {
      // NumberFormatException is an IllegalArgumentException
      throw new FireboltSQLException(ex, ErrorCode.DECODE_ERROR, raw, name, ex.getMessage());
    }
  }

  private static String scalarText(JsonNode raw) {
    if (!raw.isValueNode()) {
      throw new IllegalArgumentException("expected a scalar value");
    }
    return raw.asText();
  }

  private static BigDecimal toBigDecimal(JsonNode raw) {
    if (raw.isNumber()) {
      return raw.decimalValue();
    }
    return new BigDecimal(scalarText(raw).trim());
  }

  private static BigInteger toUnsignedBigInteger(JsonNode raw) {
    BigInteger value = toBigDecimal(raw).toBigIntegerExact();
    if (value.signum() < 0 || value.bitLength() > 64) {
      throw new ArithmeticException("out of uint64 range");
    }
    return value;
  }

  private static Double toDouble(JsonNode raw) {
    if (raw.isNumber()) {
      return raw.doubleValue();
    }
    String text = scalarText(raw).trim();
    switch (text.toLowerCase(Locale.ROOT)) {
      case "nan":
      case "+nan":
      case "-nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
      case "+infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        return Double.valueOf(text);
    }
  }

  private static Boolean toBoolean(JsonNode raw) {
    if (raw.isBoolean()) {
      return raw.booleanValue();
    }
    if (raw.isIntegralNumber()) {
      return numericBoolean(raw.asLong());
    }
    String text = scalarText(raw).trim().toLowerCase(Locale.ROOT);
    switch (text) {
      case "t":
      case "true":
      case "1":
        return Boolean.TRUE;
      case "f":
      case "false":
      case "0":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException("not a boolean");
    }
  }

  private static Boolean numericBoolean(long value) {
    if (value == 0) {
      return Boolean.FALSE;
    }
    if (value == 1) {
      return Boolean.TRUE;
    }
    throw new IllegalArgumentException("not a boolean");
  }

  private static byte[] toBytes(String text) {
    if (text.startsWith("\\x")) {
      return HexUtil.hexStringToBytes(text.substring(2));
    }
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static LocalDateTime toLocalDateTime(String text) {
    if (text.length() == 10) {
      return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
    }
    return LocalDateTime.parse(text, TIMESTAMP_FORMATTER);
  }

  private static OffsetDateTime toOffsetDateTime(String text, ZoneId sessionZone) {
    // a bare date would be taken for a date followed by a negative offset
    if (text.length() > 10) {
      Matcher matcher = TIMESTAMP_OFFSET.matcher(text);
      if (matcher.matches()) {
        LocalDateTime local = toLocalDateTime(matcher.group(1).trim());
        return local.atOffset(parseOffset(matcher.group(2)));
      }
    }
    LocalDateTime local = toLocalDateTime(text);
    ZoneId zone = sessionZone == null ? ZoneOffset.UTC : sessionZone;
    return local.atZone(zone).toOffsetDateTime();
  }

  private static ZoneOffset parseOffset(String offset) {
    if ("Z".equals(offset)) {
      return ZoneOffset.UTC;
    }
    String digits = offset.substring(1).replace(":", "");
    int hours = Integer.parseInt(digits.substring(0, 2));
    int minutes = digits.length() >= 4 ? Integer.parseInt(digits.substring(2, 4)) : 0;
    int seconds = digits.length() >= 6 ? Integer.parseInt(digits.substring(4, 6)) : 0;
    int sign = offset.charAt(0) == '-' ? -1 : 1;
    return ZoneOffset.ofHoursMinutesSeconds(sign * hours, sign * minutes, sign * seconds);
  }

  private List<Object> toList(JsonNode raw, ZoneId sessionZone) throws FireboltSQLException {
    if (!raw.isArray()) {
      throw new IllegalArgumentException("expected an array");
    }
    List<Object> values = new ArrayList<>(raw.size());
    for (JsonNode element : raw) {
      if (innerType == null) {
        values.add(element.isValueNode() ? element.asText() : element.toString());
      } else {
        values.add(innerType.decode(element, sessionZone));
      }
    }
    return Collections.unmodifiableList(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnType)) {
      return false;
    }
    ColumnType that = (ColumnType) o;
    return nullable == that.nullable
        && dataType == that.dataType
        && Objects.equals(innerType, that.innerType)
        && Objects.equals(precision, that.precision)
        && Objects.equals(scale, that.scale);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataType, innerType, precision, scale, nullable);
  }

  @Override
  public String toString() {
    return name;
  }
}
