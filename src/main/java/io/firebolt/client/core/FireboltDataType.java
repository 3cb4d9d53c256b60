package io.firebolt.client.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/** Base column types understood by the result decoder. */
public enum FireboltDataType {
  INTEGER(Integer.class, Types.INTEGER),
  BIG_INTEGER(Long.class, Types.BIGINT),
  // does not fit a long
  UNSIGNED_BIG_INTEGER(BigInteger.class, Types.NUMERIC),
  REAL(Double.class, Types.REAL),
  DOUBLE_PRECISION(Double.class, Types.DOUBLE),
  NUMERIC(BigDecimal.class, Types.NUMERIC),
  TEXT(String.class, Types.VARCHAR),
  DATE(LocalDate.class, Types.DATE),
  TIMESTAMP(LocalDateTime.class, Types.TIMESTAMP),
  TIMESTAMP_WITH_TIMEZONE(OffsetDateTime.class, Types.TIMESTAMP_WITH_TIMEZONE),
  BOOLEAN(Boolean.class, Types.BOOLEAN),
  BYTEA(byte[].class, Types.BINARY),
  ARRAY(List.class, Types.ARRAY),
  // names the driver does not know are passed through as text
  UNKNOWN(String.class, Types.OTHER);

  private final Class<?> javaClass;
  private final int sqlType;

  FireboltDataType(Class<?> javaClass, int sqlType) {
    this.javaClass = javaClass;
    this.sqlType = sqlType;
  }

  public Class<?> getJavaClass() {
    return javaClass;
  }

  /** @return the {@link java.sql.Types} constant closest to this type */
  public int getSqlType() {
    return sqlType;
  }

  /**
   * Converts a bare type name (no parameters, no nullable marker) returned by the server.
   *
   * @param typeName type name, e.g. {@code int}, {@code text}, {@code timestamptz}
   * @return matching type, {@link #UNKNOWN} if the name is not recognized
   */
  public static FireboltDataType fromString(String typeName) {
    if (typeName == null) {
      return UNKNOWN;
    }
    switch (typeName.trim().toLowerCase(Locale.ROOT)) {
      case "int":
      case "integer":
      case "int32":
      case "int8":
      case "int16":
      case "uint8":
      case "uint16":
      case "smallint":
        return INTEGER;
      case "long":
      case "bigint":
      case "int64":
      case "uint32":
        return BIG_INTEGER;
      case "uint64":
        return UNSIGNED_BIG_INTEGER;
      case "float":
      case "float32":
      case "real":
        return REAL;
      case "double":
      case "float64":
      case "double precision":
        return DOUBLE_PRECISION;
      case "decimal":
      case "numeric":
        return NUMERIC;
      case "text":
      case "string":
      case "varchar":
        return TEXT;
      case "date":
      case "pgdate":
      case "date_ext":
        return DATE;
      case "datetime":
      case "timestamp":
      case "timestampntz":
      case "datetime64":
        return TIMESTAMP;
      case "timestamptz":
        return TIMESTAMP_WITH_TIMEZONE;
      case "boolean":
      case "bool":
        return BOOLEAN;
      case "bytea":
        return BYTEA;
      case "array":
        return ARRAY;
      default:
        return UNKNOWN;
    }
  }
}
