package io.firebolt.client.core;

import java.util.Objects;

/** Description of one projected column. Size fields are not reported by the server. */
public final class Column {
  private final String name;
  private final ColumnType type;
  private final Integer displaySize;
  private final Integer internalSize;
  private final Integer precision;
  private final Integer scale;
  private final Boolean nullOk;

  public Column(String name, ColumnType type) {
    this(name, type, null, null, type.getPrecision(), type.getScale(), type.isNullable());
  }

  public Column(
      String name,
      ColumnType type,
      Integer displaySize,
      Integer internalSize,
      Integer precision,
      Integer scale,
      Boolean nullOk) {
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
    this.displaySize = displaySize;
    this.internalSize = internalSize;
    this.precision = precision;
    this.scale = scale;
    this.nullOk = nullOk;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  /** @return the {@link java.sql.Types} code of the column */
  public int getTypeCode() {
    return type.getDataType().getSqlType();
  }

  public Integer getDisplaySize() {
    return displaySize;
  }

  public Integer getInternalSize() {
    return internalSize;
  }

  public Integer getPrecision() {
    return precision;
  }

  public Integer getScale() {
    return scale;
  }

  public Boolean getNullOk() {
    return nullOk;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Column)) {
      return false;
    }
    Column column = (Column) o;
    return Objects.equals(name, column.name)
        && type.equals(column.type)
        && Objects.equals(displaySize, column.displaySize)
        && Objects.equals(internalSize, column.internalSize)
        && Objects.equals(precision, column.precision)
        && Objects.equals(scale, column.scale)
        && Objects.equals(nullOk, column.nullOk);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, displaySize, internalSize, precision, scale, nullOk);
  }

  @Override
  public String toString() {
    return "Column{name=" + name + ", type=" + type + '}';
  }
}
