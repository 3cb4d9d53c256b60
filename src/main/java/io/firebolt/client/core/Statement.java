package io.firebolt.client.core;

import java.util.Objects;

/**
 * One unit of work produced by {@link StatementSplitter}: either a query to send as is, or a
 * {@link SetParameter} directive that changes session state instead of running a query.
 */
public abstract class Statement {
  private Statement() {}

  public abstract boolean isSetParameter();

  /** A literal SQL statement. */
  public static final class Query extends Statement {
    private final String sql;

    public Query(String sql) {
      this.sql = Objects.requireNonNull(sql, "sql");
    }

    public String getSql() {
      return sql;
    }

    @Override
    public boolean isSetParameter() {
      return false;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Query && sql.equals(((Query) o).sql);
    }

    @Override
    public int hashCode() {
      return sql.hashCode();
    }

    @Override
    public String toString() {
      return sql;
    }
  }

  /** {@code SET name = value} */
  public static final class SetParameter extends Statement {
    private final String name;
    private final String value;

    public SetParameter(String name, String value) {
      this.name = Objects.requireNonNull(name, "name");
      this.value = Objects.requireNonNull(value, "value");
    }

    public String getName() {
      return name;
    }

    public String getValue() {
      return value;
    }

    @Override
    public boolean isSetParameter() {
      return true;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof SetParameter)) {
        return false;
      }
      SetParameter that = (SetParameter) o;
      return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override
    public String toString() {
      return "SET " + name + " = " + value;
    }
  }
}
