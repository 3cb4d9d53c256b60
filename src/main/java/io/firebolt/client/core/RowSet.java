package io.firebolt.client.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one executed statement. Rows are coerced on first access, so a cell that cannot be
 * decoded fails reads of this row set only.
 */
public final class RowSet {
  private static final RowSet EMPTY = new RowSet(-1, null, null, null, null);

  private final int rowCount;
  private final List<Column> columns;
  private final Statistics statistics;
  private final JsonNode data;
  private final ZoneId sessionZone;

  private List<List<Object>> rows;
  private FireboltSQLException decodeError;

  RowSet(
      int rowCount,
      List<Column> columns,
      Statistics statistics,
      JsonNode data,
      ZoneId sessionZone) {
    this.rowCount = rowCount;
    this.columns = columns == null ? null : Collections.unmodifiableList(columns);
    this.statistics = statistics;
    this.data = data;
    this.sessionZone = sessionZone;
  }

  /** @return the row set of a statement that produced no rows (DDL, DML, SET) */
  public static RowSet empty() {
    return EMPTY;
  }

  /** @return number of rows, -1 if the statement produced no result table */
  public int getRowCount() {
    return rowCount;
  }

  /** @return column descriptions, null if the statement produced no result table */
  public List<Column> getColumns() {
    return columns;
  }

  public Statistics getStatistics() {
    return statistics;
  }

  public boolean hasRows() {
    return columns != null && data != null;
  }

  /**
   * @return decoded rows, null if the statement produced no result table
   * @throws FireboltSQLException if a cell cannot be coerced to its column type; the same error is
   *     raised on every call
   */
  public synchronized List<List<Object>> getRows() throws FireboltSQLException {
    if (!hasRows()) {
      return null;
    }
    if (decodeError != null) {
      throw decodeError;
    }
    if (rows == null) {
      try {
        rows = decodeRows();
      } catch (FireboltSQLException ex) {
        decodeError = ex;
        throw ex;
      }
    }
    return rows;
  }

  private List<List<Object>> decodeRows() throws FireboltSQLException {
    List<List<Object>> decoded = new ArrayList<>(data.size());
    for (JsonNode rawRow : data) {
      if (!rawRow.isArray() || rawRow.size() != columns.size()) {
        throw new FireboltSQLException(
            ErrorCode.DECODE_ERROR,
            rawRow,
            "row",
            "expected " + columns.size() + " values per row");
      }
      List<Object> row = new ArrayList<>(columns.size());
      for (int i = 0; i < columns.size(); i++) {
        row.add(columns.get(i).getType().decode(rawRow.get(i), sessionZone));
      }
      decoded.add(Collections.unmodifiableList(row));
    }
    return Collections.unmodifiableList(decoded);
  }

  @Override
  public String toString() {
    return "RowSet{rowCount=" + rowCount + ", columns=" + columns + '}';
  }
}
