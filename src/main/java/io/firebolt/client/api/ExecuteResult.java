package io.firebolt.client.api;

/**
 * Outcome of an execute call: the row count of the first statement, or the query id of a server
 * side asynchronous submission.
 */
public final class ExecuteResult {
  private final int rowCount;
  private final String queryId;

  private ExecuteResult(int rowCount, String queryId) {
    this.rowCount = rowCount;
    this.queryId = queryId;
  }

  static ExecuteResult ofRowCount(int rowCount) {
    return new ExecuteResult(rowCount, null);
  }

  static ExecuteResult ofQueryId(String queryId) {
    return new ExecuteResult(-1, queryId);
  }

  /** @return true if the query was submitted for asynchronous execution */
  public boolean isAsync() {
    return queryId != null;
  }

  /** @return row count of the first result, -1 for statements without result table */
  public int getRowCount() {
    return rowCount;
  }

  /** @return query id of an asynchronous submission, null otherwise */
  public String getQueryId() {
    return queryId;
  }

  @Override
  public String toString() {
    return isAsync()
        ? "ExecuteResult{queryId=" + queryId + '}'
        : "ExecuteResult{rowCount=" + rowCount + '}';
  }
}
