package io.firebolt.client.api;

import io.firebolt.client.core.Column;
import io.firebolt.client.core.CursorState;
import io.firebolt.client.core.QueryStatus;
import io.firebolt.client.core.Statistics;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Non-blocking view of a {@link FireboltCursor}. Same semantics, including the locking between
 * executes and fetches; only the calling thread does not wait.
 */
public class AsyncFireboltCursor implements AutoCloseable {
  private final FireboltCursor cursor;
  private final Executor executor;

  AsyncFireboltCursor(FireboltCursor cursor, Executor executor) {
    this.cursor = cursor;
    this.executor = executor;
  }

  public CompletableFuture<ExecuteResult> execute(String query) {
    return AsyncSupport.supply(() -> cursor.execute(query), executor);
  }

  public CompletableFuture<ExecuteResult> execute(String query, List<?> parameters) {
    return AsyncSupport.supply(() -> cursor.execute(query, parameters), executor);
  }

  public CompletableFuture<ExecuteResult> execute(
      String query, List<?> parameters, boolean skipParsing, boolean asyncExecution) {
    return AsyncSupport.supply(
        () -> cursor.execute(query, parameters, skipParsing, asyncExecution), executor);
  }

  public CompletableFuture<ExecuteResult> executeMany(
      String query, List<? extends List<?>> parameterSets, boolean asyncExecution) {
    return AsyncSupport.supply(
        () -> cursor.executeMany(query, parameterSets, asyncExecution), executor);
  }

  public CompletableFuture<List<Object>> fetchOne() {
    return AsyncSupport.supply(cursor::fetchOne, executor);
  }

  public CompletableFuture<List<List<Object>>> fetchMany() {
    return AsyncSupport.supply(cursor::fetchMany, executor);
  }

  public CompletableFuture<List<List<Object>>> fetchMany(int size) {
    return AsyncSupport.supply(() -> cursor.fetchMany(size), executor);
  }

  public CompletableFuture<List<List<Object>>> fetchAll() {
    return AsyncSupport.supply(cursor::fetchAll, executor);
  }

  /** @return future of {@link Boolean#TRUE} if there was a next row set, null otherwise */
  public CompletableFuture<Boolean> nextSet() {
    return AsyncSupport.supply(cursor::nextSet, executor);
  }

  public CompletableFuture<QueryStatus> getStatus(String queryId) {
    return AsyncSupport.supply(() -> cursor.getStatus(queryId), executor);
  }

  public CompletableFuture<Void> cancel(String queryId) {
    return AsyncSupport.supply(
        () -> {
          cursor.cancel(queryId);
          return null;
        },
        executor);
  }

  public List<Column> getDescription() {
    return cursor.getDescription();
  }

  public int getRowCount() {
    return cursor.getRowCount();
  }

  public Statistics getStatistics() {
    return cursor.getStatistics();
  }

  public String getQueryId() {
    return cursor.getQueryId();
  }

  public CursorState getState() {
    return cursor.getState();
  }

  public int getArraySize() {
    return cursor.getArraySize();
  }

  public void setArraySize(int arraySize) throws FireboltSQLException {
    cursor.setArraySize(arraySize);
  }

  public Map<String, String> getSetParameters() {
    return cursor.getSetParameters();
  }

  public void flushParameters() {
    cursor.flushParameters();
  }

  public boolean isClosed() {
    return cursor.isClosed();
  }

  @Override
  public void close() {
    cursor.close();
  }

  /** @return the blocking cursor this view runs on */
  public FireboltCursor getCursor() {
    return cursor;
  }
}
