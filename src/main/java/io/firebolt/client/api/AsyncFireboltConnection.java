package io.firebolt.client.api;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Non-blocking view of a {@link FireboltConnection}. Operations that talk to the server run on the
 * given executor and complete a {@link CompletableFuture}.
 */
public class AsyncFireboltConnection implements AutoCloseable {
  private final FireboltConnection connection;
  private final Executor executor;

  public AsyncFireboltConnection(FireboltConnection connection, Executor executor) {
    this.connection = connection;
    this.executor = executor;
  }

  /**
   * @param properties connection properties, see {@link FireboltConnector#connect(Map)}
   * @param executor executor running blocking calls
   * @return future of the open connection
   */
  public static CompletableFuture<AsyncFireboltConnection> connect(
      Map<?, ?> properties, Executor executor) {
    return AsyncSupport.supply(
        () -> new AsyncFireboltConnection(FireboltConnector.connect(properties), executor),
        executor);
  }

  /** Connects on the common fork join pool. */
  public static CompletableFuture<AsyncFireboltConnection> connect(Map<?, ?> properties) {
    return connect(properties, ForkJoinPool.commonPool());
  }

  public AsyncFireboltCursor cursor() throws FireboltSQLException {
    return new AsyncFireboltCursor(connection.cursor(), executor);
  }

  public void commit() throws FireboltSQLException {
    connection.commit();
  }

  @Override
  public void close() {
    connection.close();
  }

  public boolean isClosed() {
    return connection.isClosed();
  }

  /** @return the blocking connection this view runs on */
  public FireboltConnection getConnection() {
    return connection;
  }
}
