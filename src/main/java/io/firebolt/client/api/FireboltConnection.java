package io.firebolt.client.api;

import io.firebolt.client.core.ErrorClassifier;
import io.firebolt.client.core.QueryRunner;
import io.firebolt.client.core.Transport;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A session with one engine. Owns the transport, the cursors it created and, for a user engine,
 * the system engine connection used for catalog lookups.
 */
public class FireboltConnection implements AutoCloseable {
  private static final FireboltLogger logger =
      FireboltLoggerFactory.getLogger(FireboltConnection.class);

  private final Transport transport;
  private final String database;
  private final FireboltConnection systemEngineConnection;
  private final ErrorClassifier errorClassifier;
  private final ErrorClassifier catalogErrorClassifier;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  // cursors dropped by the application without close are collected
  private final Set<FireboltCursor> cursors =
      Collections.synchronizedSet(Collections.newSetFromMap(new WeakHashMap<>()));

  /**
   * @param transport transport to the engine
   * @param database database queries run against, may be null
   * @param systemEngineConnection connection to the system engine, null if {@code transport}
   *     itself talks to the system engine; it is closed with this connection
   */
  public FireboltConnection(
      Transport transport, String database, FireboltConnection systemEngineConnection) {
    this.transport = transport;
    this.database = database;
    this.systemEngineConnection = systemEngineConnection;
    this.errorClassifier =
        new ErrorClassifier(database, transport.getBaseUrl(), isSystemEngine(), controlRunner());
    // catalog queries are not diagnosed with further catalog queries
    this.catalogErrorClassifier =
        new ErrorClassifier(database, transport.getBaseUrl(), isSystemEngine(), null);
  }

  /**
   * @return a new cursor sharing this connection's transport
   * @throws FireboltSQLException if the connection is closed
   */
  public FireboltCursor cursor() throws FireboltSQLException {
    return newCursor(errorClassifier);
  }

  private FireboltCursor newCursor(ErrorClassifier classifier) throws FireboltSQLException {
    checkNotClosed("Unable to create cursor");
    FireboltCursor cursor = new FireboltCursor(this, classifier);
    // close() sets the flag before it takes its snapshot under the same monitor
    synchronized (cursors) {
      if (!closed.get()) {
        cursors.add(cursor);
        return cursor;
      }
    }
    cursor.close();
    throw new FireboltSQLException(ErrorCode.CONNECTION_CLOSED, "Unable to create cursor");
  }

  void removeCursor(FireboltCursor cursor) {
    // absent cursors are ignored
    cursors.remove(cursor);
  }

  int getOpenCursorCount() {
    return cursors.size();
  }

  /**
   * Runs a catalog query on the system engine, on a cursor of its own.
   *
   * @return runner bound to the system engine connection
   */
  QueryRunner controlRunner() {
    return (sql, parameters) -> {
      FireboltConnection target =
          systemEngineConnection == null ? FireboltConnection.this : systemEngineConnection;
      try (FireboltCursor cursor = target.newCursor(target.catalogErrorClassifier)) {
        cursor.execute(sql, parameters);
        return cursor.fetchAll();
      }
    };
  }

  /**
   * Does nothing since there are no transactions.
   *
   * @throws FireboltSQLException if the connection is closed
   */
  public void commit() throws FireboltSQLException {
    checkNotClosed("Unable to commit");
  }

  /**
   * Closes all cursors, the transport and the system engine connection. Closing a closed
   * connection is ignored.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    List<FireboltCursor> open;
    synchronized (cursors) {
      open = new ArrayList<>(cursors);
    }
    for (FireboltCursor cursor : open) {
      cursor.close();
    }
    cursors.clear();
    transport.close();
    if (systemEngineConnection != null) {
      systemEngineConnection.close();
    }
    logger.debug("Connection to {} closed", transport.getBaseUrl());
  }

  public boolean isClosed() {
    return closed.get();
  }

  public String getDatabase() {
    return database;
  }

  public String getEngineUrl() {
    return transport.getBaseUrl();
  }

  /** @return true if this connection talks to the system engine */
  public boolean isSystemEngine() {
    return systemEngineConnection == null;
  }

  /** @return the system engine connection, null if this is the system engine */
  public FireboltConnection getSystemEngineConnection() {
    return systemEngineConnection;
  }

  Transport getTransport() {
    return transport;
  }

  private void checkNotClosed(String operation) throws FireboltSQLException {
    if (closed.get()) {
      throw new FireboltSQLException(ErrorCode.CONNECTION_CLOSED, operation);
    }
  }
}
