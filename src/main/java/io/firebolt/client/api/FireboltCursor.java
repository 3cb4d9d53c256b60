package io.firebolt.client.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.firebolt.client.core.Column;
import io.firebolt.client.core.CursorState;
import io.firebolt.client.core.ErrorClassifier;
import io.firebolt.client.core.QueryStatus;
import io.firebolt.client.core.ResultDecoder;
import io.firebolt.client.core.RowSet;
import io.firebolt.client.core.Statement;
import io.firebolt.client.core.StatementSplitter;
import io.firebolt.client.core.Statistics;
import io.firebolt.client.core.Transport;
import io.firebolt.client.core.TransportResponse;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import io.firebolt.client.util.SecretDetector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.http.HttpStatus;

/**
 * Runs queries on a connection and iterates over their results.
 *
 * <p>A query text may hold several statements; each produces one {@link RowSet}. After an execute
 * the cursor points at the first row set and {@link #nextSet()} moves to the following ones.
 *
 * <p>Statements of the form {@code SET name = value} are not sent as queries. The parameter is
 * checked with a validation query and, if the server accepts it, sent along with every later
 * statement of this cursor until {@link #flushParameters()} or {@link #close()}.
 *
 * <p>A cursor can be shared by several threads. Executes are serialized; fetches may run
 * concurrently with each other and each row is returned to exactly one caller.
 */
public class FireboltCursor implements AutoCloseable, Iterable<List<Object>> {
  private static final FireboltLogger logger =
      FireboltLoggerFactory.getLogger(FireboltCursor.class);

  static final String JSON_OUTPUT_FORMAT = "JSON_Compact";
  static final String OUTPUT_FORMAT_PARAMETER = "output_format";
  static final String DATABASE_PARAMETER = "database";
  static final String ACCOUNT_ID_PARAMETER = "account_id";
  static final String QUERY_ID_PARAMETER = "query_id";
  static final String ASYNC_EXECUTION_PARAMETER = "async_execution";
  static final String ADVANCED_MODE_PARAMETER = "advanced_mode";
  static final String STATUS_PATH = "status";
  static final String CANCEL_PATH = "cancel";

  private final FireboltConnection connection;
  private final ErrorClassifier errorClassifier;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  // written under the write lock only
  private final Map<String, String> setParameters =
      Collections.synchronizedMap(new LinkedHashMap<>());

  private volatile CursorState state = CursorState.NONE;
  private volatile List<RowSet> rowSets = Collections.emptyList();
  private final AtomicReference<Position> position = new AtomicReference<>(Position.START);
  private volatile String queryId;
  private volatile int arraySize = 1;

  FireboltCursor(FireboltConnection connection, ErrorClassifier errorClassifier) {
    this.connection = connection;
    this.errorClassifier = errorClassifier;
  }

  /**
   * Runs a query without parameters.
   *
   * @param query one or more statements separated by {@code ;}
   * @return row count of the first statement
   * @throws FireboltSQLException if the query fails
   */
  public ExecuteResult execute(String query) throws FireboltSQLException {
    return execute(query, null, false, false);
  }

  /**
   * Runs a query with one parameter set.
   *
   * @param query one or more statements with {@code ?} placeholders
   * @param parameters values for the placeholders, in order across all statements
   * @return row count of the first statement
   * @throws FireboltSQLException if the query fails
   */
  public ExecuteResult execute(String query, List<?> parameters) throws FireboltSQLException {
    return execute(query, parameters, false, false);
  }

  /**
   * Prepares and runs a query.
   *
   * @param query one or more statements with {@code ?} placeholders
   * @param parameters values for the placeholders, may be null
   * @param skipParsing send the query text as is: no parameters, statement splitting or SET
   * @param asyncExecution submit the query for server side asynchronous execution
   * @return row count of the first statement, or the query id for an asynchronous submission
   * @throws FireboltSQLException if the query fails
   */
  public ExecuteResult execute(
      String query, List<?> parameters, boolean skipParsing, boolean asyncExecution)
      throws FireboltSQLException {
    List<List<?>> parameterSets =
        parameters == null || parameters.isEmpty()
            ? Collections.<List<?>>emptyList()
            : Collections.<List<?>>singletonList(parameters);
    return doExecute(query, parameterSets, skipParsing, asyncExecution);
  }

  /**
   * Runs a query once per parameter set, in order. The row sets of all runs are kept.
   *
   * @param query one or more statements with {@code ?} placeholders
   * @param parameterSets parameter sets
   * @param asyncExecution submit the query for server side asynchronous execution
   * @return row count of the first statement, or the query id for an asynchronous submission
   * @throws FireboltSQLException if the query fails
   */
  public ExecuteResult executeMany(
      String query, List<? extends List<?>> parameterSets, boolean asyncExecution)
      throws FireboltSQLException {
    return doExecute(query, parameterSets, false, asyncExecution);
  }

  public ExecuteResult executeMany(String query, List<? extends List<?>> parameterSets)
      throws FireboltSQLException {
    return executeMany(query, parameterSets, false);
  }

  /**
   * @param query query text
   * @return row count of the first statement
   * @throws FireboltSQLException if the query fails
   */
  public int executeForRowCount(String query) throws FireboltSQLException {
    return execute(query).getRowCount();
  }

  private ExecuteResult doExecute(
      String query,
      List<? extends List<?>> parameterSets,
      boolean skipParsing,
      boolean asyncExecution)
      throws FireboltSQLException {
    checkNotClosed();
    lock.writeLock().lock();
    try {
      reset();
      List<Statement> statements =
          skipParsing
              ? Collections.<Statement>singletonList(new Statement.Query(query))
              : StatementSplitter.splitFormatSql(query, parameterSets);
      if (asyncExecution) {
        validateServerSideAsyncSettings(parameterSets, statements, skipParsing);
      }

      List<RowSet> results = new ArrayList<>(statements.size());
      for (Statement statement : statements) {
        long start = System.currentTimeMillis();
        logStatement(statement);

        RowSet rowSet = RowSet.empty();
        if (statement.isSetParameter()) {
          validateSetParameter((Statement.SetParameter) statement);
        } else if (asyncExecution) {
          queryId = submitAsync(((Statement.Query) statement).getSql());
        } else {
          rowSet = runQuery(((Statement.Query) statement).getSql());
        }
        results.add(rowSet);

        logger.info(
            "Query fetched {} rows in {} ms",
            rowSet.getRowCount(),
            System.currentTimeMillis() - start);
      }
      rowSets = Collections.unmodifiableList(results);
      position.set(Position.START);
      state = CursorState.DONE;
      return queryId != null
          ? ExecuteResult.ofQueryId(queryId)
          : ExecuteResult.ofRowCount(getRowCount());
    } catch (FireboltSQLException | RuntimeException ex) {
      state = CursorState.ERROR;
      throw ex;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void reset() {
    state = CursorState.NONE;
    rowSets = Collections.emptyList();
    position.set(Position.START);
    queryId = null;
  }

  private static void logStatement(Statement statement) {
    if (statement.isSetParameter()) {
      logger.debug("Running query: {}", statement);
    } else if (!SecretDetector.containsCredentials(((Statement.Query) statement).getSql())) {
      logger.debug("Running query: {}", statement);
    }
  }

  private void validateServerSideAsyncSettings(
      List<? extends List<?>> parameterSets, List<Statement> statements, boolean skipParsing)
      throws FireboltSQLException {
    if (parameterSets != null && parameterSets.size() > 1) {
      throw new FireboltSQLException(
          ErrorCode.ASYNC_EXECUTION_UNAVAILABLE,
          "Server side async does not support executemany with more than one parameter set.");
    }
    if (skipParsing) {
      throw new FireboltSQLException(
          ErrorCode.ASYNC_EXECUTION_UNAVAILABLE,
          "Server side async does not support skip_parsing option.");
    }
    if (statements.size() != 1 || statements.get(0).isSetParameter()) {
      throw new FireboltSQLException(
          ErrorCode.ASYNC_EXECUTION_UNAVAILABLE,
          "Server side async does not support multi-statement queries or SET statements.");
    }
  }

  private void validateSetParameter(Statement.SetParameter parameter) throws FireboltSQLException {
    if (ASYNC_EXECUTION_PARAMETER.equalsIgnoreCase(parameter.getName())) {
      throw new FireboltSQLException(
          ErrorCode.ASYNC_EXECUTION_UNAVAILABLE,
          "It is not possible to set async_execution using a SET command. "
              + "Instead, pass it as an argument to the execute or executeMany method.");
    }
    Map<String, String> params = new LinkedHashMap<>();
    params.put(parameter.getName(), parameter.getValue());
    params.put(OUTPUT_FORMAT_PARAMETER, JSON_OUTPUT_FORMAT);
    TransportResponse response = apiRequest("select 1", params, "", true);
    errorClassifier.raiseIfSetParameterError(response, parameter);

    // parameter passed validation
    setParameters.put(parameter.getName(), parameter.getValue());
  }

  private String submitAsync(String sql) throws FireboltSQLException {
    Map<String, String> params = new LinkedHashMap<>();
    params.put(ASYNC_EXECUTION_PARAMETER, "1");
    params.put(ADVANCED_MODE_PARAMETER, "1");
    params.put(OUTPUT_FORMAT_PARAMETER, JSON_OUTPUT_FORMAT);
    TransportResponse response = apiRequest(sql, params, "", true);
    errorClassifier.raiseIfError(response);
    if (response.getBody().trim().isEmpty()) {
      throw new FireboltSQLException(
          ErrorCode.OPERATIONAL_ERROR, "No response to asynchronous query.");
    }
    JsonNode id = response.json().path(QUERY_ID_PARAMETER);
    if (!id.isValueNode() || id.asText().isEmpty()) {
      throw new FireboltSQLException(
          ErrorCode.OPERATIONAL_ERROR,
          "Invalid response to asynchronous query: missing query_id.");
    }
    return id.asText();
  }

  private RowSet runQuery(String sql) throws FireboltSQLException {
    Map<String, String> params =
        Collections.singletonMap(OUTPUT_FORMAT_PARAMETER, JSON_OUTPUT_FORMAT);
    TransportResponse response = apiRequest(sql, params, "", true);
    errorClassifier.raiseIfError(response);
    return ResultDecoder.decode(response.getBody(), getSetParameters());
  }

  /**
   * Sends one request to the engine with the session wire parameters.
   *
   * @param sql request body
   * @param parameters request specific parameters, they win over set-parameters of the same name
   * @param path endpoint path, {@code ""} for queries
   * @param useSetParameters whether to send the session set-parameters
   */
  private TransportResponse apiRequest(
      String sql, Map<String, String> parameters, String path, boolean useSetParameters)
      throws FireboltSQLException {
    Map<String, String> params = new LinkedHashMap<>();
    if (useSetParameters) {
      params.putAll(getSetParameters());
    }
    params.putAll(parameters);
    Transport transport = connection.getTransport();
    if (connection.getDatabase() != null) {
      params.put(DATABASE_PARAMETER, connection.getDatabase());
    }
    if (connection.isSystemEngine() && transport.getAccountId() != null) {
      params.put(ACCOUNT_ID_PARAMETER, transport.getAccountId());
    }
    return transport.request(Transport.POST, path, params, sql);
  }

  /**
   * Polls the status of a server side asynchronous query.
   *
   * @param queryId id returned by an asynchronous execute
   * @return current status; {@link QueryStatus#NOT_READY} if the server does not report one yet
   * @throws FireboltSQLException if the status cannot be read
   */
  public QueryStatus getStatus(String queryId) throws FireboltSQLException {
    checkNotClosed();
    try {
      // set parameters make the status endpoint fail
      TransportResponse response =
          apiRequest("", sideChannelParameters(queryId), STATUS_PATH, false);
      if (response.getStatusCode() == HttpStatus.SC_BAD_REQUEST) {
        throw new FireboltSQLException(
            ErrorCode.OPERATIONAL_ERROR,
            "Asynchronous query "
                + queryId
                + " status check failed: "
                + response.getStatusCode()
                + ".");
      }
      errorClassifier.raiseIfError(response);
      JsonNode status = response.json().get("status");
      if (status == null || !status.isValueNode()) {
        throw new FireboltSQLException(
            ErrorCode.OPERATIONAL_ERROR,
            "Invalid response to asynchronous query: missing status.");
      }
      return QueryStatus.getStatusFromString(status.asText());
    } catch (FireboltSQLException ex) {
      state = CursorState.ERROR;
      throw ex.getQueryId() == null ? ex.withQueryId(queryId) : ex;
    } catch (RuntimeException ex) {
      state = CursorState.ERROR;
      throw ex;
    }
  }

  /**
   * Asks the server to cancel an asynchronous query. Does not wait for the cancellation; poll
   * {@link #getStatus(String)} to observe it.
   *
   * @param queryId id returned by an asynchronous execute
   * @throws FireboltSQLException if the request cannot be sent
   */
  public void cancel(String queryId) throws FireboltSQLException {
    checkNotClosed();
    TransportResponse response;
    try {
      response = apiRequest("", sideChannelParameters(queryId), CANCEL_PATH, false);
    } catch (FireboltSQLException ex) {
      throw ex.withQueryId(queryId);
    }
    logger.debug("Cancel of query {} answered with status {}", queryId, response.getStatusCode());
  }

  private static Map<String, String> sideChannelParameters(String queryId) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put(QUERY_ID_PARAMETER, queryId);
    params.put(OUTPUT_FORMAT_PARAMETER, "");
    return params;
  }

  /**
   * @return next row of the current row set, null if all rows have been fetched
   * @throws FireboltSQLException NO_DATA if the last execute did not produce a result table
   */
  public List<Object> fetchOne() throws FireboltSQLException {
    List<List<Object>> rows = fetch(1);
    return rows.isEmpty() ? null : rows.get(0);
  }

  /**
   * @return up to {@link #getArraySize()} next rows of the current row set
   * @throws FireboltSQLException NO_DATA if the last execute did not produce a result table
   */
  public List<List<Object>> fetchMany() throws FireboltSQLException {
    return fetch(arraySize);
  }

  /**
   * @param size maximum number of rows
   * @return up to {@code size} next rows of the current row set
   * @throws FireboltSQLException NO_DATA if the last execute did not produce a result table
   */
  public List<List<Object>> fetchMany(int size) throws FireboltSQLException {
    if (size < 0) {
      throw new FireboltSQLException(ErrorCode.DATA_ERROR, "fetch size must not be negative");
    }
    return fetch(size);
  }

  /**
   * @return all remaining rows of the current row set, empty once they have been fetched
   * @throws FireboltSQLException NO_DATA if the last execute did not produce a result table
   */
  public List<List<Object>> fetchAll() throws FireboltSQLException {
    return fetch(Integer.MAX_VALUE);
  }

  private List<List<Object>> fetch(int size) throws FireboltSQLException {
    checkNotClosed();
    lock.readLock().lock();
    try {
      checkQueryExecuted();
      while (true) {
        Position current = position.get();
        List<List<Object>> rows = currentRows(current);
        int from = Math.min(current.offset, rows.size());
        int to = (int) Math.min((long) from + size, rows.size());
        if (position.compareAndSet(current, new Position(current.setIndex, to))) {
          return Collections.unmodifiableList(new ArrayList<>(rows.subList(from, to)));
        }
      }
    } finally {
      lock.readLock().unlock();
    }
  }

  private List<List<Object>> currentRows(Position current) throws FireboltSQLException {
    List<RowSet> sets = rowSets;
    if (current.setIndex >= sets.size()) {
      throw new FireboltSQLException(ErrorCode.NO_DATA);
    }
    List<List<Object>> rows = sets.get(current.setIndex).getRows();
    if (rows == null) {
      throw new FireboltSQLException(ErrorCode.NO_DATA);
    }
    return rows;
  }

  /**
   * Moves to the result of the next statement.
   *
   * @return {@link Boolean#TRUE} if there was a next row set, null if there are no more
   * @throws FireboltSQLException NO_DATA if no query has been executed successfully
   */
  public Boolean nextSet() throws FireboltSQLException {
    checkNotClosed();
    lock.readLock().lock();
    try {
      checkQueryExecuted();
      while (true) {
        Position current = position.get();
        if (current.setIndex + 1 >= rowSets.size()) {
          return null;
        }
        if (position.compareAndSet(current, new Position(current.setIndex + 1, 0))) {
          return Boolean.TRUE;
        }
      }
    } finally {
      lock.readLock().unlock();
    }
  }

  private RowSet currentRowSet() {
    List<RowSet> sets = rowSets;
    int index = position.get().setIndex;
    return index < sets.size() ? sets.get(index) : null;
  }

  /** @return columns of the current row set, null if it has no result table */
  public List<Column> getDescription() {
    RowSet rowSet = currentRowSet();
    return rowSet == null ? null : rowSet.getColumns();
  }

  /** @return row count of the current row set, -1 if it has no result table */
  public int getRowCount() {
    RowSet rowSet = currentRowSet();
    return rowSet == null ? -1 : rowSet.getRowCount();
  }

  public Statistics getStatistics() {
    RowSet rowSet = currentRowSet();
    return rowSet == null ? null : rowSet.getStatistics();
  }

  /** @return id of the last asynchronous submission, null if the last execute was synchronous */
  public String getQueryId() {
    return queryId;
  }

  public CursorState getState() {
    return state;
  }

  public int getArraySize() {
    return arraySize;
  }

  public void setArraySize(int arraySize) throws FireboltSQLException {
    if (arraySize < 1) {
      throw new FireboltSQLException(ErrorCode.DATA_ERROR, "array size must be positive");
    }
    this.arraySize = arraySize;
  }

  /** @return copy of the session set-parameters sent with every statement */
  public Map<String, String> getSetParameters() {
    synchronized (setParameters) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(setParameters));
    }
  }

  /** Drops all session set-parameters. */
  public void flushParameters() {
    setParameters.clear();
  }

  public FireboltConnection getConnection() {
    return connection;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Closes the cursor; a close of a closed cursor is ignored. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    lock.writeLock().lock();
    try {
      state = CursorState.CLOSED;
      rowSets = Collections.emptyList();
      position.set(Position.START);
      setParameters.clear();
    } finally {
      lock.writeLock().unlock();
    }
    connection.removeCursor(this);
    logger.debug("Cursor closed");
  }

  /**
   * Iterates over the remaining rows of the current row set. Fetch errors are rethrown as {@link
   * IllegalStateException} with the {@link FireboltSQLException} as cause.
   */
  @Override
  public Iterator<List<Object>> iterator() {
    return new Iterator<List<Object>>() {
      private List<Object> next;

      @Override
      public boolean hasNext() {
        if (next == null) {
          try {
            next = fetchOne();
          } catch (FireboltSQLException ex) {
            throw new IllegalStateException(ex.getMessage(), ex);
          }
        }
        return next != null;
      }

      @Override
      public List<Object> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        List<Object> row = next;
        next = null;
        return row;
      }
    };
  }

  private void checkNotClosed() throws FireboltSQLException {
    if (closed.get()) {
      throw new FireboltSQLException(ErrorCode.CURSOR_CLOSED, "Unable to run operation");
    }
  }

  private void checkQueryExecuted() throws FireboltSQLException {
    if (state != CursorState.DONE) {
      logger.debug("No data to fetch, cursor state is {}", state);
      throw new FireboltSQLException(ErrorCode.NO_DATA);
    }
  }

  /** Current row set and the offset of the next row to fetch in it. */
  private static final class Position {
    static final Position START = new Position(0, 0);

    final int setIndex;
    final int offset;

    Position(int setIndex, int offset) {
      this.setIndex = setIndex;
      this.offset = offset;
    }
  }
}
