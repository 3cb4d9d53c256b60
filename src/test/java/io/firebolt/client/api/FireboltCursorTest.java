package io.firebolt.client.api;

import static io.firebolt.client.core.FakeTransport.columns;
import static io.firebolt.client.core.FakeTransport.result;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.firebolt.client.core.CursorState;
import io.firebolt.client.core.FakeTransport;
import io.firebolt.client.core.QueryStatus;
import io.firebolt.client.core.Transport;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class FireboltCursorTest {
  private FakeTransport transport;
  private FireboltConnection connection;
  private FireboltCursor cursor;

  @BeforeEach
  public void setUp() throws Exception {
    transport = new FakeTransport("https://sys.example.com/dynamic/query", "acc-1");
    connection = new FireboltConnection(transport, "db1", null);
    cursor = connection.cursor();
  }

  @AfterEach
  public void tearDown() {
    connection.close();
  }

  private static FireboltSQLException expectError(ErrorCode code, SqlAction action) {
    FireboltSQLException ex = assertThrows(FireboltSQLException.class, action::run);
    assertThat(ex.getMessage(), ex.getDriverErrorCode(), equalTo(code));
    return ex;
  }

  @FunctionalInterface
  private interface SqlAction {
    void run() throws Exception;
  }

  private List<FakeTransport.Request> queries() {
    List<FakeTransport.Request> queries = new ArrayList<>();
    for (FakeTransport.Request request : transport.getRequests()) {
      if (request.path.isEmpty()) {
        queries.add(request);
      }
    }
    return queries;
  }

  @Test
  public void testExecuteAndFetch() throws Exception {
    transport.onSql(
        "from numbers",
        result(
            columns("n", "int", "s", "text"),
            new Object[] {1, "a"},
            new Object[] {2, "b"},
            new Object[] {3, "c"}));

    ExecuteResult executeResult = cursor.execute("select n, s from numbers");

    assertThat(executeResult.isAsync(), is(false));
    assertThat(executeResult.getRowCount(), equalTo(3));
    assertThat(cursor.getState(), equalTo(CursorState.DONE));
    assertThat(cursor.getDescription(), hasSize(2));
    assertThat(cursor.getDescription().get(0).getName(), equalTo("n"));
    assertThat(cursor.getStatistics().getRowsRead(), equalTo(3L));
    assertThat(cursor.fetchOne(), contains(1, "a"));
    assertThat(cursor.fetchMany(), hasSize(1));
    assertThat(cursor.fetchAll(), contains(Arrays.<Object>asList(3, "c")));
    assertThat(cursor.fetchOne(), is(nullValue()));
    assertThat(cursor.fetchAll(), is(empty()));
  }

  @Test
  public void testWireParameters() throws Exception {
    cursor.execute("select 42");
    FakeTransport.Request request = transport.lastRequest();
    assertThat(request.method, equalTo(Transport.POST));
    assertThat(request.body, equalTo("select 42"));
    assertThat(request.params, hasEntry("output_format", "JSON_Compact"));
    assertThat(request.params, hasEntry("database", "db1"));
    assertThat(request.params, hasEntry("account_id", "acc-1"));
  }

  @Test
  public void testUserEngineDoesNotSendAccountId() throws Exception {
    FakeTransport engine = new FakeTransport("https://engine.example.com", null);
    try (FireboltConnection userEngine = new FireboltConnection(engine, "db1", connection)) {
      userEngine.cursor().execute("select 1");
    }
    assertThat(engine.lastRequest().params, not(hasKey("account_id")));
  }

  @Test
  public void testMultiStatementResults() throws Exception {
    transport.onSql("from t1", result(columns("a", "int"), new Object[] {1}, new Object[] {2}));
    transport.onSql("from t2", result(columns("b", "text"), new Object[] {"x"}));

    ExecuteResult executeResult =
        cursor.execute("select a from t1; create table t3 (c int); select b from t2");

    assertThat(executeResult.getRowCount(), equalTo(2));
    assertThat(queries(), hasSize(3));
    assertThat(cursor.fetchAll(), hasSize(2));

    assertThat(cursor.nextSet(), is(Boolean.TRUE));
    assertThat(cursor.getRowCount(), equalTo(-1));
    assertThat(cursor.getDescription(), is(nullValue()));
    expectError(ErrorCode.NO_DATA, () -> cursor.fetchOne());

    assertThat(cursor.nextSet(), is(Boolean.TRUE));
    assertThat(cursor.getRowCount(), equalTo(1));
    assertThat(cursor.fetchOne(), contains("x"));

    assertThat(cursor.nextSet(), is(nullValue()));
    assertThat(cursor.nextSet(), is(nullValue()));
  }

  @Test
  public void testFetchBeforeExecute() {
    assertThat(cursor.getState(), equalTo(CursorState.NONE));
    expectError(ErrorCode.NO_DATA, () -> cursor.fetchOne());
    expectError(ErrorCode.NO_DATA, () -> cursor.nextSet());
    assertThat(cursor.getRowCount(), equalTo(-1));
  }

  @Test
  public void testFailedExecute() throws Exception {
    transport.onSql("from broken", FakeTransport.status(500, "Code: 60. table missing"));
    FireboltSQLException ex =
        expectError(ErrorCode.OPERATIONAL_ERROR, () -> cursor.execute("select * from broken"));
    assertThat(ex.getMessage(), containsString("table missing"));
    assertThat(cursor.getState(), equalTo(CursorState.ERROR));
    expectError(ErrorCode.NO_DATA, () -> cursor.fetchAll());

    cursor.execute("select 1");
    assertThat(cursor.getState(), equalTo(CursorState.DONE));
  }

  @Test
  public void testSetParameterIsValidatedAndSent() throws Exception {
    ExecuteResult executeResult = cursor.execute("set time_zone = 'Asia/Tokyo'");
    assertThat(executeResult.getRowCount(), equalTo(-1));

    FakeTransport.Request validation = transport.lastRequest();
    assertThat(validation.body, equalTo("select 1"));
    assertThat(validation.params, hasEntry("time_zone", "Asia/Tokyo"));
    assertThat(cursor.getSetParameters(), hasEntry("time_zone", "Asia/Tokyo"));

    cursor.execute("select now()");
    assertThat(transport.lastRequest().params, hasEntry("time_zone", "Asia/Tokyo"));

    cursor.flushParameters();
    cursor.execute("select now()");
    assertThat(transport.lastRequest().params, not(hasKey("time_zone")));
  }

  @Test
  public void testSetParameterAppliesToLaterStatementsOfTheSameQuery() throws Exception {
    cursor.execute("set a = 1; select 2");
    assertThat(transport.lastRequest().body, equalTo("select 2"));
    assertThat(transport.lastRequest().params, hasEntry("a", "1"));
  }

  @Test
  public void testRejectedSetParameter() throws Exception {
    transport.on(
        request -> request.params.containsKey("bogus"),
        FakeTransport.status(400, "unknown setting bogus"));

    FireboltSQLException ex =
        expectError(ErrorCode.INVALID_PARAMETER, () -> cursor.execute("set bogus = 1"));
    assertThat(ex.getMessage(), containsString("bogus"));
    assertThat(cursor.getSetParameters().isEmpty(), is(true));
    assertThat(cursor.getState(), equalTo(CursorState.ERROR));
  }

  @Test
  public void testAsyncExecutionCannotBeSet() {
    expectError(
        ErrorCode.ASYNC_EXECUTION_UNAVAILABLE, () -> cursor.execute("set async_execution = 1"));
    assertThat(transport.getRequests(), is(empty()));
  }

  @Test
  public void testParametersAreSubstituted() throws Exception {
    cursor.execute("select * from t where a = ? and b = ?", Arrays.asList(1, "it's"));
    assertThat(
        transport.lastRequest().body, equalTo("select * from t where a = 1 and b = 'it''s'"));
  }

  @Test
  public void testSkipParsingSendsTextAsIs() throws Exception {
    cursor.execute("select '?'; select 2", null, true, false);
    assertThat(queries(), hasSize(1));
    assertThat(transport.lastRequest().body, equalTo("select '?'; select 2"));
  }

  @Test
  public void testExecuteManyKeepsAllRowSets() throws Exception {
    cursor.executeMany(
        "insert into t values (?)", Arrays.asList(Collections.singletonList(1), Arrays.asList(2)));
    assertThat(queries(), hasSize(2));
    assertThat(queries().get(1).body, equalTo("insert into t values (2)"));
    assertThat(cursor.nextSet(), is(Boolean.TRUE));
    assertThat(cursor.nextSet(), is(nullValue()));
  }

  @Test
  public void testParameterCountMismatch() {
    expectError(ErrorCode.DATA_ERROR, () -> cursor.execute("select ?", Arrays.asList(1, 2)));
    assertThat(cursor.getState(), equalTo(CursorState.ERROR));
    assertThat(transport.getRequests(), is(empty()));
  }

  @Test
  public void testAsyncSubmission() throws Exception {
    transport.on(
        request -> "1".equals(request.params.get("async_execution")),
        FakeTransport.ok("{\"query_id\":\"q-1\",\"message\":\"submitted\"}"));

    ExecuteResult executeResult =
        cursor.execute("insert into t select * from s", null, false, true);

    assertThat(executeResult.isAsync(), is(true));
    assertThat(executeResult.getQueryId(), equalTo("q-1"));
    assertThat(cursor.getQueryId(), equalTo("q-1"));
    Map<String, String> params = transport.lastRequest().params;
    assertThat(params, hasEntry("advanced_mode", "1"));
    assertThat(params, hasEntry("output_format", "JSON_Compact"));
    expectError(ErrorCode.NO_DATA, () -> cursor.fetchOne());
  }

  @Test
  public void testAsyncSubmissionWithoutAnswer() throws Exception {
    FireboltSQLException ex =
        expectError(
            ErrorCode.OPERATIONAL_ERROR, () -> cursor.execute("select 1", null, false, true));
    assertThat(ex.getMessage(), containsString("No response to asynchronous query."));

    transport.on(request -> true, FakeTransport.ok("{\"message\":\"ok\"}"));
    ex =
        expectError(
            ErrorCode.OPERATIONAL_ERROR, () -> cursor.execute("select 1", null, false, true));
    assertThat(ex.getMessage(), containsString("missing query_id"));
  }

  @Test
  public void testAsyncRestrictions() {
    expectError(
        ErrorCode.ASYNC_EXECUTION_UNAVAILABLE,
        () -> cursor.execute("select 1; select 2", null, false, true));
    expectError(
        ErrorCode.ASYNC_EXECUTION_UNAVAILABLE,
        () -> cursor.execute("set a = 1", null, false, true));
    expectError(
        ErrorCode.ASYNC_EXECUTION_UNAVAILABLE, () -> cursor.execute("select 1", null, true, true));
    expectError(
        ErrorCode.ASYNC_EXECUTION_UNAVAILABLE,
        () ->
            cursor.executeMany(
                "select ?",
                Arrays.asList(Collections.singletonList(1), Collections.singletonList(2)),
                true));
    assertThat(transport.getRequests(), is(empty()));
  }

  @Test
  public void testGetStatus() throws Exception {
    cursor.execute("set a = 1");
    transport.onPath("status", FakeTransport.ok("{\"status\":\"RUNNING\",\"query_id\":\"q-1\"}"));

    assertThat(cursor.getStatus("q-1"), equalTo(QueryStatus.RUNNING));

    FakeTransport.Request request = transport.lastRequest();
    assertThat(request.params, hasEntry("query_id", "q-1"));
    assertThat(request.params, hasEntry("output_format", ""));
    assertThat(request.params, not(hasKey("a")));

    transport.onPath("status", FakeTransport.ok("{\"status\":\"\"}"));
    assertThat(cursor.getStatus("q-1"), equalTo(QueryStatus.NOT_READY));
  }

  @Test
  public void testGetStatusFailures() {
    transport.onPath("status", FakeTransport.status(400, "bad"));
    FireboltSQLException ex =
        expectError(ErrorCode.OPERATIONAL_ERROR, () -> cursor.getStatus("q-9"));
    assertThat(ex.getMessage(), containsString("Asynchronous query q-9 status check failed: 400."));
    assertThat(ex.getQueryId(), equalTo("q-9"));

    transport.onPath("status", FakeTransport.ok("{}"));
    ex = expectError(ErrorCode.OPERATIONAL_ERROR, () -> cursor.getStatus("q-9"));
    assertThat(ex.getMessage(), containsString("missing status"));

    transport.onPath("status", FakeTransport.ok("{\"status\":\"EXPLODED\"}"));
    ex = expectError(ErrorCode.OPERATIONAL_ERROR, () -> cursor.getStatus("q-9"));
    assertThat(ex.getQueryId(), equalTo("q-9"));
    assertThat(cursor.getState(), equalTo(CursorState.ERROR));

    transport.onPath("status", FakeTransport.status(503, "unavailable"));
    ex = expectError(ErrorCode.HTTP_ERROR, () -> cursor.getStatus("q-10"));
    assertThat(ex.getQueryId(), equalTo("q-10"));
  }

  @Test
  public void testCancelFailureCarriesQueryId() throws Exception {
    Transport failing = mock(Transport.class);
    when(failing.getBaseUrl()).thenReturn("https://engine.example.com");
    when(failing.request(anyString(), eq("cancel"), anyMap(), anyString()))
        .thenThrow(new FireboltSQLException(ErrorCode.NETWORK_ERROR, "connection reset"));
    try (FireboltConnection failingConnection = new FireboltConnection(failing, "db", null)) {
      FireboltCursor failingCursor = failingConnection.cursor();
      FireboltSQLException ex =
          expectError(ErrorCode.NETWORK_ERROR, () -> failingCursor.cancel("q-3"));
      assertThat(ex.getQueryId(), equalTo("q-3"));
    }
  }

  @Test
  public void testCancel() throws Exception {
    cursor.cancel("q-1");
    FakeTransport.Request request = transport.lastRequest();
    assertThat(request.path, equalTo("cancel"));
    assertThat(request.params, hasEntry("query_id", "q-1"));
  }

  @Test
  public void testArraySize() throws Exception {
    transport.onSql(
        "from t",
        result(columns("a", "int"), new Object[] {1}, new Object[] {2}, new Object[] {3}));
    cursor.setArraySize(2);
    cursor.execute("select a from t");
    assertThat(cursor.fetchMany(), hasSize(2));
    assertThat(cursor.fetchMany(), hasSize(1));
    expectError(ErrorCode.DATA_ERROR, () -> cursor.setArraySize(0));
    expectError(ErrorCode.DATA_ERROR, () -> cursor.fetchMany(-1));
    assertThat(cursor.fetchMany(0), is(empty()));
  }

  @Test
  public void testUndecodableRowSet() throws Exception {
    transport.onSql("from t", result(columns("a", "int"), new Object[] {"not a number"}));
    cursor.execute("select a from t");
    assertThat(cursor.getState(), equalTo(CursorState.DONE));
    expectError(ErrorCode.DECODE_ERROR, () -> cursor.fetchOne());
  }

  @Test
  public void testIterator() throws Exception {
    transport.onSql("from t", result(columns("a", "int"), new Object[] {1}, new Object[] {2}));
    cursor.execute("select a from t");
    List<Object> values = new ArrayList<>();
    for (List<Object> row : cursor) {
      values.add(row.get(0));
    }
    assertThat(values, contains(1, 2));
  }

  @Test
  public void testClose() throws Exception {
    cursor.execute("set a = 1");
    assertThat(connection.getOpenCursorCount(), equalTo(1));

    cursor.close();
    cursor.close();

    assertThat(cursor.isClosed(), is(true));
    assertThat(cursor.getState(), equalTo(CursorState.CLOSED));
    assertThat(cursor.getSetParameters().isEmpty(), is(true));
    assertThat(connection.getOpenCursorCount(), equalTo(0));
    expectError(ErrorCode.CURSOR_CLOSED, () -> cursor.execute("select 1"));
    expectError(ErrorCode.CURSOR_CLOSED, () -> cursor.fetchOne());
    expectError(ErrorCode.CURSOR_CLOSED, () -> cursor.getStatus("q"));
  }
}
