package io.firebolt.client.api;

import static io.firebolt.client.core.FakeTransport.columns;
import static io.firebolt.client.core.FakeTransport.result;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anyOf;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

import io.firebolt.client.core.FakeTransport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class FireboltCursorConcurrencyTest {
  private static final int ROWS = 2000;
  private static final int THREADS = 8;

  private FakeTransport transport;
  private FireboltConnection connection;
  private ExecutorService executor;

  @BeforeEach
  public void setUp() {
    Object[][] rows = new Object[ROWS][];
    for (int i = 0; i < ROWS; i++) {
      rows[i] = new Object[] {i};
    }
    transport = new FakeTransport().onSql("from big", result(columns("id", "int"), rows));
    connection = new FireboltConnection(transport, null, null);
    executor = Executors.newFixedThreadPool(THREADS);
  }

  @AfterEach
  public void tearDown() throws Exception {
    executor.shutdownNow();
    executor.awaitTermination(10, TimeUnit.SECONDS);
    connection.close();
  }

  @Test
  public void testConcurrentFetchesReturnEachRowOnce() throws Exception {
    FireboltCursor cursor = connection.cursor();
    cursor.execute("select id from big");

    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<Integer>>> futures = new ArrayList<>();
    for (int t = 0; t < THREADS; t++) {
      final int batch = t + 1;
      Callable<List<Integer>> fetcher =
          () -> {
            start.await();
            List<Integer> seen = new ArrayList<>();
            while (true) {
              List<List<Object>> rows = batch == 1 ? single(cursor) : cursor.fetchMany(batch);
              if (rows.isEmpty()) {
                return seen;
              }
              for (List<Object> row : rows) {
                seen.add((Integer) row.get(0));
              }
            }
          };
      futures.add(executor.submit(fetcher));
    }
    start.countDown();

    List<Integer> all = new ArrayList<>();
    for (Future<List<Integer>> future : futures) {
      List<Integer> seen = future.get(30, TimeUnit.SECONDS);
      for (int i = 1; i < seen.size(); i++) {
        assertThat(seen.get(i), greaterThan(seen.get(i - 1)));
      }
      all.addAll(seen);
    }
    Set<Integer> distinct = new HashSet<>(all);
    assertThat(all.size(), equalTo(ROWS));
    assertThat(distinct.size(), equalTo(ROWS));
    assertThat(cursor.fetchOne() == null, is(true));
  }

  @Test
  public void testExecuteExcludesOtherExecutesAndFetches() throws Exception {
    CountDownLatch slowQueryEntered = new CountDownLatch(1);
    CountDownLatch releaseSlowQuery = new CountDownLatch(1);
    transport.on(
        request -> request.bodyContains("from slow"),
        request -> {
          slowQueryEntered.countDown();
          try {
            releaseSlowQuery.await(30, TimeUnit.SECONDS);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
          return result(columns("name", "text"), new Object[] {"slow"});
        });
    FireboltCursor cursor = connection.cursor();

    Future<ExecuteResult> slow = executor.submit(() -> cursor.execute("select name from slow"));
    assertThat(slowQueryEntered.await(10, TimeUnit.SECONDS), is(true));

    Future<ExecuteResult> second = executor.submit(() -> cursor.execute("select id from big"));
    Future<List<List<Object>>> fetch = executor.submit(cursor::fetchAll);

    await()
        .during(Duration.ofMillis(300))
        .atMost(Duration.ofSeconds(5))
        .until(
            () ->
                !second.isDone()
                    && !fetch.isDone()
                    && transport.getRequests().stream().noneMatch(r -> r.bodyContains("from big")));

    releaseSlowQuery.countDown();
    assertThat(slow.get(10, TimeUnit.SECONDS).getRowCount(), equalTo(1));
    assertThat(second.get(10, TimeUnit.SECONDS).getRowCount(), equalTo(ROWS));

    // the fetch ran after one of the two executes, never in between
    List<List<Object>> fetched = fetch.get(10, TimeUnit.SECONDS);
    assertThat(fetched.size(), anyOf(equalTo(1), equalTo(ROWS)));
    if (fetched.size() == 1) {
      assertThat(fetched.get(0).get(0), equalTo("slow"));
    }
    assertThat(
        transport.getRequests().stream().filter(r -> r.bodyContains("from big")).count(),
        equalTo(1L));
  }

  private static List<List<Object>> single(FireboltCursor cursor) throws FireboltSQLException {
    List<Object> row = cursor.fetchOne();
    return row == null ? Collections.<List<Object>>emptyList() : Collections.singletonList(row);
  }
}
