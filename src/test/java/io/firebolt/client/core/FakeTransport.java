package io.firebolt.client.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory {@link Transport}. Requests are recorded and answered by the most recently registered
 * route that matches; unmatched requests get an empty 200 response.
 */
public class FakeTransport implements Transport {
  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  /** A recorded request. */
  public static final class Request {
    public final String method;
    public final String path;
    public final Map<String, String> params;
    public final String body;

    Request(String method, String path, Map<String, String> params, String body) {
      this.method = method;
      this.path = path;
      this.params =
          Collections.unmodifiableMap(
              params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params));
      this.body = body;
    }

    public boolean bodyContains(String text) {
      return body != null && body.toLowerCase().contains(text.toLowerCase());
    }

    @Override
    public String toString() {
      return method + " /" + path + " " + params + " " + body;
    }
  }

  private static final class Route {
    final Predicate<Request> matcher;
    final Function<Request, TransportResponse> responder;

    Route(Predicate<Request> matcher, Function<Request, TransportResponse> responder) {
      this.matcher = matcher;
      this.responder = responder;
    }
  }

  private final String baseUrl;
  private final String accountId;
  private final List<Request> requests = Collections.synchronizedList(new ArrayList<>());
  private final List<Route> routes = Collections.synchronizedList(new ArrayList<>());
  private volatile boolean closed;

  public FakeTransport(String baseUrl, String accountId) {
    this.baseUrl = baseUrl;
    this.accountId = accountId;
  }

  public FakeTransport() {
    this("https://engine.example.com", null);
  }

  public FakeTransport on(
      Predicate<Request> matcher, Function<Request, TransportResponse> responder) {
    routes.add(new Route(matcher, responder));
    return this;
  }

  public FakeTransport on(Predicate<Request> matcher, TransportResponse response) {
    return on(matcher, request -> response);
  }

  /** Answers queries whose body contains {@code sql}, case-insensitively. */
  public FakeTransport onSql(String sql, TransportResponse response) {
    return on(request -> request.path.isEmpty() && request.bodyContains(sql), response);
  }

  public FakeTransport onPath(String path, TransportResponse response) {
    return on(request -> request.path.equals(path), response);
  }

  @Override
  public TransportResponse request(
      String method, String path, Map<String, String> queryParams, String body) {
    Request request = new Request(method, path, queryParams, body);
    requests.add(request);
    Route matched = null;
    synchronized (routes) {
      for (int i = routes.size() - 1; i >= 0 && matched == null; i--) {
        if (routes.get(i).matcher.test(request)) {
          matched = routes.get(i);
        }
      }
    }
    // responders may block, so they run outside the lock
    return matched == null ? new TransportResponse(200, "") : matched.responder.apply(request);
  }

  public List<Request> getRequests() {
    synchronized (requests) {
      return new ArrayList<>(requests);
    }
  }

  public Request lastRequest() {
    synchronized (requests) {
      return requests.get(requests.size() - 1);
    }
  }

  @Override
  public String getAccountId() {
    return accountId;
  }

  @Override
  public String getBaseUrl() {
    return baseUrl;
  }

  @Override
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public static TransportResponse ok(String body) {
    return new TransportResponse(200, body);
  }

  public static TransportResponse status(int statusCode, String body) {
    return new TransportResponse(statusCode, body);
  }

  /**
   * Builds a JSON_Compact query response.
   *
   * @param columns alternating column names and type names
   * @param rows row values
   */
  public static TransportResponse result(String[] columns, Object[]... rows) {
    ObjectNode root = mapper.createObjectNode();
    ArrayNode meta = root.putArray("meta");
    for (int i = 0; i + 1 < columns.length; i += 2) {
      meta.addObject().put("name", columns[i]).put("type", columns[i + 1]);
    }
    ArrayNode data = root.putArray("data");
    for (Object[] row : rows) {
      data.add(mapper.valueToTree(row));
    }
    root.put("rows", rows.length);
    root.putObject("statistics").put("elapsed", 0.001).put("rows_read", rows.length);
    return ok(root.toString());
  }

  public static String[] columns(String... nameTypePairs) {
    return nameTypePairs;
  }
}
