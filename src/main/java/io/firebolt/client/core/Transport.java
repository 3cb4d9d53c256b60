package io.firebolt.client.core;

import io.firebolt.client.api.FireboltSQLException;
import java.io.Closeable;
import java.util.Map;

/**
 * HTTP access to one engine endpoint. Paths are relative to the endpoint URL, except paths starting
 * with {@code /web/} which address the account gateway.
 */
public interface Transport extends Closeable {
  String GET = "GET";
  String POST = "POST";

  /**
   * Sends one request and returns whatever status the server answered with; status codes are not
   * interpreted here.
   *
   * @param method HTTP method
   * @param path path relative to the endpoint, {@code ""} for the query root
   * @param queryParams URL query parameters, in order
   * @param body request body, may be null
   * @return the response
   * @throws FireboltSQLException if the request could not be sent or the response not read
   */
  TransportResponse request(
      String method, String path, Map<String, String> queryParams, String body)
      throws FireboltSQLException;

  /** @return account id injected into system engine requests, null if unknown */
  String getAccountId();

  /** @return base URL of the endpoint this transport talks to */
  String getBaseUrl();

  /** Releases pooled connections. */
  @Override
  void close();
}
