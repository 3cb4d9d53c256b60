package io.firebolt.client.core.auth;

import io.firebolt.client.api.FireboltSQLException;

/** Supplies the bearer credential sent with every request. */
public interface Auth {
  /**
   * @return a token valid for the next request
   * @throws FireboltSQLException if no token can be obtained
   */
  String getToken() throws FireboltSQLException;

  /** Drops a cached token, e.g. after the server rejected it. */
  void invalidate();
}
