package io.firebolt.client.core.auth;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;

/** A fixed access token obtained outside of the driver. */
public class TokenAuth implements Auth {
  private final String token;

  public TokenAuth(String token) throws FireboltSQLException {
    if (token == null || token.trim().isEmpty()) {
      throw new FireboltSQLException(ErrorCode.CONFIGURATION_ERROR, "access token is empty");
    }
    this.token = token.trim();
  }

  @Override
  public String getToken() {
    return token;
  }

  // a static token cannot be refreshed
  @Override
  public void invalidate() {}

  @Override
  public String toString() {
    return "TokenAuth{token=****}";
  }
}
