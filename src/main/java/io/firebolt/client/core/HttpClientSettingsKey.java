package io.firebolt.client.core;

import java.util.Locale;
import java.util.Objects;

/**
 * This class defines all non-static parameters needed to create an HttpClient object. It is used as
 * the key for the static map of reusable http clients.
 */
public class HttpClientSettingsKey {
  private final int connectTimeoutSeconds;
  private final int socketTimeoutSeconds;
  private final String userAgentSuffix;

  public HttpClientSettingsKey(
      int connectTimeoutSeconds, int socketTimeoutSeconds, String userAgentSuffix) {
    this.connectTimeoutSeconds = connectTimeoutSeconds;
    this.socketTimeoutSeconds = socketTimeoutSeconds;
    this.userAgentSuffix = userAgentSuffix == null ? "" : userAgentSuffix.trim();
  }

  public int getConnectTimeoutSeconds() {
    return connectTimeoutSeconds;
  }

  /** @return socket timeout in seconds, 0 for none */
  public int getSocketTimeoutSeconds() {
    return socketTimeoutSeconds;
  }

  public String getUserAgentSuffix() {
    return userAgentSuffix;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof HttpClientSettingsKey)) {
      return false;
    }
    HttpClientSettingsKey other = (HttpClientSettingsKey) obj;
    return connectTimeoutSeconds == other.connectTimeoutSeconds
        && socketTimeoutSeconds == other.socketTimeoutSeconds
        && userAgentSuffix.equalsIgnoreCase(other.userAgentSuffix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        connectTimeoutSeconds, socketTimeoutSeconds, userAgentSuffix.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return "HttpClientSettingsKey[connectTimeout="
        + connectTimeoutSeconds
        + "s, socketTimeout="
        + socketTimeoutSeconds
        + "s, userAgentSuffix="
        + userAgentSuffix
        + "]";
  }
}
