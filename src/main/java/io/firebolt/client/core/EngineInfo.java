package io.firebolt.client.core;

import java.util.Objects;

/** Catalog entry of an engine. */
public final class EngineInfo {
  private final String url;
  private final String status;
  private final String database;

  public EngineInfo(String url, String status, String database) {
    this.url = url;
    this.status = status;
    this.database = database;
  }

  public String getUrl() {
    return url;
  }

  /** @return status text as stored in the catalog, e.g. {@code Running} */
  public String getStatus() {
    return status;
  }

  /** @return database the engine is attached to, null if none */
  public String getDatabase() {
    return database;
  }

  public boolean isRunning() {
    return EngineResolver.ENGINE_STATUS_RUNNING.equals(status);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof EngineInfo)) {
      return false;
    }
    EngineInfo that = (EngineInfo) o;
    return Objects.equals(url, that.url)
        && Objects.equals(status, that.status)
        && Objects.equals(database, that.database);
  }

  @Override
  public int hashCode() {
    return Objects.hash(url, status, database);
  }

  @Override
  public String toString() {
    return "EngineInfo{url=" + url + ", status=" + status + ", database=" + database + '}';
  }
}
