package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;

/** Status of a server side asynchronous query, as reported by the status endpoint. */
public enum QueryStatus {
  RUNNING("RUNNING"),
  ERROR("ERROR"),
  CANCELED("CANCELED"),
  NOT_READY("NOT_READY"),
  STARTED_EXECUTION("STARTED_EXECUTION"),
  PARSE_ERROR("PARSE_ERROR"),
  CANCELED_EXECUTION("CANCELED_EXECUTION"),
  EXECUTION_ERROR("EXECUTION_ERROR"),
  ENDED_SUCCESSFULLY("ENDED_SUCCESSFULLY"),
  ENDED_WITH_ERROR("ENDED_WITH_ERROR");

  private final String description;

  QueryStatus(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Maps the status text returned by the server. An empty status means the server has not
   * registered the query yet.
   *
   * @param description status text, may be null or empty
   * @return the matching status
   * @throws FireboltSQLException if the text is not a known status
   */
  public static QueryStatus getStatusFromString(String description) throws FireboltSQLException {
    if (description == null || description.isEmpty()) {
      return NOT_READY;
    }
    for (QueryStatus st : QueryStatus.values()) {
      if (st.description.equalsIgnoreCase(description)) {
        return st;
      }
    }
    throw new FireboltSQLException(
        ErrorCode.OPERATIONAL_ERROR, "Unknown query status: " + description);
  }

  /**
   * Check if query is still running.
   *
   * @param status QueryStatus
   * @return true if query is still running
   */
  public static boolean isStillRunning(QueryStatus status) {
    switch (status) {
      case RUNNING:
      case NOT_READY:
      case STARTED_EXECUTION:
        return true;
      default:
        return false;
    }
  }

  /**
   * Check if query has failed or been canceled.
   *
   * @param status QueryStatus
   * @return true if the query ended without success
   */
  public static boolean isAnError(QueryStatus status) {
    switch (status) {
      case ERROR:
      case CANCELED:
      case PARSE_ERROR:
      case CANCELED_EXECUTION:
      case EXECUTION_ERROR:
      case ENDED_WITH_ERROR:
        return true;
      default:
        return false;
    }
  }
}
