package io.firebolt.client.core;

import io.firebolt.client.api.FireboltSQLException;
import java.util.List;

/** Runs one control-plane statement, e.g. a catalog lookup on the system engine. */
@FunctionalInterface
public interface QueryRunner {
  /**
   * @param sql statement with {@code ?} placeholders
   * @param parameters values for the placeholders
   * @return decoded rows, empty if the statement produced none
   * @throws FireboltSQLException if the statement fails
   */
  List<List<Object>> query(String sql, List<?> parameters) throws FireboltSQLException;
}
