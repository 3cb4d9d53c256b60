package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import org.apache.http.HttpStatus;

/**
 * Turns failed query responses into driver errors. Ambiguous statuses are narrowed down with a
 * follow-up catalog query on the system engine; if that query fails too, it is logged and the
 * error derived from the original response is raised.
 */
public class ErrorClassifier {
  private static final FireboltLogger logger =
      FireboltLoggerFactory.getLogger(ErrorClassifier.class);

  private final String database;
  private final String engineUrl;
  private final boolean systemEngine;
  private final QueryRunner catalogRunner;

  /**
   * @param database database queries run against, may be null
   * @param engineUrl engine queries are sent to
   * @param systemEngine whether the engine is the system engine
   * @param catalogRunner runs catalog queries on the system engine, null to skip them
   */
  public ErrorClassifier(
      String database, String engineUrl, boolean systemEngine, QueryRunner catalogRunner) {
    this.database = database;
    this.engineUrl = engineUrl;
    this.systemEngine = systemEngine;
    this.catalogRunner = catalogRunner;
  }

  /**
   * @param response response to a query
   * @throws FireboltSQLException if the response is not a success
   */
  public void raiseIfError(TransportResponse response) throws FireboltSQLException {
    int status = response.getStatusCode();
    if (response.isSuccess()) {
      return;
    }
    if (status == HttpStatus.SC_INTERNAL_SERVER_ERROR) {
      throw new FireboltSQLException(
          ErrorCode.OPERATIONAL_ERROR, "Error executing query:\n" + response.getBody());
    }
    if (status == HttpStatus.SC_FORBIDDEN) {
      if (database != null && isDatabaseMissing()) {
        throw new FireboltSQLException(ErrorCode.DATABASE_NOT_FOUND, database);
      }
      throw new FireboltSQLException(ErrorCode.PROGRAMMING_ERROR, response.getBody());
    }
    if (status == HttpStatus.SC_SERVICE_UNAVAILABLE || status == HttpStatus.SC_NOT_FOUND) {
      if (isEngineStopped()) {
        throw new FireboltSQLException(ErrorCode.ENGINE_NOT_RUNNING, engineUrl);
      }
    }
    throw new FireboltSQLException(
        ErrorCode.HTTP_ERROR, String.valueOf(status), response.getBody());
  }

  /**
   * Classifies the response to the validation query of a SET statement. The server answers 400 if
   * it rejects the parameter.
   *
   * @param response response to the validation query
   * @param parameter parameter being validated
   * @throws FireboltSQLException INVALID_PARAMETER if the server rejected the parameter
   */
  public void raiseIfSetParameterError(
      TransportResponse response, Statement.SetParameter parameter) throws FireboltSQLException {
    if (response.getStatusCode() == HttpStatus.SC_BAD_REQUEST) {
      throw new FireboltSQLException(
          ErrorCode.INVALID_PARAMETER, parameter.getName(), response.getBody());
    }
    raiseIfError(response);
  }

  private boolean isDatabaseMissing() {
    if (catalogRunner == null) {
      return false;
    }
    try {
      return !EngineResolver.isDatabaseAvailable(catalogRunner, database);
    } catch (FireboltSQLException | RuntimeException ex) {
      logger.warn("Unable to check whether database {} exists: {}", database, ex.getMessage());
      return false;
    }
  }

  private boolean isEngineStopped() {
    if (catalogRunner == null) {
      return false;
    }
    try {
      return !EngineResolver.isEngineRunning(catalogRunner, engineUrl, systemEngine);
    } catch (FireboltSQLException | RuntimeException ex) {
      logger.warn("Unable to check whether engine {} is running: {}", engineUrl, ex.getMessage());
      return false;
    }
  }
}
