package io.firebolt.client.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import java.util.Collections;
import java.util.List;
import org.apache.http.HttpStatus;

/**
 * Maps account and engine names to live endpoints. Account lookups go through the account
 * gateway; engine and database lookups are catalog queries on the system engine.
 */
public class EngineResolver {
  private static final FireboltLogger logger =
      FireboltLoggerFactory.getLogger(EngineResolver.class);

  public static final String ENGINE_STATUS_RUNNING = "Running";

  static final String ACCOUNT_RESOLVE_PATH = "/web/v3/account/%s/resolve";
  static final String SYSTEM_ENGINE_URL_PATH = "/web/v3/account/%s/engineUrl";
  static final String DYNAMIC_QUERY = "/dynamic/query";

  static final String ENGINE_QUERY =
      "SELECT url, attached_to, status FROM information_schema.engines WHERE engine_name=?";
  static final String DATABASE_QUERY =
      "SELECT 1 FROM information_schema.databases WHERE database_name=?";

  private EngineResolver() {}

  /**
   * @param gateway transport able to reach the account gateway
   * @param accountName account name
   * @return account id
   * @throws FireboltSQLException ACCOUNT_NOT_FOUND if the gateway does not know the account
   */
  public static String resolveAccountId(Transport gateway, String accountName)
      throws FireboltSQLException {
    JsonNode json = gatewayLookup(gateway, ACCOUNT_RESOLVE_PATH, accountName, "account id");
    return requiredText(json, "id");
  }

  /**
   * @param gateway transport able to reach the account gateway
   * @param accountName account name
   * @return URL queries to the system engine are sent to
   * @throws FireboltSQLException ACCOUNT_NOT_FOUND if the gateway does not know the account
   */
  public static String getSystemEngineUrl(Transport gateway, String accountName)
      throws FireboltSQLException {
    JsonNode json =
        gatewayLookup(gateway, SYSTEM_ENGINE_URL_PATH, accountName, "system engine endpoint");
    return requiredText(json, "engineUrl") + DYNAMIC_QUERY;
  }

  private static JsonNode gatewayLookup(
      Transport gateway, String pathTemplate, String accountName, String what)
      throws FireboltSQLException {
    String path = String.format(pathTemplate, URLUtil.urlEncode(accountName));
    TransportResponse response =
        gateway.request(Transport.GET, path, Collections.emptyMap(), null);
    if (response.getStatusCode() == HttpStatus.SC_NOT_FOUND) {
      throw new FireboltSQLException(ErrorCode.ACCOUNT_NOT_FOUND, accountName);
    }
    if (response.getStatusCode() != HttpStatus.SC_OK) {
      throw new FireboltSQLException(
          ErrorCode.INTERFACE_ERROR,
          "Unable to retrieve "
              + what
              + " "
              + path
              + ": "
              + response.getStatusCode()
              + " "
              + response.getBody());
    }
    return response.json();
  }

  private static String requiredText(JsonNode json, String field) throws FireboltSQLException {
    JsonNode value = json.get(field);
    if (value == null || value.isNull() || value.asText().isEmpty()) {
      throw new FireboltSQLException(ErrorCode.BAD_RESPONSE, "missing " + field);
    }
    return value.asText();
  }

  /**
   * @param systemEngine runner on the system engine
   * @param engineName engine name
   * @return catalog entry of the engine
   * @throws FireboltSQLException ENGINE_NOT_FOUND if the catalog has no such engine
   */
  public static EngineInfo resolveEngine(QueryRunner systemEngine, String engineName)
      throws FireboltSQLException {
    List<List<Object>> rows =
        systemEngine.query(ENGINE_QUERY, Collections.singletonList(engineName));
    if (rows.isEmpty()) {
      throw new FireboltSQLException(ErrorCode.ENGINE_NOT_FOUND, engineName);
    }
    List<Object> row = rows.get(0);
    EngineInfo info = new EngineInfo(text(row, 0), text(row, 2), text(row, 1));
    logger.debug("Resolved engine {}: {}", engineName, info);
    return info;
  }

  private static String text(List<Object> row, int index) {
    Object value = index < row.size() ? row.get(index) : null;
    return value == null ? null : value.toString();
  }

  /**
   * Whether an engine accepts queries. The system engine always does; a user engine does if its
   * catalog status is exactly {@value #ENGINE_STATUS_RUNNING}.
   *
   * @param systemEngine runner on the system engine
   * @param engineUrl URL of the engine
   * @param isSystemEngine whether {@code engineUrl} is the system engine
   * @return true if the engine is running
   * @throws FireboltSQLException if the lookup fails
   */
  public static boolean isEngineRunning(
      QueryRunner systemEngine, String engineUrl, boolean isSystemEngine)
      throws FireboltSQLException {
    if (isSystemEngine) {
      return true;
    }
    return resolveEngine(systemEngine, engineNameFromUrl(engineUrl)).isRunning();
  }

  /**
   * @param systemEngine runner on the system engine
   * @param database database name
   * @return true if the catalog lists the database
   * @throws FireboltSQLException if the lookup fails
   */
  public static boolean isDatabaseAvailable(QueryRunner systemEngine, String database)
      throws FireboltSQLException {
    return !systemEngine.query(DATABASE_QUERY, Collections.singletonList(database)).isEmpty();
  }

  /**
   * Engine name encoded in an engine URL: the first label of the host, hyphens replaced by
   * underscores. {@code https://my-engine.account.region.app.firebolt.io} gives {@code my_engine}.
   *
   * @param engineUrl engine URL, with or without scheme
   * @return engine name
   */
  public static String engineNameFromUrl(String engineUrl) {
    String host = URLUtil.getHost(engineUrl);
    int dot = host.indexOf('.');
    String label = dot < 0 ? host : host.substring(0, dot);
    return label.replace('-', '_');
  }
}
