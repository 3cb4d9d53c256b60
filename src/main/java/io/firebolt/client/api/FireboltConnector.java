package io.firebolt.client.api;

import io.firebolt.client.core.EngineInfo;
import io.firebolt.client.core.EngineResolver;
import io.firebolt.client.core.FireboltSessionProperty;
import io.firebolt.client.core.HttpClientSettingsKey;
import io.firebolt.client.core.HttpTransport;
import io.firebolt.client.core.HttpUtil;
import io.firebolt.client.core.Transport;
import io.firebolt.client.core.auth.Auth;
import io.firebolt.client.core.auth.TokenAuth;
import io.firebolt.client.log.ArgSupplier;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import io.firebolt.client.util.SecretDetector;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.BiFunction;

/**
 * Opens connections.
 *
 * <p>The account gateway is asked for the account id and the system engine endpoint. Without
 * {@code engine_name} or {@code engine_url} the connection talks to the system engine. With {@code
 * engine_name} the engine is looked up in the system engine catalog; it must be running and, if a
 * database is given, attached to it. With {@code engine_url} the URL is used as is.
 */
public class FireboltConnector {
  private static final FireboltLogger logger =
      FireboltLoggerFactory.getLogger(FireboltConnector.class);

  static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 60;
  static final int DEFAULT_SOCKET_TIMEOUT_SECONDS = 0;

  private FireboltConnector() {}

  /**
   * @param properties connection properties, see {@link FireboltSessionProperty}
   * @return an open connection
   * @throws FireboltSQLException if the properties are invalid or a resolution step fails
   */
  public static FireboltConnection connect(Map<?, ?> properties) throws FireboltSQLException {
    Map<FireboltSessionProperty, Object> props = FireboltSessionProperty.parse(properties);
    logger.debug("Connecting with properties {}", (ArgSupplier) () -> describe(props));

    String accountName = (String) props.get(FireboltSessionProperty.ACCOUNT_NAME);
    String database = (String) props.get(FireboltSessionProperty.DATABASE);
    String engineName = (String) props.get(FireboltSessionProperty.ENGINE_NAME);
    String engineUrl = (String) props.get(FireboltSessionProperty.ENGINE_URL);
    String apiEndpoint =
        (String)
            props.getOrDefault(
                FireboltSessionProperty.API_ENDPOINT, FireboltSessionProperty.DEFAULT_API_ENDPOINT);
    Auth auth = new TokenAuth((String) props.get(FireboltSessionProperty.ACCESS_TOKEN));

    HttpClientSettingsKey key =
        new HttpClientSettingsKey(
            (Integer)
                props.getOrDefault(
                    FireboltSessionProperty.CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT_SECONDS),
            (Integer)
                props.getOrDefault(
                    FireboltSessionProperty.SOCKET_TIMEOUT, DEFAULT_SOCKET_TIMEOUT_SECONDS),
            (String) props.get(FireboltSessionProperty.USER_AGENT));
    HttpTransport gateway =
        new HttpTransport(HttpUtil.getHttpClient(key), null, apiEndpoint, auth, null);
    try {
      return connect(gateway, gateway::withBaseUrl, accountName, database, engineName, engineUrl);
    } finally {
      gateway.close();
    }
  }

  /**
   * @param gateway transport to the account gateway
   * @param engineTransports creates a transport from an engine URL and an account id
   */
  static FireboltConnection connect(
      Transport gateway,
      BiFunction<String, String, Transport> engineTransports,
      String accountName,
      String database,
      String engineName,
      String engineUrl)
      throws FireboltSQLException {
    String accountId = EngineResolver.resolveAccountId(gateway, accountName);
    String systemEngineUrl = EngineResolver.getSystemEngineUrl(gateway, accountName);
    logger.debug("System engine of account {} is at {}", accountName, systemEngineUrl);

    if (engineName == null && engineUrl == null) {
      return new FireboltConnection(
          engineTransports.apply(systemEngineUrl, accountId), database, null);
    }

    FireboltConnection systemEngine =
        new FireboltConnection(engineTransports.apply(systemEngineUrl, accountId), database, null);
    try {
      if (engineUrl != null) {
        return new FireboltConnection(
            engineTransports.apply(engineUrl, null), database, systemEngine);
      }
      EngineInfo engine = EngineResolver.resolveEngine(systemEngine.controlRunner(), engineName);
      if (!engine.isRunning()) {
        throw new FireboltSQLException(ErrorCode.ENGINE_NOT_RUNNING, engineName);
      }
      String engineDatabase = checkAttachedDatabase(engineName, database, engine.getDatabase());
      return new FireboltConnection(
          engineTransports.apply(engine.getUrl(), null), engineDatabase, systemEngine);
    } catch (FireboltSQLException | RuntimeException ex) {
      systemEngine.close();
      throw ex;
    }
  }

  private static String checkAttachedDatabase(
      String engineName, String database, String attachedDatabase) throws FireboltSQLException {
    if (attachedDatabase == null || attachedDatabase.isEmpty()) {
      throw new FireboltSQLException(
          ErrorCode.INTERFACE_ERROR,
          "Engine " + engineName + " is not attached to any database");
    }
    if (database == null) {
      return attachedDatabase;
    }
    if (!database.equals(attachedDatabase)) {
      throw new FireboltSQLException(
          ErrorCode.INTERFACE_ERROR,
          "Engine "
              + engineName
              + " is attached to "
              + attachedDatabase
              + " instead of "
              + database);
    }
    return database;
  }

  private static String describe(Map<FireboltSessionProperty, Object> props) {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    for (Map.Entry<FireboltSessionProperty, Object> entry : props.entrySet()) {
      String name = entry.getKey().getPropertyKey();
      joiner.add(
          name + "=" + SecretDetector.maskParameterValue(name, String.valueOf(entry.getValue())));
    }
    return joiner.toString();
  }
}
