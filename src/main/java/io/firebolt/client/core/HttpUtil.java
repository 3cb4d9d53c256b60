package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;

public class HttpUtil {
  private static final FireboltLogger logger = FireboltLoggerFactory.getLogger(HttpUtil.class);

  static final int DEFAULT_MAX_CONNECTIONS = 300;
  static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 300;
  static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 60;
  // queries may run for a long time, so reads do not time out unless configured
  static final int DEFAULT_SOCKET_TIMEOUT_SECONDS = 0;
  static final int DEFAULT_TTL = 60;

  public static final String MAX_CONNECTIONS_PROPERTY = "io.firebolt.client.max_connections";
  public static final String MAX_CONNECTIONS_PER_ROUTE_PROPERTY =
      "io.firebolt.client.max_connections_per_route";
  public static final String TTL_PROPERTY = "io.firebolt.client.ttl";

  static final String CLIENT_NAME = "FireboltJavaClient";

  /** The unique httpClient shared by all connections with the same settings. */
  private static final Map<HttpClientSettingsKey, CloseableHttpClient> httpClients =
      new ConcurrentHashMap<>();

  private HttpUtil() {}

  /**
   * Accessor for the HTTP client singleton.
   *
   * @param key client settings
   * @return HttpClient object shared across all connections with the same settings
   */
  public static CloseableHttpClient getHttpClient(HttpClientSettingsKey key) {
    return httpClients.computeIfAbsent(key, HttpUtil::buildHttpClient);
  }

  /**
   * Build an Http client using our set of default.
   *
   * @param key client settings
   * @return HttpClient object
   */
  public static CloseableHttpClient buildHttpClient(HttpClientSettingsKey key) {
    logger.debug("Building http client with client settings key: {}", key);
    int timeToLive = SystemUtil.convertSystemPropertyToIntValue(TTL_PROPERTY, DEFAULT_TTL);
    int connectTimeout = toMillis(key.getConnectTimeoutSeconds());
    int socketTimeout = toMillis(key.getSocketTimeoutSeconds());
    logger.debug(
        "Connection pooling manager connect timeout: {} ms, socket timeout: {} ms, ttl: {} s",
        connectTimeout,
        socketTimeout,
        timeToLive);

    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(connectTimeout)
            .setConnectionRequestTimeout(connectTimeout)
            .setSocketTimeout(socketTimeout)
            .build();

    PoolingHttpClientConnectionManager connectionManager =
        new PoolingHttpClientConnectionManager(timeToLive, TimeUnit.SECONDS);
    int maxConnections =
        SystemUtil.convertSystemPropertyToIntValue(
            MAX_CONNECTIONS_PROPERTY, DEFAULT_MAX_CONNECTIONS);
    int maxConnectionsPerRoute =
        SystemUtil.convertSystemPropertyToIntValue(
            MAX_CONNECTIONS_PER_ROUTE_PROPERTY, DEFAULT_MAX_CONNECTIONS_PER_ROUTE);
    logger.debug(
        "Max connections total in connection pooling manager: {}; max connections per route: {}",
        maxConnections,
        maxConnectionsPerRoute);
    connectionManager.setMaxTotal(maxConnections);
    connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);

    return HttpClientBuilder.create()
        .setConnectionManager(connectionManager)
        // Support JVM proxy settings
        .useSystemProperties()
        .setUserAgent(buildUserAgent(key.getUserAgentSuffix()))
        .disableCookieManagement()
        .setDefaultRequestConfig(requestConfig)
        .build();
  }

  /** Converts a timeout to milliseconds, saturating at {@link Integer#MAX_VALUE}. */
  static int toMillis(int seconds) {
    return (int) Math.min(TimeUnit.SECONDS.toMillis(seconds), Integer.MAX_VALUE);
  }

  static String buildUserAgent(String customSuffix) {
    StringBuilder builder = new StringBuilder(CLIENT_NAME).append('/');
    builder.append(getImplementationVersion());
    builder.append(" (");
    String osPlatform = SystemUtil.systemGetProperty("os.name");
    String osVersion = SystemUtil.systemGetProperty("os.version");
    builder.append(osPlatform == null ? "" : osPlatform);
    builder.append(' ');
    builder.append(osVersion == null ? "" : osVersion);
    builder.append(") JAVA/");
    String languageVersion = SystemUtil.systemGetProperty("java.version");
    builder.append(languageVersion == null ? "" : languageVersion);
    if (customSuffix != null && !customSuffix.isEmpty()) {
      builder.append(' ').append(customSuffix);
    }
    return builder.toString();
  }

  static String getImplementationVersion() {
    String version = HttpUtil.class.getPackage().getImplementationVersion();
    return version == null ? "dev" : version;
  }

  /**
   * Executes a request and reads the whole response. The connection goes back to the pool once the
   * body has been consumed.
   *
   * @param httpClient client to use
   * @param httpRequest request to execute
   * @return status, headers and body
   * @throws FireboltSQLException if an I/O error occurs
   */
  static TransportResponse executeRequest(
      CloseableHttpClient httpClient, HttpRequestBase httpRequest) throws FireboltSQLException {
    long start = System.currentTimeMillis();
    try (CloseableHttpResponse response = httpClient.execute(httpRequest)) {
      Map<String, String> headers = new LinkedHashMap<>();
      for (Header header : response.getAllHeaders()) {
        headers.put(header.getName(), header.getValue());
      }
      HttpEntity entity = response.getEntity();
      String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
      int statusCode = response.getStatusLine().getStatusCode();
      logger.debug(
          "{} {} returned {} in {} ms",
          httpRequest.getMethod(),
          httpRequest.getURI().getPath(),
          statusCode,
          System.currentTimeMillis() - start);
      return new TransportResponse(statusCode, headers, body);
    } catch (IOException ex) {
      logger.debug("Request {} failed: {}", httpRequest.getURI().getPath(), ex.getMessage());
      throw new FireboltSQLException(ex, ErrorCode.NETWORK_ERROR, ex.getMessage());
    } finally {
      httpRequest.releaseConnection();
    }
  }
}
