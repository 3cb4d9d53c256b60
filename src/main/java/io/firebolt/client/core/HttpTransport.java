package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import io.firebolt.client.core.auth.Auth;
import io.firebolt.client.log.ArgSupplier;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import io.firebolt.client.util.SecretDetector;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;

/** {@link Transport} over a pooled Apache HttpClient with bearer token authentication. */
public class HttpTransport implements Transport {
  private static final FireboltLogger logger = FireboltLoggerFactory.getLogger(HttpTransport.class);

  static final String GATEWAY_PATH_PREFIX = "/web/";

  private final CloseableHttpClient httpClient;
  private final String baseUrl;
  private final String apiEndpoint;
  private final Auth auth;
  private final String accountId;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param httpClient shared client, see {@link HttpUtil#getHttpClient(HttpClientSettingsKey)}
   * @param baseUrl engine URL requests are sent to, may be null for a gateway-only transport
   * @param apiEndpoint account gateway host or URL
   * @param auth token supplier
   * @param accountId account id for system engine requests, may be null
   */
  public HttpTransport(
      CloseableHttpClient httpClient,
      String baseUrl,
      String apiEndpoint,
      Auth auth,
      String accountId) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl == null ? null : URLUtil.fixUrl(baseUrl);
    this.apiEndpoint = URLUtil.fixUrl(apiEndpoint);
    this.auth = auth;
    this.accountId = accountId;
  }

  /**
   * @param engineUrl engine URL of the new transport
   * @param accountId account id of the new transport, may be null
   * @return a transport to another engine sharing the HTTP client and credentials
   */
  public HttpTransport withBaseUrl(String engineUrl, String accountId) {
    return new HttpTransport(httpClient, engineUrl, apiEndpoint, auth, accountId);
  }

  @Override
  public TransportResponse request(
      String method, String path, Map<String, String> queryParams, String body)
      throws FireboltSQLException {
    if (closed.get()) {
      throw new FireboltSQLException(ErrorCode.CONNECTION_CLOSED, "transport");
    }
    URI uri = URLUtil.buildUri(resolveBase(path), path, queryParams);
    HttpRequestBase request = newRequest(method, uri, body);
    request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + auth.getToken());
    request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
    logger.debug(
        "Sending {} {}{} with parameters {}",
        method,
        uri.getHost(),
        uri.getPath(),
        (ArgSupplier) () -> maskedParameters(queryParams));

    TransportResponse response = HttpUtil.executeRequest(httpClient, request);
    if (response.getStatusCode() == HttpStatus.SC_UNAUTHORIZED) {
      auth.invalidate();
    }
    return response;
  }

  private static String maskedParameters(Map<String, String> queryParams) {
    if (queryParams == null) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> param : queryParams.entrySet()) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(param.getKey())
          .append('=')
          .append(SecretDetector.maskParameterValue(param.getKey(), param.getValue()));
    }
    return sb.append('}').toString();
  }

  private String resolveBase(String path) throws FireboltSQLException {
    if (path != null && path.startsWith(GATEWAY_PATH_PREFIX)) {
      return apiEndpoint;
    }
    if (baseUrl == null) {
      throw new FireboltSQLException(
          ErrorCode.INTERFACE_ERROR, "no engine URL configured for request to " + path);
    }
    return baseUrl;
  }

  private static HttpRequestBase newRequest(String method, URI uri, String body)
      throws FireboltSQLException {
    if (GET.equalsIgnoreCase(method)) {
      return new HttpGet(uri);
    }
    if (POST.equalsIgnoreCase(method)) {
      HttpPost post = new HttpPost(uri);
      if (body != null) {
        post.setEntity(
            new StringEntity(body, ContentType.create("text/plain", StandardCharsets.UTF_8)));
      }
      return post;
    }
    throw new FireboltSQLException(ErrorCode.INTERNAL_ERROR, "unsupported method " + method);
  }

  @Override
  public String getAccountId() {
    return accountId;
  }

  @Override
  public String getBaseUrl() {
    return baseUrl;
  }

  /** The pooled HTTP client is shared and stays open for other transports. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      logger.debug("Closed transport to {}", baseUrl);
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public String toString() {
    return "HttpTransport{baseUrl=" + baseUrl + ", apiEndpoint=" + apiEndpoint + '}';
  }
}
