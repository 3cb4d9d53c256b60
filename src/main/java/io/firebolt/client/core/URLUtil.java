package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.http.client.utils.URIBuilder;

public class URLUtil {
  private URLUtil() {}

  /**
   * Adds {@code https://} to a host or URL given without scheme and drops a trailing slash.
   *
   * @param url host name or URL
   * @return URL with scheme
   */
  public static String fixUrl(String url) {
    String fixed = url.trim();
    if (!fixed.startsWith("http://") && !fixed.startsWith("https://")) {
      fixed = "https://" + fixed;
    }
    while (fixed.endsWith("/")) {
      fixed = fixed.substring(0, fixed.length() - 1);
    }
    return fixed;
  }

  /**
   * Builds a request URI.
   *
   * @param baseUrl endpoint URL, may already carry a path and query
   * @param path path to append, {@code ""} for the endpoint itself
   * @param queryParams query parameters added after the ones already in {@code baseUrl}
   * @return request URI
   * @throws FireboltSQLException if the resulting URI is malformed
   */
  public static URI buildUri(String baseUrl, String path, Map<String, String> queryParams)
      throws FireboltSQLException {
    try {
      URIBuilder builder = new URIBuilder(fixUrl(baseUrl));
      if (path != null && !path.isEmpty()) {
        String basePath = builder.getPath() == null ? "" : builder.getPath();
        String separator = basePath.endsWith("/") || path.startsWith("/") ? "" : "/";
        builder.setPath(basePath + separator + path);
      }
      if (queryParams != null) {
        for (Map.Entry<String, String> param : queryParams.entrySet()) {
          builder.addParameter(param.getKey(), param.getValue());
        }
      }
      return builder.build();
    } catch (URISyntaxException ex) {
      throw new FireboltSQLException(ex, ErrorCode.CONFIGURATION_ERROR, ex.getMessage());
    }
  }

  /**
   * Encodes one path segment, e.g. an account name.
   *
   * @param target text to encode
   * @return encoded text
   */
  public static String urlEncode(String target) {
    try {
      return URLEncoder.encode(target, StandardCharsets.UTF_8.toString()).replace("+", "%20");
    } catch (UnsupportedEncodingException uex) {
      // UTF-8 is always supported
      throw new IllegalStateException(uex);
    }
  }

  /**
   * @param url engine URL
   * @return host name of the URL, the input itself if it cannot be parsed
   */
  public static String getHost(String url) {
    try {
      String host = new URI(fixUrl(url)).getHost();
      return host == null ? url : host;
    } catch (URISyntaxException ex) {
      return url;
    }
  }
}
