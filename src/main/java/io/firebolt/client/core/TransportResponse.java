package io.firebolt.client.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Status, headers and body of an HTTP response, read in full. */
public final class TransportResponse {
  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private final int statusCode;
  private final Map<String, String> headers;
  private final String body;

  public TransportResponse(int statusCode, Map<String, String> headers, String body) {
    this.statusCode = statusCode;
    TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      copy.putAll(headers);
    }
    this.headers = Collections.unmodifiableMap(copy);
    this.body = body == null ? "" : body;
  }

  public TransportResponse(int statusCode, String body) {
    this(statusCode, null, body);
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  /** @return response headers, looked up case-insensitively */
  public Map<String, String> getHeaders() {
    return headers;
  }

  public String getBody() {
    return body;
  }

  /**
   * @return the body parsed as JSON, a missing node for an empty body
   * @throws FireboltSQLException if the body is not valid JSON
   */
  public JsonNode json() throws FireboltSQLException {
    if (body.trim().isEmpty()) {
      return mapper.missingNode();
    }
    try {
      return mapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new FireboltSQLException(ex, ErrorCode.BAD_RESPONSE, ex.getOriginalMessage());
    }
  }

  @Override
  public String toString() {
    return "TransportResponse{statusCode=" + statusCode + ", body length=" + body.length() + '}';
  }
}
