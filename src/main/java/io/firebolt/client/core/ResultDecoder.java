package io.firebolt.client.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes the JSON_Compact response envelope:
 *
 * <pre>
 * {"meta": [{"name": "a", "type": "int"}], "data": [[1]], "rows": 1, "statistics": {...}}
 * </pre>
 *
 * A body without {@code meta} belongs to a statement that produced no result table.
 */
public class ResultDecoder {
  private static final FireboltLogger logger = FireboltLoggerFactory.getLogger(ResultDecoder.class);

  public static final String TIME_ZONE_PARAMETER = "time_zone";

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private ResultDecoder() {}

  /**
   * @param body response body, may be empty
   * @param sessionParameters session set-parameters in effect for the statement
   * @return decoded row set; {@link RowSet#empty()} for statements without result table
   * @throws FireboltSQLException if the body is not a JSON object
   */
  public static RowSet decode(String body, Map<String, String> sessionParameters)
      throws FireboltSQLException {
    if (body == null || body.trim().isEmpty()) {
      return RowSet.empty();
    }
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new FireboltSQLException(ex, ErrorCode.BAD_RESPONSE, ex.getOriginalMessage());
    }
    return decode(root, sessionParameters);
  }

  public static RowSet decode(JsonNode root, Map<String, String> sessionParameters)
      throws FireboltSQLException {
    if (root == null || root.isMissingNode() || root.isNull()) {
      return RowSet.empty();
    }
    if (!root.isObject()) {
      throw new FireboltSQLException(ErrorCode.BAD_RESPONSE, "expected a JSON object");
    }
    JsonNode meta = root.get("meta");
    if (meta == null || meta.isNull()) {
      return RowSet.empty();
    }
    if (!meta.isArray()) {
      throw new FireboltSQLException(ErrorCode.BAD_RESPONSE, "meta is not an array");
    }

    JsonNode data = root.get("data");
    if (data != null && !data.isNull() && !data.isArray()) {
      throw new FireboltSQLException(ErrorCode.BAD_RESPONSE, "data is not an array");
    }
    int dataSize = data == null || data.isNull() ? 0 : data.size();
    JsonNode rowsNode = root.get("rows");
    int rowCount = rowsNode != null && rowsNode.canConvertToInt() ? rowsNode.intValue() : dataSize;
    Statistics statistics = parseStatistics(root.get("statistics"));

    if (meta.size() == 0) {
      return new RowSet(rowCount, null, statistics, null, null);
    }

    List<Column> columns = new ArrayList<>(meta.size());
    for (JsonNode field : meta) {
      ColumnType type = ColumnType.of(field.path("type").asText());
      columns.add(new Column(field.path("name").asText(), type));
    }
    JsonNode rows = dataSize == 0 ? mapper.createArrayNode() : data;
    logger.debug("Decoded result metadata: {} columns, {} rows", columns.size(), rowCount);
    return new RowSet(rowCount, columns, statistics, rows, sessionZone(sessionParameters));
  }

  private static Statistics parseStatistics(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    try {
      return mapper.treeToValue(node, Statistics.class);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      logger.debug("Ignoring statistics that could not be read: {}", ex.getMessage());
      return null;
    }
  }

  static ZoneId sessionZone(Map<String, String> sessionParameters) {
    String timeZone =
        sessionParameters == null ? null : sessionParameters.get(TIME_ZONE_PARAMETER);
    if (timeZone == null || timeZone.isEmpty()) {
      return null;
    }
    try {
      return ZoneId.of(timeZone);
    } catch (DateTimeException ex) {
      logger.warn("Unknown session time zone {}, timestamptz values default to UTC", timeZone);
      return null;
    }
  }
}
