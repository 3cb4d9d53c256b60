package io.firebolt.client.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class FireboltSessionPropertyTest {

  private static Map<String, Object> required() {
    Map<String, Object> properties = new HashMap<>();
    properties.put("account_name", "dev");
    properties.put("access_token", "secret-token");
    return properties;
  }

  @Test
  public void testLookupByKeyAndAlias() {
    assertThat(
        FireboltSessionProperty.lookupByKey("ACCOUNT_NAME"),
        equalTo(FireboltSessionProperty.ACCOUNT_NAME));
    assertThat(
        FireboltSessionProperty.lookupByKey("db"), equalTo(FireboltSessionProperty.DATABASE));
    assertThat(
        FireboltSessionProperty.lookupByKey("engine"),
        equalTo(FireboltSessionProperty.ENGINE_NAME));
    assertThat(FireboltSessionProperty.lookupByKey("warehouse"), is(nullValue()));
  }

  @Test
  public void testParseConvertsValues() throws Exception {
    Properties properties = new Properties();
    properties.putAll(required());
    properties.put("database", "db1");
    properties.put("socket_timeout", "30");
    properties.put("unknown", "ignored");
    properties.put("engine_name", "  ");

    Map<FireboltSessionProperty, Object> parsed = FireboltSessionProperty.parse(properties);
    assertThat(parsed.get(FireboltSessionProperty.DATABASE), equalTo("db1"));
    assertThat(parsed.get(FireboltSessionProperty.SOCKET_TIMEOUT), equalTo(30));
    assertThat(parsed, not(hasKey(FireboltSessionProperty.ENGINE_NAME)));
    assertThrows(
        UnsupportedOperationException.class,
        () -> parsed.put(FireboltSessionProperty.USER_AGENT, "x"));
  }

  @Test
  public void testMissingRequiredProperty() {
    Map<String, Object> properties = required();
    properties.remove("access_token");
    FireboltSQLException ex =
        assertThrows(FireboltSQLException.class, () -> FireboltSessionProperty.parse(properties));
    assertThat(ex.getDriverErrorCode(), equalTo(ErrorCode.CONFIGURATION_ERROR));
    assertThat(ex.getMessage(), containsString("access_token"));
  }

  @Test
  public void testInvalidNumericValue() {
    for (Object value : new Object[] {"abc", "-1", -5}) {
      Map<String, Object> properties = required();
      properties.put("connect_timeout", value);
      FireboltSQLException ex =
          assertThrows(
              FireboltSQLException.class, () -> FireboltSessionProperty.parse(properties));
      assertThat(ex.getDriverErrorCode(), equalTo(ErrorCode.CONFIGURATION_ERROR));
    }
  }

  @Test
  public void testTimeoutMustFitInMilliseconds() throws Exception {
    for (String key : new String[] {"connect_timeout", "socket_timeout"}) {
      for (Object value : new Object[] {"2147484", 3_000_000, Integer.MAX_VALUE}) {
        Map<String, Object> properties = required();
        properties.put(key, value);
        FireboltSQLException ex =
            assertThrows(
                FireboltSQLException.class, () -> FireboltSessionProperty.parse(properties));
        assertThat(ex.getDriverErrorCode(), equalTo(ErrorCode.CONFIGURATION_ERROR));
      }
      Map<String, Object> properties = required();
      properties.put(key, "2147483");
      assertThat(
          FireboltSessionProperty.parse(properties)
              .get(FireboltSessionProperty.lookupByKey(key)),
          equalTo(FireboltSessionProperty.MAX_TIMEOUT_SECONDS));
    }
  }

  @Test
  public void testEngineNameAndUrlAreExclusive() {
    Map<String, Object> properties = required();
    properties.put("engine_name", "e1");
    properties.put("engine_url", "e1.example.com");
    FireboltSQLException ex =
        assertThrows(FireboltSQLException.class, () -> FireboltSessionProperty.parse(properties));
    assertThat(ex.getDriverErrorCode(), equalTo(ErrorCode.CONFIGURATION_ERROR));
  }
}
