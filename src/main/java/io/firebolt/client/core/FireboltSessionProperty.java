package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** connection properties accepted by {@link io.firebolt.client.api.FireboltConnector}. */
public enum FireboltSessionProperty {
  ACCOUNT_NAME("account_name", true, String.class, "account"),
  DATABASE("database", false, String.class, "db"),
  ENGINE_NAME("engine_name", false, String.class, "engine"),
  ENGINE_URL("engine_url", false, String.class),
  API_ENDPOINT("api_endpoint", false, String.class),
  ACCESS_TOKEN("access_token", true, String.class, "token"),
  // seconds
  CONNECT_TIMEOUT("connect_timeout", false, Integer.class),
  SOCKET_TIMEOUT("socket_timeout", false, Integer.class),
  USER_AGENT("user_agent", false, String.class);

  public static final String DEFAULT_API_ENDPOINT = "api.app.firebolt.io";

  // timeouts are handed to the http client in milliseconds as an int
  static final int MAX_TIMEOUT_SECONDS = Integer.MAX_VALUE / 1000;

  private static final FireboltLogger logger =
      FireboltLoggerFactory.getLogger(FireboltSessionProperty.class);

  // property key in string
  private final String propertyKey;

  // if required when establishing connection
  private final boolean required;

  // value type
  private final Class<?> valueType;

  // alias to property key
  private final String[] aliases;

  FireboltSessionProperty(
      String propertyKey, boolean required, Class<?> valueType, String... aliases) {
    this.propertyKey = propertyKey;
    this.required = required;
    this.valueType = valueType;
    this.aliases = aliases;
  }

  public boolean isRequired() {
    return required;
  }

  public String getPropertyKey() {
    return propertyKey;
  }

  public Class<?> getValueType() {
    return valueType;
  }

  static FireboltSessionProperty lookupByKey(String propertyKey) {
    for (FireboltSessionProperty property : FireboltSessionProperty.values()) {
      if (property.propertyKey.equalsIgnoreCase(propertyKey)) {
        return property;
      }
      for (String alias : property.aliases) {
        if (alias.equalsIgnoreCase(propertyKey)) {
          return property;
        }
      }
    }
    return null;
  }

  /**
   * Check if property value is desired class. Convert if possible
   *
   * @param property The session property to check
   * @param propertyValue The property value to check
   * @return The checked property value
   * @throws FireboltSQLException Will be thrown if an invalid property value is passed in
   */
  static Object checkPropertyValue(FireboltSessionProperty property, Object propertyValue)
      throws FireboltSQLException {
    if (propertyValue == null) {
      return null;
    }
    if (property.getValueType().isAssignableFrom(propertyValue.getClass())) {
      if (propertyValue instanceof Integer) {
        return checkIntegerRange(property, (Integer) propertyValue);
      }
      return propertyValue;
    }
    if (property.getValueType() == Integer.class
        && (propertyValue instanceof String || propertyValue instanceof Number)) {
      int value;
      try {
        value = Integer.parseInt(propertyValue.toString().trim());
      } catch (NumberFormatException e) {
        throw invalidValue(property, propertyValue);
      }
      return checkIntegerRange(property, value);
    }
    if (property.getValueType() == String.class) {
      return propertyValue.toString();
    }
    throw invalidValue(property, propertyValue);
  }

  private static Integer checkIntegerRange(FireboltSessionProperty property, int value)
      throws FireboltSQLException {
    boolean timeout = property == CONNECT_TIMEOUT || property == SOCKET_TIMEOUT;
    if (value < 0 || (timeout && value > MAX_TIMEOUT_SECONDS)) {
      throw invalidValue(property, value);
    }
    return value;
  }

  private static FireboltSQLException invalidValue(
      FireboltSessionProperty property, Object propertyValue) {
    return new FireboltSQLException(
        ErrorCode.CONFIGURATION_ERROR,
        "invalid value "
            + propertyValue
            + " for "
            + property.propertyKey
            + ", expected "
            + property.valueType.getSimpleName());
  }

  /**
   * Validates and converts raw connection properties. Keys are matched case-insensitively against
   * property keys and aliases; unknown keys are ignored.
   *
   * @param properties raw properties, e.g. a {@link java.util.Properties}
   * @return recognized properties with converted values
   * @throws FireboltSQLException if a value has the wrong type or a required property is missing
   */
  public static Map<FireboltSessionProperty, Object> parse(Map<?, ?> properties)
      throws FireboltSQLException {
    Map<FireboltSessionProperty, Object> result = new EnumMap<>(FireboltSessionProperty.class);
    if (properties != null) {
      for (Map.Entry<?, ?> entry : properties.entrySet()) {
        String key = String.valueOf(entry.getKey());
        FireboltSessionProperty property = lookupByKey(key);
        if (property == null) {
          logger.debug("Ignoring unknown connection property {}", key);
          continue;
        }
        Object value = checkPropertyValue(property, entry.getValue());
        if (value instanceof String && ((String) value).trim().isEmpty()) {
          continue;
        }
        result.put(property, value);
      }
    }
    for (FireboltSessionProperty property : values()) {
      if (property.required && !result.containsKey(property)) {
        throw new FireboltSQLException(
            ErrorCode.CONFIGURATION_ERROR, "missing required property " + property.propertyKey);
      }
    }
    if (result.containsKey(ENGINE_NAME) && result.containsKey(ENGINE_URL)) {
      throw new FireboltSQLException(
          ErrorCode.CONFIGURATION_ERROR,
          "Both engine_name and engine_url are provided. Provide only one to connect.");
    }
    return Collections.unmodifiableMap(result);
  }
}
