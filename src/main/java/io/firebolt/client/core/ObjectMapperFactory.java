package io.firebolt.client.core;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory method used to create ObjectMapper instance. All object mappers in the driver should be
 * created by this method.
 */
public class ObjectMapperFactory {
  // query responses carry whole result sets in one body
  public static final int DEFAULT_MAX_JSON_STRING_LEN = 180_000_000;

  public static final String MAX_JSON_STRING_LENGTH_JVM =
      "io.firebolt.client.objectMapper.maxJsonStringLength";

  private ObjectMapperFactory() {}

  public static ObjectMapper getObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.configure(MapperFeature.OVERRIDE_PUBLIC_ACCESS_MODIFIERS, false);
    mapper.configure(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS, false);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    // keeps decimal digits exact until the column type is known
    mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    int maxJsonStringLength =
        SystemUtil.convertSystemPropertyToIntValue(
            MAX_JSON_STRING_LENGTH_JVM, DEFAULT_MAX_JSON_STRING_LEN);
    mapper
        .getFactory()
        .setStreamReadConstraints(
            StreamReadConstraints.builder().maxStringLength(maxJsonStringLength).build());
    return mapper;
  }
}
