package com.assistantmcp.backend.router;

import java.math.BigInteger;
import java.util.Map;

/**
 * Decoded arguments of the {@code assistant_context} tool.
 *
 * <p>{@code topK} is lenient: anything other than an integral number in {@code [0,
 * Integer.MAX_VALUE]} is treated as absent and left to the backend default.
 */
public record AssistantContextArguments(String assistantName, String query, Integer topK) {

  public static final String PARAM_ASSISTANT_NAME = "assistant_name";
  public static final String PARAM_QUERY = "query";
  public static final String PARAM_TOP_K = "top_k";

  private static final BigInteger MAX_TOP_K = BigInteger.valueOf(Integer.MAX_VALUE);

  public static AssistantContextArguments from(Map<String, Object> arguments) {
    Map<String, Object> source = arguments == null ? Map.of() : arguments;
    String assistantName = requireString(source, PARAM_ASSISTANT_NAME);
    String query = requireString(source, PARAM_QUERY);
    Integer topK = optionalTopK(source.get(PARAM_TOP_K));
    return new AssistantContextArguments(assistantName, query, topK);
  }

  private static String requireString(Map<String, Object> source, String field) {
    Object value = source.get(field);
    if (value instanceof String text) {
      return text;
    }
    throw RouterException.invalidParameters(field + " must be a string");
  }

  static Integer optionalTopK(Object value) {
    BigInteger integral;
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      integral = BigInteger.valueOf(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      integral = big;
    } else {
      // floats, strings, booleans and nested values
      return null;
    }
    if (integral.signum() < 0 || integral.compareTo(MAX_TOP_K) > 0) {
      return null;
    }
    return integral.intValue();
  }
}
