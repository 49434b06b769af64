/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.util.Map;
import tracelog.internal.Nullable;

/** Lenient parsing of HTTP query parameters: empty means absent and bad numbers mean default. */
final class QueryParameters {
  static final int DEFAULT_LIMIT = 100;

  @Nullable static String string(Map<String, String> parameters, String name) {
    String value = parameters.get(name);
    if (value == null) return null;
    value = value.trim();
    return value.isEmpty() ? null : value;
  }

  static int integer(Map<String, String> parameters, String name, int defaultValue) {
    String value = string(parameters, name);
    if (value == null) return defaultValue;
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  @Nullable static Long longValue(Map<String, String> parameters, String name) {
    String value = string(parameters, name);
    if (value == null) return null;
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Nullable static Boolean bool(Map<String, String> parameters, String name) {
    String value = string(parameters, name);
    if ("true".equalsIgnoreCase(value)) return true;
    if ("false".equalsIgnoreCase(value)) return false;
    return null;
  }

  /** Non-positive limits fall back to the default. */
  static int limit(Map<String, String> parameters) {
    int limit = integer(parameters, "limit", DEFAULT_LIMIT);
    return limit > 0 ? limit : DEFAULT_LIMIT;
  }

  /** Negative offsets fall back to zero. */
  static int offset(Map<String, String> parameters) {
    return Math.max(0, integer(parameters, "offset", 0));
  }

  QueryParameters() {
  }
}
