/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import tracelog.LogRecord;

/**
 * Normalizes one JSON log event, as written by structured logging libraries, into a {@link
 * LogRecord}. Well-known fields are lifted out. Every other top-level field is kept, re-encoded
 * as the record's attributes.
 */
final class LogRecordParser {
  /** One event per payload: anything after the object makes the payload malformed. */
  static final ObjectMapper MAPPER =
    new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  static final String TIME = "time", TIMESTAMP = "timestamp", LEVEL = "level",
    MESSAGE = "message", TRACE_ID = "trace_id", SPAN_ID = "span_id";

  final Clock clock;

  LogRecordParser(Clock clock) {
    if (clock == null) throw new NullPointerException("clock == null");
    this.clock = clock;
  }

  /**
   * @throws IllegalArgumentException if the payload isn't a JSON object
   */
  LogRecord parse(byte[] payload) {
    JsonNode node;
    try {
      node = MAPPER.readTree(payload);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed reading log record from json", e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Expected a json object, not " + describe(node));
    }

    LogRecord.Builder result = LogRecord.newBuilder().timestamp(timestamp(node));
    String level = text(node, LEVEL);
    if (level != null) result.level(level);
    String message = text(node, MESSAGE);
    if (message != null) result.message(message);
    result.traceId(text(node, TRACE_ID));
    result.spanId(text(node, SPAN_ID));

    ObjectNode attributes = MAPPER.createObjectNode();
    for (Iterator<Map.Entry<String, JsonNode>> i = node.fields(); i.hasNext(); ) {
      Map.Entry<String, JsonNode> field = i.next();
      if (isWellKnown(field.getKey())) continue;
      attributes.set(field.getKey(), field.getValue());
    }
    if (!attributes.isEmpty()) {
      try {
        result.attributes(MAPPER.writeValueAsString(attributes));
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Could not encode attributes", e); // unexpected
      }
    }
    return result.build();
  }

  /** Epoch nanos of the first textual "time" or "timestamp" field, falling back to now. */
  long timestamp(JsonNode node) {
    String value = text(node, TIME);
    if (value == null) value = text(node, TIMESTAMP);
    if (value != null) {
      try {
        return epochNanos(OffsetDateTime.parse(value).toInstant());
      } catch (DateTimeParseException e) {
        // fall through to now
      }
    }
    return epochNanos(clock.instant());
  }

  static long epochNanos(Instant instant) {
    return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
  }

  static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.textValue() : null;
  }

  static boolean isWellKnown(String field) {
    switch (field) {
      case TIME:
      case TIMESTAMP:
      case LEVEL:
      case MESSAGE:
      case TRACE_ID:
      case SPAN_ID:
        return true;
      default:
        return false;
    }
  }

  static String describe(JsonNode node) {
    return node == null || node.isMissingNode() ? "empty input" : node.getNodeType().toString();
  }
}
