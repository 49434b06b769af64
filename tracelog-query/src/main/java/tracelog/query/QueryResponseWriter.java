/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import tracelog.LogRecord;
import tracelog.Span;
import tracelog.internal.Nullable;

/**
 * Renders query results as JSON with snake_case field names. Lists are wrapped as {@code
 * {"metadata":{"total":..,"limit":..,"offset":..},"data":[..]}}.
 *
 * <p>Stored attributes are nested as JSON objects. Attributes that are absent or don't parse as an
 * object are written as {@code {}}. Absent IDs are written as empty strings.
 */
public final class QueryResponseWriter {
  static final ObjectMapper MAPPER = new ObjectMapper();
  static final JsonFactory JSON_FACTORY = MAPPER.getFactory();

  public static QueryResponseWriter create() {
    return new QueryResponseWriter();
  }

  QueryResponseWriter() {
  }

  public byte[] writeTraces(QueryResult<TraceSummary> result) {
    if (result == null) throw new NullPointerException("result == null");
    return write(generator -> {
      writeMetadataStart(generator, result);
      for (TraceSummary trace : result.data()) {
        generator.writeStartObject();
        generator.writeStringField("trace_id", trace.traceId());
        generator.writeStringField("root_span_name", trace.rootSpanName());
        generator.writeNumberField("trace_start_time", trace.traceStartTime());
        generator.writeNumberField("duration_ms", trace.durationMs());
        generator.writeNumberField("span_count", trace.spanCount());
        generator.writeNumberField("error_count", trace.errorCount());
        generator.writeBooleanField("has_error", trace.hasError());
        generator.writeEndObject();
      }
      writeMetadataEnd(generator);
    });
  }

  public byte[] writeTrace(TraceDetail trace) {
    if (trace == null) throw new NullPointerException("trace == null");
    return write(generator -> {
      generator.writeStartObject();
      generator.writeStringField("trace_id", trace.traceId());
      generator.writeArrayFieldStart("spans");
      for (Span span : trace.spans()) {
        generator.writeStartObject();
        generator.writeStringField("span_id", span.spanId());
        generator.writeStringField("trace_id", span.traceId());
        generator.writeStringField("parent_span_id", orEmpty(span.parentSpanId()));
        generator.writeStringField("name", span.name());
        generator.writeNumberField("start_time", span.startTime());
        generator.writeNumberField("end_time", span.endTime());
        generator.writeNumberField("duration_ns", span.durationNs());
        writeAttributes(generator, span.attributes());
        generator.writeStringField("service_name", span.serviceName());
        generator.writeBooleanField("has_error", span.hasError());
        generator.writeEndObject();
      }
      generator.writeEndArray();
      generator.writeEndObject();
    });
  }

  public byte[] writeLogs(QueryResult<LogRecord> result) {
    if (result == null) throw new NullPointerException("result == null");
    return write(generator -> {
      writeMetadataStart(generator, result);
      for (LogRecord record : result.data()) {
        generator.writeStartObject();
        generator.writeNumberField("id", record.id());
        generator.writeNumberField("timestamp", record.timestamp());
        generator.writeStringField("level", record.level());
        generator.writeStringField("message", record.message());
        generator.writeStringField("trace_id", orEmpty(record.traceId()));
        generator.writeStringField("span_id", orEmpty(record.spanId()));
        writeAttributes(generator, record.attributes());
        generator.writeEndObject();
      }
      writeMetadataEnd(generator);
    });
  }

  interface Body {
    void write(JsonGenerator generator) throws IOException;
  }

  static byte[] write(Body body) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator generator = JSON_FACTORY.createGenerator(out)) {
      body.write(generator);
    } catch (IOException e) {
      throw new UncheckedIOException(e); // in-memory output doesn't throw
    }
    return out.toByteArray();
  }

  static void writeMetadataStart(JsonGenerator generator, QueryResult<?> result)
    throws IOException {
    generator.writeStartObject();
    generator.writeObjectFieldStart("metadata");
    generator.writeNumberField("total", result.total());
    generator.writeNumberField("limit", result.limit());
    generator.writeNumberField("offset", result.offset());
    generator.writeEndObject();
    generator.writeArrayFieldStart("data");
  }

  static void writeMetadataEnd(JsonGenerator generator) throws IOException {
    generator.writeEndArray();
    generator.writeEndObject();
  }

  static void writeAttributes(JsonGenerator generator, @Nullable String attributes)
    throws IOException {
    generator.writeFieldName("attributes");
    JsonNode node = parseObject(attributes);
    if (node == null) {
      generator.writeStartObject();
      generator.writeEndObject();
    } else {
      MAPPER.writeTree(generator, node);
    }
  }

  @Nullable static JsonNode parseObject(@Nullable String json) {
    if (json == null || json.isEmpty()) return null;
    try {
      JsonNode node = MAPPER.readTree(json);
      return node != null && node.isObject() ? node : null;
    } catch (IOException e) {
      return null;
    }
  }

  static String orEmpty(@Nullable String value) {
    return value != null ? value : "";
  }

  @Override public String toString() {
    return "QueryResponseWriter{}";
  }
}
