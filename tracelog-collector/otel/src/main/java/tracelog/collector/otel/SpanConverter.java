/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector.otel;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import tracelog.Span;

/** Converts finished OpenTelemetry spans into the stored model. */
final class SpanConverter {
  static final JsonFactory JSON_FACTORY = new JsonFactory();
  static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  static final String UNKNOWN_SERVICE = "unknown";

  static Span convert(SpanData data) {
    Span.Builder result = Span.newBuilder()
      .traceId(data.getSpanContext().getTraceId())
      .spanId(data.getSpanContext().getSpanId())
      .name(data.getName())
      .startTime(data.getStartEpochNanos())
      .endTime(data.getEndEpochNanos())
      .attributes(writeAttributes(data.getAttributes()))
      .serviceName(serviceName(data))
      .hasError(data.getStatus().getStatusCode() == StatusCode.ERROR);
    if (data.getParentSpanContext().isValid()) {
      result.parentSpanId(data.getParentSpanContext().getSpanId());
    }
    return result.build();
  }

  static String serviceName(SpanData data) {
    String serviceName = data.getResource().getAttribute(SERVICE_NAME);
    return serviceName != null && !serviceName.isEmpty() ? serviceName : UNKNOWN_SERVICE;
  }

  /** Writes attributes as a JSON object, keeping their types. Arrays become JSON arrays. */
  static String writeAttributes(Attributes attributes) {
    StringWriter writer = new StringWriter();
    try (JsonGenerator generator = JSON_FACTORY.createGenerator(writer)) {
      generator.writeStartObject();
      for (Map.Entry<AttributeKey<?>, Object> entry : attributes.asMap().entrySet()) {
        generator.writeFieldName(entry.getKey().getKey());
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } catch (IOException e) {
      throw new UncheckedIOException(e); // StringWriter doesn't throw
    }
    return writer.toString();
  }

  static void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value instanceof String) {
      generator.writeString((String) value);
    } else if (value instanceof Boolean) {
      generator.writeBoolean((Boolean) value);
    } else if (value instanceof Long) {
      generator.writeNumber((Long) value);
    } else if (value instanceof Double) {
      generator.writeNumber((Double) value);
    } else if (value instanceof List) {
      generator.writeStartArray();
      for (Object element : (List<?>) value) writeValue(generator, element);
      generator.writeEndArray();
    } else {
      generator.writeString(String.valueOf(value));
    }
  }

  SpanConverter() {
  }
}
