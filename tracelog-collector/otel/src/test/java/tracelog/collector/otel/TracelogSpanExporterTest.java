/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector.otel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.valfirst.slf4jtest.TestLoggerFactoryExtension;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.testing.trace.TestSpanData;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.data.StatusData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import tracelog.Span;
import tracelog.collector.SpanCollector;
import tracelog.storage.InMemoryStorage;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(TestLoggerFactoryExtension.class)
class TracelogSpanExporterTest {
  static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
  static final long START = 1_704_067_200_000_000_000L;
  static final ObjectMapper JSON = new ObjectMapper();

  InMemoryStorage storage = InMemoryStorage.create();
  SpanCollector collector = SpanCollector.newBuilder().storage(storage)
    .flushInterval(Duration.ofMinutes(1))
    .build();
  TracelogSpanExporter exporter = TracelogSpanExporter.create(collector, Duration.ofSeconds(5));

  @AfterEach void close() {
    exporter.shutdown();
  }

  @Test void export_convertsSpans() throws Exception {
    SpanData child = spanData("b7ad6b7169203331", "00f067aa0ba902b7")
      .setName("SELECT orders")
      .setStatus(StatusData.error())
      .setAttributes(Attributes.builder()
        .put("db.system", "h2")
        .put("db.rows", 12L)
        .put("retry", true)
        .put(AttributeKey.stringArrayKey("tags"), List.of("a", "b"))
        .build())
      .setResource(Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), "orders")))
      .build();

    assertThat(exporter.export(List.of(child)).isSuccess()).isTrue();
    assertThat(exporter.flush().join(5, TimeUnit.SECONDS).isSuccess()).isTrue();

    Span stored = storage.getSpans().get(0);
    assertThat(stored.traceId()).isEqualTo(TRACE_ID);
    assertThat(stored.spanId()).isEqualTo("b7ad6b7169203331");
    assertThat(stored.parentSpanId()).isEqualTo("00f067aa0ba902b7");
    assertThat(stored.name()).isEqualTo("SELECT orders");
    assertThat(stored.startTime()).isEqualTo(START);
    assertThat(stored.durationNs()).isEqualTo(80_000_000L);
    assertThat(stored.serviceName()).isEqualTo("orders");
    assertThat(stored.hasError()).isTrue();
    assertThat(JSON.readTree(stored.attributes())).isEqualTo(JSON.readTree(
      "{\"db.system\":\"h2\",\"db.rows\":12,\"retry\":true,\"tags\":[\"a\",\"b\"]}"));
  }

  @Test void export_rootWithoutServiceName() {
    SpanData root = spanData("00f067aa0ba902b7", null).setName("GET /checkout").build();

    exporter.export(List.of(root));
    exporter.flush();

    Span stored = storage.getSpans().get(0);
    assertThat(stored.parentSpanId()).isNull();
    assertThat(stored.isRoot()).isTrue();
    assertThat(stored.serviceName()).isEqualTo("unknown");
    assertThat(stored.attributes()).isEqualTo("{}");
    assertThat(stored.hasError()).isFalse();
  }

  @Test void export_afterShutdownFails() {
    assertThat(exporter.shutdown().isSuccess()).isTrue();

    CompletableResultCode result =
      exporter.export(List.of(spanData("00f067aa0ba902b7", null).build()));

    assertThat(result.isSuccess()).isFalse();
    assertThat(storage.getSpans()).isEmpty();
  }

  @Test void shutdown_drainsCollector() {
    exporter.export(List.of(spanData("00f067aa0ba902b7", null).build()));

    assertThat(exporter.shutdown().isSuccess()).isTrue();
    assertThat(storage.acceptedSpanCount()).isEqualTo(1);
    assertThat(collector.check().ok()).isFalse();
  }

  @Test void tracerProvider_storesParentAndChild() {
    SdkTracerProvider provider = SdkTracerProvider.builder()
      .addSpanProcessor(SimpleSpanProcessor.create(exporter))
      .setResource(Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), "shop")))
      .build();
    Tracer tracer = provider.get("test");

    io.opentelemetry.api.trace.Span parent = tracer.spanBuilder("checkout").startSpan();
    try (Scope scope = parent.makeCurrent()) {
      tracer.spanBuilder("charge").startSpan()
        .setStatus(StatusCode.ERROR)
        .end();
    } finally {
      parent.end();
    }
    exporter.flush();

    assertThat(storage.getSpans())
      .extracting(Span::name, Span::serviceName, Span::hasError)
      .containsExactly(
        Tuple.tuple("charge", "shop", true),
        Tuple.tuple("checkout", "shop", false));
    List<Span> spans = storage.getSpans();
    assertThat(spans.get(0).parentSpanId()).isEqualTo(spans.get(1).spanId());
    assertThat(spans.get(0).traceId()).isEqualTo(spans.get(1).traceId());
    provider.shutdown().join(5, TimeUnit.SECONDS);
  }

  static TestSpanData.Builder spanData(String spanId, String parentSpanId) {
    TestSpanData.Builder result = TestSpanData.builder()
      .setSpanContext(context(spanId))
      .setKind(SpanKind.INTERNAL)
      .setName("span")
      .setStartEpochNanos(START)
      .setEndEpochNanos(START + 80_000_000L)
      .setStatus(StatusData.unset())
      .setHasEnded(true)
      .setTotalRecordedEvents(0)
      .setTotalRecordedLinks(0)
      .setResource(Resource.empty());
    if (parentSpanId != null) result.setParentSpanContext(context(parentSpanId));
    return result;
  }

  static SpanContext context(String spanId) {
    return SpanContext.create(TRACE_ID, spanId, TraceFlags.getSampled(), TraceState.getDefault());
  }
}
