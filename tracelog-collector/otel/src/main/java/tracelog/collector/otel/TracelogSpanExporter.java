/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector.otel;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracelog.collector.SpanCollector;

/**
 * Exports spans finished by the OpenTelemetry SDK into a {@link SpanCollector}. Exporting only
 * queues spans, so it completes immediately: spans the collector drops are not reported as export
 * failures.
 *
 * <p>Shutting down the exporter shuts down the collector.
 */
public final class TracelogSpanExporter implements SpanExporter {
  static final Logger LOG = LoggerFactory.getLogger(TracelogSpanExporter.class);

  public static TracelogSpanExporter create(SpanCollector collector) {
    return create(collector, Duration.ofSeconds(5));
  }

  /** @param timeout how long {@link #flush()} and {@link #shutdown()} wait for storage */
  public static TracelogSpanExporter create(SpanCollector collector, Duration timeout) {
    if (collector == null) throw new NullPointerException("collector == null");
    if (timeout == null) throw new NullPointerException("timeout == null");
    return new TracelogSpanExporter(collector, timeout);
  }

  final SpanCollector collector;
  final Duration timeout;
  final AtomicBoolean isShutdown = new AtomicBoolean();

  TracelogSpanExporter(SpanCollector collector, Duration timeout) {
    this.collector = collector;
    this.timeout = timeout;
  }

  @Override public CompletableResultCode export(Collection<SpanData> spans) {
    if (isShutdown.get()) {
      LOG.debug("Dropped {} spans exported after shutdown", spans.size());
      return CompletableResultCode.ofFailure();
    }
    for (SpanData span : spans) {
      collector.accept(SpanConverter.convert(span));
    }
    return CompletableResultCode.ofSuccess();
  }

  @Override public CompletableResultCode flush() {
    try {
      collector.flush(timeout);
      return CompletableResultCode.ofSuccess();
    } catch (TimeoutException e) {
      LOG.warn("Spans not stored within {}", timeout);
      return CompletableResultCode.ofFailure();
    }
  }

  @Override public CompletableResultCode shutdown() {
    if (!isShutdown.compareAndSet(false, true)) return CompletableResultCode.ofSuccess();
    try {
      collector.shutdown(timeout);
      return CompletableResultCode.ofSuccess();
    } catch (TimeoutException e) {
      LOG.warn("{}: queued spans may be lost", e.getMessage());
      return CompletableResultCode.ofFailure();
    }
  }

  @Override public String toString() {
    return "TracelogSpanExporter{" + collector + "}";
  }
}
