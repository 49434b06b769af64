/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracelog.Call;
import tracelog.Span;
import tracelog.storage.StorageComponent;
import tracelog.storage.TenantStorageManager;

/**
 * Accepts spans from instrumentation without blocking it, and stores them in batches.
 *
 * <p>Telemetry favors the availability of the instrumented application over completeness: a full
 * queue drops the newest span silently, counting it in {@link CollectorMetrics}.
 */
public final class SpanCollector extends CollectorComponent<Span> {
  static final Logger LOG = LoggerFactory.getLogger(SpanCollector.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends CollectorComponent.Builder {
    Builder() {
    }

    @Override public Builder storage(StorageComponent storage) {
      return (Builder) super.storage(storage);
    }

    @Override public Builder storageManager(TenantStorageManager storageManager) {
      return (Builder) super.storageManager(storageManager);
    }

    @Override public Builder tenant(String tenant) {
      return (Builder) super.tenant(tenant);
    }

    @Override public Builder metrics(CollectorMetrics metrics) {
      return (Builder) super.metrics(metrics);
    }

    @Override public Builder queueSize(int queueSize) {
      return (Builder) super.queueSize(queueSize);
    }

    @Override public Builder batchSize(int batchSize) {
      return (Builder) super.batchSize(batchSize);
    }

    @Override public Builder flushInterval(Duration flushInterval) {
      return (Builder) super.flushInterval(flushInterval);
    }

    @Override public Builder shutdownTimeout(Duration shutdownTimeout) {
      return (Builder) super.shutdownTimeout(shutdownTimeout);
    }

    @Override public SpanCollector build() {
      return new SpanCollector(this);
    }
  }

  SpanCollector(Builder builder) {
    super(builder, "span", LOG);
    startWorker();
  }

  /** Queues the span for storage, or drops it. Never blocks and never throws. */
  public void accept(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    enqueue(span);
  }

  /** Like {@link #accept(Span)}, for each span in order. */
  public void accept(List<Span> spans) {
    if (spans == null) throw new NullPointerException("spans == null");
    for (Span span : spans) accept(span);
  }

  @Override Call<Void> store(StorageComponent storage, Span span) {
    return storage.spanConsumer().accept(span);
  }

  @Override String idString(Span span) {
    return "span " + span.traceId() + "/" + span.spanId();
  }

  @Override public String toString() {
    return "SpanCollector{tenant=" + tenant + "}";
  }
}
