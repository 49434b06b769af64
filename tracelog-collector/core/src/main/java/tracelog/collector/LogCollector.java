/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracelog.Call;
import tracelog.LogRecord;
import tracelog.internal.ClosedComponentException;
import tracelog.storage.StorageComponent;
import tracelog.storage.TenantStorageManager;

/**
 * Sink for structured logging output: each {@link #write(byte[])} carries one JSON encoded event.
 * Writes never block on storage. Payloads that aren't JSON objects, and events arriving while the
 * queue is full, are dropped without failing the caller.
 */
public final class LogCollector extends CollectorComponent<LogRecord> {
  static final Logger LOG = LoggerFactory.getLogger(LogCollector.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends CollectorComponent.Builder {
    Clock clock = Clock.systemUTC();

    Builder() {
    }

    /** Stamps events that carry no parsable time. Defaults to the system clock. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
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

    @Override public LogCollector build() {
      return new LogCollector(this);
    }
  }

  final LogRecordParser parser;

  LogCollector(Builder builder) {
    super(builder, "log", LOG);
    parser = new LogRecordParser(builder.clock);
    startWorker();
  }

  /**
   * Queues one JSON encoded event. Returns the payload length even when the event was dropped, so
   * that logging frameworks don't treat drops as I/O failures.
   *
   * @throws ClosedComponentException if this collector was shut down
   */
  public int write(byte[] payload) {
    if (payload == null) throw new NullPointerException("payload == null");
    if (batcher.isClosed()) throw new ClosedComponentException(this + " is closed");
    metrics.incrementMessages();
    metrics.incrementBytes(payload.length);

    LogRecord record;
    try {
      record = parser.parse(payload);
    } catch (IllegalArgumentException e) {
      metrics.incrementMessagesDropped();
      handleError(e, () -> "Cannot decode log record");
      return payload.length;
    }
    enqueue(record);
    return payload.length;
  }

  @Override Call<Void> store(StorageComponent storage, LogRecord record) {
    return storage.logConsumer().accept(record);
  }

  @Override String idString(LogRecord record) {
    return "log record at " + record.timestamp();
  }

  @Override public String toString() {
    return "LogCollector{tenant=" + tenant + "}";
  }
}
