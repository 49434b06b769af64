/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import tracelog.Call;
import tracelog.CheckResult;
import tracelog.Component;
import tracelog.internal.ClosedComponentException;
import tracelog.internal.Nullable;
import tracelog.storage.StorageComponent;
import tracelog.storage.TenantStorageManager;

import static java.lang.String.format;
import static tracelog.Call.propagateIfFatal;

/**
 * Base type of ingest pipelines. Each pipeline owns a bounded queue and one worker thread, which
 * is the only writer of its record type. Records are stored one call per record, so a failure
 * affects only that record.
 *
 * <p>Storage is looked up for every batch, and again after a record fails to store. When built
 * with a {@link TenantStorageManager}, this means a handle evicted for idleness, even in the middle
 * of a batch, is transparently reopened and only the record in flight is lost.
 */
public abstract class CollectorComponent<T> extends Component {

  public abstract static class Builder {
    StorageComponent storage;
    TenantStorageManager storageManager;
    String tenant = TenantStorageManager.DEFAULT_TENANT;
    CollectorMetrics metrics = CollectorMetrics.NOOP_METRICS;
    int queueSize = 1000, batchSize = 100;
    Duration flushInterval = Duration.ofMillis(100), shutdownTimeout = Duration.ofSeconds(5);

    Builder() {
    }

    /** Stores into a fixed handle. Mutually exclusive with {@link #storageManager}. */
    public Builder storage(StorageComponent storage) {
      if (storage == null) throw new NullPointerException("storage == null");
      this.storage = storage;
      return this;
    }

    /** Stores into the {@link #tenant(String) tenant's} handle, looked up per batch. */
    public Builder storageManager(TenantStorageManager storageManager) {
      if (storageManager == null) throw new NullPointerException("storageManager == null");
      this.storageManager = storageManager;
      return this;
    }

    /** Tenant whose storage receives the records. Defaults to "default". */
    public Builder tenant(String tenant) {
      if (tenant == null) throw new NullPointerException("tenant == null");
      this.tenant = tenant;
      return this;
    }

    /**
     * Aggregates and reports collection metrics to a monitoring system. Defaults to no-op. The
     * collector scopes this to its own transport.
     */
    public Builder metrics(CollectorMetrics metrics) {
      if (metrics == null) throw new NullPointerException("metrics == null");
      this.metrics = metrics;
      return this;
    }

    /** Maximum records waiting to be stored. Records offered beyond this are dropped. */
    public Builder queueSize(int queueSize) {
      if (queueSize <= 0) throw new IllegalArgumentException("queueSize <= 0");
      this.queueSize = queueSize;
      return this;
    }

    /** Records queued that trigger a write before the flush interval. Defaults to 100. */
    public Builder batchSize(int batchSize) {
      if (batchSize <= 0) throw new IllegalArgumentException("batchSize <= 0");
      this.batchSize = batchSize;
      return this;
    }

    /** Longest time a record waits in the queue when traffic is light. Defaults to 100ms. */
    public Builder flushInterval(Duration flushInterval) {
      if (flushInterval == null) throw new NullPointerException("flushInterval == null");
      if (flushInterval.isNegative() || flushInterval.isZero()) {
        throw new IllegalArgumentException("flushInterval <= 0");
      }
      this.flushInterval = flushInterval;
      return this;
    }

    /** How long {@link CollectorComponent#close()} waits for the queue to drain. */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      if (shutdownTimeout == null) throw new NullPointerException("shutdownTimeout == null");
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public abstract CollectorComponent<?> build();
  }

  final Logger logger;
  final CollectorMetrics metrics;
  @Nullable final StorageComponent storage;
  @Nullable final TenantStorageManager storageManager;
  final String tenant;
  final Duration shutdownTimeout;
  final AsyncBatcher<T> batcher;

  CollectorComponent(Builder builder, String transport, Logger logger) {
    if (builder.storage == null && builder.storageManager == null) {
      throw new NullPointerException("storage == null && storageManager == null");
    }
    if (builder.storage != null && builder.storageManager != null) {
      throw new IllegalArgumentException("storage and storageManager are mutually exclusive");
    }
    if (builder.batchSize > builder.queueSize) {
      throw new IllegalArgumentException("batchSize > queueSize");
    }
    this.logger = logger;
    this.metrics = builder.metrics.forTransport(transport);
    this.storage = builder.storage;
    this.storageManager = builder.storageManager;
    this.tenant = builder.tenant;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.batcher = new AsyncBatcher<>("tracelog-" + transport + "-collector-" + tenant,
      builder.queueSize, builder.batchSize, builder.flushInterval, this::storeBatch);
  }

  /** Subclasses call this last in their constructor, as the worker calls their methods. */
  final void startWorker() {
    batcher.start();
  }

  /** Issues the request that stores one record. */
  abstract Call<Void> store(StorageComponent storage, T record);

  /** Identifies a record in log messages without dumping its content. */
  abstract String idString(T record);

  /** Queues the record, or drops it when the queue is full or this is shut down. */
  boolean enqueue(T record) {
    metrics.incrementRecords(1);
    if (batcher.offer(record)) return true;
    metrics.incrementRecordsDropped(1);
    return false;
  }

  StorageComponent storage() throws IOException {
    return storage != null ? storage : storageManager.get(tenant);
  }

  void storeBatch(List<T> batch) {
    StorageComponent storage;
    try {
      storage = storage();
    } catch (IOException | RuntimeException e) {
      metrics.incrementRecordsDropped(batch.size());
      handleError(e, () -> "Cannot open storage for tenant " + tenant + " to store "
        + batch.size() + " records");
      return;
    }
    for (int i = 0, length = batch.size(); i < length; i++) {
      T record = batch.get(i);
      try {
        store(storage, record).execute();
      } catch (Throwable e) {
        propagateIfFatal(e);
        metrics.incrementRecordsDropped(1);
        handleError(e, () -> "Cannot store " + idString(record));
        if (storageManager == null || i == length - 1) continue;
        // the handle may have been evicted while in use: look it up again for the rest
        int remaining = length - i - 1;
        try {
          storage = storage();
        } catch (IOException | RuntimeException lookupError) {
          metrics.incrementRecordsDropped(remaining);
          handleError(lookupError, () -> "Cannot open storage for tenant " + tenant + " to store "
            + remaining + " records");
          return;
        }
      }
    }
  }

  void handleError(Throwable e, Supplier<String> defaultLogMessage) {
    if (!logger.isDebugEnabled()) return;
    String error = e.getMessage() != null ? e.getMessage() : "";
    logger.debug(
      format("%s due to %s(%s)", defaultLogMessage.get(), e.getClass().getSimpleName(), error), e);
  }

  /**
   * Blocks until every record queued before this call was handed to storage. Records that storage
   * rejected count as handled.
   *
   * @throws TimeoutException when that takes longer than the timeout
   */
  public void flush(Duration timeout) throws TimeoutException {
    if (timeout == null) throw new NullPointerException("timeout == null");
    batcher.flush(timeout);
  }

  /**
   * Stops accepting records, then waits for the queue to drain. A timeout that isn't positive is
   * already expired. When this times out, the worker keeps draining in the background and records
   * still queued may not be stored.
   *
   * @throws TimeoutException when draining takes longer than the timeout
   */
  public void shutdown(Duration timeout) throws TimeoutException {
    if (timeout == null) throw new NullPointerException("timeout == null");
    batcher.shutdown(timeout);
  }

  /** Records waiting for the worker. */
  public int queuedCount() {
    return batcher.queuedCount();
  }

  @Override public CheckResult check() {
    if (batcher.isClosed()) return CheckResult.failed(new ClosedComponentException());
    return CheckResult.OK;
  }

  /** Shuts down with the configured timeout, logging rather than throwing when it elapses. */
  @Override public void close() {
    try {
      shutdown(shutdownTimeout);
    } catch (TimeoutException e) {
      logger.warn("{}: records still queued may be lost", e.getMessage());
    }
  }
}
