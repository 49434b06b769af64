/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.server;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import tracelog.internal.Nullable;
import tracelog.storage.TenantStorageManager;

/**
 * Periodically closes storage of tenants idle longer than the configured maximum. A non-positive
 * interval disables eviction.
 */
final class TenantIdleEvictor implements Closeable {
  static final Logger LOG = LoggerFactory.getLogger(TenantIdleEvictor.class);

  final TenantStorageManager storageManager;
  final Duration maxIdle;
  @Nullable final ScheduledFuture<?> schedule;

  TenantIdleEvictor(TenantStorageManager storageManager, TaskScheduler scheduler,
    Duration maxIdle, Duration interval) {
    this.storageManager = storageManager;
    this.maxIdle = maxIdle;
    if (interval.isNegative() || interval.isZero()) {
      LOG.info("Idle tenant eviction is disabled");
      this.schedule = null;
    } else {
      this.schedule = scheduler.scheduleWithFixedDelay(this::evict, interval);
    }
  }

  void evict() {
    try {
      int evicted = storageManager.evictIdle(maxIdle);
      if (evicted > 0) LOG.debug("Evicted {} idle tenants", evicted);
    } catch (RuntimeException e) {
      // an escaping exception would cancel the schedule
      LOG.warn("Failed to evict idle tenants", e);
    }
  }

  boolean isScheduled() {
    return schedule != null && !schedule.isDone();
  }

  @Override public void close() {
    if (schedule != null) schedule.cancel(false);
  }

  @Override public String toString() {
    return "TenantIdleEvictor{maxIdle=" + maxIdle + "}";
  }
}
