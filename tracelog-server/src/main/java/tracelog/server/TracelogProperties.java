/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.server;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import tracelog.collector.CollectorComponent;
import tracelog.storage.TenantStorageManager;

@ConfigurationProperties("tracelog")
public class TracelogProperties {
  /** When false, every tenant ID resolves to the default tenant. */
  private boolean multiTenant;
  private final Storage storage = new Storage();
  private final Collector collector = new Collector();
  private final Tenant tenant = new Tenant();

  public boolean isMultiTenant() {
    return multiTenant;
  }

  public void setMultiTenant(boolean multiTenant) {
    this.multiTenant = multiTenant;
  }

  public Storage getStorage() {
    return storage;
  }

  public Collector getCollector() {
    return collector;
  }

  public Tenant getTenant() {
    return tenant;
  }

  public static class Storage {
    /** Parent of the per-tenant database directories. */
    private String directory = "./tracelog-data";
    private int maxPoolSize = 2;

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(String directory) {
      this.directory = directory;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    Path directoryPath() {
      return Paths.get(directory);
    }
  }

  public static class Collector {
    /** Tenant the in-process collectors write to. */
    private String tenant = TenantStorageManager.DEFAULT_TENANT;
    private int queueSize = 1000;
    private int batchSize = 100;
    private Duration flushInterval = Duration.ofMillis(100);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    public String getTenant() {
      return tenant;
    }

    public void setTenant(String tenant) {
      this.tenant = tenant;
    }

    public int getQueueSize() {
      return queueSize;
    }

    public void setQueueSize(int queueSize) {
      this.queueSize = queueSize;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getFlushInterval() {
      return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
    }

    public Duration getShutdownTimeout() {
      return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
    }

    <B extends CollectorComponent.Builder> B configure(B builder) {
      builder.tenant(tenant)
        .queueSize(queueSize)
        .batchSize(batchSize)
        .flushInterval(flushInterval)
        .shutdownTimeout(shutdownTimeout);
      return builder;
    }
  }

  public static class Tenant {
    /** Storage of a tenant unused this long is closed, and reopened on next use. */
    private Duration maxIdle = Duration.ofMinutes(30);
    /** How often to look for idle tenants. Zero disables eviction. */
    private Duration evictionInterval = Duration.ofMinutes(5);

    public Duration getMaxIdle() {
      return maxIdle;
    }

    public void setMaxIdle(Duration maxIdle) {
      this.maxIdle = maxIdle;
    }

    public Duration getEvictionInterval() {
      return evictionInterval;
    }

    public void setEvictionInterval(Duration evictionInterval) {
      this.evictionInterval = evictionInterval;
    }
  }
}
