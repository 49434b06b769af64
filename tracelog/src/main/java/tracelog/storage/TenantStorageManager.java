/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens, caches and evicts one {@link StorageComponent} per tenant. This is the only type that
 * opens or closes storage handles.
 *
 * <p>Cache hits proceed in parallel under a shared lock. A miss takes the exclusive lock and checks
 * again before opening, so concurrent callers for the same tenant never open two handles.
 *
 * <p>When multi-tenancy is disabled, every tenant ID is normalized to {@value #DEFAULT_TENANT}
 * before lookup, so at most one handle is open.
 */
public final class TenantStorageManager implements Closeable {
  public static final String DEFAULT_TENANT = "default";

  /** Tenant IDs become directory names, so they are restricted to a safe alphabet. */
  static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]{0,127}");
  static final Logger LOG = LoggerFactory.getLogger(TenantStorageManager.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    StorageFactory storageFactory;
    boolean multiTenant;
    Clock clock = Clock.systemUTC();

    Builder() {
    }

    public Builder storageFactory(StorageFactory storageFactory) {
      if (storageFactory == null) throw new NullPointerException("storageFactory == null");
      this.storageFactory = storageFactory;
      return this;
    }

    /** When false (default), all tenant IDs map to {@value #DEFAULT_TENANT}. */
    public Builder multiTenant(boolean multiTenant) {
      this.multiTenant = multiTenant;
      return this;
    }

    /** Source of access times used by {@link #evictIdle(Duration)}. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    public TenantStorageManager build() {
      return new TenantStorageManager(this);
    }
  }

  static final class OpenStorage {
    final StorageComponent storage;
    volatile long lastUsed; // written under the shared lock, so last writer wins

    OpenStorage(StorageComponent storage, long lastUsed) {
      this.storage = storage;
      this.lastUsed = lastUsed;
    }
  }

  final StorageFactory storageFactory;
  final boolean multiTenant;
  final Clock clock;
  final ReadWriteLock lock = new ReentrantReadWriteLock();
  final Map<String, OpenStorage> storages = new LinkedHashMap<>(); // guarded by lock

  TenantStorageManager(Builder builder) {
    if (builder.storageFactory == null) throw new NullPointerException("storageFactory == null");
    storageFactory = builder.storageFactory;
    multiTenant = builder.multiTenant;
    clock = builder.clock;
  }

  public boolean multiTenant() {
    return multiTenant;
  }

  /**
   * Returns the open handle for the tenant, opening it if needed, and records the access time.
   * Callers should not keep the result longer than one unit of work, as {@link #evictIdle} or
   * {@link #close(String)} can close it afterwards.
   *
   * @throws IOException if the handle could not be opened. Other tenants are unaffected and the
   * next call retries the open.
   * @throws IllegalArgumentException if the tenant ID has characters unsafe for a directory name
   */
  public StorageComponent get(String tenantId) throws IOException {
    String key = tenantKey(tenantId);

    lock.readLock().lock();
    try {
      OpenStorage open = storages.get(key);
      if (open != null) {
        open.lastUsed = clock.millis();
        return open.storage;
      }
    } finally {
      lock.readLock().unlock();
    }

    lock.writeLock().lock();
    try {
      // another thread may have opened it while we waited for the write lock
      OpenStorage open = storages.get(key);
      if (open != null) {
        open.lastUsed = clock.millis();
        return open.storage;
      }

      StorageComponent storage = storageFactory.open(key);
      if (storage == null) throw new NullPointerException(storageFactory + " returned null");
      storages.put(key, new OpenStorage(storage, clock.millis()));
      LOG.info("Opened storage for tenant {}", key);
      return storage;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Closes and evicts the tenant's handle. Does nothing when it isn't open. */
  public void close(String tenantId) throws IOException {
    String key = tenantKey(tenantId);
    lock.writeLock().lock();
    try {
      OpenStorage open = storages.get(key);
      if (open == null) return;
      try {
        open.storage.close();
      } catch (IOException | RuntimeException e) {
        throw new IOException("Failed to close storage for tenant " + key, e);
      }
      storages.remove(key);
      LOG.info("Closed storage for tenant {}", key);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Closes and evicts handles not used within {@code maxAge}. A handle that fails to close is
   * logged and left in place, so that a later sweep can retry.
   *
   * <p>Handles are not reference counted. A caller still holding a handle from {@link #get} when
   * it is evicted sees its next request fail, and should call {@link #get} again to reopen it.
   *
   * <p>This is intended to be called periodically by a scheduler.
   *
   * @return count of handles closed
   */
  public int evictIdle(Duration maxAge) {
    if (maxAge == null) throw new NullPointerException("maxAge == null");
    if (maxAge.isNegative()) throw new IllegalArgumentException("maxAge < 0");
    long maxAgeMillis = maxAge.toMillis();

    lock.writeLock().lock();
    try {
      long now = clock.millis();
      int closed = 0;
      for (Iterator<Map.Entry<String, OpenStorage>> i = storages.entrySet().iterator();
        i.hasNext(); ) {
        Map.Entry<String, OpenStorage> entry = i.next();
        long idleMillis = now - entry.getValue().lastUsed;
        if (idleMillis <= maxAgeMillis) continue;
        try {
          entry.getValue().storage.close();
        } catch (IOException | RuntimeException e) {
          LOG.error("Failed to close idle storage for tenant {}", entry.getKey(), e);
          continue;
        }
        i.remove();
        closed++;
        LOG.info("Closed storage for tenant {} after {}ms idle", entry.getKey(), idleMillis);
      }
      return closed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Closes every open handle and empties the cache, even when some handles fail to close.
   *
   * @throws IOException listing the tenants that failed, with each failure {@linkplain
   * Throwable#getSuppressed() suppressed}
   */
  public void closeAll() throws IOException {
    lock.writeLock().lock();
    try {
      List<String> failedTenants = new ArrayList<>();
      List<Exception> failures = new ArrayList<>();
      for (Map.Entry<String, OpenStorage> entry : storages.entrySet()) {
        try {
          entry.getValue().storage.close();
        } catch (IOException | RuntimeException e) {
          failedTenants.add(entry.getKey());
          failures.add(e);
        }
      }
      int count = storages.size();
      storages.clear();

      if (!failures.isEmpty()) {
        IOException error = new IOException("Failed to close storage for tenants " + failedTenants);
        for (Exception failure : failures) error.addSuppressed(failure);
        throw error;
      }
      if (count > 0) LOG.info("Closed storage for {} tenants", count);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Same as {@link #closeAll()}. */
  @Override public void close() throws IOException {
    closeAll();
  }

  /** Returns a snapshot of tenants with an open handle. */
  public Set<String> openTenants() {
    lock.readLock().lock();
    try {
      return new LinkedHashSet<>(storages.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  String tenantKey(String tenantId) {
    if (!multiTenant) return DEFAULT_TENANT;
    if (tenantId == null) throw new NullPointerException("tenantId == null");
    if (!TENANT_ID.matcher(tenantId).matches()) {
      throw new IllegalArgumentException("invalid tenantId: " + tenantId);
    }
    return tenantId;
  }

  @Override public String toString() {
    return "TenantStorageManager{multiTenant=" + multiTenant + ", storageFactory="
      + storageFactory + "}";
  }
}
