/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracelog.storage.StorageFactory;

/**
 * Opens a file database per tenant at {@code <directory>/<tenantId>/tracelog.mv.db}, creating
 * the directory and schema on first use. Each handle has its own small connection pool, closed
 * with the handle.
 */
public final class JdbcStorageFactory implements StorageFactory {
  static final Logger LOG = LoggerFactory.getLogger(JdbcStorageFactory.class);
  static final String DATABASE_NAME = "tracelog";

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    Path directory;
    int maxPoolSize = 2;

    /** Parent of the per-tenant directories. Created if missing. */
    public Builder directory(Path directory) {
      if (directory == null) throw new NullPointerException("directory == null");
      this.directory = directory;
      return this;
    }

    /** Connections per tenant. Defaults to 2. */
    public Builder maxPoolSize(int maxPoolSize) {
      if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize <= 0");
      this.maxPoolSize = maxPoolSize;
      return this;
    }

    public JdbcStorageFactory build() {
      if (directory == null) throw new NullPointerException("directory == null");
      return new JdbcStorageFactory(this);
    }

    Builder() {
    }
  }

  final Path directory;
  final int maxPoolSize;

  JdbcStorageFactory(Builder builder) {
    directory = builder.directory.toAbsolutePath();
    maxPoolSize = builder.maxPoolSize;
  }

  public Path directory() {
    return directory;
  }

  @Override public JdbcStorage open(String tenantId) throws IOException {
    if (tenantId == null) throw new NullPointerException("tenantId == null");
    Path tenantDirectory = directory.resolve(tenantId).normalize();
    if (!tenantDirectory.getParent().equals(directory)) {
      throw new IllegalArgumentException("tenantId escapes the storage directory: " + tenantId);
    }
    Files.createDirectories(tenantDirectory);

    HikariDataSource datasource = new HikariDataSource();
    datasource.setPoolName("tracelog-" + tenantId);
    datasource.setJdbcUrl(jdbcUrl(tenantDirectory));
    datasource.setMaximumPoolSize(maxPoolSize);

    JdbcStorage result = JdbcStorage.newBuilder()
      .datasource(datasource)
      .ownsDatasource(true)
      .build();
    try {
      result.ensureSchema();
    } catch (IOException e) {
      datasource.close();
      throw e;
    } catch (RuntimeException e) { // pool initialization
      datasource.close();
      throw new IOException("Could not open storage for tenant " + tenantId, e);
    }
    LOG.debug("Opened {} for tenant {}", datasource.getJdbcUrl(), tenantId);
    return result;
  }

  static String jdbcUrl(Path tenantDirectory) {
    return "jdbc:h2:file:" + tenantDirectory.resolve(DATABASE_NAME);
  }

  @Override public String toString() {
    return "JdbcStorageFactory{directory=" + directory + ", maxPoolSize=" + maxPoolSize + "}";
  }
}
