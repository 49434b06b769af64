/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.jooq.exception.DataAccessException;
import tracelog.CheckResult;
import tracelog.storage.LogConsumer;
import tracelog.storage.LogStore;
import tracelog.storage.SpanConsumer;
import tracelog.storage.SpanStore;
import tracelog.storage.StorageComponent;

import static tracelog.storage.jdbc.Schema.LOGS;
import static tracelog.storage.jdbc.Schema.SPANS;
import static tracelog.storage.jdbc.Schema.SPAN_ID;

/**
 * Storage for one tenant's spans and log records, in an embedded H2 database.
 *
 * <p>Use {@link JdbcStorageFactory} to open a file database per tenant. This type can also be
 * built directly against any H2 {@link DataSource}, in which case {@link #close()} leaves the data
 * source open unless {@link Builder#ownsDatasource(boolean)} was set.
 */
public final class JdbcStorage extends StorageComponent {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    DataSource datasource;
    boolean ownsDatasource;

    public Builder datasource(DataSource datasource) {
      if (datasource == null) throw new NullPointerException("datasource == null");
      this.datasource = datasource;
      return this;
    }

    /** When true, {@link #close()} also closes the data source if it is {@link Closeable}. */
    public Builder ownsDatasource(boolean ownsDatasource) {
      this.ownsDatasource = ownsDatasource;
      return this;
    }

    public JdbcStorage build() {
      return new JdbcStorage(this);
    }

    Builder() {
    }
  }

  static {
    System.setProperty("org.jooq.no-logo", "true");
    System.setProperty("org.jooq.no-tips", "true");
  }

  final DataSource datasource;
  final DSLContexts context;
  final DataSourceCall.Factory dataSourceCallFactory;
  final boolean ownsDatasource;
  final JdbcSpanStore spanStore;
  final JdbcSpanConsumer spanConsumer;
  final JdbcLogStore logStore;
  final JdbcLogConsumer logConsumer;

  JdbcStorage(Builder builder) {
    datasource = builder.datasource;
    if (datasource == null) throw new NullPointerException("datasource == null");
    context = new DSLContexts();
    dataSourceCallFactory = new DataSourceCall.Factory(datasource, context);
    ownsDatasource = builder.ownsDatasource;
    spanStore = new JdbcSpanStore(dataSourceCallFactory);
    spanConsumer = new JdbcSpanConsumer(dataSourceCallFactory);
    logStore = new JdbcLogStore(dataSourceCallFactory);
    logConsumer = new JdbcLogConsumer(dataSourceCallFactory);
  }

  /** Returns the data source in use by this storage component. */
  public DataSource datasource() {
    return datasource;
  }

  /** Creates the tables and indexes if they don't exist. */
  public void ensureSchema() throws IOException {
    try (Connection conn = datasource.getConnection()) {
      Schema.ensure(context.get(conn));
    } catch (SQLException | DataAccessException e) {
      throw new IOException("Could not create schema: " + e.getMessage(), e);
    }
  }

  @Override public SpanStore spanStore() {
    return spanStore;
  }

  @Override public LogStore logStore() {
    return logStore;
  }

  @Override public SpanConsumer spanConsumer() {
    return spanConsumer;
  }

  @Override public LogConsumer logConsumer() {
    return logConsumer;
  }

  @Override public CheckResult check() {
    try (Connection conn = datasource.getConnection()) {
      context.get(conn).select(SPAN_ID).from(SPANS).limit(1).execute();
    } catch (SQLException | RuntimeException e) {
      return CheckResult.failed(e);
    }
    return CheckResult.OK;
  }

  @Override public void close() throws IOException {
    if (ownsDatasource && datasource instanceof Closeable) ((Closeable) datasource).close();
  }

  /** Visible for testing */
  void clear() {
    try (Connection conn = datasource.getConnection()) {
      context.get(conn).truncate(SPANS).execute();
      context.get(conn).truncate(LOGS).execute();
    } catch (SQLException | RuntimeException e) {
      throw new AssertionError(e);
    }
  }

  @Override public String toString() {
    return "JdbcStorage{datasource=" + datasource + "}";
  }
}
