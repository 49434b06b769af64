/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Function;
import javax.sql.DataSource;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import tracelog.Call;

/** Runs one jOOQ function against a pooled connection, borrowed for the duration of the call. */
final class DataSourceCall<V> extends Call.Base<V> {

  static final class Factory {
    final DataSource datasource;
    final DSLContexts context;

    Factory(DataSource datasource, DSLContexts context) {
      this.datasource = datasource;
      this.context = context;
    }

    <V> DataSourceCall<V> create(Function<DSLContext, V> queryFunction) {
      return new DataSourceCall<>(this, queryFunction);
    }
  }

  final Factory factory;
  final Function<DSLContext, V> queryFunction;

  DataSourceCall(Factory factory, Function<DSLContext, V> queryFunction) {
    this.factory = factory;
    this.queryFunction = queryFunction;
  }

  @Override protected V doExecute() throws IOException {
    try (Connection conn = factory.datasource.getConnection()) {
      return queryFunction.apply(factory.context.get(conn));
    } catch (SQLException | DataAccessException e) {
      throw new IOException(e.getMessage(), e);
    }
  }

  @Override public String toString() {
    return queryFunction.toString();
  }

  @Override public Call<V> clone() {
    return new DataSourceCall<>(factory, queryFunction);
  }
}
