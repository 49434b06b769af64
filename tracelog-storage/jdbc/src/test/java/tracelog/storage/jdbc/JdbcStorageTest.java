/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.io.Closeable;
import java.io.IOException;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import tracelog.CheckResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

class JdbcStorageTest {

  @Test void check_failsInsteadOfThrowing() throws SQLException {
    DataSource dataSource = mock(DataSource.class);
    when(dataSource.getConnection()).thenThrow(new SQLException("foo"));

    CheckResult result = storage(dataSource).check();

    assertThat(result.ok()).isFalse();
    assertThat(result.error())
      .isInstanceOf(SQLException.class);
  }

  @Test void ensureSchema_wrapsSQLException() throws SQLException {
    DataSource dataSource = mock(DataSource.class);
    when(dataSource.getConnection()).thenThrow(new SQLException("foo"));

    assertThatThrownBy(() -> storage(dataSource).ensureSchema())
      .isInstanceOf(IOException.class)
      .hasCauseInstanceOf(SQLException.class);
  }

  @Test void close_leavesDatasourceOpenByDefault() throws IOException {
    DataSource dataSource = mock(DataSource.class, withSettings().extraInterfaces(Closeable.class));

    storage(dataSource).close();

    verifyNoInteractions(dataSource);
  }

  @Test void close_closesOwnedDatasource() throws IOException {
    DataSource dataSource = mock(DataSource.class, withSettings().extraInterfaces(Closeable.class));

    JdbcStorage.newBuilder()
      .datasource(dataSource)
      .ownsDatasource(true)
      .build()
      .close();

    verify((Closeable) dataSource).close();
  }

  @Test void datasourceIsRequired() {
    assertThatThrownBy(() -> JdbcStorage.newBuilder().build())
      .isInstanceOf(NullPointerException.class)
      .hasMessage("datasource == null");
  }

  /**
   * The {@code toString()} of storage handles appears in logs, so it should be short and not
   * contain sensitive information.
   */
  @Test void toStringContainsOnlySummaryInformation() {
    DataSource datasource = mock(DataSource.class);
    when(datasource.toString()).thenReturn("Blamo");

    assertThat(storage(datasource)).hasToString("JdbcStorage{datasource=Blamo}");
  }

  static JdbcStorage storage(DataSource dataSource) {
    return JdbcStorage.newBuilder()
      .datasource(dataSource)
      .build();
  }
}
