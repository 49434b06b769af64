/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.sql.Connection;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.impl.DSL;

/** Binds jOOQ to a borrowed connection, rendering unqualified names for the H2 dialect. */
final class DSLContexts {
  final Settings settings = new Settings().withRenderSchema(false);

  DSLContext get(Connection conn) {
    return DSL.using(conn, SQLDialect.H2, settings);
  }
}
