/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.util.function.Function;
import org.jooq.DSLContext;
import tracelog.Call;
import tracelog.LogRecord;
import tracelog.storage.LogConsumer;

import static tracelog.storage.jdbc.Schema.LEVEL;
import static tracelog.storage.jdbc.Schema.LOGS;
import static tracelog.storage.jdbc.Schema.LOG_ATTRIBUTES;
import static tracelog.storage.jdbc.Schema.LOG_SPAN_ID;
import static tracelog.storage.jdbc.Schema.LOG_TRACE_ID;
import static tracelog.storage.jdbc.Schema.MESSAGE;
import static tracelog.storage.jdbc.Schema.TIMESTAMP;

final class JdbcLogConsumer implements LogConsumer {
  final DataSourceCall.Factory dataSourceCallFactory;

  JdbcLogConsumer(DataSourceCall.Factory dataSourceCallFactory) {
    this.dataSourceCallFactory = dataSourceCallFactory;
  }

  @Override public Call<Void> accept(LogRecord record) {
    if (record == null) throw new NullPointerException("record == null");
    return dataSourceCallFactory.create(new InsertLog(record));
  }

  /** The ID is assigned by the database, so any ID on the input is ignored. */
  static final class InsertLog implements Function<DSLContext, Void> {
    final LogRecord record;

    InsertLog(LogRecord record) {
      this.record = record;
    }

    @Override public Void apply(DSLContext create) {
      create.insertInto(LOGS)
        .set(TIMESTAMP, record.timestamp())
        .set(LEVEL, record.level())
        .set(MESSAGE, record.message())
        .set(LOG_TRACE_ID, record.traceId())
        .set(LOG_SPAN_ID, record.spanId())
        .set(LOG_ATTRIBUTES, record.attributes())
        .execute();
      return null;
    }

    @Override public String toString() {
      return "InsertLog{timestamp=" + record.timestamp() + "}";
    }
  }
}
