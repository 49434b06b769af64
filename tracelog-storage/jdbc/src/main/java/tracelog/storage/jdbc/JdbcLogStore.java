/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Record;
import tracelog.Call;
import tracelog.LogRecord;
import tracelog.storage.LogQueryRequest;
import tracelog.storage.LogStore;

import static org.jooq.impl.DSL.noCondition;
import static tracelog.storage.jdbc.Schema.ID;
import static tracelog.storage.jdbc.Schema.LEVEL;
import static tracelog.storage.jdbc.Schema.LOGS;
import static tracelog.storage.jdbc.Schema.LOG_FIELDS;
import static tracelog.storage.jdbc.Schema.LOG_TRACE_ID;
import static tracelog.storage.jdbc.Schema.TIMESTAMP;

final class JdbcLogStore implements LogStore {
  final DataSourceCall.Factory dataSourceCallFactory;

  JdbcLogStore(DataSourceCall.Factory dataSourceCallFactory) {
    this.dataSourceCallFactory = dataSourceCallFactory;
  }

  @Override public Call<List<LogRecord>> getLogs(LogQueryRequest request) {
    if (request == null) throw new NullPointerException("request == null");
    return dataSourceCallFactory.create(new SelectLogs(request));
  }

  @Override public Call<Long> countLogs(LogQueryRequest request) {
    if (request == null) throw new NullPointerException("request == null");
    return dataSourceCallFactory.create(new CountLogs(request));
  }

  /** Filters absent from the request are omitted, so they match everything. */
  static Condition condition(LogQueryRequest request) {
    Condition result = noCondition();
    if (request.level() != null) result = result.and(LEVEL.eq(request.level()));
    if (request.traceId() != null) result = result.and(LOG_TRACE_ID.eq(request.traceId()));
    if (request.startTime() != null) result = result.and(TIMESTAMP.ge(request.startTime()));
    if (request.endTime() != null) result = result.and(TIMESTAMP.le(request.endTime()));
    return result;
  }

  static final class SelectLogs implements Function<DSLContext, List<LogRecord>> {
    final LogQueryRequest request;

    SelectLogs(LogQueryRequest request) {
      this.request = request;
    }

    @Override public List<LogRecord> apply(DSLContext context) {
      List<LogRecord> result = new ArrayList<>();
      for (Record record : context.select(LOG_FIELDS).from(LOGS)
        .where(condition(request))
        .orderBy(TIMESTAMP.desc(), ID.desc())
        .limit(request.limit()).offset(request.offset())
        .fetch()) {
        result.add(Schema.toLogRecord(record));
      }
      return result;
    }

    @Override public String toString() {
      return "SelectLogs{request=" + request + "}";
    }
  }

  static final class CountLogs implements Function<DSLContext, Long> {
    final LogQueryRequest request;

    CountLogs(LogQueryRequest request) {
      this.request = request;
    }

    @Override public Long apply(DSLContext context) {
      return (long) context.fetchCount(LOGS, condition(request));
    }

    @Override public String toString() {
      return "CountLogs{request=" + request + "}";
    }
  }
}
