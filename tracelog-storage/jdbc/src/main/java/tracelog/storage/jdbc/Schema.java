/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.util.List;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;
import tracelog.LogRecord;
import tracelog.Span;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.primaryKey;
import static org.jooq.impl.DSL.table;

/**
 * Table and column definitions. There are no generated classes: names are declared here and the
 * tables are created with jOOQ's DDL API, so that identifier quoting is the same in DDL and DML.
 */
final class Schema {
  static final Table<Record> SPANS = table(name("spans"));
  static final Field<String> SPAN_ID = field(name("span_id"), SQLDataType.VARCHAR(64));
  static final Field<String> TRACE_ID = field(name("trace_id"), SQLDataType.VARCHAR(64));
  static final Field<String> PARENT_SPAN_ID =
    field(name("parent_span_id"), SQLDataType.VARCHAR(64));
  static final Field<String> NAME = field(name("name"), SQLDataType.VARCHAR(1024));
  static final Field<Long> START_TIME = field(name("start_time"), SQLDataType.BIGINT);
  static final Field<Long> END_TIME = field(name("end_time"), SQLDataType.BIGINT);
  static final Field<String> SPAN_ATTRIBUTES = field(name("attributes"), SQLDataType.CLOB);
  static final Field<String> SERVICE_NAME = field(name("service_name"), SQLDataType.VARCHAR(255));
  static final Field<Boolean> HAS_ERROR = field(name("has_error"), SQLDataType.BOOLEAN);

  static final List<Field<?>> SPAN_FIELDS = List.of(SPAN_ID, TRACE_ID, PARENT_SPAN_ID, NAME,
    START_TIME, END_TIME, SPAN_ATTRIBUTES, SERVICE_NAME, HAS_ERROR);

  static final Table<Record> LOGS = table(name("logs"));
  static final Field<Long> ID = field(name("id"), SQLDataType.BIGINT);
  static final Field<Long> TIMESTAMP = field(name("timestamp"), SQLDataType.BIGINT);
  static final Field<String> LEVEL = field(name("level"), SQLDataType.VARCHAR(32));
  static final Field<String> MESSAGE = field(name("message"), SQLDataType.CLOB);
  static final Field<String> LOG_TRACE_ID = field(name("trace_id"), SQLDataType.VARCHAR(64));
  static final Field<String> LOG_SPAN_ID = field(name("span_id"), SQLDataType.VARCHAR(64));
  static final Field<String> LOG_ATTRIBUTES = field(name("attributes"), SQLDataType.CLOB);

  static final List<Field<?>> LOG_FIELDS = List.of(ID, TIMESTAMP, LEVEL, MESSAGE, LOG_TRACE_ID,
    LOG_SPAN_ID, LOG_ATTRIBUTES);

  /** Creates tables and indexes that don't yet exist. Safe to call on every open. */
  static void ensure(DSLContext create) {
    create.createTableIfNotExists(SPANS)
      .column(SPAN_ID, SPAN_ID.getDataType().nullable(false))
      .column(TRACE_ID, TRACE_ID.getDataType().nullable(false))
      .column(PARENT_SPAN_ID, PARENT_SPAN_ID.getDataType().nullable(true))
      .column(NAME, NAME.getDataType().nullable(false))
      .column(START_TIME, START_TIME.getDataType().nullable(false))
      .column(END_TIME, END_TIME.getDataType().nullable(false))
      .column(SPAN_ATTRIBUTES, SPAN_ATTRIBUTES.getDataType().nullable(false))
      .column(SERVICE_NAME, SERVICE_NAME.getDataType().nullable(false))
      .column(HAS_ERROR, HAS_ERROR.getDataType().nullable(false))
      .constraints(primaryKey(SPAN_ID))
      .execute();
    create.createIndexIfNotExists(name("spans_trace_id_start_time"))
      .on(SPANS, TRACE_ID, START_TIME)
      .execute();
    create.createIndexIfNotExists(name("spans_start_time"))
      .on(SPANS, START_TIME)
      .execute();

    create.createTableIfNotExists(LOGS)
      .column(ID, SQLDataType.BIGINT.identity(true))
      .column(TIMESTAMP, TIMESTAMP.getDataType().nullable(false))
      .column(LEVEL, LEVEL.getDataType().nullable(false))
      .column(MESSAGE, MESSAGE.getDataType().nullable(false))
      .column(LOG_TRACE_ID, LOG_TRACE_ID.getDataType().nullable(true))
      .column(LOG_SPAN_ID, LOG_SPAN_ID.getDataType().nullable(true))
      .column(LOG_ATTRIBUTES, LOG_ATTRIBUTES.getDataType().nullable(true))
      .constraints(primaryKey(ID))
      .execute();
    create.createIndexIfNotExists(name("logs_timestamp")).on(LOGS, TIMESTAMP).execute();
    create.createIndexIfNotExists(name("logs_level")).on(LOGS, LEVEL).execute();
    create.createIndexIfNotExists(name("logs_trace_id")).on(LOGS, LOG_TRACE_ID).execute();
  }

  static Span toSpan(Record record) {
    return Span.newBuilder()
      .spanId(record.get(SPAN_ID))
      .traceId(record.get(TRACE_ID))
      .parentSpanId(record.get(PARENT_SPAN_ID))
      .name(record.get(NAME))
      .startTime(record.get(START_TIME))
      .endTime(record.get(END_TIME))
      .attributes(record.get(SPAN_ATTRIBUTES))
      .serviceName(record.get(SERVICE_NAME))
      .hasError(Boolean.TRUE.equals(record.get(HAS_ERROR)))
      .build();
  }

  static LogRecord toLogRecord(Record record) {
    return LogRecord.newBuilder()
      .id(record.get(ID))
      .timestamp(record.get(TIMESTAMP))
      .level(record.get(LEVEL))
      .message(record.get(MESSAGE))
      .traceId(record.get(LOG_TRACE_ID))
      .spanId(record.get(LOG_SPAN_ID))
      .attributes(record.get(LOG_ATTRIBUTES))
      .build();
  }

  Schema() {
  }
}
