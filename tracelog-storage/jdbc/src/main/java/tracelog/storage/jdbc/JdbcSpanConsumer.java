/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.util.function.Function;
import org.jooq.DSLContext;
import tracelog.Call;
import tracelog.Span;
import tracelog.storage.SpanConsumer;

import static tracelog.storage.jdbc.Schema.END_TIME;
import static tracelog.storage.jdbc.Schema.HAS_ERROR;
import static tracelog.storage.jdbc.Schema.NAME;
import static tracelog.storage.jdbc.Schema.PARENT_SPAN_ID;
import static tracelog.storage.jdbc.Schema.SERVICE_NAME;
import static tracelog.storage.jdbc.Schema.SPANS;
import static tracelog.storage.jdbc.Schema.SPAN_ATTRIBUTES;
import static tracelog.storage.jdbc.Schema.SPAN_ID;
import static tracelog.storage.jdbc.Schema.START_TIME;
import static tracelog.storage.jdbc.Schema.TRACE_ID;

final class JdbcSpanConsumer implements SpanConsumer {
  final DataSourceCall.Factory dataSourceCallFactory;

  JdbcSpanConsumer(DataSourceCall.Factory dataSourceCallFactory) {
    this.dataSourceCallFactory = dataSourceCallFactory;
  }

  @Override public Call<Void> accept(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    return dataSourceCallFactory.create(new InsertSpan(span));
  }

  /** A span ID already stored fails with a constraint violation. */
  static final class InsertSpan implements Function<DSLContext, Void> {
    final Span span;

    InsertSpan(Span span) {
      this.span = span;
    }

    @Override public Void apply(DSLContext create) {
      create.insertInto(SPANS)
        .set(SPAN_ID, span.spanId())
        .set(TRACE_ID, span.traceId())
        .set(PARENT_SPAN_ID, span.parentSpanId())
        .set(NAME, span.name())
        .set(START_TIME, span.startTime())
        .set(END_TIME, span.endTime())
        .set(SPAN_ATTRIBUTES, span.attributes())
        .set(SERVICE_NAME, span.serviceName())
        .set(HAS_ERROR, span.hasError())
        .execute();
      return null;
    }

    @Override public String toString() {
      return "InsertSpan{spanId=" + span.spanId() + "}";
    }
  }
}
