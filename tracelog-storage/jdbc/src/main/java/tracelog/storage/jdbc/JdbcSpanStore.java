/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Record3;
import tracelog.Call;
import tracelog.Span;
import tracelog.storage.SpanStore;
import tracelog.storage.TraceStats;

import static org.jooq.impl.DSL.count;
import static org.jooq.impl.DSL.countDistinct;
import static tracelog.storage.jdbc.Schema.HAS_ERROR;
import static tracelog.storage.jdbc.Schema.PARENT_SPAN_ID;
import static tracelog.storage.jdbc.Schema.SPANS;
import static tracelog.storage.jdbc.Schema.SPAN_FIELDS;
import static tracelog.storage.jdbc.Schema.START_TIME;
import static tracelog.storage.jdbc.Schema.TRACE_ID;

final class JdbcSpanStore implements SpanStore {
  /** Spans written with an empty parent ID by other tools are also roots. */
  static final Condition IS_ROOT = PARENT_SPAN_ID.isNull().or(PARENT_SPAN_ID.eq(""));

  final DataSourceCall.Factory dataSourceCallFactory;

  JdbcSpanStore(DataSourceCall.Factory dataSourceCallFactory) {
    this.dataSourceCallFactory = dataSourceCallFactory;
  }

  @Override public Call<List<Span>> getRootSpans(int limit, int offset) {
    if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
    if (offset < 0) throw new IllegalArgumentException("offset < 0");
    return dataSourceCallFactory.create(new SelectRootSpans(limit, offset));
  }

  @Override public Call<List<TraceStats>> getTraceStats(Collection<String> traceIds) {
    if (traceIds == null) throw new NullPointerException("traceIds == null");
    if (traceIds.isEmpty()) return Call.emptyList();
    return dataSourceCallFactory.create(new SelectTraceStats(new LinkedHashSet<>(traceIds)));
  }

  @Override public Call<Long> countTraces() {
    return dataSourceCallFactory.create(CountTraces.INSTANCE);
  }

  @Override public Call<List<Span>> getTrace(String traceId) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    if (traceId.isEmpty()) return Call.emptyList();
    return dataSourceCallFactory.create(new SelectTrace(traceId));
  }

  static final class SelectRootSpans implements Function<DSLContext, List<Span>> {
    final int limit, offset;

    SelectRootSpans(int limit, int offset) {
      this.limit = limit;
      this.offset = offset;
    }

    @Override public List<Span> apply(DSLContext context) {
      List<Span> result = new ArrayList<>();
      for (Record record : context.select(SPAN_FIELDS).from(SPANS)
        .where(IS_ROOT)
        .orderBy(START_TIME.desc())
        .limit(limit).offset(offset)
        .fetch()) {
        result.add(Schema.toSpan(record));
      }
      return result;
    }

    @Override public String toString() {
      return "SelectRootSpans{limit=" + limit + ", offset=" + offset + "}";
    }
  }

  static final class SelectTraceStats implements Function<DSLContext, List<TraceStats>> {
    final Set<String> traceIds;

    SelectTraceStats(Set<String> traceIds) {
      this.traceIds = traceIds;
    }

    @Override public List<TraceStats> apply(DSLContext context) {
      Field<Integer> spanCount = count();
      Field<Integer> errorCount = count().filterWhere(HAS_ERROR.isTrue());
      List<TraceStats> result = new ArrayList<>(traceIds.size());
      for (Record3<String, Integer, Integer> record : context
        .select(TRACE_ID, spanCount, errorCount)
        .from(SPANS)
        .where(TRACE_ID.in(traceIds))
        .groupBy(TRACE_ID)
        .fetch()) {
        result.add(TraceStats.create(record.value1(), record.value2(), record.value3()));
      }
      return result;
    }

    @Override public String toString() {
      return "SelectTraceStats{traceIds=" + traceIds + "}";
    }
  }

  enum CountTraces implements Function<DSLContext, Long> {
    INSTANCE;

    @Override public Long apply(DSLContext context) {
      Integer count = context.select(countDistinct(TRACE_ID)).from(SPANS)
        .where(IS_ROOT)
        .fetchOne(0, Integer.class);
      return count != null ? count.longValue() : 0L;
    }

    @Override public String toString() {
      return "CountTraces{}";
    }
  }

  static final class SelectTrace implements Function<DSLContext, List<Span>> {
    final String traceId;

    SelectTrace(String traceId) {
      this.traceId = traceId;
    }

    @Override public List<Span> apply(DSLContext context) {
      List<Span> result = new ArrayList<>();
      for (Record record : context.select(SPAN_FIELDS).from(SPANS)
        .where(TRACE_ID.eq(traceId))
        .orderBy(START_TIME.asc())
        .fetch()) {
        result.add(Schema.toSpan(record));
      }
      return result;
    }

    @Override public String toString() {
      return "SelectTrace{traceId=" + traceId + "}";
    }
  }
}
