/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import tracelog.Call;
import tracelog.LogRecord;
import tracelog.Span;
import tracelog.internal.ClosedComponentException;

/**
 * Storage that keeps all spans and log records in memory. Writes happen when the returned call is
 * executed, and are rejected the same way as durable storage: a span ID can only be stored once.
 *
 * <p>This is used in tests, and as the storage of a process that doesn't need durability.
 */
public final class InMemoryStorage extends StorageComponent
  implements SpanStore, SpanConsumer, LogStore, LogConsumer {

  static final Comparator<Span> START_TIME_DESCENDING =
    Comparator.comparingLong(Span::startTime).reversed();
  static final Comparator<Span> START_TIME_ASCENDING = Comparator.comparingLong(Span::startTime);
  static final Comparator<LogRecord> TIMESTAMP_DESCENDING =
    Comparator.comparingLong(LogRecord::timestamp).reversed()
      .thenComparing(Comparator.comparingLong(LogRecord::id).reversed());

  public static InMemoryStorage create() {
    return new InMemoryStorage();
  }

  /** Spans in insertion order, keyed on span ID. */
  final Map<String, Span> spansById = new LinkedHashMap<>();
  final List<LogRecord> logs = new ArrayList<>();
  long nextLogId = 1;
  volatile boolean closed;

  InMemoryStorage() {
  }

  @Override public SpanStore spanStore() {
    return this;
  }

  @Override public LogStore logStore() {
    return this;
  }

  @Override public SpanConsumer spanConsumer() {
    return this;
  }

  @Override public LogConsumer logConsumer() {
    return this;
  }

  public synchronized int acceptedSpanCount() {
    return spansById.size();
  }

  public synchronized int acceptedLogCount() {
    return logs.size();
  }

  /** Used for testing. Returns all spans in insertion order. */
  public synchronized List<Span> getSpans() {
    return new ArrayList<>(spansById.values());
  }

  /** Used for testing. Returns all log records in insertion order. */
  public synchronized List<LogRecord> getLogs() {
    return new ArrayList<>(logs);
  }

  public synchronized void clear() {
    spansById.clear();
    logs.clear();
    nextLogId = 1;
  }

  @Override public Call<Void> accept(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    return new StoreSpan(span);
  }

  @Override public Call<Void> accept(LogRecord record) {
    if (record == null) throw new NullPointerException("record == null");
    return new StoreLog(record);
  }

  synchronized void store(Span span) throws IOException {
    checkOpen();
    if (spansById.containsKey(span.spanId())) {
      throw new IOException("span " + span.spanId() + " already exists");
    }
    spansById.put(span.spanId(), span);
  }

  synchronized void store(LogRecord record) {
    checkOpen();
    logs.add(record.toBuilder().id(nextLogId++).build());
  }

  @Override public synchronized Call<List<Span>> getRootSpans(int limit, int offset) {
    checkPagination(limit, offset);
    List<Span> roots = new ArrayList<>();
    for (Span span : spansById.values()) {
      if (span.isRoot()) roots.add(span);
    }
    roots.sort(START_TIME_DESCENDING);
    return Call.create(page(roots, limit, offset));
  }

  @Override public synchronized Call<List<TraceStats>> getTraceStats(Collection<String> traceIds) {
    if (traceIds.isEmpty()) return Call.emptyList();
    Map<String, long[]> counts = new LinkedHashMap<>();
    for (Span span : spansById.values()) {
      if (!traceIds.contains(span.traceId())) continue;
      long[] count = counts.computeIfAbsent(span.traceId(), k -> new long[2]);
      count[0]++;
      if (span.hasError()) count[1]++;
    }
    List<TraceStats> result = new ArrayList<>(counts.size());
    for (Map.Entry<String, long[]> entry : counts.entrySet()) {
      result.add(TraceStats.create(entry.getKey(), entry.getValue()[0], entry.getValue()[1]));
    }
    return Call.create(result);
  }

  @Override public synchronized Call<Long> countTraces() {
    Set<String> traceIds = new LinkedHashSet<>();
    for (Span span : spansById.values()) {
      if (span.isRoot()) traceIds.add(span.traceId());
    }
    return Call.create((long) traceIds.size());
  }

  @Override public synchronized Call<List<Span>> getTrace(String traceId) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    List<Span> result = new ArrayList<>();
    for (Span span : spansById.values()) {
      if (span.traceId().equals(traceId)) result.add(span);
    }
    if (result.isEmpty()) return Call.emptyList();
    result.sort(START_TIME_ASCENDING);
    return Call.create(result);
  }

  @Override public synchronized Call<List<LogRecord>> getLogs(LogQueryRequest request) {
    List<LogRecord> result = matching(request);
    return Call.create(page(result, request.limit(), request.offset()));
  }

  @Override public synchronized Call<Long> countLogs(LogQueryRequest request) {
    return Call.create((long) matching(request).size());
  }

  List<LogRecord> matching(LogQueryRequest request) {
    if (request == null) throw new NullPointerException("request == null");
    List<LogRecord> result = new ArrayList<>();
    for (LogRecord record : logs) {
      if (request.test(record)) result.add(record);
    }
    result.sort(TIMESTAMP_DESCENDING);
    return result;
  }

  static <T> List<T> page(List<T> input, int limit, int offset) {
    if (offset >= input.size()) return new ArrayList<>();
    return new ArrayList<>(input.subList(offset, Math.min(input.size(), offset + limit)));
  }

  static void checkPagination(int limit, int offset) {
    if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
    if (offset < 0) throw new IllegalArgumentException("offset < 0");
  }

  void checkOpen() {
    if (closed) throw new ClosedComponentException();
  }

  @Override public void close() {
    closed = true;
  }

  @Override public String toString() {
    return "InMemoryStorage{}";
  }

  final class StoreSpan extends Call.Base<Void> {
    final Span span;

    StoreSpan(Span span) {
      this.span = span;
    }

    @Override protected Void doExecute() throws IOException {
      store(span);
      return null;
    }

    @Override public Call<Void> clone() {
      return new StoreSpan(span);
    }

    @Override public String toString() {
      return "StoreSpan{" + span + "}";
    }
  }

  final class StoreLog extends Call.Base<Void> {
    final LogRecord record;

    StoreLog(LogRecord record) {
      this.record = record;
    }

    @Override protected Void doExecute() {
      store(record);
      return null;
    }

    @Override public Call<Void> clone() {
      return new StoreLog(record);
    }

    @Override public String toString() {
      return "StoreLog{" + record + "}";
    }
  }
}
