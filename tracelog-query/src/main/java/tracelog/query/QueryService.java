/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracelog.Call;
import tracelog.LogRecord;
import tracelog.Span;
import tracelog.storage.LogStore;
import tracelog.storage.SpanStore;
import tracelog.storage.StorageComponent;
import tracelog.storage.TenantStorageManager;
import tracelog.storage.TraceStats;

import static tracelog.Call.propagateIfFatal;

/**
 * Read side of tenant storage. Reads run on the caller's thread and are independent of the
 * collectors writing to the same storage.
 *
 * <p>A failure to count results degrades the total to zero, as the page itself is still useful. A
 * failure to read the page propagates.
 */
public final class QueryService {
  static final Logger LOG = LoggerFactory.getLogger(QueryService.class);

  public static QueryService create(TenantStorageManager storageManager) {
    if (storageManager == null) throw new NullPointerException("storageManager == null");
    return new QueryService(storageManager);
  }

  final TenantStorageManager storageManager;

  QueryService(TenantStorageManager storageManager) {
    this.storageManager = storageManager;
  }

  /**
   * Returns a page of root spans, newest first, each joined with the counts of its trace. The name
   * and error filters apply to the page, after the counts are read.
   */
  public QueryResult<TraceSummary> listTraces(String tenant, TraceQuery query) throws IOException {
    if (query == null) throw new NullPointerException("query == null");
    SpanStore spanStore = storage(tenant).spanStore();

    List<Span> roots = spanStore.getRootSpans(query.limit(), query.offset()).execute();
    Set<String> traceIds = new LinkedHashSet<>();
    for (Span root : roots) traceIds.add(root.traceId());
    Map<String, TraceStats> statsByTraceId = new LinkedHashMap<>();
    for (TraceStats stats : spanStore.getTraceStats(traceIds).execute()) {
      statsByTraceId.put(stats.traceId(), stats);
    }

    String nameFilter = query.q() != null ? query.q().toLowerCase(Locale.ROOT) : null;
    List<TraceSummary> data = new ArrayList<>();
    for (Span root : roots) {
      if (nameFilter != null && !root.name().toLowerCase(Locale.ROOT).contains(nameFilter)) {
        continue;
      }
      TraceStats stats = statsByTraceId.get(root.traceId());
      if (stats == null) stats = TraceStats.create(root.traceId(), 1, 0); // root alone
      TraceSummary summary = TraceSummary.create(root, stats);
      if (query.hasError() != null && query.hasError() != summary.hasError()) continue;
      data.add(summary);
    }

    long total = count(spanStore.countTraces(), tenant);
    return QueryResult.create(data, total, query.limit(), query.offset());
  }

  /**
   * Returns every span of the trace, ordered by start time.
   *
   * @throws TraceNotFoundException if storage holds no span of the trace
   */
  public TraceDetail getTrace(String tenant, String traceId) throws IOException {
    if (traceId == null) throw new NullPointerException("traceId == null");
    if (traceId.isEmpty()) throw new IllegalArgumentException("traceId is empty");
    List<Span> spans = storage(tenant).spanStore().getTrace(traceId).execute();
    if (spans.isEmpty()) throw new TraceNotFoundException(traceId);
    return new TraceDetail(traceId, spans);
  }

  /**
   * Returns a page of log records, newest first. The total counts structural matches, ignoring the
   * free text filter.
   */
  public QueryResult<LogRecord> listLogs(String tenant, LogQuery query) throws IOException {
    if (query == null) throw new NullPointerException("query == null");
    LogStore logStore = storage(tenant).logStore();

    List<LogRecord> page = logStore.getLogs(query.request()).execute();
    List<LogRecord> data = new ArrayList<>(page.size());
    for (LogRecord record : page) {
      if (query.matchesText(record)) data.add(record);
    }

    long total = count(logStore.countLogs(query.request()), tenant);
    return QueryResult.create(data, total, query.request().limit(), query.request().offset());
  }

  StorageComponent storage(String tenant) throws IOException {
    if (tenant == null) throw new NullPointerException("tenant == null");
    return storageManager.get(tenant);
  }

  static long count(Call<Long> call, String tenant) {
    try {
      Long result = call.execute();
      return result != null ? result : 0L;
    } catch (Throwable e) {
      propagateIfFatal(e);
      LOG.warn("Could not count results for tenant {}: reporting total 0", tenant, e);
      return 0L;
    }
  }

  @Override public String toString() {
    return "QueryService{" + storageManager + "}";
  }
}
