/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import java.util.Collection;
import java.util.List;
import tracelog.Call;
import tracelog.Span;

/** Read side of span storage. Nothing here mutates stored data. */
public interface SpanStore {

  /**
   * Returns root spans (those without a parent), ordered by {@link Span#startTime()} descending.
   *
   * @param limit maximum spans to return, at least one
   * @param offset count of root spans to skip
   */
  Call<List<Span>> getRootSpans(int limit, int offset);

  /**
   * Returns span and error counts for each of the given trace IDs that has any spans. Order is
   * unspecified.
   */
  Call<List<TraceStats>> getTraceStats(Collection<String> traceIds);

  /** Counts distinct trace IDs among root spans. */
  Call<Long> countTraces();

  /**
   * Returns all spans that share the trace ID, ordered by {@link Span#startTime()} ascending, or
   * empty if none are found.
   */
  Call<List<Span>> getTrace(String traceId);
}
