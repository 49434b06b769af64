/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import tracelog.Span;
import tracelog.storage.TraceStats;

/** A trace as listed: its root span joined with counts over all of its spans. */
public final class TraceSummary {
  static TraceSummary create(Span root, TraceStats stats) {
    return new TraceSummary(root.traceId(), root.name(), root.startTime(),
      root.durationNs() / 1e6, stats.spanCount(), stats.errorCount());
  }

  final String traceId, rootSpanName;
  final long traceStartTime, spanCount, errorCount;
  final double durationMs;

  TraceSummary(String traceId, String rootSpanName, long traceStartTime, double durationMs,
    long spanCount, long errorCount) {
    this.traceId = traceId;
    this.rootSpanName = rootSpanName;
    this.traceStartTime = traceStartTime;
    this.durationMs = durationMs;
    this.spanCount = spanCount;
    this.errorCount = errorCount;
  }

  public String traceId() {
    return traceId;
  }

  public String rootSpanName() {
    return rootSpanName;
  }

  /** Epoch nanoseconds of the root span start. */
  public long traceStartTime() {
    return traceStartTime;
  }

  /** Duration of the root span, with sub-millisecond precision. */
  public double durationMs() {
    return durationMs;
  }

  public long spanCount() {
    return spanCount;
  }

  public long errorCount() {
    return errorCount;
  }

  public boolean hasError() {
    return errorCount > 0;
  }

  @Override public String toString() {
    return "TraceSummary{traceId=" + traceId + ", rootSpanName=" + rootSpanName
      + ", spanCount=" + spanCount + ", errorCount=" + errorCount + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceSummary)) return false;
    TraceSummary that = (TraceSummary) o;
    return traceId.equals(that.traceId)
      && rootSpanName.equals(that.rootSpanName)
      && traceStartTime == that.traceStartTime
      && Double.compare(durationMs, that.durationMs) == 0
      && spanCount == that.spanCount
      && errorCount == that.errorCount;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= rootSpanName.hashCode();
    h *= 1000003;
    h ^= Long.hashCode(traceStartTime);
    h *= 1000003;
    h ^= Double.hashCode(durationMs);
    h *= 1000003;
    h ^= Long.hashCode(spanCount);
    h *= 1000003;
    h ^= Long.hashCode(errorCount);
    return h;
  }
}
