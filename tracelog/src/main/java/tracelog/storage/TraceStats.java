/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

/** Aggregate counts over all spans sharing a trace ID. */
// @Immutable
public final class TraceStats {
  public static TraceStats create(String traceId, long spanCount, long errorCount) {
    return new TraceStats(traceId, spanCount, errorCount);
  }

  final String traceId;
  final long spanCount, errorCount;

  TraceStats(String traceId, long spanCount, long errorCount) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    if (errorCount > spanCount) throw new IllegalArgumentException("errorCount > spanCount");
    this.traceId = traceId;
    this.spanCount = spanCount;
    this.errorCount = errorCount;
  }

  public String traceId() {
    return traceId;
  }

  public long spanCount() {
    return spanCount;
  }

  /** Count of spans in the trace with {@link tracelog.Span#hasError()} set. */
  public long errorCount() {
    return errorCount;
  }

  @Override public String toString() {
    return "TraceStats{traceId=" + traceId + ", spanCount=" + spanCount
      + ", errorCount=" + errorCount + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceStats)) return false;
    TraceStats that = (TraceStats) o;
    return traceId.equals(that.traceId)
      && spanCount == that.spanCount
      && errorCount == that.errorCount;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= (int) ((spanCount >>> 32) ^ spanCount);
    h *= 1000003;
    h ^= (int) ((errorCount >>> 32) ^ errorCount);
    return h;
  }
}
