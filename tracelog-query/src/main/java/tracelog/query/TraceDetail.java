/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.util.List;
import tracelog.Span;

/** All spans of one trace, ordered by start time. Never empty. */
public final class TraceDetail {
  final String traceId;
  final List<Span> spans;

  TraceDetail(String traceId, List<Span> spans) {
    this.traceId = traceId;
    this.spans = List.copyOf(spans);
  }

  public String traceId() {
    return traceId;
  }

  public List<Span> spans() {
    return spans;
  }

  @Override public String toString() {
    return "TraceDetail{traceId=" + traceId + ", spans=" + spans.size() + "}";
  }
}
