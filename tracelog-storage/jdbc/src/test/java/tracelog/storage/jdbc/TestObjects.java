/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage.jdbc;

import tracelog.LogRecord;
import tracelog.Span;

final class TestObjects {
  static final long TODAY = 1_704_067_200_000_000_000L;
  static final long MILLIS = 1_000_000L;

  static final Span ROOT = Span.newBuilder()
    .traceId("4bf92f3577b34da6a3ce929d0e0e4736")
    .spanId("00f067aa0ba902b7")
    .name("GET /checkout")
    .serviceName("frontend")
    .startTime(TODAY)
    .endTime(TODAY + 250 * MILLIS)
    .attributes("{\"http.method\":\"GET\"}")
    .build();

  static final Span CHILD = Span.newBuilder()
    .traceId(ROOT.traceId())
    .spanId("b7ad6b7169203331")
    .parentSpanId(ROOT.spanId())
    .name("SELECT orders")
    .serviceName("backend")
    .startTime(TODAY + 10 * MILLIS)
    .endTime(TODAY + 90 * MILLIS)
    .hasError(true)
    .build();

  static final LogRecord LOG = LogRecord.newBuilder()
    .timestamp(TODAY + 20 * MILLIS)
    .level("error")
    .message("connection refused")
    .traceId(ROOT.traceId())
    .spanId(CHILD.spanId())
    .attributes("{\"db\":\"orders\"}")
    .build();

  static Span rootSpan(int i, long offsetMillis) {
    String id = String.format("%016x", i + 1);
    return Span.newBuilder()
      .traceId(id + id)
      .spanId(id)
      .name("operation-" + i)
      .startTime(TODAY + offsetMillis * MILLIS)
      .endTime(TODAY + (offsetMillis + 5) * MILLIS)
      .build();
  }

  TestObjects() {
  }
}
