/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.util.Map;
import org.junit.jupiter.api.Test;
import tracelog.LogRecord;
import tracelog.storage.LogQueryRequest;

import static org.assertj.core.api.Assertions.assertThat;

class LogQueryTest {

  @Test void fromParameters_defaults() {
    LogQuery query = LogQuery.fromParameters(Map.of());

    assertThat(query.request().hasFilters()).isFalse();
    assertThat(query.request().limit()).isEqualTo(100);
    assertThat(query.request().offset()).isZero();
    assertThat(query.q()).isNull();
  }

  @Test void fromParameters() {
    LogQuery query = LogQuery.fromParameters(Map.of(
      "level", "warn",
      "trace_id", "4bf92f3577b34da6a3ce929d0e0e4736",
      "start_time", "1704067200000000000",
      "end_time", "1704067300000000000",
      "q", "timeout",
      "limit", "50",
      "offset", "10"));

    LogQueryRequest request = query.request();
    assertThat(request.level()).isEqualTo("warn");
    assertThat(request.traceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
    assertThat(request.startTime()).isEqualTo(1704067200000000000L);
    assertThat(request.endTime()).isEqualTo(1704067300000000000L);
    assertThat(request.limit()).isEqualTo(50);
    assertThat(request.offset()).isEqualTo(10);
    assertThat(query.q()).isEqualTo("timeout");
  }

  @Test void fromParameters_unparsableTimesAreAbsent() {
    LogQuery query = LogQuery.fromParameters(Map.of("start_time", "yesterday", "level", ""));

    assertThat(query.request().startTime()).isNull();
    assertThat(query.request().level()).isNull();
  }

  @Test void matchesText_messageOrAttributes() {
    LogQuery query = LogQuery.fromParameters(Map.of("q", "Timeout"));

    assertThat(query.matchesText(LogRecord.newBuilder().message("read TIMEOUT").build())).isTrue();
    assertThat(query.matchesText(LogRecord.newBuilder()
      .attributes("{\"error\":\"socket timeout\"}").build())).isTrue();
    assertThat(query.matchesText(LogRecord.newBuilder().message("ok").build())).isFalse();
  }

  @Test void matchesText_noFilter() {
    assertThat(LogQuery.fromParameters(Map.of()).matchesText(LogRecord.newBuilder().build()))
      .isTrue();
  }
}
