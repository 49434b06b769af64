/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import tracelog.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tracelog.collector.TestObjects.utf8;

class LogRecordParserTest {
  static final Instant NOW = Instant.parse("2024-06-01T08:30:00Z");
  static final long NOW_NANOS = NOW.getEpochSecond() * 1_000_000_000L;

  LogRecordParser parser = new LogRecordParser(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test void parse_liftsWellKnownFields() {
    LogRecord record = parser.parse(utf8("""
      {
        "level": "warn",
        "message": "slow query",
        "time": "2024-01-01T12:00:00.123456789Z",
        "trace_id": "4bf92f3577b34da6a3ce929d0e0e4736",
        "span_id": "00f067aa0ba902b7",
        "db": "orders",
        "rows": 12
      }
      """));

    assertThat(record.level()).isEqualTo("warn");
    assertThat(record.message()).isEqualTo("slow query");
    assertThat(record.timestamp())
      .isEqualTo(Instant.parse("2024-01-01T12:00:00Z").getEpochSecond() * 1_000_000_000L
        + 123_456_789L);
    assertThat(record.traceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
    assertThat(record.spanId()).isEqualTo("00f067aa0ba902b7");
    assertThat(record.attributes()).isEqualTo("{\"db\":\"orders\",\"rows\":12}");
    assertThat(record.id()).isZero();
  }

  @Test void parse_defaults() {
    LogRecord record = parser.parse(utf8("{}"));

    assertThat(record.level()).isEqualTo("info");
    assertThat(record.message()).isEqualTo("unknown");
    assertThat(record.timestamp()).isEqualTo(NOW_NANOS);
    assertThat(record.traceId()).isNull();
    assertThat(record.spanId()).isNull();
    assertThat(record.attributes()).isNull();
  }

  @Test void parse_timestampFieldWhenNoTime() {
    LogRecord record = parser.parse(utf8("{\"timestamp\":\"2024-01-01T13:00:00+01:00\"}"));

    assertThat(record.timestamp())
      .isEqualTo(Instant.parse("2024-01-01T12:00:00Z").getEpochSecond() * 1_000_000_000L);
  }

  @Test void parse_timePreferredOverTimestamp() {
    LogRecord record = parser.parse(utf8(
      "{\"time\":\"2024-01-01T12:00:00Z\",\"timestamp\":\"2030-01-01T00:00:00Z\"}"));

    assertThat(record.timestamp())
      .isEqualTo(Instant.parse("2024-01-01T12:00:00Z").getEpochSecond() * 1_000_000_000L);
    assertThat(record.attributes()).isNull();
  }

  @Test void parse_numericTimeFallsBackToTimestampField() {
    LogRecord record = parser.parse(utf8(
      "{\"time\":1704110400,\"timestamp\":\"2024-01-01T12:00:00Z\"}"));

    assertThat(record.timestamp())
      .isEqualTo(Instant.parse("2024-01-01T12:00:00Z").getEpochSecond() * 1_000_000_000L);
  }

  @Test void parse_unparsableTimeIsNow() {
    LogRecord record = parser.parse(utf8("{\"time\":\"yesterday\"}"));

    assertThat(record.timestamp()).isEqualTo(NOW_NANOS);
  }

  @Test void parse_nonTextualWellKnownFieldsUseDefaults() {
    LogRecord record = parser.parse(utf8(
      "{\"level\":30,\"message\":null,\"trace_id\":7,\"span_id\":\"\"}"));

    assertThat(record.level()).isEqualTo("info");
    assertThat(record.message()).isEqualTo("unknown");
    assertThat(record.traceId()).isNull();
    assertThat(record.spanId()).isNull();
    assertThat(record.attributes()).isNull();
  }

  @Test void parse_keepsNestedAttributes() {
    LogRecord record = parser.parse(utf8(
      "{\"message\":\"hi\",\"http\":{\"status\":500,\"retry\":[1,2]},\"ok\":false}"));

    assertThat(record.attributes())
      .isEqualTo("{\"http\":{\"status\":500,\"retry\":[1,2]},\"ok\":false}");
  }

  @Test void parse_malformed() {
    assertThatThrownBy(() -> parser.parse(utf8("{invalid json}")))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("Malformed reading log record from json");
  }

  @Test void parse_trailingTokensAreMalformed() {
    assertThatThrownBy(() -> parser.parse(utf8("{\"message\":\"hi\"} not json")))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("Malformed reading log record from json");
    assertThatThrownBy(() -> parser.parse(utf8("{\"message\":\"a\"}{\"message\":\"b\"}")))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("Malformed reading log record from json");
  }

  @Test void parse_trailingNewline() {
    assertThat(parser.parse(utf8("{\"message\":\"hi\"}\n")).message()).isEqualTo("hi");
  }

  @Test void parse_notAnObject() {
    assertThatThrownBy(() -> parser.parse(utf8("[1,2]")))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("Expected a json object, not ARRAY");
  }

  @Test void parse_empty() {
    assertThatThrownBy(() -> parser.parse(new byte[0]))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("Expected a json object, not empty input");
  }
}
