/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.server;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MicrometerCollectorMetricsTest {
  SimpleMeterRegistry registry = new SimpleMeterRegistry();
  MicrometerCollectorMetrics metrics = new MicrometerCollectorMetrics(registry);

  @Test void countsByTransport() {
    MicrometerCollectorMetrics spans = metrics.forTransport("span");
    MicrometerCollectorMetrics logs = metrics.forTransport("log");

    spans.incrementRecords(3);
    spans.incrementRecordsDropped(1);
    logs.incrementMessages();
    logs.incrementBytes(42);
    logs.incrementMessagesDropped();

    assertThat(count("tracelog_collector.records", "span")).isEqualTo(3.0);
    assertThat(count("tracelog_collector.records_dropped", "span")).isEqualTo(1.0);
    assertThat(count("tracelog_collector.records", "log")).isZero();
    assertThat(count("tracelog_collector.messages", "log")).isEqualTo(1.0);
    assertThat(count("tracelog_collector.bytes", "log")).isEqualTo(42.0);
    assertThat(count("tracelog_collector.messages_dropped", "log")).isEqualTo(1.0);
    assertThat(registry.get("tracelog_collector.message_bytes").tag("transport", "log").gauge()
      .value()).isEqualTo(42.0);
  }

  @Test void unscopedUseFails() {
    assertThatThrownBy(metrics::incrementMessages)
      .isInstanceOf(IllegalStateException.class);
  }

  double count(String name, String transport) {
    return registry.get(name).tag("transport", transport).counter().count();
  }
}
