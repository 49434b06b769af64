/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.server;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import tracelog.collector.CollectorMetrics;
import tracelog.internal.Nullable;

/**
 * Reports collector activity to Micrometer, tagged by transport ("span" or "log"):
 *
 * <ul>
 *   <li>tracelog_collector.messages - cumulative log payloads received</li>
 *   <li>tracelog_collector.messages_dropped - payloads that were not JSON objects</li>
 *   <li>tracelog_collector.bytes - cumulative payload bytes</li>
 *   <li>tracelog_collector.records - cumulative spans or log records offered to the queue</li>
 *   <li>tracelog_collector.records_dropped - records dropped on a full queue, after shutdown or
 *   by storage failures</li>
 *   <li>tracelog_collector.message_bytes - size of the last payload</li>
 * </ul>
 */
final class MicrometerCollectorMetrics implements CollectorMetrics {

  final MeterRegistry registryInstance;
  final Counter messages, messagesDropped, bytes, records, recordsDropped;
  final AtomicInteger messageBytes;

  MicrometerCollectorMetrics(MeterRegistry registry) {
    this(null, registry);
  }

  MicrometerCollectorMetrics(@Nullable String transport, MeterRegistry meterRegistry) {
    this.registryInstance = meterRegistry;
    if (transport == null) {
      messages = messagesDropped = bytes = records = recordsDropped = null;
      messageBytes = null;
      return;
    }
    this.messages = Counter.builder("tracelog_collector.messages")
      .description("cumulative amount of messages received")
      .tag("transport", transport)
      .register(registryInstance);
    this.messagesDropped = Counter.builder("tracelog_collector.messages_dropped")
      .description("cumulative amount of messages received that could not be decoded")
      .tag("transport", transport)
      .register(registryInstance);
    this.bytes = Counter.builder("tracelog_collector.bytes")
      .description("cumulative amount of bytes received")
      .tag("transport", transport)
      .baseUnit("bytes")
      .register(registryInstance);
    this.records = Counter.builder("tracelog_collector.records")
      .description("cumulative amount of records received")
      .tag("transport", transport)
      .register(registryInstance);
    this.recordsDropped = Counter.builder("tracelog_collector.records_dropped")
      .description("cumulative amount of records received that were not stored")
      .tag("transport", transport)
      .register(registryInstance);

    this.messageBytes = new AtomicInteger(0);
    Gauge.builder("tracelog_collector.message_bytes", messageBytes, AtomicInteger::get)
      .description("size of the last message received")
      .tag("transport", transport)
      .baseUnit("bytes")
      .register(registryInstance);
  }

  @Override public MicrometerCollectorMetrics forTransport(String transportType) {
    if (transportType == null) throw new NullPointerException("transportType == null");
    return new MicrometerCollectorMetrics(transportType, registryInstance);
  }

  @Override public void incrementMessages() {
    checkScoped();
    messages.increment();
  }

  @Override public void incrementMessagesDropped() {
    checkScoped();
    messagesDropped.increment();
  }

  @Override public void incrementBytes(int quantity) {
    checkScoped();
    messageBytes.set(quantity);
    bytes.increment(quantity);
  }

  @Override public void incrementRecords(int quantity) {
    checkScoped();
    records.increment(quantity);
  }

  @Override public void incrementRecordsDropped(int quantity) {
    checkScoped();
    recordsDropped.increment(quantity);
  }

  void checkScoped() {
    if (messages == null) {
      throw new IllegalStateException("always scope with MicrometerCollectorMetrics.forTransport");
    }
  }
}
