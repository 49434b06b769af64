/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import tracelog.internal.Nullable;

/** Counts in memory, for tests and for processes without a metrics system. */
public final class InMemoryCollectorMetrics implements CollectorMetrics {

  final ConcurrentHashMap<String, AtomicInteger> metrics;
  final String messages, messagesDropped, bytes, records, recordsDropped;

  public InMemoryCollectorMetrics() {
    this(new ConcurrentHashMap<>(), null);
  }

  InMemoryCollectorMetrics(ConcurrentHashMap<String, AtomicInteger> metrics,
    @Nullable String transport) {
    this.metrics = metrics;
    this.messages = scope("messages", transport);
    this.messagesDropped = scope("messagesDropped", transport);
    this.bytes = scope("bytes", transport);
    this.records = scope("records", transport);
    this.recordsDropped = scope("recordsDropped", transport);
  }

  /** Returns a view that shares counters with this one, under keys suffixed by the transport. */
  @Override public InMemoryCollectorMetrics forTransport(String transportType) {
    if (transportType == null) throw new NullPointerException("transportType == null");
    return new InMemoryCollectorMetrics(metrics, transportType);
  }

  @Override public void incrementMessages() {
    increment(messages, 1);
  }

  public int messages() {
    return get(messages);
  }

  @Override public void incrementMessagesDropped() {
    increment(messagesDropped, 1);
  }

  public int messagesDropped() {
    return get(messagesDropped);
  }

  @Override public void incrementBytes(int quantity) {
    increment(bytes, quantity);
  }

  public int bytes() {
    return get(bytes);
  }

  @Override public void incrementRecords(int quantity) {
    increment(records, quantity);
  }

  public int records() {
    return get(records);
  }

  @Override public void incrementRecordsDropped(int quantity) {
    increment(recordsDropped, quantity);
  }

  public int recordsDropped() {
    return get(recordsDropped);
  }

  public void clear() {
    metrics.clear();
  }

  int get(String key) {
    AtomicInteger atomic = metrics.get(key);
    return atomic == null ? 0 : atomic.get();
  }

  void increment(String key, int quantity) {
    if (quantity == 0) return;
    metrics.computeIfAbsent(key, k -> new AtomicInteger()).addAndGet(quantity);
  }

  static String scope(String key, @Nullable String transport) {
    return key + (transport == null ? "" : "." + transport);
  }

  @Override public String toString() {
    return "InMemoryCollectorMetrics{" + metrics + "}";
  }
}
