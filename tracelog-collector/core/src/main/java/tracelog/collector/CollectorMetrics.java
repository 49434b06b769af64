/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

/**
 * Callbacks invoked by collectors to make ingestion visible. A typical implementation reports
 * counters to a telemetry system.
 *
 * <h3>Key relationships</h3>
 *
 * <ul>
 *   <li>Stored records = {@link #incrementRecords(int) accepted records} - {@link
 *   #incrementRecordsDropped(int) dropped records}. Records are dropped when the queue is full,
 *   when the collector is shut down or when storage rejects them.</li>
 *   <li>Readable messages = {@link #incrementMessages() messages} - {@link
 *   #incrementMessagesDropped() dropped messages}. Only collectors that decode raw payloads report
 *   messages and bytes.</li>
 * </ul>
 */
public interface CollectorMetrics {

  /**
   * Scopes metrics to one ingestion path, such as "span" or "log", so that an implementation can
   * include it in the metric key.
   */
  CollectorMetrics forTransport(String transportType);

  /** Increments count of raw payloads received, such as one encoded log line. */
  void incrementMessages();

  /** Increments count of payloads that could not be read, such as malformed JSON. */
  void incrementMessagesDropped();

  /** Increments the count of payload bytes received. */
  void incrementBytes(int quantity);

  /** Increments the count of records offered to the collector's queue. */
  void incrementRecords(int quantity);

  /** Increments the count of records that will never be stored. */
  void incrementRecordsDropped(int quantity);

  CollectorMetrics NOOP_METRICS = new CollectorMetrics() {
    @Override public CollectorMetrics forTransport(String transportType) {
      return this;
    }

    @Override public void incrementMessages() {
    }

    @Override public void incrementMessagesDropped() {
    }

    @Override public void incrementBytes(int quantity) {
    }

    @Override public void incrementRecords(int quantity) {
    }

    @Override public void incrementRecordsDropped(int quantity) {
    }

    @Override public String toString() {
      return "NoOpCollectorMetrics";
    }
  };
}
