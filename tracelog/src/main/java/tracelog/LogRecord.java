/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog;

import tracelog.internal.Nullable;

/**
 * A structured log line. When {@link #traceId()} is set, the record correlates to a trace which may
 * or may not exist in storage: correlation is best effort.
 */
// @Immutable
public final class LogRecord {
  public static final String DEFAULT_LEVEL = "info";
  public static final String DEFAULT_MESSAGE = "unknown";

  final long id, timestamp;
  final String level, message, traceId, spanId, attributes;

  /** Assigned by storage, monotonically. Zero until the record is persisted. */
  public long id() {
    return id;
  }

  /** Epoch nanoseconds. */
  public long timestamp() {
    return timestamp;
  }

  public String level() {
    return level;
  }

  public String message() {
    return message;
  }

  @Nullable public String traceId() {
    return traceId;
  }

  @Nullable public String spanId() {
    return spanId;
  }

  /**
   * Fields of the original payload that aren't modeled above, as a JSON object, or null if there
   * were none.
   */
  @Nullable public String attributes() {
    return attributes;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    long id, timestamp;
    String level = DEFAULT_LEVEL, message = DEFAULT_MESSAGE, traceId, spanId, attributes;

    Builder() {
    }

    Builder(LogRecord source) {
      id = source.id;
      timestamp = source.timestamp;
      level = source.level;
      message = source.message;
      traceId = source.traceId;
      spanId = source.spanId;
      attributes = source.attributes;
    }

    public Builder id(long id) {
      if (id < 0L) throw new IllegalArgumentException("id < 0");
      this.id = id;
      return this;
    }

    public Builder timestamp(long timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder level(String level) {
      if (level == null) throw new NullPointerException("level == null");
      this.level = level;
      return this;
    }

    public Builder message(String message) {
      if (message == null) throw new NullPointerException("message == null");
      this.message = message;
      return this;
    }

    /** Empty is treated as absent. */
    public Builder traceId(@Nullable String traceId) {
      this.traceId = traceId == null || traceId.isEmpty() ? null : traceId;
      return this;
    }

    /** Empty is treated as absent. */
    public Builder spanId(@Nullable String spanId) {
      this.spanId = spanId == null || spanId.isEmpty() ? null : spanId;
      return this;
    }

    public Builder attributes(@Nullable String attributes) {
      this.attributes = attributes == null || attributes.isEmpty() ? null : attributes;
      return this;
    }

    public LogRecord build() {
      return new LogRecord(this);
    }
  }

  LogRecord(Builder builder) {
    id = builder.id;
    timestamp = builder.timestamp;
    level = builder.level;
    message = builder.message;
    traceId = builder.traceId;
    spanId = builder.spanId;
    attributes = builder.attributes;
  }

  @Override public String toString() {
    return "LogRecord{id=" + id + ", timestamp=" + timestamp + ", level=" + level
      + ", message=" + message
      + (traceId != null ? ", traceId=" + traceId : "")
      + (spanId != null ? ", spanId=" + spanId : "")
      + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof LogRecord)) return false;
    LogRecord that = (LogRecord) o;
    return id == that.id
      && timestamp == that.timestamp
      && level.equals(that.level)
      && message.equals(that.message)
      && (traceId == null ? that.traceId == null : traceId.equals(that.traceId))
      && (spanId == null ? that.spanId == null : spanId.equals(that.spanId))
      && (attributes == null ? that.attributes == null : attributes.equals(that.attributes));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((id >>> 32) ^ id);
    h *= 1000003;
    h ^= (int) ((timestamp >>> 32) ^ timestamp);
    h *= 1000003;
    h ^= level.hashCode();
    h *= 1000003;
    h ^= message.hashCode();
    h *= 1000003;
    h ^= (traceId == null) ? 0 : traceId.hashCode();
    h *= 1000003;
    h ^= (spanId == null) ? 0 : spanId.hashCode();
    h *= 1000003;
    h ^= (attributes == null) ? 0 : attributes.hashCode();
    return h;
  }
}
