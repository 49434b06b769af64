/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog;

import tracelog.internal.Nullable;

/**
 * A span is one timed unit of work within a trace. Spans that share a {@link #traceId()} belong to
 * the same trace. A span without a {@link #parentSpanId() parent} is a root span.
 *
 * <p>Times are epoch nanoseconds. {@link #durationNs()} is derived from the start and end times and
 * is never stored separately on this type.
 */
// @Immutable
public final class Span {
  static final String EMPTY_ATTRIBUTES = "{}";
  static final String UNKNOWN_SERVICE = "unknown";

  final String spanId, traceId, parentSpanId, name, attributes, serviceName;
  final long startTime, endTime;
  final boolean hasError;

  /** Unique within a trace. */
  public String spanId() {
    return spanId;
  }

  /** Groups spans belonging to one distributed operation. */
  public String traceId() {
    return traceId;
  }

  /** The parent's span ID or null if this is a root span. */
  @Nullable public String parentSpanId() {
    return parentSpanId;
  }

  /** True when this span has no parent. */
  public boolean isRoot() {
    return parentSpanId == null;
  }

  /** Operation name, empty when unknown. */
  public String name() {
    return name;
  }

  /** Epoch nanoseconds when this span started. */
  public long startTime() {
    return startTime;
  }

  /** Epoch nanoseconds when this span finished. */
  public long endTime() {
    return endTime;
  }

  /** {@link #endTime()} minus {@link #startTime()}. */
  public long durationNs() {
    return endTime - startTime;
  }

  /** Arbitrary key/value attributes, serialized as a JSON object. Defaults to {@code {}}. */
  public String attributes() {
    return attributes;
  }

  /** The service that recorded this span, or "unknown". */
  public String serviceName() {
    return serviceName;
  }

  /** True when the span ended with an error status. */
  public boolean hasError() {
    return hasError;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    String spanId, traceId, parentSpanId, name = "", attributes = EMPTY_ATTRIBUTES,
      serviceName = UNKNOWN_SERVICE;
    long startTime, endTime;
    boolean hasError;

    Builder() {
    }

    Builder(Span source) {
      spanId = source.spanId;
      traceId = source.traceId;
      parentSpanId = source.parentSpanId;
      name = source.name;
      attributes = source.attributes;
      serviceName = source.serviceName;
      startTime = source.startTime;
      endTime = source.endTime;
      hasError = source.hasError;
    }

    /** @see Span#spanId() */
    public Builder spanId(String spanId) {
      if (spanId == null) throw new NullPointerException("spanId == null");
      if (spanId.isEmpty()) throw new IllegalArgumentException("spanId is empty");
      this.spanId = spanId;
      return this;
    }

    /** @see Span#traceId() */
    public Builder traceId(String traceId) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      if (traceId.isEmpty()) throw new IllegalArgumentException("traceId is empty");
      this.traceId = traceId;
      return this;
    }

    /** Null or empty marks a root span. */
    public Builder parentSpanId(@Nullable String parentSpanId) {
      this.parentSpanId = parentSpanId == null || parentSpanId.isEmpty() ? null : parentSpanId;
      return this;
    }

    /** @see Span#name() */
    public Builder name(@Nullable String name) {
      this.name = name != null ? name : "";
      return this;
    }

    /** @see Span#startTime() */
    public Builder startTime(long startTime) {
      this.startTime = startTime;
      return this;
    }

    /** @see Span#endTime() */
    public Builder endTime(long endTime) {
      this.endTime = endTime;
      return this;
    }

    /** JSON object text. Null or empty resets to {@code {}}. */
    public Builder attributes(@Nullable String attributes) {
      this.attributes =
        attributes == null || attributes.isEmpty() ? EMPTY_ATTRIBUTES : attributes;
      return this;
    }

    /** Null or empty resets to "unknown". */
    public Builder serviceName(@Nullable String serviceName) {
      this.serviceName =
        serviceName == null || serviceName.isEmpty() ? UNKNOWN_SERVICE : serviceName;
      return this;
    }

    /** @see Span#hasError() */
    public Builder hasError(boolean hasError) {
      this.hasError = hasError;
      return this;
    }

    public Span build() {
      String missing = "";
      if (traceId == null) missing += " traceId";
      if (spanId == null) missing += " spanId";
      if (!"".equals(missing)) throw new IllegalStateException("Missing :" + missing);
      return new Span(this);
    }
  }

  Span(Builder builder) {
    spanId = builder.spanId;
    traceId = builder.traceId;
    // prevent self-referencing spans
    parentSpanId = builder.spanId.equals(builder.parentSpanId) ? null : builder.parentSpanId;
    name = builder.name;
    attributes = builder.attributes;
    serviceName = builder.serviceName;
    startTime = builder.startTime;
    endTime = builder.endTime;
    hasError = builder.hasError;
  }

  @Override public String toString() {
    return "Span{traceId=" + traceId + ", spanId=" + spanId
      + (parentSpanId != null ? ", parentSpanId=" + parentSpanId : "")
      + ", name=" + name + ", serviceName=" + serviceName
      + ", startTime=" + startTime + ", endTime=" + endTime
      + ", hasError=" + hasError + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Span)) return false;
    Span that = (Span) o;
    return spanId.equals(that.spanId)
      && traceId.equals(that.traceId)
      && (parentSpanId == null ? that.parentSpanId == null : parentSpanId.equals(that.parentSpanId))
      && name.equals(that.name)
      && startTime == that.startTime
      && endTime == that.endTime
      && attributes.equals(that.attributes)
      && serviceName.equals(that.serviceName)
      && hasError == that.hasError;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= spanId.hashCode();
    h *= 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= (parentSpanId == null) ? 0 : parentSpanId.hashCode();
    h *= 1000003;
    h ^= name.hashCode();
    h *= 1000003;
    h ^= (int) ((startTime >>> 32) ^ startTime);
    h *= 1000003;
    h ^= (int) ((endTime >>> 32) ^ endTime);
    h *= 1000003;
    h ^= attributes.hashCode();
    h *= 1000003;
    h ^= serviceName.hashCode();
    h *= 1000003;
    h ^= hasError ? 1231 : 1237;
    return h;
  }
}
