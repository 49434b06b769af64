/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import tracelog.LogRecord;
import tracelog.internal.Nullable;

/**
 * Structural filters over stored log records, composed with AND semantics. Absent filters match
 * everything. Free-text search is not part of this request: it runs after the page is fetched.
 */
public final class LogQueryRequest {
  @Nullable final String level, traceId;
  @Nullable final Long startTime, endTime;
  final int limit, offset;

  /** Exact match on {@link LogRecord#level()}. */
  @Nullable public String level() {
    return level;
  }

  /** Exact match on {@link LogRecord#traceId()}. */
  @Nullable public String traceId() {
    return traceId;
  }

  /** Inclusive lower bound on {@link LogRecord#timestamp()}. */
  @Nullable public Long startTime() {
    return startTime;
  }

  /** Inclusive upper bound on {@link LogRecord#timestamp()}. */
  @Nullable public Long endTime() {
    return endTime;
  }

  public int limit() {
    return limit;
  }

  public int offset() {
    return offset;
  }

  /** True if any filter is set. Storage can use an unfiltered statement otherwise. */
  public boolean hasFilters() {
    return level != null || traceId != null || startTime != null || endTime != null;
  }

  /** Returns true when the record passes every filter. Pagination is not considered. */
  public boolean test(LogRecord record) {
    if (level != null && !level.equals(record.level())) return false;
    if (traceId != null && !traceId.equals(record.traceId())) return false;
    if (startTime != null && record.timestamp() < startTime) return false;
    return endTime == null || record.timestamp() <= endTime;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String level, traceId;
    Long startTime, endTime;
    int limit = 100, offset;

    Builder() {
    }

    Builder(LogQueryRequest source) {
      level = source.level;
      traceId = source.traceId;
      startTime = source.startTime;
      endTime = source.endTime;
      limit = source.limit;
      offset = source.offset;
    }

    /** Empty is treated as absent. */
    public Builder level(@Nullable String level) {
      this.level = level == null || level.isEmpty() ? null : level;
      return this;
    }

    /** Empty is treated as absent. */
    public Builder traceId(@Nullable String traceId) {
      this.traceId = traceId == null || traceId.isEmpty() ? null : traceId;
      return this;
    }

    public Builder startTime(@Nullable Long startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder endTime(@Nullable Long endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public LogQueryRequest build() {
      if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
      if (offset < 0) throw new IllegalArgumentException("offset < 0");
      return new LogQueryRequest(this);
    }
  }

  LogQueryRequest(Builder builder) {
    level = builder.level;
    traceId = builder.traceId;
    startTime = builder.startTime;
    endTime = builder.endTime;
    limit = builder.limit;
    offset = builder.offset;
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder("LogQueryRequest{");
    if (level != null) result.append("level=").append(level).append(", ");
    if (traceId != null) result.append("traceId=").append(traceId).append(", ");
    if (startTime != null) result.append("startTime=").append(startTime).append(", ");
    if (endTime != null) result.append("endTime=").append(endTime).append(", ");
    return result.append("limit=").append(limit).append(", offset=").append(offset).append("}")
      .toString();
  }
}
