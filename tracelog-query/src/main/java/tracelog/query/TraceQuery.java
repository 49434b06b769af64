/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.util.Map;
import tracelog.internal.Nullable;

/** Lists traces by their root spans, newest first. */
public final class TraceQuery {

  /**
   * Parses {@code limit}, {@code offset}, {@code q} and {@code has_error}. Values that don't parse
   * are treated as absent, so this never fails.
   */
  public static TraceQuery fromParameters(Map<String, String> parameters) {
    if (parameters == null) throw new NullPointerException("parameters == null");
    return newBuilder()
      .limit(QueryParameters.limit(parameters))
      .offset(QueryParameters.offset(parameters))
      .q(QueryParameters.string(parameters, "q"))
      .hasError(QueryParameters.bool(parameters, "has_error"))
      .build();
  }

  final int limit, offset;
  final String q;
  final Boolean hasError;

  /** Maximum root spans to read. Filters apply after, so fewer traces may return. */
  public int limit() {
    return limit;
  }

  public int offset() {
    return offset;
  }

  /** Case-insensitive substring of the root span name. */
  @Nullable public String q() {
    return q;
  }

  /** When set, only traces whose error status matches are returned. */
  @Nullable public Boolean hasError() {
    return hasError;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    int limit = QueryParameters.DEFAULT_LIMIT, offset;
    String q;
    Boolean hasError;

    Builder() {
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    /** Empty is treated as absent. */
    public Builder q(@Nullable String q) {
      this.q = q == null || q.isEmpty() ? null : q;
      return this;
    }

    public Builder hasError(@Nullable Boolean hasError) {
      this.hasError = hasError;
      return this;
    }

    public TraceQuery build() {
      if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
      if (offset < 0) throw new IllegalArgumentException("offset < 0");
      return new TraceQuery(this);
    }
  }

  TraceQuery(Builder builder) {
    limit = builder.limit;
    offset = builder.offset;
    q = builder.q;
    hasError = builder.hasError;
  }

  @Override public String toString() {
    return "TraceQuery{limit=" + limit + ", offset=" + offset
      + (q != null ? ", q=" + q : "")
      + (hasError != null ? ", hasError=" + hasError : "")
      + "}";
  }
}
