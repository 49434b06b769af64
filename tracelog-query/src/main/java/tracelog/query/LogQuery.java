/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.util.Locale;
import java.util.Map;
import tracelog.LogRecord;
import tracelog.internal.Nullable;
import tracelog.storage.LogQueryRequest;

/**
 * Structural filters go to storage. The free text filter {@link #q()} is applied to the page
 * storage returns, so a page can be shorter than the limit even when more records match.
 */
public final class LogQuery {

  /**
   * Parses {@code level}, {@code trace_id}, {@code start_time}, {@code end_time}, {@code q},
   * {@code limit} and {@code offset}. Values that don't parse are treated as absent.
   */
  public static LogQuery fromParameters(Map<String, String> parameters) {
    if (parameters == null) throw new NullPointerException("parameters == null");
    return new LogQuery(LogQueryRequest.newBuilder()
      .level(QueryParameters.string(parameters, "level"))
      .traceId(QueryParameters.string(parameters, "trace_id"))
      .startTime(QueryParameters.longValue(parameters, "start_time"))
      .endTime(QueryParameters.longValue(parameters, "end_time"))
      .limit(QueryParameters.limit(parameters))
      .offset(QueryParameters.offset(parameters))
      .build(), QueryParameters.string(parameters, "q"));
  }

  public static LogQuery create(LogQueryRequest request, @Nullable String q) {
    if (request == null) throw new NullPointerException("request == null");
    return new LogQuery(request, q == null || q.isEmpty() ? null : q);
  }

  final LogQueryRequest request;
  final String q, searchTerm;

  LogQuery(LogQueryRequest request, @Nullable String q) {
    this.request = request;
    this.q = q;
    this.searchTerm = q != null ? q.toLowerCase(Locale.ROOT) : null;
  }

  public LogQueryRequest request() {
    return request;
  }

  /** Case-insensitive substring of the message or the attributes JSON. */
  @Nullable public String q() {
    return q;
  }

  /** Returns true when there is no free text or the record contains it. */
  boolean matchesText(LogRecord record) {
    if (searchTerm == null) return true;
    if (record.message().toLowerCase(Locale.ROOT).contains(searchTerm)) return true;
    String attributes = record.attributes();
    return attributes != null && attributes.toLowerCase(Locale.ROOT).contains(searchTerm);
  }

  @Override public String toString() {
    return "LogQuery{request=" + request + (q != null ? ", q=" + q : "") + "}";
  }
}
