/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.util.List;

/** One page of results, with the pagination that produced it. */
public final class QueryResult<T> {
  public static <T> QueryResult<T> create(List<T> data, long total, int limit, int offset) {
    if (data == null) throw new NullPointerException("data == null");
    return new QueryResult<>(List.copyOf(data), total, limit, offset);
  }

  final List<T> data;
  final long total;
  final int limit, offset;

  QueryResult(List<T> data, long total, int limit, int offset) {
    this.data = data;
    this.total = total;
    this.limit = limit;
    this.offset = offset;
  }

  public List<T> data() {
    return data;
  }

  /**
   * Matches before pagination, counting structural filters only. Zero when the count could not be
   * read.
   */
  public long total() {
    return total;
  }

  public int limit() {
    return limit;
  }

  public int offset() {
    return offset;
  }

  @Override public String toString() {
    return "QueryResult{total=" + total + ", limit=" + limit + ", offset=" + offset
      + ", data=" + data + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof QueryResult)) return false;
    QueryResult<?> that = (QueryResult<?>) o;
    return total == that.total && limit == that.limit && offset == that.offset
      && data.equals(that.data);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= data.hashCode();
    h *= 1000003;
    h ^= (int) ((total >>> 32) ^ total);
    h *= 1000003;
    h ^= limit;
    h *= 1000003;
    h ^= offset;
    return h;
  }
}
