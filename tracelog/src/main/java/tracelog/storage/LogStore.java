/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import java.util.List;
import tracelog.Call;
import tracelog.LogRecord;

/** Read side of log storage. Nothing here mutates stored data. */
public interface LogStore {

  /**
   * Returns records matching every filter present in the request, ordered by {@link
   * LogRecord#timestamp()} descending, paginated by the request's limit and offset.
   */
  Call<List<LogRecord>> getLogs(LogQueryRequest request);

  /** Counts records matching every filter in the request, ignoring its limit and offset. */
  Call<Long> countLogs(LogQueryRequest request);
}
