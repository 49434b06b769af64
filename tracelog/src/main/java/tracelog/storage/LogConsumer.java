/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import tracelog.Call;
import tracelog.LogRecord;

/** Writes log records, one per call. The storage assigns {@link LogRecord#id()}. */
// @FunctionalInterface
public interface LogConsumer {
  Call<Void> accept(LogRecord record);
}
