/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.io.IOException;

/** Thrown when storage holds no span for the requested trace ID. */
public final class TraceNotFoundException extends IOException {
  static final long serialVersionUID = -1882046417315391208L;

  final String traceId;

  public TraceNotFoundException(String traceId) {
    super("Trace not found: " + traceId);
    this.traceId = traceId;
  }

  public String traceId() {
    return traceId;
  }
}
