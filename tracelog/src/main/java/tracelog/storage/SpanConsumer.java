/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import tracelog.Call;
import tracelog.Span;

/**
 * Writes spans, one per call. Collectors invoke this once per item in a batch, so that a failure
 * storing one span never affects the others.
 */
// @FunctionalInterface
public interface SpanConsumer {
  Call<Void> accept(Span span);
}
