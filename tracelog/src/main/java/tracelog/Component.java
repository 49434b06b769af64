/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog;

import java.io.Closeable;
import java.io.IOException;

/** Base type of storage handles and other resources that can be health checked and closed. */
public abstract class Component implements Closeable {

  /**
   * Answers the question: Are operations on this component likely to succeed? Implementations
   * return a failed result rather than throwing, and are safe to call concurrently.
   */
  public CheckResult check() {
    return CheckResult.OK;
  }

  /** Releases resources this component opened. Resources passed in by the caller stay open. */
  @Override public void close() throws IOException {
  }
}
