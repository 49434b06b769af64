/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.internal;

/**
 * Raised when a caller writes to a component after it was closed. This is a caller error, unlike
 * best-effort drops which are never surfaced.
 */
public final class ClosedComponentException extends IllegalStateException {
  static final long serialVersionUID = 4710289361724094512L;

  public ClosedComponentException() {
    this(null);
  }

  public ClosedComponentException(String message) {
    super(message != null ? message : "closed");
  }
}
