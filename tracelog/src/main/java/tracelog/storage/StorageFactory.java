/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import java.io.IOException;

/** Opens the storage handle for a tenant, creating its storage location and schema on first use. */
// @FunctionalInterface
public interface StorageFactory {
  /**
   * @param tenantId already validated by the caller
   * @throws IOException if storage could not be opened. Nothing should be left open in this case.
   */
  StorageComponent open(String tenantId) throws IOException;
}
