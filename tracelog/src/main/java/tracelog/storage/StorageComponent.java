/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.storage;

import tracelog.Component;

/**
 * A storage handle for one tenant. Collectors write through {@link #spanConsumer()} and {@link
 * #logConsumer()}; queries read through {@link #spanStore()} and {@link #logStore()}.
 *
 * <p>Handles are opened and closed only by {@link TenantStorageManager}.
 */
public abstract class StorageComponent extends Component {

  public abstract SpanStore spanStore();

  public abstract LogStore logStore();

  public abstract SpanConsumer spanConsumer();

  public abstract LogConsumer logConsumer();
}
