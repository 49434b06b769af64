/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * A single storage request, invoked with {@link #execute()}.
 *
 * <p>Input validation belongs where the call is created, so that {@link #execute()} only performs
 * I/O. For example, {@code logStore.getLogs(request)} rejects a bad request before any statement
 * is issued.
 *
 * <p>A call cannot be invoked twice. {@linkplain #clone() Clone} it to repeat the request.
 *
 * @param <V> the success type, null only when {@code V} is {@linkplain Void}.
 */
public abstract class Call<V> implements Cloneable {
  /** Returns a completed call, for example when input implies there's nothing to fetch. */
  public static <V> Call<V> create(V v) {
    return new Constant<>(v);
  }

  public static <T> Call<List<T>> emptyList() {
    return Call.create(Collections.emptyList());
  }

  // Taken from RxJava throwIfFatal, which was taken from scala
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof ThreadDeath) {
      throw (ThreadDeath) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /**
   * Invokes the request, returning its value or throwing its error.
   *
   * @throws IOException when the underlying storage failed
   * @throws IllegalStateException when already executed
   */
  public abstract V execute() throws IOException;

  /** Returns a copy of this object, so you can make an identical follow-up request. */
  @Override public abstract Call<V> clone();

  static class Constant<V> extends Base<V> { // not final for mock testing
    final V v;

    Constant(V v) {
      this.v = v;
    }

    @Override protected V doExecute() {
      return v;
    }

    @Override public Call<V> clone() {
      return new Constant<>(v);
    }

    @Override public String toString() {
      return "ConstantCall{value=" + v + "}";
    }
  }

  /** Guards against double invocation. */
  public static abstract class Base<V> extends Call<V> {
    boolean executed;

    protected Base() {
    }

    @Override public final V execute() throws IOException {
      markExecuted();
      return doExecute();
    }

    protected abstract V doExecute() throws IOException;

    synchronized void markExecuted() {
      if (executed) throw new IllegalStateException("Already Executed");
      executed = true;
    }
  }
}
