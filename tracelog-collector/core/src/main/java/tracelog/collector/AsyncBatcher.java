/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded queue drained by one daemon thread, which hands batches to a {@link Sink}. A batch is
 * written when {@code batchSize} items are queued or when {@code flushInterval} elapses, whichever
 * happens first.
 *
 * <p>Producers never wait for the worker: {@link #offer(Object)} only holds the lock long enough
 * to add to the queue. The worker thread is never interrupted, as storage drivers such as H2 close
 * their files when the writing thread is interrupted.
 */
final class AsyncBatcher<T> {
  static final Logger LOG = LoggerFactory.getLogger(AsyncBatcher.class);

  /** Writes one batch. Implementations handle per-item failures themselves. */
  interface Sink<T> {
    void store(List<T> batch);
  }

  static final class FlushRequest {
    final long target;
    final CompletableFuture<Void> done = new CompletableFuture<>();

    FlushRequest(long target) {
      this.target = target;
    }
  }

  final String name;
  final int capacity, batchSize;
  final long flushIntervalNanos;
  final Sink<T> sink;
  final Thread thread;
  final CountDownLatch terminated = new CountDownLatch(1);

  final ReentrantLock lock = new ReentrantLock();
  final Condition wake = lock.newCondition();
  // guarded by lock
  final ArrayDeque<T> queue;
  final List<FlushRequest> flushRequests = new ArrayList<>();
  long offered, stored; // counts of items added to the queue and handed to the sink
  boolean closed;

  AsyncBatcher(String name, int capacity, int batchSize, Duration flushInterval, Sink<T> sink) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize <= 0");
    if (flushInterval.isNegative() || flushInterval.isZero()) {
      throw new IllegalArgumentException("flushInterval <= 0");
    }
    this.name = name;
    this.capacity = capacity;
    this.batchSize = batchSize;
    this.flushIntervalNanos = flushInterval.toNanos();
    this.sink = sink;
    this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
    this.thread = new Thread(this::run, name);
    this.thread.setDaemon(true);
  }

  AsyncBatcher<T> start() {
    thread.start();
    return this;
  }

  /** Returns false without waiting when the queue is full or the batcher is shut down. */
  boolean offer(T item) {
    lock.lock();
    try {
      if (closed || queue.size() >= capacity) return false;
      queue.add(item);
      offered++;
      if (queue.size() >= batchSize) wake.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  int queuedCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until every item queued before this call was handed to the sink.
   *
   * @throws TimeoutException if that didn't happen within the timeout
   */
  void flush(Duration timeout) throws TimeoutException {
    FlushRequest request;
    lock.lock();
    try {
      if (stored >= offered) return;
      request = new FlushRequest(offered);
      flushRequests.add(request);
      wake.signal();
    } finally {
      lock.unlock();
    }
    await(request.done, timeout);
  }

  /**
   * Stops accepting items and waits for the worker to drain the queue. After a timeout, the worker
   * keeps draining in the background.
   *
   * @throws TimeoutException if draining didn't complete within the timeout, or immediately if the
   * timeout isn't positive
   */
  void shutdown(Duration timeout) throws TimeoutException {
    lock.lock();
    try {
      closed = true;
      wake.signal();
    } finally {
      lock.unlock();
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new TimeoutException(name + " shutdown deadline already expired");
    }
    boolean done;
    try {
      done = terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TimeoutException(name + " interrupted waiting for shutdown");
    }
    if (!done) throw new TimeoutException(name + " did not drain within " + timeout);
  }

  void run() {
    List<T> batch = new ArrayList<>(batchSize);
    long nextFlush = System.nanoTime() + flushIntervalNanos;
    while (true) {
      boolean exit;
      lock.lock();
      try {
        while (queue.size() < batchSize && flushRequests.isEmpty() && !closed) {
          long remaining = nextFlush - System.nanoTime();
          if (remaining <= 0L) break;
          try {
            wake.awaitNanos(remaining);
          } catch (InterruptedException e) {
            // clears the interrupt status, so the drain below can still use storage
            LOG.warn("{} was interrupted: draining and stopping", name);
            closed = true;
          }
        }
        for (int i = 0; i < batchSize; i++) {
          T next = queue.poll();
          if (next == null) break;
          batch.add(next);
        }
        exit = closed && queue.isEmpty();
      } finally {
        lock.unlock();
      }

      if (!batch.isEmpty()) {
        store(batch);
        batch.clear();
      }
      long now = System.nanoTime();
      if (now - nextFlush >= 0L) nextFlush = now + flushIntervalNanos;

      if (exit) break;
    }
    completeFlushRequests();
    terminated.countDown();
    LOG.debug("{} stopped", name);
  }

  void store(List<T> batch) {
    try {
      sink.store(batch);
    } catch (RuntimeException e) {
      LOG.warn("{} could not store {} items", name, batch.size(), e);
    } finally {
      lock.lock();
      try {
        stored += batch.size();
      } finally {
        lock.unlock();
      }
      completeFlushRequests();
    }
  }

  void completeFlushRequests() {
    List<FlushRequest> completed = new ArrayList<>();
    lock.lock();
    try {
      boolean drained = closed && queue.isEmpty();
      for (Iterator<FlushRequest> i = flushRequests.iterator(); i.hasNext(); ) {
        FlushRequest request = i.next();
        if (request.target <= stored || drained) {
          completed.add(request);
          i.remove();
        }
      }
    } finally {
      lock.unlock();
    }
    for (FlushRequest request : completed) request.done.complete(null);
  }

  static void await(CompletableFuture<Void> future, Duration timeout) throws TimeoutException {
    try {
      future.get(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TimeoutException("interrupted waiting for flush");
    } catch (ExecutionException e) {
      throw new IllegalStateException(e.getCause()); // futures are only completed normally
    }
  }

  @Override public String toString() {
    return "AsyncBatcher{name=" + name + ", capacity=" + capacity + ", batchSize=" + batchSize
      + "}";
  }
}
