/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.collector;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import tracelog.internal.ClosedComponentException;

/**
 * Adapts a {@link LogCollector} to encoders that write one event per {@link #write(byte[], int,
 * int)} call. Bytes written one at a time are buffered until a newline or {@link #flush()}.
 *
 * <p>Closing this stream does not close the collector.
 */
public final class LogCollectorOutputStream extends OutputStream {
  final LogCollector collector;
  final ByteArrayOutputStream pending = new ByteArrayOutputStream();

  public LogCollectorOutputStream(LogCollector collector) {
    if (collector == null) throw new NullPointerException("collector == null");
    this.collector = collector;
  }

  @Override public synchronized void write(int b) throws IOException {
    if (b == '\n') {
      flush();
      return;
    }
    pending.write(b);
  }

  @Override public synchronized void write(byte[] b, int off, int len) throws IOException {
    if (len == 0) return;
    send(Arrays.copyOfRange(b, off, off + len));
  }

  @Override public synchronized void flush() throws IOException {
    if (pending.size() == 0) return;
    byte[] event = pending.toByteArray();
    pending.reset();
    send(event);
  }

  @Override public synchronized void close() throws IOException {
    flush();
  }

  void send(byte[] event) throws IOException {
    try {
      collector.write(event);
    } catch (ClosedComponentException e) {
      throw new IOException(e.getMessage(), e);
    }
  }

  @Override public String toString() {
    return "LogCollectorOutputStream{" + collector + "}";
  }
}
