/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.csimux.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded single-direction byte ring shared by the two ends of a {@link PipeConnection}. The
 * writing end closes it with {@link #closeWrite()} (the reader drains and then sees EOF); the
 * reading end closes it with {@link #closeRead()} (buffered bytes are dropped, the writer fails).
 */
final class PipeBuffer {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final byte[] ring;

  private int head;
  private int count;
  private boolean writeClosed;
  private boolean readClosed;

  PipeBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.ring = new byte[capacity];
  }

  int read(byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    if (len == 0) {
      return 0;
    }
    lock.lock();
    try {
      while (count == 0) {
        if (readClosed) {
          throw new IOException("pipe closed");
        }
        if (writeClosed) {
          return -1;
        }
        await(notEmpty);
      }
      if (readClosed) {
        throw new IOException("pipe closed");
      }
      int n = Math.min(len, count);
      int first = Math.min(n, ring.length - head);
      System.arraycopy(ring, head, b, off, first);
      System.arraycopy(ring, 0, b, off + first, n - first);
      head = (head + n) % ring.length;
      count -= n;
      notFull.signalAll();
      return n;
    } finally {
      lock.unlock();
    }
  }

  void write(byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    lock.lock();
    try {
      while (len > 0) {
        if (writeClosed) {
          throw new IOException("pipe closed");
        }
        if (readClosed) {
          throw new IOException("broken pipe");
        }
        if (count == ring.length) {
          await(notFull);
          continue;
        }
        int tail = (head + count) % ring.length;
        int n = Math.min(len, Math.min(ring.length - count, ring.length - tail));
        System.arraycopy(b, off, ring, tail, n);
        count += n;
        off += n;
        len -= n;
        notEmpty.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  int available() {
    lock.lock();
    try {
      return readClosed ? 0 : count;
    } finally {
      lock.unlock();
    }
  }

  void closeWrite() {
    lock.lock();
    try {
      writeClosed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  void closeRead() {
    lock.lock();
    try {
      readClosed = true;
      count = 0;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private static void await(Condition condition) throws InterruptedIOException {
    try {
      condition.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting on pipe");
    }
  }
}
