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

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process stand-in for a listening socket. Each {@link #accept()} is paired with exactly one
 * {@link #dial()} and both sides receive the two ends of a fresh {@link PipeConnection}.
 *
 * <p>Pairing is FIFO on both sides: the n-th waiting accept is matched with the n-th waiting dial.
 * Unmatched requests stay queued until they are paired, cancelled (asynchronous forms only) or the
 * listener is closed. Once closed, pending and new requests fail with {@link PipeClosedException}
 * without blocking.
 */
public final class PipeListener implements Closeable {
  private final String name;
  private final int bufferSize;
  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<CompletableFuture<PipeConnection>> accepts = new ArrayDeque<>();
  private final Deque<CompletableFuture<PipeConnection>> dials = new ArrayDeque<>();
  private boolean closed;

  public PipeListener(String name) {
    this(name, PipeConnection.DEFAULT_BUFFER_SIZE);
  }

  public PipeListener(String name, int bufferSize) {
    this.name = Objects.requireNonNull(name, "name");
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
    }
    this.bufferSize = bufferSize;
  }

  public String name() {
    return name;
  }

  /** Blocks until a dialer arrives and returns the accepting end of the new connection. */
  public PipeConnection accept() throws IOException {
    return await(acceptAsync());
  }

  /** Blocks until an acceptor is waiting and returns the dialing end of the new connection. */
  public PipeConnection dial() throws IOException {
    return await(dialAsync());
  }

  /**
   * Queues an accept. The future completes with the accepting end once paired, or exceptionally
   * with {@link PipeClosedException}. Cancelling it withdraws the request.
   */
  public CompletableFuture<PipeConnection> acceptAsync() {
    return rendezvous(accepts, dials, true);
  }

  /** Dialing counterpart of {@link #acceptAsync()}. */
  public CompletableFuture<PipeConnection> dialAsync() {
    return rendezvous(dials, accepts, false);
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  int pendingAccepts() {
    lock.lock();
    try {
      return accepts.size();
    } finally {
      lock.unlock();
    }
  }

  int pendingDials() {
    lock.lock();
    try {
      return dials.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    Deque<CompletableFuture<PipeConnection>> pending = new ArrayDeque<>();
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      pending.addAll(accepts);
      pending.addAll(dials);
      accepts.clear();
      dials.clear();
    } finally {
      lock.unlock();
    }
    PipeClosedException failure = new PipeClosedException(name);
    pending.forEach(waiter -> waiter.completeExceptionally(failure));
  }

  @Override
  public String toString() {
    return "PipeListener{" + name + "}";
  }

  private CompletableFuture<PipeConnection> rendezvous(
      Deque<CompletableFuture<PipeConnection>> own,
      Deque<CompletableFuture<PipeConnection>> peers,
      boolean accepting) {
    lock.lock();
    try {
      if (closed) {
        return CompletableFuture.failedFuture(new PipeClosedException(name));
      }
      CompletableFuture<PipeConnection> peer;
      while ((peer = peers.pollFirst()) != null) {
        if (peer.isDone()) {
          continue;
        }
        PipeConnection.Pair pair = PipeConnection.pair(name, bufferSize);
        if (peer.complete(accepting ? pair.dialer() : pair.acceptor())) {
          return CompletableFuture.completedFuture(accepting ? pair.acceptor() : pair.dialer());
        }
        // the peer was cancelled between the check and the hand-off
        pair.close();
      }
      CompletableFuture<PipeConnection> waiter = new CompletableFuture<>();
      own.addLast(waiter);
      waiter.whenComplete(
          (conn, failure) -> {
            if (waiter.isCancelled()) {
              withdraw(own, waiter);
            }
          });
      return waiter;
    } finally {
      lock.unlock();
    }
  }

  private void withdraw(
      Deque<CompletableFuture<PipeConnection>> queue, CompletableFuture<PipeConnection> waiter) {
    lock.lock();
    try {
      queue.remove(waiter);
    } finally {
      lock.unlock();
    }
  }

  private PipeConnection await(CompletableFuture<PipeConnection> pending) throws IOException {
    try {
      return pending.get();
    } catch (InterruptedException e) {
      if (!pending.cancel(false) && !pending.isCompletedExceptionally()) {
        // paired concurrently with the interrupt; nobody will use this end
        pending.join().close();
      }
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting on pipe " + name);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException("pipe " + name + " failed", cause);
    }
  }
}
