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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PipeListenerTest {
  private final PipeListener listener = new PipeListener("test");
  private final ExecutorService pool = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    listener.close();
    pool.shutdownNow();
  }

  @Test
  void dial_pairsWithAcceptsInArrivalOrder() throws Exception {
    List<CompletableFuture<PipeConnection>> dials = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      dials.add(listener.dialAsync());
    }
    assertThat(listener.pendingDials()).isEqualTo(3);

    for (int i = 0; i < 3; i++) {
      PipeConnection accepted = listener.accept();
      accepted.getOutputStream().write(i);
      accepted.getOutputStream().flush();
    }

    for (int i = 0; i < 3; i++) {
      PipeConnection dialed = dials.get(i).get(5, TimeUnit.SECONDS);
      assertThat(dialed.getInputStream().read()).isEqualTo(i);
    }
    assertThat(listener.pendingDials()).isZero();
  }

  @Test
  void accept_pairsWithDialsInArrivalOrder() throws Exception {
    List<CompletableFuture<PipeConnection>> accepts = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      accepts.add(listener.acceptAsync());
    }

    for (int i = 0; i < 3; i++) {
      listener.dial().getOutputStream().write(10 + i);
    }

    for (int i = 0; i < 3; i++) {
      assertThat(accepts.get(i).get(5, TimeUnit.SECONDS).getInputStream().read()).isEqualTo(10 + i);
    }
  }

  @Test
  void concurrentDialsAndAccepts_allPair() throws Exception {
    int n = 16;
    List<Future<PipeConnection>> dialers = new ArrayList<>();
    List<Future<PipeConnection>> acceptors = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      dialers.add(pool.submit(listener::dial));
      acceptors.add(pool.submit(listener::accept));
    }

    Set<Integer> seen = new HashSet<>();
    for (int i = 0; i < n; i++) {
      dialers.get(i).get(5, TimeUnit.SECONDS).getOutputStream().write(i);
    }
    for (Future<PipeConnection> acceptor : acceptors) {
      seen.add(acceptor.get(5, TimeUnit.SECONDS).getInputStream().read());
    }

    assertThat(seen).hasSize(n);
    assertThat(listener.pendingAccepts()).isZero();
    assertThat(listener.pendingDials()).isZero();
  }

  @Test
  void close_failsPendingRequests() {
    CompletableFuture<PipeConnection> accept = listener.acceptAsync();
    CompletableFuture<PipeConnection> otherAccept = listener.acceptAsync();

    listener.close();

    assertThatThrownBy(accept::get)
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(PipeClosedException.class);
    assertThatThrownBy(otherAccept::get).hasCauseInstanceOf(PipeClosedException.class);
    assertThat(listener.pendingAccepts()).isZero();
  }

  @Test
  void close_unblocksBlockedDial() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    Future<PipeConnection> dial =
        pool.submit(
            () -> {
              started.countDown();
              return listener.dial();
            });
    started.await();
    while (listener.pendingDials() == 0) {
      Thread.sleep(5);
    }

    listener.close();

    assertThatThrownBy(() -> dial.get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(PipeClosedException.class);
  }

  @Test
  void dial_afterCloseFailsWithoutBlocking() {
    listener.close();

    assertThatThrownBy(listener::dial)
        .isInstanceOf(PipeClosedException.class)
        .hasMessageContaining("test");
    assertThat(listener.dialAsync()).isCompletedExceptionally();
    assertThat(listener.acceptAsync()).isCompletedExceptionally();
  }

  @Test
  void close_isIdempotent() {
    listener.close();
    listener.close();

    assertThat(listener.isClosed()).isTrue();
  }

  @Test
  void cancelledDial_isNeverPaired() throws Exception {
    CompletableFuture<PipeConnection> abandoned = listener.dialAsync();
    CompletableFuture<PipeConnection> live = listener.dialAsync();

    abandoned.cancel(false);
    assertThat(listener.pendingDials()).isEqualTo(1);

    PipeConnection accepted = listener.accept();
    accepted.getOutputStream().write(7);

    assertThat(live.get(5, TimeUnit.SECONDS).getInputStream().read()).isEqualTo(7);
    assertThat(abandoned).isCancelled();
  }

  @Test
  void blockingAccept_isInterruptible() throws Exception {
    AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread waiter =
        new Thread(
            () -> {
              try {
                listener.accept();
              } catch (Throwable t) {
                failure.set(t);
              }
            });
    waiter.start();
    while (listener.pendingAccepts() == 0) {
      Thread.sleep(5);
    }

    waiter.interrupt();
    waiter.join(5_000);

    assertThat(failure.get()).isInstanceOf(InterruptedIOException.class);
    assertThat(listener.pendingAccepts()).isZero();
  }
}
