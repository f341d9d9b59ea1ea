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

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.MethodDescriptor;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * gRPC client {@link Channel} whose calls travel over a {@link PipeListener} instead of a socket.
 * Every call dials its own {@link PipeConnection}; only unary methods are supported.
 *
 * <p>Calls observe {@link CallOptions#getDeadline()} and the cancellation of the {@link
 * io.grpc.Context} that was current when they were started.
 */
public final class PipeChannel extends Channel {
  private final PipeListener listener;
  private final String authority;
  private final ExecutorService executor;
  private final ScheduledExecutorService scheduler;
  private final Set<PipeClientCall<?, ?>> calls = ConcurrentHashMap.newKeySet();
  private volatile boolean shutdown;

  public PipeChannel(PipeListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
    this.authority = listener.name();
    this.executor = Executors.newCachedThreadPool(daemonThreads("pipe-client-" + authority));
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(daemonThreads("pipe-deadline-" + authority));
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> newCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions) {
    if (method.getType() != MethodDescriptor.MethodType.UNARY) {
      throw new UnsupportedOperationException(
          "pipe channel supports unary calls only: " + method.getFullMethodName());
    }
    return new PipeClientCall<>(this, method, callOptions);
  }

  @Override
  public String authority() {
    return authority;
  }

  public boolean isShutdown() {
    return shutdown;
  }

  /** Number of calls started and not yet closed. */
  public int activeCalls() {
    return calls.size();
  }

  /** Cancels every active call and releases the channel's threads. Idempotent. */
  public void shutdownNow() {
    shutdown = true;
    for (PipeClientCall<?, ?> call : List.copyOf(calls)) {
      call.cancel("pipe channel " + authority + " shut down", null);
    }
    scheduler.shutdownNow();
    executor.shutdown();
  }

  PipeListener listener() {
    return listener;
  }

  ExecutorService executor() {
    return executor;
  }

  ScheduledExecutorService scheduler() {
    return scheduler;
  }

  void register(PipeClientCall<?, ?> call) {
    calls.add(call);
  }

  void unregister(PipeClientCall<?, ?> call) {
    calls.remove(call);
  }

  static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
