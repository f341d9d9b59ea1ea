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

import io.grpc.Context;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerMethodDefinition;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Serves unary gRPC methods over the connections accepted from a {@link PipeListener}. Each
 * accepted connection carries exactly one call, which runs on a worker thread inside its own
 * cancellable {@link Context}.
 *
 * <p>{@link #shutdown()} stops accepting and lets in-flight calls finish; {@link #shutdownNow()}
 * additionally cancels them. {@link #serve(PipeListener)} returns normally in both cases.
 */
public final class PipeServer {
  private static final Logger LOG = Logger.getLogger(PipeServer.class);

  private final String name;
  private final Map<String, ServerMethodDefinition<?, ?>> methods;
  private final ExecutorService workers;
  private final Set<InFlight> inFlight = ConcurrentHashMap.newKeySet();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition terminated = lock.newCondition();

  private boolean serving;
  private boolean shutdown;
  private boolean aborted;
  private CompletableFuture<PipeConnection> pendingAccept;

  public PipeServer(String name, List<ServerServiceDefinition> services) {
    this.name = Objects.requireNonNull(name, "name");
    Map<String, ServerMethodDefinition<?, ?>> byName = new HashMap<>();
    for (ServerServiceDefinition service : services) {
      for (ServerMethodDefinition<?, ?> method : service.getMethods()) {
        String fullName = method.getMethodDescriptor().getFullMethodName();
        if (byName.putIfAbsent(fullName, method) != null) {
          throw new IllegalArgumentException("duplicate method " + fullName);
        }
      }
    }
    this.methods = Map.copyOf(byName);
    this.workers = Executors.newCachedThreadPool(PipeChannel.daemonThreads("pipe-server-" + name));
  }

  public String name() {
    return name;
  }

  /**
   * Runs the accept loop until the server is shut down. Fails with {@link PipeClosedException} if
   * the listener is closed while the server is still running.
   */
  public void serve(PipeListener listener) throws IOException {
    Objects.requireNonNull(listener, "listener");
    lock.lock();
    try {
      if (shutdown) {
        throw new IllegalStateException("pipe server " + name + " is shut down");
      }
      if (serving) {
        throw new IllegalStateException("pipe server " + name + " is already serving");
      }
      serving = true;
    } finally {
      lock.unlock();
    }
    LOG.debugf("pipe server %s: serving on %s", name, listener.name());

    try {
      while (true) {
        CompletableFuture<PipeConnection> accept;
        lock.lock();
        try {
          if (shutdown) {
            return;
          }
          accept = listener.acceptAsync();
          pendingAccept = accept;
        } finally {
          lock.unlock();
        }

        PipeConnection connection;
        try {
          connection = accept.get();
        } catch (CancellationException e) {
          return;
        } catch (InterruptedException e) {
          accept.cancel(false);
          Thread.currentThread().interrupt();
          throw new InterruptedIOException("pipe server " + name + " interrupted");
        } catch (ExecutionException e) {
          if (isShutdown()) {
            return;
          }
          Throwable cause = e.getCause();
          if (cause instanceof IOException io) {
            throw io;
          }
          throw new IOException("pipe server " + name + " accept failed", cause);
        }
        dispatch(connection);
      }
    } finally {
      lock.lock();
      try {
        pendingAccept = null;
        serving = false;
      } finally {
        lock.unlock();
      }
      LOG.debugf("pipe server %s: accept loop ended", name);
    }
  }

  public boolean isShutdown() {
    lock.lock();
    try {
      return shutdown;
    } finally {
      lock.unlock();
    }
  }

  /** Stops accepting new calls. In-flight calls run to completion. */
  public void shutdown() {
    CompletableFuture<PipeConnection> accept;
    lock.lock();
    try {
      shutdown = true;
      accept = pendingAccept;
      pendingAccept = null;
      signalIfIdle();
    } finally {
      lock.unlock();
    }
    if (accept != null) {
      accept.cancel(false);
    }
    workers.shutdown();
  }

  /** Stops accepting and cancels every in-flight call. */
  public void shutdownNow() {
    lock.lock();
    try {
      aborted = true;
    } finally {
      lock.unlock();
    }
    shutdown();
    Status status = Status.UNAVAILABLE.withDescription("pipe server " + name + " shut down");
    for (InFlight call : List.copyOf(inFlight)) {
      call.abort(status);
    }
    workers.shutdownNow();
  }

  /** Waits until the server is shut down and no calls remain. */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lock();
    try {
      while (!isTerminatedLocked()) {
        if (remaining <= 0) {
          return false;
        }
        remaining = terminated.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public void awaitTermination() throws InterruptedException {
    lock.lock();
    try {
      while (!isTerminatedLocked()) {
        terminated.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Number of calls accepted and not yet answered. */
  public int inFlightCalls() {
    return inFlight.size();
  }

  private boolean isTerminatedLocked() {
    return shutdown && inFlight.isEmpty();
  }

  private void signalIfIdle() {
    if (isTerminatedLocked()) {
      terminated.signalAll();
    }
  }

  private void dispatch(PipeConnection connection) {
    InFlight call = new InFlight(connection);
    lock.lock();
    try {
      if (aborted) {
        connection.close();
        return;
      }
      inFlight.add(call);
    } finally {
      lock.unlock();
    }
    try {
      workers.execute(call::run);
    } catch (RejectedExecutionException e) {
      LOG.debugf(e, "pipe server %s: rejected call", name);
      call.finish();
    }
  }

  private final class InFlight {
    private final PipeConnection connection;
    private volatile PipeServerCall<?, ?> call;

    InFlight(PipeConnection connection) {
      this.connection = connection;
    }

    void run() {
      try {
        PipeFrames.Request request = PipeFrames.readRequest(connection.getInputStream());
        PipeFrames.Response response = handle(request);
        PipeFrames.writeResponse(connection.getOutputStream(), response);
      } catch (IOException e) {
        LOG.debugf(e, "pipe server %s: connection failed", name);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.debugf("pipe server %s: call interrupted", name);
      } finally {
        finish();
      }
    }

    void abort(Status status) {
      PipeServerCall<?, ?> current = call;
      if (current != null) {
        current.cancel(status);
      }
      connection.close();
    }

    void finish() {
      connection.close();
      lock.lock();
      try {
        inFlight.remove(this);
        signalIfIdle();
      } finally {
        lock.unlock();
      }
    }

    private PipeFrames.Response handle(PipeFrames.Request request) throws InterruptedException {
      ServerMethodDefinition<?, ?> definition = methods.get(request.method());
      if (definition == null) {
        return PipeFrames.Response.of(
            Status.UNIMPLEMENTED.withDescription("Method not found: " + request.method()));
      }
      return invoke(definition, request);
    }

    private <ReqT, RespT> PipeFrames.Response invoke(
        ServerMethodDefinition<ReqT, RespT> definition, PipeFrames.Request request)
        throws InterruptedException {
      Context.CancellableContext context = Context.ROOT.withCancellation();
      PipeServerCall<ReqT, RespT> serverCall =
          new PipeServerCall<>(name, definition.getMethodDescriptor(), context);
      call = serverCall;
      try {
        context.run(
            () -> {
              try {
                ReqT message =
                    definition
                        .getMethodDescriptor()
                        .parseRequest(new ByteArrayInputStream(request.message()));
                ServerCall.Listener<ReqT> listener =
                    definition.getServerCallHandler().startCall(serverCall, request.headers());
                listener.onMessage(message);
                listener.onHalfClose();
              } catch (RuntimeException e) {
                LOG.debugf(e, "pipe server %s: %s failed", name, request.method());
                if (!serverCall.isClosed()) {
                  serverCall.close(Status.fromThrowable(e), Status.trailersFromThrowable(e));
                }
              }
            });
        PipeFrames.Response response = serverCall.result().get();
        if (!response.status().isOk()) {
          LOG.debugf("pipe server %s: %s -> %s", name, request.method(), response.status());
        }
        return response;
      } catch (ExecutionException e) {
        return PipeFrames.Response.of(Status.fromThrowable(e.getCause()));
      } finally {
        context.cancel(null);
      }
    }
  }
}
