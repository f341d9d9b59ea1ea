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
import io.grpc.ClientCall;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Deadline;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

final class PipeClientCall<ReqT, RespT> extends ClientCall<ReqT, RespT> {
  private static final Logger LOG = Logger.getLogger(PipeClientCall.class);

  private final PipeChannel channel;
  private final MethodDescriptor<ReqT, RespT> method;
  private final CallOptions callOptions;
  private final Executor callbackExecutor;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Object lock = new Object();

  private Listener<RespT> listener;
  private Metadata headers;
  private ReqT request;
  private Context context;
  private Context.CancellationListener cancellationListener;
  private ScheduledFuture<?> deadlineTimer;
  private CompletableFuture<PipeConnection> pendingDial;
  private PipeConnection connection;

  PipeClientCall(
      PipeChannel channel, MethodDescriptor<ReqT, RespT> method, CallOptions callOptions) {
    this.channel = channel;
    this.method = method;
    this.callOptions = callOptions;
    this.callbackExecutor =
        callOptions.getExecutor() != null ? callOptions.getExecutor() : channel.executor();
  }

  @Override
  public void start(Listener<RespT> responseListener, Metadata headers) {
    Objects.requireNonNull(responseListener, "responseListener");
    synchronized (lock) {
      if (listener != null) {
        throw new IllegalStateException("call already started");
      }
      this.listener = responseListener;
      this.headers = headers == null ? new Metadata() : headers;
    }
    channel.register(this);
    if (channel.isShutdown()) {
      abort(
          Status.UNAVAILABLE.withDescription(
              "pipe channel " + channel.authority() + " is shut down"));
      return;
    }

    context = Context.current();
    cancellationListener =
        cancelled -> {
          Status status = Contexts.statusFromCancelled(cancelled);
          abort(status != null ? status : Status.CANCELLED.withDescription("context cancelled"));
        };
    context.addListener(cancellationListener, Runnable::run);

    Deadline deadline = callOptions.getDeadline();
    if (deadline != null) {
      long remaining = deadline.timeRemaining(TimeUnit.NANOSECONDS);
      Status exceeded =
          Status.DEADLINE_EXCEEDED.withDescription(
              "deadline exceeded calling " + method.getFullMethodName());
      if (remaining <= 0) {
        abort(exceeded);
        return;
      }
      try {
        deadlineTimer =
            channel.scheduler().schedule(() -> abort(exceeded), remaining, TimeUnit.NANOSECONDS);
      } catch (RejectedExecutionException e) {
        abort(Status.UNAVAILABLE.withDescription("pipe channel is shut down").withCause(e));
      }
    }
  }

  @Override
  public void request(int numMessages) {}

  @Override
  public void sendMessage(ReqT message) {
    synchronized (lock) {
      if (request != null) {
        throw new IllegalStateException("unary call accepts a single request");
      }
      request = Objects.requireNonNull(message, "message");
    }
  }

  @Override
  public void halfClose() {
    if (closed.get()) {
      return;
    }
    synchronized (lock) {
      if (request == null) {
        abort(Status.INTERNAL.withDescription("no request sent for " + method.getFullMethodName()));
        return;
      }
    }
    try {
      channel.executor().execute(this::exchange);
    } catch (RejectedExecutionException e) {
      abort(Status.UNAVAILABLE.withDescription("pipe channel is shut down").withCause(e));
    }
  }

  @Override
  public void cancel(String message, Throwable cause) {
    Status status = Status.CANCELLED;
    if (message != null) {
      status = status.withDescription(message);
    }
    if (cause != null) {
      status = status.withCause(cause);
    }
    abort(status);
  }

  private void exchange() {
    CompletableFuture<PipeConnection> dial;
    synchronized (lock) {
      if (closed.get()) {
        return;
      }
      dial = channel.listener().dialAsync();
      pendingDial = dial;
    }

    PipeConnection conn;
    try {
      conn = dial.get();
    } catch (CancellationException e) {
      return;
    } catch (ExecutionException e) {
      abort(
          Status.UNAVAILABLE
              .withDescription("failed to dial pipe " + channel.authority())
              .withCause(e.getCause()));
      return;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      abort(Status.CANCELLED.withDescription("interrupted while dialing").withCause(e));
      return;
    }

    synchronized (lock) {
      if (closed.get()) {
        conn.close();
        return;
      }
      connection = conn;
    }

    try {
      byte[] payload = PipeFrames.drain(method.streamRequest(request));
      PipeFrames.writeRequest(
          conn.getOutputStream(),
          new PipeFrames.Request(method.getFullMethodName(), headers, payload));
      PipeFrames.Response response = PipeFrames.readResponse(conn.getInputStream());
      RespT message =
          response.message() == null
              ? null
              : method.parseResponse(new ByteArrayInputStream(response.message()));
      Status status = response.status();
      if (status.isOk() && message == null) {
        status =
            Status.INTERNAL.withDescription(
                "no response message for " + method.getFullMethodName());
      }
      close(status, response.trailers(), message);
    } catch (IOException | RuntimeException e) {
      if (!closed.get()) {
        LOG.debugf(e, "pipe %s: call %s failed", channel.authority(), method.getFullMethodName());
      }
      abort(
          Status.UNAVAILABLE
              .withDescription("pipe " + channel.authority() + " connection failed")
              .withCause(e));
    }
  }

  private void abort(Status status) {
    close(status, new Metadata(), null);
  }

  private void close(Status status, Metadata trailers, RespT message) {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    CompletableFuture<PipeConnection> dial;
    PipeConnection conn;
    Listener<RespT> target;
    synchronized (lock) {
      dial = pendingDial;
      conn = connection;
      target = listener;
    }
    if (dial != null) {
      dial.cancel(false);
    }
    if (conn != null) {
      conn.close();
    }
    if (context != null && cancellationListener != null) {
      context.removeListener(cancellationListener);
    }
    if (deadlineTimer != null) {
      deadlineTimer.cancel(false);
    }
    channel.unregister(this);
    if (target == null) {
      return;
    }
    Runnable deliver =
        () -> {
          if (message != null) {
            target.onHeaders(new Metadata());
            target.onMessage(message);
          }
          target.onClose(status, trailers);
        };
    try {
      callbackExecutor.execute(deliver);
    } catch (RejectedExecutionException e) {
      LOG.debugf(e, "pipe %s: delivering close inline", channel.authority());
      deliver.run();
    }
  }
}
