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

package ai.floedb.csimux.runtime.service;

import ai.floedb.csimux.csi.rpc.ControllerGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.ControllerGetCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.ControllerGrpc;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.CreateVolumeRequest;
import ai.floedb.csimux.csi.rpc.CreateVolumeResponse;
import ai.floedb.csimux.csi.rpc.DeleteVolumeRequest;
import ai.floedb.csimux.csi.rpc.DeleteVolumeResponse;
import ai.floedb.csimux.csi.rpc.Error.ControllerPublishVolumeError.ControllerPublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.ControllerUnpublishVolumeError.ControllerUnpublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.CreateVolumeError.CreateVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.DeleteVolumeError.DeleteVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error;
import ai.floedb.csimux.csi.rpc.GetCapacityRequest;
import ai.floedb.csimux.csi.rpc.GetCapacityResponse;
import ai.floedb.csimux.csi.rpc.GetNodeIDRequest;
import ai.floedb.csimux.csi.rpc.GetNodeIDResponse;
import ai.floedb.csimux.csi.rpc.GetPluginInfoRequest;
import ai.floedb.csimux.csi.rpc.GetPluginInfoResponse;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsRequest;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsResponse;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.csi.rpc.ListVolumesRequest;
import ai.floedb.csimux.csi.rpc.ListVolumesResponse;
import ai.floedb.csimux.csi.rpc.NodeGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.NodeGetCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.NodeGrpc;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ProbeNodeRequest;
import ai.floedb.csimux.csi.rpc.ProbeNodeResponse;
import ai.floedb.csimux.csi.rpc.ValidateVolumeCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.ValidateVolumeCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.Version;
import ai.floedb.csimux.csi.rpc.VolumeID;
import ai.floedb.csimux.spi.StorageProvider;
import ai.floedb.csimux.spi.csi.CsiErrors;
import ai.floedb.csimux.spi.csi.CsiVersions;
import ai.floedb.csimux.transport.PipeChannel;
import ai.floedb.csimux.transport.PipeListener;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Puts one provider behind structural validation and protocol version gating.
 *
 * <p>The provider is reached over a private {@link PipeListener}. Rejected requests are answered
 * here with a CSI error payload and never reach the provider. Accepted requests are forwarded and
 * the provider's answer, or its transport failure, is passed back unchanged.
 *
 * <p>The provider's supported versions are fetched on first use and cached. Concurrent first
 * callers share one fetch. A failed fetch is reported to its callers and retried by the next call.
 */
public final class ValidatingService implements StorageService {
  private static final Logger LOG = Logger.getLogger(ValidatingService.class);

  private enum State {
    NEW,
    SERVING,
    DRAINING,
    STOPPED
  }

  private final String name;
  private final String type;
  private final StorageProvider provider;
  private final PipeListener pipe;
  private final PipeChannel channel;
  private final IdentityGrpc.IdentityStub identity;
  private final ControllerGrpc.ControllerStub controller;
  private final NodeGrpc.NodeStub node;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition idle = lock.newCondition();
  private State state = State.NEW;
  private int inFlight;
  private CompletableFuture<List<Version>> versions;

  public ValidatingService(String name, String type, StorageProvider provider) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.provider = Objects.requireNonNull(provider, "provider");
    this.pipe = new PipeListener("csimux-" + name);
    this.channel = new PipeChannel(pipe);
    this.identity = IdentityGrpc.newStub(channel);
    this.controller = ControllerGrpc.newStub(channel);
    this.node = NodeGrpc.newStub(channel);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String type() {
    return type;
  }

  @Override
  public void serve() throws IOException {
    lock.lock();
    try {
      if (state == State.SERVING) {
        throw new IllegalStateException("service " + name + " is already serving");
      }
      if (state != State.NEW) {
        throw new IllegalStateException("service " + name + " is stopped");
      }
      state = State.SERVING;
    } finally {
      lock.unlock();
    }
    LOG.infof("service %s: serving provider %s", name, type);
    try {
      provider.serve(pipe);
    } finally {
      LOG.infof("service %s: provider %s returned", name, type);
    }
  }

  @Override
  public void stop() {
    lock.lock();
    try {
      if (state == State.STOPPED) {
        return;
      }
      state = State.STOPPED;
      idle.signalAll();
    } finally {
      lock.unlock();
    }
    LOG.infof("service %s: stopping", name);
    provider.stop();
    closeTransport();
  }

  @Override
  public void gracefulStop() {
    lock.lock();
    try {
      if (state == State.DRAINING || state == State.STOPPED) {
        return;
      }
      state = State.DRAINING;
      LOG.infof("service %s: draining %d in-flight calls", name, inFlight);
      while (inFlight > 0 && state == State.DRAINING) {
        idle.awaitUninterruptibly();
      }
      if (state == State.STOPPED) {
        return;
      }
    } finally {
      lock.unlock();
    }
    provider.gracefulStop();
    lock.lock();
    try {
      if (state == State.STOPPED) {
        return;
      }
      state = State.STOPPED;
    } finally {
      lock.unlock();
    }
    closeTransport();
    LOG.infof("service %s: stopped gracefully", name);
  }

  /** Calls admitted and not yet answered. */
  public int inFlightCalls() {
    lock.lock();
    try {
      return inFlight;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "ValidatingService{name=" + name + ", type=" + type + "}";
  }

  // Identity

  @Override
  public void getSupportedVersions(
      GetSupportedVersionsRequest request,
      StreamObserver<GetSupportedVersionsResponse> responses) {
    call(
        responses,
        out -> {
          List<Version> supported = supportedVersions();
          out.onNext(
              GetSupportedVersionsResponse.newBuilder()
                  .setResult(
                      GetSupportedVersionsResponse.Result.newBuilder()
                          .addAllSupportedVersions(supported))
                  .build());
          out.onCompleted();
        });
  }

  @Override
  public void getPluginInfo(
      GetPluginInfoRequest request, StreamObserver<GetPluginInfoResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, GetPluginInfoResponse.newBuilder().setError(error).build());
            return;
          }
          identity.getPluginInfo(request, out);
        });
  }

  // Controller

  @Override
  public void createVolume(
      CreateVolumeRequest request, StreamObserver<CreateVolumeResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error == null && request.getName().isEmpty()) {
            error =
                CsiErrors.createVolume(CreateVolumeErrorCode.INVALID_VOLUME_NAME, "missing name");
          }
          if (error != null) {
            reply(out, CreateVolumeResponse.newBuilder().setError(error).build());
            return;
          }
          controller.createVolume(request, out);
        });
  }

  @Override
  public void deleteVolume(
      DeleteVolumeRequest request, StreamObserver<DeleteVolumeResponse> responses) {
    call(
        responses,
        out -> {
          Error error =
              checkVolumeId(
                  request.hasVolumeId(),
                  request.getVolumeId(),
                  d -> CsiErrors.deleteVolume(DeleteVolumeErrorCode.INVALID_VOLUME_ID, d));
          if (error == null) {
            error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          }
          if (error != null) {
            reply(out, DeleteVolumeResponse.newBuilder().setError(error).build());
            return;
          }
          controller.deleteVolume(request, out);
        });
  }

  @Override
  public void controllerPublishVolume(
      ControllerPublishVolumeRequest request,
      StreamObserver<ControllerPublishVolumeResponse> responses) {
    call(
        responses,
        out -> {
          Error error =
              checkVolumeId(
                  request.hasVolumeId(),
                  request.getVolumeId(),
                  d ->
                      CsiErrors.controllerPublishVolume(
                          ControllerPublishVolumeErrorCode.INVALID_VOLUME_ID, d));
          if (error == null) {
            error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          }
          if (error != null) {
            reply(out, ControllerPublishVolumeResponse.newBuilder().setError(error).build());
            return;
          }
          controller.controllerPublishVolume(request, out);
        });
  }

  @Override
  public void controllerUnpublishVolume(
      ControllerUnpublishVolumeRequest request,
      StreamObserver<ControllerUnpublishVolumeResponse> responses) {
    call(
        responses,
        out -> {
          Error error =
              checkVolumeId(
                  request.hasVolumeId(),
                  request.getVolumeId(),
                  d ->
                      CsiErrors.controllerUnpublishVolume(
                          ControllerUnpublishVolumeErrorCode.INVALID_VOLUME_ID, d));
          if (error == null) {
            error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          }
          if (error != null) {
            reply(out, ControllerUnpublishVolumeResponse.newBuilder().setError(error).build());
            return;
          }
          controller.controllerUnpublishVolume(request, out);
        });
  }

  @Override
  public void validateVolumeCapabilities(
      ValidateVolumeCapabilitiesRequest request,
      StreamObserver<ValidateVolumeCapabilitiesResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, ValidateVolumeCapabilitiesResponse.newBuilder().setError(error).build());
            return;
          }
          controller.validateVolumeCapabilities(request, out);
        });
  }

  @Override
  public void listVolumes(
      ListVolumesRequest request, StreamObserver<ListVolumesResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, ListVolumesResponse.newBuilder().setError(error).build());
            return;
          }
          controller.listVolumes(request, out);
        });
  }

  @Override
  public void getCapacity(
      GetCapacityRequest request, StreamObserver<GetCapacityResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, GetCapacityResponse.newBuilder().setError(error).build());
            return;
          }
          controller.getCapacity(request, out);
        });
  }

  @Override
  public void controllerGetCapabilities(
      ControllerGetCapabilitiesRequest request,
      StreamObserver<ControllerGetCapabilitiesResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, ControllerGetCapabilitiesResponse.newBuilder().setError(error).build());
            return;
          }
          controller.controllerGetCapabilities(request, out);
        });
  }

  // Node

  @Override
  public void nodePublishVolume(
      NodePublishVolumeRequest request, StreamObserver<NodePublishVolumeResponse> responses) {
    call(
        responses,
        out -> {
          Error error =
              checkVolumeId(request.hasVolumeId(), request.getVolumeId(), CsiErrors::missingField);
          if (error == null) {
            error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          }
          if (error != null) {
            reply(out, NodePublishVolumeResponse.newBuilder().setError(error).build());
            return;
          }
          node.nodePublishVolume(request, out);
        });
  }

  @Override
  public void nodeUnpublishVolume(
      NodeUnpublishVolumeRequest request, StreamObserver<NodeUnpublishVolumeResponse> responses) {
    call(
        responses,
        out -> {
          Error error =
              checkVolumeId(request.hasVolumeId(), request.getVolumeId(), CsiErrors::missingField);
          if (error == null) {
            error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          }
          if (error != null) {
            reply(out, NodeUnpublishVolumeResponse.newBuilder().setError(error).build());
            return;
          }
          node.nodeUnpublishVolume(request, out);
        });
  }

  @Override
  public void getNodeID(GetNodeIDRequest request, StreamObserver<GetNodeIDResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, GetNodeIDResponse.newBuilder().setError(error).build());
            return;
          }
          node.getNodeID(request, out);
        });
  }

  @Override
  public void probeNode(ProbeNodeRequest request, StreamObserver<ProbeNodeResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, ProbeNodeResponse.newBuilder().setError(error).build());
            return;
          }
          node.probeNode(request, out);
        });
  }

  @Override
  public void nodeGetCapabilities(
      NodeGetCapabilitiesRequest request, StreamObserver<NodeGetCapabilitiesResponse> responses) {
    call(
        responses,
        out -> {
          Error error = checkVersion(request.hasVersion() ? request.getVersion() : null);
          if (error != null) {
            reply(out, NodeGetCapabilitiesResponse.newBuilder().setError(error).build());
            return;
          }
          node.nodeGetCapabilities(request, out);
        });
  }

  @FunctionalInterface
  private interface Handler<T> {
    void handle(StreamObserver<T> responses);
  }

  private <T> void call(StreamObserver<T> responses, Handler<T> handler) {
    StreamObserver<T> tracked;
    try {
      tracked = admit(responses);
    } catch (StatusRuntimeException e) {
      responses.onError(e);
      return;
    }
    try {
      handler.handle(tracked);
    } catch (StatusRuntimeException e) {
      tracked.onError(e);
    } catch (RuntimeException e) {
      LOG.warnf(e, "service %s: call failed", name);
      tracked.onError(
          Status.INTERNAL
              .withDescription("service " + name + " failed: " + e.getMessage())
              .withCause(e)
              .asRuntimeException());
    }
  }

  private <T> StreamObserver<T> admit(StreamObserver<T> responses) {
    lock.lock();
    try {
      if (state == State.DRAINING || state == State.STOPPED) {
        throw Status.UNAVAILABLE
            .withDescription("service " + name + " is stopped")
            .asRuntimeException();
      }
      inFlight++;
    } finally {
      lock.unlock();
    }
    return new Tracked<>(responses);
  }

  private void release() {
    lock.lock();
    try {
      inFlight--;
      if (inFlight == 0) {
        idle.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  private static <T> void reply(StreamObserver<T> out, T response) {
    out.onNext(response);
    out.onCompleted();
  }

  /**
   * Returns the error to answer with, or {@code null} when {@code requested} is supported. The
   * supported set is fetched first, so a failed fetch surfaces even for a missing version.
   */
  private Error checkVersion(Version requested) {
    List<Version> supported = supportedVersions();
    if (requested == null || !supported.contains(requested)) {
      Error error = CsiErrors.unsupportedVersion(requested);
      LOG.debugf("service %s: %s", name, CsiErrors.describe(error));
      return error;
    }
    return null;
  }

  private static Error checkVolumeId(
      boolean present, VolumeID id, Function<String, Error> invalid) {
    if (!present) {
      return invalid.apply("missing id obj");
    }
    if (id.getValuesCount() == 0) {
      return invalid.apply("missing id map");
    }
    return null;
  }

  /**
   * Waits for the cached supported versions, honouring the caller's {@link Context}. The fetch
   * itself is detached from the caller so cancelling one waiter does not fail the others.
   */
  private List<Version> supportedVersions() {
    CompletableFuture<List<Version>> fetch;
    boolean start = false;
    lock.lock();
    try {
      if (versions == null || versions.isCompletedExceptionally()) {
        versions = new CompletableFuture<>();
        start = true;
      }
      fetch = versions;
    } finally {
      lock.unlock();
    }
    if (start) {
      CompletableFuture<List<Version>> target = fetch;
      Context.current().fork().run(() -> fetchVersions(target));
    }

    Context context = Context.current();
    CompletableFuture<List<Version>> waiter = new CompletableFuture<>();
    fetch.whenComplete(
        (result, failure) -> {
          if (failure != null) {
            waiter.completeExceptionally(failure);
          } else {
            waiter.complete(result);
          }
        });
    Context.CancellationListener onCancel =
        cancelled -> waiter.completeExceptionally(statusOf(cancelled).asRuntimeException());
    context.addListener(onCancel, Runnable::run);
    try {
      return waiter.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw Status.CANCELLED
          .withDescription("interrupted while fetching supported versions")
          .withCause(e)
          .asRuntimeException();
    } catch (ExecutionException e) {
      throw Status.fromThrowable(e.getCause()).asRuntimeException();
    } finally {
      context.removeListener(onCancel);
    }
  }

  private void fetchVersions(CompletableFuture<List<Version>> target) {
    LOG.debugf("service %s: fetching supported versions", name);
    identity.getSupportedVersions(
        GetSupportedVersionsRequest.getDefaultInstance(),
        new StreamObserver<>() {
          @Override
          public void onNext(GetSupportedVersionsResponse response) {
            switch (response.getReplyCase()) {
              case RESULT -> {
                List<Version> supported =
                    List.copyOf(response.getResult().getSupportedVersionsList());
                LOG.infof("service %s: provider %s supports %s", name, type, describe(supported));
                target.complete(supported);
              }
              case ERROR -> target.completeExceptionally(
                  Status.FAILED_PRECONDITION
                      .withDescription(
                          "provider "
                              + type
                              + " failed to report supported versions: "
                              + CsiErrors.describe(response.getError()))
                      .asRuntimeException());
              default -> target.completeExceptionally(
                  Status.INTERNAL
                      .withDescription("provider " + type + " returned no supported versions")
                      .asRuntimeException());
            }
          }

          @Override
          public void onError(Throwable t) {
            LOG.debugf(t, "service %s: supported versions fetch failed", name);
            target.completeExceptionally(t);
          }

          @Override
          public void onCompleted() {
            target.completeExceptionally(
                Status.INTERNAL
                    .withDescription("provider " + type + " returned no supported versions")
                    .asRuntimeException());
          }
        });
  }

  private static String describe(List<Version> supported) {
    StringBuilder out = new StringBuilder("[");
    for (Version v : supported) {
      if (out.length() > 1) {
        out.append(", ");
      }
      out.append(CsiVersions.format(v));
    }
    return out.append(']').toString();
  }

  private static Status statusOf(Context cancelled) {
    Status status = Contexts.statusFromCancelled(cancelled);
    return status != null ? status : Status.CANCELLED.withDescription("call cancelled");
  }

  private void closeTransport() {
    channel.shutdownNow();
    pipe.close();
  }

  private final class Tracked<T> implements StreamObserver<T> {
    private final StreamObserver<T> delegate;
    private final AtomicBoolean done = new AtomicBoolean();

    Tracked(StreamObserver<T> delegate) {
      this.delegate = delegate;
    }

    @Override
    public void onNext(T value) {
      if (!done.get()) {
        delegate.onNext(value);
      }
    }

    @Override
    public void onError(Throwable t) {
      if (done.compareAndSet(false, true)) {
        try {
          delegate.onError(t);
        } finally {
          release();
        }
      }
    }

    @Override
    public void onCompleted() {
      if (done.compareAndSet(false, true)) {
        try {
          delegate.onCompleted();
        } finally {
          release();
        }
      }
    }
  }
}
