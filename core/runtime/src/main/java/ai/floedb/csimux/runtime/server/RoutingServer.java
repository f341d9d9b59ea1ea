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

package ai.floedb.csimux.runtime.server;

import ai.floedb.csimux.csi.rpc.ControllerGrpc;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.csi.rpc.NodeGrpc;
import ai.floedb.csimux.runtime.service.StorageService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.netty.shaded.io.netty.channel.EventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.Epoll;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollEventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.grpc.netty.shaded.io.netty.channel.unix.DomainSocketAddress;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Hosts several {@link StorageService}s behind one gRPC listener. Each call is dispatched to the
 * service named by its {@value ServiceRoutingInterceptor#SERVICE_HEADER} header, or to the first
 * service.
 *
 * <p>{@link #serve()} binds the listener and starts every service on its own thread, then returns.
 * Shutdown stops the services before the listener and runs registered cleanup actions once.
 */
public final class RoutingServer {
  private static final Logger LOG = Logger.getLogger(RoutingServer.class);

  private final ListenAddress listenAddress;
  private final ServerBuilder<?> suppliedBuilder;
  private final List<StorageService> services;
  private final List<Runnable> cleanup = new CopyOnWriteArrayList<>();
  private final AtomicBoolean cleanedUp = new AtomicBoolean();
  private final ExecutorService serviceThreads;
  private final CompletableFuture<List<ServiceResult>> serviceResults = new CompletableFuture<>();
  private final ReentrantLock lock = new ReentrantLock();

  private Server server;
  private boolean started;
  private boolean stopped;

  private RoutingServer(
      ListenAddress listenAddress,
      ServerBuilder<?> suppliedBuilder,
      List<? extends StorageService> services) {
    this.listenAddress = listenAddress;
    this.suppliedBuilder = suppliedBuilder;
    this.services = List.copyOf(services);
    AtomicInteger counter = new AtomicInteger();
    this.serviceThreads =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "csimux-service-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * @throws IllegalArgumentException if {@code address} is not {@code scheme://address}
   */
  public static RoutingServer forAddress(String address, List<? extends StorageService> services) {
    return new RoutingServer(ListenAddress.parse(address), null, services);
  }

  /** Serves through a caller-configured builder instead of binding an address. */
  public static RoutingServer forServerBuilder(
      ServerBuilder<?> builder, List<? extends StorageService> services) {
    return new RoutingServer(null, Objects.requireNonNull(builder, "builder"), services);
  }

  public List<StorageService> services() {
    return services;
  }

  /** Registers an action run once, after the listener has been shut down. */
  public void onShutdown(Runnable action) {
    cleanup.add(Objects.requireNonNull(action, "action"));
  }

  /**
   * Binds the listener and starts every service. Returns once the listener is up.
   *
   * @throws IllegalStateException if no services are configured, or the server was already
   *     started or stopped
   */
  public RoutingServer serve() throws IOException {
    if (services.isEmpty()) {
      throw new IllegalStateException("no services configured");
    }
    lock.lock();
    try {
      if (stopped) {
        throw new IllegalStateException("routing server is stopped");
      }
      if (started) {
        throw new IllegalStateException("routing server is already serving");
      }
      started = true;

      ServerBuilder<?> builder = suppliedBuilder != null ? suppliedBuilder : bind(listenAddress);
      ServiceRouter router = new ServiceRouter();
      ServiceRoutingInterceptor routing = new ServiceRoutingInterceptor(services);
      builder
          .addService(ServerInterceptors.intercept(IdentityGrpc.bindService(router), routing))
          .addService(ServerInterceptors.intercept(ControllerGrpc.bindService(router), routing))
          .addService(ServerInterceptors.intercept(NodeGrpc.bindService(router), routing));
      try {
        server = builder.build().start();
      } catch (IOException | RuntimeException e) {
        runCleanup();
        throw e;
      }
    } finally {
      lock.unlock();
    }

    LOG.infof("listening on %s", address());
    startServices();
    return this;
  }

  /**
   * Completes after the serve loop of every service has returned, with one result per service in
   * configuration order.
   */
  public CompletableFuture<List<ServiceResult>> serviceResults() {
    return serviceResults;
  }

  /** Bound address as {@code scheme://address}, or {@code null} before {@link #serve()}. */
  public String address() {
    Server current;
    lock.lock();
    try {
      current = server;
    } finally {
      lock.unlock();
    }
    if (current == null) {
      return null;
    }
    if (listenAddress != null && listenAddress.isUnix()) {
      return listenAddress.toString();
    }
    List<? extends SocketAddress> sockets = current.getListenSockets();
    if (sockets.isEmpty()) {
      return listenAddress != null ? listenAddress.toString() : null;
    }
    SocketAddress socket = sockets.get(0);
    if (socket instanceof InetSocketAddress inet) {
      String scheme = listenAddress != null ? listenAddress.scheme() : "tcp";
      String host =
          inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
      if (host.indexOf(':') >= 0) {
        host = "[" + host + "]";
      }
      return scheme + "://" + host + ":" + inet.getPort();
    }
    return socket.toString();
  }

  public void stop() {
    shutdown(ShutdownMode.FORCED);
  }

  public void gracefulStop() {
    shutdown(ShutdownMode.GRACEFUL);
  }

  /**
   * Stops every service, then the listener, then runs the cleanup actions. A forced shutdown may
   * follow a graceful one that is still draining.
   */
  public void shutdown(ShutdownMode mode) {
    Server current;
    lock.lock();
    try {
      stopped = true;
      current = server;
    } finally {
      lock.unlock();
    }
    LOG.infof("shutting down (%s)", mode);

    if (mode == ShutdownMode.GRACEFUL) {
      for (StorageService service : services) {
        service.gracefulStop();
      }
      if (current != null) {
        current.shutdown();
        try {
          current.awaitTermination();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOG.warn("interrupted while draining the listener, forcing shutdown");
          current.shutdownNow();
        }
      }
    } else {
      for (StorageService service : services) {
        service.stop();
      }
      if (current != null) {
        current.shutdownNow();
      }
    }
    runCleanup();
    serviceThreads.shutdown();
  }

  public void awaitTermination() throws InterruptedException {
    Server current = startedServer();
    if (current != null) {
      current.awaitTermination();
    }
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    Server current = startedServer();
    return current == null || current.awaitTermination(timeout, unit);
  }

  private Server startedServer() {
    lock.lock();
    try {
      return server;
    } finally {
      lock.unlock();
    }
  }

  private void startServices() {
    List<CompletableFuture<ServiceResult>> runs = new ArrayList<>(services.size());
    for (StorageService service : services) {
      runs.add(CompletableFuture.supplyAsync(() -> run(service), serviceThreads));
    }
    CompletableFuture.allOf(runs.toArray(CompletableFuture[]::new))
        .whenComplete(
            (ignored, failure) -> {
              List<ServiceResult> results = new ArrayList<>(runs.size());
              for (CompletableFuture<ServiceResult> run : runs) {
                results.add(run.join());
              }
              serviceResults.complete(List.copyOf(results));
            });
  }

  private static ServiceResult run(StorageService service) {
    try {
      service.serve();
      LOG.infof("service %s (%s) finished", service.name(), service.type());
      return new ServiceResult(service.name(), service.type(), null);
    } catch (IOException | RuntimeException e) {
      LOG.warnf(e, "service %s (%s) failed", service.name(), service.type());
      return new ServiceResult(service.name(), service.type(), e);
    }
  }

  private ServerBuilder<?> bind(ListenAddress address) throws IOException {
    if (address.isTcp()) {
      return NettyServerBuilder.forAddress(inetSocket(address));
    }
    if (address.scheme().equals("unix")) {
      if (!Epoll.isAvailable()) {
        throw new IOException(
            "unix sockets are not supported on this platform", Epoll.unavailabilityCause());
      }
      Path socket = Path.of(address.address());
      EventLoopGroup boss = new EpollEventLoopGroup(1);
      EventLoopGroup workers = new EpollEventLoopGroup();
      onShutdown(
          () -> {
            boss.shutdownGracefully();
            workers.shutdownGracefully();
          });
      onShutdown(() -> removeSocket(socket));
      return NettyServerBuilder.forAddress(new DomainSocketAddress(socket.toString()))
          .channelType(EpollServerDomainSocketChannel.class)
          .bossEventLoopGroup(boss)
          .workerEventLoopGroup(workers);
    }
    throw new IllegalArgumentException("unsupported listen scheme: " + address.scheme());
  }

  static InetSocketAddress inetSocket(ListenAddress address) throws UnknownHostException {
    String hostPort = address.address();
    int colon = hostPort.lastIndexOf(':');
    if (colon < 0) {
      throw new IllegalArgumentException("missing port in " + address);
    }
    String host = hostPort.substring(0, colon);
    int port;
    try {
      port = Integer.parseInt(hostPort.substring(colon + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid port in " + address, e);
    }
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    }
    if (host.isEmpty()) {
      return switch (address.scheme()) {
        case "tcp4" -> new InetSocketAddress(InetAddress.getByName("0.0.0.0"), port);
        case "tcp6" -> new InetSocketAddress(InetAddress.getByName("::"), port);
        default -> new InetSocketAddress(port);
      };
    }
    return new InetSocketAddress(InetAddress.getByName(host), port);
  }

  private void runCleanup() {
    if (!cleanedUp.compareAndSet(false, true)) {
      return;
    }
    for (Runnable action : cleanup) {
      try {
        action.run();
      } catch (RuntimeException e) {
        LOG.warnf(e, "cleanup action failed");
      }
    }
  }

  private static void removeSocket(Path socket) {
    try {
      if (Files.deleteIfExists(socket)) {
        LOG.debugf("removed socket %s", socket);
      }
    } catch (IOException e) {
      LOG.warnf(e, "failed to remove socket %s", socket);
    }
  }
}
