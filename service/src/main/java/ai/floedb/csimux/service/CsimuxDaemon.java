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

package ai.floedb.csimux.service;

import ai.floedb.csimux.runtime.registry.ProviderLoadException;
import ai.floedb.csimux.runtime.registry.ProviderNotFoundException;
import ai.floedb.csimux.runtime.registry.ProviderRegistry;
import ai.floedb.csimux.runtime.server.RoutingServer;
import ai.floedb.csimux.runtime.server.ServiceResult;
import ai.floedb.csimux.runtime.service.StorageService;
import ai.floedb.csimux.runtime.service.StorageServices;
import ai.floedb.csimux.service.config.CsimuxConfig;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/**
 * {@code csimux [PLUGIN_JAR ...] TYPE[:NAME] ...}: loads provider plug-ins, creates one service per
 * definition and serves them all on the configured endpoint until the JVM shuts down.
 */
public final class CsimuxDaemon {
  static {
    configureJbossLogging();
  }

  private static final Logger LOG = Logger.getLogger(CsimuxDaemon.class);

  static final String USAGE =
      "usage: csimux [PLUGIN_JAR [PLUGIN_JAR...]] TYPE[:NAME] [TYPE[:NAME]...]";

  private final CsimuxConfig config;
  private final ProviderRegistry registry;

  public CsimuxDaemon(CsimuxConfig config, ProviderRegistry registry) {
    this.config = config;
    this.registry = registry;
  }

  public static void main(String[] args) {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDefaultInterceptors()
            .withMapping(CsimuxConfig.class)
            .build();
    CsimuxDaemon daemon =
        new CsimuxDaemon(config.getConfigMapping(CsimuxConfig.class), new ProviderRegistry());
    System.exit(daemon.run(args, System.err));
  }

  private static void configureJbossLogging() {
    if (System.getProperty("java.util.logging.manager") == null
        && isClassPresent("org.jboss.logmanager.LogManager")) {
      System.setProperty("java.util.logging.manager", "org.jboss.logmanager.LogManager");
    }
  }

  private static boolean isClassPresent(String name) {
    try {
      Class.forName(name, false, CsimuxDaemon.class.getClassLoader());
      return true;
    } catch (ClassNotFoundException ignored) {
      return false;
    }
  }

  /** Serves until the process is asked to stop. Returns the exit code. */
  int run(String[] args, PrintStream err) {
    LaunchPlan plan;
    try {
      plan = LaunchPlan.resolve(config, List.of(args));
    } catch (IllegalArgumentException e) {
      err.println("error: " + e.getMessage());
      err.println(USAGE);
      return 1;
    }

    RoutingServer server;
    try {
      server = start(plan);
    } catch (ProviderLoadException | ProviderNotFoundException e) {
      err.println("error: " + e.getMessage());
      return 1;
    } catch (IOException | RuntimeException e) {
      err.println("error: failed to serve on " + plan.endpoint() + ": " + e.getMessage());
      return 1;
    }

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  err.println("received shutdown request: shutting down");
                  shutdown(server, plan.shutdownTimeout());
                },
                "csimux-shutdown"));
    try {
      server.awaitTermination();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      shutdown(server, plan.shutdownTimeout());
    }
    return failures(server).isEmpty() ? 0 : 1;
  }

  /**
   * Loads the plan's plug-ins, creates its services and starts serving them.
   *
   * @throws IllegalArgumentException if the endpoint is malformed or uses an unsupported scheme
   */
  RoutingServer start(LaunchPlan plan)
      throws ProviderLoadException, ProviderNotFoundException, IOException {
    registry.load(plan.plugins().toArray(Path[]::new));
    LOG.infof("available providers: %s", registry.names());

    List<StorageService> services = new ArrayList<>(plan.services().size());
    for (ServiceSpec spec : plan.services()) {
      services.add(StorageServices.newService(registry, spec.type(), spec.name()));
    }
    RoutingServer server = RoutingServer.forAddress(plan.endpoint(), services);
    server.serve();
    return server;
  }

  /** Stops gracefully, aborting whatever is still in flight once {@code timeout} has passed. */
  static void shutdown(RoutingServer server, Duration timeout) {
    CompletableFuture<Void> graceful = new CompletableFuture<>();
    Thread stopper =
        new Thread(
            () -> {
              try {
                server.gracefulStop();
                graceful.complete(null);
              } catch (RuntimeException e) {
                graceful.completeExceptionally(e);
              }
            },
            "csimux-graceful-stop");
    stopper.setDaemon(true);
    stopper.start();
    try {
      graceful.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      LOG.info("server stopped gracefully");
    } catch (TimeoutException e) {
      LOG.warnf("graceful stop exceeded %s, aborting", timeout);
      server.stop();
    } catch (ExecutionException e) {
      LOG.warnf(e.getCause(), "graceful stop failed, aborting");
      server.stop();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      server.stop();
    }
  }

  private static List<ServiceResult> failures(RoutingServer server) {
    List<ServiceResult> failed = new ArrayList<>();
    try {
      for (ServiceResult result : server.serviceResults().get(5, TimeUnit.SECONDS)) {
        if (result.failed()) {
          failed.add(result);
        }
      }
    } catch (ExecutionException | TimeoutException e) {
      LOG.debugf(e, "service results unavailable");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return failed;
  }
}
