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

import ai.floedb.csimux.service.config.CsimuxConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * What the daemon should start: configured plug-ins and services first, then those named on the
 * command line. An argument naming an existing file is a plug-in jar; any other argument is a
 * service definition.
 */
public record LaunchPlan(
    String endpoint, List<Path> plugins, List<ServiceSpec> services, Duration shutdownTimeout) {

  public LaunchPlan {
    plugins = List.copyOf(plugins);
    services = List.copyOf(services);
  }

  /**
   * @throws IllegalArgumentException if no endpoint is configured, no service is defined, or a
   *     service definition is malformed
   */
  public static LaunchPlan resolve(CsimuxConfig config, List<String> args) {
    List<Path> plugins = new ArrayList<>();
    List<ServiceSpec> services = new ArrayList<>();
    config.plugins().ifPresent(paths -> paths.forEach(p -> plugins.add(Path.of(p))));
    config.services().ifPresent(defs -> defs.forEach(d -> services.add(ServiceSpec.parse(d))));
    for (String arg : args) {
      Path path = Path.of(arg);
      if (Files.exists(path)) {
        plugins.add(path);
      } else {
        services.add(ServiceSpec.parse(arg));
      }
    }

    String endpoint = config.endpoint().map(String::trim).orElse("");
    if (endpoint.isEmpty()) {
      throw new IllegalArgumentException("missing CSI_ENDPOINT");
    }
    if (services.isEmpty()) {
      throw new IllegalArgumentException("no services defined");
    }
    return new LaunchPlan(endpoint, plugins, services, config.shutdownTimeout());
  }
}
