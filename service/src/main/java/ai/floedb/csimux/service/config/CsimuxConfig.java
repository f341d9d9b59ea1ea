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

package ai.floedb.csimux.service.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "csimux")
public interface CsimuxConfig {
  /** Listen address, {@code scheme://address}. Falls back to {@code CSI_ENDPOINT}. */
  Optional<String> endpoint();

  /** Plug-in jars loaded before command-line plug-ins. */
  Optional<List<String>> plugins();

  /** {@code TYPE[:NAME]} service definitions created before command-line ones. */
  Optional<List<String>> services();

  /** How long a graceful stop may take before the daemon aborts in-flight calls. */
  @WithDefault("PT30S")
  Duration shutdownTimeout();
}
