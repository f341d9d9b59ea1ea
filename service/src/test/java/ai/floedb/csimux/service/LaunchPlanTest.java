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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LaunchPlanTest {
  @TempDir Path dir;

  @Test
  void existingFilesArePluginsAndTheRestAreServices() throws Exception {
    Path jar = Files.createFile(dir.resolve("vendor.jar"));

    LaunchPlan plan =
        LaunchPlan.resolve(
            TestConfigs.of(Map.of("csimux.endpoint", "tcp://127.0.0.1:9000")),
            List.of(jar.toString(), "mock", "mock:second"));

    assertThat(plan.endpoint()).isEqualTo("tcp://127.0.0.1:9000");
    assertThat(plan.plugins()).containsExactly(jar);
    assertThat(plan.services())
        .containsExactly(new ServiceSpec("mock", "mock"), new ServiceSpec("mock", "second"));
    assertThat(plan.shutdownTimeout()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void configuredEntriesComeBeforeArguments() throws Exception {
    Path configured = Files.createFile(dir.resolve("a.jar"));
    Path argument = Files.createFile(dir.resolve("b.jar"));

    LaunchPlan plan =
        LaunchPlan.resolve(
            TestConfigs.of(
                Map.of(
                    "csimux.endpoint", "unix:///tmp/csi.sock",
                    "csimux.plugins", configured.toString(),
                    "csimux.services", "mock:first",
                    "csimux.shutdown-timeout", "PT2S")),
            List.of(argument.toString(), "mock:last"));

    assertThat(plan.plugins()).containsExactly(configured, argument);
    assertThat(plan.services())
        .extracting(ServiceSpec::name)
        .containsExactly("first", "last");
    assertThat(plan.shutdownTimeout()).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  void requiresEndpoint() {
    assertThatThrownBy(() -> LaunchPlan.resolve(TestConfigs.of(Map.of()), List.of("mock")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("missing CSI_ENDPOINT");
  }

  @Test
  void requiresAtLeastOneService() throws Exception {
    Path jar = Files.createFile(dir.resolve("only.jar"));

    assertThatThrownBy(
            () ->
                LaunchPlan.resolve(
                    TestConfigs.of(Map.of("csimux.endpoint", "tcp://127.0.0.1:0")),
                    List.of(jar.toString())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("no services defined");
  }
}
