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

import ai.floedb.csimux.csi.rpc.ControllerGrpc;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsRequest;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.csi.rpc.ListVolumesRequest;
import ai.floedb.csimux.csi.rpc.ListVolumesResponse;
import ai.floedb.csimux.runtime.registry.ProviderRegistry;
import ai.floedb.csimux.runtime.server.RoutingServer;
import ai.floedb.csimux.spi.csi.CsiVersions;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Metadata;
import io.grpc.stub.MetadataUtils;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsimuxDaemonTest {
  private static final Metadata.Key<String> SERVICE =
      Metadata.Key.of("csi.service", Metadata.ASCII_STRING_MARSHALLER);

  @Test
  void servesBuiltInMockProviderOverTcp() throws Exception {
    CsimuxDaemon daemon = new CsimuxDaemon(TestConfigs.of(Map.of()), new ProviderRegistry());
    LaunchPlan plan =
        new LaunchPlan(
            "tcp://127.0.0.1:0",
            List.of(),
            List.of(ServiceSpec.parse("mock:first"), ServiceSpec.parse("mock:second")),
            Duration.ofSeconds(5));

    RoutingServer server = daemon.start(plan);
    String target = server.address().substring("tcp://".length());
    ManagedChannel channel = ManagedChannelBuilder.forTarget(target).usePlaintext().build();
    try {
      Metadata headers = new Metadata();
      headers.put(SERVICE, "second");
      ControllerGrpc.ControllerBlockingStub controller =
          ControllerGrpc.newBlockingStub(channel)
              .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
      ListVolumesResponse response =
          controller.listVolumes(
              ListVolumesRequest.newBuilder().setVersion(CsiVersions.of(0, 1, 0)).build());

      assertThat(response.getResult().getEntriesList()).hasSize(3);
      assertThat(
              IdentityGrpc.newBlockingStub(channel)
                  .getSupportedVersions(GetSupportedVersionsRequest.getDefaultInstance())
                  .getResult()
                  .getSupportedVersionsList())
          .containsExactly(CsiVersions.of(0, 1, 0));
    } finally {
      channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
      CsimuxDaemon.shutdown(server, Duration.ofSeconds(5));
    }

    assertThat(server.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    assertThat(server.serviceResults().get(5, TimeUnit.SECONDS))
        .noneMatch(result -> result.failed());
  }

  @Test
  void reportsMissingEndpointWithUsage() {
    CsimuxDaemon daemon = new CsimuxDaemon(TestConfigs.of(Map.of()), new ProviderRegistry());
    ByteArrayOutputStream err = new ByteArrayOutputStream();

    int code =
        daemon.run(new String[] {"mock"}, new PrintStream(err, true, StandardCharsets.UTF_8));

    assertThat(code).isEqualTo(1);
    assertThat(err.toString(StandardCharsets.UTF_8))
        .contains("error: missing CSI_ENDPOINT")
        .contains(CsimuxDaemon.USAGE);
  }

  @Test
  void reportsUnknownProviderType() {
    CsimuxDaemon daemon =
        new CsimuxDaemon(
            TestConfigs.of(Map.of("csimux.endpoint", "tcp://127.0.0.1:0")),
            new ProviderRegistry());
    ByteArrayOutputStream err = new ByteArrayOutputStream();

    int code =
        daemon.run(new String[] {"nosuch"}, new PrintStream(err, true, StandardCharsets.UTF_8));

    assertThat(code).isEqualTo(1);
    assertThat(err.toString(StandardCharsets.UTF_8)).contains("error: ").contains("nosuch");
  }

  @Test
  void reportsBrokenPluginJar(@TempDir Path dir) throws Exception {
    Path bogus = Files.writeString(dir.resolve("broken.jar"), "not a jar");
    CsimuxDaemon daemon =
        new CsimuxDaemon(
            TestConfigs.of(Map.of("csimux.endpoint", "tcp://127.0.0.1:0")),
            new ProviderRegistry());
    ByteArrayOutputStream err = new ByteArrayOutputStream();

    int code =
        daemon.run(
            new String[] {bogus.toString(), "mock"},
            new PrintStream(err, true, StandardCharsets.UTF_8));

    assertThat(code).isEqualTo(1);
    assertThat(err.toString(StandardCharsets.UTF_8)).startsWith("error: ");
  }
}
