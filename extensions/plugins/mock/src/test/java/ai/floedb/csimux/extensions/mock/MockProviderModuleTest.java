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

package ai.floedb.csimux.extensions.mock;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.csimux.csi.rpc.GetPluginInfoRequest;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.spi.ProviderModule;
import ai.floedb.csimux.spi.StorageProvider;
import ai.floedb.csimux.transport.PipeChannel;
import ai.floedb.csimux.transport.PipeListener;
import java.util.ServiceLoader;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class MockProviderModuleTest {
  @Test
  void isDiscoverableThroughServiceLoader() {
    assertThat(ServiceLoader.load(ProviderModule.class))
        .anySatisfy(module -> assertThat(module).isInstanceOf(MockProviderModule.class));
  }

  @Test
  void constructsFreshProviders() {
    Supplier<? extends StorageProvider> ctor =
        new MockProviderModule().serviceProviders().get(MockProvider.NAME);

    assertThat(ctor.get()).isInstanceOf(MockProvider.class).isNotSameAs(ctor.get());
  }

  @Test
  void servesOverPipe() throws Exception {
    StorageProvider provider = new MockProviderModule().serviceProviders().get("mock").get();
    PipeListener pipe = new PipeListener("mock-test");
    PipeChannel channel = new PipeChannel(pipe);
    CompletableFuture<Void> serving =
        CompletableFuture.runAsync(
            () -> {
              try {
                provider.serve(pipe);
              } catch (Exception e) {
                throw new IllegalStateException(e);
              }
            });
    try {
      String name =
          IdentityGrpc.newBlockingStub(channel)
              .withDeadlineAfter(5, TimeUnit.SECONDS)
              .getPluginInfo(GetPluginInfoRequest.getDefaultInstance())
              .getResult()
              .getName();
      assertThat(name).isEqualTo("mock");
    } finally {
      provider.gracefulStop();
      channel.shutdownNow();
      pipe.close();
    }
    serving.get(5, TimeUnit.SECONDS);
  }
}
