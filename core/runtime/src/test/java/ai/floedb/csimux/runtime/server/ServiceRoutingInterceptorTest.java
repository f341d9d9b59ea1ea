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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ai.floedb.csimux.runtime.service.StorageService;
import java.util.List;
import org.junit.jupiter.api.Test;

class ServiceRoutingInterceptorTest {
  private static StorageService named(String name) {
    StorageService service = mock(StorageService.class);
    when(service.name()).thenReturn(name);
    return service;
  }

  @Test
  void resolvesNamesIgnoringCase() {
    StorageService first = named("Alpha");
    StorageService second = named("beta");
    ServiceRoutingInterceptor routing = new ServiceRoutingInterceptor(List.of(first, second));

    assertThat(routing.resolve("BETA")).isSameAs(second);
    assertThat(routing.resolve(" alpha ")).isSameAs(first);
    assertThat(routing.resolve(null)).isSameAs(first);
    assertThat(routing.resolve("")).isSameAs(first);
    assertThat(routing.resolve("gamma")).isSameAs(first);
  }

  @Test
  void firstOfDuplicateNamesWins() {
    StorageService first = named("dup");
    StorageService second = named("DUP");
    ServiceRoutingInterceptor routing =
        new ServiceRoutingInterceptor(List.of(named("other"), first, second));

    assertThat(routing.resolve("dup")).isSameAs(first);
  }

  @Test
  void requiresAtLeastOneService() {
    assertThatThrownBy(() -> new ServiceRoutingInterceptor(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
