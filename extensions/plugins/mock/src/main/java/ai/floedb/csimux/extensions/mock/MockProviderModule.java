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

import ai.floedb.csimux.spi.ProviderModule;
import ai.floedb.csimux.spi.StorageProvider;
import java.util.Map;
import java.util.function.Supplier;

public final class MockProviderModule implements ProviderModule {
  @Override
  public Map<String, Supplier<? extends StorageProvider>> serviceProviders() {
    return Map.of(MockProvider.NAME, MockProvider::new);
  }
}
