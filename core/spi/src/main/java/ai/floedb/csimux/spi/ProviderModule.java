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

package ai.floedb.csimux.spi;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of a provider plug-in. Implementations are declared in the plug-in jar's {@code
 * META-INF/services/ai.floedb.csimux.spi.ProviderModule} and must have a public no-arg
 * constructor.
 */
public interface ProviderModule {
  /**
   * Provider names mapped to constructors. Names are matched case-insensitively and must be unique
   * across every module loaded into a process. Each call of a constructor returns a fresh,
   * unstarted provider.
   */
  Map<String, Supplier<? extends StorageProvider>> serviceProviders();
}
