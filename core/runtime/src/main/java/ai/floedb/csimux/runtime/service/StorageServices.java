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

package ai.floedb.csimux.runtime.service;

import ai.floedb.csimux.runtime.registry.ProviderLoadException;
import ai.floedb.csimux.runtime.registry.ProviderNotFoundException;
import ai.floedb.csimux.runtime.registry.ProviderRegistry;
import ai.floedb.csimux.spi.StorageProvider;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

public final class StorageServices {
  private static final Logger LOG = Logger.getLogger(StorageServices.class);

  private StorageServices() {}

  /**
   * Instantiates provider {@code type} from {@code registry} and wraps it in a validating service
   * named {@code name}, or {@code type} when no name is given.
   */
  public static StorageService newService(ProviderRegistry registry, String type, String name)
      throws ProviderNotFoundException, ProviderLoadException {
    Objects.requireNonNull(registry, "registry");
    Supplier<? extends StorageProvider> ctor = registry.lookup(type);
    StorageProvider provider;
    try {
      provider = ctor.get();
    } catch (RuntimeException e) {
      throw new ProviderLoadException("provider " + type + " failed to construct", e);
    }
    if (provider == null) {
      throw new ProviderLoadException("provider " + type + " returned no instance");
    }
    String serviceName = name == null || name.isBlank() ? type : name;
    LOG.infof("created service: type=%s name=%s", type, serviceName);
    return new ValidatingService(serviceName, type, provider);
  }
}
