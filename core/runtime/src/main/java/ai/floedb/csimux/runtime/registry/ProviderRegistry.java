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

package ai.floedb.csimux.runtime.registry;

import ai.floedb.csimux.spi.ProviderModule;
import ai.floedb.csimux.spi.StorageProvider;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Process-wide table of provider constructors keyed by case-insensitive name.
 *
 * <p>On first use the registry absorbs the {@link ProviderModule}s visible on its parent class
 * loader. Further modules come from plug-in jars ({@link #load(Path...)}) or are registered in
 * process ({@link #register(ProviderModule)}). A module is merged all-or-nothing; an entry is never
 * replaced or removed. Lookups read an immutable snapshot and take no lock.
 */
public final class ProviderRegistry {
  private static final Logger LOG = Logger.getLogger(ProviderRegistry.class);

  static final String MODULE_DESCRIPTOR = "META-INF/services/" + ProviderModule.class.getName();

  private final ClassLoader parent;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile Map<String, Supplier<? extends StorageProvider>> providers = Map.of();
  private volatile boolean bootstrapped;

  public ProviderRegistry() {
    this(ProviderRegistry.class.getClassLoader());
  }

  /** Creates a registry whose built-in modules and plug-in parent come from {@code parent}. */
  public ProviderRegistry(ClassLoader parent) {
    this.parent = Objects.requireNonNull(parent, "parent");
  }

  /**
   * Loads plug-in jars in order. Stops at the first jar that fails; jars before it stay
   * registered.
   */
  public void load(Path... modulePaths) throws ProviderLoadException {
    bootstrap();
    for (Path path : modulePaths) {
      loadModule(path);
    }
  }

  /** Merges an in-process module. */
  public void register(ProviderModule module) throws ProviderLoadException {
    Objects.requireNonNull(module, "module");
    bootstrap();
    lock.lock();
    try {
      merge(module.getClass().getName(), entriesOf(module));
    } finally {
      lock.unlock();
    }
  }

  public Supplier<? extends StorageProvider> lookup(String name) throws ProviderNotFoundException {
    bootstrap();
    if (name == null) {
      throw new ProviderNotFoundException(null);
    }
    Supplier<? extends StorageProvider> ctor = providers.get(name.toLowerCase(Locale.ROOT));
    if (ctor == null) {
      throw new ProviderNotFoundException(name);
    }
    return ctor;
  }

  /** Registered provider names, sorted. */
  public Set<String> names() {
    bootstrap();
    return new TreeSet<>(providers.keySet());
  }

  private void bootstrap() {
    if (bootstrapped) {
      return;
    }
    lock.lock();
    try {
      if (bootstrapped) {
        return;
      }
      bootstrapped = true;
      List<ServiceLoader.Provider<ProviderModule>> builtIns;
      try {
        builtIns = ServiceLoader.load(ProviderModule.class, parent).stream().toList();
      } catch (ServiceConfigurationError e) {
        LOG.warnf(e, "cannot list built-in provider modules");
        return;
      }
      for (ServiceLoader.Provider<ProviderModule> candidate : builtIns) {
        String source = candidate.type().getName();
        try {
          merge(source, entriesOf(candidate.get()));
        } catch (ProviderLoadException | ServiceConfigurationError e) {
          LOG.warnf(e, "skipping built-in provider module %s", source);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  private void loadModule(Path path) throws ProviderLoadException {
    if (path == null || !Files.isRegularFile(path)) {
      throw new ProviderLoadException("plug-in not found: " + path);
    }
    URLClassLoader loader;
    try {
      loader = new URLClassLoader(new URL[] {path.toUri().toURL()}, parent);
    } catch (IOException e) {
      throw new ProviderLoadException("invalid plug-in path: " + path, e);
    }

    lock.lock();
    try {
      Set<String> declared = declaredModules(loader, path);
      Map<String, Supplier<? extends StorageProvider>> entries = new LinkedHashMap<>();
      for (String className : declared) {
        ProviderModule module = instantiate(loader, className, path);
        for (Map.Entry<String, Supplier<? extends StorageProvider>> e :
            entriesOf(module).entrySet()) {
          if (entries.putIfAbsent(e.getKey(), e.getValue()) != null) {
            throw new ProviderLoadException(
                "plug-in " + path + " declares provider " + e.getKey() + " twice");
          }
        }
      }
      merge(path.toString(), entries);
    } catch (ProviderLoadException | RuntimeException e) {
      closeQuietly(loader, path);
      throw e;
    } finally {
      lock.unlock();
    }
  }

  private static Set<String> declaredModules(URLClassLoader loader, Path path)
      throws ProviderLoadException {
    Set<String> names = new LinkedHashSet<>();
    try {
      Enumeration<URL> descriptors = loader.findResources(MODULE_DESCRIPTOR);
      while (descriptors.hasMoreElements()) {
        URL descriptor = descriptors.nextElement();
        try (BufferedReader reader =
            new BufferedReader(
                new InputStreamReader(descriptor.openStream(), StandardCharsets.UTF_8))) {
          String line;
          while ((line = reader.readLine()) != null) {
            int comment = line.indexOf('#');
            String name = (comment >= 0 ? line.substring(0, comment) : line).trim();
            if (!name.isEmpty()) {
              names.add(name);
            }
          }
        }
      }
    } catch (IOException e) {
      throw new ProviderLoadException("failed to read " + MODULE_DESCRIPTOR + " in " + path, e);
    }
    if (names.isEmpty()) {
      throw new ProviderLoadException(
          "plug-in " + path + " declares no " + ProviderModule.class.getName());
    }
    return names;
  }

  private static ProviderModule instantiate(ClassLoader loader, String className, Path path)
      throws ProviderLoadException {
    try {
      Class<?> type = Class.forName(className, true, loader);
      if (!ProviderModule.class.isAssignableFrom(type)) {
        throw new ProviderLoadException(
            className + " in " + path + " does not implement " + ProviderModule.class.getName());
      }
      return (ProviderModule) type.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException | LinkageError e) {
      throw new ProviderLoadException("cannot instantiate " + className + " from " + path, e);
    }
  }

  private static Map<String, Supplier<? extends StorageProvider>> entriesOf(ProviderModule module)
      throws ProviderLoadException {
    Map<String, Supplier<? extends StorageProvider>> table;
    try {
      table = module.serviceProviders();
    } catch (RuntimeException e) {
      throw new ProviderLoadException(
          "provider module " + module.getClass().getName() + " failed to list providers", e);
    }
    if (table == null || table.isEmpty()) {
      throw new ProviderLoadException(
          "provider module " + module.getClass().getName() + " exports no providers");
    }
    Map<String, Supplier<? extends StorageProvider>> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, ? extends Supplier<? extends StorageProvider>> e : table.entrySet()) {
      String name = e.getKey();
      if (name == null || name.isBlank()) {
        throw new ProviderLoadException(
            "provider module " + module.getClass().getName() + " exports a blank provider name");
      }
      if (e.getValue() == null) {
        throw new ProviderLoadException("provider " + name + " has no constructor");
      }
      if (normalized.putIfAbsent(name.toLowerCase(Locale.ROOT), e.getValue()) != null) {
        throw new ProviderLoadException(
            "provider module " + module.getClass().getName() + " exports " + name + " twice");
      }
    }
    return normalized;
  }

  /** Caller holds {@link #lock}. */
  private void merge(String source, Map<String, Supplier<? extends StorageProvider>> entries)
      throws ProviderLoadException {
    Map<String, Supplier<? extends StorageProvider>> current = providers;
    for (String name : entries.keySet()) {
      if (current.containsKey(name)) {
        throw new ProviderLoadException(
            "provider " + name + " from " + source + " is already registered");
      }
    }
    Map<String, Supplier<? extends StorageProvider>> next = new HashMap<>(current);
    next.putAll(entries);
    providers = Map.copyOf(next);
    LOG.infof("registered providers %s from %s", entries.keySet(), source);
  }

  private static void closeQuietly(URLClassLoader loader, Path path) {
    try {
      loader.close();
    } catch (IOException e) {
      LOG.debugf(e, "failed to close class loader for %s", path);
    }
  }
}
