/*
 * Copyright 2026 The MeshPolicy Authors
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

package io.meshpolicy.discovery;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Registry of {@link ResourceStoreProvider}s. The {@link #getDefaultRegistry default instance}
 * loads providers at runtime through the Java service provider mechanism.
 */
@ThreadSafe
public final class ResourceStoreRegistry {
  private static final Logger logger = Logger.getLogger(ResourceStoreRegistry.class.getName());
  private static ResourceStoreRegistry instance;

  @GuardedBy("this")
  private final LinkedHashSet<ResourceStoreProvider> allProviders = new LinkedHashSet<>();
  /** Immutable, sorted version of {@code allProviders}. Is replaced instead of mutating. */
  @GuardedBy("this")
  private List<ResourceStoreProvider> effectiveProviders = Collections.emptyList();

  /**
   * Registers a provider.
   *
   * <p>If the provider's {@link ResourceStoreProvider#isAvailable isAvailable()} returns
   * {@code false}, this method throws {@link IllegalArgumentException}.
   *
   * <p>Providers are used in priority order. In case of ties, providers are used in registration
   * order.
   */
  public synchronized void register(ResourceStoreProvider provider) {
    addProvider(provider);
    refreshProviders();
  }

  private synchronized void addProvider(ResourceStoreProvider provider) {
    Preconditions.checkArgument(provider.isAvailable(), "isAvailable() returned false");
    allProviders.add(provider);
  }

  /** Deregisters a provider. No-op if the provider is not in the registry. */
  public synchronized void deregister(ResourceStoreProvider provider) {
    allProviders.remove(provider);
    refreshProviders();
  }

  private synchronized void refreshProviders() {
    List<ResourceStoreProvider> providers = new ArrayList<>(allProviders);
    Collections.sort(providers, Collections.reverseOrder(new Comparator<ResourceStoreProvider>() {
      @Override
      public int compare(ResourceStoreProvider o1, ResourceStoreProvider o2) {
        return o1.priority() - o2.priority();
      }
    }));
    effectiveProviders = Collections.unmodifiableList(providers);
  }

  /** Returns the default registry that loads providers via the Java service loader mechanism. */
  public static synchronized ResourceStoreRegistry getDefaultRegistry() {
    if (instance == null) {
      instance = new ResourceStoreRegistry();
      for (ResourceStoreProvider provider : loadAll(ResourceStoreProvider.class.getClassLoader())) {
        logger.fine("Service loader found " + provider);
        if (provider.isAvailable()) {
          instance.addProvider(provider);
        }
      }
      instance.refreshProviders();
    }
    return instance;
  }

  @VisibleForTesting
  static List<ResourceStoreProvider> loadAll(ClassLoader classLoader) {
    List<ResourceStoreProvider> list = new ArrayList<>();
    ServiceLoader<ResourceStoreProvider> loader =
        ServiceLoader.load(ResourceStoreProvider.class, classLoader);
    try {
      for (ResourceStoreProvider provider : loader) {
        list.add(provider);
      }
    } catch (ServiceConfigurationError e) {
      logger.log(Level.WARNING, "Failed to load a ResourceStoreProvider", e);
    }
    return list;
  }

  /** Returns effective providers, in priority order. */
  @VisibleForTesting
  synchronized List<ResourceStoreProvider> providers() {
    return effectiveProviders;
  }

  @Nullable
  ResourceStoreProvider provider() {
    List<ResourceStoreProvider> providers = providers();
    return providers.isEmpty() ? null : providers.get(0);
  }

  /**
   * Creates a store with the highest-priority provider.
   *
   * @throws BootstrapException if no provider is registered or the provider rejects
   *     {@code settings}
   */
  public ResourceStore newResourceStore(Map<String, ?> settings) throws BootstrapException {
    ResourceStoreProvider provider = provider();
    if (provider == null) {
      throw new BootstrapException("No functional resource store provider found. "
          + "Add a ResourceStoreProvider implementation to the classpath");
    }
    logger.log(Level.FINE, "Using resource store provider {0}", provider);
    return provider.newResourceStore(settings);
  }
}
