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

import java.util.Map;

/**
 * Provider of {@link ResourceStore} instances, discovered by {@link ResourceStoreRegistry}.
 * Implementations must have a public no-arg constructor and be listed in
 * {@code META-INF/services/io.meshpolicy.discovery.ResourceStoreProvider}.
 */
public abstract class ResourceStoreProvider {

  /**
   * Whether this provider can be used in the current environment. A provider that returns
   * {@code false} is never selected.
   */
  protected abstract boolean isAvailable();

  /**
   * A priority from 0 to 10, where 5 is the default. Among available providers the one with the
   * highest priority is used.
   */
  protected abstract int priority();

  /**
   * Creates a store from the {@code resourceStore} object of the bootstrap configuration.
   *
   * @throws BootstrapException if {@code settings} are not usable by this provider
   */
  public abstract ResourceStore newResourceStore(Map<String, ?> settings)
      throws BootstrapException;
}
