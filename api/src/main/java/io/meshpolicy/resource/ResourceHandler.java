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

package io.meshpolicy.resource;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Receives the events of one watched resource kind. Implementations are invoked serially.
 *
 * @param <T> the resource type
 */
public interface ResourceHandler<T extends Resource> {

  /** A resource was created or updated. */
  void apply(T resource);

  /** A resource was removed. Cluster-scoped kinds pass an empty namespace. */
  void delete(String namespace, String name);

  /**
   * The watch was restarted. {@code resources} is the complete current set and {@code removed}
   * lists, by namespace, the names that existed before the restart but no longer do.
   */
  void reset(List<T> resources, Map<String, Set<String>> removed);
}
