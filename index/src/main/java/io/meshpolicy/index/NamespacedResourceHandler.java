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

package io.meshpolicy.index;

import com.google.common.collect.ImmutableSet;
import io.meshpolicy.resource.Resource;
import io.meshpolicy.resource.ResourceHandler;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Keeps a per-namespace map of parsed resources of one kind. Invalid resources are logged and
 * skipped, leaving any previously indexed version in place. A reset replaces the whole kind and
 * reports only the namespaces whose parsed content differs.
 *
 * @param <T> the resource type
 * @param <V> the parsed form kept in the index; must implement {@code equals}
 */
public abstract class NamespacedResourceHandler<T extends Resource, V>
    implements ResourceHandler<T> {
  private static final Logger logger = Logger.getLogger(NamespacedResourceHandler.class.getName());

  /** Resource kind, for logging. */
  protected abstract String kind();

  /**
   * Parses a resource. Returns null when the resource is valid but irrelevant to this index, in
   * which case any indexed version is removed.
   */
  @Nullable
  protected abstract V parse(T resource) throws InvalidResourceException;

  /** The map holding this kind in {@code namespace}, created if {@code create} is set. */
  @Nullable
  protected abstract Map<String, V> entries(String namespace, boolean create);

  /** Namespaces that currently hold entries of this kind. */
  protected abstract Set<String> indexedNamespaces();

  /** Invoked once per event with the namespaces whose content changed; may be empty. */
  protected abstract void changed(Set<String> namespaces);

  @Override
  public final void apply(T resource) {
    String namespace = resource.metadata().namespace();
    String name = resource.metadata().name();
    V value;
    try {
      value = parse(resource);
    } catch (InvalidResourceException e) {
      logger.log(Level.WARNING, "Ignoring invalid {0} {1}/{2}: {3}",
          new Object[] {kind(), namespace, name, e.getMessage()});
      return;
    }
    if (value == null) {
      delete(namespace, name);
      return;
    }
    Map<String, V> entries = entries(namespace, true);
    V previous = entries.put(name, value);
    if (value.equals(previous)) {
      changed(Collections.<String>emptySet());
    } else {
      logger.log(Level.FINER, "Indexed {0} {1}/{2}", new Object[] {kind(), namespace, name});
      changed(Collections.singleton(namespace));
    }
  }

  @Override
  public final void delete(String namespace, String name) {
    Map<String, V> entries = entries(namespace, false);
    if (entries != null && entries.remove(name) != null) {
      logger.log(Level.FINER, "Removed {0} {1}/{2}", new Object[] {kind(), namespace, name});
      changed(Collections.singleton(namespace));
    } else {
      changed(Collections.<String>emptySet());
    }
  }

  @Override
  public final void reset(List<T> resources, Map<String, Set<String>> removed) {
    Map<String, Map<String, V>> desired = new HashMap<>();
    for (T resource : resources) {
      String namespace = resource.metadata().namespace();
      String name = resource.metadata().name();
      V value;
      try {
        value = parse(resource);
      } catch (InvalidResourceException e) {
        logger.log(Level.WARNING, "Ignoring invalid {0} {1}/{2}: {3}",
            new Object[] {kind(), namespace, name, e.getMessage()});
        Map<String, V> existing = entries(namespace, false);
        value = existing == null ? null : existing.get(name);
      }
      if (value == null) {
        continue;
      }
      Map<String, V> byName = desired.get(namespace);
      if (byName == null) {
        byName = new HashMap<>();
        desired.put(namespace, byName);
      }
      byName.put(name, value);
    }

    Set<String> namespaces = new HashSet<>(indexedNamespaces());
    namespaces.addAll(desired.keySet());
    namespaces.addAll(removed.keySet());
    Set<String> changed = new HashSet<>();
    for (String namespace : namespaces) {
      Map<String, V> want = desired.get(namespace);
      Map<String, V> entries = entries(namespace, want != null);
      if (entries == null) {
        continue;
      }
      if (want == null) {
        want = Collections.emptyMap();
      }
      if (!entries.equals(want)) {
        entries.clear();
        entries.putAll(want);
        changed.add(namespace);
      }
    }
    if (!changed.isEmpty()) {
      logger.log(Level.FINE, "Reset {0}: {1} namespaces changed",
          new Object[] {kind(), changed.size()});
    }
    changed(ImmutableSet.copyOf(changed));
  }
}
