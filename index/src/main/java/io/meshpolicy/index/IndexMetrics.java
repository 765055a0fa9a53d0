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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import io.meshpolicy.resource.Resource;
import io.meshpolicy.resource.ResourceHandler;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts resource events per namespace and kind and reports index sizes. Safe to read from any
 * thread.
 */
public final class IndexMetrics {
  public enum Operation { APPLY, DELETE, RESET }

  /** The namespace reported for resets, which span namespaces. */
  public static final String ALL_NAMESPACES = "";

  private final ConcurrentMap<Key, LongAdder> counters = new ConcurrentHashMap<>();
  private volatile ImmutableMap<String, Integer> sizes = ImmutableMap.of();

  @AutoValue
  public abstract static class Key {
    public abstract String namespace();

    public abstract String kind();

    public abstract Operation operation();

    public static Key create(String namespace, String kind, Operation operation) {
      return new AutoValue_IndexMetrics_Key(namespace, kind, operation);
    }
  }

  public long count(String namespace, String kind, Operation operation) {
    LongAdder counter = counters.get(Key.create(namespace, kind, operation));
    return counter == null ? 0 : counter.sum();
  }

  public ImmutableMap<Key, Long> counts() {
    ImmutableMap.Builder<Key, Long> counts = ImmutableMap.builder();
    for (Map.Entry<Key, LongAdder> entry : counters.entrySet()) {
      counts.put(entry.getKey(), entry.getValue().sum());
    }
    return counts.build();
  }

  /** Index sizes by kind as of the last processed event. */
  public ImmutableMap<String, Integer> sizes() {
    return sizes;
  }

  void recordSizes(ImmutableMap<String, Integer> sizes) {
    this.sizes = sizes;
  }

  void increment(String namespace, String kind, Operation operation) {
    Key key = Key.create(namespace, kind, operation);
    LongAdder counter = counters.get(key);
    if (counter == null) {
      LongAdder created = new LongAdder();
      counter = counters.putIfAbsent(key, created);
      if (counter == null) {
        counter = created;
      }
    }
    counter.increment();
  }

  /** Wraps a handler so that its events are counted under {@code kind}. */
  public <T extends Resource> ResourceHandler<T> counting(
      final String kind, final ResourceHandler<T> handler) {
    return new ResourceHandler<T>() {
      @Override
      public void apply(T resource) {
        increment(resource.metadata().namespace(), kind, Operation.APPLY);
        handler.apply(resource);
      }

      @Override
      public void delete(String namespace, String name) {
        increment(namespace, kind, Operation.DELETE);
        handler.delete(namespace, name);
      }

      @Override
      public void reset(List<T> resources, Map<String, Set<String>> removed) {
        increment(ALL_NAMESPACES, kind, Operation.RESET);
        handler.reset(resources, removed);
      }
    };
  }
}
