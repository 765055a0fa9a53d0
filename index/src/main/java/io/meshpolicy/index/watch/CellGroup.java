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

package io.meshpolicy.index.watch;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The outer level of the distribution tree: a cell holding the directory of per-key cells for
 * one key prefix. Changing a value touches only that key's cell; adding or removing a key
 * publishes a new directory.
 *
 * <p>Mutators must only be called by the single writer.
 */
public final class CellGroup<K, V> {
  private final Cell<ImmutableMap<K, Cell<V>>> directory =
      new Cell<ImmutableMap<K, Cell<V>>>(ImmutableMap.<K, Cell<V>>of());

  @Nullable
  public Cell<V> get(K key) {
    return directory.get().get(key);
  }

  @Nullable
  public V getValue(K key) {
    Cell<V> cell = get(key);
    return cell == null ? null : cell.get();
  }

  public ImmutableSet<K> keys() {
    return directory.get().keySet();
  }

  public boolean isEmpty() {
    return directory.get().isEmpty();
  }

  /** Returns the cell for {@code key}, creating it with {@code initial} if absent. */
  public Cell<V> getOrCreate(K key, V initial) {
    checkNotNull(key, "key");
    Cell<V> cell = get(key);
    if (cell != null) {
      return cell;
    }
    cell = new Cell<V>(initial);
    Map<K, Cell<V>> next = new LinkedHashMap<>(directory.get());
    next.put(key, cell);
    directory.send(ImmutableMap.copyOf(next));
    return cell;
  }

  /**
   * Publishes a new value for an existing key.
   *
   * @return whether the value changed; false also when the key is absent
   */
  public boolean update(K key, V value) {
    Cell<V> cell = get(key);
    return cell != null && cell.sendIfModified(value);
  }

  /** Removes a key and closes its cell. */
  public void remove(K key) {
    Cell<V> cell = get(key);
    if (cell == null) {
      return;
    }
    Map<K, Cell<V>> next = new LinkedHashMap<>(directory.get());
    next.remove(key);
    directory.send(ImmutableMap.copyOf(next));
    cell.close();
  }

  /** Closes every key and the directory itself. */
  public void close() {
    for (Cell<V> cell : directory.get().values()) {
      cell.close();
    }
    directory.close();
  }

  /** A cursor following {@code key}; the key need not exist yet. */
  public KeyedCursor<K, V> cursor(K key) {
    return new KeyedCursor<K, V>(directory, key);
  }
}
