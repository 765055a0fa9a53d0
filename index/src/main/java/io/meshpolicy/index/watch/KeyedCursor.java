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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import java.util.concurrent.Executor;
import javax.annotation.Nullable;

/**
 * A subscriber's position in both levels of a {@link CellGroup}. When the key's cell is
 * replaced the cursor follows the new cell. A cursor is used by one subscriber task at a time.
 */
public final class KeyedCursor<K, V> {
  private final Cell<ImmutableMap<K, Cell<V>>> directory;
  private final K key;

  private Runnable listener;
  private Executor executor;
  private Cell<ImmutableMap<K, Cell<V>>>.Registration directoryRegistration;
  private long directoryVersion = -1;
  @Nullable
  private Cell<V> inner;
  @Nullable
  private Cell<V>.Registration innerRegistration;
  private long innerVersion = -1;
  private boolean seenKey;
  private boolean cancelled;

  KeyedCursor(Cell<ImmutableMap<K, Cell<V>>> directory, K key) {
    this.directory = directory;
    this.key = key;
  }

  public K key() {
    return key;
  }

  /** Registers {@code listener} on both levels; it runs on {@code executor} after changes. */
  public void start(Runnable listener, Executor executor) {
    checkState(this.listener == null, "already started");
    this.listener = listener;
    this.executor = executor;
    directoryRegistration = directory.subscribe(listener, executor);
    followDirectory();
    if (inner != null && innerRegistration == null) {
      innerRegistration = inner.subscribe(listener, executor);
    }
  }

  /**
   * Returns the current value if it has not been returned before, or null if nothing changed
   * since the last call. The first call returns the current value.
   */
  @Nullable
  public V poll() {
    if (cancelled) {
      return null;
    }
    followDirectory();
    if (inner == null) {
      return null;
    }
    Cell.Snapshot<V> snapshot = inner.snapshot();
    if (snapshot.closed || snapshot.version == innerVersion) {
      return null;
    }
    innerVersion = snapshot.version;
    return snapshot.value;
  }

  /** Whether the key was removed or the whole group closed. */
  public boolean isClosed() {
    if (cancelled || directory.isClosed()) {
      return true;
    }
    followDirectory();
    return seenKey && (inner == null || inner.isClosed());
  }

  /** Drops both registrations. No further notifications are delivered. */
  public void cancel() {
    cancelled = true;
    if (directoryRegistration != null) {
      directoryRegistration.cancel();
    }
    if (innerRegistration != null) {
      innerRegistration.cancel();
    }
  }

  private void followDirectory() {
    Cell.Snapshot<ImmutableMap<K, Cell<V>>> snapshot = directory.snapshot();
    if (snapshot.version == directoryVersion) {
      return;
    }
    directoryVersion = snapshot.version;
    Cell<V> next = snapshot.value.get(key);
    if (next == inner) {
      return;
    }
    if (innerRegistration != null) {
      innerRegistration.cancel();
      innerRegistration = null;
    }
    inner = next;
    innerVersion = -1;
    if (inner != null) {
      seenKey = true;
      if (listener != null) {
        innerRegistration = inner.subscribe(listener, executor);
      }
    }
  }
}
