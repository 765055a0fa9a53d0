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
import static com.google.common.base.Preconditions.checkState;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A single-slot holder of the latest value with change notification. There is one writer;
 * readers see immutable snapshots and are told about changes through listeners registered with
 * {@link #subscribe}. Listeners are only told that something changed and must re-read.
 *
 * <p>Values must be immutable.
 */
public final class Cell<T> {
  private static final Logger logger = Logger.getLogger(Cell.class.getName());

  private final CopyOnWriteArrayList<Registration> registrations =
      new CopyOnWriteArrayList<>();
  private volatile Snapshot<T> snapshot;

  public Cell(T initial) {
    this.snapshot = new Snapshot<T>(checkNotNull(initial, "initial"), 0, false);
  }

  public T get() {
    return snapshot.value;
  }

  public boolean isClosed() {
    return snapshot.closed;
  }

  Snapshot<T> snapshot() {
    return snapshot;
  }

  /**
   * Publishes {@code value} unless it equals the current value.
   *
   * @return whether subscribers were notified
   */
  public boolean sendIfModified(T value) {
    checkNotNull(value, "value");
    Snapshot<T> current = snapshot;
    checkState(!current.closed, "cell is closed");
    if (current.value.equals(value)) {
      return false;
    }
    snapshot = new Snapshot<T>(value, current.version + 1, false);
    notifyListeners();
    return true;
  }

  /** Publishes {@code value} and notifies subscribers even if it is unchanged. */
  public void send(T value) {
    checkNotNull(value, "value");
    Snapshot<T> current = snapshot;
    checkState(!current.closed, "cell is closed");
    snapshot = new Snapshot<T>(value, current.version + 1, false);
    notifyListeners();
  }

  /** Marks the cell closed, notifying subscribers a final time. Idempotent. */
  public void close() {
    Snapshot<T> current = snapshot;
    if (current.closed) {
      return;
    }
    snapshot = new Snapshot<T>(current.value, current.version + 1, true);
    notifyListeners();
  }

  /**
   * Registers {@code listener} to run on {@code executor} after every change. Registration
   * happens before the caller's next read, so no change after that read can be missed.
   */
  public Registration subscribe(Runnable listener, Executor executor) {
    Registration registration = new Registration(
        checkNotNull(listener, "listener"), checkNotNull(executor, "executor"));
    registrations.add(registration);
    return registration;
  }

  int subscriberCount() {
    return registrations.size();
  }

  private void notifyListeners() {
    for (Registration registration : registrations) {
      try {
        registration.executor.execute(registration.listener);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to notify subscriber", e);
      }
    }
  }

  /** A subscription to a cell. */
  public final class Registration {
    private final Runnable listener;
    private final Executor executor;

    private Registration(Runnable listener, Executor executor) {
      this.listener = listener;
      this.executor = executor;
    }

    public void cancel() {
      registrations.remove(this);
    }
  }

  static final class Snapshot<T> {
    final T value;
    final long version;
    final boolean closed;

    Snapshot(T value, long version, boolean closed) {
      this.value = value;
      this.version = version;
      this.closed = closed;
    }
  }
}
