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

package io.meshpolicy.status;

import java.util.concurrent.Executor;

/** Reports whether this replica holds the status-writer lease. */
public interface LeaderStatus {
  boolean isLeader();

  /** Runs {@code listener} on {@code executor} whenever leadership is acquired or lost. */
  void addListener(Runnable listener, Executor executor);
}
