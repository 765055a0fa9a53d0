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

import io.meshpolicy.resource.ResourceWatches;
import io.meshpolicy.status.LeaderStatus;
import io.meshpolicy.status.StatusPatcher;

/**
 * A source of cluster resources. A store lists and watches every resource kind and delivers the
 * events to the {@link ResourceWatches} it is started with; it also writes resource statuses and
 * tracks the status-writer lease.
 */
public interface ResourceStore {

  /**
   * Starts delivering events. Each kind begins with a {@code reset} carrying its full listing.
   * Called at most once.
   */
  void start(ResourceWatches watches);

  StatusPatcher statusPatcher();

  LeaderStatus leaderStatus();

  /** Stops watching. Events may still be delivered while this method runs. */
  void shutdown();
}
