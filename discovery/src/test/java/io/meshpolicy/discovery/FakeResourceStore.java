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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.gson.JsonObject;
import io.meshpolicy.ResourceId;
import io.meshpolicy.resource.ResourceWatches;
import io.meshpolicy.status.LeaderStatus;
import io.meshpolicy.status.StatusPatcher;
import java.util.AbstractMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import javax.annotation.Nullable;

/** A store that hands its watches to the test and records status patches. */
final class FakeResourceStore implements ResourceStore {
  final Map<String, ?> settings;
  final BlockingQueue<Map.Entry<ResourceId, JsonObject>> patches = new LinkedBlockingQueue<>();
  @Nullable
  ResourceWatches watches;
  boolean shutdown;

  private final StatusPatcher patcher = new StatusPatcher() {
    @Override
    public ListenableFuture<Void> patch(ResourceId id, JsonObject mergePatch) {
      patches.add(new AbstractMap.SimpleImmutableEntry<>(id, mergePatch));
      return Futures.immediateFuture(null);
    }
  };

  private final LeaderStatus leaderStatus = new LeaderStatus() {
    @Override
    public boolean isLeader() {
      return true;
    }

    @Override
    public void addListener(Runnable listener, Executor executor) {}
  };

  FakeResourceStore(Map<String, ?> settings) {
    this.settings = settings;
  }

  @Override
  public synchronized void start(ResourceWatches watches) {
    this.watches = watches;
  }

  @Override
  public StatusPatcher statusPatcher() {
    return patcher;
  }

  @Override
  public LeaderStatus leaderStatus() {
    return leaderStatus;
  }

  @Override
  public synchronized void shutdown() {
    shutdown = true;
  }
}
