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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import io.meshpolicy.index.ClusterInfo;

/** Settings the controller runs with. */
@AutoValue
public abstract class BootstrapConfig {
  static final int DEFAULT_GRPC_PORT = 8090;
  static final long DEFAULT_STATUS_PATCH_TIMEOUT_NANOS = 5_000_000_000L;
  static final int DEFAULT_STATUS_PATCH_RETRIES = 3;

  public abstract ClusterInfo cluster();

  public abstract int grpcPort();

  /** Bound on each status write attempt. */
  public abstract long statusPatchTimeoutNanos();

  /** Additional attempts made after a failed status write. */
  public abstract int statusPatchRetries();

  /** Settings passed through to the resource store, keyed as in the bootstrap file. */
  public abstract ImmutableMap<String, Object> resourceStore();

  public static Builder builder() {
    return new AutoValue_BootstrapConfig.Builder()
        .setCluster(ClusterInfo.builder().build())
        .setGrpcPort(DEFAULT_GRPC_PORT)
        .setStatusPatchTimeoutNanos(DEFAULT_STATUS_PATCH_TIMEOUT_NANOS)
        .setStatusPatchRetries(DEFAULT_STATUS_PATCH_RETRIES)
        .setResourceStore(ImmutableMap.<String, Object>of());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setCluster(ClusterInfo cluster);

    public abstract Builder setGrpcPort(int port);

    public abstract Builder setStatusPatchTimeoutNanos(long timeoutNanos);

    public abstract Builder setStatusPatchRetries(int retries);

    public abstract Builder setResourceStore(ImmutableMap<String, Object> settings);

    public abstract BootstrapConfig build();
  }
}
