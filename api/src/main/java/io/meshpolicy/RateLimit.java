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

package io.meshpolicy;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** Local request-rate limits attached to a Server. */
@AutoValue
public abstract class RateLimit {

  public abstract String name();

  /** Requests per second across all clients. */
  @Nullable
  public abstract Integer totalRps();

  /** Requests per second per client identity. */
  @Nullable
  public abstract Integer identityRps();

  public abstract ImmutableList<OverrideLimit> overrides();

  public static RateLimit create(String name, @Nullable Integer totalRps,
      @Nullable Integer identityRps, List<OverrideLimit> overrides) {
    return new AutoValue_RateLimit(name, totalRps, identityRps, ImmutableList.copyOf(overrides));
  }

  /** A rate that replaces the per-identity limit for the listed identities. */
  @AutoValue
  public abstract static class OverrideLimit {
    public abstract int requestsPerSecond();

    public abstract ImmutableList<String> clientIdentities();

    public static OverrideLimit create(int requestsPerSecond, List<String> clientIdentities) {
      return new AutoValue_RateLimit_OverrideLimit(
          requestsPerSecond, ImmutableList.copyOf(clientIdentities));
    }
  }
}
