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

package io.meshpolicy.resource;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** An HTTP local rate limit attached to a Server. */
@AutoValue
public abstract class RateLimitPolicy implements Resource {

  @Override
  public abstract ObjectMeta metadata();

  public abstract ObjectReference targetRef();

  @Nullable
  public abstract Integer totalRps();

  @Nullable
  public abstract Integer identityRps();

  public abstract ImmutableList<RpsOverride> overrides();

  public static RateLimitPolicy create(ObjectMeta metadata, ObjectReference targetRef,
      @Nullable Integer totalRps, @Nullable Integer identityRps, List<RpsOverride> overrides) {
    return new AutoValue_RateLimitPolicy(
        metadata, targetRef, totalRps, identityRps, ImmutableList.copyOf(overrides));
  }

  /** A per-identity rate for the referenced clients. */
  @AutoValue
  public abstract static class RpsOverride {
    public abstract int requestsPerSecond();

    public abstract ImmutableList<ObjectReference> clientRefs();

    public static RpsOverride create(int requestsPerSecond, List<ObjectReference> clientRefs) {
      return new AutoValue_RateLimitPolicy_RpsOverride(
          requestsPerSecond, ImmutableList.copyOf(clientRefs));
    }
  }
}
