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

package io.meshpolicy.index.inbound;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.meshpolicy.RateLimit;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.resource.ObjectReference;
import io.meshpolicy.resource.RateLimitPolicy;
import java.time.Instant;
import javax.annotation.Nullable;

@AutoValue
abstract class IndexedRateLimit {

  abstract String server();

  abstract RateLimit limit();

  @Nullable
  abstract Instant creationTimestamp();

  static IndexedRateLimit parse(RateLimitPolicy policy, ClusterInfo cluster)
      throws InvalidResourceException {
    if (!policy.targetRef().isKind("Server")) {
      throw new InvalidResourceException("rate limits may only target Servers");
    }
    checkRps(policy.totalRps());
    checkRps(policy.identityRps());
    String namespace = policy.metadata().namespace();
    ImmutableList.Builder<RateLimit.OverrideLimit> overrides = ImmutableList.builder();
    for (RateLimitPolicy.RpsOverride override : policy.overrides()) {
      checkRps(override.requestsPerSecond());
      ImmutableList.Builder<String> identities = ImmutableList.builder();
      for (ObjectReference ref : override.clientRefs()) {
        if (!ref.isKind("ServiceAccount")) {
          throw new InvalidResourceException("overrides may only reference ServiceAccounts");
        }
        String refNamespace = ref.namespace() == null ? namespace : ref.namespace();
        identities.add(cluster.serviceAccountIdentity(refNamespace, ref.name()));
      }
      overrides.add(
          RateLimit.OverrideLimit.create(override.requestsPerSecond(), identities.build()));
    }
    RateLimit limit = RateLimit.create(policy.metadata().name(), policy.totalRps(),
        policy.identityRps(), overrides.build());
    return new AutoValue_IndexedRateLimit(
        policy.targetRef().name(), limit, policy.metadata().creationTimestamp());
  }

  private static void checkRps(@Nullable Integer rps) throws InvalidResourceException {
    if (rps != null && rps <= 0) {
      throw new InvalidResourceException("requests per second must be positive: " + rps);
    }
  }
}
