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
import com.google.common.collect.ImmutableSet;
import io.meshpolicy.index.Annotations;
import io.meshpolicy.index.DefaultPolicy;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.PortSets;
import java.util.Map;
import javax.annotation.Nullable;

/** Per-workload policy settings read from annotations. */
@AutoValue
abstract class WorkloadSettings {

  abstract ImmutableSet<Integer> opaquePorts();

  abstract ImmutableSet<Integer> requireIdentityPorts();

  /** Overrides the namespace and cluster defaults when set. */
  @Nullable
  abstract DefaultPolicy defaultPolicy();

  static WorkloadSettings parse(Map<String, String> annotations)
      throws InvalidResourceException {
    ImmutableSet<Integer> opaque = ImmutableSet.of();
    if (annotations.containsKey(Annotations.OPAQUE_PORTS)) {
      opaque = PortSets.parsePortSet(annotations.get(Annotations.OPAQUE_PORTS));
    }
    ImmutableSet<Integer> requireIdentity = ImmutableSet.of();
    if (annotations.containsKey(Annotations.REQUIRE_IDENTITY_PORTS)) {
      requireIdentity = PortSets.parsePortSet(annotations.get(Annotations.REQUIRE_IDENTITY_PORTS));
    }
    DefaultPolicy policy = null;
    if (annotations.containsKey(Annotations.DEFAULT_INBOUND_POLICY)) {
      policy = DefaultPolicy.parse(annotations.get(Annotations.DEFAULT_INBOUND_POLICY));
    }
    return new AutoValue_WorkloadSettings(opaque, requireIdentity, policy);
  }
}
