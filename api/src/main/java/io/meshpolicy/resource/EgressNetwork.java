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
import io.meshpolicy.TrafficPolicy;
import java.util.List;

/** Describes destinations outside the cluster and whether traffic to them is allowed. */
@AutoValue
public abstract class EgressNetwork implements Resource {

  @Override
  public abstract ObjectMeta metadata();

  public abstract TrafficPolicy trafficPolicy();

  /** When empty, every address outside the cluster networks. */
  public abstract ImmutableList<NetworkSpec> networks();

  public static EgressNetwork create(
      ObjectMeta metadata, TrafficPolicy trafficPolicy, List<NetworkSpec> networks) {
    return new AutoValue_EgressNetwork(metadata, trafficPolicy, ImmutableList.copyOf(networks));
  }
}
