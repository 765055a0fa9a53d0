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

package io.meshpolicy.index.outbound;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.TrafficPolicy;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.MostSpecificNetwork;
import io.meshpolicy.index.Networks;
import io.meshpolicy.resource.EgressNetwork;
import java.time.Instant;
import javax.annotation.Nullable;

@AutoValue
abstract class EgressNetworkInfo implements MostSpecificNetwork.Candidate {

  @Override
  public abstract String namespace();

  @Override
  public abstract String name();

  @Override
  @Nullable
  public abstract Instant creationTimestamp();

  @Override
  public abstract ImmutableList<NetworkMatch> networks();

  abstract TrafficPolicy trafficPolicy();

  static EgressNetworkInfo parse(EgressNetwork network, ClusterInfo cluster)
      throws InvalidResourceException {
    ImmutableList<NetworkMatch> networks = Networks.parseAll(
        network.networks(), Networks.outsideCluster(cluster.clusterNetworks()));
    return new AutoValue_EgressNetworkInfo(network.metadata().namespace(),
        network.metadata().name(), network.metadata().creationTimestamp(), networks,
        network.trafficPolicy());
  }
}
