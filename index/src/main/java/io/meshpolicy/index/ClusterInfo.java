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

package io.meshpolicy.index;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.meshpolicy.Cidr;
import io.meshpolicy.NetworkMatch;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/** Cluster-wide settings shared by all policy computations. */
@AutoValue
public abstract class ClusterInfo {

  /** Networks containing all pod and node addresses. */
  public abstract ImmutableList<Cidr> clusterNetworks();

  /** Trust domain suffix of mesh identities, e.g. {@code cluster.local}. */
  public abstract String identityDomain();

  /** DNS suffix of Services, e.g. {@code cluster.local}. */
  public abstract String clusterDomain();

  public abstract DefaultPolicy defaultPolicy();

  public abstract Duration defaultDetectTimeout();

  public abstract ImmutableSet<Integer> defaultOpaquePorts();

  /** Networks from which probes are sent; empty disables probe routes. */
  public abstract ImmutableList<Cidr> probeNetworks();

  /** Namespace whose EgressNetworks apply to workloads in every namespace. */
  public abstract String globalEgressNetworkNamespace();

  public abstract String controlPlaneNamespace();

  public static Builder builder() {
    return new AutoValue_ClusterInfo.Builder()
        .setClusterNetworks(ImmutableList.of(
            Cidr.parse("10.0.0.0/8"), Cidr.parse("100.64.0.0/10"), Cidr.parse("172.16.0.0/12"),
            Cidr.parse("192.168.0.0/16"), Cidr.parse("fd00::/8")))
        .setIdentityDomain("cluster.local")
        .setClusterDomain("cluster.local")
        .setDefaultPolicy(DefaultPolicy.allow(false, false))
        .setDefaultDetectTimeout(Duration.ofSeconds(10))
        .setDefaultOpaquePorts(ImmutableSet.of(25, 587, 3306, 4444, 5432, 6379, 9300, 11211))
        .setProbeNetworks(ImmutableList.of(Cidr.allIpv4(), Cidr.allIpv6()))
        .setGlobalEgressNetworkNamespace("linkerd-egress")
        .setControlPlaneNamespace("linkerd");
  }

  public abstract Builder toBuilder();

  /** The mesh identity of a service account. */
  public final String serviceAccountIdentity(String namespace, String serviceAccount) {
    return serviceAccount + "." + namespace + ".serviceaccount.identity."
        + controlPlaneNamespace() + "." + identityDomain();
  }

  /** Identity suffix shared by every workload identity in the mesh. */
  public final ImmutableList<String> identitySuffix() {
    return ImmutableList.<String>builder()
        .add("serviceaccount", "identity", controlPlaneNamespace())
        .add(identityDomain().split("\\."))
        .build();
  }

  public final String serviceAuthority(String namespace, String name, int port) {
    return name + "." + namespace + ".svc." + clusterDomain() + ":" + port;
  }

  public final ImmutableList<NetworkMatch> clusterNetworkMatches() {
    return NetworkMatch.of(clusterNetworks());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setClusterNetworks(List<Cidr> networks);

    public abstract Builder setIdentityDomain(String domain);

    public abstract Builder setClusterDomain(String domain);

    public abstract Builder setDefaultPolicy(DefaultPolicy policy);

    public abstract Builder setDefaultDetectTimeout(Duration timeout);

    public abstract Builder setDefaultOpaquePorts(Set<Integer> ports);

    public abstract Builder setProbeNetworks(List<Cidr> networks);

    public abstract Builder setGlobalEgressNetworkNamespace(String namespace);

    public abstract Builder setControlPlaneNamespace(String namespace);

    public abstract ClusterInfo build();
  }
}
