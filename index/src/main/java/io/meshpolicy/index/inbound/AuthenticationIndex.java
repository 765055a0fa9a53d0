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

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;
import io.meshpolicy.IdentityMatch;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.NamespacedName;
import io.meshpolicy.index.Networks;
import io.meshpolicy.resource.MeshTlsAuthentication;
import io.meshpolicy.resource.NetworkAuthentication;
import io.meshpolicy.resource.ObjectReference;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * MeshTLSAuthentication and NetworkAuthentication resources of all namespaces. They are kept
 * apart from the per-namespace index because AuthorizationPolicies may reference them across
 * namespaces.
 */
final class AuthenticationIndex {
  final Map<String, Map<String, ImmutableList<IdentityMatch>>> meshTls = new HashMap<>();
  final Map<String, Map<String, ImmutableList<NetworkMatch>>> networks = new HashMap<>();

  /** Namespaces whose AuthorizationPolicies reference each authentication. */
  private final SetMultimap<NamespacedName, String> meshTlsReferrers = HashMultimap.create();
  private final SetMultimap<NamespacedName, String> networkReferrers = HashMultimap.create();
  private final Map<String, ImmutableSet<NamespacedName>> meshTlsRefsByNamespace =
      new HashMap<>();
  private final Map<String, ImmutableSet<NamespacedName>> networkRefsByNamespace =
      new HashMap<>();

  /** Records the authentications referenced by the policies of {@code namespace}. */
  void setReferences(String namespace, Collection<IndexedAuthorizationPolicy> policies) {
    ImmutableSet.Builder<NamespacedName> meshTlsRefs = ImmutableSet.builder();
    ImmutableSet.Builder<NamespacedName> networkRefs = ImmutableSet.builder();
    for (IndexedAuthorizationPolicy policy : policies) {
      meshTlsRefs.addAll(policy.meshTlsRefs());
      networkRefs.addAll(policy.networkRefs());
    }
    replace(namespace, meshTlsRefs.build(), meshTlsRefsByNamespace, meshTlsReferrers);
    replace(namespace, networkRefs.build(), networkRefsByNamespace, networkReferrers);
  }

  Set<String> meshTlsReferrers(NamespacedName ref) {
    return meshTlsReferrers.get(ref);
  }

  Set<String> networkReferrers(NamespacedName ref) {
    return networkReferrers.get(ref);
  }

  private static void replace(String namespace, ImmutableSet<NamespacedName> refs,
      Map<String, ImmutableSet<NamespacedName>> refsByNamespace,
      SetMultimap<NamespacedName, String> referrers) {
    ImmutableSet<NamespacedName> previous = refs.isEmpty()
        ? refsByNamespace.remove(namespace)
        : refsByNamespace.put(namespace, refs);
    if (previous != null) {
      for (NamespacedName ref : previous) {
        referrers.remove(ref, namespace);
      }
    }
    for (NamespacedName ref : refs) {
      referrers.put(ref, namespace);
    }
  }

  @Nullable
  ImmutableList<IdentityMatch> meshTls(String namespace, String name) {
    Map<String, ImmutableList<IdentityMatch>> byName = meshTls.get(namespace);
    return byName == null ? null : byName.get(name);
  }

  @Nullable
  ImmutableList<NetworkMatch> networks(String namespace, String name) {
    Map<String, ImmutableList<NetworkMatch>> byName = networks.get(namespace);
    return byName == null ? null : byName.get(name);
  }

  int size() {
    int size = 0;
    for (Map<String, ImmutableList<IdentityMatch>> byName : meshTls.values()) {
      size += byName.size();
    }
    for (Map<String, ImmutableList<NetworkMatch>> byName : networks.values()) {
      size += byName.size();
    }
    return size;
  }

  static ImmutableList<IdentityMatch> parse(MeshTlsAuthentication authn, ClusterInfo cluster)
      throws InvalidResourceException {
    ImmutableList.Builder<IdentityMatch> identities = ImmutableList.builder();
    for (String identity : authn.identities()) {
      identities.add(IdentityMatch.parse(identity));
    }
    for (ObjectReference ref : authn.identityRefs()) {
      if (ref.isKind("ServiceAccount")) {
        String namespace = ref.namespace() == null ? authn.metadata().namespace() : ref.namespace();
        identities.add(IdentityMatch.exact(cluster.serviceAccountIdentity(namespace, ref.name())));
      } else if ("*".equals(ref.kind()) || "*".equals(ref.name())) {
        identities.add(IdentityMatch.suffix(ImmutableList.<String>of()));
      } else {
        throw new InvalidResourceException("unsupported identity reference kind: " + ref.kind());
      }
    }
    ImmutableList<IdentityMatch> result = identities.build();
    if (result.isEmpty()) {
      throw new InvalidResourceException("no identities specified");
    }
    return result;
  }

  static ImmutableList<NetworkMatch> parse(NetworkAuthentication authn)
      throws InvalidResourceException {
    if (authn.networks().isEmpty()) {
      throw new InvalidResourceException("no networks specified");
    }
    return Networks.parseAll(authn.networks(), ImmutableList.<NetworkMatch>of());
  }
}
