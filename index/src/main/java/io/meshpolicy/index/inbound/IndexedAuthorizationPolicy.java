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
import io.meshpolicy.ClientAuthentication;
import io.meshpolicy.ClientAuthorization;
import io.meshpolicy.IdentityMatch;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.NamespacedName;
import io.meshpolicy.resource.AuthorizationPolicy;
import io.meshpolicy.resource.ObjectReference;

/**
 * A validated AuthorizationPolicy. Authentication references are kept unresolved since the
 * referenced resources change independently.
 */
@AutoValue
abstract class IndexedAuthorizationPolicy {
  enum TargetKind { SERVER, NAMESPACE, HTTP_ROUTE, GRPC_ROUTE }

  abstract TargetKind targetKind();

  abstract String targetName();

  abstract ImmutableList<NamespacedName> meshTlsRefs();

  abstract ImmutableList<NamespacedName> networkRefs();

  abstract ImmutableList<IdentityMatch> serviceAccounts();

  static IndexedAuthorizationPolicy parse(AuthorizationPolicy policy, ClusterInfo cluster)
      throws InvalidResourceException {
    String namespace = policy.metadata().namespace();
    ObjectReference target = policy.targetRef();
    if (target.namespace() != null && !target.namespace().equals(namespace)) {
      throw new InvalidResourceException("target must be in the policy's namespace");
    }
    TargetKind targetKind;
    if (target.isKind("Server")) {
      targetKind = TargetKind.SERVER;
    } else if (target.isKind("Namespace")) {
      if (!target.name().equals(namespace)) {
        throw new InvalidResourceException("target namespace must be the policy's namespace");
      }
      targetKind = TargetKind.NAMESPACE;
    } else if (target.isKind("HTTPRoute")) {
      targetKind = TargetKind.HTTP_ROUTE;
    } else if (target.isKind("GRPCRoute")) {
      targetKind = TargetKind.GRPC_ROUTE;
    } else {
      throw new InvalidResourceException("unsupported target kind: " + target.kind());
    }

    ImmutableList.Builder<NamespacedName> meshTls = ImmutableList.builder();
    ImmutableList.Builder<NamespacedName> networks = ImmutableList.builder();
    ImmutableList.Builder<IdentityMatch> serviceAccounts = ImmutableList.builder();
    for (ObjectReference ref : policy.requiredAuthenticationRefs()) {
      String refNamespace = ref.namespace() == null ? namespace : ref.namespace();
      if (ref.isKind("MeshTLSAuthentication")) {
        meshTls.add(NamespacedName.of(refNamespace, ref.name()));
      } else if (ref.isKind("NetworkAuthentication")) {
        networks.add(NamespacedName.of(refNamespace, ref.name()));
      } else if (ref.isKind("ServiceAccount")) {
        serviceAccounts.add(
            IdentityMatch.exact(cluster.serviceAccountIdentity(refNamespace, ref.name())));
      } else {
        throw new InvalidResourceException("unsupported authentication kind: " + ref.kind());
      }
    }
    if (policy.requiredAuthenticationRefs().isEmpty()) {
      throw new InvalidResourceException("at least one authentication must be required");
    }
    return new AutoValue_IndexedAuthorizationPolicy(targetKind, target.name(), meshTls.build(),
        networks.build(), serviceAccounts.build());
  }

  /** Resolves the referenced authentications into a client authorization. */
  ClientAuthorization resolve(AuthenticationIndex authentications)
      throws InvalidResourceException {
    if (meshTlsRefs().size() > 1) {
      throw new InvalidResourceException("only a single MeshTLSAuthentication may be set");
    }
    if (networkRefs().size() > 1) {
      throw new InvalidResourceException("only a single NetworkAuthentication may be set");
    }
    if (!meshTlsRefs().isEmpty() && !serviceAccounts().isEmpty()) {
      throw new InvalidResourceException(
          "a MeshTLSAuthentication and ServiceAccounts may not both be set");
    }

    ImmutableList<IdentityMatch> identities = serviceAccounts();
    if (!meshTlsRefs().isEmpty()) {
      NamespacedName ref = meshTlsRefs().get(0);
      identities = authentications.meshTls(ref.namespace(), ref.name());
      if (identities == null) {
        throw new InvalidResourceException("MeshTLSAuthentication " + ref + " not found");
      }
    }
    ImmutableList<NetworkMatch> networks = NetworkMatch.all();
    if (!networkRefs().isEmpty()) {
      NamespacedName ref = networkRefs().get(0);
      networks = authentications.networks(ref.namespace(), ref.name());
      if (networks == null) {
        throw new InvalidResourceException("NetworkAuthentication " + ref + " not found");
      }
    }
    ClientAuthentication authentication = identities.isEmpty()
        ? ClientAuthentication.unauthenticatedClients()
        : ClientAuthentication.authenticatedClients(identities);
    return ClientAuthorization.create(networks, authentication);
  }
}
