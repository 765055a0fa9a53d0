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
import io.meshpolicy.index.Networks;
import io.meshpolicy.resource.LabelSelector;
import io.meshpolicy.resource.ObjectReference;
import io.meshpolicy.resource.ServerAuthorization;
import javax.annotation.Nullable;

/** A validated ServerAuthorization. */
@AutoValue
abstract class IndexedServerAuthorization {

  @Nullable
  abstract String serverName();

  @Nullable
  abstract LabelSelector serverSelector();

  abstract ClientAuthorization client();

  boolean selects(IndexedServer server) {
    if (serverName() != null) {
      return serverName().equals(server.name());
    }
    return serverSelector().matches(server.labels());
  }

  static IndexedServerAuthorization parse(ServerAuthorization authz, ClusterInfo cluster)
      throws InvalidResourceException {
    if ((authz.serverName() == null) == (authz.serverSelector() == null)) {
      throw new InvalidResourceException(
          "servers must be selected by exactly one of name or label");
    }
    ImmutableList<NetworkMatch> networks = Networks.parseAll(authz.networks(), NetworkMatch.all());
    return new AutoValue_IndexedServerAuthorization(authz.serverName(), authz.serverSelector(),
        ClientAuthorization.create(networks, authentication(authz, cluster)));
  }

  private static ClientAuthentication authentication(
      ServerAuthorization authz, ClusterInfo cluster) throws InvalidResourceException {
    ServerAuthorization.MeshTls meshTls = authz.meshTls();
    if (authz.unauthenticated()) {
      if (meshTls != null) {
        throw new InvalidResourceException("unauthenticated clients may not also set meshTLS");
      }
      return ClientAuthentication.unauthenticatedClients();
    }
    if (meshTls == null) {
      throw new InvalidResourceException("no client authentication configured");
    }
    if (meshTls.unauthenticatedTls()) {
      if (!meshTls.identities().isEmpty() || !meshTls.serviceAccounts().isEmpty()) {
        throw new InvalidResourceException(
            "unauthenticated TLS clients may not also set identities");
      }
      return ClientAuthentication.tlsClients();
    }
    ImmutableList.Builder<IdentityMatch> identities = ImmutableList.builder();
    for (String identity : meshTls.identities()) {
      identities.add(IdentityMatch.parse(identity));
    }
    for (ObjectReference sa : meshTls.serviceAccounts()) {
      String namespace = sa.namespace() == null ? authz.metadata().namespace() : sa.namespace();
      identities.add(IdentityMatch.exact(cluster.serviceAccountIdentity(namespace, sa.name())));
    }
    ImmutableList<IdentityMatch> result = identities.build();
    if (result.isEmpty()) {
      throw new InvalidResourceException("authorization must permit at least one identity");
    }
    return ClientAuthentication.authenticatedClients(result);
  }
}
