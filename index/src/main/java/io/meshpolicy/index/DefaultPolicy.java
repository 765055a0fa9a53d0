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
import com.google.common.collect.ImmutableMap;
import io.meshpolicy.AuthorizationRef;
import io.meshpolicy.ClientAuthentication;
import io.meshpolicy.ClientAuthorization;
import io.meshpolicy.NetworkMatch;

/**
 * The policy applied to a port when no Server selects it, or when a Server has no
 * authorizations. One of {@code all-unauthenticated}, {@code all-authenticated},
 * {@code cluster-unauthenticated}, {@code cluster-authenticated}, {@code deny} or
 * {@code audit}.
 */
@AutoValue
public abstract class DefaultPolicy {
  public enum Kind { ALLOW, DENY, AUDIT }

  public abstract Kind kind();

  /** For ALLOW: clients must present a mesh identity. */
  public abstract boolean authenticatedOnly();

  /** For ALLOW: clients must connect from the cluster networks. */
  public abstract boolean clusterOnly();

  public static DefaultPolicy allow(boolean authenticatedOnly, boolean clusterOnly) {
    return new AutoValue_DefaultPolicy(Kind.ALLOW, authenticatedOnly, clusterOnly);
  }

  public static DefaultPolicy deny() {
    return new AutoValue_DefaultPolicy(Kind.DENY, false, false);
  }

  public static DefaultPolicy audit() {
    return new AutoValue_DefaultPolicy(Kind.AUDIT, false, false);
  }

  public static DefaultPolicy parse(String text) throws InvalidResourceException {
    switch (text.trim()) {
      case "all-authenticated":
        return allow(true, false);
      case "all-unauthenticated":
        return allow(false, false);
      case "cluster-authenticated":
        return allow(true, true);
      case "cluster-unauthenticated":
        return allow(false, true);
      case "deny":
        return deny();
      case "audit":
        return audit();
      default:
        throw new InvalidResourceException("invalid default policy: " + text);
    }
  }

  /** The policy used on ports that require client identities. */
  public final DefaultPolicy requireIdentity() {
    if (kind() == Kind.ALLOW) {
      return allow(true, clusterOnly());
    }
    return this;
  }

  public final boolean isDeny() {
    return kind() == Kind.DENY;
  }

  /** Authorizations that implement this policy. Deny has none. */
  public final ImmutableMap<AuthorizationRef, ClientAuthorization> authorizations(
      ClusterInfo cluster) {
    ImmutableList<NetworkMatch> networks;
    ClientAuthentication authentication;
    switch (kind()) {
      case DENY:
        return ImmutableMap.of();
      case AUDIT:
        networks = NetworkMatch.all();
        authentication = ClientAuthentication.unauthenticatedClients();
        break;
      case ALLOW:
        networks = clusterOnly() ? cluster.clusterNetworkMatches() : NetworkMatch.all();
        authentication = authenticatedOnly()
            ? ClientAuthentication.anyIdentity()
            : ClientAuthentication.unauthenticatedClients();
        break;
      default:
        throw new AssertionError(kind());
    }
    return ImmutableMap.of(
        AuthorizationRef.ofDefault(toString()),
        ClientAuthorization.create(networks, authentication));
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case DENY:
        return "deny";
      case AUDIT:
        return "audit";
      case ALLOW:
        return (clusterOnly() ? "cluster-" : "all-")
            + (authenticatedOnly() ? "authenticated" : "unauthenticated");
      default:
        throw new AssertionError(kind());
    }
  }
}
