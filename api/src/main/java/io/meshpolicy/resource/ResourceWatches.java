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

/** The handlers that receive the events of every watched resource kind. */
@AutoValue
public abstract class ResourceWatches {

  public abstract ResourceHandler<Namespace> namespaces();

  public abstract ResourceHandler<Node> nodes();

  public abstract ResourceHandler<Pod> pods();

  public abstract ResourceHandler<ExternalWorkload> externalWorkloads();

  public abstract ResourceHandler<Service> services();

  public abstract ResourceHandler<EgressNetwork> egressNetworks();

  public abstract ResourceHandler<Server> servers();

  public abstract ResourceHandler<ServerAuthorization> serverAuthorizations();

  public abstract ResourceHandler<AuthorizationPolicy> authorizationPolicies();

  public abstract ResourceHandler<MeshTlsAuthentication> meshTlsAuthentications();

  public abstract ResourceHandler<NetworkAuthentication> networkAuthentications();

  public abstract ResourceHandler<RateLimitPolicy> rateLimits();

  public abstract ResourceHandler<Route> httpRoutes();

  public abstract ResourceHandler<Route> grpcRoutes();

  public abstract ResourceHandler<Route> tlsRoutes();

  public abstract ResourceHandler<Route> tcpRoutes();

  /** The route handler for one route kind. */
  public final ResourceHandler<Route> routes(Route.Kind kind) {
    switch (kind) {
      case HTTP:
        return httpRoutes();
      case GRPC:
        return grpcRoutes();
      case TLS:
        return tlsRoutes();
      case TCP:
        return tcpRoutes();
      default:
        throw new AssertionError(kind);
    }
  }

  public static Builder builder() {
    return new AutoValue_ResourceWatches.Builder();
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setNamespaces(ResourceHandler<Namespace> handler);

    public abstract Builder setNodes(ResourceHandler<Node> handler);

    public abstract Builder setPods(ResourceHandler<Pod> handler);

    public abstract Builder setExternalWorkloads(ResourceHandler<ExternalWorkload> handler);

    public abstract Builder setServices(ResourceHandler<Service> handler);

    public abstract Builder setEgressNetworks(ResourceHandler<EgressNetwork> handler);

    public abstract Builder setServers(ResourceHandler<Server> handler);

    public abstract Builder setServerAuthorizations(
        ResourceHandler<ServerAuthorization> handler);

    public abstract Builder setAuthorizationPolicies(
        ResourceHandler<AuthorizationPolicy> handler);

    public abstract Builder setMeshTlsAuthentications(
        ResourceHandler<MeshTlsAuthentication> handler);

    public abstract Builder setNetworkAuthentications(
        ResourceHandler<NetworkAuthentication> handler);

    public abstract Builder setRateLimits(ResourceHandler<RateLimitPolicy> handler);

    public abstract Builder setHttpRoutes(ResourceHandler<Route> handler);

    public abstract Builder setGrpcRoutes(ResourceHandler<Route> handler);

    public abstract Builder setTlsRoutes(ResourceHandler<Route> handler);

    public abstract Builder setTcpRoutes(ResourceHandler<Route> handler);

    public abstract ResourceWatches build();
  }
}
