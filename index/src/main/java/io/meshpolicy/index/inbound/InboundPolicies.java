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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import io.meshpolicy.AuthorizationRef;
import io.meshpolicy.Cidr;
import io.meshpolicy.ClientAuthentication;
import io.meshpolicy.ClientAuthorization;
import io.meshpolicy.InboundRoute;
import io.meshpolicy.InboundServer;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.ProxyProtocol;
import io.meshpolicy.RateLimit;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HostMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.RouteMatchers.PathMatch;
import io.meshpolicy.RouteMatchers.ValueMatch;
import io.meshpolicy.RouteOrdering;
import io.meshpolicy.RouteRef;
import io.meshpolicy.ServerRef;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.DefaultPolicy;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.inbound.IndexedAuthorizationPolicy.TargetKind;
import java.net.InetAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/** Derives the {@link InboundServer} for a workload port from the indexed resources. */
final class InboundPolicies {
  private static final Logger logger = Logger.getLogger(InboundPolicies.class.getName());

  static final String DEFAULT_ROUTE = "default";
  static final String PROBE_ROUTE = "probe";
  static final String KUBELET_AUTHORIZATION = "kubelet";
  static final String PROBE_AUTHORIZATION = "probe";

  private static final Comparator<IndexedRateLimit> OLDEST_RATE_LIMIT =
      new Comparator<IndexedRateLimit>() {
        @Override
        public int compare(IndexedRateLimit a, IndexedRateLimit b) {
          return ComparisonChain.start()
              .compare(a.creationTimestamp(), b.creationTimestamp(),
                  Ordering.<Instant>natural().nullsLast())
              .compare(a.limit().name(), b.limit().name())
              .result();
        }
      };

  private final ClusterInfo cluster;
  private final AuthenticationIndex authentications;

  InboundPolicies(ClusterInfo cluster, AuthenticationIndex authentications) {
    this.cluster = cluster;
    this.authentications = authentications;
  }

  /** The policy for a port that no Server selects. */
  InboundServer defaultServer(
      @Nullable DefaultPolicy namespaceDefault, WorkloadState workload, int port) {
    DefaultPolicy policy = workload.settings.defaultPolicy();
    if (policy == null) {
      policy = namespaceDefault != null ? namespaceDefault : cluster.defaultPolicy();
    }
    if (workload.settings.requireIdentityPorts().contains(port)) {
      policy = policy.requireIdentity();
    }
    ProxyProtocol protocol = workload.settings.opaquePorts().contains(port)
        ? ProxyProtocol.of(ProxyProtocol.Kind.OPAQUE)
        : ProxyProtocol.detect(cluster.defaultDetectTimeout());

    Map<AuthorizationRef, ClientAuthorization> authorizations =
        new LinkedHashMap<>(policy.authorizations(cluster));
    if (!policy.isDeny()) {
      addKubelet(authorizations, workload);
    }

    return InboundServer.builder()
        .setReference(ServerRef.ofDefault(policy.toString()))
        .setProtocol(protocol)
        .setAuthorizations(authorizations)
        .setHttpRoutes(defaultHttpRoutes(authorizations, workload, port))
        .setGrpcRoutes(ImmutableList.of(defaultGrpcRoute(authorizations)))
        .build();
  }

  /** The policy for a port owned by {@code server}. */
  InboundServer forServer(
      NamespaceIndex namespace, WorkloadState workload, int port, IndexedServer server) {
    Map<AuthorizationRef, ClientAuthorization> authorizations =
        serverAuthorizations(namespace, server);

    Map<String, Map<AuthorizationRef, ClientAuthorization>> httpRouteAuthorizations =
        routeAuthorizations(namespace, TargetKind.HTTP_ROUTE);
    Map<String, Map<AuthorizationRef, ClientAuthorization>> grpcRouteAuthorizations =
        routeAuthorizations(namespace, TargetKind.GRPC_ROUTE);
    List<InboundRoute<HttpRouteMatch>> httpRoutes =
        attached(namespace.httpRoutes.values(), server);
    List<InboundRoute<GrpcRouteMatch>> grpcRoutes =
        attached(namespace.grpcRoutes.values(), server);

    if (authorizations.isEmpty()
        && !anyTargeted(httpRoutes, httpRouteAuthorizations)
        && !anyTargeted(grpcRoutes, grpcRouteAuthorizations)) {
      authorizations.putAll(server.accessPolicy().authorizations(cluster));
    }
    if (!server.accessPolicy().isDeny()) {
      addKubelet(authorizations, workload);
    }

    ImmutableList<InboundRoute<HttpRouteMatch>> http = httpRoutes.isEmpty()
        ? defaultHttpRoutes(authorizations, workload, port)
        : RouteOrdering.sorted(withAuthorizations(
            httpRoutes, httpRouteAuthorizations, authorizations));
    ImmutableList<InboundRoute<GrpcRouteMatch>> grpc = grpcRoutes.isEmpty()
        ? ImmutableList.of(defaultGrpcRoute(authorizations))
        : RouteOrdering.sorted(withAuthorizations(
            grpcRoutes, grpcRouteAuthorizations, authorizations));

    return InboundServer.builder()
        .setReference(ServerRef.ofServer(server.name()))
        .setProtocol(server.protocol())
        .setAuthorizations(authorizations)
        .setHttpRoutes(http)
        .setGrpcRoutes(grpc)
        .setRateLimit(rateLimit(namespace, server))
        .build();
  }

  private Map<AuthorizationRef, ClientAuthorization> serverAuthorizations(
      NamespaceIndex namespace, IndexedServer server) {
    Map<AuthorizationRef, ClientAuthorization> authorizations = new LinkedHashMap<>();
    for (Map.Entry<String, IndexedServerAuthorization> entry
        : new TreeMap<>(namespace.serverAuthorizations).entrySet()) {
      if (entry.getValue().selects(server)) {
        authorizations.put(
            AuthorizationRef.ofServerAuthorization(entry.getKey()), entry.getValue().client());
      }
    }
    for (Map.Entry<String, IndexedAuthorizationPolicy> entry
        : new TreeMap<>(namespace.authorizationPolicies).entrySet()) {
      IndexedAuthorizationPolicy policy = entry.getValue();
      boolean targetsServer = policy.targetKind() == TargetKind.SERVER
          && policy.targetName().equals(server.name());
      if (targetsServer || policy.targetKind() == TargetKind.NAMESPACE) {
        ClientAuthorization client = resolve(namespace.name, entry.getKey(), policy);
        if (client != null) {
          authorizations.put(AuthorizationRef.ofAuthorizationPolicy(entry.getKey()), client);
        }
      }
    }
    return authorizations;
  }

  /** Authorizations of policies targeting routes of one kind, keyed by route name. */
  private Map<String, Map<AuthorizationRef, ClientAuthorization>> routeAuthorizations(
      NamespaceIndex namespace, TargetKind kind) {
    Map<String, Map<AuthorizationRef, ClientAuthorization>> byRoute = new TreeMap<>();
    for (Map.Entry<String, IndexedAuthorizationPolicy> entry
        : new TreeMap<>(namespace.authorizationPolicies).entrySet()) {
      IndexedAuthorizationPolicy policy = entry.getValue();
      if (policy.targetKind() != kind) {
        continue;
      }
      ClientAuthorization client = resolve(namespace.name, entry.getKey(), policy);
      if (client == null) {
        continue;
      }
      Map<AuthorizationRef, ClientAuthorization> authorizations =
          byRoute.get(policy.targetName());
      if (authorizations == null) {
        authorizations = new LinkedHashMap<>();
        byRoute.put(policy.targetName(), authorizations);
      }
      authorizations.put(AuthorizationRef.ofAuthorizationPolicy(entry.getKey()), client);
    }
    return byRoute;
  }

  @Nullable
  private ClientAuthorization resolve(
      String namespace, String name, IndexedAuthorizationPolicy policy) {
    try {
      return policy.resolve(authentications);
    } catch (InvalidResourceException e) {
      logger.log(Level.WARNING, "Illegal AuthorizationPolicy {0}/{1}; ignoring: {2}",
          new Object[] {namespace, name, e.getMessage()});
      return null;
    }
  }

  private static <M> List<InboundRoute<M>> attached(
      Collection<InboundRouteBinding<M>> bindings, IndexedServer server) {
    List<InboundRoute<M>> routes = new ArrayList<>();
    for (InboundRouteBinding<M> binding : bindings) {
      if (binding.attachesTo(server.name())) {
        routes.add(binding.route());
      }
    }
    return routes;
  }

  private static <M> boolean anyTargeted(List<InboundRoute<M>> routes,
      Map<String, Map<AuthorizationRef, ClientAuthorization>> routeAuthorizations) {
    for (InboundRoute<M> route : routes) {
      if (routeAuthorizations.containsKey(route.ref().resource().name())) {
        return true;
      }
    }
    return false;
  }

  /** Routes without targeted policies inherit the server's authorizations. */
  private static <M> List<InboundRoute<M>> withAuthorizations(List<InboundRoute<M>> routes,
      Map<String, Map<AuthorizationRef, ClientAuthorization>> routeAuthorizations,
      Map<AuthorizationRef, ClientAuthorization> serverAuthorizations) {
    List<InboundRoute<M>> result = new ArrayList<>(routes.size());
    for (InboundRoute<M> route : routes) {
      Map<AuthorizationRef, ClientAuthorization> targeted =
          routeAuthorizations.get(route.ref().resource().name());
      result.add(route.withAuthorizations(targeted != null ? targeted : serverAuthorizations));
    }
    return result;
  }

  @Nullable
  private static RateLimit rateLimit(NamespaceIndex namespace, IndexedServer server) {
    IndexedRateLimit oldest = null;
    for (IndexedRateLimit limit : namespace.rateLimits.values()) {
      if (!limit.server().equals(server.name())) {
        continue;
      }
      if (oldest == null || OLDEST_RATE_LIMIT.compare(limit, oldest) < 0) {
        oldest = limit;
      }
    }
    return oldest == null ? null : oldest.limit();
  }

  private static void addKubelet(
      Map<AuthorizationRef, ClientAuthorization> authorizations, WorkloadState workload) {
    if (workload.kubeletIps.isEmpty()) {
      return;
    }
    List<Cidr> hosts = new ArrayList<>();
    for (InetAddress ip : workload.kubeletIps) {
      hosts.add(Cidr.ofHost(ip));
    }
    authorizations.put(AuthorizationRef.ofDefault(KUBELET_AUTHORIZATION),
        ClientAuthorization.create(
            NetworkMatch.of(hosts), ClientAuthentication.unauthenticatedClients()));
  }

  /** The default route, plus a probe route when the port has probe paths. */
  private ImmutableList<InboundRoute<HttpRouteMatch>> defaultHttpRoutes(
      Map<AuthorizationRef, ClientAuthorization> authorizations, WorkloadState workload,
      int port) {
    ImmutableSet<String> probePaths = workload.probePaths.get(port);
    if (probePaths.isEmpty() || cluster.probeNetworks().isEmpty()) {
      return ImmutableList.of(defaultHttpRoute(authorizations));
    }
    return ImmutableList.of(defaultHttpRoute(authorizations), probeRoute(probePaths));
  }

  private InboundRoute<HttpRouteMatch> probeRoute(ImmutableSet<String> paths) {
    List<HttpRouteMatch> matches = new ArrayList<>();
    for (String path : new TreeSet<>(paths)) {
      matches.add(HttpRouteMatch.create(PathMatch.forExact(path),
          ImmutableList.<ValueMatch>of(), ImmutableList.<ValueMatch>of(), "GET"));
    }
    List<Cidr> probeNetworks = cluster.probeNetworks();
    return InboundRoute.create(RouteRef.ofDefault(PROBE_ROUTE),
        ImmutableList.<HostMatch>of(),
        ImmutableList.of(InboundRoute.Rule.create(matches, ImmutableList.<RouteFilter>of())),
        ImmutableMap.of(AuthorizationRef.ofDefault(PROBE_AUTHORIZATION),
            ClientAuthorization.create(
                NetworkMatch.of(probeNetworks), ClientAuthentication.unauthenticatedClients())),
        null);
  }

  static InboundRoute<HttpRouteMatch> defaultHttpRoute(
      Map<AuthorizationRef, ClientAuthorization> authorizations) {
    return InboundRoute.create(RouteRef.ofDefault(DEFAULT_ROUTE),
        ImmutableList.<HostMatch>of(),
        ImmutableList.of(InboundRoute.Rule.create(
            ImmutableList.of(HttpRouteMatch.pathPrefix("/")), ImmutableList.<RouteFilter>of())),
        authorizations, null);
  }

  static InboundRoute<GrpcRouteMatch> defaultGrpcRoute(
      Map<AuthorizationRef, ClientAuthorization> authorizations) {
    return InboundRoute.create(RouteRef.ofDefault(DEFAULT_ROUTE),
        ImmutableList.<HostMatch>of(),
        ImmutableList.of(InboundRoute.Rule.create(
            ImmutableList.of(GrpcRouteMatch.create(null, null, ImmutableList.<ValueMatch>of())),
            ImmutableList.<RouteFilter>of())),
        authorizations, null);
  }
}
