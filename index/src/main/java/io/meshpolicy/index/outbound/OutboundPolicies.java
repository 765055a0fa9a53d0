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

import com.google.common.collect.ImmutableList;
import io.meshpolicy.Backend;
import io.meshpolicy.OutboundPolicy;
import io.meshpolicy.OutboundRoute;
import io.meshpolicy.ParentRef;
import io.meshpolicy.RetryPolicy;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HostMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.RouteOrdering;
import io.meshpolicy.RouteRef;
import io.meshpolicy.RouteTimeouts;
import io.meshpolicy.TrafficPolicy;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.resource.Route;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/** Derives the {@link OutboundPolicy} for an {@link OutboundKey} from the indexed resources. */
final class OutboundPolicies {
  static final String DEFAULT_ROUTE = "default";
  static final String EGRESS_DENIED = "traffic not allowed";

  private final ClusterInfo cluster;
  private final Map<String, OutboundNamespace> namespaces;

  OutboundPolicies(ClusterInfo cluster, Map<String, OutboundNamespace> namespaces) {
    this.cluster = cluster;
    this.namespaces = namespaces;
  }

  /**
   * Computes the policy of an existing parent. Every backend the policy refers to is added to
   * {@code backends}.
   */
  OutboundPolicy compute(OutboundKey key, Set<ParentRef> backends) {
    ParentRef parent = key.parent();
    OutboundNamespace parentNamespace = namespaces.get(parent.namespace());
    OutboundNamespace sourceNamespace = parent.namespace().equals(key.sourceNamespace())
        ? null
        : namespaces.get(key.sourceNamespace());

    OutboundPolicy.Builder policy = OutboundPolicy.builder()
        .setParent(parent)
        .setPort(key.port());
    ServiceInfo service = null;
    TrafficPolicy trafficPolicy = null;
    boolean opaque;
    if (parent.kind() == ParentRef.Kind.SERVICE) {
      service = parentNamespace.services.get(parent.name());
      opaque = service.opaquePorts().contains(key.port());
      policy.setAuthority(cluster.serviceAuthority(parent.namespace(), parent.name(), key.port()));
      policy.setFailureAccrual(service.failureAccrual());
    } else {
      trafficPolicy = parentNamespace.egressNetworks.get(parent.name()).trafficPolicy();
      opaque = cluster.defaultOpaquePorts().contains(key.port());
      policy.setTrafficPolicy(trafficPolicy);
    }
    policy.setOpaque(opaque);
    RetryPolicy httpRetry = service == null ? null : service.httpRetry();
    RetryPolicy grpcRetry = service == null ? null : service.grpcRetry();
    RouteTimeouts timeouts = service == null ? null : service.timeouts();

    if (!opaque) {
      List<OutboundRoute<GrpcRouteMatch>> grpc = routes(key, parentNamespace.grpcRoutes,
          sourceNamespace == null ? null : sourceNamespace.grpcRoutes, grpcRetry, timeouts,
          backends);
      if (!grpc.isEmpty()) {
        return policy.setGrpcRoutes(grpc).build();
      }
      List<OutboundRoute<HttpRouteMatch>> http = routes(key, parentNamespace.httpRoutes,
          sourceNamespace == null ? null : sourceNamespace.httpRoutes, httpRetry, timeouts,
          backends);
      if (!http.isEmpty()) {
        return policy.setHttpRoutes(http).build();
      }
    }
    List<OutboundRoute<Void>> tls = routes(key, parentNamespace.tlsRoutes,
        sourceNamespace == null ? null : sourceNamespace.tlsRoutes, null, null, backends);
    if (!tls.isEmpty()) {
      return policy.setTlsRoutes(tls).build();
    }
    List<OutboundRoute<Void>> tcp = routes(key, parentNamespace.tcpRoutes,
        sourceNamespace == null ? null : sourceNamespace.tcpRoutes, null, null, backends);
    if (!tcp.isEmpty()) {
      return policy.setTcpRoutes(tcp).build();
    }

    boolean denied = trafficPolicy == TrafficPolicy.DENY;
    if (opaque) {
      Backend backend = denied ? Backend.ofInvalid(1, EGRESS_DENIED) : parentBackend(key);
      return policy.setTcpRoutes(ImmutableList.of(defaultRoute(ImmutableList.<Void>of(),
          ImmutableList.<RouteFilter>of(), backend, null, null))).build();
    }
    ImmutableList<RouteFilter> filters = denied
        ? ImmutableList.of(RouteFilter.ofFailureInjector(
            RouteFilter.FailureInjector.create(403, EGRESS_DENIED, 1.0)))
        : ImmutableList.<RouteFilter>of();
    return policy.setHttpRoutes(ImmutableList.of(defaultRoute(
        ImmutableList.of(HttpRouteMatch.pathPrefix("/")), filters, parentBackend(key),
        timeouts, httpRetry))).build();
  }

  /** Consumer routes in the source namespace replace the parent namespace's own routes. */
  private <M> ImmutableList<OutboundRoute<M>> routes(OutboundKey key,
      Map<String, OutboundRouteBinding<M>> producer,
      @Nullable Map<String, OutboundRouteBinding<M>> consumer,
      @Nullable RetryPolicy defaultRetry, @Nullable RouteTimeouts defaultTimeouts,
      Set<ParentRef> backends) {
    List<OutboundRouteBinding<M>> bindings = new ArrayList<>();
    if (consumer != null) {
      attached(consumer, key, bindings);
    }
    if (bindings.isEmpty()) {
      attached(producer, key, bindings);
    }
    List<OutboundRoute<M>> routes = new ArrayList<>(bindings.size());
    for (OutboundRouteBinding<M> binding : bindings) {
      routes.add(convert(key, binding, defaultRetry, defaultTimeouts, backends));
    }
    return RouteOrdering.sorted(routes);
  }

  private static <M> void attached(Map<String, OutboundRouteBinding<M>> candidates,
      OutboundKey key, List<OutboundRouteBinding<M>> into) {
    for (OutboundRouteBinding<M> binding : candidates.values()) {
      if (binding.attachesTo(key.parent(), key.port())) {
        into.add(binding);
      }
    }
  }

  private <M> OutboundRoute<M> convert(OutboundKey key, OutboundRouteBinding<M> binding,
      @Nullable RetryPolicy defaultRetry, @Nullable RouteTimeouts defaultTimeouts,
      Set<ParentRef> backends) {
    RetryPolicy retry = binding.retry() != null ? binding.retry() : defaultRetry;
    RouteTimeouts routeTimeouts =
        binding.timeouts() != null ? binding.timeouts() : defaultTimeouts;
    List<OutboundRoute.Rule<M>> rules = new ArrayList<>(binding.rules().size());
    for (OutboundRouteBinding.RuleSpec<M> spec : binding.rules()) {
      List<Backend> resolved = new ArrayList<>();
      if (spec.backendRefs().isEmpty()) {
        resolved.add(parentBackend(key));
      }
      for (Route.BackendReference ref : spec.backendRefs()) {
        resolved.add(backend(binding.namespace(), ref, backends));
      }
      rules.add(OutboundRoute.Rule.create(spec.matches(), spec.filters(), resolved,
          spec.timeouts() != null ? spec.timeouts() : routeTimeouts, retry));
    }
    return OutboundRoute.create(
        binding.ref(), binding.hostnames(), rules, binding.creationTimestamp());
  }

  private Backend backend(
      String routeNamespace, Route.BackendReference ref, Set<ParentRef> backends) {
    ParentRef target = RouteParent.toParentRef(
        routeNamespace, ref.group(), ref.kind(), ref.namespace(), ref.name());
    if (target == null) {
      String kind = ref.group() == null ? ref.kind() : ref.group() + "/" + ref.kind();
      return Backend.ofInvalid(ref.weight(), "unsupported backend type " + kind);
    }
    backends.add(target);
    boolean exists = exists(target);
    if (target.kind() == ParentRef.Kind.SERVICE) {
      if (ref.port() == null) {
        return Backend.ofInvalid(
            ref.weight(), "missing port for backend Service " + target.name());
      }
      return Backend.ofService(Backend.WeightedService.create(ref.weight(), target.namespace(),
          target.name(), ref.port(),
          cluster.serviceAuthority(target.namespace(), target.name(), ref.port()), exists,
          ref.filters()));
    }
    return Backend.ofEgressNetwork(Backend.WeightedEgressNetwork.create(ref.weight(),
        target.namespace(), target.name(), ref.port(), exists, ref.filters()));
  }

  boolean exists(ParentRef ref) {
    OutboundNamespace namespace = namespaces.get(ref.namespace());
    if (namespace == null) {
      return false;
    }
    return ref.kind() == ParentRef.Kind.SERVICE
        ? namespace.services.containsKey(ref.name())
        : namespace.egressNetworks.containsKey(ref.name());
  }

  private Backend parentBackend(OutboundKey key) {
    ParentRef parent = key.parent();
    if (parent.kind() == ParentRef.Kind.SERVICE) {
      return Backend.ofService(Backend.WeightedService.create(1, parent.namespace(),
          parent.name(), key.port(),
          cluster.serviceAuthority(parent.namespace(), parent.name(), key.port()), true,
          ImmutableList.<RouteFilter>of()));
    }
    return Backend.ofEgressNetwork(Backend.WeightedEgressNetwork.create(1, parent.namespace(),
        parent.name(), key.port(), true, ImmutableList.<RouteFilter>of()));
  }

  private static <M> OutboundRoute<M> defaultRoute(List<M> matches, List<RouteFilter> filters,
      Backend backend, @Nullable RouteTimeouts timeouts, @Nullable RetryPolicy retry) {
    return OutboundRoute.create(RouteRef.ofDefault(DEFAULT_ROUTE), ImmutableList.<HostMatch>of(),
        ImmutableList.of(OutboundRoute.Rule.create(
            matches, filters, ImmutableList.of(backend), timeouts, retry)),
        null);
  }
}
