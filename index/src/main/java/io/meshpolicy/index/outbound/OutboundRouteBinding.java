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
import io.meshpolicy.ParentRef;
import io.meshpolicy.RetryPolicy;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HostMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.RouteRef;
import io.meshpolicy.RouteTimeouts;
import io.meshpolicy.index.Annotations;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.RouteConversions;
import io.meshpolicy.resource.Route;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A validated route with its outbound parents. Backends stay unresolved since their existence
 * changes independently of the route.
 */
@AutoValue
abstract class OutboundRouteBinding<M> {

  abstract ImmutableList<RouteParent> parents();

  abstract RouteRef ref();

  abstract ImmutableList<HostMatch> hostnames();

  @Nullable
  abstract Instant creationTimestamp();

  abstract ImmutableList<RuleSpec<M>> rules();

  /** Retry policy from the route's annotations. */
  @Nullable
  abstract RetryPolicy retry();

  /** Timeouts from the route's annotations. */
  @Nullable
  abstract RouteTimeouts timeouts();

  boolean attachesTo(ParentRef parent, int port) {
    for (RouteParent routeParent : parents()) {
      if (routeParent.attachesTo(parent, port)) {
        return true;
      }
    }
    return false;
  }

  String namespace() {
    return ref().resource().namespace();
  }

  @AutoValue
  abstract static class RuleSpec<M> {
    abstract ImmutableList<M> matches();

    abstract ImmutableList<RouteFilter> filters();

    abstract ImmutableList<Route.BackendReference> backendRefs();

    @Nullable
    abstract RouteTimeouts timeouts();

    static <M> RuleSpec<M> create(List<M> matches, List<RouteFilter> filters,
        List<Route.BackendReference> backendRefs, @Nullable RouteTimeouts timeouts) {
      return new AutoValue_OutboundRouteBinding_RuleSpec<M>(ImmutableList.copyOf(matches),
          ImmutableList.copyOf(filters), ImmutableList.copyOf(backendRefs), timeouts);
    }
  }

  /** Returns null when the route has no outbound parent. */
  @Nullable
  static OutboundRouteBinding<HttpRouteMatch> parseHttp(Route route)
      throws InvalidResourceException {
    ImmutableList<RouteParent> parents = RouteParent.of(route);
    if (parents.isEmpty()) {
      return null;
    }
    ImmutableList.Builder<RuleSpec<HttpRouteMatch>> rules = ImmutableList.builder();
    for (Route.Rule rule : route.rules()) {
      rules.add(ruleSpec(RouteConversions.httpMatches(rule), rule));
    }
    return create(parents, route, rules.build(), Annotations.RETRY_HTTP);
  }

  @Nullable
  static OutboundRouteBinding<GrpcRouteMatch> parseGrpc(Route route)
      throws InvalidResourceException {
    ImmutableList<RouteParent> parents = RouteParent.of(route);
    if (parents.isEmpty()) {
      return null;
    }
    ImmutableList.Builder<RuleSpec<GrpcRouteMatch>> rules = ImmutableList.builder();
    for (Route.Rule rule : route.rules()) {
      rules.add(ruleSpec(RouteConversions.grpcMatches(rule), rule));
    }
    return create(parents, route, rules.build(), Annotations.RETRY_GRPC);
  }

  /** TLS and TCP routes carry no matches. */
  @Nullable
  static OutboundRouteBinding<Void> parseStream(Route route) throws InvalidResourceException {
    ImmutableList<RouteParent> parents = RouteParent.of(route);
    if (parents.isEmpty()) {
      return null;
    }
    RouteConversions.checkNoMatches(route);
    ImmutableList.Builder<RuleSpec<Void>> rules = ImmutableList.builder();
    for (Route.Rule rule : route.rules()) {
      rules.add(ruleSpec(ImmutableList.<Void>of(), rule));
    }
    return create(parents, route, rules.build(), null);
  }

  private static <M> RuleSpec<M> ruleSpec(List<M> matches, Route.Rule rule)
      throws InvalidResourceException {
    for (Route.BackendReference backend : rule.backendRefs()) {
      RouteConversions.filters(backend.filters());
    }
    return RuleSpec.create(matches, RouteConversions.filters(rule.filters()), rule.backendRefs(),
        rule.timeouts());
  }

  /** {@code retryConditionsKey} is null for TLS and TCP routes; they take no retry or timeouts. */
  private static <M> OutboundRouteBinding<M> create(ImmutableList<RouteParent> parents,
      Route route, ImmutableList<RuleSpec<M>> rules, @Nullable String retryConditionsKey) {
    RetryPolicy retry = retryConditionsKey == null
        ? null
        : Annotations.retry(route.metadata().annotations(), retryConditionsKey);
    RouteTimeouts timeouts = retryConditionsKey == null
        ? null
        : Annotations.timeouts(route.metadata().annotations());
    return new AutoValue_OutboundRouteBinding<M>(parents, RouteConversions.ref(route),
        RouteConversions.hostnames(route), route.metadata().creationTimestamp(), rules, retry,
        timeouts);
  }
}
