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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.meshpolicy.AuthorizationRef;
import io.meshpolicy.ClientAuthorization;
import io.meshpolicy.InboundRoute;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.RouteConversions;
import io.meshpolicy.resource.Route;
import javax.annotation.Nullable;

/** An HTTP or gRPC route together with the Servers it attaches to. */
@AutoValue
abstract class InboundRouteBinding<M> {

  abstract ImmutableSet<String> servers();

  abstract InboundRoute<M> route();

  boolean attachesTo(String server) {
    return servers().contains(server);
  }

  /** Returns null when the route names no Server parent. */
  @Nullable
  static InboundRouteBinding<HttpRouteMatch> parseHttp(Route route)
      throws InvalidResourceException {
    ImmutableSet<String> servers = serverParents(route);
    if (servers.isEmpty()) {
      return null;
    }
    ImmutableList.Builder<InboundRoute.Rule<HttpRouteMatch>> rules = ImmutableList.builder();
    for (Route.Rule rule : route.rules()) {
      rules.add(InboundRoute.Rule.create(
          RouteConversions.httpMatches(rule), RouteConversions.filters(rule.filters())));
    }
    return create(servers, route, rules.build());
  }

  @Nullable
  static InboundRouteBinding<GrpcRouteMatch> parseGrpc(Route route)
      throws InvalidResourceException {
    ImmutableSet<String> servers = serverParents(route);
    if (servers.isEmpty()) {
      return null;
    }
    ImmutableList.Builder<InboundRoute.Rule<GrpcRouteMatch>> rules = ImmutableList.builder();
    for (Route.Rule rule : route.rules()) {
      rules.add(InboundRoute.Rule.create(
          RouteConversions.grpcMatches(rule), RouteConversions.filters(rule.filters())));
    }
    return create(servers, route, rules.build());
  }

  private static <M> InboundRouteBinding<M> create(
      ImmutableSet<String> servers, Route route, ImmutableList<InboundRoute.Rule<M>> rules) {
    InboundRoute<M> inbound = InboundRoute.create(RouteConversions.ref(route),
        RouteConversions.hostnames(route), rules,
        ImmutableMap.<AuthorizationRef, ClientAuthorization>of(),
        route.metadata().creationTimestamp());
    return new AutoValue_InboundRouteBinding<M>(servers, inbound);
  }

  static ImmutableSet<String> serverParents(Route route) throws InvalidResourceException {
    ImmutableSet.Builder<String> servers = ImmutableSet.builder();
    for (Route.ParentReference parent : route.parentRefs()) {
      if (!"Server".equals(parent.kind())) {
        continue;
      }
      if (parent.namespace() != null
          && !parent.namespace().equals(route.metadata().namespace())) {
        throw new InvalidResourceException(
            "route may not reference a parent Server in another namespace");
      }
      if (parent.port() != null) {
        throw new InvalidResourceException("route may not reference a parent Server by port");
      }
      servers.add(parent.name());
    }
    return servers.build();
  }
}
