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

import com.google.common.collect.ImmutableList;
import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import io.meshpolicy.ResourceId;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HostMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.RouteMatchers.PathMatch;
import io.meshpolicy.RouteMatchers.ValueMatch;
import io.meshpolicy.RouteRef;
import io.meshpolicy.resource.Route;
import java.util.List;

/** Validation and conversion of route resource fields shared by inbound and outbound. */
public final class RouteConversions {
  private RouteConversions() {}

  public static RouteRef ref(Route route) {
    return RouteRef.ofResource(ResourceId.create(route.group(), route.kind().resourceKind(),
        route.metadata().namespace(), route.metadata().name()));
  }

  public static ImmutableList<HostMatch> hostnames(Route route) {
    ImmutableList.Builder<HostMatch> hosts = ImmutableList.builder();
    for (String hostname : route.hostnames()) {
      hosts.add(HostMatch.parse(hostname));
    }
    return hosts.build();
  }

  /** HTTP matches of a rule. A rule without matches matches every request. */
  public static ImmutableList<HttpRouteMatch> httpMatches(Route.Rule rule)
      throws InvalidResourceException {
    if (rule.matches().isEmpty()) {
      return ImmutableList.of(HttpRouteMatch.pathPrefix("/"));
    }
    ImmutableList.Builder<HttpRouteMatch> matches = ImmutableList.builder();
    for (Route.Match match : rule.matches()) {
      if (match.getKind() != Route.Match.Kind.HTTP) {
        throw new InvalidResourceException("gRPC match in an HTTP route");
      }
      HttpRouteMatch http = match.http();
      if (http.path() != null && http.path().getKind() == PathMatch.Kind.REGEX) {
        checkRegex(http.path().regex());
      }
      checkValueMatches(http.headers());
      checkValueMatches(http.queryParams());
      matches.add(http);
    }
    return matches.build();
  }

  /** gRPC matches of a rule. A rule without matches matches every call. */
  public static ImmutableList<GrpcRouteMatch> grpcMatches(Route.Rule rule)
      throws InvalidResourceException {
    if (rule.matches().isEmpty()) {
      return ImmutableList.of(
          GrpcRouteMatch.create(null, null, ImmutableList.<ValueMatch>of()));
    }
    ImmutableList.Builder<GrpcRouteMatch> matches = ImmutableList.builder();
    for (Route.Match match : rule.matches()) {
      if (match.getKind() != Route.Match.Kind.GRPC) {
        throw new InvalidResourceException("HTTP match in a gRPC route");
      }
      checkValueMatches(match.grpc().headers());
      matches.add(match.grpc());
    }
    return matches.build();
  }

  /** Rejects matches on rules of routes that do not support them. */
  public static void checkNoMatches(Route route) throws InvalidResourceException {
    for (Route.Rule rule : route.rules()) {
      if (!rule.matches().isEmpty()) {
        throw new InvalidResourceException(
            route.kind().resourceKind() + " rules may not have matches");
      }
    }
  }

  public static ImmutableList<RouteFilter> filters(List<RouteFilter> filters)
      throws InvalidResourceException {
    for (RouteFilter filter : filters) {
      if (filter.getKind() == RouteFilter.Kind.REQUEST_REDIRECT) {
        int status = filter.requestRedirect().statusCode();
        if (status != 301 && status != 302) {
          throw new InvalidResourceException("unsupported redirect status: " + status);
        }
      }
    }
    return ImmutableList.copyOf(filters);
  }

  private static void checkValueMatches(List<ValueMatch> matches)
      throws InvalidResourceException {
    for (ValueMatch match : matches) {
      if (match.name().isEmpty()) {
        throw new InvalidResourceException("match name must not be empty");
      }
      if (match.type() == ValueMatch.Type.REGEX) {
        checkRegex(match.value());
      }
    }
  }

  private static void checkRegex(String regex) throws InvalidResourceException {
    try {
      Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new InvalidResourceException("invalid regular expression: " + regex, e);
    }
  }
}
