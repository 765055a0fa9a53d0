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

package io.meshpolicy.discovery;

import com.google.protobuf.util.Durations;
import io.meshpolicy.AuthorizationRef;
import io.meshpolicy.Cidr;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.ParentRef;
import io.meshpolicy.ResourceId;
import io.meshpolicy.RetryPolicy;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers;
import io.meshpolicy.RouteRef;
import io.meshpolicy.RouteTimeouts;
import io.meshpolicy.proto.common.FailureInjector;
import io.meshpolicy.proto.common.Filter;
import io.meshpolicy.proto.common.GrpcRouteMatch;
import io.meshpolicy.proto.common.HeaderModifier;
import io.meshpolicy.proto.common.HostMatch;
import io.meshpolicy.proto.common.HttpRouteMatch;
import io.meshpolicy.proto.common.IdentityMatch;
import io.meshpolicy.proto.common.Metadata;
import io.meshpolicy.proto.common.Network;
import io.meshpolicy.proto.common.PathMatch;
import io.meshpolicy.proto.common.RequestRedirect;
import io.meshpolicy.proto.common.Resource;
import io.meshpolicy.proto.common.Retry;
import io.meshpolicy.proto.common.Timeouts;
import io.meshpolicy.proto.common.ValueMatch;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Conversions to the messages shared by the inbound and outbound APIs. */
final class CommonProtos {
  private CommonProtos() {}

  static Metadata defaultMetadata(String name) {
    return Metadata.newBuilder().setDefault(name).build();
  }

  static Metadata resourceMetadata(String group, String kind, String namespace, String name) {
    return Metadata.newBuilder()
        .setResource(Resource.newBuilder()
            .setGroup(group)
            .setKind(kind)
            .setNamespace(namespace)
            .setName(name))
        .build();
  }

  static Metadata metadata(RouteRef ref) {
    switch (ref.getKind()) {
      case DEFAULT_NAME:
        return defaultMetadata(ref.defaultName());
      case RESOURCE:
        ResourceId id = ref.resource();
        return resourceMetadata(id.group(), id.kind(), id.namespace(), id.name());
      default:
        throw new AssertionError(ref.getKind());
    }
  }

  static Metadata metadata(AuthorizationRef ref, String namespace) {
    switch (ref.kind()) {
      case DEFAULT:
        return defaultMetadata(ref.name());
      case SERVER_AUTHORIZATION:
        return resourceMetadata(
            ResourceId.POLICY_GROUP, "ServerAuthorization", namespace, ref.name());
      case AUTHORIZATION_POLICY:
        return resourceMetadata(
            ResourceId.POLICY_GROUP, "AuthorizationPolicy", namespace, ref.name());
      default:
        throw new AssertionError(ref.kind());
    }
  }

  static Metadata metadata(ParentRef parent, int port) {
    Resource.Builder resource = Resource.newBuilder()
        .setNamespace(parent.namespace())
        .setName(parent.name())
        .setPort(port);
    switch (parent.kind()) {
      case SERVICE:
        resource.setGroup(ResourceId.CORE_GROUP).setKind("Service");
        break;
      case EGRESS_NETWORK:
        resource.setGroup(ResourceId.POLICY_GROUP).setKind("EgressNetwork");
        break;
      default:
        throw new AssertionError(parent.kind());
    }
    return Metadata.newBuilder().setResource(resource).build();
  }

  static Network network(NetworkMatch match) {
    Network.Builder network = Network.newBuilder().setNet(match.net().toString());
    for (Cidr except : match.except()) {
      network.addExcept(except.toString());
    }
    return network.build();
  }

  static IdentityMatch identity(io.meshpolicy.IdentityMatch match) {
    switch (match.getKind()) {
      case EXACT:
        return IdentityMatch.newBuilder().setExact(match.exact()).build();
      case SUFFIX:
        return IdentityMatch.newBuilder()
            .setSuffix(IdentityMatch.Suffix.newBuilder().addAllLabels(match.suffix()))
            .build();
      default:
        throw new AssertionError(match.getKind());
    }
  }

  static List<HostMatch> hosts(List<RouteMatchers.HostMatch> hostnames) {
    List<HostMatch> hosts = new ArrayList<>(hostnames.size());
    for (RouteMatchers.HostMatch hostname : hostnames) {
      switch (hostname.getKind()) {
        case EXACT:
          hosts.add(HostMatch.newBuilder().setExact(hostname.exact()).build());
          break;
        case SUFFIX:
          hosts.add(HostMatch.newBuilder().setSuffix(hostname.suffix()).build());
          break;
        default:
          throw new AssertionError(hostname.getKind());
      }
    }
    return hosts;
  }

  static HttpRouteMatch httpMatch(RouteMatchers.HttpRouteMatch match) {
    HttpRouteMatch.Builder proto = HttpRouteMatch.newBuilder();
    if (match.path() != null) {
      proto.setPath(path(match.path()));
    }
    for (RouteMatchers.ValueMatch header : match.headers()) {
      proto.addHeaders(value(header));
    }
    for (RouteMatchers.ValueMatch param : match.queryParams()) {
      proto.addQueryParams(value(param));
    }
    if (match.method() != null) {
      proto.setMethod(match.method());
    }
    return proto.build();
  }

  static GrpcRouteMatch grpcMatch(RouteMatchers.GrpcRouteMatch match) {
    GrpcRouteMatch.Builder proto = GrpcRouteMatch.newBuilder();
    if (match.service() != null) {
      proto.setService(match.service());
    }
    if (match.method() != null) {
      proto.setMethod(match.method());
    }
    for (RouteMatchers.ValueMatch header : match.headers()) {
      proto.addHeaders(value(header));
    }
    return proto.build();
  }

  private static PathMatch path(RouteMatchers.PathMatch path) {
    switch (path.getKind()) {
      case EXACT:
        return PathMatch.newBuilder().setExact(path.exact()).build();
      case PREFIX:
        return PathMatch.newBuilder().setPrefix(path.prefix()).build();
      case REGEX:
        return PathMatch.newBuilder().setRegex(path.regex()).build();
      default:
        throw new AssertionError(path.getKind());
    }
  }

  private static ValueMatch value(RouteMatchers.ValueMatch match) {
    ValueMatch.Builder proto = ValueMatch.newBuilder().setName(match.name());
    if (match.type() == RouteMatchers.ValueMatch.Type.REGEX) {
      proto.setRegex(match.value());
    } else {
      proto.setExact(match.value());
    }
    return proto.build();
  }

  static List<Filter> filters(List<RouteFilter> filters) {
    List<Filter> protos = new ArrayList<>(filters.size());
    for (RouteFilter filter : filters) {
      protos.add(filter(filter));
    }
    return protos;
  }

  static Filter filter(RouteFilter filter) {
    switch (filter.getKind()) {
      case REQUEST_HEADER_MODIFIER:
        return Filter.newBuilder()
            .setRequestHeaderModifier(headerModifier(filter.requestHeaderModifier()))
            .build();
      case RESPONSE_HEADER_MODIFIER:
        return Filter.newBuilder()
            .setResponseHeaderModifier(headerModifier(filter.responseHeaderModifier()))
            .build();
      case REQUEST_REDIRECT:
        return Filter.newBuilder().setRequestRedirect(redirect(filter.requestRedirect())).build();
      case FAILURE_INJECTOR:
        RouteFilter.FailureInjector injector = filter.failureInjector();
        return Filter.newBuilder()
            .setFailureInjector(FailureInjector.newBuilder()
                .setStatus(injector.status())
                .setMessage(injector.message())
                .setRatio(injector.ratio()))
            .build();
      default:
        throw new AssertionError(filter.getKind());
    }
  }

  private static HeaderModifier headerModifier(RouteFilter.HeaderModifier modifier) {
    return HeaderModifier.newBuilder()
        .putAllAdd(modifier.add())
        .putAllSet(modifier.set())
        .addAllRemove(modifier.remove())
        .build();
  }

  private static RequestRedirect redirect(RouteFilter.RequestRedirect redirect) {
    RequestRedirect.Builder proto = RequestRedirect.newBuilder()
        .setStatus(redirect.statusCode());
    if (redirect.scheme() != null) {
      proto.setScheme(redirect.scheme());
    }
    if (redirect.host() != null) {
      proto.setHost(redirect.host());
    }
    if (redirect.port() != null) {
      proto.setPort(redirect.port());
    }
    if (redirect.pathModifierType() != null && redirect.path() != null) {
      switch (redirect.pathModifierType()) {
        case FULL:
          proto.setFullPath(redirect.path());
          break;
        case PREFIX:
          proto.setPrefix(redirect.path());
          break;
        default:
          throw new AssertionError(redirect.pathModifierType());
      }
    }
    return proto.build();
  }

  @Nullable
  static Timeouts timeouts(@Nullable RouteTimeouts timeouts) {
    if (timeouts == null || timeouts.isEmpty()) {
      return null;
    }
    Timeouts.Builder proto = Timeouts.newBuilder();
    if (timeouts.request() != null) {
      proto.setRequest(duration(timeouts.request()));
    }
    if (timeouts.response() != null) {
      proto.setResponse(duration(timeouts.response()));
    }
    if (timeouts.idle() != null) {
      proto.setIdle(duration(timeouts.idle()));
    }
    return proto.build();
  }

  @Nullable
  static Retry retry(@Nullable RetryPolicy retry) {
    if (retry == null) {
      return null;
    }
    Retry.Builder proto = Retry.newBuilder()
        .setLimit(retry.limit())
        .addAllConditions(retry.conditions());
    if (retry.timeout() != null) {
      proto.setTimeout(duration(retry.timeout()));
    }
    return proto.build();
  }

  static com.google.protobuf.Duration duration(Duration duration) {
    return Durations.fromNanos(duration.toNanos());
  }
}
