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

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.RouteTimeouts;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An HTTPRoute, GRPCRoute, TLSRoute or TCPRoute. Retry and timeout settings are read from the
 * route's annotations.
 */
@AutoValue
public abstract class Route implements Resource {
  public enum Kind {
    HTTP("HTTPRoute"),
    GRPC("GRPCRoute"),
    TLS("TLSRoute"),
    TCP("TCPRoute");

    private final String resourceKind;

    Kind(String resourceKind) {
      this.resourceKind = resourceKind;
    }

    public String resourceKind() {
      return resourceKind;
    }
  }

  @Override
  public abstract ObjectMeta metadata();

  public abstract Kind kind();

  /** API group the route was read from. */
  public abstract String group();

  public abstract ImmutableList<ParentReference> parentRefs();

  public abstract ImmutableList<String> hostnames();

  public abstract ImmutableList<Rule> rules();

  public static Builder builder() {
    return new AutoValue_Route.Builder()
        .setGroup("gateway.networking.k8s.io")
        .setParentRefs(ImmutableList.<ParentReference>of())
        .setHostnames(ImmutableList.<String>of())
        .setRules(ImmutableList.<Rule>of());
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMetadata(ObjectMeta metadata);

    public abstract Builder setKind(Kind kind);

    public abstract Builder setGroup(String group);

    public abstract Builder setParentRefs(List<ParentReference> parentRefs);

    public abstract Builder setHostnames(List<String> hostnames);

    public abstract Builder setRules(List<Rule> rules);

    public abstract Route build();
  }

  /** A parent the route attaches to. An unset port attaches to every port. */
  @AutoValue
  public abstract static class ParentReference {
    @Nullable
    public abstract String group();

    public abstract String kind();

    @Nullable
    public abstract String namespace();

    public abstract String name();

    @Nullable
    public abstract Integer port();

    public static ParentReference create(@Nullable String group, String kind,
        @Nullable String namespace, String name, @Nullable Integer port) {
      return new AutoValue_Route_ParentReference(group, kind, namespace, name, port);
    }

    public static ParentReference server(String name) {
      return create("policy.linkerd.io", "Server", null, name, null);
    }

    public static ParentReference service(String namespace, String name, @Nullable Integer port) {
      return create("core", "Service", namespace, name, port);
    }
  }

  /** A weighted backend reference. */
  @AutoValue
  public abstract static class BackendReference {
    @Nullable
    public abstract String group();

    public abstract String kind();

    @Nullable
    public abstract String namespace();

    public abstract String name();

    @Nullable
    public abstract Integer port();

    public abstract long weight();

    public abstract ImmutableList<RouteFilter> filters();

    public static BackendReference create(@Nullable String group, String kind,
        @Nullable String namespace, String name, @Nullable Integer port, long weight,
        List<RouteFilter> filters) {
      return new AutoValue_Route_BackendReference(
          group, kind, namespace, name, port, weight, ImmutableList.copyOf(filters));
    }

    public static BackendReference service(String name, int port) {
      return create("core", "Service", null, name, port, 1, ImmutableList.<RouteFilter>of());
    }
  }

  /** Match kinds allowed on a rule; HTTP routes use HTTP matches and gRPC routes gRPC ones. */
  @AutoOneOf(Match.Kind.class)
  public abstract static class Match {
    public enum Kind { HTTP, GRPC }

    public abstract Kind getKind();

    public abstract HttpRouteMatch http();

    public abstract GrpcRouteMatch grpc();

    public static Match of(HttpRouteMatch match) {
      return AutoOneOf_Route_Match.http(match);
    }

    public static Match of(GrpcRouteMatch match) {
      return AutoOneOf_Route_Match.grpc(match);
    }
  }

  @AutoValue
  public abstract static class Rule {
    public abstract ImmutableList<Match> matches();

    public abstract ImmutableList<RouteFilter> filters();

    public abstract ImmutableList<BackendReference> backendRefs();

    @Nullable
    public abstract RouteTimeouts timeouts();

    public static Rule create(List<Match> matches, List<RouteFilter> filters,
        List<BackendReference> backendRefs, @Nullable RouteTimeouts timeouts) {
      return new AutoValue_Route_Rule(ImmutableList.copyOf(matches),
          ImmutableList.copyOf(filters), ImmutableList.copyOf(backendRefs), timeouts);
    }
  }
}
