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
import io.meshpolicy.ResourceId;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.PortSets;
import io.meshpolicy.resource.Route;
import javax.annotation.Nullable;

/** An outbound parent a route attaches to. An unset port attaches to every port. */
@AutoValue
public abstract class RouteParent {

  public abstract ParentRef ref();

  @Nullable
  public abstract Integer port();

  public boolean attachesTo(ParentRef parent, int port) {
    return ref().equals(parent) && (port() == null || port() == port);
  }

  public static RouteParent create(ParentRef ref, @Nullable Integer port) {
    return new AutoValue_RouteParent(ref, port);
  }

  /**
   * The Service and EgressNetwork parents of a route. Parents of other kinds are skipped.
   *
   * @throws InvalidResourceException if a parent names an invalid port
   */
  public static ImmutableList<RouteParent> of(Route route) throws InvalidResourceException {
    ImmutableList.Builder<RouteParent> parents = ImmutableList.builder();
    for (Route.ParentReference parent : route.parentRefs()) {
      ParentRef ref = toParentRef(route.metadata().namespace(), parent.group(), parent.kind(),
          parent.namespace(), parent.name());
      if (ref == null) {
        continue;
      }
      if (parent.port() != null) {
        PortSets.checkPort(parent.port());
      }
      parents.add(create(ref, parent.port()));
    }
    return parents.build();
  }

  /** Resolves a Service or EgressNetwork reference; null for any other kind. */
  @Nullable
  public static ParentRef toParentRef(String routeNamespace, @Nullable String group, String kind,
      @Nullable String namespace, String name) {
    String resolved = namespace == null ? routeNamespace : namespace;
    if (isService(group, kind)) {
      return ParentRef.ofService(resolved, name);
    }
    if (isEgressNetwork(group, kind)) {
      return ParentRef.ofEgressNetwork(resolved, name);
    }
    return null;
  }

  static boolean isService(@Nullable String group, String kind) {
    return "Service".equals(kind)
        && (group == null || group.isEmpty() || ResourceId.CORE_GROUP.equals(group));
  }

  static boolean isEgressNetwork(@Nullable String group, String kind) {
    return "EgressNetwork".equals(kind)
        && (group == null || ResourceId.POLICY_GROUP.equals(group));
  }
}
