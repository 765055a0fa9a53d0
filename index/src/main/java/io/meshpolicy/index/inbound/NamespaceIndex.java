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

import com.google.common.collect.Iterables;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.index.WorkloadRef;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** The inbound resources of a single namespace. */
final class NamespaceIndex {
  final String name;

  final Map<String, WorkloadState> pods = new HashMap<>();
  final Map<String, WorkloadState> externalWorkloads = new HashMap<>();
  final Map<String, IndexedServer> servers = new HashMap<>();
  final Map<String, IndexedServerAuthorization> serverAuthorizations = new HashMap<>();
  final Map<String, IndexedAuthorizationPolicy> authorizationPolicies = new HashMap<>();
  final Map<String, InboundRouteBinding<HttpRouteMatch>> httpRoutes = new HashMap<>();
  final Map<String, InboundRouteBinding<GrpcRouteMatch>> grpcRoutes = new HashMap<>();
  final Map<String, IndexedRateLimit> rateLimits = new HashMap<>();

  NamespaceIndex(String name) {
    this.name = name;
  }

  Map<String, WorkloadState> workloads(WorkloadRef.Kind kind) {
    return kind == WorkloadRef.Kind.POD ? pods : externalWorkloads;
  }

  @Nullable
  WorkloadState workload(WorkloadRef ref) {
    return workloads(ref.kind()).get(ref.name());
  }

  Iterable<WorkloadState> allWorkloads() {
    return Iterables.concat(
        pods.values(), externalWorkloads.values());
  }

  boolean isEmpty() {
    return pods.isEmpty()
        && externalWorkloads.isEmpty()
        && servers.isEmpty()
        && serverAuthorizations.isEmpty()
        && authorizationPolicies.isEmpty()
        && httpRoutes.isEmpty()
        && grpcRoutes.isEmpty()
        && rateLimits.isEmpty();
  }
}
