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

import io.meshpolicy.OutboundPolicy;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.index.watch.CellGroup;
import java.util.HashMap;
import java.util.Map;

/** Outbound resources of one namespace and the policies of parents it contains. */
final class OutboundNamespace {
  final String name;

  final Map<String, ServiceInfo> services = new HashMap<>();
  final Map<String, EgressNetworkInfo> egressNetworks = new HashMap<>();
  final Map<String, OutboundRouteBinding<HttpRouteMatch>> httpRoutes = new HashMap<>();
  final Map<String, OutboundRouteBinding<GrpcRouteMatch>> grpcRoutes = new HashMap<>();
  final Map<String, OutboundRouteBinding<Void>> tlsRoutes = new HashMap<>();
  final Map<String, OutboundRouteBinding<Void>> tcpRoutes = new HashMap<>();

  /** Published policies keyed by destination; every key's parent lives in this namespace. */
  final CellGroup<OutboundKey, OutboundPolicy> policies = new CellGroup<>();

  OutboundNamespace(String name) {
    this.name = name;
  }

  boolean isEmpty() {
    return services.isEmpty()
        && egressNetworks.isEmpty()
        && httpRoutes.isEmpty()
        && grpcRoutes.isEmpty()
        && tlsRoutes.isEmpty()
        && tcpRoutes.isEmpty()
        && policies.isEmpty();
  }
}
