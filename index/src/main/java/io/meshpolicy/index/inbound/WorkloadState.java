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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import io.meshpolicy.InboundServer;
import io.meshpolicy.index.WorkloadRef;
import io.meshpolicy.index.watch.CellGroup;
import io.meshpolicy.resource.PortReference;
import java.net.InetAddress;
import java.util.HashMap;
import java.util.Map;

/** An indexed pod or external workload and the published policy for each of its ports. */
final class WorkloadState {
  final WorkloadRef ref;
  /** Declared port names. Fixed for the life of the workload. */
  final ImmutableSetMultimap<String, Integer> portNames;
  final CellGroup<Integer, InboundServer> servers = new CellGroup<>();

  ImmutableMap<String, String> labels;
  WorkloadSettings settings;
  ImmutableSetMultimap<Integer, String> probePaths;
  ImmutableList<InetAddress> kubeletIps;

  /** Name of the Server that owns each port, as of the last reindex. */
  Map<Integer, String> serverByPort = new HashMap<>();

  WorkloadState(WorkloadRef ref, ImmutableSetMultimap<String, Integer> portNames) {
    this.ref = ref;
    this.portNames = portNames;
  }

  /** Ports a Server port reference resolves to on this workload. */
  ImmutableSet<Integer> ports(PortReference port) {
    switch (port.getKind()) {
      case NUMBER:
        return ImmutableSet.of(port.number());
      case NAME:
        return portNames.get(port.name());
      default:
        throw new AssertionError(port.getKind());
    }
  }

  /** Publishes a port's policy, creating its cell if needed. */
  void publish(int port, InboundServer policy) {
    if (servers.get(port) == null) {
      servers.getOrCreate(port, policy);
    } else {
      servers.update(port, policy);
    }
  }

  @Override
  public String toString() {
    return ref.namespace() + "/" + ref.name();
  }
}
