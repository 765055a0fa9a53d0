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
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import io.meshpolicy.ProxyProtocol;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.DefaultPolicy;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.PortSets;
import io.meshpolicy.index.WorkloadRef;
import io.meshpolicy.resource.LabelSelector;
import io.meshpolicy.resource.PortReference;
import io.meshpolicy.resource.Server;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import javax.annotation.Nullable;

/** A validated Server. */
@AutoValue
abstract class IndexedServer {

  /** Older servers first; a younger server never takes a port from an older one. */
  static final Comparator<IndexedServer> OLDEST_FIRST = new Comparator<IndexedServer>() {
    @Override
    public int compare(IndexedServer a, IndexedServer b) {
      return ComparisonChain.start()
          .compare(a.creationTimestamp(), b.creationTimestamp(),
              Ordering.<Instant>natural().nullsLast())
          .compare(a.name(), b.name())
          .result();
    }
  };

  abstract String name();

  abstract ImmutableMap<String, String> labels();

  abstract Server.SelectorKind selectorKind();

  abstract LabelSelector selector();

  abstract PortReference port();

  abstract ProxyProtocol protocol();

  /** Policy applied when nothing authorizes a client; deny when unset. */
  abstract DefaultPolicy accessPolicy();

  @Nullable
  abstract Instant creationTimestamp();

  boolean selects(WorkloadRef.Kind kind, Map<String, String> workloadLabels) {
    Server.SelectorKind wanted = kind == WorkloadRef.Kind.POD
        ? Server.SelectorKind.POD
        : Server.SelectorKind.EXTERNAL_WORKLOAD;
    return selectorKind() == wanted && selector().matches(workloadLabels);
  }

  static IndexedServer parse(Server server, ClusterInfo cluster)
      throws InvalidResourceException {
    PortSets.checkPort(server.port());
    DefaultPolicy accessPolicy = server.accessPolicy() == null
        ? DefaultPolicy.deny()
        : DefaultPolicy.parse(server.accessPolicy());
    return new AutoValue_IndexedServer(
        server.metadata().name(),
        server.metadata().labels(),
        server.selectorKind(),
        server.selector(),
        server.port(),
        parseProtocol(server.proxyProtocol(), cluster),
        accessPolicy,
        server.metadata().creationTimestamp());
  }

  static ProxyProtocol parseProtocol(@Nullable String protocol, ClusterInfo cluster)
      throws InvalidResourceException {
    if (protocol == null) {
      return ProxyProtocol.detect(cluster.defaultDetectTimeout());
    }
    switch (protocol) {
      case "unknown":
        return ProxyProtocol.detect(cluster.defaultDetectTimeout());
      case "HTTP/1":
        return ProxyProtocol.of(ProxyProtocol.Kind.HTTP1);
      case "HTTP/2":
        return ProxyProtocol.of(ProxyProtocol.Kind.HTTP2);
      case "gRPC":
        return ProxyProtocol.of(ProxyProtocol.Kind.GRPC);
      case "opaque":
        return ProxyProtocol.of(ProxyProtocol.Kind.OPAQUE);
      case "TLS":
        return ProxyProtocol.of(ProxyProtocol.Kind.TLS);
      default:
        throw new InvalidResourceException("unsupported proxy protocol: " + protocol);
    }
  }
}
