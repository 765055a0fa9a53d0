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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;
import com.google.common.net.InetAddresses;
import io.meshpolicy.OutboundPolicy;
import io.meshpolicy.ParentRef;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.MostSpecificNetwork;
import io.meshpolicy.index.NamespacedResourceHandler;
import io.meshpolicy.index.ServiceAuthority;
import io.meshpolicy.index.watch.KeyedCursor;
import io.meshpolicy.resource.EgressNetwork;
import io.meshpolicy.resource.Resource;
import io.meshpolicy.resource.ResourceHandler;
import io.meshpolicy.resource.Route;
import io.meshpolicy.resource.Service;
import java.net.InetAddress;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Indexes Services, EgressNetworks and the routes attached to them, and publishes an
 * {@link OutboundPolicy} for each watched {@link OutboundKey}.
 *
 * <p>Not thread-safe. All handlers, lookups and {@link #watch} must be called from a single
 * writer.
 */
public final class OutboundIndex {
  private static final Logger logger = Logger.getLogger(OutboundIndex.class.getName());

  private final ClusterInfo cluster;
  private final Map<String, OutboundNamespace> namespaces = new HashMap<>();
  private final OutboundPolicies policies;
  /** Normalized cluster IP to the Service that owns it. */
  private final Map<String, ParentRef> serviceIps = new HashMap<>();
  private final SetMultimap<String, OutboundKey> keysBySource = HashMultimap.create();
  /** Keys with at least one backend in a namespace, by that namespace. */
  private final SetMultimap<String, OutboundKey> keysByBackendNamespace = HashMultimap.create();
  private final Map<OutboundKey, Set<String>> backendNamespacesByKey = new HashMap<>();

  public OutboundIndex(ClusterInfo cluster) {
    this.cluster = checkNotNull(cluster, "cluster");
    this.policies = new OutboundPolicies(cluster, namespaces);
  }

  /** Returns a cursor over the policy of {@code key}, or null if its parent does not exist. */
  @Nullable
  public KeyedCursor<OutboundKey, OutboundPolicy> watch(OutboundKey key) {
    if (!policies.exists(key.parent())) {
      return null;
    }
    OutboundNamespace namespace = namespaces.get(key.parent().namespace());
    if (namespace.policies.get(key) == null) {
      namespace.policies.getOrCreate(key, compute(key));
      keysBySource.put(key.sourceNamespace(), key);
    }
    return namespace.policies.cursor(key);
  }

  /** The current policy of {@code key}, or null if its parent does not exist. */
  @Nullable
  public OutboundPolicy policy(OutboundKey key) {
    if (!policies.exists(key.parent())) {
      return null;
    }
    OutboundPolicy published = namespaces.get(key.parent().namespace()).policies.getValue(key);
    if (published != null) {
      return published;
    }
    return policies.compute(key, new HashSet<ParentRef>());
  }

  /** Resolves a service authority, or returns null if the Service is unknown. */
  @Nullable
  public OutboundKey lookup(ServiceAuthority authority, String sourceNamespace) {
    ParentRef parent = ParentRef.ofService(authority.namespace(), authority.name());
    return policies.exists(parent)
        ? OutboundKey.create(parent, authority.port(), sourceNamespace)
        : null;
  }

  /**
   * Resolves a destination address: a Service cluster IP first, then the most specific
   * EgressNetwork. EgressNetworks in the source namespace take precedence over those in the
   * global egress namespace. Returns null when nothing matches.
   */
  @Nullable
  public OutboundKey lookup(InetAddress address, int port, String sourceNamespace) {
    ParentRef service = serviceIps.get(InetAddresses.toAddrString(address));
    if (service != null) {
      return OutboundKey.create(service, port, sourceNamespace);
    }
    OutboundNamespace candidates = namespaces.get(sourceNamespace);
    if (candidates == null || candidates.egressNetworks.isEmpty()) {
      candidates = namespaces.get(cluster.globalEgressNetworkNamespace());
    }
    if (candidates == null) {
      return null;
    }
    EgressNetworkInfo network =
        MostSpecificNetwork.select(address, candidates.egressNetworks.values());
    if (network == null) {
      return null;
    }
    return OutboundKey.create(
        ParentRef.ofEgressNetwork(network.namespace(), network.name()), port, sourceNamespace);
  }

  /** Whether a Service or EgressNetwork is indexed. */
  public boolean exists(ParentRef parent) {
    return policies.exists(parent);
  }

  /** Number of indexed resources by kind. */
  public ImmutableMap<String, Integer> sizes() {
    int services = 0;
    int egressNetworks = 0;
    int routes = 0;
    int keys = 0;
    for (OutboundNamespace namespace : namespaces.values()) {
      services += namespace.services.size();
      egressNetworks += namespace.egressNetworks.size();
      routes += namespace.httpRoutes.size() + namespace.grpcRoutes.size()
          + namespace.tlsRoutes.size() + namespace.tcpRoutes.size();
      keys += namespace.policies.keys().size();
    }
    return ImmutableMap.of(
        "Service", services,
        "EgressNetwork", egressNetworks,
        "OutboundRoute", routes,
        "OutboundPolicy", keys);
  }

  public ResourceHandler<Service> services() {
    return new IndexHandler<Service, ServiceInfo>("Service") {
      @Override
      protected ServiceInfo parse(Service service) throws InvalidResourceException {
        return ServiceInfo.parse(service, cluster);
      }

      @Override
      Map<String, ServiceInfo> of(OutboundNamespace namespace) {
        return namespace.services;
      }

      @Override
      protected void changed(Set<String> names) {
        for (String name : names) {
          rebuildServiceIps(name);
        }
        super.changed(names);
      }
    };
  }

  public ResourceHandler<EgressNetwork> egressNetworks() {
    return new IndexHandler<EgressNetwork, EgressNetworkInfo>("EgressNetwork") {
      @Override
      protected EgressNetworkInfo parse(EgressNetwork network) throws InvalidResourceException {
        return EgressNetworkInfo.parse(network, cluster);
      }

      @Override
      Map<String, EgressNetworkInfo> of(OutboundNamespace namespace) {
        return namespace.egressNetworks;
      }
    };
  }

  public ResourceHandler<Route> httpRoutes() {
    return new IndexHandler<Route, OutboundRouteBinding<HttpRouteMatch>>("HTTPRoute") {
      @Override
      protected OutboundRouteBinding<HttpRouteMatch> parse(Route route)
          throws InvalidResourceException {
        checkKind(route, Route.Kind.HTTP);
        return OutboundRouteBinding.parseHttp(route);
      }

      @Override
      Map<String, OutboundRouteBinding<HttpRouteMatch>> of(OutboundNamespace namespace) {
        return namespace.httpRoutes;
      }
    };
  }

  public ResourceHandler<Route> grpcRoutes() {
    return new IndexHandler<Route, OutboundRouteBinding<GrpcRouteMatch>>("GRPCRoute") {
      @Override
      protected OutboundRouteBinding<GrpcRouteMatch> parse(Route route)
          throws InvalidResourceException {
        checkKind(route, Route.Kind.GRPC);
        return OutboundRouteBinding.parseGrpc(route);
      }

      @Override
      Map<String, OutboundRouteBinding<GrpcRouteMatch>> of(OutboundNamespace namespace) {
        return namespace.grpcRoutes;
      }
    };
  }

  public ResourceHandler<Route> tlsRoutes() {
    return new IndexHandler<Route, OutboundRouteBinding<Void>>("TLSRoute") {
      @Override
      protected OutboundRouteBinding<Void> parse(Route route) throws InvalidResourceException {
        checkKind(route, Route.Kind.TLS);
        return OutboundRouteBinding.parseStream(route);
      }

      @Override
      Map<String, OutboundRouteBinding<Void>> of(OutboundNamespace namespace) {
        return namespace.tlsRoutes;
      }
    };
  }

  public ResourceHandler<Route> tcpRoutes() {
    return new IndexHandler<Route, OutboundRouteBinding<Void>>("TCPRoute") {
      @Override
      protected OutboundRouteBinding<Void> parse(Route route) throws InvalidResourceException {
        checkKind(route, Route.Kind.TCP);
        return OutboundRouteBinding.parseStream(route);
      }

      @Override
      Map<String, OutboundRouteBinding<Void>> of(OutboundNamespace namespace) {
        return namespace.tcpRoutes;
      }
    };
  }

  private static void checkKind(Route route, Route.Kind kind) throws InvalidResourceException {
    if (route.kind() != kind) {
      throw new InvalidResourceException("expected " + kind.resourceKind() + " but got "
          + route.kind().resourceKind());
    }
  }

  private void rebuildServiceIps(String namespace) {
    Iterator<ParentRef> owners = serviceIps.values().iterator();
    while (owners.hasNext()) {
      if (owners.next().namespace().equals(namespace)) {
        owners.remove();
      }
    }
    OutboundNamespace index = namespaces.get(namespace);
    if (index == null) {
      return;
    }
    for (Map.Entry<String, ServiceInfo> entry : index.services.entrySet()) {
      ParentRef service = ParentRef.ofService(namespace, entry.getKey());
      for (String ip : entry.getValue().clusterIps()) {
        ParentRef previous = serviceIps.put(ip, service);
        if (previous != null && !previous.equals(service)) {
          logger.log(Level.WARNING, "Cluster IP {0} is claimed by both {1} and {2}",
              new Object[] {ip, previous, service});
        }
      }
    }
  }

  /**
   * Recomputes every key that depends on a changed namespace: keys whose parent or source is
   * in it and keys with backends in it. Keys whose parent no longer exists are removed.
   */
  private void refresh(Set<String> names) {
    if (names.isEmpty()) {
      return;
    }
    Set<OutboundKey> affected = new HashSet<>();
    for (String name : names) {
      OutboundNamespace namespace = namespaces.get(name);
      if (namespace != null) {
        affected.addAll(namespace.policies.keys());
      }
      affected.addAll(keysBySource.get(name));
      affected.addAll(keysByBackendNamespace.get(name));
    }
    for (OutboundKey key : affected) {
      OutboundNamespace namespace = namespaces.get(key.parent().namespace());
      if (!policies.exists(key.parent())) {
        remove(namespace, key);
      } else {
        namespace.policies.update(key, compute(key));
      }
    }
    for (String name : names) {
      OutboundNamespace namespace = namespaces.get(name);
      if (namespace != null && namespace.isEmpty()) {
        namespaces.remove(name);
      }
    }
  }

  private OutboundPolicy compute(OutboundKey key) {
    Set<ParentRef> backends = new HashSet<>();
    OutboundPolicy policy = policies.compute(key, backends);
    Set<String> backendNamespaces = new HashSet<>();
    for (ParentRef backend : backends) {
      backendNamespaces.add(backend.namespace());
    }
    forgetBackends(key);
    backendNamespacesByKey.put(key, backendNamespaces);
    for (String namespace : backendNamespaces) {
      keysByBackendNamespace.put(namespace, key);
    }
    return policy;
  }

  private void remove(@Nullable OutboundNamespace namespace, OutboundKey key) {
    logger.log(Level.FINE, "Removing outbound policy for {0}", key.parent());
    if (namespace != null) {
      namespace.policies.remove(key);
    }
    keysBySource.remove(key.sourceNamespace(), key);
    forgetBackends(key);
  }

  @VisibleForTesting
  Set<OutboundKey> keysWithBackendsIn(String namespace) {
    return ImmutableSet.copyOf(keysByBackendNamespace.get(namespace));
  }

  private void forgetBackends(OutboundKey key) {
    Set<String> previous = backendNamespacesByKey.remove(key);
    if (previous != null) {
      for (String namespace : previous) {
        keysByBackendNamespace.remove(namespace, key);
      }
    }
  }

  private abstract class IndexHandler<T extends Resource, V>
      extends NamespacedResourceHandler<T, V> {
    private final String kind;

    IndexHandler(String kind) {
      this.kind = kind;
    }

    abstract Map<String, V> of(OutboundNamespace namespace);

    @Override
    protected String kind() {
      return kind;
    }

    @Override
    protected Map<String, V> entries(String name, boolean create) {
      OutboundNamespace namespace = namespaces.get(name);
      if (namespace == null && create) {
        namespace = new OutboundNamespace(name);
        namespaces.put(name, namespace);
      }
      return namespace == null ? null : of(namespace);
    }

    @Override
    protected Set<String> indexedNamespaces() {
      Set<String> names = new HashSet<>();
      for (OutboundNamespace namespace : namespaces.values()) {
        if (!of(namespace).isEmpty()) {
          names.add(namespace.name);
        }
      }
      return names;
    }

    @Override
    protected void changed(Set<String> names) {
      refresh(names);
    }
  }
}
