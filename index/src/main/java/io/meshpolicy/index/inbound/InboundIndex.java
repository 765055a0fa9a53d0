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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import io.meshpolicy.IdentityMatch;
import io.meshpolicy.InboundServer;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.index.Annotations;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.DefaultPolicy;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.NamespacedName;
import io.meshpolicy.index.NamespacedResourceHandler;
import io.meshpolicy.index.WorkloadRef;
import io.meshpolicy.index.watch.KeyedCursor;
import io.meshpolicy.resource.AuthorizationPolicy;
import io.meshpolicy.resource.ContainerPort;
import io.meshpolicy.resource.ExternalWorkload;
import io.meshpolicy.resource.MeshTlsAuthentication;
import io.meshpolicy.resource.Namespace;
import io.meshpolicy.resource.NetworkAuthentication;
import io.meshpolicy.resource.Node;
import io.meshpolicy.resource.ObjectMeta;
import io.meshpolicy.resource.Pod;
import io.meshpolicy.resource.RateLimitPolicy;
import io.meshpolicy.resource.Resource;
import io.meshpolicy.resource.ResourceHandler;
import io.meshpolicy.resource.Route;
import io.meshpolicy.resource.Server;
import io.meshpolicy.resource.ServerAuthorization;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Indexes the resources that determine inbound policy and publishes an {@link InboundServer}
 * for each watched workload port.
 *
 * <p>Not thread-safe. All handlers and {@link #watch} must be called from a single writer.
 */
public final class InboundIndex {
  private static final Logger logger = Logger.getLogger(InboundIndex.class.getName());

  private final ClusterInfo cluster;
  private final NodeIndex nodes = new NodeIndex();
  private final AuthenticationIndex authentications = new AuthenticationIndex();
  private final InboundPolicies policies;
  private final Map<String, NamespaceIndex> namespaces = new HashMap<>();
  private final Map<String, DefaultPolicy> namespaceDefaults = new HashMap<>();

  private final WorkloadHandler<Pod> pods = new WorkloadHandler<Pod>(WorkloadRef.Kind.POD) {
    @Override
    void apply(Pod pod, WorkloadRef ref, WorkloadSettings settings) {
      if (pod.nodeName() == null) {
        logger.log(Level.FINE, "Pod {0} is not yet scheduled", ref);
        return;
      }
      ImmutableList<InetAddress> kubeletIps = nodes.kubeletIps(pod.nodeName());
      if (kubeletIps == null) {
        nodes.addPending(pod.nodeName(), pod);
        return;
      }
      nodes.clearPendingPod(ref);
      ImmutableSetMultimap<String, Integer> portNames = portNames(pod.ports());
      ImmutableSetMultimap.Builder<Integer, String> probes = ImmutableSetMultimap.builder();
      for (Pod.HttpProbe probe : pod.probes()) {
        switch (probe.port().getKind()) {
          case NUMBER:
            probes.put(probe.port().number(), probe.path());
            break;
          case NAME:
            for (int port : portNames.get(probe.port().name())) {
              probes.put(port, probe.path());
            }
            break;
          default:
            throw new AssertionError(probe.port().getKind());
        }
      }
      upsert(ref, pod.metadata(), portNames, settings, probes.build(), kubeletIps);
    }

    @Override
    void forget(WorkloadRef ref) {
      nodes.clearPendingPod(ref);
    }
  };

  private final WorkloadHandler<ExternalWorkload> externalWorkloads =
      new WorkloadHandler<ExternalWorkload>(WorkloadRef.Kind.EXTERNAL_WORKLOAD) {
        @Override
        void apply(ExternalWorkload workload, WorkloadRef ref, WorkloadSettings settings) {
          upsert(ref, workload.metadata(), portNames(workload.ports()), settings,
              ImmutableSetMultimap.<Integer, String>of(), ImmutableList.<InetAddress>of());
        }

        @Override
        void forget(WorkloadRef ref) {}
      };

  public InboundIndex(ClusterInfo cluster) {
    this.cluster = checkNotNull(cluster, "cluster");
    this.policies = new InboundPolicies(cluster, authentications);
  }

  /**
   * Returns a cursor over the policy of a workload port, or null if the workload is not
   * indexed.
   */
  @Nullable
  public KeyedCursor<Integer, InboundServer> watch(WorkloadRef ref, int port) {
    NamespaceIndex namespace = namespaces.get(ref.namespace());
    WorkloadState workload = namespace == null ? null : namespace.workload(ref);
    if (workload == null) {
      return null;
    }
    if (workload.servers.get(port) == null) {
      workload.servers.getOrCreate(port, compute(namespace, workload, port));
    }
    return workload.servers.cursor(port);
  }

  /** The current policy of a workload port, or null if the workload is not indexed. */
  @Nullable
  public InboundServer policy(WorkloadRef ref, int port) {
    NamespaceIndex namespace = namespaces.get(ref.namespace());
    WorkloadState workload = namespace == null ? null : namespace.workload(ref);
    if (workload == null) {
      return null;
    }
    InboundServer published = workload.servers.getValue(port);
    return published != null ? published : compute(namespace, workload, port);
  }

  /** Number of indexed resources by kind. */
  public ImmutableMap<String, Integer> sizes() {
    int pods = 0;
    int externalWorkloads = 0;
    int servers = 0;
    int serverAuthorizations = 0;
    int authorizationPolicies = 0;
    int routes = 0;
    int rateLimits = 0;
    for (NamespaceIndex namespace : namespaces.values()) {
      pods += namespace.pods.size();
      externalWorkloads += namespace.externalWorkloads.size();
      servers += namespace.servers.size();
      serverAuthorizations += namespace.serverAuthorizations.size();
      authorizationPolicies += namespace.authorizationPolicies.size();
      routes += namespace.httpRoutes.size() + namespace.grpcRoutes.size();
      rateLimits += namespace.rateLimits.size();
    }
    return ImmutableMap.<String, Integer>builder()
        .put("Pod", pods)
        .put("ExternalWorkload", externalWorkloads)
        .put("Server", servers)
        .put("ServerAuthorization", serverAuthorizations)
        .put("AuthorizationPolicy", authorizationPolicies)
        .put("InboundRoute", routes)
        .put("HTTPLocalRateLimitPolicy", rateLimits)
        .put("Authentication", authentications.size())
        .put("Node", nodes.size())
        .put("PendingPod", nodes.pendingCount())
        .build();
  }

  public ResourceHandler<Pod> pods() {
    return pods;
  }

  public ResourceHandler<ExternalWorkload> externalWorkloads() {
    return externalWorkloads;
  }

  public ResourceHandler<Node> nodes() {
    return new ResourceHandler<Node>() {
      @Override
      public void apply(Node node) {
        List<Pod> flushed;
        try {
          flushed = nodes.apply(node);
        } catch (InvalidResourceException e) {
          logger.log(Level.WARNING, "Ignoring invalid node {0}: {1}",
              new Object[] {node.metadata().name(), e.getMessage()});
          return;
        }
        for (Pod pod : flushed) {
          pods.apply(pod);
        }
      }

      @Override
      public void delete(String namespace, String name) {
        nodes.delete(name);
      }

      @Override
      public void reset(List<Node> resources, Map<String, Set<String>> removed) {
        for (Pod pod : nodes.reset(resources)) {
          pods.apply(pod);
        }
      }
    };
  }

  /** Namespace-level default policy annotations. */
  public ResourceHandler<Namespace> namespaces() {
    return new ResourceHandler<Namespace>() {
      @Override
      public void apply(Namespace namespace) {
        String name = namespace.metadata().name();
        String annotation =
            namespace.metadata().annotations().get(Annotations.DEFAULT_INBOUND_POLICY);
        DefaultPolicy policy = null;
        if (annotation != null) {
          try {
            policy = DefaultPolicy.parse(annotation);
          } catch (InvalidResourceException e) {
            logger.log(Level.WARNING, "Ignoring invalid default policy of namespace {0}: {1}",
                new Object[] {name, e.getMessage()});
            return;
          }
        }
        setNamespaceDefault(name, policy);
      }

      @Override
      public void delete(String namespace, String name) {
        setNamespaceDefault(name, null);
      }

      @Override
      public void reset(List<Namespace> resources, Map<String, Set<String>> removed) {
        Set<String> stale = new HashSet<>(namespaceDefaults.keySet());
        for (Namespace namespace : resources) {
          stale.remove(namespace.metadata().name());
          apply(namespace);
        }
        for (String name : stale) {
          setNamespaceDefault(name, null);
        }
      }
    };
  }

  public ResourceHandler<Server> servers() {
    return new IndexHandler<Server, IndexedServer>("Server") {
      @Override
      protected IndexedServer parse(Server server) throws InvalidResourceException {
        return IndexedServer.parse(server, cluster);
      }

      @Override
      Map<String, IndexedServer> of(NamespaceIndex namespace) {
        return namespace.servers;
      }
    };
  }

  public ResourceHandler<ServerAuthorization> serverAuthorizations() {
    return new IndexHandler<ServerAuthorization, IndexedServerAuthorization>(
        "ServerAuthorization") {
      @Override
      protected IndexedServerAuthorization parse(ServerAuthorization authz)
          throws InvalidResourceException {
        return IndexedServerAuthorization.parse(authz, cluster);
      }

      @Override
      Map<String, IndexedServerAuthorization> of(NamespaceIndex namespace) {
        return namespace.serverAuthorizations;
      }
    };
  }

  public ResourceHandler<AuthorizationPolicy> authorizationPolicies() {
    return new IndexHandler<AuthorizationPolicy, IndexedAuthorizationPolicy>(
        "AuthorizationPolicy") {
      @Override
      protected IndexedAuthorizationPolicy parse(AuthorizationPolicy policy)
          throws InvalidResourceException {
        return IndexedAuthorizationPolicy.parse(policy, cluster);
      }

      @Override
      Map<String, IndexedAuthorizationPolicy> of(NamespaceIndex namespace) {
        return namespace.authorizationPolicies;
      }

      @Override
      protected void changed(Set<String> names) {
        for (String name : names) {
          NamespaceIndex namespace = namespaces.get(name);
          authentications.setReferences(name, namespace == null
              ? Collections.<IndexedAuthorizationPolicy>emptyList()
              : namespace.authorizationPolicies.values());
        }
        super.changed(names);
      }
    };
  }

  /** Receives HTTPRoutes; routes without a Server parent are not indexed here. */
  public ResourceHandler<Route> httpRoutes() {
    return new IndexHandler<Route, InboundRouteBinding<HttpRouteMatch>>("HTTPRoute") {
      @Override
      protected InboundRouteBinding<HttpRouteMatch> parse(Route route)
          throws InvalidResourceException {
        checkKind(route, Route.Kind.HTTP);
        return InboundRouteBinding.parseHttp(route);
      }

      @Override
      Map<String, InboundRouteBinding<HttpRouteMatch>> of(NamespaceIndex namespace) {
        return namespace.httpRoutes;
      }
    };
  }

  public ResourceHandler<Route> grpcRoutes() {
    return new IndexHandler<Route, InboundRouteBinding<GrpcRouteMatch>>("GRPCRoute") {
      @Override
      protected InboundRouteBinding<GrpcRouteMatch> parse(Route route)
          throws InvalidResourceException {
        checkKind(route, Route.Kind.GRPC);
        return InboundRouteBinding.parseGrpc(route);
      }

      @Override
      Map<String, InboundRouteBinding<GrpcRouteMatch>> of(NamespaceIndex namespace) {
        return namespace.grpcRoutes;
      }
    };
  }

  public ResourceHandler<RateLimitPolicy> rateLimits() {
    return new IndexHandler<RateLimitPolicy, IndexedRateLimit>("HTTPLocalRateLimitPolicy") {
      @Override
      protected IndexedRateLimit parse(RateLimitPolicy policy) throws InvalidResourceException {
        return IndexedRateLimit.parse(policy, cluster);
      }

      @Override
      Map<String, IndexedRateLimit> of(NamespaceIndex namespace) {
        return namespace.rateLimits;
      }
    };
  }

  public ResourceHandler<MeshTlsAuthentication> meshTlsAuthentications() {
    return new AuthenticationHandler<MeshTlsAuthentication, ImmutableList<IdentityMatch>>(
        "MeshTLSAuthentication", authentications.meshTls) {
      @Override
      protected ImmutableList<IdentityMatch> parse(MeshTlsAuthentication authn)
          throws InvalidResourceException {
        return AuthenticationIndex.parse(authn, cluster);
      }

      @Override
      Set<String> referrers(NamespacedName ref) {
        return authentications.meshTlsReferrers(ref);
      }
    };
  }

  public ResourceHandler<NetworkAuthentication> networkAuthentications() {
    return new AuthenticationHandler<NetworkAuthentication, ImmutableList<NetworkMatch>>(
        "NetworkAuthentication", authentications.networks) {
      @Override
      protected ImmutableList<NetworkMatch> parse(NetworkAuthentication authn)
          throws InvalidResourceException {
        return AuthenticationIndex.parse(authn);
      }

      @Override
      Set<String> referrers(NamespacedName ref) {
        return authentications.networkReferrers(ref);
      }
    };
  }

  private static void checkKind(Route route, Route.Kind kind) throws InvalidResourceException {
    if (route.kind() != kind) {
      throw new InvalidResourceException("expected " + kind.resourceKind() + " but got "
          + route.kind().resourceKind());
    }
  }

  private void setNamespaceDefault(String namespace, @Nullable DefaultPolicy policy) {
    DefaultPolicy previous = policy == null
        ? namespaceDefaults.remove(namespace)
        : namespaceDefaults.put(namespace, policy);
    if (policy == null ? previous != null : !policy.equals(previous)) {
      logger.log(Level.FINE, "Namespace {0} default policy is now {1}",
          new Object[] {namespace, policy});
      reindex(Collections.singleton(namespace));
    }
  }

  private void upsert(WorkloadRef ref, ObjectMeta metadata,
      ImmutableSetMultimap<String, Integer> portNames, WorkloadSettings settings,
      ImmutableSetMultimap<Integer, String> probePaths, ImmutableList<InetAddress> kubeletIps) {
    NamespaceIndex namespace = namespace(ref.namespace());
    Map<String, WorkloadState> workloads = namespace.workloads(ref.kind());
    WorkloadState workload = workloads.get(ref.name());
    if (workload == null) {
      workload = new WorkloadState(ref, portNames);
      workloads.put(ref.name(), workload);
      logger.log(Level.FINER, "Indexed workload {0}", workload);
    } else if (!workload.portNames.equals(portNames)) {
      logger.log(Level.WARNING, "Port names of {0} may not change; ignoring update", workload);
      return;
    }
    workload.labels = metadata.labels();
    workload.settings = settings;
    workload.probePaths = probePaths;
    workload.kubeletIps = kubeletIps;
    reindex(namespace, workload);
  }

  private void removeWorkload(WorkloadRef ref) {
    NamespaceIndex namespace = namespaces.get(ref.namespace());
    if (namespace == null) {
      return;
    }
    WorkloadState workload = namespace.workloads(ref.kind()).remove(ref.name());
    if (workload != null) {
      logger.log(Level.FINER, "Removed workload {0}", workload);
      workload.servers.close();
      prune(namespace);
    }
  }

  private NamespaceIndex namespace(String name) {
    NamespaceIndex namespace = namespaces.get(name);
    if (namespace == null) {
      namespace = new NamespaceIndex(name);
      namespaces.put(name, namespace);
    }
    return namespace;
  }

  private void prune(NamespaceIndex namespace) {
    if (namespace.isEmpty()) {
      namespaces.remove(namespace.name);
    }
  }

  private void reindex(Set<String> names) {
    for (String name : names) {
      NamespaceIndex namespace = namespaces.get(name);
      if (namespace == null) {
        continue;
      }
      for (WorkloadState workload : namespace.allWorkloads()) {
        reindex(namespace, workload);
      }
      prune(namespace);
    }
  }

  /** Assigns ports to the Servers selecting the workload and republishes each known port. */
  private void reindex(NamespaceIndex namespace, WorkloadState workload) {
    List<IndexedServer> selecting = new ArrayList<>();
    for (IndexedServer server : namespace.servers.values()) {
      if (server.selects(workload.ref.kind(), workload.labels)) {
        selecting.add(server);
      }
    }
    Collections.sort(selecting, IndexedServer.OLDEST_FIRST);
    Map<Integer, String> serverByPort = new HashMap<>();
    for (IndexedServer server : selecting) {
      for (int port : workload.ports(server.port())) {
        String owner = serverByPort.get(port);
        if (owner != null) {
          logger.log(Level.WARNING, "Server {0} selects port {1} of {2} already claimed by {3};"
              + " ignoring", new Object[] {server.name(), port, workload, owner});
          continue;
        }
        serverByPort.put(port, server.name());
      }
    }
    workload.serverByPort = serverByPort;

    Set<Integer> ports = new TreeSet<>(workload.servers.keys());
    ports.addAll(serverByPort.keySet());
    for (int port : ports) {
      workload.publish(port, compute(namespace, workload, port));
    }
  }

  private InboundServer compute(NamespaceIndex namespace, WorkloadState workload, int port) {
    String serverName = workload.serverByPort.get(port);
    IndexedServer server = serverName == null ? null : namespace.servers.get(serverName);
    if (server != null) {
      return policies.forServer(namespace, workload, port, server);
    }
    return policies.defaultServer(namespaceDefaults.get(namespace.name), workload, port);
  }

  private static ImmutableSetMultimap<String, Integer> portNames(List<ContainerPort> ports) {
    ImmutableSetMultimap.Builder<String, Integer> names = ImmutableSetMultimap.builder();
    for (ContainerPort port : ports) {
      if (port.name() != null) {
        names.put(port.name(), port.port());
      }
    }
    return names.build();
  }

  /** Workload events; settings are parsed before the kind-specific handling. */
  private abstract class WorkloadHandler<T extends Resource>
      implements ResourceHandler<T> {
    private final WorkloadRef.Kind kind;

    WorkloadHandler(WorkloadRef.Kind kind) {
      this.kind = kind;
    }

    abstract void apply(T resource, WorkloadRef ref, WorkloadSettings settings);

    /** Drops state held for a workload outside the namespace index. */
    abstract void forget(WorkloadRef ref);

    @Override
    public final void apply(T resource) {
      WorkloadRef ref = ref(resource.metadata().namespace(), resource.metadata().name());
      WorkloadSettings settings;
      try {
        settings = WorkloadSettings.parse(resource.metadata().annotations());
      } catch (InvalidResourceException e) {
        logger.log(Level.WARNING, "Ignoring invalid workload {0}/{1}: {2}",
            new Object[] {ref.namespace(), ref.name(), e.getMessage()});
        return;
      }
      apply(resource, ref, settings);
    }

    @Override
    public final void delete(String namespace, String name) {
      WorkloadRef ref = ref(namespace, name);
      forget(ref);
      removeWorkload(ref);
    }

    @Override
    public final void reset(List<T> resources, Map<String, Set<String>> removed) {
      Set<WorkloadRef> present = new HashSet<>();
      for (T resource : resources) {
        present.add(ref(resource.metadata().namespace(), resource.metadata().name()));
      }
      for (Map.Entry<String, Set<String>> entry : removed.entrySet()) {
        for (String name : entry.getValue()) {
          forget(ref(entry.getKey(), name));
        }
      }
      List<WorkloadRef> stale = new ArrayList<>();
      for (NamespaceIndex namespace : namespaces.values()) {
        for (WorkloadState workload : namespace.workloads(kind).values()) {
          if (!present.contains(workload.ref)) {
            stale.add(workload.ref);
          }
        }
      }
      for (WorkloadRef ref : stale) {
        delete(ref.namespace(), ref.name());
      }
      for (T resource : resources) {
        apply(resource);
      }
    }

    private WorkloadRef ref(String namespace, String name) {
      return kind == WorkloadRef.Kind.POD
          ? WorkloadRef.pod(namespace, name)
          : WorkloadRef.externalWorkload(namespace, name);
    }
  }

  /** Namespaced kinds stored in {@link NamespaceIndex}; changes reindex the namespace. */
  private abstract class IndexHandler<T extends Resource, V>
      extends NamespacedResourceHandler<T, V> {
    private final String kind;

    IndexHandler(String kind) {
      this.kind = kind;
    }

    abstract Map<String, V> of(NamespaceIndex namespace);

    @Override
    protected String kind() {
      return kind;
    }

    @Override
    protected Map<String, V> entries(String name, boolean create) {
      NamespaceIndex namespace = create ? namespace(name) : namespaces.get(name);
      return namespace == null ? null : of(namespace);
    }

    @Override
    protected Set<String> indexedNamespaces() {
      Set<String> names = new HashSet<>();
      for (NamespaceIndex namespace : namespaces.values()) {
        if (!of(namespace).isEmpty()) {
          names.add(namespace.name);
        }
      }
      return names;
    }

    @Override
    protected void changed(Set<String> names) {
      reindex(names);
    }
  }

  /**
   * Authentications are referenced across namespaces; a change reindexes the namespaces whose
   * AuthorizationPolicies reference the changed authentication.
   */
  private abstract class AuthenticationHandler<T extends Resource, V>
      extends NamespacedResourceHandler<T, V> {
    private final String kind;
    private final Map<String, Map<String, V>> byNamespace;
    /** The entries of each namespace as of the last change, to tell which names changed. */
    private final Map<String, ImmutableMap<String, V>> lastSeen = new HashMap<>();

    AuthenticationHandler(String kind, Map<String, Map<String, V>> byNamespace) {
      this.kind = kind;
      this.byNamespace = byNamespace;
    }

    abstract Set<String> referrers(NamespacedName ref);

    @Override
    protected String kind() {
      return kind;
    }

    @Override
    protected Map<String, V> entries(String namespace, boolean create) {
      Map<String, V> entries = byNamespace.get(namespace);
      if (entries == null && create) {
        entries = new HashMap<>();
        byNamespace.put(namespace, entries);
      }
      return entries;
    }

    @Override
    protected Set<String> indexedNamespaces() {
      return new HashSet<>(byNamespace.keySet());
    }

    @Override
    protected void changed(Set<String> names) {
      if (names.isEmpty()) {
        return;
      }
      Set<String> affected = new HashSet<>();
      for (String name : names) {
        Map<String, V> entries = byNamespace.get(name);
        ImmutableMap<String, V> current = entries == null
            ? ImmutableMap.<String, V>of()
            : ImmutableMap.copyOf(entries);
        ImmutableMap<String, V> previous = lastSeen.get(name);
        if (previous == null) {
          previous = ImmutableMap.of();
        }
        Set<String> keys = new HashSet<>(current.keySet());
        keys.addAll(previous.keySet());
        for (String key : keys) {
          if (!Objects.equals(current.get(key), previous.get(key))) {
            affected.addAll(referrers(NamespacedName.of(name, key)));
          }
        }
        if (current.isEmpty()) {
          byNamespace.remove(name);
          lastSeen.remove(name);
        } else {
          lastSeen.put(name, current);
        }
      }
      reindex(affected);
    }
  }
}
