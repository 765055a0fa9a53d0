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

package io.meshpolicy.status;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import com.google.common.collect.SetMultimap;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import io.grpc.SynchronizationContext;
import io.grpc.internal.TimeProvider;
import io.meshpolicy.ParentRef;
import io.meshpolicy.ResourceId;
import io.meshpolicy.index.NamespacedName;
import io.meshpolicy.index.ResourceHandlers;
import io.meshpolicy.index.outbound.RouteParent;
import io.meshpolicy.resource.EgressNetwork;
import io.meshpolicy.resource.ObjectReference;
import io.meshpolicy.resource.RateLimitPolicy;
import io.meshpolicy.resource.Resource;
import io.meshpolicy.resource.ResourceHandler;
import io.meshpolicy.resource.ResourceWatches;
import io.meshpolicy.resource.Route;
import io.meshpolicy.resource.Server;
import io.meshpolicy.resource.Service;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Tracks routes, rate limits and the resources they refer to, and keeps the status of each route
 * and rate limit in line with what it resolves to. Statuses are only written while this replica
 * is the leader, and only when the desired status differs from the last one written.
 *
 * <p>All state is confined to a {@link SynchronizationContext}.
 */
public final class StatusIndex {
  private static final Logger logger = Logger.getLogger(StatusIndex.class.getName());

  static final String RATE_LIMIT_KIND = "HTTPLocalRateLimitPolicy";

  private static final Ordering<Instant> OLDEST_FIRST = Ordering.<Instant>natural().nullsLast();

  private final SynchronizationContext syncContext = new SynchronizationContext(
      new Thread.UncaughtExceptionHandler() {
        @Override
        public void uncaughtException(Thread t, Throwable e) {
          logger.log(Level.SEVERE,
              "Uncaught exception in StatusIndex SynchronizationContext. Panic!", e);
          throw new AssertionError(e);
        }
      });

  private final StatusController controller;
  private final LeaderStatus leader;
  private final TimeProvider timeProvider;

  private final Set<NamespacedName> servers = new HashSet<>();
  private final Set<NamespacedName> services = new HashSet<>();
  private final Set<NamespacedName> egressNetworks = new HashSet<>();
  private final Map<Route.Kind, Map<NamespacedName, Route>> routes =
      new EnumMap<>(Route.Kind.class);
  private final Map<ResourceId, Route> routesById = new HashMap<>();
  // Routes by each Service or EgressNetwork parent they attach to.
  private final SetMultimap<ParentRef, Route> routesByParent = HashMultimap.create();
  private final Map<String, Map<String, RateLimitPolicy>> rateLimits = new HashMap<>();
  // Routes and rate limits whose status depends on resources in a namespace.
  private final SetMultimap<String, ResourceId> dependents = HashMultimap.create();
  private final Map<ResourceId, Set<String>> dependencies = new HashMap<>();

  private final Map<ResourceId, ResourceStatus> desired = new HashMap<>();
  private final Map<ResourceId, ResourceStatus> written = new HashMap<>();
  // Desired statuses not yet written.
  private final Set<ResourceId> pending = new HashSet<>();
  private final Set<ResourceId> inFlight = new HashSet<>();
  // Bumped whenever leadership is lost so that completions of older patches are ignored.
  private int leaderEpoch;
  private boolean started;

  public StatusIndex(
      StatusController controller, LeaderStatus leader, TimeProvider timeProvider) {
    this.controller = checkNotNull(controller, "controller");
    this.leader = checkNotNull(leader, "leader");
    this.timeProvider = checkNotNull(timeProvider, "timeProvider");
    for (Route.Kind kind : Route.Kind.values()) {
      routes.put(kind, new HashMap<NamespacedName, Route>());
    }
  }

  /** Starts following leadership changes. */
  public void start() {
    syncContext.execute(new Runnable() {
      @Override
      public void run() {
        if (started) {
          return;
        }
        started = true;
        leader.addListener(new Runnable() {
          @Override
          public void run() {
            leadershipChanged();
          }
        }, syncContext);
        reconcile();
      }
    });
  }

  /** Handlers for the kinds that affect statuses. All other kinds are ignored. */
  public ResourceWatches watches() {
    return ResourceHandlers.ignoringAll().toBuilder()
        .setServers(serialized(new NameHandler<Server>(servers)))
        .setServices(serialized(new NameHandler<Service>(services)))
        .setEgressNetworks(serialized(new NameHandler<EgressNetwork>(egressNetworks)))
        .setRateLimits(serialized(new RateLimitHandler()))
        .setHttpRoutes(serialized(new RouteHandler(Route.Kind.HTTP)))
        .setGrpcRoutes(serialized(new RouteHandler(Route.Kind.GRPC)))
        .setTlsRoutes(serialized(new RouteHandler(Route.Kind.TLS)))
        .setTcpRoutes(serialized(new RouteHandler(Route.Kind.TCP)))
        .build();
  }

  private <T extends Resource> ResourceHandler<T> serialized(ResourceHandler<T> handler) {
    return ResourceHandlers.serialized(handler, syncContext);
  }

  /** The status that should currently be reported for {@code id}, or null if none. */
  @VisibleForTesting
  @Nullable
  ResourceStatus desiredStatus(ResourceId id) {
    syncContext.throwIfNotInThisSynchronizationContext();
    return desired.get(id);
  }

  /** Routes and rate limits that are recomputed when a resource in {@code namespace} changes. */
  @VisibleForTesting
  Set<ResourceId> dependentsOf(String namespace) {
    syncContext.throwIfNotInThisSynchronizationContext();
    return ImmutableSet.copyOf(dependents.get(namespace));
  }

  @VisibleForTesting
  SynchronizationContext getSyncContext() {
    return syncContext;
  }

  static ResourceId routeId(Route route) {
    return ResourceId.create(route.group(), route.kind().resourceKind(),
        route.metadata().namespace(), route.metadata().name());
  }

  static ResourceId rateLimitId(String namespace, String name) {
    return ResourceId.create(ResourceId.POLICY_GROUP, RATE_LIMIT_KIND, namespace, name);
  }

  private void leadershipChanged() {
    if (!leader.isLeader()) {
      logger.log(Level.INFO, "Lost status leadership");
      leaderEpoch++;
      written.clear();
      inFlight.clear();
      pending.clear();
      return;
    }
    logger.log(Level.INFO, "Acquired status leadership");
    pending.addAll(desired.keySet());
    reconcile();
  }

  /** Recomputes the statuses of {@code affected} and writes the ones that changed. */
  private void recompute(Set<ResourceId> affected) {
    for (ResourceId id : affected) {
      ResourceStatus status = computeStatus(id);
      if (status == null) {
        desired.remove(id);
        written.remove(id);
        pending.remove(id);
        continue;
      }
      desired.put(id, status);
      if (status.equals(written.get(id))) {
        pending.remove(id);
      } else {
        pending.add(id);
      }
    }
    reconcile();
  }

  @Nullable
  private ResourceStatus computeStatus(ResourceId id) {
    Route route = routesById.get(id);
    if (route != null) {
      return ResourceStatus.ofRoute(routeStatus(route));
    }
    if (!RATE_LIMIT_KIND.equals(id.kind())) {
      return null;
    }
    Map<String, RateLimitPolicy> inNamespace = rateLimits.get(id.namespace());
    RateLimitPolicy policy = inNamespace == null ? null : inNamespace.get(id.name());
    return policy == null ? null : ResourceStatus.ofRateLimit(rateLimitStatus(policy));
  }

  private void reconcile() {
    if (!started || !leader.isLeader() || pending.isEmpty()) {
      return;
    }
    Map<String, List<ResourceId>> byNamespace = new TreeMap<>();
    for (Iterator<ResourceId> it = pending.iterator(); it.hasNext(); ) {
      ResourceId id = it.next();
      if (inFlight.contains(id)) {
        // Rechecked once the outstanding patch completes.
        continue;
      }
      it.remove();
      List<ResourceId> ids = byNamespace.get(id.namespace());
      if (ids == null) {
        ids = new ArrayList<>();
        byNamespace.put(id.namespace(), ids);
      }
      ids.add(id);
    }
    Instant now = Instant.ofEpochSecond(0, timeProvider.currentTimeNanos());
    for (Map.Entry<String, List<ResourceId>> entry : byNamespace.entrySet()) {
      logger.log(Level.FINE, "Patching {0} statuses in namespace {1}",
          new Object[] {entry.getValue().size(), entry.getKey()});
      for (ResourceId id : entry.getValue()) {
        issuePatch(id, desired.get(id), now);
      }
    }
  }

  private void issuePatch(final ResourceId id, final ResourceStatus status, Instant now) {
    inFlight.add(id);
    final int epoch = leaderEpoch;
    Futures.addCallback(controller.patch(id, StatusPatches.mergePatch(status, now)),
        new FutureCallback<Void>() {
          @Override
          public void onSuccess(Void unused) {
            if (epoch != leaderEpoch) {
              return;
            }
            inFlight.remove(id);
            ResourceStatus current = desired.get(id);
            if (current == null) {
              return;
            }
            written.put(id, status);
            if (!current.equals(status)) {
              pending.add(id);
            }
            reconcile();
          }

          @Override
          public void onFailure(Throwable t) {
            if (epoch != leaderEpoch) {
              return;
            }
            // Already logged by the controller. The next change retries.
            inFlight.remove(id);
            if (desired.containsKey(id)) {
              pending.add(id);
            }
          }
        }, syncContext);
  }

  private ImmutableList<ParentStatus> routeStatus(Route route) {
    String namespace = route.metadata().namespace();
    ImmutableList.Builder<ParentStatus> parents = ImmutableList.builder();
    for (Route.ParentReference parentRef : route.parentRefs()) {
      if (isServer(parentRef)) {
        NamespacedName server = NamespacedName.of(serverNamespace(namespace, parentRef),
            parentRef.name());
        Condition accepted = servers.contains(server)
            ? Condition.accepted()
            : Condition.notAccepted(Condition.NO_MATCHING_PARENT, "");
        parents.add(ParentStatus.create(parentRef, ImmutableList.of(accepted)));
        continue;
      }
      ParentRef parent = toParentRef(namespace, parentRef);
      if (parent == null) {
        continue;
      }
      Condition accepted;
      if (!exists(parent)) {
        accepted = Condition.notAccepted(Condition.NO_MATCHING_PARENT, "");
      } else if (conflicted(route, parent, parentRef.port())) {
        accepted = Condition.notAccepted(Condition.ROUTE_CONFLICTED, "");
      } else {
        accepted = Condition.accepted();
      }
      parents.add(ParentStatus.create(parentRef,
          ImmutableList.of(accepted, backendCondition(route))));
    }
    return parents.build();
  }

  private Condition backendCondition(Route route) {
    String namespace = route.metadata().namespace();
    Condition resolved = Condition.resolvedRefs();
    for (Route.Rule rule : route.rules()) {
      for (Route.BackendReference backend : rule.backendRefs()) {
        ParentRef target = RouteParent.toParentRef(namespace, backend.group(), backend.kind(),
            backend.namespace(), backend.name());
        if (target == null) {
          return Condition.unresolvedRefs(Condition.INVALID_KIND,
              "unsupported backend type " + backend.kind());
        }
        if (resolved.status() && !exists(target)) {
          resolved = Condition.unresolvedRefs(Condition.BACKEND_NOT_FOUND,
              "backend " + target.namespace() + "/" + target.name() + " not found");
        }
      }
    }
    return resolved;
  }

  private boolean conflicted(Route candidate, ParentRef parent, @Nullable Integer port) {
    for (Route other : routesByParent.get(parent)) {
      if (!conflicts(candidate.kind(), other.kind())) {
        continue;
      }
      for (Route.ParentReference otherRef : other.parentRefs()) {
        if (parent.equals(toParentRef(other.metadata().namespace(), otherRef))
            && Objects.equal(port, otherRef.port())) {
          return true;
        }
      }
    }
    return false;
  }

  /** Whether a route of kind {@code candidate} yields to a route of kind {@code other}. */
  static boolean conflicts(Route.Kind candidate, Route.Kind other) {
    switch (candidate) {
      case GRPC:
        return false;
      case HTTP:
        return other == Route.Kind.GRPC;
      case TLS:
        return other == Route.Kind.GRPC || other == Route.Kind.HTTP;
      case TCP:
        return other != Route.Kind.TCP;
      default:
        throw new AssertionError(candidate);
    }
  }

  private RateLimitStatus rateLimitStatus(RateLimitPolicy policy) {
    ObjectReference target = policy.targetRef();
    ObjectReference targetRef =
        ObjectReference.local(ResourceId.POLICY_GROUP, "Server", target.name());
    String namespace = policy.metadata().namespace();
    if (!target.isKind("Server")
        || !servers.contains(NamespacedName.of(namespace, target.name()))) {
      return RateLimitStatus.create(targetRef,
          ImmutableList.of(Condition.notAccepted(Condition.NO_MATCHING_TARGET, "")));
    }
    for (RateLimitPolicy other : rateLimits.get(namespace).values()) {
      if (other != policy
          && other.targetRef().isKind("Server")
          && target.name().equals(other.targetRef().name())
          && isOlder(other, policy)) {
        return RateLimitStatus.create(targetRef,
            ImmutableList.of(Condition.notAccepted(Condition.RATE_LIMIT_ALREADY_EXISTS, "")));
      }
    }
    return RateLimitStatus.create(targetRef, ImmutableList.of(Condition.accepted()));
  }

  private static boolean isOlder(RateLimitPolicy a, RateLimitPolicy b) {
    return ComparisonChain.start()
        .compare(a.metadata().creationTimestamp(), b.metadata().creationTimestamp(),
            OLDEST_FIRST)
        .compare(a.metadata().name(), b.metadata().name())
        .result() < 0;
  }

  private boolean exists(ParentRef ref) {
    NamespacedName name = NamespacedName.of(ref.namespace(), ref.name());
    return ref.kind() == ParentRef.Kind.SERVICE
        ? services.contains(name)
        : egressNetworks.contains(name);
  }

  private static boolean isServer(Route.ParentReference parentRef) {
    return "Server".equals(parentRef.kind())
        && (parentRef.group() == null || ResourceId.POLICY_GROUP.equals(parentRef.group()));
  }

  private static String serverNamespace(String routeNamespace, Route.ParentReference parentRef) {
    return parentRef.namespace() == null ? routeNamespace : parentRef.namespace();
  }

  @Nullable
  private static ParentRef toParentRef(String routeNamespace, Route.ParentReference parentRef) {
    return RouteParent.toParentRef(routeNamespace, parentRef.group(), parentRef.kind(),
        parentRef.namespace(), parentRef.name());
  }

  /**
   * Indexes {@code route} by its parents and records the namespaces its status depends on: its
   * own, its parents' and its backends'.
   */
  private void indexRoute(Route route) {
    ResourceId id = routeId(route);
    String namespace = route.metadata().namespace();
    routesById.put(id, route);
    Set<String> namespaces = new HashSet<>();
    namespaces.add(namespace);
    for (Route.ParentReference parentRef : route.parentRefs()) {
      if (isServer(parentRef)) {
        namespaces.add(serverNamespace(namespace, parentRef));
        continue;
      }
      ParentRef parent = toParentRef(namespace, parentRef);
      if (parent != null) {
        routesByParent.put(parent, route);
        namespaces.add(parent.namespace());
      }
    }
    for (Route.Rule rule : route.rules()) {
      for (Route.BackendReference backend : rule.backendRefs()) {
        ParentRef target = RouteParent.toParentRef(namespace, backend.group(), backend.kind(),
            backend.namespace(), backend.name());
        if (target != null) {
          namespaces.add(target.namespace());
        }
      }
    }
    setDependencies(id, namespaces);
  }

  private void unindexRoute(Route route) {
    ResourceId id = routeId(route);
    routesById.remove(id);
    for (Route.ParentReference parentRef : route.parentRefs()) {
      ParentRef parent = toParentRef(route.metadata().namespace(), parentRef);
      if (parent != null) {
        routesByParent.remove(parent, route);
      }
    }
    setDependencies(id, ImmutableSet.<String>of());
  }

  /** Adds {@code route} and the routes sharing a parent with it to {@code affected}. */
  private void collectRouteAndPeers(Route route, Set<ResourceId> affected) {
    affected.add(routeId(route));
    for (Route.ParentReference parentRef : route.parentRefs()) {
      ParentRef parent = toParentRef(route.metadata().namespace(), parentRef);
      if (parent != null) {
        for (Route peer : routesByParent.get(parent)) {
          affected.add(routeId(peer));
        }
      }
    }
  }

  private void setDependencies(ResourceId id, Set<String> namespaces) {
    Set<String> previous = dependencies.remove(id);
    if (previous != null) {
      for (String namespace : previous) {
        dependents.remove(namespace, id);
      }
    }
    if (namespaces.isEmpty()) {
      return;
    }
    dependencies.put(id, namespaces);
    for (String namespace : namespaces) {
      dependents.put(namespace, id);
    }
  }

  /**
   * Applies, deletes and resets one kind of resource, then recomputes the statuses that the
   * change can affect.
   */
  private abstract class StatusHandler<T extends Resource> implements ResourceHandler<T> {
    /** Stores {@code resource} and returns the statuses to recompute. */
    abstract Set<ResourceId> put(T resource);

    /** Forgets {@code name} and returns the statuses to recompute. */
    abstract Set<ResourceId> remove(NamespacedName name);

    /** Names of every stored resource of this kind. */
    abstract Set<NamespacedName> names();

    @Override
    public void apply(T resource) {
      recompute(put(resource));
    }

    @Override
    public void delete(String namespace, String name) {
      recompute(remove(NamespacedName.of(namespace, name)));
    }

    @Override
    public void reset(List<T> resources, Map<String, Set<String>> removed) {
      Set<NamespacedName> present = new HashSet<>();
      for (T resource : resources) {
        present.add(NamespacedName.of(resource.metadata().namespace(),
            resource.metadata().name()));
      }
      Set<ResourceId> affected = new HashSet<>();
      for (NamespacedName name : ImmutableList.copyOf(names())) {
        if (!present.contains(name)) {
          affected.addAll(remove(name));
        }
      }
      for (Map.Entry<String, Set<String>> entry : removed.entrySet()) {
        for (String name : entry.getValue()) {
          NamespacedName removedName = NamespacedName.of(entry.getKey(), name);
          if (!present.contains(removedName)) {
            affected.addAll(remove(removedName));
          }
        }
      }
      for (T resource : resources) {
        affected.addAll(put(resource));
      }
      recompute(affected);
    }
  }

  private final class NameHandler<T extends Resource> extends StatusHandler<T> {
    private final Set<NamespacedName> names;

    NameHandler(Set<NamespacedName> names) {
      this.names = names;
    }

    @Override
    Set<ResourceId> put(T resource) {
      NamespacedName name =
          NamespacedName.of(resource.metadata().namespace(), resource.metadata().name());
      if (!names.add(name)) {
        return ImmutableSet.of();
      }
      return ImmutableSet.copyOf(dependents.get(name.namespace()));
    }

    @Override
    Set<ResourceId> remove(NamespacedName name) {
      if (!names.remove(name)) {
        return ImmutableSet.of();
      }
      return ImmutableSet.copyOf(dependents.get(name.namespace()));
    }

    @Override
    Set<NamespacedName> names() {
      return names;
    }
  }

  private final class RouteHandler extends StatusHandler<Route> {
    private final Route.Kind kind;

    RouteHandler(Route.Kind kind) {
      this.kind = kind;
    }

    @Override
    Set<ResourceId> put(Route route) {
      if (route.kind() != kind) {
        logger.log(Level.WARNING, "Ignoring {0} delivered as a {1}",
            new Object[] {routeId(route), kind.resourceKind()});
        return ImmutableSet.of();
      }
      Set<ResourceId> affected = new HashSet<>();
      Route previous = routes.get(kind).put(
          NamespacedName.of(route.metadata().namespace(), route.metadata().name()), route);
      if (previous != null) {
        collectRouteAndPeers(previous, affected);
        unindexRoute(previous);
      }
      indexRoute(route);
      collectRouteAndPeers(route, affected);
      return affected;
    }

    @Override
    Set<ResourceId> remove(NamespacedName name) {
      Route previous = routes.get(kind).remove(name);
      if (previous == null) {
        return ImmutableSet.of();
      }
      Set<ResourceId> affected = new HashSet<>();
      collectRouteAndPeers(previous, affected);
      unindexRoute(previous);
      return affected;
    }

    @Override
    Set<NamespacedName> names() {
      return routes.get(kind).keySet();
    }
  }

  private final class RateLimitHandler extends StatusHandler<RateLimitPolicy> {
    @Override
    Set<ResourceId> put(RateLimitPolicy policy) {
      String namespace = policy.metadata().namespace();
      Map<String, RateLimitPolicy> inNamespace = rateLimits.get(namespace);
      if (inNamespace == null) {
        inNamespace = new HashMap<>();
        rateLimits.put(namespace, inNamespace);
      }
      inNamespace.put(policy.metadata().name(), policy);
      ResourceId id = rateLimitId(namespace, policy.metadata().name());
      setDependencies(id, ImmutableSet.of(namespace));
      return idsIn(namespace, id);
    }

    @Override
    Set<ResourceId> remove(NamespacedName name) {
      Map<String, RateLimitPolicy> inNamespace = rateLimits.get(name.namespace());
      if (inNamespace == null || inNamespace.remove(name.name()) == null) {
        return ImmutableSet.of();
      }
      if (inNamespace.isEmpty()) {
        rateLimits.remove(name.namespace());
      }
      ResourceId id = rateLimitId(name.namespace(), name.name());
      setDependencies(id, ImmutableSet.<String>of());
      return idsIn(name.namespace(), id);
    }

    @Override
    Set<NamespacedName> names() {
      Set<NamespacedName> names = new HashSet<>();
      for (Map.Entry<String, Map<String, RateLimitPolicy>> entry : rateLimits.entrySet()) {
        for (String name : entry.getValue().keySet()) {
          names.add(NamespacedName.of(entry.getKey(), name));
        }
      }
      return names;
    }

    // Rate limits in a namespace contend for the same Servers, so they are recomputed together.
    private Set<ResourceId> idsIn(String namespace, ResourceId changed) {
      Set<ResourceId> ids = new HashSet<>();
      ids.add(changed);
      Map<String, RateLimitPolicy> inNamespace = rateLimits.get(namespace);
      if (inNamespace != null) {
        for (String name : inNamespace.keySet()) {
          ids.add(rateLimitId(namespace, name));
        }
      }
      return ids;
    }
  }
}
