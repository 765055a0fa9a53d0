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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.net.InetAddresses;
import com.google.common.util.concurrent.MoreExecutors;
import io.meshpolicy.AuthorizationRef;
import io.meshpolicy.Cidr;
import io.meshpolicy.ClientAuthentication;
import io.meshpolicy.ClientAuthorization;
import io.meshpolicy.IdentityMatch;
import io.meshpolicy.InboundRoute;
import io.meshpolicy.InboundServer;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.ProxyProtocol;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.RouteMatchers.PathMatch;
import io.meshpolicy.RouteMatchers.ValueMatch;
import io.meshpolicy.RouteRef;
import io.meshpolicy.ServerRef;
import io.meshpolicy.index.Annotations;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.WorkloadRef;
import io.meshpolicy.index.watch.KeyedCursor;
import io.meshpolicy.resource.AuthorizationPolicy;
import io.meshpolicy.resource.ContainerPort;
import io.meshpolicy.resource.LabelSelector;
import io.meshpolicy.resource.MeshTlsAuthentication;
import io.meshpolicy.resource.Namespace;
import io.meshpolicy.resource.NetworkAuthentication;
import io.meshpolicy.resource.NetworkSpec;
import io.meshpolicy.resource.Node;
import io.meshpolicy.resource.ObjectMeta;
import io.meshpolicy.resource.ObjectReference;
import io.meshpolicy.resource.Pod;
import io.meshpolicy.resource.PortReference;
import io.meshpolicy.resource.RateLimitPolicy;
import io.meshpolicy.resource.Route;
import io.meshpolicy.resource.Server;
import io.meshpolicy.resource.ServerAuthorization;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InboundIndexTest {
  private static final String NAMESPACE = "shop";
  private static final String POLICY_GROUP = "policy.linkerd.io";
  private static final WorkloadRef WEB = WorkloadRef.pod(NAMESPACE, "web-0");
  private static final ClientAuthorization KUBELET = ClientAuthorization.create(
      NetworkMatch.of(ImmutableList.of(Cidr.ofHost(InetAddresses.forString("10.0.1.1")))),
      ClientAuthentication.unauthenticatedClients());

  private final Logger policiesLogger = Logger.getLogger(InboundPolicies.class.getName());
  private final ClusterInfo cluster = ClusterInfo.builder().build();
  private final InboundIndex index = new InboundIndex(cluster);
  private final AtomicInteger notifications = new AtomicInteger();
  private final Runnable listener = new Runnable() {
    @Override
    public void run() {
      notifications.incrementAndGet();
    }
  };

  @Before
  public void setUp() {
    index.nodes().apply(Node.create(ObjectMeta.of("", "node-1"),
        ImmutableList.of("10.0.1.0/24")));
  }

  @Test
  public void unknownWorkload() {
    assertThat(index.policy(WEB, 8080)).isNull();
    assertThat(index.watch(WEB, 8080)).isNull();
  }

  @Test
  public void defaultPolicy_fromCluster() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));

    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.reference()).isEqualTo(ServerRef.ofDefault("all-unauthenticated"));
    assertThat(policy.protocol()).isEqualTo(ProxyProtocol.detect(cluster.defaultDetectTimeout()));
    assertThat(policy.authorizations()).containsExactly(
        AuthorizationRef.ofDefault("all-unauthenticated"),
        ClientAuthorization.create(NetworkMatch.all(),
            ClientAuthentication.unauthenticatedClients()),
        AuthorizationRef.ofDefault("kubelet"), KUBELET);
    assertThat(policy.httpRoutes()).hasSize(1);
    assertThat(policy.httpRoutes().get(0).ref()).isEqualTo(RouteRef.ofDefault("default"));
    assertThat(policy.httpRoutes().get(0).authorizations()).isEqualTo(policy.authorizations());
    assertThat(policy.grpcRoutes()).hasSize(1);
    assertThat(policy.rateLimit()).isNull();
  }

  @Test
  public void defaultPolicy_namespaceAnnotationUpdatesWatchers() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    KeyedCursor<Integer, InboundServer> cursor = index.watch(WEB, 8080);
    cursor.start(listener, MoreExecutors.directExecutor());
    assertThat(cursor.poll().reference()).isEqualTo(ServerRef.ofDefault("all-unauthenticated"));

    index.namespaces().apply(Namespace.create(ObjectMeta.builder()
        .setName(NAMESPACE)
        .setAnnotations(ImmutableMap.of(Annotations.DEFAULT_INBOUND_POLICY, "deny"))
        .build()));

    assertThat(notifications.get()).isEqualTo(1);
    InboundServer denied = cursor.poll();
    assertThat(denied.reference()).isEqualTo(ServerRef.ofDefault("deny"));
    assertThat(denied.authorizations()).isEmpty();

    index.namespaces().delete("", NAMESPACE);

    assertThat(cursor.poll().reference()).isEqualTo(ServerRef.ofDefault("all-unauthenticated"));
  }

  @Test
  public void defaultPolicy_workloadAnnotationWinsOverNamespace() {
    index.namespaces().apply(Namespace.create(ObjectMeta.builder()
        .setName(NAMESPACE)
        .setAnnotations(ImmutableMap.of(Annotations.DEFAULT_INBOUND_POLICY, "deny"))
        .build()));
    index.pods().apply(pod("web-0",
        ImmutableMap.of(Annotations.DEFAULT_INBOUND_POLICY, "cluster-authenticated")));

    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.reference()).isEqualTo(ServerRef.ofDefault("cluster-authenticated"));
    assertThat(policy.authorizations().get(AuthorizationRef.ofDefault("cluster-authenticated")))
        .isEqualTo(ClientAuthorization.create(
            cluster.clusterNetworkMatches(), ClientAuthentication.anyIdentity()));
  }

  @Test
  public void defaultPolicy_requireIdentityAndOpaquePorts() {
    index.pods().apply(pod("web-0", ImmutableMap.of(
        Annotations.REQUIRE_IDENTITY_PORTS, "8080",
        Annotations.OPAQUE_PORTS, "9990")));

    InboundServer http = index.policy(WEB, 8080);
    assertThat(http.reference()).isEqualTo(ServerRef.ofDefault("all-authenticated"));
    assertThat(http.protocol().kind()).isEqualTo(ProxyProtocol.Kind.DETECT);

    InboundServer admin = index.policy(WEB, 9990);
    assertThat(admin.reference()).isEqualTo(ServerRef.ofDefault("all-unauthenticated"));
    assertThat(admin.protocol()).isEqualTo(ProxyProtocol.of(ProxyProtocol.Kind.OPAQUE));
  }

  @Test
  public void defaultPolicy_invalidWorkloadAnnotationIsIgnored() {
    index.pods().apply(pod("web-0", ImmutableMap.of(Annotations.OPAQUE_PORTS, "0")));

    assertThat(index.policy(WEB, 8080)).isNull();
  }

  @Test
  public void defaultPolicy_probeRoute() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()).toBuilder()
        .setProbes(ImmutableList.of(
            Pod.HttpProbe.create(PortReference.ofName("http"), "/ready"),
            Pod.HttpProbe.create(PortReference.ofNumber(8080), "/live")))
        .build());

    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.httpRoutes()).hasSize(2);
    InboundRoute<HttpRouteMatch> probe = policy.httpRoutes().get(1);
    assertThat(probe.ref()).isEqualTo(RouteRef.ofDefault("probe"));
    assertThat(probe.rules().get(0).matches()).containsExactly(
        HttpRouteMatch.create(PathMatch.forExact("/live"), ImmutableList.<ValueMatch>of(),
            ImmutableList.<ValueMatch>of(), "GET"),
        HttpRouteMatch.create(PathMatch.forExact("/ready"), ImmutableList.<ValueMatch>of(),
            ImmutableList.<ValueMatch>of(), "GET")).inOrder();
    assertThat(probe.authorizations()).containsExactly(
        AuthorizationRef.ofDefault("probe"),
        ClientAuthorization.create(NetworkMatch.of(cluster.probeNetworks()),
            ClientAuthentication.unauthenticatedClients()));

    assertThat(index.policy(WEB, 9990).httpRoutes()).hasSize(1);
  }

  @Test
  public void server_withoutRoutesKeepsProbeRoute() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()).toBuilder()
        .setProbes(ImmutableList.of(
            Pod.HttpProbe.create(PortReference.ofNumber(8080), "/live")))
        .build());
    index.servers().apply(server("web-http", null, null));

    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.reference()).isEqualTo(ServerRef.ofServer("web-http"));
    assertThat(policy.httpRoutes()).hasSize(2);
    assertThat(policy.httpRoutes().get(0).ref()).isEqualTo(RouteRef.ofDefault("default"));
    InboundRoute<HttpRouteMatch> probe = policy.httpRoutes().get(1);
    assertThat(probe.ref()).isEqualTo(RouteRef.ofDefault("probe"));
    assertThat(probe.rules().get(0).matches()).containsExactly(
        HttpRouteMatch.create(PathMatch.forExact("/live"), ImmutableList.<ValueMatch>of(),
            ImmutableList.<ValueMatch>of(), "GET"));
    assertThat(probe.authorizations()).containsKey(AuthorizationRef.ofDefault("probe"));

    index.httpRoutes().apply(route("web-route", "/api", null));

    assertThat(index.policy(WEB, 8080).httpRoutes()).hasSize(1);
  }

  @Test
  public void pendingPod_indexedWhenNodeArrives() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()).toBuilder()
        .setNodeName("node-2")
        .build());
    assertThat(index.policy(WEB, 8080)).isNull();
    assertThat(index.sizes()).containsEntry("PendingPod", 1);

    index.nodes().apply(Node.create(ObjectMeta.of("", "node-2"),
        ImmutableList.of("10.0.2.0/24")));

    assertThat(index.sizes()).containsEntry("PendingPod", 0);
    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.authorizations().get(AuthorizationRef.ofDefault("kubelet")))
        .isEqualTo(ClientAuthorization.create(
            NetworkMatch.of(ImmutableList.of(
                Cidr.ofHost(InetAddresses.forString("10.0.2.1")))),
            ClientAuthentication.unauthenticatedClients()));
  }

  @Test
  public void pendingPod_deletedBeforeNodeArrives() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()).toBuilder()
        .setNodeName("node-2")
        .build());
    index.pods().delete(NAMESPACE, "web-0");
    index.nodes().apply(Node.create(ObjectMeta.of("", "node-2"),
        ImmutableList.of("10.0.2.0/24")));

    assertThat(index.policy(WEB, 8080)).isNull();
    assertThat(index.sizes()).containsEntry("PendingPod", 0);
  }

  @Test
  public void unscheduledPodIsNotIndexed() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()).toBuilder()
        .setNodeName(null)
        .build());

    assertThat(index.policy(WEB, 8080)).isNull();
    assertThat(index.sizes()).containsEntry("PendingPod", 0);
  }

  @Test
  public void deletedPodClosesWatch() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    KeyedCursor<Integer, InboundServer> cursor = index.watch(WEB, 8080);
    cursor.start(listener, MoreExecutors.directExecutor());
    cursor.poll();

    index.pods().delete(NAMESPACE, "web-0");

    assertThat(cursor.isClosed()).isTrue();
    assertThat(index.policy(WEB, 8080)).isNull();
  }

  @Test
  public void server_selectsPortByName() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));

    InboundServer http = index.policy(WEB, 8080);
    assertThat(http.reference()).isEqualTo(ServerRef.ofServer("web-http"));
    assertThat(http.protocol()).isEqualTo(ProxyProtocol.of(ProxyProtocol.Kind.HTTP1));
    assertThat(http.authorizations()).isEmpty();
    assertThat(http.httpRoutes().get(0).ref()).isEqualTo(RouteRef.ofDefault("default"));

    assertThat(index.policy(WEB, 9990).reference())
        .isEqualTo(ServerRef.ofDefault("all-unauthenticated"));
  }

  @Test
  public void server_labelsMustMatch() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()).toBuilder()
        .setMetadata(ObjectMeta.builder()
            .setNamespace(NAMESPACE)
            .setName("web-0")
            .setLabels(ImmutableMap.of("app", "api"))
            .build())
        .build());
    index.servers().apply(server("web-http", null, null));

    assertThat(index.policy(WEB, 8080).reference())
        .isEqualTo(ServerRef.ofDefault("all-unauthenticated"));
  }

  @Test
  public void server_accessPolicyAppliesWhenNothingAuthorizes() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", "all-unauthenticated", null));

    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.authorizations().keySet()).containsExactly(
        AuthorizationRef.ofDefault("all-unauthenticated"), AuthorizationRef.ofDefault("kubelet"));
  }

  @Test
  public void server_oldestWinsAndSuccessorTakesOver() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    KeyedCursor<Integer, InboundServer> cursor = index.watch(WEB, 8080);
    cursor.start(listener, MoreExecutors.directExecutor());
    cursor.poll();

    index.servers().apply(server("newer", null, Instant.ofEpochSecond(200)));
    index.servers().apply(server("older", null, Instant.ofEpochSecond(100)));
    assertThat(cursor.poll().reference()).isEqualTo(ServerRef.ofServer("older"));

    index.servers().delete(NAMESPACE, "older");
    assertThat(cursor.poll().reference()).isEqualTo(ServerRef.ofServer("newer"));

    index.servers().delete(NAMESPACE, "newer");
    assertThat(cursor.poll().reference())
        .isEqualTo(ServerRef.ofDefault("all-unauthenticated"));
  }

  @Test
  public void server_invalidUpdateKeepsPreviousVersion() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));

    index.servers().apply(Server.builder()
        .setMetadata(meta("web-http", null))
        .setSelector(LabelSelector.matchLabels(ImmutableMap.of("app", "web")))
        .setPort(PortReference.ofName("http"))
        .setProxyProtocol("SMTP")
        .build());

    assertThat(index.policy(WEB, 8080).protocol())
        .isEqualTo(ProxyProtocol.of(ProxyProtocol.Kind.HTTP1));
  }

  @Test
  public void serverAuthorization_byName() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));
    index.serverAuthorizations().apply(ServerAuthorization.builder()
        .setMetadata(meta("web-authz", null))
        .setServerName("web-http")
        .setNetworks(ImmutableList.of(NetworkSpec.of("10.0.0.0/8")))
        .setUnauthenticated(true)
        .build());

    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.authorizations()).containsExactly(
        AuthorizationRef.ofServerAuthorization("web-authz"),
        ClientAuthorization.create(
            NetworkMatch.of(ImmutableList.of(Cidr.parse("10.0.0.0/8"))),
            ClientAuthentication.unauthenticatedClients()));
  }

  @Test
  public void authorizationPolicy_waitsForAuthentication() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));
    index.authorizationPolicies().apply(AuthorizationPolicy.create(
        meta("web-policy", null),
        ObjectReference.local(POLICY_GROUP, "Server", "web-http"),
        ImmutableList.of(
            ObjectReference.local(POLICY_GROUP, "MeshTLSAuthentication", "web-clients"))));

    assertThat(index.policy(WEB, 8080).authorizations()).isEmpty();

    String identity = "*.shop.serviceaccount.identity.linkerd.cluster.local";
    index.meshTlsAuthentications().apply(MeshTlsAuthentication.create(
        meta("web-clients", null), ImmutableList.of(identity),
        ImmutableList.<ObjectReference>of()));

    assertThat(index.policy(WEB, 8080).authorizations()).containsExactly(
        AuthorizationRef.ofAuthorizationPolicy("web-policy"),
        ClientAuthorization.create(NetworkMatch.all(),
            ClientAuthentication.authenticatedClients(
                ImmutableList.of(IdentityMatch.parse(identity)))));

    index.meshTlsAuthentications().delete(NAMESPACE, "web-clients");

    assertThat(index.policy(WEB, 8080).authorizations()).isEmpty();
  }

  @Test
  public void authenticationChange_reindexesOnlyReferringNamespaces() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));
    index.authorizationPolicies().apply(AuthorizationPolicy.create(
        meta("web-policy", null),
        ObjectReference.local(POLICY_GROUP, "Server", "web-http"),
        ImmutableList.of(
            ObjectReference.local(POLICY_GROUP, "MeshTLSAuthentication", "web-clients"))));
    final List<LogRecord> illegalPolicies = new ArrayList<>();
    Handler handler = new Handler() {
      @Override
      public void publish(LogRecord record) {
        if (record.getMessage().startsWith("Illegal AuthorizationPolicy")) {
          illegalPolicies.add(record);
        }
      }

      @Override
      public void flush() {}

      @Override
      public void close() {}
    };
    policiesLogger.addHandler(handler);
    try {
      index.meshTlsAuthentications().apply(MeshTlsAuthentication.create(
          ObjectMeta.of("billing", "billing-clients"), ImmutableList.of("*"),
          ImmutableList.<ObjectReference>of()));
      index.networkAuthentications().apply(NetworkAuthentication.create(
          meta("web-clients", null), ImmutableList.of(NetworkSpec.of("10.0.0.0/8"))));
      assertThat(illegalPolicies).isEmpty();

      index.meshTlsAuthentications().apply(MeshTlsAuthentication.create(
          meta("web-clients", null), ImmutableList.of("*"), ImmutableList.<ObjectReference>of()));
      assertThat(index.policy(WEB, 8080).authorizations())
          .containsKey(AuthorizationRef.ofAuthorizationPolicy("web-policy"));

      index.meshTlsAuthentications().delete(NAMESPACE, "web-clients");
      assertThat(illegalPolicies).isNotEmpty();
      assertThat(index.policy(WEB, 8080).authorizations()).isEmpty();
    } finally {
      policiesLogger.removeHandler(handler);
    }
  }

  @Test
  public void authorizationPolicy_namespaceTargetWithServiceAccounts() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));
    index.authorizationPolicies().apply(AuthorizationPolicy.create(
        meta("everything", null),
        ObjectReference.local(null, "Namespace", NAMESPACE),
        ImmutableList.of(ObjectReference.local(null, "ServiceAccount", "frontend"))));

    assertThat(index.policy(WEB, 8080).authorizations()).containsExactly(
        AuthorizationRef.ofAuthorizationPolicy("everything"),
        ClientAuthorization.create(NetworkMatch.all(),
            ClientAuthentication.authenticatedClients(ImmutableList.of(IdentityMatch.exact(
                "frontend.shop.serviceaccount.identity.linkerd.cluster.local")))));
  }

  @Test
  public void routes_inheritServerAuthorizationsUnlessTargeted() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", "all-unauthenticated", null));
    index.httpRoutes().apply(route("api", "/api", Instant.ofEpochSecond(100)));
    index.httpRoutes().apply(route("admin", "/admin", Instant.ofEpochSecond(200)));

    InboundServer policy = index.policy(WEB, 8080);
    assertThat(policy.httpRoutes()).hasSize(2);
    for (InboundRoute<HttpRouteMatch> route : policy.httpRoutes()) {
      assertThat(route.authorizations()).isEqualTo(policy.authorizations());
    }

    index.authorizationPolicies().apply(AuthorizationPolicy.create(
        meta("admin-only", null),
        ObjectReference.local("gateway.networking.k8s.io", "HTTPRoute", "admin"),
        ImmutableList.of(ObjectReference.local(null, "ServiceAccount", "operator"))));

    policy = index.policy(WEB, 8080);
    assertThat(policy.authorizations().keySet())
        .containsExactly(AuthorizationRef.ofDefault("kubelet"));
    InboundRoute<HttpRouteMatch> admin = routeNamed(policy, "admin");
    assertThat(admin.authorizations().keySet())
        .containsExactly(AuthorizationRef.ofAuthorizationPolicy("admin-only"));
    assertThat(routeNamed(policy, "api").authorizations()).isEqualTo(policy.authorizations());
  }

  @Test
  public void routes_withoutServerParentAreIgnored() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));
    index.httpRoutes().apply(route("api", "/api", null).toBuilder()
        .setParentRefs(ImmutableList.of(Route.ParentReference.service(NAMESPACE, "web", 80)))
        .build());

    assertThat(index.policy(WEB, 8080).httpRoutes().get(0).ref())
        .isEqualTo(RouteRef.ofDefault("default"));
    assertThat(index.sizes()).containsEntry("InboundRoute", 0);
  }

  @Test
  public void rateLimit_oldestTargetingServerWins() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.servers().apply(server("web-http", null, null));
    index.rateLimits().apply(rateLimit("second", 50, Instant.ofEpochSecond(200)));
    index.rateLimits().apply(rateLimit("first", 100, Instant.ofEpochSecond(100)));

    assertThat(index.policy(WEB, 8080).rateLimit().name()).isEqualTo("first");
    assertThat(index.policy(WEB, 9990).rateLimit()).isNull();

    index.rateLimits().delete(NAMESPACE, "first");

    assertThat(index.policy(WEB, 8080).rateLimit().totalRps()).isEqualTo(50);
  }

  @Test
  public void reset_matchesIncrementalUpdates() {
    index.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    index.pods().apply(pod("web-1", ImmutableMap.<String, String>of()));
    index.servers().apply(server("stale", null, null));
    KeyedCursor<Integer, InboundServer> stale = index.watch(WorkloadRef.pod(NAMESPACE, "web-1"),
        8080);
    stale.start(listener, MoreExecutors.directExecutor());

    Map<String, Set<String>> removedPods =
        ImmutableMap.<String, Set<String>>of(NAMESPACE, ImmutableSet.of("web-1"));
    index.pods().reset(ImmutableList.of(pod("web-0", ImmutableMap.<String, String>of())),
        removedPods);
    index.servers().reset(ImmutableList.of(server("web-http", null, null)),
        Collections.<String, Set<String>>singletonMap(NAMESPACE, ImmutableSet.of("stale")));

    InboundIndex expected = new InboundIndex(cluster);
    expected.nodes().apply(Node.create(ObjectMeta.of("", "node-1"),
        ImmutableList.of("10.0.1.0/24")));
    expected.pods().apply(pod("web-0", ImmutableMap.<String, String>of()));
    expected.servers().apply(server("web-http", null, null));

    assertThat(stale.isClosed()).isTrue();
    assertThat(index.policy(WorkloadRef.pod(NAMESPACE, "web-1"), 8080)).isNull();
    assertThat(index.policy(WEB, 8080)).isEqualTo(expected.policy(WEB, 8080));
    assertThat(index.policy(WEB, 9990)).isEqualTo(expected.policy(WEB, 9990));
    assertThat(index.sizes()).isEqualTo(expected.sizes());
  }

  private static InboundRoute<HttpRouteMatch> routeNamed(InboundServer policy, String name) {
    for (InboundRoute<HttpRouteMatch> route : policy.httpRoutes()) {
      if (route.ref().getKind() == RouteRef.Kind.RESOURCE
          && route.ref().resource().name().equals(name)) {
        return route;
      }
    }
    throw new AssertionError("no route " + name);
  }

  private static ObjectMeta meta(String name, @Nullable Instant created) {
    return ObjectMeta.builder()
        .setNamespace(NAMESPACE)
        .setName(name)
        .setCreationTimestamp(created)
        .build();
  }

  private static Pod pod(String name, Map<String, String> annotations) {
    return Pod.builder()
        .setMetadata(ObjectMeta.builder()
            .setNamespace(NAMESPACE)
            .setName(name)
            .setLabels(ImmutableMap.of("app", "web"))
            .setAnnotations(annotations)
            .build())
        .setNodeName("node-1")
        .setPorts(ImmutableList.of(
            ContainerPort.create("http", 8080), ContainerPort.create("admin", 9990)))
        .build();
  }

  private static Server server(
      String name, @Nullable String accessPolicy, @Nullable Instant created) {
    return Server.builder()
        .setMetadata(meta(name, created))
        .setSelector(LabelSelector.matchLabels(ImmutableMap.of("app", "web")))
        .setPort(PortReference.ofName("http"))
        .setProxyProtocol("HTTP/1")
        .setAccessPolicy(accessPolicy)
        .build();
  }

  private static Route route(String name, String prefix, @Nullable Instant created) {
    return Route.builder()
        .setMetadata(meta(name, created))
        .setKind(Route.Kind.HTTP)
        .setParentRefs(ImmutableList.of(Route.ParentReference.server("web-http")))
        .setRules(ImmutableList.of(Route.Rule.create(
            ImmutableList.of(Route.Match.of(HttpRouteMatch.pathPrefix(prefix))),
            ImmutableList.<RouteFilter>of(),
            ImmutableList.<Route.BackendReference>of(),
            null)))
        .build();
  }

  private static RateLimitPolicy rateLimit(String name, int rps, Instant created) {
    return RateLimitPolicy.create(meta(name, created),
        ObjectReference.local(POLICY_GROUP, "Server", "web-http"), rps, null,
        ImmutableList.<RateLimitPolicy.RpsOverride>of());
  }
}
