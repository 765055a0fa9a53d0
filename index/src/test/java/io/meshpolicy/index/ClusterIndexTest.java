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

package io.meshpolicy.index;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.net.InetAddresses;
import io.meshpolicy.InboundServer;
import io.meshpolicy.OutboundPolicy;
import io.meshpolicy.ParentRef;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.RouteRef;
import io.meshpolicy.ServerRef;
import io.meshpolicy.index.IndexMetrics.Operation;
import io.meshpolicy.index.outbound.OutboundKey;
import io.meshpolicy.index.watch.KeyedCursor;
import io.meshpolicy.resource.ContainerPort;
import io.meshpolicy.resource.LabelSelector;
import io.meshpolicy.resource.Node;
import io.meshpolicy.resource.ObjectMeta;
import io.meshpolicy.resource.Pod;
import io.meshpolicy.resource.PortReference;
import io.meshpolicy.resource.ResourceWatches;
import io.meshpolicy.resource.Route;
import io.meshpolicy.resource.Server;
import io.meshpolicy.resource.Service;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ClusterIndexTest {
  private final ClusterIndex index = new ClusterIndex(ClusterInfo.builder().build());
  private final ResourceWatches watches = index.watches();

  @Test
  public void watchInbound_unknownWorkloadYieldsNull() throws Exception {
    assertThat(index.watchInbound(WorkloadRef.pod("shop", "web-0"), 8080).get()).isNull();
  }

  @Test
  public void watchInbound_publishesCurrentPolicy() throws Exception {
    indexWebPod();

    KeyedCursor<Integer, InboundServer> cursor =
        index.watchInbound(WorkloadRef.pod("shop", "web-0"), 8080).get();

    assertThat(cursor.key()).isEqualTo(8080);
    assertThat(cursor.poll().reference()).isEqualTo(ServerRef.ofDefault("all-unauthenticated"));
  }

  @Test
  public void watchOutbound_byAuthorityAndAddress() throws Exception {
    watches.services().apply(Service.create(ObjectMeta.of("shop", "web"),
        ImmutableList.of("10.96.0.10")));

    KeyedCursor<OutboundKey, OutboundPolicy> byAuthority = index.watchOutbound(
        ServiceAuthority.parse("web.shop.svc.cluster.local:80", "cluster.local"), "client")
        .get();
    KeyedCursor<OutboundKey, OutboundPolicy> byAddress = index.watchOutbound(
        InetAddresses.forString("10.96.0.10"), 80, "client").get();

    assertThat(byAuthority.key()).isEqualTo(byAddress.key());
    assertThat(byAuthority.poll().parent()).isEqualTo(ParentRef.ofService("shop", "web"));
    assertThat(index.watchOutbound(InetAddresses.forString("10.96.0.99"), 80, "client").get())
        .isNull();
  }

  @Test
  public void httpRoutesReachBothDirections() throws Exception {
    indexWebPod();
    watches.servers().apply(Server.builder()
        .setMetadata(ObjectMeta.of("shop", "web-http"))
        .setSelector(LabelSelector.matchLabels(ImmutableMap.of("app", "web")))
        .setPort(PortReference.ofNumber(8080))
        .setAccessPolicy("all-unauthenticated")
        .build());
    watches.services().apply(Service.create(ObjectMeta.of("shop", "web"),
        ImmutableList.of("10.96.0.10")));
    watches.httpRoutes().apply(Route.builder()
        .setMetadata(ObjectMeta.of("shop", "web-route"))
        .setKind(Route.Kind.HTTP)
        .setParentRefs(ImmutableList.of(
            Route.ParentReference.server("web-http"),
            Route.ParentReference.service(null, "web", null)))
        .setRules(ImmutableList.of(Route.Rule.create(
            ImmutableList.of(Route.Match.of(HttpRouteMatch.pathPrefix("/api"))),
            ImmutableList.<RouteFilter>of(), ImmutableList.<Route.BackendReference>of(), null)))
        .build());

    InboundServer inbound = index.watchInbound(WorkloadRef.pod("shop", "web-0"), 8080).get()
        .poll();
    OutboundPolicy outbound = index.watchOutbound(
        InetAddresses.forString("10.96.0.10"), 80, "client").get().poll();

    assertThat(inbound.httpRoutes().get(0).ref().getKind()).isEqualTo(RouteRef.Kind.RESOURCE);
    assertThat(outbound.httpRoutes().get(0).ref().resource().name()).isEqualTo("web-route");
  }

  @Test
  public void metricsCountEventsAndSizes() {
    indexWebPod();
    watches.pods().delete("shop", "web-0");
    watches.services().reset(ImmutableList.<Service>of(), ImmutableMap.<String, Set<String>>of());

    IndexMetrics metrics = index.metrics();
    assertThat(metrics.count("", "Node", Operation.APPLY)).isEqualTo(1);
    assertThat(metrics.count("shop", "Pod", Operation.APPLY)).isEqualTo(1);
    assertThat(metrics.count("shop", "Pod", Operation.DELETE)).isEqualTo(1);
    assertThat(metrics.count(IndexMetrics.ALL_NAMESPACES, "Service", Operation.RESET))
        .isEqualTo(1);
    assertThat(metrics.count("shop", "Server", Operation.APPLY)).isEqualTo(0);
    assertThat(metrics.sizes()).containsEntry("Pod", 0);
    assertThat(metrics.sizes()).containsEntry("Node", 1);
    assertThat(metrics.sizes()).containsEntry("Service", 0);
  }

  private void indexWebPod() {
    watches.nodes().apply(Node.create(ObjectMeta.of("", "node-1"),
        ImmutableList.of("10.0.1.0/24")));
    watches.pods().apply(Pod.builder()
        .setMetadata(ObjectMeta.builder()
            .setNamespace("shop")
            .setName("web-0")
            .setLabels(ImmutableMap.of("app", "web"))
            .build())
        .setNodeName("node-1")
        .setPorts(ImmutableList.of(ContainerPort.create("http", 8080)))
        .build());
  }
}
