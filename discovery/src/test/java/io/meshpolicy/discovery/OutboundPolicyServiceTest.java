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

package io.meshpolicy.discovery;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.testing.GrpcCleanupRule;
import io.meshpolicy.ResourceId;
import io.meshpolicy.TrafficPolicy;
import io.meshpolicy.index.ClusterIndex;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.proto.common.Resource;
import io.meshpolicy.proto.outbound.Backend;
import io.meshpolicy.proto.outbound.OutboundPoliciesGrpc;
import io.meshpolicy.proto.outbound.OutboundPolicy;
import io.meshpolicy.proto.outbound.SocketAddress;
import io.meshpolicy.proto.outbound.TrafficSpec;
import io.meshpolicy.resource.EgressNetwork;
import io.meshpolicy.resource.NetworkSpec;
import io.meshpolicy.resource.ObjectMeta;
import io.meshpolicy.resource.ResourceWatches;
import io.meshpolicy.resource.Service;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OutboundPolicyServiceTest {
  private static final String SERVER_NAME = "outbound-policy-service-test";
  private static final String CLIENT = "client:curl-0";

  @Rule
  public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();

  private final ClusterIndex index = new ClusterIndex(ClusterInfo.builder().build());
  private final ResourceWatches watches = index.watches();
  private ManagedChannel channel;
  private OutboundPoliciesGrpc.OutboundPoliciesBlockingStub stub;

  @Before
  public void setUp() throws Exception {
    grpcCleanup.register(InProcessServerBuilder.forName(SERVER_NAME)
        .addService(new OutboundPolicyService(index, MoreExecutors.directExecutor()))
        .directExecutor()
        .build()
        .start());
    channel = grpcCleanup.register(
        InProcessChannelBuilder.forName(SERVER_NAME).directExecutor().build());
    stub = OutboundPoliciesGrpc.newBlockingStub(channel).withDeadlineAfter(10, TimeUnit.SECONDS);
    watches.services().apply(Service.create(ObjectMeta.of("shop", "web"),
        ImmutableList.of("10.96.0.10")));
  }

  @After
  public void tearDown() {
    channel.shutdownNow();
  }

  @Test
  public void byAuthority() {
    OutboundPolicy policy =
        stub.getOutboundPolicy(byAuthority("web.shop.svc.cluster.local:8080")).next();

    assertThat(policy.getMetadata().getResource()).isEqualTo(Resource.newBuilder()
        .setGroup(ResourceId.CORE_GROUP)
        .setKind("Service")
        .setNamespace("shop")
        .setName("web")
        .setPort(8080)
        .build());
    assertThat(policy.getAuthority()).isEqualTo("web.shop.svc.cluster.local:8080");
    assertThat(policy.getOpaque()).isFalse();
    assertThat(policy.getHttpRoutesCount()).isEqualTo(1);
    Backend backend = policy.getHttpRoutes(0).getRules(0).getBackends(0);
    assertThat(backend.getService().getName()).isEqualTo("web");
    assertThat(backend.getService().getExists()).isTrue();
  }

  @Test
  public void byAuthority_defaultPort() {
    OutboundPolicy policy =
        stub.getOutboundPolicy(byAuthority("web.shop.svc.cluster.local")).next();

    assertThat(policy.getMetadata().getResource().getPort()).isEqualTo(80);
  }

  @Test
  public void byAddress() {
    OutboundPolicy policy = stub.getOutboundPolicy(byAddress("10.96.0.10", 80)).next();

    assertThat(policy.getMetadata().getResource().getName()).isEqualTo("web");
    assertThat(policy.getAuthority()).isEqualTo("web.shop.svc.cluster.local:80");
  }

  @Test
  public void byAddress_egressNetwork() {
    watches.egressNetworks().apply(EgressNetwork.create(
        ObjectMeta.of("linkerd-egress", "internet"), TrafficPolicy.ALLOW,
        ImmutableList.<NetworkSpec>of()));

    OutboundPolicy policy = stub.getOutboundPolicy(byAddress("203.0.113.7", 443)).next();

    assertThat(policy.getMetadata().getResource().getKind()).isEqualTo("EgressNetwork");
    assertThat(policy.getMetadata().getResource().getName()).isEqualTo("internet");
    assertThat(policy.getTrafficPolicy()).isEqualTo(OutboundPolicy.TrafficPolicy.ALLOW);
  }

  @Test
  public void deletedServiceEndsStream() {
    Iterator<OutboundPolicy> responses = stub.getOutboundPolicy(byAddress("10.96.0.10", 80));
    responses.next();

    watches.services().delete("shop", "web");

    assertThat(statusOf(responses).getCode()).isEqualTo(Status.Code.NOT_FOUND);
  }

  @Test
  public void unknownTargets() {
    assertThat(statusOf(stub.getOutboundPolicy(byAddress("10.96.0.99", 80))).getCode())
        .isEqualTo(Status.Code.NOT_FOUND);
    assertThat(statusOf(stub.getOutboundPolicy(
        byAuthority("api.shop.svc.cluster.local:80"))).getCode())
        .isEqualTo(Status.Code.NOT_FOUND);
    assertThat(statusOf(stub.getOutboundPolicy(byAuthority("example.com:80"))).getCode())
        .isEqualTo(Status.Code.NOT_FOUND);
  }

  @Test
  public void invalidRequests() {
    TrafficSpec[] invalid = {
        TrafficSpec.newBuilder().setSourceWorkload(CLIENT).build(),
        byAuthority("web.shop.svc.cluster.local:http"),
        byAddress("10.96.0.10", 0),
        byAddress("10.96.0.10", 65536),
        byAddress("", 80),
        byAddress("not-an-ip", 80),
        byAddress("10.96.0.10", 80).toBuilder().setSourceWorkload("curl-0").build(),
    };
    for (TrafficSpec request : invalid) {
      assertThat(statusOf(stub.getOutboundPolicy(request)).getCode())
          .isEqualTo(Status.Code.INVALID_ARGUMENT);
    }
  }

  private static TrafficSpec byAuthority(String authority) {
    return TrafficSpec.newBuilder().setSourceWorkload(CLIENT).setAuthority(authority).build();
  }

  private static TrafficSpec byAddress(String ip, int port) {
    return TrafficSpec.newBuilder()
        .setSourceWorkload(CLIENT)
        .setAddr(SocketAddress.newBuilder().setIp(ip).setPort(port))
        .build();
  }

  private static Status statusOf(Iterator<?> responses) {
    try {
      responses.hasNext();
      fail("Expected the stream to fail");
      return null;
    } catch (StatusRuntimeException e) {
      return e.getStatus();
    }
  }
}
