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
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.testing.GrpcCleanupRule;
import io.meshpolicy.ResourceId;
import io.meshpolicy.index.ClusterIndex;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.proto.common.Metadata;
import io.meshpolicy.proto.inbound.InboundPoliciesGrpc;
import io.meshpolicy.proto.inbound.PortSpec;
import io.meshpolicy.proto.inbound.ProxyProtocol;
import io.meshpolicy.proto.inbound.Server;
import io.meshpolicy.resource.ContainerPort;
import io.meshpolicy.resource.LabelSelector;
import io.meshpolicy.resource.Node;
import io.meshpolicy.resource.ObjectMeta;
import io.meshpolicy.resource.Pod;
import io.meshpolicy.resource.PortReference;
import io.meshpolicy.resource.ResourceWatches;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InboundPolicyServiceTest {
  private static final String SERVER_NAME = "inbound-policy-service-test";

  @Rule
  public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();

  private final ClusterIndex index = new ClusterIndex(ClusterInfo.builder().build());
  private final ResourceWatches watches = index.watches();
  private ManagedChannel channel;
  private InboundPoliciesGrpc.InboundPoliciesBlockingStub stub;

  @Before
  public void setUp() throws Exception {
    grpcCleanup.register(InProcessServerBuilder.forName(SERVER_NAME)
        .addService(new InboundPolicyService(index, MoreExecutors.directExecutor()))
        .directExecutor()
        .build()
        .start());
    channel = grpcCleanup.register(
        InProcessChannelBuilder.forName(SERVER_NAME).directExecutor().build());
    stub = InboundPoliciesGrpc.newBlockingStub(channel).withDeadlineAfter(10, TimeUnit.SECONDS);
  }

  @After
  public void tearDown() {
    channel.shutdownNow();
  }

  @Test
  public void firstResponseIsTheCurrentPolicy() {
    indexWebPod();

    Iterator<Server> responses = stub.getInboundPolicy(portSpec("shop:web-0", 8080));

    Server server = responses.next();
    assertThat(server.getMetadata())
        .isEqualTo(Metadata.newBuilder().setDefault("all-unauthenticated").build());
    assertThat(server.getProtocol().getKind()).isEqualTo(ProxyProtocol.Kind.DETECT);
    assertThat(server.getProtocol().getDetectTimeout().getSeconds()).isEqualTo(10);
    assertThat(server.getAuthorizationsCount()).isGreaterThan(0);
  }

  @Test
  public void streamsUpdates() {
    indexWebPod();
    Iterator<Server> responses = stub.getInboundPolicy(
        portSpec("{\"ns\":\"shop\",\"pod\":\"web-0\"}", 8080));
    assertThat(responses.next().getMetadata().getDefault()).isEqualTo("all-unauthenticated");

    watches.servers().apply(io.meshpolicy.resource.Server.builder()
        .setMetadata(ObjectMeta.of("shop", "web-http"))
        .setSelector(LabelSelector.matchLabels(ImmutableMap.of("app", "web")))
        .setPort(PortReference.ofNumber(8080))
        .setProxyProtocol("HTTP/2")
        .setAccessPolicy("all-unauthenticated")
        .build());

    Server server = responses.next();
    assertThat(server.getMetadata().getResource().getGroup()).isEqualTo(ResourceId.POLICY_GROUP);
    assertThat(server.getMetadata().getResource().getKind()).isEqualTo("Server");
    assertThat(server.getMetadata().getResource().getName()).isEqualTo("web-http");
    assertThat(server.getProtocol().getKind()).isEqualTo(ProxyProtocol.Kind.HTTP2);
  }

  @Test
  public void deletedWorkloadEndsStream() {
    indexWebPod();
    Iterator<Server> responses = stub.getInboundPolicy(portSpec("shop:web-0", 8080));
    responses.next();

    watches.pods().delete("shop", "web-0");

    assertThat(statusOf(responses).getCode()).isEqualTo(Status.Code.NOT_FOUND);
  }

  @Test
  public void unknownWorkload() {
    Status status = statusOf(stub.getInboundPolicy(portSpec("shop:web-0", 8080)));

    assertThat(status.getCode()).isEqualTo(Status.Code.NOT_FOUND);
    assertThat(status.getDescription()).contains("shop/web-0:8080");
  }

  @Test
  public void malformedWorkload() {
    Status status = statusOf(stub.getInboundPolicy(portSpec("web-0", 8080)));

    assertThat(status.getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
  }

  @Test
  public void invalidPort() {
    indexWebPod();

    Status zero = statusOf(stub.getInboundPolicy(portSpec("shop:web-0", 0)));
    Status tooLarge = statusOf(stub.getInboundPolicy(portSpec("shop:web-0", 65536)));

    assertThat(zero.getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
    assertThat(zero.getDescription()).isEqualTo("Invalid port: 0");
    assertThat(tooLarge.getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
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

  private static PortSpec portSpec(String workload, int port) {
    return PortSpec.newBuilder().setWorkload(workload).setPort(port).build();
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
