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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Function;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.meshpolicy.InboundServer;
import io.meshpolicy.index.ClusterIndex;
import io.meshpolicy.index.WorkloadRef;
import io.meshpolicy.proto.inbound.InboundPoliciesGrpc;
import io.meshpolicy.proto.inbound.PortSpec;
import io.meshpolicy.proto.inbound.Server;
import java.util.concurrent.Executor;

/** Serves the inbound policy of workload ports from a {@link ClusterIndex}. */
final class InboundPolicyService extends InboundPoliciesGrpc.InboundPoliciesImplBase {
  private final ClusterIndex index;
  private final Executor executor;

  InboundPolicyService(ClusterIndex index, Executor executor) {
    this.index = checkNotNull(index, "index");
    this.executor = checkNotNull(executor, "executor");
  }

  @Override
  public void getInboundPolicy(PortSpec request, StreamObserver<Server> responseObserver) {
    final WorkloadRef workload;
    try {
      workload = WorkloadIds.parse(request.getWorkload());
    } catch (IllegalArgumentException e) {
      responseObserver.onError(
          Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
      return;
    }
    int port = request.getPort();
    if (port < 1 || port > 65535) {
      responseObserver.onError(
          Status.INVALID_ARGUMENT.withDescription("Invalid port: " + port).asRuntimeException());
      return;
    }
    PolicyStream.serve(index.watchInbound(workload, port),
        (ServerCallStreamObserver<Server>) responseObserver,
        new Function<InboundServer, Server>() {
          @Override
          public Server apply(InboundServer server) {
            return InboundProtos.toProto(server, workload.namespace());
          }
        },
        workload.namespace() + "/" + workload.name() + ":" + port, executor);
  }
}
