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
import com.google.common.net.InetAddresses;
import com.google.common.util.concurrent.ListenableFuture;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.meshpolicy.index.ClusterIndex;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.ServiceAuthority;
import io.meshpolicy.index.outbound.OutboundKey;
import io.meshpolicy.index.watch.KeyedCursor;
import io.meshpolicy.proto.outbound.OutboundPoliciesGrpc;
import io.meshpolicy.proto.outbound.OutboundPolicy;
import io.meshpolicy.proto.outbound.SocketAddress;
import io.meshpolicy.proto.outbound.TrafficSpec;
import java.net.InetAddress;
import java.util.concurrent.Executor;

/** Serves the outbound policy of Services and egress destinations from a {@link ClusterIndex}. */
final class OutboundPolicyService extends OutboundPoliciesGrpc.OutboundPoliciesImplBase {
  private static final Function<io.meshpolicy.OutboundPolicy, OutboundPolicy> TO_PROTO =
      new Function<io.meshpolicy.OutboundPolicy, OutboundPolicy>() {
        @Override
        public OutboundPolicy apply(io.meshpolicy.OutboundPolicy policy) {
          return OutboundProtos.toProto(policy);
        }
      };

  private final ClusterIndex index;
  private final Executor executor;

  OutboundPolicyService(ClusterIndex index, Executor executor) {
    this.index = checkNotNull(index, "index");
    this.executor = checkNotNull(executor, "executor");
  }

  @Override
  public void getOutboundPolicy(
      TrafficSpec request, StreamObserver<OutboundPolicy> responseObserver) {
    String sourceNamespace;
    try {
      sourceNamespace = WorkloadIds.parse(request.getSourceWorkload()).namespace();
    } catch (IllegalArgumentException e) {
      responseObserver.onError(invalidArgument(e.getMessage()));
      return;
    }
    ListenableFuture<KeyedCursor<OutboundKey, io.meshpolicy.OutboundPolicy>> watch;
    String target;
    switch (request.getTargetCase()) {
      case AUTHORITY:
        String clusterDomain = index.cluster().clusterDomain();
        ServiceAuthority authority;
        try {
          authority = ServiceAuthority.parse(request.getAuthority(), clusterDomain);
        } catch (InvalidResourceException e) {
          responseObserver.onError(invalidArgument("invalid authority: " + e.getMessage()));
          return;
        }
        if (authority == null) {
          responseObserver.onError(Status.NOT_FOUND
              .withDescription(
                  "authority must be of the form <name>.<namespace>.svc." + clusterDomain)
              .asRuntimeException());
          return;
        }
        watch = index.watchOutbound(authority, sourceNamespace);
        target = request.getAuthority();
        break;
      case ADDR:
        SocketAddress addr = request.getAddr();
        if (addr.getPort() < 1 || addr.getPort() > 65535) {
          responseObserver.onError(invalidArgument("port outside valid range"));
          return;
        }
        if (addr.getIp().isEmpty()) {
          responseObserver.onError(invalidArgument("traffic target must have an IP"));
          return;
        }
        InetAddress address;
        try {
          address = InetAddresses.forString(addr.getIp());
        } catch (IllegalArgumentException e) {
          responseObserver.onError(
              invalidArgument("failed to parse target addr: " + addr.getIp()));
          return;
        }
        watch = index.watchOutbound(address, addr.getPort(), sourceNamespace);
        target = InetAddresses.toUriString(address) + ":" + addr.getPort();
        break;
      default:
        responseObserver.onError(invalidArgument("target is required"));
        return;
    }
    PolicyStream.serve(watch, (ServerCallStreamObserver<OutboundPolicy>) responseObserver,
        TO_PROTO, target, executor);
  }

  private static RuntimeException invalidArgument(String description) {
    return Status.INVALID_ARGUMENT.withDescription(description).asRuntimeException();
  }
}
