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

import io.meshpolicy.Backend;
import io.meshpolicy.FailureAccrual;
import io.meshpolicy.OutboundRoute;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.TrafficPolicy;
import io.meshpolicy.proto.common.Retry;
import io.meshpolicy.proto.common.Timeouts;
import io.meshpolicy.proto.outbound.GrpcRoute;
import io.meshpolicy.proto.outbound.HttpRoute;
import io.meshpolicy.proto.outbound.OpaqueRoute;
import io.meshpolicy.proto.outbound.OutboundPolicy;
import java.util.ArrayList;
import java.util.List;

/** Converts outbound policies to their wire form. */
final class OutboundProtos {
  private OutboundProtos() {}

  static OutboundPolicy toProto(io.meshpolicy.OutboundPolicy policy) {
    OutboundPolicy.Builder proto = OutboundPolicy.newBuilder()
        .setMetadata(CommonProtos.metadata(policy.parent(), policy.port()))
        .setAuthority(policy.authority())
        .setOpaque(policy.opaque());
    if (policy.failureAccrual() != null) {
      proto.setFailureAccrual(failureAccrual(policy.failureAccrual()));
    }
    if (policy.trafficPolicy() != null) {
      proto.setTrafficPolicy(policy.trafficPolicy() == TrafficPolicy.ALLOW
          ? OutboundPolicy.TrafficPolicy.ALLOW
          : OutboundPolicy.TrafficPolicy.DENY);
    }
    for (OutboundRoute<HttpRouteMatch> route : policy.httpRoutes()) {
      proto.addHttpRoutes(httpRoute(route));
    }
    for (OutboundRoute<GrpcRouteMatch> route : policy.grpcRoutes()) {
      proto.addGrpcRoutes(grpcRoute(route));
    }
    for (OutboundRoute<Void> route : policy.tlsRoutes()) {
      proto.addTlsRoutes(opaqueRoute(route));
    }
    for (OutboundRoute<Void> route : policy.tcpRoutes()) {
      proto.addTcpRoutes(opaqueRoute(route));
    }
    return proto.build();
  }

  private static io.meshpolicy.proto.outbound.FailureAccrual failureAccrual(
      FailureAccrual accrual) {
    return io.meshpolicy.proto.outbound.FailureAccrual.newBuilder()
        .setMaxFailures(accrual.maxFailures())
        .setMinPenalty(CommonProtos.duration(accrual.minPenalty()))
        .setMaxPenalty(CommonProtos.duration(accrual.maxPenalty()))
        .setJitterRatio(accrual.jitterRatio())
        .build();
  }

  private static HttpRoute httpRoute(OutboundRoute<HttpRouteMatch> route) {
    HttpRoute.Builder proto = HttpRoute.newBuilder()
        .setMetadata(CommonProtos.metadata(route.ref()))
        .addAllHosts(CommonProtos.hosts(route.hostnames()));
    for (OutboundRoute.Rule<HttpRouteMatch> rule : route.rules()) {
      HttpRoute.Rule.Builder protoRule = HttpRoute.Rule.newBuilder()
          .addAllFilters(CommonProtos.filters(rule.filters()))
          .addAllBackends(backends(rule.backends()));
      for (HttpRouteMatch match : rule.matches()) {
        protoRule.addMatches(CommonProtos.httpMatch(match));
      }
      Timeouts timeouts = CommonProtos.timeouts(rule.timeouts());
      if (timeouts != null) {
        protoRule.setTimeouts(timeouts);
      }
      Retry retry = CommonProtos.retry(rule.retry());
      if (retry != null) {
        protoRule.setRetry(retry);
      }
      proto.addRules(protoRule);
    }
    return proto.build();
  }

  private static GrpcRoute grpcRoute(OutboundRoute<GrpcRouteMatch> route) {
    GrpcRoute.Builder proto = GrpcRoute.newBuilder()
        .setMetadata(CommonProtos.metadata(route.ref()))
        .addAllHosts(CommonProtos.hosts(route.hostnames()));
    for (OutboundRoute.Rule<GrpcRouteMatch> rule : route.rules()) {
      GrpcRoute.Rule.Builder protoRule = GrpcRoute.Rule.newBuilder()
          .addAllFilters(CommonProtos.filters(rule.filters()))
          .addAllBackends(backends(rule.backends()));
      for (GrpcRouteMatch match : rule.matches()) {
        protoRule.addMatches(CommonProtos.grpcMatch(match));
      }
      Timeouts timeouts = CommonProtos.timeouts(rule.timeouts());
      if (timeouts != null) {
        protoRule.setTimeouts(timeouts);
      }
      Retry retry = CommonProtos.retry(rule.retry());
      if (retry != null) {
        protoRule.setRetry(retry);
      }
      proto.addRules(protoRule);
    }
    return proto.build();
  }

  private static OpaqueRoute opaqueRoute(OutboundRoute<Void> route) {
    OpaqueRoute.Builder proto = OpaqueRoute.newBuilder()
        .setMetadata(CommonProtos.metadata(route.ref()));
    for (OutboundRoute.Rule<Void> rule : route.rules()) {
      proto.addRules(OpaqueRoute.Rule.newBuilder()
          .addAllFilters(CommonProtos.filters(rule.filters()))
          .addAllBackends(backends(rule.backends())));
    }
    return proto.build();
  }

  private static List<io.meshpolicy.proto.outbound.Backend> backends(List<Backend> backends) {
    List<io.meshpolicy.proto.outbound.Backend> protos = new ArrayList<>(backends.size());
    for (Backend backend : backends) {
      protos.add(backend(backend));
    }
    return protos;
  }

  static io.meshpolicy.proto.outbound.Backend backend(Backend backend) {
    io.meshpolicy.proto.outbound.Backend.Builder proto =
        io.meshpolicy.proto.outbound.Backend.newBuilder().setWeight(backend.weight());
    switch (backend.getKind()) {
      case SERVICE:
        Backend.WeightedService service = backend.service();
        return proto
            .addAllFilters(CommonProtos.filters(service.filters()))
            .setService(io.meshpolicy.proto.outbound.Backend.Service.newBuilder()
                .setNamespace(service.namespace())
                .setName(service.name())
                .setPort(service.port())
                .setAuthority(service.authority())
                .setExists(service.exists()))
            .build();
      case EGRESS_NETWORK:
        Backend.WeightedEgressNetwork network = backend.egressNetwork();
        io.meshpolicy.proto.outbound.Backend.EgressNetwork.Builder egress =
            io.meshpolicy.proto.outbound.Backend.EgressNetwork.newBuilder()
                .setNamespace(network.namespace())
                .setName(network.name())
                .setExists(network.exists());
        if (network.port() != null) {
          egress.setPort(network.port());
        }
        return proto
            .addAllFilters(CommonProtos.filters(network.filters()))
            .setEgressNetwork(egress)
            .build();
      case INVALID:
        return proto
            .setInvalid(io.meshpolicy.proto.outbound.Backend.Invalid.newBuilder()
                .setMessage(backend.invalid().message()))
            .build();
      default:
        throw new AssertionError(backend.getKind());
    }
  }
}
