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

import io.meshpolicy.AuthorizationRef;
import io.meshpolicy.ClientAuthentication;
import io.meshpolicy.ClientAuthorization;
import io.meshpolicy.IdentityMatch;
import io.meshpolicy.InboundRoute;
import io.meshpolicy.InboundServer;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.ResourceId;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import io.meshpolicy.ServerRef;
import io.meshpolicy.proto.inbound.Authn;
import io.meshpolicy.proto.inbound.Authz;
import io.meshpolicy.proto.inbound.GrpcRoute;
import io.meshpolicy.proto.inbound.HttpRoute;
import io.meshpolicy.proto.inbound.ProxyProtocol;
import io.meshpolicy.proto.inbound.RateLimit;
import io.meshpolicy.proto.inbound.Server;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Converts inbound policies to their wire form. */
final class InboundProtos {
  private InboundProtos() {}

  /** Converts the policy of a port on a workload in {@code namespace}. */
  static Server toProto(InboundServer server, String namespace) {
    Server.Builder proto = Server.newBuilder()
        .setMetadata(metadata(server.reference(), namespace))
        .setProtocol(protocol(server.protocol()))
        .addAllAuthorizations(authorizations(server.authorizations(), namespace));
    for (InboundRoute<HttpRouteMatch> route : server.httpRoutes()) {
      proto.addHttpRoutes(httpRoute(route, namespace));
    }
    for (InboundRoute<GrpcRouteMatch> route : server.grpcRoutes()) {
      proto.addGrpcRoutes(grpcRoute(route, namespace));
    }
    if (server.rateLimit() != null) {
      proto.setRateLimit(rateLimit(server.rateLimit(), namespace));
    }
    return proto.build();
  }

  private static io.meshpolicy.proto.common.Metadata metadata(
      ServerRef reference, String namespace) {
    switch (reference.getKind()) {
      case DEFAULT_POLICY:
        return CommonProtos.defaultMetadata(reference.defaultPolicy());
      case SERVER:
        return CommonProtos.resourceMetadata(
            ResourceId.POLICY_GROUP, "Server", namespace, reference.server());
      default:
        throw new AssertionError(reference.getKind());
    }
  }

  static ProxyProtocol protocol(io.meshpolicy.ProxyProtocol protocol) {
    ProxyProtocol.Builder proto = ProxyProtocol.newBuilder();
    switch (protocol.kind()) {
      case DETECT:
        return proto.setKind(ProxyProtocol.Kind.DETECT)
            .setDetectTimeout(CommonProtos.duration(protocol.detectTimeout()))
            .build();
      case HTTP1:
        return proto.setKind(ProxyProtocol.Kind.HTTP1).build();
      case HTTP2:
        return proto.setKind(ProxyProtocol.Kind.HTTP2).build();
      case GRPC:
        return proto.setKind(ProxyProtocol.Kind.GRPC).build();
      case OPAQUE:
        return proto.setKind(ProxyProtocol.Kind.OPAQUE).build();
      case TLS:
        return proto.setKind(ProxyProtocol.Kind.TLS).build();
      default:
        throw new AssertionError(protocol.kind());
    }
  }

  private static List<Authz> authorizations(
      Map<AuthorizationRef, ClientAuthorization> authorizations, String namespace) {
    List<Authz> protos = new ArrayList<>(authorizations.size());
    for (Map.Entry<AuthorizationRef, ClientAuthorization> entry : authorizations.entrySet()) {
      protos.add(authz(entry.getKey(), entry.getValue(), namespace));
    }
    return protos;
  }

  private static Authz authz(
      AuthorizationRef ref, ClientAuthorization authorization, String namespace) {
    Authz.Builder proto = Authz.newBuilder()
        .setMetadata(CommonProtos.metadata(ref, namespace))
        .setAuthentication(authn(authorization.authentication()));
    for (NetworkMatch network : authorization.networks()) {
      proto.addNetworks(CommonProtos.network(network));
    }
    return proto.build();
  }

  private static Authn authn(ClientAuthentication authentication) {
    switch (authentication.getKind()) {
      case UNAUTHENTICATED:
        return Authn.newBuilder()
            .setUnauthenticated(Authn.Unauthenticated.getDefaultInstance())
            .build();
      case TLS_UNAUTHENTICATED:
        return Authn.newBuilder()
            .setTlsUnauthenticated(Authn.TlsUnauthenticated.getDefaultInstance())
            .build();
      case TLS_AUTHENTICATED:
        Authn.TlsAuthenticated.Builder tls = Authn.TlsAuthenticated.newBuilder();
        for (IdentityMatch identity : authentication.tlsAuthenticated()) {
          tls.addIdentities(CommonProtos.identity(identity));
        }
        return Authn.newBuilder().setTlsAuthenticated(tls).build();
      default:
        throw new AssertionError(authentication.getKind());
    }
  }

  private static HttpRoute httpRoute(InboundRoute<HttpRouteMatch> route, String namespace) {
    HttpRoute.Builder proto = HttpRoute.newBuilder()
        .setMetadata(CommonProtos.metadata(route.ref()))
        .addAllHosts(CommonProtos.hosts(route.hostnames()))
        .addAllAuthorizations(authorizations(route.authorizations(), namespace));
    for (InboundRoute.Rule<HttpRouteMatch> rule : route.rules()) {
      HttpRoute.Rule.Builder protoRule = HttpRoute.Rule.newBuilder()
          .addAllFilters(CommonProtos.filters(rule.filters()));
      for (HttpRouteMatch match : rule.matches()) {
        protoRule.addMatches(CommonProtos.httpMatch(match));
      }
      proto.addRules(protoRule);
    }
    return proto.build();
  }

  private static GrpcRoute grpcRoute(InboundRoute<GrpcRouteMatch> route, String namespace) {
    GrpcRoute.Builder proto = GrpcRoute.newBuilder()
        .setMetadata(CommonProtos.metadata(route.ref()))
        .addAllHosts(CommonProtos.hosts(route.hostnames()))
        .addAllAuthorizations(authorizations(route.authorizations(), namespace));
    for (InboundRoute.Rule<GrpcRouteMatch> rule : route.rules()) {
      GrpcRoute.Rule.Builder protoRule = GrpcRoute.Rule.newBuilder()
          .addAllFilters(CommonProtos.filters(rule.filters()));
      for (GrpcRouteMatch match : rule.matches()) {
        protoRule.addMatches(CommonProtos.grpcMatch(match));
      }
      proto.addRules(protoRule);
    }
    return proto.build();
  }

  private static RateLimit rateLimit(io.meshpolicy.RateLimit limit, String namespace) {
    RateLimit.Builder proto = RateLimit.newBuilder()
        .setMetadata(CommonProtos.resourceMetadata(
            ResourceId.POLICY_GROUP, "HTTPLocalRateLimitPolicy", namespace, limit.name()));
    if (limit.totalRps() != null) {
      proto.setTotalRequestsPerSecond(limit.totalRps());
    }
    if (limit.identityRps() != null) {
      proto.setIdentityRequestsPerSecond(limit.identityRps());
    }
    for (io.meshpolicy.RateLimit.OverrideLimit override : limit.overrides()) {
      proto.addOverrides(RateLimit.IdentityOverride.newBuilder()
          .setRequestsPerSecond(override.requestsPerSecond())
          .addAllClientIdentities(override.clientIdentities()));
    }
    return proto.build();
  }
}
