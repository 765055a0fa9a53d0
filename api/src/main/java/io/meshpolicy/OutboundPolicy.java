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

package io.meshpolicy;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import java.util.List;
import javax.annotation.Nullable;

/** The policy a proxy applies to traffic it sends to one Service or EgressNetwork port. */
@AutoValue
public abstract class OutboundPolicy {

  public abstract ParentRef parent();

  public abstract int port();

  /** Authority of the destination. Empty for egress networks. */
  public abstract String authority();

  public abstract boolean opaque();

  @Nullable
  public abstract FailureAccrual failureAccrual();

  /** Set for egress networks only. */
  @Nullable
  public abstract TrafficPolicy trafficPolicy();

  public abstract ImmutableList<OutboundRoute<HttpRouteMatch>> httpRoutes();

  public abstract ImmutableList<OutboundRoute<GrpcRouteMatch>> grpcRoutes();

  public abstract ImmutableList<OutboundRoute<Void>> tlsRoutes();

  public abstract ImmutableList<OutboundRoute<Void>> tcpRoutes();

  public static Builder builder() {
    return new AutoValue_OutboundPolicy.Builder()
        .setAuthority("")
        .setOpaque(false)
        .setHttpRoutes(ImmutableList.<OutboundRoute<HttpRouteMatch>>of())
        .setGrpcRoutes(ImmutableList.<OutboundRoute<GrpcRouteMatch>>of())
        .setTlsRoutes(ImmutableList.<OutboundRoute<Void>>of())
        .setTcpRoutes(ImmutableList.<OutboundRoute<Void>>of());
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setParent(ParentRef parent);

    public abstract Builder setPort(int port);

    public abstract Builder setAuthority(String authority);

    public abstract Builder setOpaque(boolean opaque);

    public abstract Builder setFailureAccrual(@Nullable FailureAccrual accrual);

    public abstract Builder setTrafficPolicy(@Nullable TrafficPolicy policy);

    public abstract Builder setHttpRoutes(List<OutboundRoute<HttpRouteMatch>> routes);

    public abstract Builder setGrpcRoutes(List<OutboundRoute<GrpcRouteMatch>> routes);

    public abstract Builder setTlsRoutes(List<OutboundRoute<Void>> routes);

    public abstract Builder setTcpRoutes(List<OutboundRoute<Void>> routes);

    public abstract OutboundPolicy build();
  }
}
