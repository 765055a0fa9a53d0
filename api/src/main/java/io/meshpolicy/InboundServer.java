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
import com.google.common.collect.ImmutableMap;
import io.meshpolicy.RouteMatchers.GrpcRouteMatch;
import io.meshpolicy.RouteMatchers.HttpRouteMatch;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The policy a proxy enforces for one inbound workload port. */
@AutoValue
public abstract class InboundServer {

  public abstract ServerRef reference();

  public abstract ProxyProtocol protocol();

  public abstract ImmutableMap<AuthorizationRef, ClientAuthorization> authorizations();

  public abstract ImmutableList<InboundRoute<HttpRouteMatch>> httpRoutes();

  public abstract ImmutableList<InboundRoute<GrpcRouteMatch>> grpcRoutes();

  @Nullable
  public abstract RateLimit rateLimit();

  public static Builder builder() {
    return new AutoValue_InboundServer.Builder()
        .setAuthorizations(ImmutableMap.<AuthorizationRef, ClientAuthorization>of())
        .setHttpRoutes(ImmutableList.<InboundRoute<HttpRouteMatch>>of())
        .setGrpcRoutes(ImmutableList.<InboundRoute<GrpcRouteMatch>>of());
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setReference(ServerRef reference);

    public abstract Builder setProtocol(ProxyProtocol protocol);

    public abstract Builder setAuthorizations(
        Map<AuthorizationRef, ClientAuthorization> authorizations);

    public abstract Builder setHttpRoutes(List<InboundRoute<HttpRouteMatch>> routes);

    public abstract Builder setGrpcRoutes(List<InboundRoute<GrpcRouteMatch>> routes);

    public abstract Builder setRateLimit(@Nullable RateLimit rateLimit);

    public abstract InboundServer build();
  }
}
