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
import io.meshpolicy.RouteMatchers.HostMatch;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A route attached to an inbound server, with the authorizations that apply to requests it
 * matches.
 *
 * @param <M> the request matcher type, HTTP or gRPC
 */
@AutoValue
public abstract class InboundRoute<M> implements PolicyRoute {

  @Override
  public abstract RouteRef ref();

  public abstract ImmutableList<HostMatch> hostnames();

  public abstract ImmutableList<Rule<M>> rules();

  public abstract ImmutableMap<AuthorizationRef, ClientAuthorization> authorizations();

  @Override
  @Nullable
  public abstract Instant creationTimestamp();

  public static <M> InboundRoute<M> create(RouteRef ref, List<HostMatch> hostnames,
      List<Rule<M>> rules, Map<AuthorizationRef, ClientAuthorization> authorizations,
      @Nullable Instant creationTimestamp) {
    return new AutoValue_InboundRoute<M>(ref, ImmutableList.copyOf(hostnames),
        ImmutableList.copyOf(rules), ImmutableMap.copyOf(authorizations), creationTimestamp);
  }

  public final InboundRoute<M> withAuthorizations(
      Map<AuthorizationRef, ClientAuthorization> authorizations) {
    return create(ref(), hostnames(), rules(), authorizations, creationTimestamp());
  }

  @AutoValue
  public abstract static class Rule<M> {
    public abstract ImmutableList<M> matches();

    public abstract ImmutableList<RouteFilter> filters();

    public static <M> Rule<M> create(List<M> matches, List<RouteFilter> filters) {
      return new AutoValue_InboundRoute_Rule<M>(
          ImmutableList.copyOf(matches), ImmutableList.copyOf(filters));
    }
  }
}
