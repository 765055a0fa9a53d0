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
import io.meshpolicy.RouteMatchers.HostMatch;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A route attached to a Service or EgressNetwork.
 *
 * @param <M> the request matcher type; {@link Void} for TLS and TCP routes, which have none
 */
@AutoValue
public abstract class OutboundRoute<M> implements PolicyRoute {

  @Override
  public abstract RouteRef ref();

  /** Authority matches for HTTP and gRPC, SNI matches for TLS. */
  public abstract ImmutableList<HostMatch> hostnames();

  public abstract ImmutableList<Rule<M>> rules();

  @Override
  @Nullable
  public abstract Instant creationTimestamp();

  public static <M> OutboundRoute<M> create(RouteRef ref, List<HostMatch> hostnames,
      List<Rule<M>> rules, @Nullable Instant creationTimestamp) {
    return new AutoValue_OutboundRoute<M>(
        ref, ImmutableList.copyOf(hostnames), ImmutableList.copyOf(rules), creationTimestamp);
  }

  @AutoValue
  public abstract static class Rule<M> {
    public abstract ImmutableList<M> matches();

    public abstract ImmutableList<RouteFilter> filters();

    public abstract ImmutableList<Backend> backends();

    @Nullable
    public abstract RouteTimeouts timeouts();

    @Nullable
    public abstract RetryPolicy retry();

    public static <M> Rule<M> create(List<M> matches, List<RouteFilter> filters,
        List<Backend> backends, @Nullable RouteTimeouts timeouts, @Nullable RetryPolicy retry) {
      return new AutoValue_OutboundRoute_Rule<M>(ImmutableList.copyOf(matches),
          ImmutableList.copyOf(filters), ImmutableList.copyOf(backends), timeouts, retry);
    }
  }
}
