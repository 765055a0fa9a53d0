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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.protobuf.util.Durations;
import io.meshpolicy.Cidr;
import io.meshpolicy.IdentityMatch;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.RetryPolicy;
import io.meshpolicy.RouteFilter;
import io.meshpolicy.RouteTimeouts;
import io.meshpolicy.proto.common.Filter;
import io.meshpolicy.proto.common.HeaderModifier;
import io.meshpolicy.proto.common.Network;
import io.meshpolicy.proto.common.RequestRedirect;
import io.meshpolicy.proto.common.Retry;
import io.meshpolicy.proto.common.Timeouts;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CommonProtosTest {

  @Test
  public void network_withExceptions() {
    NetworkMatch match = NetworkMatch.create(Cidr.parse("10.0.0.0/8"),
        ImmutableList.of(Cidr.parse("10.1.0.0/16")));

    assertThat(CommonProtos.network(match)).isEqualTo(Network.newBuilder()
        .setNet("10.0.0.0/8")
        .addExcept("10.1.0.0/16")
        .build());
  }

  @Test
  public void identity_suffix() {
    io.meshpolicy.proto.common.IdentityMatch proto =
        CommonProtos.identity(IdentityMatch.parse("*.shop.serviceaccount.identity.linkerd"));

    assertThat(proto.getSuffix().getLabelsList())
        .containsExactly("shop", "serviceaccount", "identity", "linkerd").inOrder();
    assertThat(CommonProtos.identity(IdentityMatch.parse("*")).getSuffix().getLabelsCount())
        .isEqualTo(0);
    assertThat(CommonProtos.identity(IdentityMatch.exact("web.shop")).getExact())
        .isEqualTo("web.shop");
  }

  @Test
  public void filter_redirectWithPrefixRewrite() {
    RouteFilter filter = RouteFilter.ofRequestRedirect(RouteFilter.RequestRedirect.builder()
        .setHost("new.example.com")
        .setPathModifierType(RouteFilter.RequestRedirect.PathModifierType.PREFIX)
        .setPath("/v2")
        .setStatusCode(301)
        .build());

    assertThat(CommonProtos.filter(filter)).isEqualTo(Filter.newBuilder()
        .setRequestRedirect(RequestRedirect.newBuilder()
            .setHost("new.example.com")
            .setPrefix("/v2")
            .setStatus(301))
        .build());
  }

  @Test
  public void filter_responseHeaderModifier() {
    RouteFilter filter = RouteFilter.ofResponseHeaderModifier(RouteFilter.HeaderModifier.create(
        ImmutableMap.of("x-added", "1"), ImmutableMap.<String, String>of(),
        ImmutableList.of("server")));

    assertThat(CommonProtos.filter(filter)).isEqualTo(Filter.newBuilder()
        .setResponseHeaderModifier(HeaderModifier.newBuilder()
            .putAdd("x-added", "1")
            .addRemove("server"))
        .build());
  }

  @Test
  public void timeouts_emptyAreOmitted() {
    assertThat(CommonProtos.timeouts(null)).isNull();
    assertThat(CommonProtos.timeouts(RouteTimeouts.create(null, null, null))).isNull();
    assertThat(CommonProtos.timeouts(RouteTimeouts.create(Duration.ofMillis(1500), null, null)))
        .isEqualTo(Timeouts.newBuilder().setRequest(Durations.fromMillis(1500)).build());
  }

  @Test
  public void retry() {
    assertThat(CommonProtos.retry(null)).isNull();
    assertThat(CommonProtos.retry(RetryPolicy.create(3, ImmutableSet.of("5xx"),
        Duration.ofSeconds(2)))).isEqualTo(Retry.newBuilder()
            .setLimit(3)
            .addConditions("5xx")
            .setTimeout(Durations.fromSeconds(2))
            .build());
  }
}
