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

package io.meshpolicy.index;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import io.meshpolicy.AuthorizationRef;
import io.meshpolicy.ClientAuthentication;
import io.meshpolicy.ClientAuthorization;
import io.meshpolicy.NetworkMatch;
import org.junit.Test;
import org.junit.function.ThrowingRunnable;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DefaultPolicyTest {
  private final ClusterInfo cluster = ClusterInfo.builder().build();

  @Test
  public void parse_roundTripsNames() throws Exception {
    for (String name : new String[] {
        "all-authenticated", "all-unauthenticated", "cluster-authenticated",
        "cluster-unauthenticated", "deny", "audit"}) {
      assertThat(DefaultPolicy.parse(name).toString()).isEqualTo(name);
    }
  }

  @Test
  public void parse_rejectsUnknownName() {
    assertThrows(InvalidResourceException.class, new ThrowingRunnable() {
      @Override
      public void run() throws Throwable {
        DefaultPolicy.parse("allow-everything");
      }
    });
  }

  @Test
  public void requireIdentity_upgradesAllowOnly() {
    assertThat(DefaultPolicy.allow(false, true).requireIdentity())
        .isEqualTo(DefaultPolicy.allow(true, true));
    assertThat(DefaultPolicy.allow(false, false).requireIdentity())
        .isEqualTo(DefaultPolicy.allow(true, false));
    assertThat(DefaultPolicy.deny().requireIdentity()).isEqualTo(DefaultPolicy.deny());
    assertThat(DefaultPolicy.audit().requireIdentity()).isEqualTo(DefaultPolicy.audit());
  }

  @Test
  public void authorizations_denyHasNone() {
    assertThat(DefaultPolicy.deny().authorizations(cluster)).isEmpty();
    assertThat(DefaultPolicy.deny().isDeny()).isTrue();
  }

  @Test
  public void authorizations_clusterAuthenticated() {
    ImmutableMap<AuthorizationRef, ClientAuthorization> authorizations =
        DefaultPolicy.allow(true, true).authorizations(cluster);
    assertThat(authorizations.keySet())
        .containsExactly(AuthorizationRef.ofDefault("cluster-authenticated"));
    ClientAuthorization authorization = Iterables.getOnlyElement(authorizations.values());
    assertThat(authorization.networks()).isEqualTo(cluster.clusterNetworkMatches());
    assertThat(authorization.authentication()).isEqualTo(ClientAuthentication.anyIdentity());
  }

  @Test
  public void authorizations_auditAllowsEveryone() {
    ClientAuthorization authorization =
        Iterables.getOnlyElement(DefaultPolicy.audit().authorizations(cluster).values());
    assertThat(authorization.networks()).isEqualTo(NetworkMatch.all());
    assertThat(authorization.authentication().getKind())
        .isEqualTo(ClientAuthentication.Kind.UNAUTHENTICATED);
  }
}
