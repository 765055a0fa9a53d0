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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IdentityMatchTest {

  @Test
  public void exact() {
    IdentityMatch match = IdentityMatch.parse("web.ns.serviceaccount.identity.linkerd.local");
    assertThat(match.getKind()).isEqualTo(IdentityMatch.Kind.EXACT);
    assertThat(match.matches("web.ns.serviceaccount.identity.linkerd.local")).isTrue();
    assertThat(match.matches("api.ns.serviceaccount.identity.linkerd.local")).isFalse();
  }

  @Test
  public void wildcardMatchesAnything() {
    IdentityMatch match = IdentityMatch.parse("*");
    assertThat(match.getKind()).isEqualTo(IdentityMatch.Kind.SUFFIX);
    assertThat(match.matches("anything")).isTrue();
    assertThat(match.toString()).isEqualTo("*");
  }

  @Test
  public void suffixIsLabelAligned() {
    IdentityMatch match = IdentityMatch.parse("*.identity.linkerd.local");
    assertThat(match.matches("web.ns.serviceaccount.identity.linkerd.local")).isTrue();
    assertThat(match.matches("web.fooidentity.linkerd.local")).isFalse();
    assertThat(match.matches("identity.linkerd.local")).isFalse();
    assertThat(match.toString()).isEqualTo("*.identity.linkerd.local");
  }
}
