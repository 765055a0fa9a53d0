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
import static org.junit.Assert.assertThrows;

import com.google.common.net.InetAddresses;
import java.net.InetAddress;
import java.util.Collections;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CidrTest {

  @Test
  public void parse_masksHostBits() {
    Cidr cidr = Cidr.parse("10.1.2.3/8");
    assertThat(cidr).isEqualTo(Cidr.parse("10.0.0.0/8"));
    assertThat(cidr.toString()).isEqualTo("10.0.0.0/8");
    assertThat(cidr.hostBits()).isEqualTo(24);
  }

  @Test
  public void parse_bareAddressIsHostRoute() {
    assertThat(Cidr.parse("192.168.1.1").prefixLength()).isEqualTo(32);
    assertThat(Cidr.parse("fd00::1").prefixLength()).isEqualTo(128);
  }

  @Test
  public void parse_rejectsMalformed() {
    assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0/33"));
    assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0/x"));
    assertThrows(IllegalArgumentException.class, () -> Cidr.parse("not-an-ip/8"));
  }

  @Test
  public void contains_ipv4() {
    Cidr cidr = Cidr.parse("10.10.16.0/20");
    assertThat(cidr.contains(InetAddresses.forString("10.10.16.0"))).isTrue();
    assertThat(cidr.contains(InetAddresses.forString("10.10.31.255"))).isTrue();
    assertThat(cidr.contains(InetAddresses.forString("10.10.32.0"))).isFalse();
    assertThat(cidr.contains(InetAddresses.forString("::1"))).isFalse();
    assertThat(cidr.contains((InetAddress) null)).isFalse();
  }

  @Test
  public void contains_ipv6() {
    Cidr cidr = Cidr.parse("2012:fe:d808::/36");
    assertThat(cidr.contains(InetAddresses.forString("2012:fe:d000::"))).isTrue();
    assertThat(cidr.contains(InetAddresses.forString("2013:fe:d000::"))).isFalse();
    assertThat(cidr.contains(InetAddresses.forString("10.0.0.1"))).isFalse();
  }

  @Test
  public void contains_block() {
    Cidr outer = Cidr.parse("10.0.0.0/8");
    assertThat(outer.contains(Cidr.parse("10.1.0.0/16"))).isTrue();
    assertThat(outer.contains(outer)).isTrue();
    assertThat(Cidr.parse("10.1.0.0/16").contains(outer)).isFalse();
  }

  @Test
  public void firstHost() {
    assertThat(Cidr.parse("10.244.3.0/24").firstHost())
        .isEqualTo(InetAddresses.forString("10.244.3.1"));
    assertThat(Cidr.parse("10.244.3.7/32").firstHost())
        .isEqualTo(InetAddresses.forString("10.244.3.7"));
  }

  @Test
  public void networkMatch_except() {
    NetworkMatch match = NetworkMatch.create(
        Cidr.parse("10.0.0.0/8"), Collections.singletonList(Cidr.parse("10.1.0.0/16")));
    assertThat(match.matches(InetAddresses.forString("10.2.0.1"))).isTrue();
    assertThat(match.matches(InetAddresses.forString("10.1.0.1"))).isFalse();
    assertThrows(IllegalArgumentException.class, () -> NetworkMatch.create(
        Cidr.parse("10.0.0.0/8"),
        Collections.singletonList(Cidr.parse("192.168.0.0/16"))));
  }
}
