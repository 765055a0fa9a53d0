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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.net.InetAddress;
import java.util.List;

/** A permitted source network, with optional carve-outs. */
@AutoValue
public abstract class NetworkMatch {

  public abstract Cidr net();

  public abstract ImmutableList<Cidr> except();

  public static NetworkMatch create(Cidr net) {
    return new AutoValue_NetworkMatch(net, ImmutableList.<Cidr>of());
  }

  /**
   * Creates a match excluding the given blocks.
   *
   * @throws IllegalArgumentException if an exception is not contained by {@code net}
   */
  public static NetworkMatch create(Cidr net, List<Cidr> except) {
    for (Cidr e : except) {
      checkArgument(net.contains(e), "%s is not contained in %s", e, net);
    }
    return new AutoValue_NetworkMatch(net, ImmutableList.copyOf(except));
  }

  public final boolean matches(InetAddress address) {
    if (!net().contains(address)) {
      return false;
    }
    for (Cidr e : except()) {
      if (e.contains(address)) {
        return false;
      }
    }
    return true;
  }

  /** Matches of both IPv4 and IPv6 everything. */
  public static ImmutableList<NetworkMatch> all() {
    return ImmutableList.of(create(Cidr.allIpv4()), create(Cidr.allIpv6()));
  }

  public static ImmutableList<NetworkMatch> of(List<Cidr> nets) {
    ImmutableList.Builder<NetworkMatch> builder = ImmutableList.builder();
    for (Cidr net : nets) {
      builder.add(create(net));
    }
    return builder.build();
  }
}
