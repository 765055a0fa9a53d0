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

import com.google.common.collect.ImmutableList;
import io.meshpolicy.Cidr;
import io.meshpolicy.NetworkMatch;
import io.meshpolicy.resource.NetworkSpec;
import java.util.ArrayList;
import java.util.List;

/** Conversion of network specs found in resources. */
public final class Networks {
  private Networks() {}

  public static Cidr parseCidr(String text) throws InvalidResourceException {
    try {
      return Cidr.parse(text);
    } catch (IllegalArgumentException e) {
      throw new InvalidResourceException("invalid network: " + text, e);
    }
  }

  public static NetworkMatch parse(NetworkSpec spec) throws InvalidResourceException {
    Cidr net = parseCidr(spec.cidr());
    List<Cidr> except = new ArrayList<>();
    for (String e : spec.except()) {
      Cidr cidr = parseCidr(e);
      if (!net.contains(cidr)) {
        throw new InvalidResourceException(e + " is not contained in " + net);
      }
      except.add(cidr);
    }
    return NetworkMatch.create(net, except);
  }

  /** Parses every spec; an empty list yields {@code defaults}. */
  public static ImmutableList<NetworkMatch> parseAll(
      List<NetworkSpec> specs, ImmutableList<NetworkMatch> defaults)
      throws InvalidResourceException {
    if (specs.isEmpty()) {
      return defaults;
    }
    ImmutableList.Builder<NetworkMatch> networks = ImmutableList.builder();
    for (NetworkSpec spec : specs) {
      networks.add(parse(spec));
    }
    return networks.build();
  }

  /** Every IPv4 and IPv6 address outside the given cluster networks. */
  public static ImmutableList<NetworkMatch> outsideCluster(List<Cidr> clusterNetworks) {
    List<Cidr> v4 = new ArrayList<>();
    List<Cidr> v6 = new ArrayList<>();
    for (Cidr net : clusterNetworks) {
      (net.isIpv4() ? v4 : v6).add(net);
    }
    return ImmutableList.of(
        NetworkMatch.create(Cidr.allIpv4(), v4), NetworkMatch.create(Cidr.allIpv6(), v6));
  }
}
