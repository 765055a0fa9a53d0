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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import io.meshpolicy.NetworkMatch;
import java.net.InetAddress;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Selects, among resources declaring networks, the one whose matching block is smallest. Ties
 * go to the older resource, then to the smaller namespace and name. Resources without a
 * creation timestamp are treated as oldest.
 */
public final class MostSpecificNetwork {
  private MostSpecificNetwork() {}

  /** A resource that declares networks. */
  public interface Candidate {
    String namespace();

    String name();

    @Nullable
    Instant creationTimestamp();

    List<NetworkMatch> networks();
  }

  /** Returns the best candidate containing {@code address}, or null if none does. */
  @Nullable
  public static <C extends Candidate> C select(InetAddress address, Iterable<C> candidates) {
    C best = null;
    int bestHostBits = Integer.MAX_VALUE;
    for (C candidate : candidates) {
      int hostBits = smallestMatch(address, candidate.networks());
      if (hostBits < 0) {
        continue;
      }
      if (best == null || hostBits < bestHostBits
          || (hostBits == bestHostBits && compareTieBreak(candidate, best) < 0)) {
        best = candidate;
        bestHostBits = hostBits;
      }
    }
    return best;
  }

  /** Host bits of the smallest network containing the address, or -1. */
  static int smallestMatch(InetAddress address, List<NetworkMatch> networks) {
    int smallest = -1;
    for (NetworkMatch network : networks) {
      if (network.matches(address)) {
        int hostBits = network.net().hostBits();
        if (smallest < 0 || hostBits < smallest) {
          smallest = hostBits;
        }
      }
    }
    return smallest;
  }

  static int compareTieBreak(Candidate a, Candidate b) {
    return ComparisonChain.start()
        .compare(a.creationTimestamp(), b.creationTimestamp(),
            Ordering.<Instant>natural().nullsFirst())
        .compare(a.namespace(), b.namespace())
        .compare(a.name(), b.name())
        .result();
  }
}
