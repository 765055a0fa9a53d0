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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;

/**
 * Orders routes by creation timestamp, oldest first, with untimestamped routes after all
 * timestamped ones; equal or absent timestamps fall back to namespace then name. Synthesized
 * routes sort after route resources.
 */
public final class RouteOrdering {
  private RouteOrdering() {}

  private static final Comparator<PolicyRoute> TIMESTAMP_THEN_NAME = new Comparator<PolicyRoute>() {
    @Override
    public int compare(PolicyRoute a, PolicyRoute b) {
      Instant ta = a.creationTimestamp();
      Instant tb = b.creationTimestamp();
      if (ta != null && tb != null) {
        int c = ta.compareTo(tb);
        if (c != 0) {
          return c;
        }
      } else if (ta != null) {
        return -1;
      } else if (tb != null) {
        return 1;
      }
      return compareRefs(a.ref(), b.ref());
    }
  };

  @SuppressWarnings("unchecked")
  public static <R extends PolicyRoute> Comparator<R> timestampThenName() {
    return (Comparator<R>) TIMESTAMP_THEN_NAME;
  }

  public static <R extends PolicyRoute> ImmutableList<R> sorted(Collection<R> routes) {
    return Ordering.from(RouteOrdering.<R>timestampThenName()).immutableSortedCopy(routes);
  }

  static int compareRefs(RouteRef a, RouteRef b) {
    if (a.getKind() != b.getKind()) {
      return a.getKind() == RouteRef.Kind.RESOURCE ? -1 : 1;
    }
    switch (a.getKind()) {
      case RESOURCE:
        return a.resource().compareTo(b.resource());
      case DEFAULT_NAME:
        return a.defaultName().compareTo(b.defaultName());
      default:
        throw new AssertionError(a.getKind());
    }
  }
}
