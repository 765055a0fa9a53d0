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

package io.meshpolicy.resource;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** A Kubernetes-style label selector. The empty selector matches everything. */
@AutoValue
public abstract class LabelSelector {

  public abstract ImmutableMap<String, String> matchLabels();

  public abstract ImmutableList<Requirement> matchExpressions();

  public static LabelSelector create(
      Map<String, String> matchLabels, List<Requirement> matchExpressions) {
    return new AutoValue_LabelSelector(
        ImmutableMap.copyOf(matchLabels), ImmutableList.copyOf(matchExpressions));
  }

  public static LabelSelector matchLabels(Map<String, String> labels) {
    return create(labels, ImmutableList.<Requirement>of());
  }

  public static LabelSelector everything() {
    return create(ImmutableMap.<String, String>of(), ImmutableList.<Requirement>of());
  }

  public final boolean matches(Map<String, String> labels) {
    for (Map.Entry<String, String> e : matchLabels().entrySet()) {
      if (!e.getValue().equals(labels.get(e.getKey()))) {
        return false;
      }
    }
    for (Requirement r : matchExpressions()) {
      if (!r.matches(labels)) {
        return false;
      }
    }
    return true;
  }

  @AutoValue
  public abstract static class Requirement {
    public enum Operator { IN, NOT_IN, EXISTS, DOES_NOT_EXIST }

    public abstract String key();

    public abstract Operator operator();

    public abstract ImmutableSet<String> values();

    public static Requirement create(String key, Operator operator, Collection<String> values) {
      return new AutoValue_LabelSelector_Requirement(key, operator, ImmutableSet.copyOf(values));
    }

    final boolean matches(Map<String, String> labels) {
      String value = labels.get(key());
      switch (operator()) {
        case IN:
          return value != null && values().contains(value);
        case NOT_IN:
          return value == null || !values().contains(value);
        case EXISTS:
          return value != null;
        case DOES_NOT_EXIST:
          return value == null;
        default:
          throw new AssertionError(operator());
      }
    }
  }
}
