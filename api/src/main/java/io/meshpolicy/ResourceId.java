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
import com.google.common.collect.ComparisonChain;

/** Group, kind, namespace and name of a cluster resource. Orders by namespace then name. */
@AutoValue
public abstract class ResourceId implements Comparable<ResourceId> {
  public static final String POLICY_GROUP = "policy.linkerd.io";
  public static final String GATEWAY_GROUP = "gateway.networking.k8s.io";
  public static final String CORE_GROUP = "core";

  public abstract String group();

  public abstract String kind();

  public abstract String namespace();

  public abstract String name();

  public static ResourceId create(String group, String kind, String namespace, String name) {
    return new AutoValue_ResourceId(group, kind, namespace, name);
  }

  @Override
  public int compareTo(ResourceId other) {
    return ComparisonChain.start()
        .compare(namespace(), other.namespace())
        .compare(name(), other.name())
        .compare(kind(), other.kind())
        .compare(group(), other.group())
        .result();
  }

  @Override
  public final String toString() {
    return kind() + "." + group() + ":" + namespace() + "/" + name();
  }
}
