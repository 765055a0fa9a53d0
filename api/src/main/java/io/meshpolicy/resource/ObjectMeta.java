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
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.Map;
import javax.annotation.Nullable;

/** Identity and metadata of a resource. Cluster-scoped resources have an empty namespace. */
@AutoValue
public abstract class ObjectMeta {

  public abstract String namespace();

  public abstract String name();

  public abstract ImmutableMap<String, String> labels();

  public abstract ImmutableMap<String, String> annotations();

  @Nullable
  public abstract Instant creationTimestamp();

  public static Builder builder() {
    return new AutoValue_ObjectMeta.Builder()
        .setNamespace("")
        .setLabels(ImmutableMap.<String, String>of())
        .setAnnotations(ImmutableMap.<String, String>of());
  }

  public static ObjectMeta of(String namespace, String name) {
    return builder().setNamespace(namespace).setName(name).build();
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setNamespace(String namespace);

    public abstract Builder setName(String name);

    public abstract Builder setLabels(Map<String, String> labels);

    public abstract Builder setAnnotations(Map<String, String> annotations);

    public abstract Builder setCreationTimestamp(@Nullable Instant timestamp);

    public abstract ObjectMeta build();
  }
}
