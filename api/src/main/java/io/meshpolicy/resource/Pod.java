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
import java.util.List;
import javax.annotation.Nullable;

/** A pod. Only fields that affect policy are carried. */
@AutoValue
public abstract class Pod implements Resource {

  @Override
  public abstract ObjectMeta metadata();

  /** Unset until the pod is scheduled. */
  @Nullable
  public abstract String nodeName();

  public abstract ImmutableList<ContainerPort> ports();

  public abstract ImmutableList<HttpProbe> probes();

  public static Builder builder() {
    return new AutoValue_Pod.Builder()
        .setPorts(ImmutableList.<ContainerPort>of())
        .setProbes(ImmutableList.<HttpProbe>of());
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMetadata(ObjectMeta metadata);

    public abstract Builder setNodeName(@Nullable String nodeName);

    public abstract Builder setPorts(List<ContainerPort> ports);

    public abstract Builder setProbes(List<HttpProbe> probes);

    public abstract Pod build();
  }

  /** An HTTP liveness or readiness probe. */
  @AutoValue
  public abstract static class HttpProbe {
    public abstract PortReference port();

    public abstract String path();

    public static HttpProbe create(PortReference port, String path) {
      return new AutoValue_Pod_HttpProbe(port, path);
    }
  }
}
