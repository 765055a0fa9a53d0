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
import javax.annotation.Nullable;

/** Selects a port on a set of workloads and declares how it is served. */
@AutoValue
public abstract class Server implements Resource {
  public enum SelectorKind { POD, EXTERNAL_WORKLOAD }

  @Override
  public abstract ObjectMeta metadata();

  public abstract SelectorKind selectorKind();

  public abstract LabelSelector selector();

  public abstract PortReference port();

  /** One of {@code HTTP/1}, {@code HTTP/2}, {@code gRPC}, {@code opaque}, {@code TLS}. */
  @Nullable
  public abstract String proxyProtocol();

  /** Default policy name applied when nothing authorizes a client. */
  @Nullable
  public abstract String accessPolicy();

  public static Builder builder() {
    return new AutoValue_Server.Builder().setSelectorKind(SelectorKind.POD);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMetadata(ObjectMeta metadata);

    public abstract Builder setSelectorKind(SelectorKind kind);

    public abstract Builder setSelector(LabelSelector selector);

    public abstract Builder setPort(PortReference port);

    public abstract Builder setProxyProtocol(@Nullable String protocol);

    public abstract Builder setAccessPolicy(@Nullable String accessPolicy);

    public abstract Server build();
  }
}
