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

/** Authorizes clients of the Servers it selects by name or by label. */
@AutoValue
public abstract class ServerAuthorization implements Resource {

  @Override
  public abstract ObjectMeta metadata();

  /** Set when the servers are selected by name. */
  @Nullable
  public abstract String serverName();

  /** Set when the servers are selected by label. */
  @Nullable
  public abstract LabelSelector serverSelector();

  public abstract ImmutableList<NetworkSpec> networks();

  public abstract boolean unauthenticated();

  @Nullable
  public abstract MeshTls meshTls();

  public static Builder builder() {
    return new AutoValue_ServerAuthorization.Builder()
        .setNetworks(ImmutableList.<NetworkSpec>of())
        .setUnauthenticated(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMetadata(ObjectMeta metadata);

    public abstract Builder setServerName(@Nullable String name);

    public abstract Builder setServerSelector(@Nullable LabelSelector selector);

    public abstract Builder setNetworks(List<NetworkSpec> networks);

    public abstract Builder setUnauthenticated(boolean unauthenticated);

    public abstract Builder setMeshTls(@Nullable MeshTls meshTls);

    public abstract ServerAuthorization build();
  }

  @AutoValue
  public abstract static class MeshTls {
    public abstract boolean unauthenticatedTls();

    public abstract ImmutableList<String> identities();

    public abstract ImmutableList<ObjectReference> serviceAccounts();

    public static MeshTls create(boolean unauthenticatedTls, List<String> identities,
        List<ObjectReference> serviceAccounts) {
      return new AutoValue_ServerAuthorization_MeshTls(unauthenticatedTls,
          ImmutableList.copyOf(identities), ImmutableList.copyOf(serviceAccounts));
    }
  }
}
