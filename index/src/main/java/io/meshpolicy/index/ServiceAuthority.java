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

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import java.util.List;
import javax.annotation.Nullable;

/** A parsed {@code <service>.<namespace>.svc.<cluster-domain>[:port]} authority. */
@AutoValue
public abstract class ServiceAuthority {
  static final int DEFAULT_PORT = 80;

  public abstract String namespace();

  public abstract String name();

  public abstract int port();

  /**
   * Parses an authority. Returns null when the host is not a service name in this cluster.
   *
   * @throws InvalidResourceException if the port is malformed
   */
  @Nullable
  public static ServiceAuthority parse(String authority, String clusterDomain)
      throws InvalidResourceException {
    String host = authority;
    int port = DEFAULT_PORT;
    int colon = authority.lastIndexOf(':');
    if (colon >= 0) {
      host = authority.substring(0, colon);
      port = PortSets.parsePort(authority.substring(colon + 1));
    }
    if (host.endsWith(".")) {
      host = host.substring(0, host.length() - 1);
    }
    String suffix = ".svc." + clusterDomain;
    if (!host.endsWith(suffix)) {
      return null;
    }
    List<String> labels =
        Splitter.on('.').splitToList(host.substring(0, host.length() - suffix.length()));
    if (labels.size() != 2 || labels.get(0).isEmpty() || labels.get(1).isEmpty()) {
      return null;
    }
    return new AutoValue_ServiceAuthority(labels.get(1), labels.get(0), port);
  }
}
