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

package io.meshpolicy.index.outbound;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import com.google.common.net.InetAddresses;
import io.meshpolicy.FailureAccrual;
import io.meshpolicy.RetryPolicy;
import io.meshpolicy.RouteTimeouts;
import io.meshpolicy.index.Annotations;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.PortSets;
import io.meshpolicy.resource.Service;
import java.util.Map;
import javax.annotation.Nullable;

/** The outbound-relevant settings of a Service. */
@AutoValue
abstract class ServiceInfo {

  /** Normalized cluster IPs; headless services have none. */
  abstract ImmutableSet<String> clusterIps();

  abstract ImmutableSet<Integer> opaquePorts();

  @Nullable
  abstract FailureAccrual failureAccrual();

  @Nullable
  abstract RetryPolicy httpRetry();

  @Nullable
  abstract RetryPolicy grpcRetry();

  @Nullable
  abstract RouteTimeouts timeouts();

  static ServiceInfo parse(Service service, ClusterInfo cluster)
      throws InvalidResourceException {
    Map<String, String> annotations = service.metadata().annotations();
    ImmutableSet.Builder<String> ips = ImmutableSet.builder();
    for (String ip : service.clusterIps()) {
      if (ip.isEmpty() || "None".equals(ip)) {
        continue;
      }
      if (!InetAddresses.isInetAddress(ip)) {
        throw new InvalidResourceException("invalid cluster IP: " + ip);
      }
      ips.add(InetAddresses.toAddrString(InetAddresses.forString(ip)));
    }
    ImmutableSet<Integer> opaquePorts = cluster.defaultOpaquePorts();
    if (annotations.containsKey(Annotations.OPAQUE_PORTS)) {
      opaquePorts = PortSets.parsePortSet(annotations.get(Annotations.OPAQUE_PORTS));
    }
    return new AutoValue_ServiceInfo(ips.build(), opaquePorts,
        Annotations.failureAccrual(annotations),
        Annotations.retry(annotations, Annotations.RETRY_HTTP),
        Annotations.retry(annotations, Annotations.RETRY_GRPC),
        Annotations.timeouts(annotations));
  }
}
