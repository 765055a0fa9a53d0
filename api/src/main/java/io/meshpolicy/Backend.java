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

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A weighted destination of an outbound route rule. Backends naming a resource that does not
 * exist are kept with {@code exists() == false}; backends that cannot be interpreted at all are
 * {@link Kind#INVALID}.
 */
@AutoOneOf(Backend.Kind.class)
public abstract class Backend {
  public enum Kind { SERVICE, EGRESS_NETWORK, INVALID }

  public abstract Kind getKind();

  public abstract WeightedService service();

  public abstract WeightedEgressNetwork egressNetwork();

  public abstract InvalidBackend invalid();

  public static Backend ofService(WeightedService service) {
    return AutoOneOf_Backend.service(service);
  }

  public static Backend ofEgressNetwork(WeightedEgressNetwork network) {
    return AutoOneOf_Backend.egressNetwork(network);
  }

  public static Backend ofInvalid(long weight, String message) {
    return AutoOneOf_Backend.invalid(InvalidBackend.create(weight, message));
  }

  public final long weight() {
    switch (getKind()) {
      case SERVICE:
        return service().weight();
      case EGRESS_NETWORK:
        return egressNetwork().weight();
      case INVALID:
        return invalid().weight();
      default:
        throw new AssertionError(getKind());
    }
  }

  @AutoValue
  public abstract static class WeightedService {
    public abstract long weight();

    public abstract String namespace();

    public abstract String name();

    public abstract int port();

    /** {@code <name>.<namespace>.svc.<cluster-domain>:<port>}. */
    public abstract String authority();

    public abstract boolean exists();

    public abstract ImmutableList<RouteFilter> filters();

    public static WeightedService create(long weight, String namespace, String name, int port,
        String authority, boolean exists, List<RouteFilter> filters) {
      return new AutoValue_Backend_WeightedService(weight, namespace, name, port, authority,
          exists, ImmutableList.copyOf(filters));
    }
  }

  /** Forwards to the original destination address inside an egress network. */
  @AutoValue
  public abstract static class WeightedEgressNetwork {
    public abstract long weight();

    public abstract String namespace();

    public abstract String name();

    @Nullable
    public abstract Integer port();

    public abstract boolean exists();

    public abstract ImmutableList<RouteFilter> filters();

    public static WeightedEgressNetwork create(long weight, String namespace, String name,
        @Nullable Integer port, boolean exists, List<RouteFilter> filters) {
      return new AutoValue_Backend_WeightedEgressNetwork(
          weight, namespace, name, port, exists, ImmutableList.copyOf(filters));
    }
  }

  @AutoValue
  public abstract static class InvalidBackend {
    public abstract long weight();

    public abstract String message();

    static InvalidBackend create(long weight, String message) {
      return new AutoValue_Backend_InvalidBackend(weight, message);
    }
  }
}
