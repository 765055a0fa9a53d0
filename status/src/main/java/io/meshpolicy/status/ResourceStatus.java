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

package io.meshpolicy.status;

import com.google.auto.value.AutoOneOf;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The desired status of a route or a rate limit policy. */
@AutoOneOf(ResourceStatus.Kind.class)
public abstract class ResourceStatus {
  public enum Kind { ROUTE, RATE_LIMIT }

  public abstract Kind getKind();

  public abstract ImmutableList<ParentStatus> route();

  public abstract RateLimitStatus rateLimit();

  public static ResourceStatus ofRoute(List<ParentStatus> parents) {
    return AutoOneOf_ResourceStatus.route(ImmutableList.copyOf(parents));
  }

  public static ResourceStatus ofRateLimit(RateLimitStatus status) {
    return AutoOneOf_ResourceStatus.rateLimit(status);
  }
}
