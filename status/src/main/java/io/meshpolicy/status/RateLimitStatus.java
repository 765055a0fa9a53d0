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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.meshpolicy.resource.ObjectReference;
import java.util.List;

/** The status of a rate limit policy and the Server it targets. */
@AutoValue
public abstract class RateLimitStatus {
  public abstract ObjectReference targetRef();

  public abstract ImmutableList<Condition> conditions();

  public static RateLimitStatus create(ObjectReference targetRef, List<Condition> conditions) {
    return new AutoValue_RateLimitStatus(targetRef, ImmutableList.copyOf(conditions));
  }
}
