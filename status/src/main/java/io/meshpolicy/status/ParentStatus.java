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
import io.meshpolicy.resource.Route;
import java.util.List;

/** The status this controller reports for one parent of a route. */
@AutoValue
public abstract class ParentStatus {
  public abstract Route.ParentReference parentRef();

  public abstract ImmutableList<Condition> conditions();

  public static ParentStatus create(Route.ParentReference parentRef, List<Condition> conditions) {
    return new AutoValue_ParentStatus(parentRef, ImmutableList.copyOf(conditions));
  }
}
