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

@AutoValue
public abstract class Node implements Resource {

  @Override
  public abstract ObjectMeta metadata();

  /** The node's pod CIDRs, in their textual form. */
  public abstract ImmutableList<String> podCidrs();

  public static Node create(ObjectMeta metadata, List<String> podCidrs) {
    return new AutoValue_Node(metadata, ImmutableList.copyOf(podCidrs));
  }
}
