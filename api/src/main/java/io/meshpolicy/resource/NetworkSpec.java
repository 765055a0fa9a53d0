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

/** A network as written in a resource: a CIDR and carve-outs, not yet validated. */
@AutoValue
public abstract class NetworkSpec {

  public abstract String cidr();

  public abstract ImmutableList<String> except();

  public static NetworkSpec create(String cidr, List<String> except) {
    return new AutoValue_NetworkSpec(cidr, ImmutableList.copyOf(except));
  }

  public static NetworkSpec of(String cidr) {
    return create(cidr, ImmutableList.<String>of());
  }
}
