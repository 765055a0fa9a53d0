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

import com.google.auto.value.AutoValue;

/** The outbound destination a policy describes. */
@AutoValue
public abstract class ParentRef {
  public enum Kind { SERVICE, EGRESS_NETWORK }

  public abstract Kind kind();

  public abstract String namespace();

  public abstract String name();

  public static ParentRef ofService(String namespace, String name) {
    return new AutoValue_ParentRef(Kind.SERVICE, namespace, name);
  }

  public static ParentRef ofEgressNetwork(String namespace, String name) {
    return new AutoValue_ParentRef(Kind.EGRESS_NETWORK, namespace, name);
  }

  @Override
  public final String toString() {
    return kind() + ":" + namespace() + "/" + name();
  }
}
