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
import io.meshpolicy.ParentRef;

/** Identifies one outbound policy: a destination port as seen from a source namespace. */
@AutoValue
public abstract class OutboundKey {

  public abstract ParentRef parent();

  public abstract int port();

  public abstract String sourceNamespace();

  public static OutboundKey create(ParentRef parent, int port, String sourceNamespace) {
    return new AutoValue_OutboundKey(parent, port, sourceNamespace);
  }
}
