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

/** Identifies the Server resource, or the default policy, that describes an inbound port. */
@AutoOneOf(ServerRef.Kind.class)
public abstract class ServerRef {
  public enum Kind { DEFAULT_POLICY, SERVER }

  public abstract Kind getKind();

  /** Name of the default policy in effect, e.g. {@code all-unauthenticated}. */
  public abstract String defaultPolicy();

  public abstract String server();

  public static ServerRef ofDefault(String policyName) {
    return AutoOneOf_ServerRef.defaultPolicy(policyName);
  }

  public static ServerRef ofServer(String name) {
    return AutoOneOf_ServerRef.server(name);
  }
}
