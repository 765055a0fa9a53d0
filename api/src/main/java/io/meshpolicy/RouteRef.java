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

/** Identifies a route: either one synthesized by the controller, or a route resource. */
@AutoOneOf(RouteRef.Kind.class)
public abstract class RouteRef {
  public enum Kind { DEFAULT_NAME, RESOURCE }

  public abstract Kind getKind();

  public abstract String defaultName();

  public abstract ResourceId resource();

  public static RouteRef ofDefault(String name) {
    return AutoOneOf_RouteRef.defaultName(name);
  }

  public static RouteRef ofResource(ResourceId id) {
    return AutoOneOf_RouteRef.resource(id);
  }
}
