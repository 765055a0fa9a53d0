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

package io.meshpolicy.index;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class NamespacedName {

  public abstract String namespace();

  public abstract String name();

  public static NamespacedName of(String namespace, String name) {
    return new AutoValue_NamespacedName(namespace, name);
  }

  @Override
  public final String toString() {
    return namespace() + "/" + name();
  }
}
