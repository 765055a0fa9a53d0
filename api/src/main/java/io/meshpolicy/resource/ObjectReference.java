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
import javax.annotation.Nullable;

/** A typed reference to another resource. An unset namespace means the referrer's. */
@AutoValue
public abstract class ObjectReference {

  @Nullable
  public abstract String group();

  public abstract String kind();

  @Nullable
  public abstract String namespace();

  public abstract String name();

  public static ObjectReference create(
      @Nullable String group, String kind, @Nullable String namespace, String name) {
    return new AutoValue_ObjectReference(group, kind, namespace, name);
  }

  public static ObjectReference local(@Nullable String group, String kind, String name) {
    return create(group, kind, null, name);
  }

  public final boolean isKind(String expectedKind) {
    return kind().equalsIgnoreCase(expectedKind);
  }
}
