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

/**
 * Authorizes clients of a Server, a route, or every Server in a namespace, requiring all of the
 * referenced authentications.
 */
@AutoValue
public abstract class AuthorizationPolicy implements Resource {

  @Override
  public abstract ObjectMeta metadata();

  public abstract ObjectReference targetRef();

  public abstract ImmutableList<ObjectReference> requiredAuthenticationRefs();

  public static AuthorizationPolicy create(ObjectMeta metadata, ObjectReference targetRef,
      List<ObjectReference> requiredAuthenticationRefs) {
    return new AutoValue_AuthorizationPolicy(
        metadata, targetRef, ImmutableList.copyOf(requiredAuthenticationRefs));
  }
}
