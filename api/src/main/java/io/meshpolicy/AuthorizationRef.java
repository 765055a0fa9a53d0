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

/** Names the resource an authorization was derived from. */
@AutoValue
public abstract class AuthorizationRef {
  public enum Kind { DEFAULT, SERVER_AUTHORIZATION, AUTHORIZATION_POLICY }

  public abstract Kind kind();

  public abstract String name();

  /** A synthesized authorization, such as {@code kubelet} or a default policy name. */
  public static AuthorizationRef ofDefault(String name) {
    return new AutoValue_AuthorizationRef(Kind.DEFAULT, name);
  }

  public static AuthorizationRef ofServerAuthorization(String name) {
    return new AutoValue_AuthorizationRef(Kind.SERVER_AUTHORIZATION, name);
  }

  public static AuthorizationRef ofAuthorizationPolicy(String name) {
    return new AutoValue_AuthorizationRef(Kind.AUTHORIZATION_POLICY, name);
  }
}
