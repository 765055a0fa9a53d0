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
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The authentication a client must present to be authorized. */
@AutoOneOf(ClientAuthentication.Kind.class)
public abstract class ClientAuthentication {
  public enum Kind { UNAUTHENTICATED, TLS_UNAUTHENTICATED, TLS_AUTHENTICATED }

  public abstract Kind getKind();

  /** Any connection, meshed or not. */
  public abstract void unauthenticated();

  /** TLS connections, whether or not a client identity was presented. */
  public abstract void tlsUnauthenticated();

  /** Mesh TLS connections whose identity matches one of the entries. */
  public abstract ImmutableList<IdentityMatch> tlsAuthenticated();

  public static ClientAuthentication unauthenticatedClients() {
    return AutoOneOf_ClientAuthentication.unauthenticated();
  }

  public static ClientAuthentication tlsClients() {
    return AutoOneOf_ClientAuthentication.tlsUnauthenticated();
  }

  public static ClientAuthentication authenticatedClients(List<IdentityMatch> identities) {
    return AutoOneOf_ClientAuthentication.tlsAuthenticated(ImmutableList.copyOf(identities));
  }

  /** Any mesh identity. */
  public static ClientAuthentication anyIdentity() {
    return authenticatedClients(ImmutableList.of(IdentityMatch.suffix(ImmutableList.<String>of())));
  }
}
