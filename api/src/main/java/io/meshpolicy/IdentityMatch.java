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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoOneOf;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Matches a peer's mesh identity. Identities are DNS-like names
 * ({@code web.emojivoto.serviceaccount.identity.linkerd.cluster.local}) or SPIFFE URIs.
 */
@AutoOneOf(IdentityMatch.Kind.class)
public abstract class IdentityMatch {
  public enum Kind { EXACT, SUFFIX }

  public abstract Kind getKind();

  public abstract String exact();

  /** Name labels the identity must end with; empty matches every identity. */
  public abstract ImmutableList<String> suffix();

  public static IdentityMatch exact(String identity) {
    return AutoOneOf_IdentityMatch.exact(checkNotNull(identity, "identity"));
  }

  public static IdentityMatch suffix(List<String> labels) {
    return AutoOneOf_IdentityMatch.suffix(ImmutableList.copyOf(labels));
  }

  /**
   * Parses {@code *} (any identity), {@code *.a.b} (any identity under {@code a.b}), or an exact
   * identity.
   */
  public static IdentityMatch parse(String text) {
    if ("*".equals(text)) {
      return suffix(ImmutableList.<String>of());
    }
    if (text.startsWith("*.")) {
      return suffix(Splitter.on('.').splitToList(text.substring(2)));
    }
    return exact(text);
  }

  public final boolean matches(String identity) {
    switch (getKind()) {
      case EXACT:
        return exact().equals(identity);
      case SUFFIX:
        if (suffix().isEmpty()) {
          return true;
        }
        return identity.endsWith("." + Joiner.on('.').join(suffix()));
      default:
        throw new AssertionError(getKind());
    }
  }

  @Override
  public String toString() {
    switch (getKind()) {
      case EXACT:
        return exact();
      case SUFFIX:
        return suffix().isEmpty() ? "*" : "*." + Joiner.on('.').join(suffix());
      default:
        throw new AssertionError(getKind());
    }
  }
}
