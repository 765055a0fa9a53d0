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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** A filter applied to requests matched by a route rule. */
@AutoOneOf(RouteFilter.Kind.class)
public abstract class RouteFilter {
  public enum Kind {
    REQUEST_HEADER_MODIFIER, RESPONSE_HEADER_MODIFIER, REQUEST_REDIRECT, FAILURE_INJECTOR
  }

  public abstract Kind getKind();

  public abstract HeaderModifier requestHeaderModifier();

  public abstract HeaderModifier responseHeaderModifier();

  public abstract RequestRedirect requestRedirect();

  public abstract FailureInjector failureInjector();

  public static RouteFilter ofRequestHeaderModifier(HeaderModifier modifier) {
    return AutoOneOf_RouteFilter.requestHeaderModifier(modifier);
  }

  public static RouteFilter ofResponseHeaderModifier(HeaderModifier modifier) {
    return AutoOneOf_RouteFilter.responseHeaderModifier(modifier);
  }

  public static RouteFilter ofRequestRedirect(RequestRedirect redirect) {
    return AutoOneOf_RouteFilter.requestRedirect(redirect);
  }

  public static RouteFilter ofFailureInjector(FailureInjector injector) {
    return AutoOneOf_RouteFilter.failureInjector(injector);
  }

  @AutoValue
  public abstract static class HeaderModifier {
    public abstract ImmutableMap<String, String> add();

    public abstract ImmutableMap<String, String> set();

    public abstract ImmutableList<String> remove();

    public static HeaderModifier create(
        Map<String, String> add, Map<String, String> set, List<String> remove) {
      return new AutoValue_RouteFilter_HeaderModifier(
          ImmutableMap.copyOf(add), ImmutableMap.copyOf(set), ImmutableList.copyOf(remove));
    }
  }

  @AutoValue
  public abstract static class RequestRedirect {
    public enum PathModifierType { FULL, PREFIX }

    @Nullable
    public abstract String scheme();

    @Nullable
    public abstract String host();

    @Nullable
    public abstract PathModifierType pathModifierType();

    @Nullable
    public abstract String path();

    @Nullable
    public abstract Integer port();

    public abstract int statusCode();

    public static Builder builder() {
      return new AutoValue_RouteFilter_RequestRedirect.Builder().setStatusCode(302);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setScheme(@Nullable String scheme);

      public abstract Builder setHost(@Nullable String host);

      public abstract Builder setPathModifierType(@Nullable PathModifierType type);

      public abstract Builder setPath(@Nullable String path);

      public abstract Builder setPort(@Nullable Integer port);

      public abstract Builder setStatusCode(int statusCode);

      public abstract RequestRedirect build();
    }
  }

  /** Fails a ratio of requests with a fixed status. */
  @AutoValue
  public abstract static class FailureInjector {
    public abstract int status();

    public abstract String message();

    public abstract double ratio();

    public static FailureInjector create(int status, String message, double ratio) {
      checkArgument(ratio >= 0 && ratio <= 1, "ratio must be in [0, 1]: %s", ratio);
      return new AutoValue_RouteFilter_FailureInjector(status, message, ratio);
    }
  }
}
