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
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** Request matchers used by route rules. */
public final class RouteMatchers {
  private RouteMatchers() {}

  /** Matcher for the request path. Regular expressions are kept as RE2 source text. */
  @AutoOneOf(PathMatch.Kind.class)
  public abstract static class PathMatch {
    public enum Kind { EXACT, PREFIX, REGEX }

    public abstract Kind getKind();

    public abstract String exact();

    public abstract String prefix();

    public abstract String regex();

    public static PathMatch forExact(String path) {
      return AutoOneOf_RouteMatchers_PathMatch.exact(checkNotNull(path, "path"));
    }

    public static PathMatch forPrefix(String prefix) {
      return AutoOneOf_RouteMatchers_PathMatch.prefix(checkNotNull(prefix, "prefix"));
    }

    public static PathMatch forRegex(String regex) {
      return AutoOneOf_RouteMatchers_PathMatch.regex(checkNotNull(regex, "regex"));
    }
  }

  /** Value matcher for a header or a query parameter. */
  @AutoValue
  public abstract static class ValueMatch {
    public enum Type { EXACT, REGEX }

    public abstract String name();

    public abstract Type type();

    public abstract String value();

    public static ValueMatch forExact(String name, String value) {
      return new AutoValue_RouteMatchers_ValueMatch(name, Type.EXACT, value);
    }

    public static ValueMatch forRegex(String name, String regex) {
      return new AutoValue_RouteMatchers_ValueMatch(name, Type.REGEX, regex);
    }
  }

  /** Matcher for the request authority. */
  @AutoOneOf(HostMatch.Kind.class)
  public abstract static class HostMatch {
    public enum Kind { EXACT, SUFFIX }

    public abstract Kind getKind();

    public abstract String exact();

    /** Domain under which any host matches, without the leading {@code *.}. */
    public abstract String suffix();

    /** Parses a Gateway API hostname: {@code *.example.com} or {@code example.com}. */
    public static HostMatch parse(String hostname) {
      if (hostname.startsWith("*.")) {
        return AutoOneOf_RouteMatchers_HostMatch.suffix(hostname.substring(2));
      }
      return AutoOneOf_RouteMatchers_HostMatch.exact(hostname);
    }
  }

  /** An HTTP request matcher. All present conditions must hold. */
  @AutoValue
  public abstract static class HttpRouteMatch {
    @Nullable
    public abstract PathMatch path();

    public abstract ImmutableList<ValueMatch> headers();

    public abstract ImmutableList<ValueMatch> queryParams();

    @Nullable
    public abstract String method();

    public static HttpRouteMatch create(@Nullable PathMatch path, List<ValueMatch> headers,
        List<ValueMatch> queryParams, @Nullable String method) {
      return new AutoValue_RouteMatchers_HttpRouteMatch(path, ImmutableList.copyOf(headers),
          ImmutableList.copyOf(queryParams), method);
    }

    /** Matches every request path. */
    public static HttpRouteMatch pathPrefix(String prefix) {
      return create(PathMatch.forPrefix(prefix), ImmutableList.<ValueMatch>of(),
          ImmutableList.<ValueMatch>of(), null);
    }
  }

  /** A gRPC request matcher. An unset service or method matches any. */
  @AutoValue
  public abstract static class GrpcRouteMatch {
    @Nullable
    public abstract String service();

    @Nullable
    public abstract String method();

    public abstract ImmutableList<ValueMatch> headers();

    public static GrpcRouteMatch create(
        @Nullable String service, @Nullable String method, List<ValueMatch> headers) {
      return new AutoValue_RouteMatchers_GrpcRouteMatch(
          service, method, ImmutableList.copyOf(headers));
    }
  }
}
