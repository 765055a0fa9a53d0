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
import java.time.Duration;
import javax.annotation.Nullable;

/** Timeouts applied to requests on a route. Unset values inherit the proxy defaults. */
@AutoValue
public abstract class RouteTimeouts {

  /** Bounds the whole request including retries. */
  @Nullable
  public abstract Duration request();

  /** Bounds each attempt to a backend. */
  @Nullable
  public abstract Duration response();

  @Nullable
  public abstract Duration idle();

  public static RouteTimeouts create(
      @Nullable Duration request, @Nullable Duration response, @Nullable Duration idle) {
    return new AutoValue_RouteTimeouts(request, response, idle);
  }

  public final boolean isEmpty() {
    return request() == null && response() == null && idle() == null;
  }
}
