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
import com.google.common.collect.ImmutableSet;
import java.time.Duration;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Retries for a route. Conditions are status classes ({@code 5xx}, {@code gateway-error}, a
 * status code or range) for HTTP, and gRPC status names for gRPC.
 */
@AutoValue
public abstract class RetryPolicy {

  public abstract int limit();

  public abstract ImmutableSet<String> conditions();

  @Nullable
  public abstract Duration timeout();

  public static RetryPolicy create(int limit, Set<String> conditions, @Nullable Duration timeout) {
    return new AutoValue_RetryPolicy(limit, ImmutableSet.copyOf(conditions), timeout);
  }
}
