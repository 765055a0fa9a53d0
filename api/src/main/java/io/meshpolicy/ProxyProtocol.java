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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import java.time.Duration;
import javax.annotation.Nullable;

/** The protocol a proxy should expect on an inbound port. */
@AutoValue
public abstract class ProxyProtocol {
  public enum Kind { DETECT, HTTP1, HTTP2, GRPC, OPAQUE, TLS }

  public abstract Kind kind();

  /** How long to wait for the client to send data when detecting. Set only for DETECT. */
  @Nullable
  public abstract Duration detectTimeout();

  public static ProxyProtocol detect(Duration timeout) {
    checkNotNull(timeout, "timeout");
    return new AutoValue_ProxyProtocol(Kind.DETECT, timeout);
  }

  public static ProxyProtocol of(Kind kind) {
    checkArgument(kind != Kind.DETECT, "use detect(timeout)");
    return new AutoValue_ProxyProtocol(kind, null);
  }
}
