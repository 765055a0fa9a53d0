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

package io.meshpolicy.status;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.gson.JsonObject;
import io.meshpolicy.ResourceId;

/** Writes status subresources to the cluster store. */
public interface StatusPatcher {
  /**
   * Applies {@code mergePatch} as a JSON merge patch to the status subresource of {@code id}.
   * The returned future fails if the write was rejected; it may be cancelled by the caller when
   * the write takes too long.
   */
  ListenableFuture<Void> patch(ResourceId id, JsonObject mergePatch);
}
