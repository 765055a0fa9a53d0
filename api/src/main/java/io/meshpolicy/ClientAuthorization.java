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
import com.google.common.collect.ImmutableList;
import java.util.List;

/** An allow rule: clients from one of {@link #networks} presenting {@link #authentication}. */
@AutoValue
public abstract class ClientAuthorization {

  public abstract ImmutableList<NetworkMatch> networks();

  public abstract ClientAuthentication authentication();

  public static ClientAuthorization create(
      List<NetworkMatch> networks, ClientAuthentication authentication) {
    return new AutoValue_ClientAuthorization(ImmutableList.copyOf(networks), authentication);
  }
}
