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

package io.meshpolicy.resource;

import com.google.auto.value.AutoOneOf;

/** A port given by number or by container port name. */
@AutoOneOf(PortReference.Kind.class)
public abstract class PortReference {
  public enum Kind { NUMBER, NAME }

  public abstract Kind getKind();

  public abstract int number();

  public abstract String name();

  public static PortReference ofNumber(int number) {
    return AutoOneOf_PortReference.number(number);
  }

  public static PortReference ofName(String name) {
    return AutoOneOf_PortReference.name(name);
  }

  /** Parses a numeric string as a number, anything else as a name. */
  public static PortReference parse(String text) {
    try {
      return ofNumber(Integer.parseInt(text));
    } catch (NumberFormatException e) {
      return ofName(text);
    }
  }
}
