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

package io.meshpolicy.index;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedSet;
import io.meshpolicy.resource.PortReference;

/** Parsers for port numbers and comma-separated port lists such as {@code 80,8000-8080}. */
public final class PortSets {
  private static final int MAX_PORT = 65535;

  private PortSets() {}

  /**
   * Parses a port list. Entries are ports or inclusive {@code lo-hi} ranges; blank entries are
   * ignored.
   */
  public static ImmutableSortedSet<Integer> parsePortSet(String text)
      throws InvalidResourceException {
    ImmutableSortedSet.Builder<Integer> ports = ImmutableSortedSet.naturalOrder();
    for (String entry : Splitter.on(',').trimResults().omitEmptyStrings().split(text)) {
      int dash = entry.indexOf('-');
      if (dash < 0) {
        ports.add(parsePort(entry));
        continue;
      }
      int floor = parsePort(entry.substring(0, dash).trim());
      int ceiling = parsePort(entry.substring(dash + 1).trim());
      if (floor > ceiling) {
        throw new InvalidResourceException("port range must be increasing: " + entry);
      }
      for (int port = floor; port <= ceiling; port++) {
        ports.add(port);
      }
    }
    return ports.build();
  }

  /** Parses a port in {@code 1..65535}. */
  public static int parsePort(String text) throws InvalidResourceException {
    int port;
    try {
      port = Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new InvalidResourceException("invalid port: '" + text + "'", e);
    }
    checkPort(port);
    return port;
  }

  public static void checkPort(int port) throws InvalidResourceException {
    if (port < 1 || port > MAX_PORT) {
      throw new InvalidResourceException("port out of range: " + port);
    }
  }

  public static void checkPort(PortReference port) throws InvalidResourceException {
    if (port.getKind() == PortReference.Kind.NUMBER) {
      checkPort(port.number());
    } else if (port.name().isEmpty()) {
      throw new InvalidResourceException("port name must not be empty");
    }
  }
}
