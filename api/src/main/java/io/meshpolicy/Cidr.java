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
import com.google.common.net.InetAddresses;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import javax.annotation.Nullable;

/**
 * An IPv4 or IPv6 address block. The stored address is always masked to the prefix length, so
 * {@code 10.1.2.3/8} and {@code 10.0.0.0/8} are equal.
 */
@AutoValue
public abstract class Cidr {

  public abstract InetAddress address();

  public abstract int prefixLength();

  /** Creates a block, masking host bits of {@code address}. */
  public static Cidr create(InetAddress address, int prefixLength) {
    checkNotNull(address, "address");
    int bits = address.getAddress().length * 8;
    checkArgument(prefixLength >= 0 && prefixLength <= bits,
        "prefix length %s out of range for %s", prefixLength, address);
    return new AutoValue_Cidr(mask(address, prefixLength), prefixLength);
  }

  /** A block containing only {@code address}. */
  public static Cidr ofHost(InetAddress address) {
    return create(address, address.getAddress().length * 8);
  }

  /**
   * Parses {@code addr/len} or a bare address.
   *
   * @throws IllegalArgumentException if the text is not a valid block
   */
  public static Cidr parse(String text) {
    checkNotNull(text, "text");
    String trimmed = text.trim();
    int slash = trimmed.indexOf('/');
    String addr = slash < 0 ? trimmed : trimmed.substring(0, slash);
    InetAddress address = InetAddresses.forString(addr);
    if (slash < 0) {
      return ofHost(address);
    }
    int prefixLength;
    try {
      prefixLength = Integer.parseInt(trimmed.substring(slash + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid prefix length in " + text, e);
    }
    return create(address, prefixLength);
  }

  public static Cidr allIpv4() {
    return parse("0.0.0.0/0");
  }

  public static Cidr allIpv6() {
    return parse("::/0");
  }

  public final boolean isIpv4() {
    return address() instanceof Inet4Address;
  }

  /** Number of host bits, the log2 of the block size. */
  public final int hostBits() {
    return address().getAddress().length * 8 - prefixLength();
  }

  /** Returns whether the address falls inside this block. Families never match each other. */
  public final boolean contains(@Nullable InetAddress candidate) {
    if (candidate == null) {
      return false;
    }
    byte[] addr = candidate.getAddress();
    byte[] net = address().getAddress();
    if (addr.length != net.length) {
      return false;
    }
    int remaining = prefixLength();
    for (int i = 0; i < net.length && remaining > 0; i++, remaining -= 8) {
      int m = remaining >= 8 ? 0xff : (0xff << (8 - remaining)) & 0xff;
      if ((addr[i] & m) != (net[i] & m)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether {@code other} lies entirely inside this block. */
  public final boolean contains(Cidr other) {
    return other.prefixLength() >= prefixLength() && contains(other.address());
  }

  /** The first host of the block, used to derive kubelet addresses from pod CIDRs. */
  public final InetAddress firstHost() {
    if (hostBits() == 0) {
      return address();
    }
    return InetAddresses.increment(address());
  }

  @Override
  public final String toString() {
    return InetAddresses.toAddrString(address()) + "/" + prefixLength();
  }

  private static InetAddress mask(InetAddress address, int prefixLength) {
    byte[] bytes = address.getAddress();
    int remaining = prefixLength;
    for (int i = 0; i < bytes.length; i++, remaining -= 8) {
      if (remaining >= 8) {
        continue;
      }
      bytes[i] = remaining <= 0 ? 0 : (byte) (bytes[i] & (0xff << (8 - remaining)));
    }
    try {
      return InetAddress.getByAddress(bytes);
    } catch (UnknownHostException e) {
      throw new AssertionError(e);
    }
  }
}
