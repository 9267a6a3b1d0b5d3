/*
 * Copyright 2025 AxonOps
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

package com.axonops.libgrok.tree;

import java.util.Comparator;

/**
 * Comparators for {@link PackedKeyMap}. Every comparator skips the length prefix and orders keys
 * by payload only.
 *
 * @since 1.0.0
 */
public final class PackedKeyComparators {

  /** Orders int32 keys (see {@link PackedKey#ofInt(int)}) numerically, negatives first. */
  public static final Comparator<PackedKey> INT32 =
      (a, b) -> Integer.compare(a.asInt(), b.asInt());

  /**
   * Orders keys by unsigned byte-wise comparison of their payload, shorter key first on a common
   * prefix. For UTF-8 string keys this is code point order.
   */
  public static final Comparator<PackedKey> STRING = PackedKeyComparators::compareBytes;

  /** Ordering for arbitrary binary keys; same as {@link #STRING}. */
  public static final Comparator<PackedKey> BINARY = STRING;

  private PackedKeyComparators() {
    // Utility class
  }

  private static int compareBytes(PackedKey a, PackedKey b) {
    int common = Math.min(a.length(), b.length());
    for (int i = 0; i < common; i++) {
      int cmp = Integer.compare(a.payloadByte(i) & 0xff, b.payloadByte(i) & 0xff);
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(a.length(), b.length());
  }
}
