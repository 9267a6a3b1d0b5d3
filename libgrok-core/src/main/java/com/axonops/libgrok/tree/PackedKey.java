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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable binary key stored as {@code length-prefix || payload}.
 *
 * <p>The 4-byte big-endian length prefix lets a single {@link PackedKeyMap} hold integer keys,
 * string keys and arbitrary binary keys without relying on null-termination. Comparators from
 * {@link PackedKeyComparators} skip the prefix and order keys by payload only.
 *
 * <pre>{@code
 * PackedKey byId = PackedKey.ofInt(42);          // [00 00 00 04][00 00 00 2a]
 * PackedKey byName = PackedKey.ofString("IP");   // [00 00 00 02]['I' 'P']
 * }</pre>
 *
 * <p>Equality and hash code are defined over the payload bytes.
 *
 * @since 1.0.0
 */
public final class PackedKey {

  /** Size of the length prefix in bytes. */
  public static final int PREFIX_BYTES = Integer.BYTES;

  private final byte[] packed;

  private PackedKey(byte[] packed) {
    this.packed = packed;
  }

  /**
   * Packs a copy of the given bytes.
   *
   * @param payload raw key bytes (copied)
   * @return packed key
   * @throws NullPointerException if payload is null
   */
  public static PackedKey of(byte[] payload) {
    Objects.requireNonNull(payload, "payload cannot be null");
    return pack(payload, 0, payload.length);
  }

  /**
   * Packs a 32-bit integer as a 4-byte big-endian payload.
   *
   * @param value key value
   * @return packed key
   */
  public static PackedKey ofInt(int value) {
    return pack(ByteBuffer.allocate(Integer.BYTES).putInt(value).array(), 0, Integer.BYTES);
  }

  /**
   * Packs a string as its UTF-8 bytes. A {@code null} string packs as the empty key.
   *
   * @param value key value
   * @return packed key
   */
  public static PackedKey ofString(String value) {
    byte[] bytes = value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    return pack(bytes, 0, bytes.length);
  }

  /**
   * Rebuilds a key from its packed form, validating the length prefix.
   *
   * @param packed bytes previously returned by {@link #packed()}
   * @return packed key
   * @throws IllegalArgumentException if the prefix does not match the buffer length
   */
  public static PackedKey fromPacked(byte[] packed) {
    Objects.requireNonNull(packed, "packed cannot be null");
    if (packed.length < PREFIX_BYTES) {
      throw new IllegalArgumentException(
          "Packed key too short: " + packed.length + " bytes (prefix is " + PREFIX_BYTES + ")");
    }
    int length = ByteBuffer.wrap(packed, 0, PREFIX_BYTES).getInt();
    if (length != packed.length - PREFIX_BYTES) {
      throw new IllegalArgumentException(
          "Packed key length prefix "
              + length
              + " does not match payload size "
              + (packed.length - PREFIX_BYTES));
    }
    return new PackedKey(packed.clone());
  }

  private static PackedKey pack(byte[] source, int offset, int length) {
    byte[] buf = new byte[PREFIX_BYTES + length];
    ByteBuffer.wrap(buf).putInt(length);
    System.arraycopy(source, offset, buf, PREFIX_BYTES, length);
    return new PackedKey(buf);
  }

  /** Payload length in bytes, as recorded in the prefix. */
  public int length() {
    return packed.length - PREFIX_BYTES;
  }

  /**
   * Returns a copy of the payload bytes (without prefix).
   *
   * @return payload copy
   */
  public byte[] payload() {
    return Arrays.copyOfRange(packed, PREFIX_BYTES, packed.length);
  }

  /**
   * Returns a copy of the packed form (prefix and payload).
   *
   * @return packed bytes
   */
  public byte[] packed() {
    return packed.clone();
  }

  /** Reads the payload byte at {@code index} without copying. */
  byte payloadByte(int index) {
    return packed[PREFIX_BYTES + index];
  }

  /**
   * Decodes the payload as a big-endian 32-bit int.
   *
   * @return decoded value
   * @throws IllegalStateException if the payload is not exactly 4 bytes
   */
  public int asInt() {
    if (length() != Integer.BYTES) {
      throw new IllegalStateException("Key payload is " + length() + " bytes, not an int32 key");
    }
    return ByteBuffer.wrap(packed, PREFIX_BYTES, Integer.BYTES).getInt();
  }

  /** Decodes the payload as UTF-8. */
  public String asString() {
    return new String(packed, PREFIX_BYTES, length(), StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PackedKey)) {
      return false;
    }
    return Arrays.equals(packed, ((PackedKey) o).packed);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(packed);
  }

  @Override
  public String toString() {
    return "PackedKey[length=" + length() + "]";
  }
}
