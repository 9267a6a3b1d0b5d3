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

package com.axonops.libgrok.capture;

/**
 * Helpers for grok capture names of the form {@code PATTERN:rename}.
 *
 * <p>{@code %{IP:client}} yields name {@code "IP:client"} and subname {@code "client"}.
 *
 * @since 1.0.0
 */
public final class CaptureNames {

  /** Separator between pattern name and rename. */
  public static final String DEFAULT_SEPARATOR = ":";

  private CaptureNames() {
    // Utility class
  }

  /**
   * Tests whether a name carries a rename.
   *
   * @param name capture name, may be null
   * @param separator rename separator
   * @return true if {@code name} contains {@code separator}
   */
  public static boolean isRenamed(String name, String separator) {
    return name != null && name.contains(separator);
  }

  /**
   * Returns the part of {@code name} after the first separator, or the whole name when there is
   * none.
   *
   * @param name capture name, may be null
   * @param separator rename separator
   * @return subname; {@link Capture#EMPTY} for a null name
   */
  public static String subnameOf(String name, String separator) {
    if (name == null) {
      return Capture.EMPTY;
    }
    int idx = name.indexOf(separator);
    return idx < 0 ? name : name.substring(idx + separator.length());
  }
}
