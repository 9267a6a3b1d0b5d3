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
 * Snapshot of a {@link CaptureIndexStore}'s index sizes and counters.
 *
 * @since 1.0.0
 */
public record CaptureStoreStatistics(
    int idCount,
    int captureNumberCount,
    int nameCount,
    int subnameCount,
    long added,
    long skipped,
    long replaced,
    long hits,
    long misses) {

  /**
   * Lookup hit rate.
   *
   * @return between 0.0 and 1.0, or 0.0 if no lookups
   */
  public double hitRate() {
    long total = hits + misses;
    return total == 0 ? 0.0 : (double) hits / total;
  }

  /** Total lookups (hits + misses). */
  public long totalLookups() {
    return hits + misses;
  }

  /** True if no capture is stored. */
  public boolean isEmpty() {
    return idCount == 0;
  }
}
