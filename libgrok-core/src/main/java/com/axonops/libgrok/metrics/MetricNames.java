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

package com.axonops.libgrok.metrics;

/**
 * Metric name constants for capture store instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Capture Insertion (4 metrics)</b> - Adds, renamed-only skips, bucket replacements and
 *       add latency
 *   <li><b>Lookups (2 metrics)</b> - Hits and misses across all lookup operations
 *   <li><b>Index State (4 metrics)</b> - Current key count of each of the four indexes
 *   <li><b>Resources (2 metrics)</b> - Stored record copies created and released
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Replacements:</b> CAPTURES_REPLACED grows when the compiler re-adds ids; a value close
 *       to CAPTURES_ADDED means most adds are redefinitions
 *   <li><b>Leaks:</b> RESOURCES_COPIES_CREATED - RESOURCES_COPIES_RELEASED should return to zero
 *       once a store is closed
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.libgrok.capture.CaptureIndexStore
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Capture Insertion Metrics (4)
  // ========================================

  /**
   * Captures stored by {@code addCapture}.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CAPTURES_ADDED = "captures.added.total.count";

  /**
   * Calls to {@code addCapture(record, true)} skipped because the name carries no rename
   * separator.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CAPTURES_SKIPPED = "captures.skipped.total.count";

  /**
   * Bucket entries replaced because a capture with the same id was already present under the same
   * name or subname.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CAPTURES_REPLACED = "captures.replaced.total.count";

  /**
   * Time spent updating all four indexes for one capture.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String CAPTURES_ADD_LATENCY = "captures.add.latency";

  // ========================================
  // Lookup Metrics (2)
  // ========================================

  /**
   * Lookups (by id, capture number, name or subname) that found a capture.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String LOOKUPS_HITS = "lookups.hits.total.count";

  /**
   * Lookups that found nothing.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String LOOKUPS_MISSES = "lookups.misses.total.count";

  // ========================================
  // Index State Metrics (4)
  // ========================================

  /** Distinct ids in the primary index. <b>Type:</b> Gauge */
  public static final String INDEX_BY_ID_COUNT = "index.by_id.current.count";

  /** Distinct capture numbers. <b>Type:</b> Gauge */
  public static final String INDEX_BY_CAPTURE_NUMBER_COUNT =
      "index.by_capture_number.current.count";

  /** Distinct names (buckets). <b>Type:</b> Gauge */
  public static final String INDEX_BY_NAME_COUNT = "index.by_name.current.count";

  /** Distinct subnames (buckets). <b>Type:</b> Gauge */
  public static final String INDEX_BY_SUBNAME_COUNT = "index.by_subname.current.count";

  // ========================================
  // Resource Metrics (2)
  // ========================================

  /**
   * Record copies taken into an index.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String RESOURCES_COPIES_CREATED = "resources.copies.created.total.count";

  /**
   * Record copies released on overwrite, replacement or teardown.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String RESOURCES_COPIES_RELEASED = "resources.copies.released.total.count";
}
