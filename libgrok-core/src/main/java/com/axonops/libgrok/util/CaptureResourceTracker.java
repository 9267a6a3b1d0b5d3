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

package com.axonops.libgrok.util;

import com.axonops.libgrok.metrics.GrokMetricsRegistry;
import com.axonops.libgrok.metrics.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts capture copies taken into and released from a store's indexes.
 *
 * Every {@code addCapture} creates four copies (one per index). A copy is released when it is
 * overwritten, replaced in a bucket, or dropped by clear/close. After a store is closed the live
 * count must be zero; anything else is a leak in the ownership bookkeeping.
 *
 * Instance-level (per store). Not thread-safe, like the store itself.
 *
 * @since 1.0.0
 */
public final class CaptureResourceTracker {
    private static final Logger logger = LoggerFactory.getLogger(CaptureResourceTracker.class);

    private final GrokMetricsRegistry metricsRegistry;

    private long liveCopies;
    private long totalCreated;
    private long totalReleased;

    public CaptureResourceTracker(GrokMetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Tracks one copy taken into an index.
     */
    public void trackCopyCreated() {
        liveCopies++;
        totalCreated++;
        metricsRegistry.incrementCounter(MetricNames.RESOURCES_COPIES_CREATED);
    }

    /**
     * Tracks one copy released by an index.
     */
    public void trackCopyReleased() {
        long before = liveCopies;
        liveCopies--;
        totalReleased++;
        metricsRegistry.incrementCounter(MetricNames.RESOURCES_COPIES_RELEASED);

        if (liveCopies < 0) {
            logger.error("Grok: Live capture copy count went negative! before={}, after={}",
                before, liveCopies);
            liveCopies = 0;
        }
    }

    /**
     * Gets copies currently held by the store's indexes.
     */
    public long getLiveCopies() {
        return liveCopies;
    }

    public long getTotalCreated() {
        return totalCreated;
    }

    public long getTotalReleased() {
        return totalReleased;
    }

    /**
     * Resets all counters (for testing only).
     */
    public void reset() {
        liveCopies = 0;
        totalCreated = 0;
        totalReleased = 0;
        logger.trace("Grok: CaptureResourceTracker reset");
    }

    /**
     * Gets statistics snapshot.
     */
    public ResourceStatistics getStatistics() {
        return new ResourceStatistics(liveCopies, totalCreated, totalReleased);
    }

    public record ResourceStatistics(long liveCopies, long totalCreated, long totalReleased) {
        public boolean hasPotentialLeaks() {
            return totalCreated > (totalReleased + liveCopies);
        }
    }
}
