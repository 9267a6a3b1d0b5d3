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

import java.util.function.Supplier;

/**
 * Metrics sink used by the capture store.
 *
 * <p>Keeps the core free of a hard dependency on a particular metrics library. {@link
 * NoOpMetricsRegistry} is the default; {@link DropwizardMetricsAdapter} bridges to Dropwizard
 * Metrics.
 *
 * <p>Names passed in are the relative names from {@link MetricNames}; implementations add their own
 * prefix.
 *
 * @since 1.0.0
 */
public interface GrokMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., {@link MetricNames#CAPTURES_ADDED})
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a non-negative delta.
     *
     * @param name metric name
     * @param delta amount to add
     */
    void incrementCounter(String name, long delta);

    /**
     * Record one duration sample.
     *
     * @param name metric name (e.g., {@link MetricNames#CAPTURES_ADD_LATENCY})
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge contribution read on demand.
     *
     * <p>Several owners may register under the same name (for example, stores sharing one config);
     * the gauge then reports the sum of all registered suppliers.
     *
     * @param name metric name (e.g., {@link MetricNames#INDEX_BY_ID_COUNT})
     * @param valueSupplier current value; must be cheap and must not block
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a contribution registered earlier with the same supplier instance. The gauge itself
     * disappears once its last contribution is removed. No-op if absent.
     *
     * @param name metric name
     * @param valueSupplier the supplier passed to {@link #registerGauge}
     */
    void removeGauge(String name, Supplier<Number> valueSupplier);
}
