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

package com.axonops.libgrok.dropwizard;

import com.axonops.libgrok.capture.CaptureStoreConfig;
import com.axonops.libgrok.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link CaptureStoreConfig} with Dropwizard Metrics integration.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * CaptureStoreConfig config = GrokMetricsConfig.withMetrics(registry, "com.myapp.grok");
 * try (CaptureIndexStore store = new CaptureIndexStore(config)) {
 *     ...
 * }
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> unless disabled, a single {@link JmxReporter} is started for
 * the first registry passed in, so store metrics appear under the {@code metrics} JMX domain.
 *
 * @since 1.0.0
 */
public final class GrokMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(GrokMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private GrokMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config reporting to {@code registry} under {@code metricPrefix}, with JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return config with metrics enabled
     */
    public static CaptureStoreConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config reporting to {@code registry} under {@code metricPrefix}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JMX reporter
     * @return config with metrics enabled
     */
    public static CaptureStoreConfig withMetrics(
            MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builder(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates a config with the default prefix {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return config with metrics enabled
     */
    public static CaptureStoreConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Returns a builder with metrics already wired, for callers that also want to change the
     * separator or enable capture logging.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JMX reporter
     * @return pre-populated builder
     */
    public static CaptureStoreConfig.Builder builder(
            MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return CaptureStoreConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Grok: Registering JmxReporter for capture store metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
            } catch (RuntimeException e) {
                // Not fatal, the registry may already be exposed
                logger.warn("Grok: Failed to start JmxReporter", e);
            }
        }
    }

    /** True once a JMX reporter has been started and not yet shut down. */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /** Stops the JMX reporter, if one was started. */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Grok: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
