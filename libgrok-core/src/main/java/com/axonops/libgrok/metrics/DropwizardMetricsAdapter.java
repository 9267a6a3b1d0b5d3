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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bridges {@link GrokMetricsRegistry} to a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name is prefixed, so a store configured with prefix {@code "myapp.grok"} reports e.g.
 * {@code myapp.grok.captures.added.total.count} and {@code myapp.grok.index.by_id.current.count}.
 *
 * <p>Gauges are summed: when several stores register the same gauge name, the Dropwizard gauge
 * reports their total, and closing one store only withdraws that store's contribution.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * CaptureStoreConfig config = CaptureStoreConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.grok"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements GrokMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.libgrok";

    // Shared by every adapter, since several adapters may wrap one MetricRegistry
    private static final Object GAUGE_LOCK = new Object();

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with prefix {@value #DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard registry
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with a custom prefix.
     *
     * @param registry the Dropwizard registry
     * @param prefix metric namespace, e.g. {@code "myapp.grok"}
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        Objects.requireNonNull(valueSupplier, "valueSupplier cannot be null");
        String fullName = metricName(name);

        synchronized (GAUGE_LOCK) {
            Gauge<?> existing = registry.getGauges().get(fullName);
            if (existing instanceof SummingGauge) {
                ((SummingGauge) existing).add(valueSupplier);
                return;
            }
            // A foreign gauge under our name is replaced
            if (existing != null) {
                registry.remove(fullName);
            }
            SummingGauge gauge = new SummingGauge();
            gauge.add(valueSupplier);
            registry.register(fullName, gauge);
        }
    }

    @Override
    public void removeGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);

        synchronized (GAUGE_LOCK) {
            Gauge<?> existing = registry.getGauges().get(fullName);
            if (!(existing instanceof SummingGauge)) {
                return;
            }
            SummingGauge gauge = (SummingGauge) existing;
            if (gauge.remove(valueSupplier) && gauge.isEmpty()) {
                registry.remove(fullName);
            }
        }
    }

    public String getPrefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }

    /** Gauge reporting the sum of every registered contribution. */
    private static final class SummingGauge implements Gauge<Number> {
        private final List<Supplier<Number>> contributions = new CopyOnWriteArrayList<>();

        void add(Supplier<Number> supplier) {
            contributions.add(supplier);
        }

        boolean remove(Supplier<Number> supplier) {
            return contributions.removeIf(candidate -> candidate == supplier);
        }

        boolean isEmpty() {
            return contributions.isEmpty();
        }

        @Override
        public Number getValue() {
            long total = 0;
            for (Supplier<Number> contribution : contributions) {
                total += contribution.get().longValue();
            }
            return total;
        }
    }
}
