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

import com.axonops.libgrok.capture.Capture;
import com.axonops.libgrok.capture.CaptureIndexStore;
import com.axonops.libgrok.capture.CaptureStoreConfig;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Verifies that capture store metrics reach the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        CaptureStoreConfig config = GrokMetricsConfig.withMetrics(registry, "com.test.jmx", false);

        try (CaptureIndexStore store = new CaptureIndexStore(config)) {
            store.addCapture(
                Capture.builder().id(1).captureNumber(1).name("IP:client").subname("client").build(),
                false);
            store.getById(1);

            MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
            Set<ObjectName> mbeans = mBeanServer.queryNames(
                new ObjectName("metrics:name=com.test.jmx.*,type=*"), null);

            boolean foundIdGauge = mbeans.stream()
                .anyMatch(name -> name.toString().contains("index.by_id.current.count")
                    && name.toString().contains("type=gauges"));
            boolean foundAddedCounter = mbeans.stream()
                .anyMatch(name -> name.toString().contains("captures.added.total.count")
                    && name.toString().contains("type=counters"));
            boolean foundAddTimer = mbeans.stream()
                .anyMatch(name -> name.toString().contains("captures.add.latency")
                    && name.toString().contains("type=timers"));

            assertThat(foundIdGauge).as("index.by_id.current.count gauge should be in JMX").isTrue();
            assertThat(foundAddedCounter).as("captures.added.total.count counter should be in JMX").isTrue();
            assertThat(foundAddTimer).as("captures.add.latency timer should be in JMX").isTrue();
        }
    }

    @Test
    void testJmxGaugeReadable() throws Exception {
        CaptureStoreConfig config = GrokMetricsConfig.withMetrics(registry, "jmx.readable.test", false);

        try (CaptureIndexStore store = new CaptureIndexStore(config)) {
            for (int id = 1; id <= 3; id++) {
                store.addCapture(Capture.builder().id(id).captureNumber(id).name("N" + id).build(), false);
            }

            MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
            ObjectName gauge = new ObjectName(
                "metrics:name=jmx.readable.test.index.by_id.current.count,type=gauges");

            Object value = mBeanServer.getAttribute(gauge, "Value");
            assertThat(((Number) value).intValue()).isEqualTo(3);
        }
    }
}
