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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GrokMetricsConfigTest {

  @AfterEach
  void cleanup() {
    GrokMetricsConfig.shutdown();
  }

  @Test
  void testWithMetrics_CustomPrefix() {
    MetricRegistry registry = new MetricRegistry();

    CaptureStoreConfig config = GrokMetricsConfig.withMetrics(registry, "com.myapp.grok", false);

    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
    assertThat(((DropwizardMetricsAdapter) config.metricsRegistry()).getPrefix())
        .isEqualTo("com.myapp.grok");
    assertThat(GrokMetricsConfig.isJmxReporterRunning()).isFalse();
  }

  @Test
  void testWithMetrics_DefaultPrefix() {
    CaptureStoreConfig config = GrokMetricsConfig.withMetrics(new MetricRegistry());

    assertThat(((DropwizardMetricsAdapter) config.metricsRegistry()).getPrefix())
        .isEqualTo(DropwizardMetricsAdapter.DEFAULT_PREFIX);
    assertThat(GrokMetricsConfig.isJmxReporterRunning()).isTrue();
  }

  @Test
  void testBuilder_KeepsOtherSettings() {
    CaptureStoreConfig config =
        GrokMetricsConfig.builder(new MetricRegistry(), "test", false)
            .renameSeparator("=")
            .logCaptures(true)
            .build();

    assertThat(config.renameSeparator()).isEqualTo("=");
    assertThat(config.logCaptures()).isTrue();
    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
  }

  @Test
  void testShutdown_Idempotent() {
    GrokMetricsConfig.withMetrics(new MetricRegistry(), "test");
    GrokMetricsConfig.shutdown();

    assertThat(GrokMetricsConfig.isJmxReporterRunning()).isFalse();
    assertThatNoException().isThrownBy(GrokMetricsConfig::shutdown);
  }

  @Test
  void testNullRegistry_ThrowsException() {
    assertThatThrownBy(() -> GrokMetricsConfig.withMetrics(null, "test"))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("registry");
  }

  @Test
  void testNullPrefix_ThrowsException() {
    MetricRegistry registry = new MetricRegistry();

    assertThatThrownBy(() -> GrokMetricsConfig.withMetrics(registry, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("metricPrefix");
  }
}
