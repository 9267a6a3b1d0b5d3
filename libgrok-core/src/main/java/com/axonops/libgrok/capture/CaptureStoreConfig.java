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

import com.axonops.libgrok.metrics.GrokMetricsRegistry;
import com.axonops.libgrok.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for a {@link CaptureIndexStore}.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: ":" separator, capture logging off, metrics disabled
 * CaptureIndexStore store = new CaptureIndexStore(CaptureStoreConfig.DEFAULT);
 *
 * // Trace every add and walk step, report to Dropwizard
 * CaptureStoreConfig config = CaptureStoreConfig.builder()
 *     .logCaptures(true)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.grok"))
 *     .build();
 * }</pre>
 *
 * @param renameSeparator separator that marks a renamed capture ({@code "IP:client"}); consulted by
 *     {@code addCapture(record, true)}. Must be non-empty.
 * @param logCaptures log each add, extra assignment and walk step at TRACE level
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @since 1.0.0
 */
public record CaptureStoreConfig(
    String renameSeparator, boolean logCaptures, GrokMetricsRegistry metricsRegistry) {

  /** ":" separator, capture logging off, metrics disabled. */
  public static final CaptureStoreConfig DEFAULT =
      new CaptureStoreConfig(CaptureNames.DEFAULT_SEPARATOR, false, NoOpMetricsRegistry.INSTANCE);

  public CaptureStoreConfig {
    Objects.requireNonNull(renameSeparator, "renameSeparator cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (renameSeparator.isEmpty()) {
      throw new IllegalArgumentException("renameSeparator must not be empty");
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom store configuration. */
  public static class Builder {
    private String renameSeparator = CaptureNames.DEFAULT_SEPARATOR;
    private boolean logCaptures = false;
    private GrokMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set the rename separator.
     *
     * <p><b>Default: ":"</b>
     *
     * @param separator non-empty separator
     * @return this builder
     */
    public Builder renameSeparator(String separator) {
      this.renameSeparator = separator;
      return this;
    }

    /**
     * Enable capture logging.
     *
     * <p><b>Default: disabled</b>. Messages go to the {@code CaptureIndexStore} logger at TRACE, so
     * the logging backend must also enable that level.
     *
     * @param enabled true to log captures
     * @return this builder
     */
    public Builder logCaptures(boolean enabled) {
      this.logCaptures = enabled;
      return this;
    }

    /**
     * Set metrics registry.
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(GrokMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if the separator is empty
     */
    public CaptureStoreConfig build() {
      return new CaptureStoreConfig(renameSeparator, logCaptures, metricsRegistry);
    }
  }
}
