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


package com.axonops.regex2dfa.dropwizard;

import com.axonops.regex2dfa.cache.AutomataConfig;
import com.axonops.regex2dfa.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link AutomataConfig} with Dropwizard Metrics integration.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * AutomataConfig config = AutomataMetricsConfig.withMetrics(registry, "com.mycompany.automata");
 * Pattern.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> unless disabled, a {@link JmxReporter} is started for the
 * registry the first time this factory is used, so every metric shows up under the
 * {@code metrics} JMX domain.
 *
 * @since 1.0.0
 */
public final class AutomataMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(AutomataMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private AutomataMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a configuration reporting to {@code registry} under {@code metricPrefix}, with JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return default configuration with metrics enabled
     */
    public static AutomataConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a configuration reporting to {@code registry} under {@code metricPrefix}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JMX reporter for the registry
     * @return default configuration with metrics enabled
     */
    public static AutomataConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builder(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates a configuration using the default prefix {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return default configuration with metrics enabled
     */
    public static AutomataConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Starts from the defaults with metrics wired in, for callers that also want to change limits.
     *
     * <pre>{@code
     * AutomataConfig config = AutomataMetricsConfig.builder(registry, "myapp.automata", false)
     *     .maxDfaStates(2_000)
     *     .build();
     * }</pre>
     */
    public static AutomataConfig.Builder builder(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return AutomataConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * Ensures a JmxReporter is running. Idempotent: only the first call creates one.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Automata: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("Automata: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - registry may already have JMX exposure
                logger.warn("Automata: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /** Whether a reporter started by this class is running. */
    public static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /** Stops the JMX reporter started by this class, if any. */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Automata: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
