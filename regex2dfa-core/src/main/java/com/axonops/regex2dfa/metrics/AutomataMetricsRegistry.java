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


package com.axonops.regex2dfa.metrics;

import java.util.function.Supplier;

/**
 * Metrics sink used by the compiler, the simulator and the pattern cache.
 *
 * <p>Decouples the core module from any metrics library. Counters, timers and gauges follow the
 * Dropwizard model; {@link NoOpMetricsRegistry} is the default and {@link DropwizardMetricsAdapter}
 * forwards to a Dropwizard {@code MetricRegistry}.
 *
 * <p>Implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface AutomataMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name, usually a {@link MetricNames} constant
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by {@code delta}.
     *
     * @param name metric name
     * @param delta non-negative increment
     */
    void incrementCounter(String name, long delta);

    /**
     * Record one duration.
     *
     * @param name metric name
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge whose value is read on demand. Re-registering a name replaces the gauge.
     *
     * @param name metric name
     * @param valueSupplier fast, non-blocking value source
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /** Remove a gauge; unknown names are ignored. */
    void removeGauge(String name);
}
