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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Forwards automata metrics to a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name is qualified with a prefix through {@link MetricRegistry#name(String, String...)},
 * so with prefix {@code com.myapp.automata} the compile counter appears as
 * {@code com.myapp.automata.patterns.compiled.total.count}.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * AutomataMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.automata");
 * Pattern.setGlobalCache(new PatternCache(AutomataConfig.builder().metricsRegistry(metrics).build()));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements AutomataMetricsRegistry {

    /** Prefix used by the single-argument constructor. */
    public static final String DEFAULT_PREFIX = "com.axonops.regex2dfa";

    private final MetricRegistry registry;
    private final String prefix;

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry target registry
     * @param prefix metric namespace in the registry and in JMX
     * @throws NullPointerException if either argument is null
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
        String fullName = metricName(name);
        // replace rather than fail on a second registration
        registry.remove(fullName);
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    public String prefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
