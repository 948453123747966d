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

import com.axonops.regex2dfa.api.ConversionException;
import com.axonops.regex2dfa.api.Pattern;
import com.axonops.regex2dfa.api.RegexParseException;
import com.axonops.regex2dfa.api.ResourceLimitException;
import com.axonops.regex2dfa.automaton.AutomatonExport;
import com.axonops.regex2dfa.automaton.AutomatonKind;
import com.axonops.regex2dfa.automaton.TransitionRecord;
import com.axonops.regex2dfa.cache.PatternCache;
import com.axonops.regex2dfa.test.TestUtils;
import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during operations.
 *
 * Uses Pattern.setGlobalCache() to inject a test cache with Dropwizard metrics,
 * then performs real operations and verifies metrics are updated correctly.
 */
class MetricsIntegrationTest {

    private MetricRegistry registry;
    private PatternCache originalCache;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        originalCache = TestUtils.replaceGlobalCacheWithMetrics(registry, "test.automata");
    }

    @AfterEach
    void cleanup() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    @Test
    void testPatternCompilationMetrics() {
        Pattern.compile("(a|b)*abb");

        Counter compiled = registry.counter("test.automata.patterns.compiled.total.count");
        assertThat(compiled.getCount()).isEqualTo(1);

        Timer compilationTime = registry.timer("test.automata.patterns.compilation.latency");
        assertThat(compilationTime.getCount()).isEqualTo(1);
        assertThat(compilationTime.getSnapshot().getMean()).isGreaterThan(0);

        Pattern.compile("a*b+");

        assertThat(compiled.getCount()).isEqualTo(2);
        assertThat(compilationTime.getCount()).isEqualTo(2);
    }

    @Test
    void testStageTimers() {
        Pattern.compile("a(b|c)+d?");

        for (String stage : new String[] {
            MetricNames.STAGE_PARSE_LATENCY,
            MetricNames.STAGE_NFA_LATENCY,
            MetricNames.STAGE_DFA_LATENCY,
            MetricNames.STAGE_MINIMIZE_LATENCY}) {
            assertThat(registry.timer("test.automata." + stage).getCount()).as(stage).isEqualTo(1);
        }
    }

    @Test
    void testCacheHitMissMetrics() {
        Pattern.compile("a|b");

        Counter misses = registry.counter("test.automata.patterns.cache.misses.total.count");
        Counter hits = registry.counter("test.automata.patterns.cache.hits.total.count");

        assertThat(misses.getCount()).isEqualTo(1);
        assertThat(hits.getCount()).isEqualTo(0);

        Pattern.compile("a|b");

        assertThat(misses.getCount()).isEqualTo(1);
        assertThat(hits.getCount()).isEqualTo(1);

        Pattern.compile("a|c");

        assertThat(misses.getCount()).isEqualTo(2);
        // compiled once per distinct regex
        assertThat(registry.counter("test.automata.patterns.compiled.total.count").getCount()).isEqualTo(2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCacheGauges() {
        Pattern.compile("a");
        Pattern.compile("(a|b)*abb");

        Gauge<Number> patterns = registry.getGauges().get("test.automata.cache.patterns.current.count");
        Gauge<Number> states = registry.getGauges().get("test.automata.cache.states.current.count");

        assertThat(patterns.getValue().intValue()).isEqualTo(2);
        assertThat(states.getValue().longValue()).isEqualTo(6);

        Pattern.clearCache();

        assertThat(patterns.getValue().intValue()).isZero();
        assertThat(states.getValue().longValue()).isZero();
    }

    @Test
    void testSimulationMetrics() {
        Pattern pattern = Pattern.compile("a*b+");

        pattern.matches("aabb");
        pattern.matches("ba");
        pattern.simulate("b", AutomatonKind.NFA);

        assertThat(registry.counter("test.automata.simulation.operations.total.count").getCount()).isEqualTo(3);
        assertThat(registry.counter("test.automata.simulation.accepted.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.automata.simulation.rejected.total.count").getCount()).isEqualTo(1);
        assertThat(registry.timer("test.automata.simulation.latency").getCount()).isEqualTo(3);
    }

    @Test
    void testSimulationMetricsStayWithCompilingRegistry() {
        Pattern pattern = Pattern.compile("a*b+");

        MetricRegistry other = new MetricRegistry();
        PatternCache compilingCache = TestUtils.replaceGlobalCacheWithMetrics(other, "other.automata");
        try {
            pattern.matches("ab");
            pattern.simulate("a");
        } finally {
            TestUtils.restoreGlobalCache(compilingCache);
        }

        assertThat(registry.counter("test.automata.simulation.operations.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.automata.simulation.accepted.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.automata.simulation.rejected.total.count").getCount()).isEqualTo(1);
        assertThat(other.getCounters()).isEmpty();
        assertThat(other.getTimers()).isEmpty();
    }

    @Test
    void testConversionErrorMetrics() {
        AutomatonExport dangling = new AutomatonExport(AutomatonKind.DFA,
            List.of(0, 1), List.of('a'), 0, List.of(1), List.of(new TransitionRecord(0, 'a', 7)));

        assertThatThrownBy(() -> Pattern.importAutomaton(dangling))
            .isInstanceOf(ConversionException.class)
            .hasMessageContaining("target 7 is not a declared state");

        assertThat(registry.counter("test.automata." + MetricNames.ERRORS_CONVERSION).getCount()).isEqualTo(1);
        assertThat(registry.counter("test.automata." + MetricNames.ERRORS_PARSE).getCount()).isZero();

        Pattern.importAutomaton(Pattern.compile("a|b").minimalDfa().export());

        assertThat(registry.counter("test.automata." + MetricNames.ERRORS_CONVERSION).getCount()).isEqualTo(1);
    }

    @Test
    void testErrorMetrics() {
        assertThatThrownBy(() -> Pattern.compile("(a"))
            .isInstanceOf(RegexParseException.class);
        assertThatThrownBy(() -> Pattern.compile("a|"))
            .isInstanceOf(RegexParseException.class);

        assertThat(registry.counter("test.automata.errors.parse.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.automata.patterns.compiled.total.count").getCount()).isZero();
    }

    @Test
    void testResourceLimitMetrics() {
        MetricRegistry limited = new MetricRegistry();
        Pattern.getGlobalCache().shutdown();
        Pattern.setGlobalCache(new PatternCache(TestUtils.testConfigWithMetrics(limited, "limited")
            .maxRegexLength(4)
            .build()));

        assertThatThrownBy(() -> Pattern.compile("abcde"))
            .isInstanceOf(ResourceLimitException.class);

        assertThat(limited.counter("limited.errors.resource_limit.total.count").getCount()).isEqualTo(1);
        assertThat(limited.counter("limited.errors.parse.total.count").getCount()).isZero();
    }

    @Test
    void testGaugesRemovedOnShutdown() {
        Pattern.compile("a");
        assertThat(registry.getGauges()).containsKey("test.automata.cache.patterns.current.count");

        Pattern.getGlobalCache().shutdown();

        assertThat(registry.getGauges()).doesNotContainKey("test.automata.cache.patterns.current.count");
        assertThat(registry.getGauges()).doesNotContainKey("test.automata.cache.states.current.count");
    }

    @Test
    void testNoOpRegistryIgnoresEverything() {
        AutomataMetricsRegistry noOp = NoOpMetricsRegistry.INSTANCE;

        noOp.incrementCounter(MetricNames.PATTERNS_COMPILED);
        noOp.incrementCounter(MetricNames.PATTERNS_COMPILED, 5);
        noOp.recordTimer(MetricNames.SIMULATION_LATENCY, 100);
        noOp.registerGauge(MetricNames.CACHE_PATTERNS_COUNT, () -> 1);
        noOp.removeGauge(MetricNames.CACHE_PATTERNS_COUNT);

        assertThat(registry.getMetrics().keySet()).noneMatch(name -> name.contains("patterns.compiled"));
    }

    @Test
    void testAdapterNaming() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry);

        adapter.incrementCounter(MetricNames.CACHE_EVICTIONS_LRU, 3);

        assertThat(adapter.prefix()).isEqualTo(DropwizardMetricsAdapter.DEFAULT_PREFIX);
        assertThat(registry.counter("com.axonops.regex2dfa.cache.evictions.lru.total.count").getCount()).isEqualTo(3);
    }
}
