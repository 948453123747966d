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

import com.axonops.regex2dfa.api.Pattern;
import com.axonops.regex2dfa.api.RegexParseException;
import com.axonops.regex2dfa.cache.AutomataConfig;
import com.axonops.regex2dfa.cache.PatternCache;
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
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;
    private PatternCache originalCache;
    private PatternCache testCache;

    @BeforeEach
    void setup() {
        originalCache = Pattern.getGlobalCache();
        registry = new MetricRegistry();

        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
        if (testCache != null) {
            testCache.shutdown();
        }
        Pattern.setGlobalCache(originalCache);
    }

    private void installCache(AutomataConfig config) {
        testCache = new PatternCache(config);
        Pattern.setGlobalCache(testCache);
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        installCache(AutomataMetricsConfig.withMetrics(registry, "com.test.jmx", false));

        Pattern.compile("(a|b)*abb");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        Set<ObjectName> mbeans = mBeanServer.queryNames(
            new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
        );

        assertThat(mbeans)
            .as("JMX MBeans should be registered for automata metrics")
            .hasSizeGreaterThan(5);

        boolean foundCacheSizeGauge = mbeans.stream()
            .anyMatch(name -> name.toString().contains("cache.patterns.current.count") && name.toString().contains("type=gauges"));

        boolean foundCompiledCounter = mbeans.stream()
            .anyMatch(name -> name.toString().contains("patterns.compiled.total.count") && name.toString().contains("type=counters"));

        boolean foundStageTimer = mbeans.stream()
            .anyMatch(name -> name.toString().contains("stages.dfa.latency") && name.toString().contains("type=timers"));

        assertThat(foundCacheSizeGauge)
            .as("cache.patterns.current.count gauge should be in JMX")
            .isTrue();

        assertThat(foundCompiledCounter)
            .as("patterns.compiled.total.count counter should be in JMX")
            .isTrue();

        assertThat(foundStageTimer)
            .as("stages.dfa.latency timer should be in JMX")
            .isTrue();
    }

    @Test
    void testJmxGaugeReadable() throws Exception {
        installCache(AutomataMetricsConfig.withMetrics(registry, "jmx.readable.test", false));

        Pattern.compile("a");
        Pattern.compile("a|b");
        Pattern.compile("(a|b)*abb");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        ObjectName cacheSizeName = new ObjectName("metrics:name=jmx.readable.test.cache.patterns.current.count,type=gauges");
        assertThat(mBeanServer.isRegistered(cacheSizeName))
            .as("cache.patterns.current.count gauge should be registered in JMX")
            .isTrue();
        assertThat(((Number) mBeanServer.getAttribute(cacheSizeName, "Value")).intValue())
            .as("Cache size via JMX should reflect actual cache state (3 patterns)")
            .isEqualTo(3);

        // minimal DFAs: "a" 2 states, "a|b" 2 states, "(a|b)*abb" 4 states
        ObjectName statesName = new ObjectName("metrics:name=jmx.readable.test.cache.states.current.count,type=gauges");
        assertThat(((Number) mBeanServer.getAttribute(statesName, "Value")).longValue())
            .isEqualTo(8);
    }

    @Test
    void testJmxTimerStatistics() throws Exception {
        installCache(AutomataMetricsConfig.withMetrics(registry, "jmx.timer.test", false));

        for (int i = 0; i < 50; i++) {
            Pattern.compile("a" + i + "(b|c)*");
        }

        assertThat(registry.getTimers().keySet())
            .as("Timer should exist in MetricRegistry")
            .contains("jmx.timer.test.patterns.compilation.latency");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName timerName = new ObjectName("metrics:name=jmx.timer.test.patterns.compilation.latency,type=timers");

        assertThat(mBeanServer.isRegistered(timerName))
            .as("Compilation latency timer should be in JMX")
            .isTrue();

        long countValue = ((Number) mBeanServer.getAttribute(timerName, "Count")).longValue();
        assertThat(countValue)
            .as("Timer count via JMX")
            .isEqualTo(50);

        assertThat(mBeanServer.getAttribute(timerName, "Min")).as("Timer min attribute exists").isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "Max")).as("Timer max attribute exists").isNotNull();
        assertThat(((Number) mBeanServer.getAttribute(timerName, "Mean")).doubleValue())
            .as("Timer mean via JMX")
            .isGreaterThan(0.0);
        assertThat(mBeanServer.getAttribute(timerName, "99thPercentile")).isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "OneMinuteRate"))
            .as("Timer should provide 1-minute rate via JMX")
            .isNotNull();
    }

    @Test
    void testAllMetricTypesInJmx() throws Exception {
        installCache(AutomataMetricsConfig.withMetrics(registry, "jmx.all.test", false));

        Pattern p = Pattern.compile("a*b+");
        Pattern.compile("a*b+"); // cache hit
        p.matches("aabb");
        p.matches("ba");

        assertThatThrownBy(() -> Pattern.compile("(a"))
            .isInstanceOf(RegexParseException.class);

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        ObjectName compiledCounter = new ObjectName("metrics:name=jmx.all.test.patterns.compiled.total.count,type=counters");
        assertThat(((Number) mBeanServer.getAttribute(compiledCounter, "Count")).longValue()).isEqualTo(1);

        ObjectName hitsCounter = new ObjectName("metrics:name=jmx.all.test.patterns.cache.hits.total.count,type=counters");
        assertThat(((Number) mBeanServer.getAttribute(hitsCounter, "Count")).longValue()).isEqualTo(1);

        ObjectName acceptedCounter = new ObjectName("metrics:name=jmx.all.test.simulation.accepted.total.count,type=counters");
        assertThat(((Number) mBeanServer.getAttribute(acceptedCounter, "Count")).longValue()).isEqualTo(1);

        ObjectName rejectedCounter = new ObjectName("metrics:name=jmx.all.test.simulation.rejected.total.count,type=counters");
        assertThat(((Number) mBeanServer.getAttribute(rejectedCounter, "Count")).longValue()).isEqualTo(1);

        ObjectName parseErrors = new ObjectName("metrics:name=jmx.all.test.errors.parse.total.count,type=counters");
        assertThat(((Number) mBeanServer.getAttribute(parseErrors, "Count")).longValue()).isEqualTo(1);

        ObjectName simulationTimer = new ObjectName("metrics:name=jmx.all.test.simulation.latency,type=timers");
        assertThat(((Number) mBeanServer.getAttribute(simulationTimer, "Count")).longValue()).isEqualTo(2);

        ObjectName cacheSize = new ObjectName("metrics:name=jmx.all.test.cache.patterns.current.count,type=gauges");
        assertThat(mBeanServer.isRegistered(cacheSize)).isTrue();
    }

    @Test
    void testJmxCounterIncrementsCorrectly() throws Exception {
        installCache(AutomataMetricsConfig.withMetrics(registry, "jmx.increment.test", false));

        Pattern.compile("initial");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName compiledCounter = new ObjectName("metrics:name=jmx.increment.test.patterns.compiled.total.count,type=counters");

        long countBefore = ((Number) mBeanServer.getAttribute(compiledCounter, "Count")).longValue();
        assertThat(countBefore).isEqualTo(1);

        for (int i = 0; i < 5; i++) {
            Pattern.compile("inc" + i);
        }

        long countAfter = ((Number) mBeanServer.getAttribute(compiledCounter, "Count")).longValue();
        assertThat(countAfter - countBefore)
            .as("Counter should have incremented by 5 via JMX")
            .isEqualTo(5);
    }

    @Test
    void testShutdownRemovesCacheGauges() throws Exception {
        installCache(AutomataMetricsConfig.withMetrics(registry, "jmx.shutdown.test", false));
        Pattern.compile("a");

        testCache.shutdown();
        testCache = null;

        assertThat(registry.getGauges().keySet())
            .doesNotContain("jmx.shutdown.test.cache.patterns.current.count",
                "jmx.shutdown.test.cache.states.current.count");
    }
}
