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


package com.axonops.regex2dfa.api;

import com.axonops.regex2dfa.algorithm.DeterminizationTrace;
import com.axonops.regex2dfa.algorithm.Determinizer;
import com.axonops.regex2dfa.algorithm.MinimizationTrace;
import com.axonops.regex2dfa.algorithm.Minimizer;
import com.axonops.regex2dfa.algorithm.NfaBuilder;
import com.axonops.regex2dfa.algorithm.PostfixExpression;
import com.axonops.regex2dfa.algorithm.RegexParser;
import com.axonops.regex2dfa.algorithm.Simulator;
import com.axonops.regex2dfa.automaton.Automaton;
import com.axonops.regex2dfa.automaton.AutomatonExport;
import com.axonops.regex2dfa.automaton.AutomatonImporter;
import com.axonops.regex2dfa.automaton.AutomatonKind;
import com.axonops.regex2dfa.automaton.Dfa;
import com.axonops.regex2dfa.automaton.Nfa;
import com.axonops.regex2dfa.cache.AutomataConfig;
import com.axonops.regex2dfa.cache.CacheStatistics;
import com.axonops.regex2dfa.cache.PatternCache;
import com.axonops.regex2dfa.metrics.AutomataMetricsRegistry;
import com.axonops.regex2dfa.metrics.MetricNames;
import com.axonops.regex2dfa.util.RegexHasher;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A regex compiled to its minimal DFA, with every intermediate stage kept.
 *
 * <p>Compilation runs parse, Thompson construction, subset construction and minimization in that
 * order. Each stage produces a new immutable automaton, so a {@code Pattern} is immutable and safe
 * to share between threads. {@link #compile(String)} goes through the global {@link PatternCache};
 * callers compiling the same regex get the same instance.
 *
 * <pre>{@code
 * Pattern p = Pattern.compile("(a|b)*abb");
 * p.matches("aabb");                          // true
 * p.minimalDfa().stateCount();                // 4
 * p.simulate("ab", AutomatonKind.NFA).steps() // replayable trace
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Pattern {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    // Global pattern cache (mutable for testing only)
    private static volatile PatternCache cache = new PatternCache(AutomataConfig.DEFAULT);

    /**
     * Gets the global pattern cache (for internal use).
     */
    public static PatternCache getGlobalCache() {
        return cache;
    }

    private final PostfixExpression postfix;
    private final Nfa nfa;
    private final Dfa dfa;
    private final Dfa minimalDfa;
    private final AutomataMetricsRegistry metrics;

    private Pattern(PostfixExpression postfix, Nfa nfa, Dfa dfa, Dfa minimalDfa, AutomataMetricsRegistry metrics) {
        this.postfix = postfix;
        this.nfa = nfa;
        this.dfa = dfa;
        this.minimalDfa = minimalDfa;
        this.metrics = metrics;
    }

    /**
     * Compiles {@code regex}, reusing a cached pattern when there is one.
     *
     * @param regex infix regex; the empty string matches only the empty input
     * @return compiled pattern
     * @throws RegexParseException if the regex is malformed
     * @throws ResourceLimitException if a configured limit is exceeded
     */
    public static Pattern compile(String regex) {
        Objects.requireNonNull(regex, "regex cannot be null");
        PatternCache current = cache;
        return current.getOrCompile(regex, () -> doCompile(regex, current.getConfig()));
    }

    /**
     * Compiles {@code regex} without looking at or filling the cache. Limits and metrics still
     * come from the global cache configuration.
     */
    public static Pattern compileWithoutCache(String regex) {
        Objects.requireNonNull(regex, "regex cannot be null");
        return doCompile(regex, cache.getConfig());
    }

    /**
     * Runs the pipeline.
     */
    private static Pattern doCompile(String regex, AutomataConfig config) {
        AutomataMetricsRegistry metrics = config.metricsRegistry();
        String hash = RegexHasher.hash(regex);
        long startNanos = System.nanoTime();

        try {
            long stageStart = System.nanoTime();
            PostfixExpression postfix = new RegexParser(config.maxRegexLength()).parse(regex);
            metrics.recordTimer(MetricNames.STAGE_PARSE_LATENCY, System.nanoTime() - stageStart);

            stageStart = System.nanoTime();
            Nfa nfa = new NfaBuilder(config.maxNfaStates()).build(postfix);
            metrics.recordTimer(MetricNames.STAGE_NFA_LATENCY, System.nanoTime() - stageStart);

            stageStart = System.nanoTime();
            Dfa dfa = new Determinizer(config.maxDfaStates()).determinize(nfa);
            metrics.recordTimer(MetricNames.STAGE_DFA_LATENCY, System.nanoTime() - stageStart);

            stageStart = System.nanoTime();
            Dfa minimalDfa = new Minimizer().minimize(dfa);
            metrics.recordTimer(MetricNames.STAGE_MINIMIZE_LATENCY, System.nanoTime() - stageStart);

            long durationNanos = System.nanoTime() - startNanos;
            metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
            metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);

            logger.trace("Automata: Pattern compiled - hash: {}, length: {}, nfaStates: {}, dfaStates: {}, minDfaStates: {}, timeNs: {}",
                hash, regex.length(), nfa.stateCount(), dfa.stateCount(), minimalDfa.stateCount(), durationNanos);
            return new Pattern(postfix, nfa, dfa, minimalDfa, metrics);

        } catch (AutomatonException e) {
            metrics.incrementCounter(errorMetric(e));
            logger.debug("Automata: Pattern compilation failed - hash: {}, error: {}", hash, e.getMessage());
            throw e;
        }
    }

    /**
     * Rebuilds an automaton from an export record, counting a malformed record under the
     * conversion error metric of the global cache configuration.
     *
     * @param export export record, as produced by {@link Automaton#export()}
     * @return an {@link Nfa} or {@link Dfa} of the exported kind
     * @throws ConversionException if the record is malformed
     */
    public static Automaton importAutomaton(AutomatonExport export) {
        Objects.requireNonNull(export, "export cannot be null");
        AutomataMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        try {
            return AutomatonImporter.fromExport(export);
        } catch (AutomatonException e) {
            metrics.incrementCounter(errorMetric(e));
            logger.debug("Automata: Automaton import failed - kind: {}, error: {}", export.kind().label(), e.getMessage());
            throw e;
        }
    }

    // the hierarchy is sealed; ConversionException is the one subtype left
    private static String errorMetric(AutomatonException e) {
        if (e instanceof RegexParseException) {
            return MetricNames.ERRORS_PARSE;
        }
        if (e instanceof AutomatonBuildException) {
            return MetricNames.ERRORS_BUILD;
        }
        if (e instanceof ResourceLimitException) {
            return MetricNames.ERRORS_RESOURCE_LIMIT;
        }
        return MetricNames.ERRORS_CONVERSION;
    }

    /** The regex this pattern was compiled from. */
    public String regex() {
        return postfix.source();
    }

    public PostfixExpression postfix() {
        return postfix;
    }

    public Nfa nfa() {
        return nfa;
    }

    public Dfa dfa() {
        return dfa;
    }

    public Dfa minimalDfa() {
        return minimalDfa;
    }

    /**
     * The automaton of one pipeline stage.
     *
     * @param kind stage to return
     * @return the NFA, DFA or minimal DFA of this pattern
     */
    public Automaton automaton(AutomatonKind kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        switch (kind) {
            case NFA:
                return nfa;
            case DFA:
                return dfa;
            default:
                return minimalDfa;
        }
    }

    /**
     * Tests whether the whole of {@code input} is in the language of this pattern.
     *
     * @param input symbols to match; characters outside the alphabet cause a rejection
     * @return true on acceptance
     */
    public boolean matches(String input) {
        Objects.requireNonNull(input, "input cannot be null");
        long startNanos = System.nanoTime();
        boolean accepted = Simulator.accepts(minimalDfa, input);
        recordSimulation(accepted, System.nanoTime() - startNanos);
        return accepted;
    }

    /** Simulates {@code input} on the minimal DFA. */
    public SimulationResult simulate(String input) {
        return simulate(input, AutomatonKind.MIN_DFA);
    }

    /**
     * Simulates {@code input} on the automaton of the given stage, recording the full trace.
     *
     * @param input symbols to consume
     * @param kind stage to run
     * @return acceptance and trace
     */
    public SimulationResult simulate(String input, AutomatonKind kind) {
        Objects.requireNonNull(input, "input cannot be null");
        long startNanos = System.nanoTime();
        SimulationResult result = Simulator.run(automaton(kind), input);
        recordSimulation(result.accepted(), System.nanoTime() - startNanos);
        return result;
    }

    /**
     * Replays subset construction on this pattern's NFA with a step trace. The resulting DFA
     * equals {@link #dfa()}.
     */
    public DeterminizationTrace traceDeterminization() {
        return new Determinizer(dfa.stateCount()).determinizeWithSteps(nfa);
    }

    /**
     * Replays minimization of this pattern's DFA with a step trace and the mapping from minimal
     * states to the DFA states they merge. The resulting automaton equals {@link #minimalDfa()}.
     */
    public MinimizationTrace traceMinimization() {
        return new Minimizer().minimizeWithSteps(dfa);
    }

    // metrics go to the registry this pattern was compiled under
    private void recordSimulation(boolean accepted, long durationNanos) {
        metrics.incrementCounter(MetricNames.SIMULATION_OPERATIONS);
        metrics.incrementCounter(accepted ? MetricNames.SIMULATION_ACCEPTED : MetricNames.SIMULATION_REJECTED);
        metrics.recordTimer(MetricNames.SIMULATION_LATENCY, durationNanos);
    }

    @Override
    public String toString() {
        return "Pattern[regex=" + postfix.source()
            + ", postfix=" + postfix.postfix()
            + ", states=" + nfa.stateCount() + "/" + dfa.stateCount() + "/" + minimalDfa.stateCount() + "]";
    }

    /**
     * Gets cache statistics (for monitoring).
     */
    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the pattern cache (for testing/maintenance).
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Fully resets the cache including statistics (for testing only).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Sets a new global cache (for testing only).
     *
     * <p>The previous cache is not shut down; callers that replace it own its lifecycle.
     *
     * @param newCache the new cache to use globally
     */
    public static void setGlobalCache(PatternCache newCache) {
        cache = Objects.requireNonNull(newCache, "newCache cannot be null");
    }

    /**
     * Gets the current cache configuration.
     *
     * @return the current AutomataConfig
     */
    public static AutomataConfig getCacheConfig() {
        return cache.getConfig();
    }
}
