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

/**
 * Metric name constants for automata compilation, caching and simulation.
 *
 * <h2>Compilation pipeline</h2>
 *
 * <p>{@link com.axonops.regex2dfa.api.Pattern#compile(String)} looks the regex up in the pattern
 * cache and, on a miss, runs the four stages:
 *
 * <ol>
 *   <li><b>Parse</b> - infix regex to postfix
 *   <li><b>NFA</b> - Thompson construction
 *   <li><b>DFA</b> - subset construction
 *   <li><b>Minimize</b> - partition refinement
 * </ol>
 *
 * <p>Each stage has its own latency timer; {@link #PATTERNS_COMPILATION_LATENCY} covers all four.
 * Subset construction is worst-case exponential, so {@link #STAGE_DFA_LATENCY} and
 * {@link #ERRORS_RESOURCE_LIMIT} are the first places to look when compilation slows down.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * AutomataConfig config = AutomataMetricsConfig.withMetrics(registry, "myapp.automata", true);
 * Pattern.setGlobalCache(new PatternCache(config));
 *
 * Pattern.compile("(a|b)*abb").matches("aabb");
 *
 * Counter compilations = registry.counter(
 *     MetricRegistry.name("myapp.automata", MetricNames.PATTERNS_COMPILED));
 * }</pre>
 *
 * @since 1.0.0
 * @see com.axonops.regex2dfa.cache.PatternCache
 * @see com.axonops.regex2dfa.api.Pattern
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation Metrics
  // ========================================

  /**
   * Total patterns compiled.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> Each time the full pipeline completes for a regex
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Total cache hits.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> hits / (hits + misses) is the cache hit rate
   */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /**
   * Total cache misses (compilation required, or cache disabled).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /**
   * End-to-end compilation latency, regex to minimal DFA.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  // ========================================
  // Stage Metrics
  // ========================================

  /** Infix-to-postfix latency. Timer (nanoseconds). */
  public static final String STAGE_PARSE_LATENCY = "stages.parse.latency";

  /** Thompson construction latency. Timer (nanoseconds). */
  public static final String STAGE_NFA_LATENCY = "stages.nfa.latency";

  /**
   * Subset construction latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Interpretation:</b> Grows with the number of reachable NFA subsets; long tails point at
   * regexes whose DFA is close to the configured {@code maxDfaStates}
   */
  public static final String STAGE_DFA_LATENCY = "stages.dfa.latency";

  /** Partition refinement latency. Timer (nanoseconds). */
  public static final String STAGE_MINIMIZE_LATENCY = "stages.minimize.latency";

  // ========================================
  // Cache Metrics
  // ========================================

  /**
   * Current number of patterns in cache.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  /**
   * Current number of minimal DFA states held by cached patterns.
   *
   * <p><b>Type:</b> Gauge (count)
   *
   * <p><b>Interpretation:</b> Rough proxy for cache heap footprint
   */
  public static final String CACHE_STATES_COUNT = "cache.states.current.count";

  /**
   * Patterns evicted because the cache grew past {@code maxCacheSize}.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Sustained growth means the cache is undersized for the workload
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /**
   * Patterns evicted after {@code idleTimeoutSeconds} without access.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CACHE_EVICTIONS_IDLE = "cache.evictions.idle.total.count";

  // ========================================
  // Simulation Metrics
  // ========================================

  /** Total simulations run through a {@code Pattern}. Counter. */
  public static final String SIMULATION_OPERATIONS = "simulation.operations.total.count";

  /** Simulations that accepted their input. Counter. */
  public static final String SIMULATION_ACCEPTED = "simulation.accepted.total.count";

  /** Simulations that rejected their input, stuck runs included. Counter. */
  public static final String SIMULATION_REJECTED = "simulation.rejected.total.count";

  /**
   * Simulation latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> For {@code matches} and {@code simulate}; traced runs are slower since
   * they allocate one record per symbol
   */
  public static final String SIMULATION_LATENCY = "simulation.latency";

  // ========================================
  // Error Metrics
  // ========================================

  /** Regexes rejected by the parser. Counter. */
  public static final String ERRORS_PARSE = "errors.parse.total.count";

  /**
   * Postfix sequences the NFA builder could not assemble.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Should be zero; parser output always builds
   */
  public static final String ERRORS_BUILD = "errors.build.total.count";

  /** Malformed export records rejected by {@link com.axonops.regex2dfa.api.Pattern#importAutomaton}. Counter. */
  public static final String ERRORS_CONVERSION = "errors.conversion.total.count";

  /**
   * Compilations stopped by {@code maxRegexLength}, {@code maxNfaStates} or {@code maxDfaStates}.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_RESOURCE_LIMIT = "errors.resource_limit.total.count";
}
