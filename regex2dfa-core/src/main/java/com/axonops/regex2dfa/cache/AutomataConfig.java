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


package com.axonops.regex2dfa.cache;

import com.axonops.regex2dfa.metrics.AutomataMetricsRegistry;
import com.axonops.regex2dfa.metrics.NoOpMetricsRegistry;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for regex compilation, the compiled-pattern cache and metrics.
 *
 * <h2>Pattern Cache</h2>
 *
 * <p>Compiled patterns are immutable, so the cache hands the same instance to every caller of
 * {@link com.axonops.regex2dfa.api.Pattern#compile(String)} with the same regex. Two eviction
 * strategies keep it bounded:
 *
 * <ol>
 *   <li><b>LRU Eviction</b> - When the cache exceeds {@code maxCacheSize}, least-recently-used
 *       patterns are evicted
 *   <li><b>Idle Eviction</b> - A background thread evicts patterns unused for {@code
 *       idleTimeoutSeconds}
 * </ol>
 *
 * <h2>Resource Limits</h2>
 *
 * <p>Subset construction can produce up to 2^n DFA states for an n-state NFA. Three limits stop a
 * compilation with {@link com.axonops.regex2dfa.api.ResourceLimitException} instead of letting it
 * exhaust the heap:
 *
 * <ul>
 *   <li><b>maxRegexLength</b> - checked before parsing
 *   <li><b>maxNfaStates</b> - checked during Thompson construction
 *   <li><b>maxDfaStates</b> - checked during subset construction
 * </ul>
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 10K cached patterns, 5 min idle timeout, metrics disabled
 * Pattern.setGlobalCache(new PatternCache(AutomataConfig.DEFAULT));
 *
 * // Untrusted input: tight limits, metrics enabled
 * AutomataConfig config = AutomataConfig.builder()
 *     .maxRegexLength(200)
 *     .maxDfaStates(2_000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.automata"))
 *     .build();
 * }</pre>
 *
 * @param cacheEnabled cache compiled patterns keyed by regex text
 * @param maxCacheSize patterns kept before LRU eviction (must be > 0 if cache enabled)
 * @param idleTimeoutSeconds evict patterns unused for this long (must be > 0 if cache enabled)
 * @param evictionScanIntervalSeconds period of the idle eviction scan (must be > 0 if cache
 *     enabled, should be ≤ idleTimeoutSeconds)
 * @param maxRegexLength longest regex accepted by the parser
 * @param maxNfaStates largest NFA Thompson construction may build
 * @param maxDfaStates largest DFA subset construction may build
 * @param metricsRegistry metrics sink (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see PatternCache
 * @see com.axonops.regex2dfa.metrics.MetricNames
 */
public record AutomataConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long idleTimeoutSeconds,
    long evictionScanIntervalSeconds,
    int maxRegexLength,
    int maxNfaStates,
    int maxDfaStates,
    AutomataMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(AutomataConfig.class);

  /** Production defaults. */
  public static final AutomataConfig DEFAULT =
      new AutomataConfig(
          true, // Cache enabled
          10000, // Max 10K cached patterns
          300, // 5 minute idle timeout
          60, // Scan every 60 seconds
          1000, // Regex length limit
          10000, // NFA state limit
          10000, // DFA state limit
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /** Caching disabled; every compile runs the full pipeline. */
  public static final AutomataConfig NO_CACHE =
      new AutomataConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          1000, // Still enforce compilation limits
          10000,
          10000,
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  public AutomataConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    // Compilation limits apply with or without cache
    if (maxRegexLength <= 0) {
      throw new IllegalArgumentException("maxRegexLength must be positive");
    }
    if (maxNfaStates < 2) {
      throw new IllegalArgumentException("maxNfaStates must be at least 2 (smallest Thompson NFA)");
    }
    if (maxDfaStates <= 0) {
      throw new IllegalArgumentException("maxDfaStates must be positive");
    }

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (idleTimeoutSeconds <= 0) {
        throw new IllegalArgumentException(
            "idleTimeoutSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds <= 0) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds must be positive when cache enabled");
      }
      // Valid, but idle patterns outlive their timeout by up to one scan interval
      if (evictionScanIntervalSeconds > idleTimeoutSeconds) {
        logger.warn(
            "Automata: evictionScanIntervalSeconds ({}s) exceeds idleTimeoutSeconds ({}s) - idle patterns may not be evicted promptly",
            evictionScanIntervalSeconds,
            idleTimeoutSeconds);
      }
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * <pre>{@code
   * AutomataConfig config = AutomataConfig.builder()
   *     .maxCacheSize(50_000)
   *     .idleTimeoutSeconds(600)
   *     .build();
   * }</pre>
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration; all fields start with the values of {@link #DEFAULT}. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private long idleTimeoutSeconds = 300;
    private long evictionScanIntervalSeconds = 60;
    private int maxRegexLength = 1000;
    private int maxNfaStates = 10000;
    private int maxDfaStates = 10000;
    private AutomataMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    public Builder idleTimeoutSeconds(long seconds) {
      this.idleTimeoutSeconds = seconds;
      return this;
    }

    public Builder evictionScanIntervalSeconds(long seconds) {
      this.evictionScanIntervalSeconds = seconds;
      return this;
    }

    public Builder maxRegexLength(int length) {
      this.maxRegexLength = length;
      return this;
    }

    public Builder maxNfaStates(int states) {
      this.maxNfaStates = states;
      return this;
    }

    public Builder maxDfaStates(int states) {
      this.maxDfaStates = states;
      return this;
    }

    /**
     * Sets the metrics sink.
     *
     * @param metricsRegistry registry implementation, not null
     * @return this builder
     */
    public Builder metricsRegistry(AutomataMetricsRegistry metricsRegistry) {
      this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public AutomataConfig build() {
      return new AutomataConfig(
          cacheEnabled,
          maxCacheSize,
          idleTimeoutSeconds,
          evictionScanIntervalSeconds,
          maxRegexLength,
          maxNfaStates,
          maxDfaStates,
          metricsRegistry);
    }
  }
}
