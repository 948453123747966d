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

import com.axonops.regex2dfa.api.Pattern;
import com.axonops.regex2dfa.metrics.AutomataMetricsRegistry;
import com.axonops.regex2dfa.metrics.MetricNames;
import com.axonops.regex2dfa.util.RegexHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of compiled patterns keyed by regex text, with dual eviction.
 *
 * <p>Eviction strategies:
 *
 * <ol>
 *   <li>LRU (soft limit): when an insertion takes the cache past {@code maxCacheSize}, the
 *       inserting thread evicts the least recently used entries of a sample
 *   <li>Idle time: a background thread evicts patterns idle beyond {@code idleTimeoutSeconds}
 * </ol>
 *
 * <p>Reads and access-time updates are lock-free. Compiled patterns are immutable, so an evicted
 * pattern stays usable by whoever still holds it.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  /** Upper bound on entries inspected per LRU eviction pass. */
  private static final int LRU_SAMPLE_SIZE = 500;

  private final AutomataConfig config;
  private final ConcurrentHashMap<String, CachedPattern> cache;
  private final IdleEvictionTask evictionTask;

  // Statistics (all atomic, lock-free)
  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);
  private final AtomicLong evictionsIdle = new AtomicLong(0);

  /**
   * Creates a new pattern cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public PatternCache(AutomataConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");

    if (config.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>(Math.min(config.maxCacheSize(), 1024));
      this.evictionTask = new IdleEvictionTask(this, config);
      this.evictionTask.start();

      logger.debug(
          "Automata: Pattern cache initialized - maxSize: {}, idleTimeout: {}s, scanInterval: {}s",
          config.maxCacheSize(),
          config.idleTimeoutSeconds(),
          config.evictionScanIntervalSeconds());

      registerCacheMetrics();
    } else {
      this.cache = null;
      this.evictionTask = null;
      logger.info("Automata: Pattern caching disabled");
    }
  }

  public AutomataConfig getConfig() {
    return config;
  }

  /**
   * Gets or compiles a pattern.
   *
   * <p>Lock-free for cache hits. {@code computeIfAbsent} guarantees that concurrent callers with
   * the same regex compile it once.
   *
   * @param regex regex text, the cache key
   * @param compiler compiles the regex on a miss
   * @return cached or newly compiled pattern
   */
  public Pattern getOrCompile(String regex, Supplier<Pattern> compiler) {
    AutomataMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    CachedPattern cached = cache.get(regex);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      logger.trace("Automata: Cache hit - hash: {}", RegexHasher.hash(regex));
      return cached.pattern();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace("Automata: Cache miss - hash: {}, compiling", RegexHasher.hash(regex));

    // Failed compilations propagate out of computeIfAbsent and leave no entry
    CachedPattern created = cache.computeIfAbsent(regex, k -> new CachedPattern(compiler.get()));

    int currentSize = cache.size();
    if (currentSize > config.maxCacheSize()) {
      evictLRUBatch(currentSize - config.maxCacheSize());
    }
    return created.pattern();
  }

  /**
   * Evicts least-recently-used patterns.
   *
   * <p>Sample-based: only the first {@value #LRU_SAMPLE_SIZE} entries are considered, which keeps
   * the pass O(sample) instead of O(cache).
   */
  private void evictLRUBatch(int toEvict) {
    int actualToEvict = Math.min(toEvict, cache.size() - config.maxCacheSize());
    if (actualToEvict <= 0) {
      return;
    }

    List<Map.Entry<String, CachedPattern>> candidates =
        cache.entrySet().stream()
            .limit(LRU_SAMPLE_SIZE)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(actualToEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<String, CachedPattern> entry : candidates) {
      if (cache.remove(entry.getKey(), entry.getValue())) {
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("Automata: LRU evicting pattern - hash: {}", RegexHasher.hash(entry.getKey()));
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "Automata: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          cache.size(),
          config.maxCacheSize());
    }
  }

  /**
   * Evicts idle patterns (called by the background thread).
   *
   * @return number of patterns evicted
   */
  int evictIdlePatterns() {
    if (!config.cacheEnabled()) {
      return 0;
    }

    long cutoffNanos = System.nanoTime() - (config.idleTimeoutSeconds() * 1_000_000_000L);
    AtomicLong evictedCount = new AtomicLong(0);

    // Non-blocking iteration - other threads can access cache concurrently
    cache
        .entrySet()
        .removeIf(
            entry -> {
              if (entry.getValue().lastAccessTimeNanos() < cutoffNanos) {
                logger.trace(
                    "Automata: Idle evicting pattern - hash: {}", RegexHasher.hash(entry.getKey()));
                evictionsIdle.incrementAndGet();
                config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_IDLE);
                evictedCount.incrementAndGet();
                return true;
              }
              return false;
            });

    int evicted = (int) evictedCount.get();
    if (evicted > 0) {
      logger.debug(
          "Automata: Idle eviction completed - evicted: {}, cacheSize: {}", evicted, cache.size());
    }
    return evicted;
  }

  /** Number of cached patterns, 0 when caching is disabled. */
  public int size() {
    return config.cacheEnabled() ? cache.size() : 0;
  }

  /** Tests whether {@code regex} is currently cached. */
  public boolean contains(String regex) {
    return config.cacheEnabled() && cache.containsKey(regex);
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        evictionsIdle.get(),
        size(),
        config.maxCacheSize(),
        cachedStateCount());
  }

  private long cachedStateCount() {
    if (!config.cacheEnabled()) {
      return 0;
    }
    long states = 0;
    for (CachedPattern cached : cache.values()) {
      states += cached.pattern().minimalDfa().stateCount();
    }
    return states;
  }

  /** Removes every cached pattern. Patterns already handed out stay valid. */
  public void clear() {
    if (!config.cacheEnabled()) {
      return;
    }
    logger.debug("Automata: Clearing cache - {} cached patterns", cache.size());
    cache.clear();
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    evictionsIdle.set(0);
    logger.trace("Automata: Cache statistics reset");
  }

  /** Full reset for testing (clears cache and resets statistics). */
  public void reset() {
    clear();
    resetStatistics();
  }

  /** Shuts down the cache (stops eviction thread, clears cache, unregisters gauges). */
  public void shutdown() {
    logger.info("Automata: Shutting down cache");

    if (evictionTask != null) {
      evictionTask.stop();
      config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
      config.metricsRegistry().removeGauge(MetricNames.CACHE_STATES_COUNT);
    }
    clear();
  }

  boolean isEvictionThreadRunning() {
    return evictionTask != null && evictionTask.isRunning();
  }

  private void registerCacheMetrics() {
    AutomataMetricsRegistry metrics = config.metricsRegistry();
    metrics.registerGauge(MetricNames.CACHE_PATTERNS_COUNT, cache::size);
    metrics.registerGauge(MetricNames.CACHE_STATES_COUNT, this::cachedStateCount);
    logger.debug("Automata: Metrics registered - cache gauges");
  }

  /**
   * Cached pattern with atomic access time tracking.
   *
   * <p>Uses nanoTime for efficient timestamp comparison without object allocation.
   */
  private static final class CachedPattern {
    private final Pattern pattern;
    private final AtomicLong lastAccessTimeNanos;

    CachedPattern(Pattern pattern) {
      this.pattern = pattern;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    Pattern pattern() {
      return pattern;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
