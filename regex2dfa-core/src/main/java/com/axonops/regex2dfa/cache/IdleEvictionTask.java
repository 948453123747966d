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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background thread that periodically evicts idle patterns from the cache.
 *
 * <p>Runs as a low-priority daemon thread so it never keeps the JVM alive or competes with
 * compilation.
 *
 * @since 1.0.0
 */
final class IdleEvictionTask {
  private static final Logger logger = LoggerFactory.getLogger(IdleEvictionTask.class);

  private final PatternCache cache;
  private final AutomataConfig config;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile Thread thread;

  IdleEvictionTask(PatternCache cache, AutomataConfig config) {
    this.cache = cache;
    this.config = config;
  }

  /** Starts the eviction thread; a second call is a no-op. */
  void start() {
    if (running.compareAndSet(false, true)) {
      thread = new Thread(this::run, "Automata-IdleEviction");
      thread.setDaemon(true);
      thread.setPriority(Thread.MIN_PRIORITY);
      thread.start();

      logger.info(
          "Automata: Idle eviction thread started - interval: {}s",
          config.evictionScanIntervalSeconds());
    }
  }

  /** Stops the eviction thread, waiting up to 5 seconds for it to exit. */
  void stop() {
    if (running.compareAndSet(true, false)) {
      logger.info("Automata: Stopping idle eviction thread");

      Thread t = thread;
      if (t != null) {
        t.interrupt();
        try {
          t.join(5000);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }

      logger.info("Automata: Idle eviction thread stopped");
    }
  }

  boolean isRunning() {
    return running.get();
  }

  private void run() {
    logger.debug("Automata: Idle eviction thread running");
    long intervalMs = config.evictionScanIntervalSeconds() * 1000;

    while (running.get()) {
      try {
        Thread.sleep(intervalMs);
        int evicted = cache.evictIdlePatterns();
        logger.debug("Automata: Idle eviction scan complete - evicted: {}", evicted);
      } catch (InterruptedException e) {
        logger.debug("Automata: Idle eviction thread interrupted");
        break;
      } catch (RuntimeException e) {
        // Continue running despite errors
        logger.error("Automata: Error in idle eviction thread", e);
      }
    }

    logger.debug("Automata: Idle eviction thread exiting");
  }
}
