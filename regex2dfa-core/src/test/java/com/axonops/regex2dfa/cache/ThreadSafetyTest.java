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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrent compilation and matching through the global cache.
 */
class ThreadSafetyTest {

    @BeforeEach
    void setUp() {
        Pattern.resetCache();
    }

    @AfterEach
    void tearDown() {
        Pattern.resetCache();
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentCacheMapAccess_100Threads() throws InterruptedException {
        int threadCount = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        // Pre-populate "existing"
        Pattern.compile("(a|b)*abb");

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    start.await();

                    int op = threadId % 10;
                    if (op < 3) {
                        // 30%: Insert new
                        Pattern.compile("new" + threadId + "(a|b)*");
                    } else if (op < 7) {
                        // 40%: Get (cache hit) and match
                        Pattern p = Pattern.compile("(a|b)*abb");
                        if (!p.matches("ababb") || p.matches("abab")) {
                            errors.incrementAndGet();
                        }
                    } else {
                        // 30%: Statistics while the map changes
                        Pattern.getCacheStatistics();
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
        assertThat(Pattern.getCacheStatistics().currentSize()).isEqualTo(31);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testSameRegexCompiledOnce() throws InterruptedException {
        int threadCount = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        Set<Pattern> instances = ConcurrentHashMap.newKeySet();
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    instances.add(Pattern.compile("a(b|c)+d?"));
                } catch (Exception e) {
                    errors.incrementAndGet();
                }
            });
        }

        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(errors.get()).isZero();
        assertThat(instances).hasSize(1);
        assertThat(Pattern.getCacheStatistics().misses()).isGreaterThanOrEqualTo(1);
        assertThat(Pattern.getCacheStatistics().totalRequests()).isEqualTo(threadCount);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentSimulation() throws InterruptedException {
        Pattern pattern = Pattern.compile("a*b+");
        int threadCount = 20;
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger mismatches = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    for (int n = 0; n < 200; n++) {
                        String input = "a".repeat(threadId) + "b".repeat(n % 3);
                        boolean expected = n % 3 != 0;
                        if (pattern.matches(input) != expected
                            || pattern.simulate(input).accepted() != expected) {
                            mismatches.incrementAndGet();
                        }
                    }
                } finally {
                    done.countDown();
                }
            }).start();
        }

        done.await();
        assertThat(mismatches.get()).isZero();
    }
}
