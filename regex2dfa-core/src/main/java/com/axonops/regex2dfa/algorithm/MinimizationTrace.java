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

package com.axonops.regex2dfa.algorithm;

import com.axonops.regex2dfa.automaton.Dfa;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Minimization result together with the steps that produced it.
 *
 * @param minimalDfa the minimal automaton, equal to {@link Minimizer#minimize(Dfa)}
 * @param steps trace in execution order
 * @param stateMapping minimal DFA state id to the ids of the input DFA states it merges;
 *        unreachable input states appear in no entry
 * @param statistics input DFA to minimal DFA sizes
 * @since 1.0.0
 */
public record MinimizationTrace(
    Dfa minimalDfa,
    List<PartitionStep> steps,
    SortedMap<Integer, SortedSet<Integer>> stateMapping,
    StageStatistics statistics) {

    public MinimizationTrace {
        Objects.requireNonNull(minimalDfa, "minimalDfa cannot be null");
        Objects.requireNonNull(statistics, "statistics cannot be null");
        steps = List.copyOf(steps);
        TreeMap<Integer, SortedSet<Integer>> copy = new TreeMap<>();
        stateMapping.forEach((id, members) -> copy.put(id, Collections.unmodifiableSortedSet(new TreeSet<>(members))));
        stateMapping = Collections.unmodifiableSortedMap(copy);
    }

    /** Number of blocks in the final partition. */
    public int partitionCount() {
        return stateMapping.size();
    }
}
