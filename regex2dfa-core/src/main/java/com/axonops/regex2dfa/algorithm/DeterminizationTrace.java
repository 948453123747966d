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
import com.axonops.regex2dfa.automaton.DfaState;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Subset construction result together with the steps that produced it.
 *
 * @param dfa the constructed automaton, equal to {@link Determinizer#determinize(com.axonops.regex2dfa.automaton.Nfa)}
 * @param steps trace in execution order
 * @param statistics NFA to DFA sizes
 * @since 1.0.0
 */
public record DeterminizationTrace(Dfa dfa, List<SubsetStep> steps, StageStatistics statistics) {

    public DeterminizationTrace {
        Objects.requireNonNull(dfa, "dfa cannot be null");
        Objects.requireNonNull(statistics, "statistics cannot be null");
        steps = List.copyOf(steps);
    }

    /**
     * NFA states each DFA state stands for.
     *
     * @return DFA state id to NFA state ids, ascending by DFA id
     */
    public SortedMap<Integer, SortedSet<Integer>> stateMapping() {
        TreeMap<Integer, SortedSet<Integer>> mapping = new TreeMap<>();
        for (DfaState state : dfa.states()) {
            mapping.put(state.id(), state.originNfaIds());
        }
        return Collections.unmodifiableSortedMap(mapping);
    }
}
