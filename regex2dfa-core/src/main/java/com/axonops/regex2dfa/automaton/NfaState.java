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

package com.axonops.regex2dfa.automaton;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable state of an {@link Nfa}.
 *
 * @since 1.0.0
 */
public final class NfaState {

    private final int id;
    private final boolean accepting;
    private final SortedMap<Character, SortedSet<Integer>> transitions;
    private final SortedSet<Integer> epsilonTargets;

    NfaState(int id, boolean accepting,
             Map<Character, ? extends SortedSet<Integer>> transitions,
             SortedSet<Integer> epsilonTargets) {
        this.id = id;
        this.accepting = accepting;
        SortedMap<Character, SortedSet<Integer>> copy = new TreeMap<>();
        transitions.forEach((symbol, targets) ->
            copy.put(symbol, Collections.unmodifiableSortedSet(new TreeSet<>(targets))));
        this.transitions = Collections.unmodifiableSortedMap(copy);
        this.epsilonTargets = Collections.unmodifiableSortedSet(new TreeSet<>(epsilonTargets));
    }

    public int id() {
        return id;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /** Symbol transitions; epsilon edges are kept separately in {@link #epsilonTargets()}. */
    public SortedMap<Character, SortedSet<Integer>> transitions() {
        return transitions;
    }

    /**
     * Targets reached on {@code symbol}.
     *
     * @param symbol input symbol
     * @return target ids, empty when there is no such transition
     */
    public SortedSet<Integer> targets(char symbol) {
        SortedSet<Integer> targets = transitions.get(symbol);
        return targets != null ? targets : Collections.emptySortedSet();
    }

    public SortedSet<Integer> epsilonTargets() {
        return epsilonTargets;
    }

    @Override
    public String toString() {
        return "NfaState(" + id + (accepting ? ", accepting" : "") + ")";
    }
}
