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
 * Immutable state of a {@link Dfa}.
 *
 * <p>A symbol maps to a single target id. The state also remembers the NFA states it was built
 * from ({@link #originNfaIds()}), which pruning and minimization use to recompute acceptance.
 *
 * @since 1.0.0
 */
public final class DfaState {

    private final int id;
    private final boolean accepting;
    private final SortedMap<Character, Integer> transitions;
    private final SortedSet<Integer> originNfaIds;

    DfaState(int id, boolean accepting, Map<Character, Integer> transitions, SortedSet<Integer> originNfaIds) {
        this.id = id;
        this.accepting = accepting;
        this.transitions = Collections.unmodifiableSortedMap(new TreeMap<>(transitions));
        this.originNfaIds = Collections.unmodifiableSortedSet(new TreeSet<>(originNfaIds));
    }

    public int id() {
        return id;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public SortedMap<Character, Integer> transitions() {
        return transitions;
    }

    /**
     * Target reached on {@code symbol}.
     *
     * @param symbol input symbol
     * @return target id, or {@link Dfa#NO_TRANSITION} when the state has no edge for it
     */
    public int target(char symbol) {
        Integer target = transitions.get(symbol);
        return target != null ? target : Dfa.NO_TRANSITION;
    }

    /** NFA state ids this state was derived from; empty for automata imported without them. */
    public SortedSet<Integer> originNfaIds() {
        return originNfaIds;
    }

    @Override
    public String toString() {
        return "DfaState(" + id + (accepting ? ", accepting" : "") + ", origin=" + originNfaIds + ")";
    }
}
