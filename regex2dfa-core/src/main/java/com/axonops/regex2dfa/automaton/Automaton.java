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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A finite automaton produced by one pipeline stage.
 *
 * <p>States live in an arena owned by the automaton and are addressed by id ({@code 0..n-1});
 * transitions are id references into the same arena, so cycles are ordinary edges. Instances are
 * immutable: every stage builds a fresh automaton and never mutates its input.
 *
 * <p>Sealed to the two shapes the pipeline produces:
 * <ul>
 *   <li>{@link Nfa} - symbol transitions to sets of targets, plus epsilon transitions</li>
 *   <li>{@link Dfa} - at most one target per (state, symbol), used for both
 *       {@link AutomatonKind#DFA} and {@link AutomatonKind#MIN_DFA}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract sealed class Automaton permits Nfa, Dfa {

    private final AutomatonKind kind;
    private final int startId;
    private final SortedSet<Character> alphabet;

    Automaton(AutomatonKind kind, int startId, SortedSet<Character> alphabet) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.startId = startId;
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
    }

    public AutomatonKind kind() {
        return kind;
    }

    public int startId() {
        return startId;
    }

    /** Input symbols, ascending. Never contains {@link Symbols#EPSILON}. */
    public SortedSet<Character> alphabet() {
        return alphabet;
    }

    public abstract int stateCount();

    public abstract boolean isAccepting(int stateId);

    /** Ids of accepting states, ascending. */
    public SortedSet<Integer> acceptIds() {
        SortedSet<Integer> accepting = new TreeSet<>();
        for (int id = 0; id < stateCount(); id++) {
            if (isAccepting(id)) {
                accepting.add(id);
            }
        }
        return Collections.unmodifiableSortedSet(accepting);
    }

    /** Number of edges, epsilon edges included. */
    public int transitionCount() {
        List<TransitionRecord> edges = new ArrayList<>();
        collectTransitions(edges);
        return edges.size();
    }

    /**
     * Appends every edge of this automaton, in any order.
     *
     * @param out destination list
     */
    abstract void collectTransitions(List<TransitionRecord> out);

    /**
     * Produces the stable export record of this automaton.
     *
     * @return export record with sorted ids, symbols and transitions
     */
    public AutomatonExport export() {
        List<Integer> states = new ArrayList<>(stateCount());
        for (int id = 0; id < stateCount(); id++) {
            states.add(id);
        }
        List<TransitionRecord> transitions = new ArrayList<>();
        collectTransitions(transitions);
        Collections.sort(transitions);
        return new AutomatonExport(
            kind, states, new ArrayList<>(alphabet), startId, new ArrayList<>(acceptIds()), transitions);
    }

    void checkStateId(int stateId) {
        if (stateId < 0 || stateId >= stateCount()) {
            throw new IllegalArgumentException(
                "State " + stateId + " does not belong to this " + kind.label() + " (states: " + stateCount() + ")");
        }
    }

    @Override
    public String toString() {
        return kind.label() + "[states=" + stateCount()
            + ", alphabet=" + alphabet
            + ", start=" + startId
            + ", accept=" + acceptIds() + "]";
    }
}
