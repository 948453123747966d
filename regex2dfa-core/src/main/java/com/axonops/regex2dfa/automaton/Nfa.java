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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Nondeterministic finite automaton with epsilon transitions.
 *
 * <p>Sets of states are handled as {@link BitSet}s over state ids: a bit set is its own canonical
 * sorted form and hashes structurally, which makes it the subset key of the determinizer.
 *
 * @since 1.0.0
 */
public final class Nfa extends Automaton {

    private final List<NfaState> states;

    private Nfa(List<NfaState> states, int startId, SortedSet<Character> alphabet) {
        super(AutomatonKind.NFA, startId, alphabet);
        this.states = Collections.unmodifiableList(states);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int stateCount() {
        return states.size();
    }

    @Override
    public boolean isAccepting(int stateId) {
        return state(stateId).isAccepting();
    }

    public NfaState state(int stateId) {
        checkStateId(stateId);
        return states.get(stateId);
    }

    public List<NfaState> states() {
        return states;
    }

    /**
     * States reachable from {@code seeds} through zero or more epsilon transitions.
     *
     * @param seeds starting state ids (not modified)
     * @return new set containing the seeds and everything epsilon-reachable from them
     */
    public BitSet epsilonClosure(BitSet seeds) {
        BitSet closure = (BitSet) seeds.clone();
        Deque<Integer> stack = new ArrayDeque<>();
        seeds.stream().forEach(stack::push);

        while (!stack.isEmpty()) {
            int current = stack.pop();
            for (int target : states.get(current).epsilonTargets()) {
                if (!closure.get(target)) {
                    closure.set(target);
                    stack.push(target);
                }
            }
        }
        return closure;
    }

    /** Epsilon-closure of the start state. */
    public BitSet initialClosure() {
        BitSet start = new BitSet(stateCount());
        start.set(startId());
        return epsilonClosure(start);
    }

    /**
     * Union of the {@code symbol} targets of every state in {@code from}; epsilon edges are not
     * followed.
     *
     * @param from source state ids (not modified)
     * @param symbol input symbol
     * @return new, possibly empty, set of targets
     */
    public BitSet move(BitSet from, char symbol) {
        BitSet result = new BitSet(stateCount());
        from.stream().forEach(id -> {
            for (int target : states.get(id).targets(symbol)) {
                result.set(target);
            }
        });
        return result;
    }

    /** Tests whether any state of {@code stateIds} is accepting. */
    public boolean containsAccepting(BitSet stateIds) {
        return stateIds.stream().anyMatch(this::isAccepting);
    }

    @Override
    void collectTransitions(List<TransitionRecord> out) {
        for (NfaState state : states) {
            state.transitions().forEach((symbol, targets) -> {
                for (int target : targets) {
                    out.add(new TransitionRecord(state.id(), symbol, target));
                }
            });
            for (int target : state.epsilonTargets()) {
                out.add(new TransitionRecord(state.id(), Symbols.EPSILON, target));
            }
        }
    }

    /**
     * Mutable assembly area for an {@link Nfa}. Ids are allocated densely from 0.
     */
    public static final class Builder {
        private final List<Boolean> accepting = new ArrayList<>();
        private final List<TreeMap<Character, TreeSet<Integer>>> transitions = new ArrayList<>();
        private final List<TreeSet<Integer>> epsilon = new ArrayList<>();
        private final SortedSet<Character> alphabet = new TreeSet<>();
        private int startId = -1;

        private Builder() {
        }

        public int addState(boolean isAccepting) {
            accepting.add(isAccepting);
            transitions.add(new TreeMap<>());
            epsilon.add(new TreeSet<>());
            return accepting.size() - 1;
        }

        public int stateCount() {
            return accepting.size();
        }

        public Builder start(int stateId) {
            checkId(stateId);
            this.startId = stateId;
            return this;
        }

        /**
         * Adds an edge; {@link Symbols#EPSILON} adds an epsilon edge.
         *
         * @throws IllegalArgumentException for unknown ids or a symbol outside {@code [a-zA-Z0-9]}
         */
        public Builder addTransition(int from, char symbol, int to) {
            checkId(from);
            checkId(to);
            if (symbol == Symbols.EPSILON) {
                epsilon.get(from).add(to);
                return this;
            }
            if (!Symbols.isInputSymbol(symbol)) {
                throw new IllegalArgumentException("Invalid transition symbol: '" + symbol + "'");
            }
            transitions.get(from).computeIfAbsent(symbol, s -> new TreeSet<>()).add(to);
            alphabet.add(symbol);
            return this;
        }

        public Builder addEpsilon(int from, int to) {
            return addTransition(from, Symbols.EPSILON, to);
        }

        /**
         * Freezes the states into an immutable automaton.
         *
         * @throws IllegalStateException if no start state was set
         */
        public Nfa build() {
            if (startId < 0) {
                throw new IllegalStateException("NFA has no start state");
            }
            List<NfaState> states = new ArrayList<>(accepting.size());
            for (int id = 0; id < accepting.size(); id++) {
                states.add(new NfaState(id, accepting.get(id), transitions.get(id), epsilon.get(id)));
            }
            return new Nfa(states, startId, alphabet);
        }

        private void checkId(int stateId) {
            if (stateId < 0 || stateId >= accepting.size()) {
                throw new IllegalArgumentException("Unknown state id: " + stateId);
            }
        }
    }
}
