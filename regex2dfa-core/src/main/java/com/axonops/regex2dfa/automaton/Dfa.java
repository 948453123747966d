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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deterministic finite automaton, tagged {@link AutomatonKind#DFA} or {@link AutomatonKind#MIN_DFA}.
 *
 * <p>Partial: a state may have no edge for a symbol, in which case simulation gets stuck and
 * rejects. The accept ids of the NFA this automaton was derived from travel with it so that
 * acceptance can be recomputed from each state's origin ids after any post-processing.
 *
 * @since 1.0.0
 */
public final class Dfa extends Automaton {

    /** Returned by {@link #next(int, char)} when there is no edge. */
    public static final int NO_TRANSITION = -1;

    private final List<DfaState> states;
    private final SortedSet<Integer> nfaAcceptIds;

    private Dfa(AutomatonKind kind, List<DfaState> states, int startId,
                SortedSet<Character> alphabet, SortedSet<Integer> nfaAcceptIds) {
        super(kind, startId, alphabet);
        this.states = Collections.unmodifiableList(states);
        this.nfaAcceptIds = Collections.unmodifiableSortedSet(new TreeSet<>(nfaAcceptIds));
    }

    public static Builder builder(AutomatonKind kind) {
        return new Builder(kind);
    }

    @Override
    public int stateCount() {
        return states.size();
    }

    @Override
    public boolean isAccepting(int stateId) {
        return state(stateId).isAccepting();
    }

    public DfaState state(int stateId) {
        checkStateId(stateId);
        return states.get(stateId);
    }

    public List<DfaState> states() {
        return states;
    }

    /**
     * Deterministic step.
     *
     * @return target id or {@link #NO_TRANSITION}
     */
    public int next(int stateId, char symbol) {
        return state(stateId).target(symbol);
    }

    /** Accept ids of the source NFA; empty when unknown (e.g. an imported automaton). */
    public SortedSet<Integer> nfaAcceptIds() {
        return nfaAcceptIds;
    }

    /**
     * Acceptance of {@code stateId} recomputed as "origin ids intersect the NFA accept ids". Falls
     * back to the stored flag when either set is unknown.
     */
    public boolean reconciledAccepting(int stateId) {
        DfaState state = state(stateId);
        return reconcile(state.isAccepting(), state.originNfaIds(), nfaAcceptIds);
    }

    /**
     * Same automaton under another deterministic tag. States are shared; both are immutable.
     */
    public Dfa withKind(AutomatonKind kind) {
        if (kind == kind()) {
            return this;
        }
        requireDeterministic(kind);
        return new Dfa(kind, states, startId(), alphabet(), nfaAcceptIds);
    }

    @Override
    void collectTransitions(List<TransitionRecord> out) {
        for (DfaState state : states) {
            state.transitions().forEach((symbol, target) -> out.add(new TransitionRecord(state.id(), symbol, target)));
        }
    }

    static boolean reconcile(boolean flag, Collection<Integer> origin, Collection<Integer> nfaAcceptIds) {
        if (origin.isEmpty() || nfaAcceptIds.isEmpty()) {
            return flag;
        }
        for (Integer id : origin) {
            if (nfaAcceptIds.contains(id)) {
                return true;
            }
        }
        return false;
    }

    private static void requireDeterministic(AutomatonKind kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (!kind.isDeterministic()) {
            throw new IllegalArgumentException("A Dfa cannot be tagged " + kind.label());
        }
    }

    /**
     * Mutable assembly area for a {@link Dfa}. Ids are allocated densely from 0.
     */
    public static final class Builder {
        private final AutomatonKind kind;
        private final List<Boolean> accepting = new ArrayList<>();
        private final List<TreeMap<Character, Integer>> transitions = new ArrayList<>();
        private final List<SortedSet<Integer>> origins = new ArrayList<>();
        private final SortedSet<Character> alphabet = new TreeSet<>();
        private final SortedSet<Integer> nfaAcceptIds = new TreeSet<>();
        private int startId = -1;

        private Builder(AutomatonKind kind) {
            requireDeterministic(kind);
            this.kind = kind;
        }

        public int addState(boolean isAccepting) {
            return addState(isAccepting, Collections.emptySet());
        }

        /**
         * Adds a state remembering the NFA ids it stands for.
         *
         * @return the new state id
         */
        public int addState(boolean isAccepting, Collection<Integer> originNfaIds) {
            accepting.add(isAccepting);
            transitions.add(new TreeMap<>());
            origins.add(new TreeSet<>(originNfaIds));
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

        /** Declares alphabet symbols, including ones no edge uses. */
        public Builder alphabet(Collection<Character> symbols) {
            for (char symbol : symbols) {
                checkSymbol(symbol);
                alphabet.add(symbol);
            }
            return this;
        }

        public Builder nfaAcceptIds(Collection<Integer> ids) {
            nfaAcceptIds.addAll(ids);
            return this;
        }

        /**
         * Adds a deterministic edge. Re-adding the same edge is a no-op.
         *
         * @throws IllegalStateException if {@code from} already has a different target for {@code symbol}
         * @throws IllegalArgumentException for unknown ids, epsilon or another invalid symbol
         */
        public Builder addTransition(int from, char symbol, int to) {
            checkId(from);
            checkId(to);
            checkSymbol(symbol);
            Integer previous = transitions.get(from).putIfAbsent(symbol, to);
            if (previous != null && previous != to) {
                throw new IllegalStateException(
                    "State " + from + " already moves to " + previous + " on '" + symbol + "', cannot add " + to);
            }
            alphabet.add(symbol);
            return this;
        }

        /**
         * Freezes the states into an immutable automaton.
         *
         * @throws IllegalStateException if no start state was set
         */
        public Dfa build() {
            if (startId < 0) {
                throw new IllegalStateException(kind.label() + " has no start state");
            }
            List<DfaState> states = new ArrayList<>(accepting.size());
            for (int id = 0; id < accepting.size(); id++) {
                states.add(new DfaState(id, accepting.get(id), transitions.get(id), origins.get(id)));
            }
            return new Dfa(kind, states, startId, alphabet, nfaAcceptIds);
        }

        private void checkId(int stateId) {
            if (stateId < 0 || stateId >= accepting.size()) {
                throw new IllegalArgumentException("Unknown state id: " + stateId);
            }
        }

        private static void checkSymbol(char symbol) {
            if (!Symbols.isInputSymbol(symbol)) {
                throw new IllegalArgumentException(
                    symbol == Symbols.EPSILON
                        ? "Deterministic automata cannot have epsilon transitions"
                        : "Invalid transition symbol: '" + symbol + "'");
            }
        }
    }
}
