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

import com.axonops.regex2dfa.api.ConversionException;
import com.axonops.regex2dfa.api.ResourceLimitException;
import com.axonops.regex2dfa.automaton.Automaton;
import com.axonops.regex2dfa.automaton.AutomatonKind;
import com.axonops.regex2dfa.automaton.Dfa;
import com.axonops.regex2dfa.automaton.DfaState;
import com.axonops.regex2dfa.automaton.Nfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction: {@link Nfa} to {@link Dfa}.
 *
 * <p>Each DFA state stands for the epsilon-closed set of NFA states it was reached with. Sets are
 * deduplicated by structural {@link BitSet} equality, explored breadth-first from the closure of
 * the NFA start state, and remembered on the DFA state as its origin ids. A state is accepting iff
 * its set contains an NFA accept state. Empty moves produce no edge, so the result is partial and
 * contains reachable states only.
 *
 * <p>Instances are stateless and thread-safe.
 *
 * @since 1.0.0
 */
public final class Determinizer {
    private static final Logger logger = LoggerFactory.getLogger(Determinizer.class);

    /** Default bound on DFA size. */
    public static final int DEFAULT_MAX_DFA_STATES = 10_000;

    private static final SortedSet<Integer> EMPTY = Collections.emptySortedSet();

    private final int maxDfaStates;

    public Determinizer() {
        this(DEFAULT_MAX_DFA_STATES);
    }

    public Determinizer(int maxDfaStates) {
        if (maxDfaStates < 1) {
            throw new IllegalArgumentException("maxDfaStates must be >= 1, got: " + maxDfaStates);
        }
        this.maxDfaStates = maxDfaStates;
    }

    /**
     * Runtime-typed entry point for callers holding an {@link Automaton}.
     *
     * @throws ConversionException unless {@code automaton} is an NFA
     */
    public Dfa determinize(Automaton automaton) {
        Objects.requireNonNull(automaton, "automaton cannot be null");
        if (!(automaton instanceof Nfa)) {
            throw new ConversionException("determinization expects an NFA, got " + automaton.kind().label());
        }
        return determinize((Nfa) automaton);
    }

    /**
     * Builds the DFA accepting the same language as {@code nfa}.
     *
     * @param nfa source automaton, left untouched
     * @return DFA tagged {@link AutomatonKind#DFA}, start state 0
     * @throws ResourceLimitException if more than the configured number of DFA states is reachable
     */
    public Dfa determinize(Nfa nfa) {
        Objects.requireNonNull(nfa, "nfa cannot be null");
        return determinize(nfa, null);
    }

    /**
     * Same construction as {@link #determinize(Nfa)}, recording every subset processed, every
     * move with its closure, and every symbol without a move.
     *
     * @param nfa source automaton, left untouched
     * @return the DFA with its trace and size statistics
     * @throws ResourceLimitException if more than the configured number of DFA states is reachable
     */
    public DeterminizationTrace determinizeWithSteps(Nfa nfa) {
        Objects.requireNonNull(nfa, "nfa cannot be null");
        List<SubsetStep> steps = new ArrayList<>();
        Dfa dfa = determinize(nfa, steps);
        return new DeterminizationTrace(dfa, steps, StageStatistics.of(nfa, dfa));
    }

    private Dfa determinize(Nfa nfa, List<SubsetStep> steps) {
        long startNanos = System.nanoTime();

        Dfa.Builder builder = Dfa.builder(AutomatonKind.DFA)
            .alphabet(nfa.alphabet())
            .nfaAcceptIds(nfa.acceptIds());
        Map<BitSet, Integer> ids = new HashMap<>();
        List<BitSet> subsets = new ArrayList<>();
        Deque<Integer> pending = new ArrayDeque<>();

        BitSet initial = nfa.initialClosure();
        int startId = addSubset(nfa, builder, initial, ids, subsets);
        pending.add(startId);
        if (steps != null) {
            steps.add(new SubsetStep(steps.size(), SubsetAction.INITIAL, startId, ids(initial), null,
                EMPTY, EMPTY, SubsetStep.NO_STATE, true));
        }

        while (!pending.isEmpty()) {
            int current = pending.poll();
            BitSet subset = subsets.get(current);
            if (steps != null) {
                steps.add(new SubsetStep(steps.size(), SubsetAction.PROCESS, current, ids(subset), null,
                    EMPTY, EMPTY, SubsetStep.NO_STATE, false));
            }
            for (char symbol : nfa.alphabet()) {
                BitSet moved = nfa.move(subset, symbol);
                if (moved.isEmpty()) {
                    if (steps != null) {
                        steps.add(new SubsetStep(steps.size(), SubsetAction.NO_TRANSITION, current, ids(subset), symbol,
                            EMPTY, EMPTY, SubsetStep.NO_STATE, false));
                    }
                    continue;
                }
                BitSet next = nfa.epsilonClosure(moved);
                Integer target = ids.get(next);
                boolean discovered = target == null;
                if (discovered) {
                    target = addSubset(nfa, builder, next, ids, subsets);
                    pending.add(target);
                }
                builder.addTransition(current, symbol, target);
                if (steps != null) {
                    steps.add(new SubsetStep(steps.size(), SubsetAction.TRANSITION, current, ids(subset), symbol,
                        ids(moved), ids(next), target, discovered));
                }
            }
        }

        Dfa dfa = builder.start(startId).build();
        logger.trace("Automata: DFA built - nfaStates: {}, dfaStates: {}, timeNs: {}",
            nfa.stateCount(), dfa.stateCount(), System.nanoTime() - startNanos);
        return dfa;
    }

    private static SortedSet<Integer> ids(BitSet subset) {
        return subset.stream().boxed().collect(Collectors.toCollection(TreeSet::new));
    }

    private int addSubset(Nfa nfa, Dfa.Builder builder, BitSet subset, Map<BitSet, Integer> ids, List<BitSet> subsets) {
        if (subsets.size() >= maxDfaStates) {
            throw new ResourceLimitException("maxDfaStates", maxDfaStates,
                "subset construction from " + nfa.stateCount() + " NFA states");
        }
        int id = builder.addState(nfa.containsAccepting(subset), subset.stream().boxed().collect(Collectors.toList()));
        ids.put(subset, id);
        subsets.add(subset);
        return id;
    }

    public int maxDfaStates() {
        return maxDfaStates;
    }

    /**
     * Drops states unreachable from the start state and renumbers the rest breadth-first (start
     * becomes 0, edges followed in symbol order).
     *
     * <p>Acceptance of every kept state is recomputed as "origin NFA ids intersect the NFA accept
     * ids" ({@link Dfa#reconciledAccepting(int)}) rather than copied from the stored flag.
     *
     * @param dfa source automaton, left untouched
     * @return a new automaton of the same kind
     */
    public static Dfa pruneUnreachable(Dfa dfa) {
        Objects.requireNonNull(dfa, "dfa cannot be null");
        int[] order = reachableOrder(dfa);
        int[] renumbered = new int[dfa.stateCount()];
        Arrays.fill(renumbered, -1);
        for (int i = 0; i < order.length; i++) {
            renumbered[order[i]] = i;
        }

        Dfa.Builder builder = Dfa.builder(dfa.kind())
            .alphabet(dfa.alphabet())
            .nfaAcceptIds(dfa.nfaAcceptIds());
        for (int old : order) {
            builder.addState(dfa.reconciledAccepting(old), dfa.state(old).originNfaIds());
        }
        for (int old : order) {
            DfaState state = dfa.state(old);
            state.transitions().forEach((symbol, target) ->
                builder.addTransition(renumbered[old], symbol, renumbered[target]));
        }

        int removed = dfa.stateCount() - order.length;
        if (removed > 0) {
            logger.trace("Automata: Pruned {} unreachable states from {}", removed, dfa.kind().label());
        }
        return builder.start(0).build();
    }

    /**
     * Ids reachable from the start state in breadth-first order, edges followed in symbol order.
     * Position {@code i} holds the id that {@link #pruneUnreachable(Dfa)} renumbers to {@code i}.
     */
    static int[] reachableOrder(Dfa dfa) {
        boolean[] seen = new boolean[dfa.stateCount()];
        int[] order = new int[dfa.stateCount()];
        int size = 0;
        seen[dfa.startId()] = true;
        order[size++] = dfa.startId();
        for (int head = 0; head < size; head++) {
            for (int target : dfa.state(order[head]).transitions().values()) {
                if (!seen[target]) {
                    seen[target] = true;
                    order[size++] = target;
                }
            }
        }
        return Arrays.copyOf(order, size);
    }
}
