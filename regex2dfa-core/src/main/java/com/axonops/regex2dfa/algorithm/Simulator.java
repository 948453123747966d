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

import com.axonops.regex2dfa.api.SimulationResult;
import com.axonops.regex2dfa.api.SimulationStep;
import com.axonops.regex2dfa.api.StepAction;
import com.axonops.regex2dfa.automaton.Automaton;
import com.axonops.regex2dfa.automaton.Dfa;
import com.axonops.regex2dfa.automaton.Nfa;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Runs input strings through automata.
 *
 * <p>A deterministic run follows one state; an NFA run follows the epsilon-closed frontier of
 * states. Either run rejects as soon as a symbol has nowhere to go. The trace has a
 * {@link StepAction#START} record (step 0), one record per consumed symbol, and then either a
 * {@link StepAction#STUCK} record or a final {@link StepAction#ACCEPT}/{@link StepAction#REJECT}
 * record at step {@code input.length() + 1}.
 *
 * @since 1.0.0
 */
public final class Simulator {

    private Simulator() {
        // Utility class
    }

    public static SimulationResult run(Automaton automaton, String input) {
        Objects.requireNonNull(automaton, "automaton cannot be null");
        if (automaton instanceof Dfa) {
            return run((Dfa) automaton, input);
        }
        return run((Nfa) automaton, input);
    }

    public static SimulationResult run(Dfa dfa, String input) {
        Objects.requireNonNull(input, "input cannot be null");
        List<SimulationStep> steps = new ArrayList<>(input.length() + 2);
        int current = dfa.startId();
        steps.add(new SimulationStep(0, single(current), null, input, StepAction.START));

        for (int i = 0; i < input.length(); i++) {
            char symbol = input.charAt(i);
            int next = dfa.next(current, symbol);
            String remaining = input.substring(i + 1);
            if (next == Dfa.NO_TRANSITION) {
                steps.add(new SimulationStep(i + 1, Collections.emptySortedSet(), symbol, remaining, StepAction.STUCK));
                return new SimulationResult(dfa.kind(), input, false, steps);
            }
            current = next;
            steps.add(new SimulationStep(i + 1, single(current), symbol, remaining, StepAction.TRANSITION));
        }

        boolean accepted = dfa.isAccepting(current);
        steps.add(new SimulationStep(input.length() + 1, single(current), null, "",
            accepted ? StepAction.ACCEPT : StepAction.REJECT));
        return new SimulationResult(dfa.kind(), input, accepted, steps);
    }

    public static SimulationResult run(Nfa nfa, String input) {
        Objects.requireNonNull(input, "input cannot be null");
        List<SimulationStep> steps = new ArrayList<>(input.length() + 2);
        BitSet frontier = nfa.initialClosure();
        steps.add(new SimulationStep(0, toSet(frontier), null, input, StepAction.START));

        for (int i = 0; i < input.length(); i++) {
            char symbol = input.charAt(i);
            BitSet moved = nfa.move(frontier, symbol);
            String remaining = input.substring(i + 1);
            if (moved.isEmpty()) {
                steps.add(new SimulationStep(i + 1, Collections.emptySortedSet(), symbol, remaining, StepAction.STUCK));
                return new SimulationResult(nfa.kind(), input, false, steps);
            }
            frontier = nfa.epsilonClosure(moved);
            steps.add(new SimulationStep(i + 1, toSet(frontier), symbol, remaining, StepAction.TRANSITION));
        }

        boolean accepted = nfa.containsAccepting(frontier);
        steps.add(new SimulationStep(input.length() + 1, toSet(frontier), null, "",
            accepted ? StepAction.ACCEPT : StepAction.REJECT));
        return new SimulationResult(nfa.kind(), input, accepted, steps);
    }

    /**
     * Acceptance only, without building a trace.
     *
     * @param automaton any automaton
     * @param input input string
     * @return true if the automaton accepts {@code input}
     */
    public static boolean accepts(Automaton automaton, String input) {
        Objects.requireNonNull(automaton, "automaton cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        if (automaton instanceof Dfa) {
            Dfa dfa = (Dfa) automaton;
            int current = dfa.startId();
            for (int i = 0; i < input.length(); i++) {
                current = dfa.next(current, input.charAt(i));
                if (current == Dfa.NO_TRANSITION) {
                    return false;
                }
            }
            return dfa.isAccepting(current);
        }

        Nfa nfa = (Nfa) automaton;
        BitSet frontier = nfa.initialClosure();
        for (int i = 0; i < input.length(); i++) {
            BitSet moved = nfa.move(frontier, input.charAt(i));
            if (moved.isEmpty()) {
                return false;
            }
            frontier = nfa.epsilonClosure(moved);
        }
        return nfa.containsAccepting(frontier);
    }

    private static SortedSet<Integer> single(int stateId) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(List.of(stateId)));
    }

    private static SortedSet<Integer> toSet(BitSet ids) {
        SortedSet<Integer> set = new TreeSet<>();
        ids.stream().forEach(set::add);
        return set;
    }
}
