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

import com.axonops.regex2dfa.api.ConversionException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rebuilds automata from {@link AutomatonExport} records.
 *
 * <p>State ids of the record may be any distinct integers; they are renumbered {@code 0..n-1} in
 * ascending order. Deterministic kinds produce a {@link Dfa} without origin information, so its
 * acceptance is taken from the record as is.
 *
 * @since 1.0.0
 */
public final class AutomatonImporter {

    private AutomatonImporter() {
        // Utility class
    }

    /**
     * Reconstructs the automaton described by {@code export}.
     *
     * @param export export record
     * @return an {@link Nfa} for {@link AutomatonKind#NFA}, otherwise a {@link Dfa} of the same kind
     * @throws ConversionException if the record references unknown states or symbols, or a
     *         deterministic record has epsilon edges or two targets for one (state, symbol)
     */
    public static Automaton fromExport(AutomatonExport export) {
        Objects.requireNonNull(export, "export cannot be null");

        TreeSet<Integer> sorted = new TreeSet<>(export.states());
        if (sorted.size() != export.states().size()) {
            throw new ConversionException("duplicate state ids in " + export.states());
        }
        if (sorted.isEmpty()) {
            throw new ConversionException("automaton has no states");
        }
        Map<Integer, Integer> renumber = new HashMap<>();
        for (int original : sorted) {
            renumber.put(original, renumber.size());
        }

        Set<Character> alphabet = new HashSet<>();
        for (char symbol : export.alphabet()) {
            if (!Symbols.isInputSymbol(symbol)) {
                throw new ConversionException("invalid alphabet symbol '" + symbol + "'");
            }
            alphabet.add(symbol);
        }
        Set<Integer> accepting = new HashSet<>();
        for (int id : export.acceptStates()) {
            accepting.add(lookup(renumber, id, "accept state"));
        }
        int start = lookup(renumber, export.start(), "start state");

        if (export.kind() == AutomatonKind.NFA) {
            return buildNfa(export, renumber, alphabet, accepting, start);
        }
        return buildDfa(export, renumber, alphabet, accepting, start);
    }

    private static Nfa buildNfa(AutomatonExport export, Map<Integer, Integer> renumber,
                                Set<Character> alphabet, Set<Integer> accepting, int start) {
        Nfa.Builder builder = Nfa.builder();
        for (int id = 0; id < renumber.size(); id++) {
            builder.addState(accepting.contains(id));
        }
        for (TransitionRecord t : export.transitions()) {
            checkSymbol(t, alphabet, true);
            builder.addTransition(lookup(renumber, t.from(), "source"), t.symbol(), lookup(renumber, t.to(), "target"));
        }
        return builder.start(start).build();
    }

    private static Dfa buildDfa(AutomatonExport export, Map<Integer, Integer> renumber,
                                Set<Character> alphabet, Set<Integer> accepting, int start) {
        Dfa.Builder builder = Dfa.builder(export.kind());
        for (int id = 0; id < renumber.size(); id++) {
            builder.addState(accepting.contains(id));
        }
        builder.alphabet(alphabet);
        for (TransitionRecord t : export.transitions()) {
            checkSymbol(t, alphabet, false);
            try {
                builder.addTransition(lookup(renumber, t.from(), "source"), t.symbol(), lookup(renumber, t.to(), "target"));
            } catch (IllegalStateException e) {
                throw new ConversionException("nondeterministic transition " + t + " in " + export.kind().label(), e);
            }
        }
        return builder.start(start).build();
    }

    private static void checkSymbol(TransitionRecord t, Set<Character> alphabet, boolean epsilonAllowed) {
        if (t.isEpsilon()) {
            if (!epsilonAllowed) {
                throw new ConversionException("epsilon transition " + t + " in a deterministic automaton");
            }
            return;
        }
        if (!alphabet.contains(t.symbol())) {
            throw new ConversionException("transition " + t + " uses a symbol outside the alphabet");
        }
    }

    private static int lookup(Map<Integer, Integer> renumber, int id, String role) {
        Integer mapped = renumber.get(id);
        if (mapped == null) {
            throw new ConversionException(role + " " + id + " is not a declared state");
        }
        return mapped;
    }
}
