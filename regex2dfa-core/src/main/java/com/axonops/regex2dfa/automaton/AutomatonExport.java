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

import java.util.List;
import java.util.Objects;

/**
 * Stable boundary record of an automaton, consumed by serialization and visualization tooling.
 *
 * <p>All lists are immutable and ordered: {@code states} and {@code acceptStates} ascending,
 * {@code alphabet} ascending, {@code transitions} by (from, symbol, to). Epsilon edges use
 * {@link Symbols#EPSILON}, which never appears in {@code alphabet}.
 *
 * <pre>{@code
 * AutomatonExport export = Pattern.compile("(a|b)*abb").minimalDfa().export();
 * export.transitions().forEach(t -> System.out.println(t.from() + " -" + t.symbol() + "-> " + t.to()));
 * }</pre>
 *
 * @param kind producing stage
 * @param states state ids
 * @param alphabet input symbols
 * @param start start state id
 * @param acceptStates accepting state ids
 * @param transitions all edges, epsilon edges included
 * @since 1.0.0
 */
public record AutomatonExport(
    AutomatonKind kind,
    List<Integer> states,
    List<Character> alphabet,
    int start,
    List<Integer> acceptStates,
    List<TransitionRecord> transitions) {

    public AutomatonExport {
        Objects.requireNonNull(kind, "kind cannot be null");
        states = List.copyOf(states);
        alphabet = List.copyOf(alphabet);
        acceptStates = List.copyOf(acceptStates);
        transitions = List.copyOf(transitions);
    }

    /** Number of edges, epsilon edges included. */
    public int transitionCount() {
        return transitions.size();
    }
}
