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

/**
 * Pipeline stage that produced an automaton.
 *
 * @since 1.0.0
 */
public enum AutomatonKind {
    /** Thompson construction output; may carry epsilon transitions and several targets per symbol. */
    NFA("NFA"),
    /** Subset construction output. */
    DFA("DFA"),
    /** Partition refinement output. */
    MIN_DFA("MinDFA");

    private final String label;

    AutomatonKind(String label) {
        this.label = label;
    }

    /** Label used in export records ({@code NFA}, {@code DFA}, {@code MinDFA}). */
    public String label() {
        return label;
    }

    public boolean isDeterministic() {
        return this != NFA;
    }

    /**
     * Resolves an export label or enum name.
     *
     * @param label {@code NFA}, {@code DFA}, {@code MinDFA} or an enum constant name
     * @return matching kind
     * @throws IllegalArgumentException if nothing matches
     */
    public static AutomatonKind fromLabel(String label) {
        for (AutomatonKind kind : values()) {
            if (kind.label.equals(label) || kind.name().equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown automaton kind: " + label);
    }
}
