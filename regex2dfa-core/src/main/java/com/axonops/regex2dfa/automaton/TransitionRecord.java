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

import java.util.Comparator;

/**
 * One edge of an exported automaton. Epsilon edges carry {@link Symbols#EPSILON}.
 *
 * <p>Natural order is (from, symbol, to).
 *
 * @since 1.0.0
 */
public record TransitionRecord(int from, char symbol, int to) implements Comparable<TransitionRecord> {

    private static final Comparator<TransitionRecord> ORDER =
        Comparator.comparingInt(TransitionRecord::from)
            .thenComparing(TransitionRecord::symbol)
            .thenComparingInt(TransitionRecord::to);

    public boolean isEpsilon() {
        return symbol == Symbols.EPSILON;
    }

    @Override
    public int compareTo(TransitionRecord other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + from + ", " + symbol + ", " + to + ")";
    }
}
