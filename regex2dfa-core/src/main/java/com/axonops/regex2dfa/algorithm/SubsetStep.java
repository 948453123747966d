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

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One record of a subset-construction trace.
 *
 * @param step index, 0 for {@link SubsetAction#INITIAL}
 * @param action what the step did
 * @param dfaState DFA state being created or processed
 * @param subset NFA states of {@code dfaState}
 * @param symbol symbol examined, {@code null} for {@link SubsetAction#INITIAL} and {@link SubsetAction#PROCESS}
 * @param moved NFA states reached on {@code symbol} before closure; empty unless {@link SubsetAction#TRANSITION}
 * @param closure epsilon closure of {@code moved}; empty unless {@link SubsetAction#TRANSITION}
 * @param targetDfaState DFA state of {@code closure}, {@link #NO_STATE} unless {@link SubsetAction#TRANSITION}
 * @param newState whether {@code targetDfaState} was discovered by this step
 * @since 1.0.0
 */
public record SubsetStep(
    int step,
    SubsetAction action,
    int dfaState,
    SortedSet<Integer> subset,
    Character symbol,
    SortedSet<Integer> moved,
    SortedSet<Integer> closure,
    int targetDfaState,
    boolean newState) {

    /** Target of steps that do not lead anywhere. */
    public static final int NO_STATE = -1;

    public SubsetStep {
        Objects.requireNonNull(action, "action cannot be null");
        subset = Collections.unmodifiableSortedSet(new TreeSet<>(subset));
        moved = Collections.unmodifiableSortedSet(new TreeSet<>(moved));
        closure = Collections.unmodifiableSortedSet(new TreeSet<>(closure));
    }

    @Override
    public String toString() {
        switch (action) {
            case TRANSITION:
                return step + " " + action + " D" + dfaState + " on '" + symbol + "': move=" + moved
                    + " closure=" + closure + " -> D" + targetDfaState + (newState ? " (new)" : "");
            case NO_TRANSITION:
                return step + " " + action + " D" + dfaState + " on '" + symbol + "'";
            default:
                return step + " " + action + " D" + dfaState + " " + subset;
        }
    }
}
