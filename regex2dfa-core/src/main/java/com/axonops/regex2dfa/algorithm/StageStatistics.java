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

import com.axonops.regex2dfa.automaton.Automaton;

/**
 * Size of an automaton before and after one conversion stage.
 *
 * <p>Transition counts include epsilon edges, so an NFA's count is its full edge count.
 *
 * @param sourceStates states of the stage input
 * @param resultStates states of the stage output
 * @param sourceTransitions edges of the stage input
 * @param resultTransitions edges of the stage output
 * @param alphabetSize input symbols of the stage input
 * @since 1.0.0
 */
public record StageStatistics(
    int sourceStates,
    int resultStates,
    int sourceTransitions,
    int resultTransitions,
    int alphabetSize) {

    static StageStatistics of(Automaton source, Automaton result) {
        return new StageStatistics(source.stateCount(), result.stateCount(),
            source.transitionCount(), result.transitionCount(), source.alphabet().size());
    }

    /** States removed by the stage; negative when the stage grew the automaton. */
    public int stateReduction() {
        return sourceStates - resultStates;
    }

    /**
     * {@link #stateReduction()} as a percentage of the source states.
     *
     * @return percentage, 0 for an empty source
     */
    public double stateReductionPercent() {
        if (sourceStates == 0) {
            return 0.0;
        }
        return stateReduction() * 100.0 / sourceStates;
    }

    public int transitionReduction() {
        return sourceTransitions - resultTransitions;
    }

    @Override
    public String toString() {
        return String.format("StageStatistics[states=%d->%d (%.2f%%), transitions=%d->%d, alphabet=%d]",
            sourceStates, resultStates, stateReductionPercent(), sourceTransitions, resultTransitions, alphabetSize);
    }
}
