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


package com.axonops.regex2dfa.api;

import com.axonops.regex2dfa.automaton.AutomatonKind;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of running an input through an automaton, with the replayable trace.
 *
 * @param kind kind of automaton that was run
 * @param input the simulated input
 * @param accepted whether the input is accepted
 * @param steps trace, starting with {@link StepAction#START} and ending with a terminal action
 * @since 1.0.0
 */
public record SimulationResult(AutomatonKind kind, String input, boolean accepted, List<SimulationStep> steps) {

    public SimulationResult {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        steps = List.copyOf(steps);
    }

    /** Last record of the trace. */
    public SimulationStep finalStep() {
        return steps.get(steps.size() - 1);
    }

    /** True if the run stopped on a symbol with no edge. */
    public boolean isStuck() {
        return finalStep().action() == StepAction.STUCK;
    }

    /** Number of input symbols consumed before the run ended. */
    public int consumed() {
        return input.length() - finalStep().remainingInput().length() - (isStuck() ? 1 : 0);
    }
}
