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

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One record of a simulation trace.
 *
 * @param step index, 0 for {@link StepAction#START}
 * @param states occupied state ids after the step; one id for a deterministic run, empty when stuck
 * @param symbol symbol consumed by this step, {@code null} for the start and final records
 * @param remainingInput input not yet consumed
 * @param action what the step did
 * @since 1.0.0
 */
public record SimulationStep(
    int step,
    SortedSet<Integer> states,
    Character symbol,
    String remainingInput,
    StepAction action) {

    public SimulationStep {
        states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        Objects.requireNonNull(remainingInput, "remainingInput cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
    }

    @Override
    public String toString() {
        return step + " " + action + " " + states
            + (symbol != null ? " on '" + symbol + "'" : "")
            + " remaining='" + remainingInput + "'";
    }
}
