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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One record of a minimization trace. State ids are those of the DFA passed to the minimizer.
 *
 * <p>{@code before} and {@code after} count what the step changed:
 * <ul>
 *   <li>{@link PartitionAction#PRUNE} - states before and after pruning</li>
 *   <li>{@link PartitionAction#INITIAL_PARTITION} - reachable states, then initial blocks</li>
 *   <li>{@link PartitionAction#SPLIT} - blocks before and after the split</li>
 *   <li>{@link PartitionAction#QUOTIENT} - reachable states, then minimal DFA states</li>
 * </ul>
 *
 * @param step index, 0 for {@link PartitionAction#PRUNE}
 * @param action what the step did
 * @param symbol splitting symbol, {@code null} unless {@link PartitionAction#SPLIT}
 * @param splitter splitter block; empty for other actions, and for a split that separates the
 *        states lacking an edge on {@code symbol}
 * @param blocks the initial or final partition, or for a split the two halves (states moving
 *        into the splitter first)
 * @param before count before the step
 * @param after count after the step
 * @since 1.0.0
 */
public record PartitionStep(
    int step,
    PartitionAction action,
    Character symbol,
    SortedSet<Integer> splitter,
    List<SortedSet<Integer>> blocks,
    int before,
    int after) {

    public PartitionStep {
        Objects.requireNonNull(action, "action cannot be null");
        splitter = Collections.unmodifiableSortedSet(new TreeSet<>(splitter));
        List<SortedSet<Integer>> copies = new ArrayList<>(blocks.size());
        for (SortedSet<Integer> block : blocks) {
            copies.add(Collections.unmodifiableSortedSet(new TreeSet<>(block)));
        }
        blocks = Collections.unmodifiableList(copies);
    }

    @Override
    public String toString() {
        if (action == PartitionAction.SPLIT) {
            return step + " " + action + " by " + splitter + " on '" + symbol + "': " + blocks
                + " (" + before + " -> " + after + " blocks)";
        }
        return step + " " + action + " " + blocks + " (" + before + " -> " + after + ")";
    }
}
