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

import com.axonops.regex2dfa.api.ConversionException;
import com.axonops.regex2dfa.automaton.Automaton;
import com.axonops.regex2dfa.automaton.AutomatonKind;
import com.axonops.regex2dfa.automaton.Dfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hopcroft partition refinement: {@link Dfa} to the minimal DFA of the same language.
 *
 * <p>Unreachable states are pruned first. Refinement then runs on the automaton completed with
 * one sink state that takes every missing edge and starts in a block of its own, next to the
 * non-accepting and accepting blocks. A missing edge therefore never matches a real block, which
 * keeps the result exact on partial automata, and the sink block is dropped at the end.
 *
 * <p>A worklist of (splitter block, symbol) pairs drives the refinement. For each pair only the
 * predecessors of the splitter on the symbol are visited, through an inverse transition index
 * built once, and only blocks holding some of them are split. When a block splits, both halves
 * replace any pending pair of the original block; otherwise only the smaller half is queued. The
 * whole refinement takes {@code O(k n log n)} for {@code n} states and {@code k} symbols.
 *
 * <p>The quotient automaton is numbered breadth-first from its start state, which makes
 * minimization of an already minimal DFA return an identical export.
 *
 * @since 1.0.0
 */
public final class Minimizer {
    private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

    /**
     * Runtime-typed entry point for callers holding an {@link Automaton}.
     *
     * @throws ConversionException if {@code automaton} is an NFA
     */
    public Dfa minimize(Automaton automaton) {
        Objects.requireNonNull(automaton, "automaton cannot be null");
        if (!(automaton instanceof Dfa)) {
            throw new ConversionException("minimization expects a DFA, got " + automaton.kind().label());
        }
        return minimize((Dfa) automaton);
    }

    /**
     * Minimizes a DFA or re-minimizes a minimal one.
     *
     * @param dfa source automaton, left untouched
     * @return automaton tagged {@link AutomatonKind#MIN_DFA}
     */
    public Dfa minimize(Dfa dfa) {
        Objects.requireNonNull(dfa, "dfa cannot be null");
        return minimize(dfa, null);
    }

    /**
     * Same minimization as {@link #minimize(Dfa)}, recording the pruning, the initial partition,
     * every split and the final blocks, and mapping each minimal state to the states it merges.
     *
     * @param dfa source automaton, left untouched
     * @return the minimal DFA with its trace, state mapping and size statistics
     */
    public MinimizationTrace minimizeWithSteps(Dfa dfa) {
        Objects.requireNonNull(dfa, "dfa cannot be null");
        Recorder recorder = new Recorder(Determinizer.reachableOrder(dfa));
        Dfa minimal = minimize(dfa, recorder);
        return new MinimizationTrace(minimal, recorder.steps, recorder.mapping, StageStatistics.of(dfa, minimal));
    }

    private Dfa minimize(Dfa dfa, Recorder recorder) {
        long startNanos = System.nanoTime();

        Dfa pruned = Determinizer.pruneUnreachable(dfa);
        if (recorder != null) {
            recorder.add(PartitionAction.PRUNE, null, Collections.emptySortedSet(), List.of(),
                dfa.stateCount(), pruned.stateCount());
        }

        Dfa minimal;
        List<BitSet> ordered;
        int[] quotientOrder;
        if (pruned.stateCount() <= 1) {
            BitSet single = new BitSet();
            single.set(0, pruned.stateCount());
            ordered = List.of(single);
            quotientOrder = new int[] {0};
            minimal = pruned.withKind(AutomatonKind.MIN_DFA);
        } else {
            ordered = orderBySmallestMember(refine(pruned, recorder));
            Dfa quotient = quotient(pruned, ordered);
            quotientOrder = Determinizer.reachableOrder(quotient);
            minimal = Determinizer.pruneUnreachable(quotient);
        }

        if (recorder != null) {
            recorder.finish(pruned, ordered, quotientOrder, minimal);
        }
        logger.trace("Automata: DFA minimized - dfaStates: {}, minDfaStates: {}, timeNs: {}",
            dfa.stateCount(), minimal.stateCount(), System.nanoTime() - startNanos);
        return minimal;
    }

    /**
     * Coarsest partition in which all members of a block agree, for every symbol, on the block
     * their edge leads to, a missing edge agreeing only with another missing edge.
     */
    static List<BitSet> refine(Dfa dfa) {
        return refine(dfa, null);
    }

    private static List<BitSet> refine(Dfa dfa, Recorder recorder) {
        int n = dfa.stateCount();
        int sink = n;
        int size = n + 1;
        List<Character> symbols = new ArrayList<>(dfa.alphabet());
        int k = symbols.size();

        // sources of symbol s into target t: sources[s][offsets[s][t] .. offsets[s][t + 1])
        int[][] offsets = new int[k][];
        int[][] sources = new int[k][];
        for (int s = 0; s < k; s++) {
            int[] targets = new int[size];
            int[] offset = new int[size + 1];
            for (int id = 0; id < size; id++) {
                int target = id == sink ? Dfa.NO_TRANSITION : dfa.next(id, symbols.get(s));
                targets[id] = target == Dfa.NO_TRANSITION ? sink : target;
                offset[targets[id] + 1]++;
            }
            for (int t = 0; t < size; t++) {
                offset[t + 1] += offset[t];
            }
            int[] cursor = Arrays.copyOf(offset, size);
            int[] source = new int[size];
            for (int id = 0; id < size; id++) {
                source[cursor[targets[id]]++] = id;
            }
            offsets[s] = offset;
            sources[s] = source;
        }

        int[] group = new int[size];
        for (int id = 0; id < n; id++) {
            group[id] = dfa.isAccepting(id) ? 1 : 0;
        }
        group[sink] = 2;
        Partition partition = new Partition(group, 3);
        if (recorder != null) {
            recorder.add(PartitionAction.INITIAL_PARTITION, null, Collections.emptySortedSet(),
                recorder.blocks(partition, sink), n, partition.blockCount - 1);
        }

        Deque<int[]> worklist = new ArrayDeque<>();
        boolean[] queued = new boolean[size * k];
        for (int b = 0; b < partition.blockCount; b++) {
            for (int s = 0; s < k; s++) {
                enqueue(worklist, queued, k, b, s);
            }
        }

        while (!worklist.isEmpty()) {
            int[] work = worklist.poll();
            int splitter = work[0];
            int s = work[1];
            queued[splitter * k + s] = false;

            int[] members = Arrays.copyOfRange(partition.elements, partition.first[splitter], partition.end[splitter]);
            for (int target : members) {
                for (int i = offsets[s][target]; i < offsets[s][target + 1]; i++) {
                    partition.mark(sources[s][i]);
                }
            }

            for (int t = 0; t < partition.touchedCount; t++) {
                int block = partition.touched[t];
                int created = partition.split(block);
                if (created < 0) {
                    continue;
                }
                if (recorder != null) {
                    recorder.add(PartitionAction.SPLIT, symbols.get(s), recorder.ids(members, sink),
                        List.of(recorder.ids(partition, created), recorder.ids(partition, block)),
                        partition.blockCount - 2, partition.blockCount - 1);
                }
                for (int c = 0; c < k; c++) {
                    if (queued[block * k + c]) {
                        enqueue(worklist, queued, k, created, c);
                    } else {
                        enqueue(worklist, queued, k, partition.size(created) <= partition.size(block) ? created : block, c);
                    }
                }
            }
            partition.touchedCount = 0;
        }

        List<BitSet> blocks = new ArrayList<>(partition.blockCount - 1);
        int sinkBlock = partition.blockOf[sink];
        for (int b = 0; b < partition.blockCount; b++) {
            if (b != sinkBlock) {
                BitSet block = new BitSet(n);
                for (int i = partition.first[b]; i < partition.end[b]; i++) {
                    block.set(partition.elements[i]);
                }
                blocks.add(block);
            }
        }
        return blocks;
    }

    private static void enqueue(Deque<int[]> worklist, boolean[] queued, int symbolCount, int block, int symbol) {
        if (!queued[block * symbolCount + symbol]) {
            queued[block * symbolCount + symbol] = true;
            worklist.add(new int[] {block, symbol});
        }
    }

    private static List<BitSet> orderBySmallestMember(List<BitSet> blocks) {
        List<BitSet> ordered = new ArrayList<>(blocks);
        ordered.sort((a, b) -> Integer.compare(a.nextSetBit(0), b.nextSetBit(0)));
        return ordered;
    }

    /**
     * One state per block, state {@code i} standing for {@code ordered.get(i)}. The block of
     * state 0 (the start of a pruned DFA) comes first.
     */
    private static Dfa quotient(Dfa dfa, List<BitSet> ordered) {
        int[] blockOf = new int[dfa.stateCount()];
        for (int b = 0; b < ordered.size(); b++) {
            int index = b;
            ordered.get(b).stream().forEach(id -> blockOf[id] = index);
        }

        Dfa.Builder builder = Dfa.builder(AutomatonKind.MIN_DFA)
            .alphabet(dfa.alphabet())
            .nfaAcceptIds(dfa.nfaAcceptIds());
        for (BitSet block : ordered) {
            SortedSet<Integer> origin = new TreeSet<>();
            boolean accepting = false;
            for (int id = block.nextSetBit(0); id >= 0; id = block.nextSetBit(id + 1)) {
                origin.addAll(dfa.state(id).originNfaIds());
                accepting |= dfa.reconciledAccepting(id);
            }
            builder.addState(accepting, origin);
        }
        for (int b = 0; b < ordered.size(); b++) {
            int representative = ordered.get(b).nextSetBit(0);
            int from = b;
            dfa.state(representative).transitions().forEach((symbol, target) ->
                builder.addTransition(from, symbol, blockOf[target]));
        }
        return builder.start(blockOf[dfa.startId()]).build();
    }

    /**
     * Refinable partition over {@code 0..size-1}. Each block is a contiguous slice of
     * {@code elements}; marked members are swapped to the front of their slice.
     */
    private static final class Partition {
        final int[] elements;
        final int[] location;
        final int[] blockOf;
        final int[] first;
        final int[] end;
        final int[] marked;
        final int[] touched;
        int blockCount;
        int touchedCount;

        Partition(int[] group, int groupCount) {
            int size = group.length;
            elements = new int[size];
            location = new int[size];
            blockOf = new int[size];
            first = new int[size];
            end = new int[size];
            marked = new int[size];
            touched = new int[size];
            int position = 0;
            for (int g = 0; g < groupCount; g++) {
                int start = position;
                for (int id = 0; id < size; id++) {
                    if (group[id] == g) {
                        elements[position] = id;
                        location[id] = position;
                        blockOf[id] = blockCount;
                        position++;
                    }
                }
                if (position > start) {
                    first[blockCount] = start;
                    end[blockCount] = position;
                    blockCount++;
                }
            }
        }

        int size(int block) {
            return end[block] - first[block];
        }

        void mark(int id) {
            int block = blockOf[id];
            int from = location[id];
            int to = first[block] + marked[block];
            int other = elements[to];
            elements[to] = id;
            location[id] = to;
            elements[from] = other;
            location[other] = from;
            if (marked[block]++ == 0) {
                touched[touchedCount++] = block;
            }
        }

        /**
         * Moves the marked members of {@code block} into a new block.
         *
         * @return the new block, or -1 when all or none of the members were marked
         */
        int split(int block) {
            int count = marked[block];
            marked[block] = 0;
            if (count == size(block)) {
                return -1;
            }
            int created = blockCount++;
            first[created] = first[block];
            end[created] = first[block] + count;
            first[block] = end[created];
            for (int i = first[created]; i < end[created]; i++) {
                blockOf[elements[i]] = created;
            }
            return created;
        }
    }

    /** Collects trace records, translating pruned ids back to the ids of the input DFA. */
    private static final class Recorder {
        private final int[] originalIds;
        private final List<PartitionStep> steps = new ArrayList<>();
        private final SortedMap<Integer, SortedSet<Integer>> mapping = new TreeMap<>();

        Recorder(int[] originalIds) {
            this.originalIds = originalIds;
        }

        void add(PartitionAction action, Character symbol, SortedSet<Integer> splitter,
                 List<SortedSet<Integer>> blocks, int before, int after) {
            steps.add(new PartitionStep(steps.size(), action, symbol, splitter, blocks, before, after));
        }

        SortedSet<Integer> ids(int[] members, int sink) {
            SortedSet<Integer> ids = new TreeSet<>();
            for (int id : members) {
                if (id != sink) {
                    ids.add(originalIds[id]);
                }
            }
            return ids;
        }

        SortedSet<Integer> ids(Partition partition, int block) {
            SortedSet<Integer> ids = new TreeSet<>();
            for (int i = partition.first[block]; i < partition.end[block]; i++) {
                ids.add(originalIds[partition.elements[i]]);
            }
            return ids;
        }

        SortedSet<Integer> ids(BitSet block) {
            SortedSet<Integer> ids = new TreeSet<>();
            block.stream().forEach(id -> ids.add(originalIds[id]));
            return ids;
        }

        List<SortedSet<Integer>> blocks(Partition partition, int sink) {
            List<SortedSet<Integer>> blocks = new ArrayList<>();
            for (int b = 0; b < partition.blockCount; b++) {
                if (b != partition.blockOf[sink]) {
                    blocks.add(ids(partition, b));
                }
            }
            return blocks;
        }

        /**
         * Records the final blocks and maps each minimal state to its block.
         *
         * @param quotientOrder quotient state at each minimal state id
         */
        void finish(Dfa pruned, List<BitSet> ordered, int[] quotientOrder, Dfa minimal) {
            List<SortedSet<Integer>> blocks = new ArrayList<>(ordered.size());
            for (BitSet block : ordered) {
                blocks.add(ids(block));
            }
            add(PartitionAction.QUOTIENT, null, Collections.emptySortedSet(), blocks,
                pruned.stateCount(), minimal.stateCount());
            for (int id = 0; id < quotientOrder.length; id++) {
                mapping.put(id, blocks.get(quotientOrder[id]));
            }
        }
    }
}
