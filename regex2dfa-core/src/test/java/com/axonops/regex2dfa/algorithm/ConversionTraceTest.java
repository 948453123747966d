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

import com.axonops.regex2dfa.automaton.AutomatonKind;
import com.axonops.regex2dfa.automaton.Dfa;
import com.axonops.regex2dfa.automaton.Nfa;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Step traces, state mappings and statistics of subset construction and minimization.
 */
class ConversionTraceTest {

    private static Nfa nfa(String regex) {
        return new NfaBuilder().build(new RegexParser().parse(regex));
    }

    private static long count(List<SubsetStep> steps, SubsetAction action) {
        return steps.stream().filter(step -> step.action() == action).count();
    }

    private static List<PartitionStep> ofAction(List<PartitionStep> steps, PartitionAction action) {
        return steps.stream().filter(step -> step.action() == action).collect(Collectors.toList());
    }

    @Test
    void testDeterminizationTraceOfClassicExample() {
        Nfa nfa = nfa("(a|b)*abb");

        DeterminizationTrace trace = new Determinizer().determinizeWithSteps(nfa);

        assertThat(trace.dfa().export()).isEqualTo(new Determinizer().determinize(nfa).export());
        List<SubsetStep> steps = trace.steps();
        assertThat(steps).hasSize(16);
        assertThat(count(steps, SubsetAction.INITIAL)).isEqualTo(1);
        assertThat(count(steps, SubsetAction.PROCESS)).isEqualTo(5);
        assertThat(count(steps, SubsetAction.TRANSITION)).isEqualTo(10);
        assertThat(count(steps, SubsetAction.NO_TRANSITION)).isZero();

        SubsetStep initial = steps.get(0);
        assertThat(initial.action()).isEqualTo(SubsetAction.INITIAL);
        assertThat(initial.dfaState()).isZero();
        assertThat(initial.subset()).containsExactlyElementsOf(nfa.initialClosure().stream().boxed().collect(Collectors.toList()));
        assertThat(initial.newState()).isTrue();

        assertThat(steps).extracting(SubsetStep::step).containsExactlyElementsOf(
            IntStream.range(0, steps.size()).boxed().collect(Collectors.toList()));
        assertThat(steps.stream().filter(SubsetStep::newState).count()).isEqualTo(5);
    }

    @Test
    void testTransitionStepsMatchStateMapping() {
        DeterminizationTrace trace = new Determinizer().determinizeWithSteps(nfa("(a|b)*abb"));

        assertThat(trace.stateMapping()).containsOnlyKeys(0, 1, 2, 3, 4);
        for (SubsetStep step : trace.steps()) {
            assertThat(step.subset()).isEqualTo(trace.stateMapping().get(step.dfaState()));
            if (step.action() == SubsetAction.TRANSITION) {
                assertThat(step.closure()).isEqualTo(trace.stateMapping().get(step.targetDfaState()));
                assertThat(step.closure()).containsAll(step.moved());
                assertThat(trace.dfa().next(step.dfaState(), step.symbol())).isEqualTo(step.targetDfaState());
            }
        }
    }

    @Test
    void testNoTransitionSteps() {
        DeterminizationTrace trace = new Determinizer().determinizeWithSteps(nfa("ab"));

        List<SubsetStep> steps = trace.steps();
        assertThat(steps).hasSize(10);
        assertThat(count(steps, SubsetAction.TRANSITION)).isEqualTo(2);
        assertThat(count(steps, SubsetAction.NO_TRANSITION)).isEqualTo(4);
        assertThat(steps).filteredOn(step -> step.action() == SubsetAction.NO_TRANSITION)
            .allSatisfy(step -> {
                assertThat(step.targetDfaState()).isEqualTo(SubsetStep.NO_STATE);
                assertThat(step.moved()).isEmpty();
                assertThat(trace.dfa().next(step.dfaState(), step.symbol())).isEqualTo(Dfa.NO_TRANSITION);
            });
        assertThat(steps.get(2).toString()).isEqualTo("2 TRANSITION D0 on 'a': move=" + steps.get(2).moved()
            + " closure=" + steps.get(2).closure() + " -> D1 (new)");
    }

    @Test
    void testDeterminizationStatistics() {
        StageStatistics statistics = new Determinizer().determinizeWithSteps(nfa("(a|b)*abb")).statistics();

        assertThat(statistics.sourceStates()).isEqualTo(14);
        assertThat(statistics.resultStates()).isEqualTo(5);
        assertThat(statistics.sourceTransitions()).isEqualTo(16);
        assertThat(statistics.resultTransitions()).isEqualTo(10);
        assertThat(statistics.alphabetSize()).isEqualTo(2);
        assertThat(statistics.stateReduction()).isEqualTo(9);
        assertThat(statistics.stateReductionPercent()).isCloseTo(64.29, within(0.01));
        assertThat(statistics.transitionReduction()).isEqualTo(6);
    }

    @Test
    void testMinimizationTraceOfClassicExample() {
        Dfa dfa = new Determinizer().determinize(nfa("(a|b)*abb"));

        MinimizationTrace trace = new Minimizer().minimizeWithSteps(dfa);

        assertThat(trace.minimalDfa().export()).isEqualTo(new Minimizer().minimize(dfa).export());
        List<PartitionStep> steps = trace.steps();
        assertThat(steps.get(0).action()).isEqualTo(PartitionAction.PRUNE);
        assertThat(steps.get(0).before()).isEqualTo(5);
        assertThat(steps.get(0).after()).isEqualTo(5);

        PartitionStep initial = steps.get(1);
        assertThat(initial.action()).isEqualTo(PartitionAction.INITIAL_PARTITION);
        SortedSet<Integer> rejecting = new TreeSet<>(Set.of(0, 1, 2, 3, 4));
        rejecting.removeAll(dfa.acceptIds());
        assertThat(initial.blocks()).containsExactly(rejecting, dfa.acceptIds());
        assertThat(initial.after()).isEqualTo(2);

        List<PartitionStep> splits = ofAction(steps, PartitionAction.SPLIT);
        assertThat(splits).hasSize(2);
        assertThat(splits).allSatisfy(split -> {
            assertThat(split.symbol()).isIn('a', 'b');
            assertThat(split.blocks()).hasSize(2);
            assertThat(split.blocks().get(0)).isNotEmpty().doesNotContainAnyElementsOf(split.blocks().get(1));
            assertThat(split.blocks().get(1)).isNotEmpty();
            assertThat(split.after()).isEqualTo(split.before() + 1);
        });
        assertThat(splits.get(0).before()).isEqualTo(2);
        assertThat(splits.get(1).after()).isEqualTo(4);

        PartitionStep last = steps.get(steps.size() - 1);
        assertThat(last.action()).isEqualTo(PartitionAction.QUOTIENT);
        assertThat(last.blocks()).hasSize(4);
        assertThat(last.before()).isEqualTo(5);
        assertThat(last.after()).isEqualTo(4);
        assertThat(steps).extracting(PartitionStep::step).containsExactlyElementsOf(
            IntStream.range(0, steps.size()).boxed().collect(Collectors.toList()));
    }

    @Test
    void testMinimalStatesMapToMergedDfaStates() {
        Dfa dfa = new Determinizer().determinize(nfa("(a|b)*abb"));

        MinimizationTrace trace = new Minimizer().minimizeWithSteps(dfa);

        assertThat(trace.partitionCount()).isEqualTo(4);
        assertThat(trace.stateMapping()).containsOnlyKeys(0, 1, 2, 3);
        // the start state and its successor on 'b' are equivalent
        assertThat(trace.stateMapping().get(0)).containsExactlyInAnyOrder(0, dfa.next(0, 'b'));
        assertThat(trace.stateMapping().values().stream().flatMap(SortedSet::stream).collect(Collectors.toList()))
            .containsExactlyInAnyOrder(0, 1, 2, 3, 4);

        Dfa minimal = trace.minimalDfa();
        trace.stateMapping().forEach((minimalId, members) -> members.forEach(id -> {
            assertThat(dfa.isAccepting(id)).isEqualTo(minimal.isAccepting(minimalId));
            for (char symbol : dfa.alphabet()) {
                int target = dfa.next(id, symbol);
                assertThat(trace.stateMapping().get(minimal.next(minimalId, symbol))).contains(target);
            }
        }));
    }

    @Test
    void testMinimizationStatistics() {
        MinimizationTrace trace = new Minimizer().minimizeWithSteps(new Determinizer().determinize(nfa("(a|b)*abb")));

        StageStatistics statistics = trace.statistics();
        assertThat(statistics.sourceStates()).isEqualTo(5);
        assertThat(statistics.resultStates()).isEqualTo(4);
        assertThat(statistics.sourceTransitions()).isEqualTo(10);
        assertThat(statistics.resultTransitions()).isEqualTo(8);
        assertThat(statistics.stateReduction()).isEqualTo(1);
        assertThat(statistics.stateReductionPercent()).isCloseTo(20.0, within(0.001));
        assertThat(statistics.transitionReduction()).isEqualTo(2);
        assertThat(statistics.toString()).contains("states=5->4 (20.00%)");
    }

    @Test
    void testMappingUsesInputIdsAndSkipsUnreachable() {
        Dfa.Builder builder = Dfa.builder(AutomatonKind.DFA);
        int orphan = builder.addState(true);
        int start = builder.addState(false);
        int left = builder.addState(true);
        int right = builder.addState(true);
        builder.addTransition(start, 'a', left).addTransition(start, 'b', right).addTransition(orphan, 'a', start);
        Dfa dfa = builder.start(start).build();

        MinimizationTrace trace = new Minimizer().minimizeWithSteps(dfa);

        assertThat(trace.steps().get(0).before()).isEqualTo(4);
        assertThat(trace.steps().get(0).after()).isEqualTo(3);
        assertThat(trace.stateMapping()).hasSize(2);
        assertThat(trace.stateMapping().get(0)).containsExactly(start);
        assertThat(trace.stateMapping().get(1)).containsExactly(left, right);
        assertThat(trace.stateMapping().values()).noneMatch(members -> members.contains(orphan));
    }

    @Test
    void testSingleStateTrace() {
        MinimizationTrace trace = new Minimizer().minimizeWithSteps(new Determinizer().determinize(nfa("")));

        assertThat(trace.steps()).extracting(PartitionStep::action)
            .containsExactly(PartitionAction.PRUNE, PartitionAction.QUOTIENT);
        assertThat(trace.stateMapping()).containsOnlyKeys(0);
        assertThat(trace.minimalDfa().kind()).isEqualTo(AutomatonKind.MIN_DFA);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a|ab", "a*b+", "(ab|c)*", "(a|ab)(c|bcd)?", "0(1|0)*1"})
    void testTracedStagesEqualPlainStages(String regex) {
        Nfa nfa = nfa(regex);
        Dfa dfa = new Determinizer().determinize(nfa);

        assertThat(new Determinizer().determinizeWithSteps(nfa).dfa().export()).isEqualTo(dfa.export());
        MinimizationTrace trace = new Minimizer().minimizeWithSteps(dfa);
        assertThat(trace.minimalDfa().export()).isEqualTo(new Minimizer().minimize(dfa).export());
        assertThat(trace.partitionCount()).isEqualTo(trace.minimalDfa().stateCount());
    }
}
