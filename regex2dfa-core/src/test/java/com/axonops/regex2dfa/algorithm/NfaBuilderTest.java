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

import com.axonops.regex2dfa.api.AutomatonBuildException;
import com.axonops.regex2dfa.api.AutomatonBuildException.Reason;
import com.axonops.regex2dfa.api.ResourceLimitException;
import com.axonops.regex2dfa.automaton.AutomatonKind;
import com.axonops.regex2dfa.automaton.Nfa;
import com.axonops.regex2dfa.automaton.Symbols;
import com.axonops.regex2dfa.automaton.TransitionRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.BitSet;

import static org.assertj.core.api.Assertions.*;

class NfaBuilderTest {

    private final NfaBuilder builder = new NfaBuilder();

    @Test
    void testSingleSymbol() {
        Nfa nfa = builder.build("a");

        assertThat(nfa.kind()).isEqualTo(AutomatonKind.NFA);
        assertThat(nfa.stateCount()).isEqualTo(2);
        assertThat(nfa.startId()).isEqualTo(0);
        assertThat(nfa.acceptIds()).containsExactly(1);
        assertThat(nfa.alphabet()).containsExactly('a');
        assertThat(nfa.export().transitions()).containsExactly(new TransitionRecord(0, 'a', 1));
    }

    @Test
    void testEpsilonOperand() {
        Nfa nfa = builder.build("ε");

        assertThat(nfa.stateCount()).isEqualTo(2);
        assertThat(nfa.alphabet()).isEmpty();
        assertThat(nfa.export().transitions()).containsExactly(new TransitionRecord(0, Symbols.EPSILON, 1));
    }

    @ParameterizedTest
    @CsvSource({
        "ab., 4, 3",
        "ab|, 6, 6",
        "a*, 4, 5",
        "a+, 3, 3",
        "a?, 4, 4",
        "a*b+., 7, 9",
        "ab|*a.b.b., 14, 16"
    })
    void testThompsonSizes(String postfix, int states, int transitions) {
        Nfa nfa = builder.build(postfix);

        assertThat(nfa.stateCount()).isEqualTo(states);
        assertThat(nfa.transitionCount()).isEqualTo(transitions);
        assertThat(nfa.acceptIds()).hasSize(1);
        assertThat(nfa.startId()).isEqualTo(0);
    }

    @Test
    void testAcceptStateHasNoOutgoingEdges() {
        Nfa nfa = builder.build("ab|*a.b.b.");
        int accept = nfa.acceptIds().first();

        assertThat(nfa.state(accept).transitions()).isEmpty();
        assertThat(nfa.state(accept).epsilonTargets()).isEmpty();
    }

    @Test
    void testIdsAreBreadthFirst() {
        // every state except the start is first reached from a lower id
        Nfa nfa = builder.build("ab|*a.b.b.");
        int[] firstSource = new int[nfa.stateCount()];
        Arrays.fill(firstSource, Integer.MAX_VALUE);
        for (TransitionRecord t : nfa.export().transitions()) {
            firstSource[t.to()] = Math.min(firstSource[t.to()], t.from());
        }
        for (int id = 1; id < nfa.stateCount(); id++) {
            assertThat(firstSource[id]).as("first source of state %d", id).isLessThan(id);
        }
    }

    @Test
    void testEpsilonClosureOfStar() {
        Nfa nfa = builder.build("a*");

        BitSet closure = nfa.initialClosure();

        // start, inner start and accept are reachable without input
        assertThat(closure.cardinality()).isEqualTo(3);
        assertThat(nfa.containsAccepting(closure)).isTrue();
    }

    @Test
    void testStackUnderflow() {
        assertThatThrownBy(() -> builder.build("a."))
            .isInstanceOf(AutomatonBuildException.class)
            .satisfies(e -> assertThat(((AutomatonBuildException) e).getReason()).isEqualTo(Reason.STACK_UNDERFLOW));
        assertThatThrownBy(() -> builder.build("*"))
            .isInstanceOf(AutomatonBuildException.class)
            .hasMessageContaining("'*' is missing an operand");
    }

    @Test
    void testMalformedPostfix() {
        assertThatThrownBy(() -> builder.build("ab"))
            .isInstanceOf(AutomatonBuildException.class)
            .hasMessageContaining("2 fragments left")
            .satisfies(e -> assertThat(((AutomatonBuildException) e).getReason()).isEqualTo(Reason.MALFORMED_POSTFIX));
        assertThatThrownBy(() -> builder.build(""))
            .isInstanceOf(AutomatonBuildException.class)
            .hasMessageContaining("0 fragments left");
        assertThatThrownBy(() -> builder.build("a#"))
            .isInstanceOf(AutomatonBuildException.class)
            .hasMessageContaining("unknown token '#'")
            .satisfies(e -> assertThat(((AutomatonBuildException) e).getPostfix()).isEqualTo("a#"));
    }

    @Test
    void testFragmentsCannotBeReused() {
        NfaBuilder.Arena arena = builder.new Arena("aa.");
        NfaBuilder.Fragment a = arena.symbol('a');
        NfaBuilder.Fragment b = arena.symbol('b');
        arena.concatenate(a, b);

        assertThatThrownBy(() -> arena.star(a))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already composed");
    }

    @Test
    void testStateLimit() {
        NfaBuilder small = new NfaBuilder(5);

        assertThat(small.build("ab.").stateCount()).isEqualTo(4);
        assertThatThrownBy(() -> small.build("ab|"))
            .isInstanceOf(ResourceLimitException.class)
            .satisfies(e -> assertThat(((ResourceLimitException) e).getLimit()).isEqualTo("maxNfaStates"));
    }

    @Test
    void testBuildFromParsedExpression() {
        Nfa nfa = builder.build(new RegexParser().parse("a*b+"));

        assertThat(nfa.stateCount()).isEqualTo(7);
        assertThat(nfa.alphabet()).containsExactly('a', 'b');
    }

    @Test
    void testInvalidConstruction() {
        assertThatThrownBy(() -> new NfaBuilder(1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
