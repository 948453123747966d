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
import com.axonops.regex2dfa.automaton.Nfa;
import com.axonops.regex2dfa.automaton.Symbols;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thompson construction: postfix tokens to an {@link Nfa}.
 *
 * <p>Each token pushes or combines fragments with exactly one start and one accept state:
 * <ul>
 *   <li>symbol {@code c}: start --c--> accept; {@code ε}: start --ε--> accept</li>
 *   <li>{@code .}: A.accept --ε--> B.start</li>
 *   <li>{@code |}: new start --ε--> A.start, B.start; A.accept, B.accept --ε--> new accept</li>
 *   <li>{@code *}: new start --ε--> A.start, new accept; A.accept --ε--> A.start, new accept</li>
 *   <li>{@code +}: A.accept --ε--> A.start, new accept</li>
 *   <li>{@code ?}: new start --ε--> A.start, new accept; A.accept --ε--> new accept</li>
 * </ul>
 *
 * <p>Only the accept state of the final fragment is accepting; accepts of composed fragments are
 * demoted by construction. Ids of the result are assigned breadth-first from the start state, so
 * the start state is always 0.
 *
 * <p>Instances are stateless and thread-safe; every call works on its own arena.
 *
 * @since 1.0.0
 */
public final class NfaBuilder {
    private static final Logger logger = LoggerFactory.getLogger(NfaBuilder.class);

    /** Default bound on NFA size. */
    public static final int DEFAULT_MAX_NFA_STATES = 10_000;

    private final int maxNfaStates;

    public NfaBuilder() {
        this(DEFAULT_MAX_NFA_STATES);
    }

    public NfaBuilder(int maxNfaStates) {
        if (maxNfaStates < 2) {
            throw new IllegalArgumentException("maxNfaStates must be >= 2, got: " + maxNfaStates);
        }
        this.maxNfaStates = maxNfaStates;
    }

    public Nfa build(PostfixExpression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return build(expression.postfix());
    }

    /**
     * Builds the NFA of a postfix token sequence.
     *
     * @param postfix one character per token, concatenation written as {@code .}
     * @return NFA tagged {@link com.axonops.regex2dfa.automaton.AutomatonKind#NFA}
     * @throws AutomatonBuildException if an operator lacks operands, a token is unknown, or the
     *         sequence does not reduce to exactly one fragment
     * @throws ResourceLimitException if more than the configured number of states is needed
     */
    public Nfa build(String postfix) {
        Objects.requireNonNull(postfix, "postfix cannot be null");
        Arena arena = new Arena(postfix);
        Deque<Fragment> stack = new ArrayDeque<>();

        for (int i = 0; i < postfix.length(); i++) {
            char token = postfix.charAt(i);
            if (Symbols.isOperand(token)) {
                stack.push(arena.symbol(token));
            } else if (token == Symbols.CONCATENATION) {
                Fragment right = pop(stack, postfix, token);
                Fragment left = pop(stack, postfix, token);
                stack.push(arena.concatenate(left, right));
            } else if (token == Symbols.ALTERNATION) {
                Fragment right = pop(stack, postfix, token);
                Fragment left = pop(stack, postfix, token);
                stack.push(arena.alternate(left, right));
            } else if (token == Symbols.STAR) {
                stack.push(arena.star(pop(stack, postfix, token)));
            } else if (token == Symbols.PLUS) {
                stack.push(arena.plus(pop(stack, postfix, token)));
            } else if (token == Symbols.OPTIONAL) {
                stack.push(arena.optional(pop(stack, postfix, token)));
            } else {
                throw new AutomatonBuildException(postfix, Reason.MALFORMED_POSTFIX,
                    "unknown token '" + token + "' at position " + i);
            }
        }

        if (stack.size() != 1) {
            throw new AutomatonBuildException(postfix, Reason.MALFORMED_POSTFIX,
                stack.size() + " fragments left, expected 1");
        }
        Nfa nfa = arena.toNfa(stack.pop());
        logger.trace("Automata: NFA built - postfix: {}, states: {}, transitions: {}",
            postfix, nfa.stateCount(), nfa.transitionCount());
        return nfa;
    }

    public int maxNfaStates() {
        return maxNfaStates;
    }

    private static Fragment pop(Deque<Fragment> stack, String postfix, char operator) {
        if (stack.isEmpty()) {
            throw new AutomatonBuildException(postfix, Reason.STACK_UNDERFLOW,
                "'" + operator + "' is missing an operand");
        }
        return stack.pop();
    }

    /**
     * Partial automaton with one entry and one exit. Composing operators take ownership through
     * {@link #consume()}; a fragment can be consumed once.
     */
    static final class Fragment {
        private final int start;
        private final int accept;
        private boolean consumed;

        Fragment(int start, int accept) {
            this.start = start;
            this.accept = accept;
        }

        Fragment consume() {
            if (consumed) {
                throw new IllegalStateException("Fragment (" + start + " -> " + accept + ") was already composed");
            }
            consumed = true;
            return this;
        }

        int start() {
            return start;
        }

        int accept() {
            return accept;
        }
    }

    /**
     * Mutable state storage for one construction. Ids are local to the arena and renumbered when
     * the final automaton is produced.
     */
    final class Arena {
        private final String postfix;
        private final List<TreeMap<Character, TreeSet<Integer>>> transitions = new ArrayList<>();
        private final List<TreeSet<Integer>> epsilon = new ArrayList<>();

        Arena(String postfix) {
            this.postfix = postfix;
        }

        int newState() {
            if (transitions.size() >= maxNfaStates) {
                throw new ResourceLimitException("maxNfaStates", maxNfaStates,
                    "NFA for postfix of length " + postfix.length() + " needs more states");
            }
            transitions.add(new TreeMap<>());
            epsilon.add(new TreeSet<>());
            return transitions.size() - 1;
        }

        void edge(int from, char symbol, int to) {
            if (symbol == Symbols.EPSILON) {
                epsilon.get(from).add(to);
            } else {
                transitions.get(from).computeIfAbsent(symbol, s -> new TreeSet<>()).add(to);
            }
        }

        Fragment symbol(char symbol) {
            int start = newState();
            int accept = newState();
            edge(start, symbol, accept);
            return new Fragment(start, accept);
        }

        Fragment concatenate(Fragment left, Fragment right) {
            Fragment a = left.consume();
            Fragment b = right.consume();
            edge(a.accept(), Symbols.EPSILON, b.start());
            return new Fragment(a.start(), b.accept());
        }

        Fragment alternate(Fragment left, Fragment right) {
            Fragment a = left.consume();
            Fragment b = right.consume();
            int start = newState();
            int accept = newState();
            edge(start, Symbols.EPSILON, a.start());
            edge(start, Symbols.EPSILON, b.start());
            edge(a.accept(), Symbols.EPSILON, accept);
            edge(b.accept(), Symbols.EPSILON, accept);
            return new Fragment(start, accept);
        }

        Fragment star(Fragment inner) {
            Fragment a = inner.consume();
            int start = newState();
            int accept = newState();
            edge(start, Symbols.EPSILON, a.start());
            edge(start, Symbols.EPSILON, accept);
            edge(a.accept(), Symbols.EPSILON, accept);
            edge(a.accept(), Symbols.EPSILON, a.start());
            return new Fragment(start, accept);
        }

        Fragment plus(Fragment inner) {
            Fragment a = inner.consume();
            int accept = newState();
            edge(a.accept(), Symbols.EPSILON, accept);
            edge(a.accept(), Symbols.EPSILON, a.start());
            return new Fragment(a.start(), accept);
        }

        Fragment optional(Fragment inner) {
            Fragment a = inner.consume();
            int start = newState();
            int accept = newState();
            edge(start, Symbols.EPSILON, a.start());
            edge(start, Symbols.EPSILON, accept);
            edge(a.accept(), Symbols.EPSILON, accept);
            return new Fragment(start, accept);
        }

        /** Freezes the arena, numbering states in breadth-first order from the start state. */
        Nfa toNfa(Fragment result) {
            Fragment root = result.consume();
            int[] renumbered = new int[transitions.size()];
            Arrays.fill(renumbered, -1);
            List<Integer> order = new ArrayList<>(transitions.size());
            Deque<Integer> queue = new ArrayDeque<>();
            renumbered[root.start()] = 0;
            order.add(root.start());
            queue.add(root.start());
            while (!queue.isEmpty()) {
                int current = queue.poll();
                for (SortedSet<Integer> targets : transitions.get(current).values()) {
                    visit(targets, renumbered, order, queue);
                }
                visit(epsilon.get(current), renumbered, order, queue);
            }

            Nfa.Builder builder = Nfa.builder();
            for (int old : order) {
                builder.addState(old == root.accept());
            }
            for (int old : order) {
                int from = renumbered[old];
                for (Map.Entry<Character, TreeSet<Integer>> entry : transitions.get(old).entrySet()) {
                    for (int target : entry.getValue()) {
                        builder.addTransition(from, entry.getKey(), renumbered[target]);
                    }
                }
                for (int target : epsilon.get(old)) {
                    builder.addEpsilon(from, renumbered[target]);
                }
            }
            return builder.start(0).build();
        }

        private void visit(SortedSet<Integer> targets, int[] renumbered, List<Integer> order, Deque<Integer> queue) {
            for (int target : targets) {
                if (renumbered[target] < 0) {
                    renumbered[target] = order.size();
                    order.add(target);
                    queue.add(target);
                }
            }
        }
    }
}
