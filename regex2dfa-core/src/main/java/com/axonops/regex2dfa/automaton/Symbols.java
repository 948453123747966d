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

/**
 * Reserved characters of the regex and automaton vocabulary.
 *
 * <p>Input symbols are ASCII letters and digits. The epsilon marker {@code ε} is an operand in
 * regex text and the reserved label of epsilon transitions in exported automata; it never appears
 * in an alphabet.
 *
 * @since 1.0.0
 */
public final class Symbols {

    public static final char EPSILON = 'ε';
    public static final char ALTERNATION = '|';
    public static final char CONCATENATION = '.';
    public static final char STAR = '*';
    public static final char PLUS = '+';
    public static final char OPTIONAL = '?';
    public static final char OPEN_GROUP = '(';
    public static final char CLOSE_GROUP = ')';

    private Symbols() {
        // Utility class
    }

    /**
     * Tests whether {@code c} may label a transition (letters and digits only).
     *
     * @param c candidate symbol
     * @return true for {@code [a-zA-Z0-9]}
     */
    public static boolean isInputSymbol(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    /** Operand of a regex: an input symbol or the epsilon marker. */
    public static boolean isOperand(char c) {
        return c == EPSILON || isInputSymbol(c);
    }

    public static boolean isUnaryOperator(char c) {
        return c == STAR || c == PLUS || c == OPTIONAL;
    }

    public static boolean isBinaryOperator(char c) {
        return c == ALTERNATION || c == CONCATENATION;
    }

    /**
     * Operator precedence: alternation 1, concatenation 2, unary postfix 3.
     *
     * @param operator an operator character
     * @return precedence, or 0 for non-operators
     */
    public static int precedence(char operator) {
        switch (operator) {
            case ALTERNATION:
                return 1;
            case CONCATENATION:
                return 2;
            case STAR:
            case PLUS:
            case OPTIONAL:
                return 3;
            default:
                return 0;
        }
    }
}
