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

import com.axonops.regex2dfa.api.RegexParseException;
import com.axonops.regex2dfa.api.RegexParseException.Reason;
import com.axonops.regex2dfa.api.ResourceLimitException;
import com.axonops.regex2dfa.automaton.Symbols;
import com.axonops.regex2dfa.util.RegexHasher;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts infix regexes into postfix form (shunting yard).
 *
 * <p>Supported syntax:
 * <ul>
 *   <li>operands: ASCII letters, digits and {@code ε}</li>
 *   <li>{@code |} alternation, precedence 1, left-associative</li>
 *   <li>implicit concatenation, written {@code .} in the output, precedence 2, left-associative</li>
 *   <li>postfix {@code *}, {@code +}, {@code ?}, precedence 3</li>
 *   <li>{@code (} and {@code )} grouping</li>
 * </ul>
 *
 * <p>Input is checked before conversion, so a regex either fails with a {@link RegexParseException}
 * naming the offending position or yields a postfix sequence the NFA builder always accepts.
 *
 * <pre>{@code
 * new RegexParser().parse("(a|b)*abb").postfix();   // "ab|*a.b.b."
 * }</pre>
 *
 * <p>Instances are stateless and thread-safe.
 *
 * @since 1.0.0
 */
public final class RegexParser {
    private static final Logger logger = LoggerFactory.getLogger(RegexParser.class);

    /** Default bound on regex length. */
    public static final int DEFAULT_MAX_REGEX_LENGTH = 1000;

    private final int maxRegexLength;

    public RegexParser() {
        this(DEFAULT_MAX_REGEX_LENGTH);
    }

    /**
     * @param maxRegexLength longest accepted regex, in characters
     */
    public RegexParser(int maxRegexLength) {
        if (maxRegexLength <= 0) {
            throw new IllegalArgumentException("maxRegexLength must be > 0, got: " + maxRegexLength);
        }
        this.maxRegexLength = maxRegexLength;
    }

    /**
     * Converts {@code regex} to postfix.
     *
     * @param regex infix regex; the empty string stands for {@code ε}
     * @return the conversion steps
     * @throws RegexParseException if the regex is malformed
     * @throws ResourceLimitException if the regex is longer than the configured bound
     */
    public PostfixExpression parse(String regex) {
        Objects.requireNonNull(regex, "regex cannot be null");
        if (regex.length() > maxRegexLength) {
            throw new ResourceLimitException("maxRegexLength", maxRegexLength,
                "regex length " + regex.length());
        }
        if (regex.isEmpty()) {
            String epsilon = String.valueOf(Symbols.EPSILON);
            return new PostfixExpression(regex, epsilon, epsilon);
        }

        String explicit = insertConcatenation(regex);
        String postfix = toPostfix(explicit);
        logger.trace("Automata: Regex parsed - hash: {}, explicit: {}, postfix: {}",
            RegexHasher.hash(regex), explicit, postfix);
        return new PostfixExpression(regex, explicit, postfix);
    }

    /**
     * Validates the token sequence and writes every implicit concatenation as {@code .}.
     *
     * <p>A concatenation goes between t1 and t2 when t1 is an operand, {@code )} or a unary
     * operator and t2 is an operand or {@code (}.
     */
    static String insertConcatenation(String regex) {
        StringBuilder out = new StringBuilder(regex.length() * 2);
        Deque<Integer> openGroups = new ArrayDeque<>();
        boolean expectOperand = true;
        char previous = 0;

        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);

            if (Symbols.isOperand(c)) {
                if (!expectOperand) {
                    out.append(Symbols.CONCATENATION);
                }
                expectOperand = false;
            } else if (c == Symbols.OPEN_GROUP) {
                if (!expectOperand) {
                    out.append(Symbols.CONCATENATION);
                }
                openGroups.push(i);
                expectOperand = true;
            } else if (c == Symbols.CLOSE_GROUP) {
                if (openGroups.isEmpty()) {
                    throw new RegexParseException(regex, Reason.UNBALANCED_PARENTHESIS, i, "unmatched ')'");
                }
                if (expectOperand) {
                    throw new RegexParseException(regex, Reason.MALFORMED_EXPRESSION, i,
                        previous == Symbols.OPEN_GROUP ? "empty group '()'" : "'|' has no right operand");
                }
                openGroups.pop();
            } else if (Symbols.isUnaryOperator(c)) {
                if (expectOperand) {
                    throw new RegexParseException(regex, Reason.MALFORMED_EXPRESSION, i,
                        "'" + c + "' has no operand");
                }
            } else if (c == Symbols.ALTERNATION) {
                if (expectOperand) {
                    throw new RegexParseException(regex, Reason.MALFORMED_EXPRESSION, i,
                        "'|' has no left operand");
                }
                expectOperand = true;
            } else {
                throw new RegexParseException(regex, Reason.INVALID_SYMBOL, i,
                    "invalid character '" + c + "'");
            }

            out.append(c);
            previous = c;
        }

        if (!openGroups.isEmpty()) {
            throw new RegexParseException(regex, Reason.UNBALANCED_PARENTHESIS, openGroups.peek(), "unclosed '('");
        }
        if (expectOperand) {
            throw new RegexParseException(regex, Reason.MALFORMED_EXPRESSION, regex.length() - 1,
                "'|' has no right operand");
        }
        return out.toString();
    }

    /**
     * Shunting yard over a validated, explicit token sequence.
     *
     * <p>Unary operators go straight to the output: they have the highest precedence and their
     * operand is already complete there.
     */
    static String toPostfix(String explicit) {
        StringBuilder out = new StringBuilder(explicit.length());
        Deque<Character> operators = new ArrayDeque<>();

        for (int i = 0; i < explicit.length(); i++) {
            char c = explicit.charAt(i);
            if (Symbols.isOperand(c) || Symbols.isUnaryOperator(c)) {
                out.append(c);
            } else if (c == Symbols.OPEN_GROUP) {
                operators.push(c);
            } else if (c == Symbols.CLOSE_GROUP) {
                while (operators.peek() != Symbols.OPEN_GROUP) {
                    out.append(operators.pop());
                }
                operators.pop();
            } else {
                // binary operators are left-associative: pop equal precedence too
                while (!operators.isEmpty()
                    && operators.peek() != Symbols.OPEN_GROUP
                    && Symbols.precedence(operators.peek()) >= Symbols.precedence(c)) {
                    out.append(operators.pop());
                }
                operators.push(c);
            }
        }
        while (!operators.isEmpty()) {
            out.append(operators.pop());
        }
        return out.toString();
    }

    public int maxRegexLength() {
        return maxRegexLength;
    }
}
