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

import java.util.Objects;

/**
 * Thrown when a regex cannot be turned into a postfix expression.
 *
 * @since 1.0.0
 */
public final class RegexParseException extends AutomatonException {

    /** Parse failure category. */
    public enum Reason {
        /** An unmatched {@code )} or an unclosed {@code (}. */
        UNBALANCED_PARENTHESIS,
        /** A character that is neither an operand nor an operator. */
        INVALID_SYMBOL,
        /** Operators without the operands they need, or an empty group. */
        MALFORMED_EXPRESSION
    }

    private final String regex;
    private final Reason reason;
    private final int position;

    public RegexParseException(String regex, Reason reason, int position, String message) {
        super("Automata: Regex parse failed: " + message + " at position " + position
            + " (regex: " + truncate(regex) + ")");
        this.regex = regex;
        this.reason = Objects.requireNonNull(reason, "reason cannot be null");
        this.position = position;
    }

    public String getRegex() {
        return regex;
    }

    public Reason getReason() {
        return reason;
    }

    /** Zero-based index of the offending character in the regex. */
    public int getPosition() {
        return position;
    }
}
