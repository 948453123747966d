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

import java.util.Objects;

/**
 * Result of infix-to-postfix conversion.
 *
 * <p>Every token is a single character, so {@code postfix.charAt(i)} is the i-th token. The
 * intermediate {@code explicit} form is the source with every implicit concatenation written as
 * {@code .}; an empty source is represented by {@code ε} in both derived forms.
 *
 * @param source regex as given
 * @param explicit regex with explicit concatenation operators
 * @param postfix reverse-Polish token sequence
 * @since 1.0.0
 */
public record PostfixExpression(String source, String explicit, String postfix) {

    public PostfixExpression {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(explicit, "explicit cannot be null");
        Objects.requireNonNull(postfix, "postfix cannot be null");
    }

    public int tokenCount() {
        return postfix.length();
    }

    public char token(int index) {
        return postfix.charAt(index);
    }

    @Override
    public String toString() {
        return postfix;
    }
}
