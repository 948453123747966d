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

/**
 * Base class for every failure raised while compiling a regex or converting an automaton.
 *
 * <p>Every pipeline stage is pure and deterministic, so these exceptions always signal malformed
 * input or a violated precondition; retrying the same call fails the same way.
 *
 * @since 1.0.0
 */
public sealed class AutomatonException extends RuntimeException
    permits RegexParseException,
            AutomatonBuildException,
            ConversionException,
            ResourceLimitException {

    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }

    static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
