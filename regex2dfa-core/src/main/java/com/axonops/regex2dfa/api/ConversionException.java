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
 * Thrown when an automaton of the wrong kind is handed to a stage, or an export record cannot be
 * turned back into an automaton.
 *
 * @since 1.0.0
 */
public final class ConversionException extends AutomatonException {

    public ConversionException(String message) {
        super("Automata: Conversion error: " + message);
    }

    public ConversionException(String message, Throwable cause) {
        super("Automata: Conversion error: " + message, cause);
    }
}
