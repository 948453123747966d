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
 * Thrown when Thompson construction receives a postfix sequence it cannot assemble.
 *
 * <p>Parser output never triggers this; it guards callers that feed hand-written postfix text.
 *
 * @since 1.0.0
 */
public final class AutomatonBuildException extends AutomatonException {

    public enum Reason {
        /** An operator found fewer fragments on the stack than it consumes. */
        STACK_UNDERFLOW,
        /** Zero or several fragments left at the end, or an unknown token. */
        MALFORMED_POSTFIX
    }

    private final String postfix;
    private final Reason reason;

    public AutomatonBuildException(String postfix, Reason reason, String message) {
        super("Automata: NFA construction failed: " + message + " (postfix: " + truncate(postfix) + ")");
        this.postfix = postfix;
        this.reason = Objects.requireNonNull(reason, "reason cannot be null");
    }

    public String getPostfix() {
        return postfix;
    }

    public Reason getReason() {
        return reason;
    }
}
