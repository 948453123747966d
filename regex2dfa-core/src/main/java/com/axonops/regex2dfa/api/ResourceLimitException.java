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
 * Thrown when a regex or an intermediate automaton exceeds a configured bound.
 *
 * @since 1.0.0
 */
public final class ResourceLimitException extends AutomatonException {

    private final String limit;
    private final long maximum;

    public ResourceLimitException(String limit, long maximum, String message) {
        super("Automata: Resource limit exceeded: " + message + " (" + limit + " = " + maximum + ")");
        this.limit = limit;
        this.maximum = maximum;
    }

    /** Name of the configuration property that was exceeded, e.g. {@code maxDfaStates}. */
    public String getLimit() {
        return limit;
    }

    public long getMaximum() {
        return maximum;
    }
}
