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

/**
 * What one record of a subset-construction trace describes.
 *
 * @since 1.0.0
 */
public enum SubsetAction {
    /** Closure of the NFA start state became DFA state 0. */
    INITIAL,
    /** A DFA state was taken off the work queue. */
    PROCESS,
    /** The current subset has a non-empty move on a symbol. */
    TRANSITION,
    /** No NFA state of the current subset has an edge on the symbol. */
    NO_TRANSITION
}
