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
 * What one record of a minimization trace describes.
 *
 * @since 1.0.0
 */
public enum PartitionAction {
    /** Unreachable states were removed. */
    PRUNE,
    /** Reachable states were split into non-accepting and accepting blocks. */
    INITIAL_PARTITION,
    /** A block was split by a (splitter, symbol) pair. */
    SPLIT,
    /** The final blocks became the states of the minimal DFA. */
    QUOTIENT
}
