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
 * What happened at one step of a simulation trace.
 *
 * @since 1.0.0
 */
public enum StepAction {
    /** Initial configuration, nothing consumed yet. */
    START,
    /** One symbol consumed. */
    TRANSITION,
    /** No edge for the symbol; the run ends here and rejects. */
    STUCK,
    /** All input consumed in an accepting configuration. */
    ACCEPT,
    /** All input consumed in a non-accepting configuration. */
    REJECT;

    public boolean isTerminal() {
        return this == STUCK || this == ACCEPT || this == REJECT;
    }
}
