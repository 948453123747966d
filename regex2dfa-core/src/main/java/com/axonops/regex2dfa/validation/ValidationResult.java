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


package com.axonops.regex2dfa.validation;

import java.util.List;

/**
 * Outcome of a validation check.
 *
 * <p>{@code valid} is true exactly when {@code errors} is empty. Warnings never make a result
 * invalid. Suggestions are hints for correcting the reported errors.
 *
 * @param valid whether the checked value can be used
 * @param errors problems that make the value unusable
 * @param warnings usable but suspicious constructs
 * @param suggestions correction hints, empty when valid
 * @since 1.0.0
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings, List<String> suggestions) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(suggestions);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no errors");
        }
    }

    static ValidationResult of(List<String> errors, List<String> warnings, List<String> suggestions) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, suggestions);
    }
}
