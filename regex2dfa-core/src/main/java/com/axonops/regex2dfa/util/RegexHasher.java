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


package com.axonops.regex2dfa.util;

/**
 * Compact hashes of regex text for log lines.
 *
 * <p>Logs carry the hash instead of the regex so that long expressions do not clutter them, while
 * the same regex always maps to the same hash and can still be traced across log lines.
 *
 * @since 1.0.0
 */
public final class RegexHasher {

    private RegexHasher() {
        // Utility class
    }

    /**
     * Hex form of {@link String#hashCode()}.
     *
     * @param regex regex text, may be null
     * @return up to 8 hex characters, or {@code "null"}
     */
    public static String hash(String regex) {
        if (regex == null) {
            return "null";
        }
        return Integer.toHexString(regex.hashCode());
    }
}
