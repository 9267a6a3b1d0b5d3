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

package com.axonops.libgrok.util;

/**
 * Compact hashes of capture sub-pattern text for log lines.
 *
 * <p>Grok sub-patterns can be long (an expanded {@code %{COMBINEDAPACHELOG}} runs to hundreds of
 * characters), so capture logging prints a stable hash instead of the text.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a hex hash of a pattern string.
     *
     * @param pattern sub-pattern text, may be null
     * @return hex string, or {@code "null"} for a null pattern
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }
}
