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

package com.axonops.regexkit.util;

import com.axonops.regexkit.node.Node;

/**
 * Short stand-ins for patterns and trees in log messages.
 *
 * <p>Logs carry a hash instead of the pattern text, so they stay readable and never leak the
 * literals a pattern was built from. The same input always hashes to the same value, so a pattern
 * can still be traced across log lines.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * @param pattern emitted pattern text
     * @return 8-character hex string (e.g., "7a3f2b1c"), or "null"
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return String.format("%08x", pattern.hashCode());
    }

    /**
     * Identifies a tree that has not been emitted yet by its root identity and structural hash.
     *
     * @param root tree root
     * @return e.g. "node#42/0c1f3a77", or "null"
     */
    public static String hash(Node root) {
        if (root == null) {
            return "null";
        }
        return root.id() + "/" + String.format("%08x", root.hashCode());
    }
}
