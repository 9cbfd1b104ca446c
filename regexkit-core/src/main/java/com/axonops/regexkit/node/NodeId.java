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

package com.axonops.regexkit.node;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-unique identity of a node.
 *
 * <p>Backreferences and conditionals point at capturing groups through this handle rather than
 * through object references, so a renamed copy of a group (which keeps its identity) is still the
 * target of every reference to the original.
 *
 * @param value the numeric handle
 * @since 1.0.0
 */
public record NodeId(long value) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    /** Allocates a fresh identity. Thread-safe. */
    public static NodeId next() {
        return new NodeId(SEQUENCE.incrementAndGet());
    }

    @Override
    public String toString() {
        return "node#" + value;
    }
}
