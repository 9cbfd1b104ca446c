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

import java.util.List;
import java.util.Objects;

/**
 * Matches {@code child} any number of times allowed by {@code counts}.
 *
 * @param id node identity
 * @param child repeated sub-expression
 * @param counts accepted repetition counts
 * @param lazy prefer fewer repetitions (reluctant quantifier) instead of more
 * @since 1.0.0
 */
public record Repetition(NodeId id, Node child, RepeatCounts counts, boolean lazy) implements Node {

    public Repetition {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(child, "child cannot be null");
        Objects.requireNonNull(counts, "counts cannot be null");
    }

    public Repetition(Node child, RepeatCounts counts) {
        this(NodeId.next(), child, counts, false);
    }

    public Repetition(Node child, RepeatCounts counts, boolean lazy) {
        this(NodeId.next(), child, counts, lazy);
    }

    public Repetition withChild(Node newChild) {
        return new Repetition(id, newChild, counts, lazy);
    }

    @Override
    public List<Node> children() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRepetition(this);
    }
}
