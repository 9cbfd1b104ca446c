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
 * Zero-width assertion that {@code child} does (or, when negated, does not) match ahead of or
 * behind the current position.
 *
 * @since 1.0.0
 */
public record Lookaround(NodeId id, Node child, Direction direction, boolean negated) implements Node {

    /** Side of the current position the assertion inspects. */
    public enum Direction {
        AHEAD,
        BEHIND
    }

    public Lookaround {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(child, "child cannot be null");
        Objects.requireNonNull(direction, "direction cannot be null");
    }

    public Lookaround(Node child, Direction direction, boolean negated) {
        this(NodeId.next(), child, direction, negated);
    }

    public Lookaround withChild(Node newChild) {
        return new Lookaround(id, newChild, direction, negated);
    }

    public boolean isBehind() {
        return direction == Direction.BEHIND;
    }

    @Override
    public List<Node> children() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLookaround(this);
    }
}
