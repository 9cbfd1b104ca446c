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
 * Once {@code child} has matched, the engine never backtracks into it.
 *
 * @since 1.0.0
 */
public record AtomicGroup(NodeId id, Node child) implements Node {

    public AtomicGroup {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(child, "child cannot be null");
    }

    public AtomicGroup(Node child) {
        this(NodeId.next(), child);
    }

    public AtomicGroup withChild(Node newChild) {
        return new AtomicGroup(id, newChild);
    }

    @Override
    public List<Node> children() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAtomicGroup(this);
    }
}
