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
 * Matches {@code thenBranch} if the capturing group identified by {@code test} took part in the
 * match so far, otherwise {@code elseBranch}. The test itself is zero-width.
 *
 * @since 1.0.0
 */
public record Conditional(NodeId id, NodeId test, Node thenBranch, Node elseBranch) implements Node {

    public Conditional {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(test, "test cannot be null");
        Objects.requireNonNull(thenBranch, "thenBranch cannot be null");
        Objects.requireNonNull(elseBranch, "elseBranch cannot be null");
    }

    public Conditional(NodeId test, Node thenBranch, Node elseBranch) {
        this(NodeId.next(), test, thenBranch, elseBranch);
    }

    public Conditional withBranches(Node newThen, Node newElse) {
        return new Conditional(id, test, newThen, newElse);
    }

    @Override
    public List<Node> children() {
        return List.of(thenBranch, elseBranch);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
