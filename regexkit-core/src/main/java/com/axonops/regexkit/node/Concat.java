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
 * Sequential composition. An empty concatenation matches the empty string.
 *
 * @since 1.0.0
 */
public record Concat(NodeId id, List<Node> children) implements Node {

    public Concat {
        Objects.requireNonNull(id, "id cannot be null");
        children = List.copyOf(children);
    }

    public Concat(List<Node> children) {
        this(NodeId.next(), children);
    }

    public Concat withChildren(List<Node> newChildren) {
        return new Concat(id, newChildren);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConcat(this);
    }
}
