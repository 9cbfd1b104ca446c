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
 * Matches the text last captured by the capturing group whose identity is {@code target}.
 *
 * <p>The target is a non-owning reference. It is resolved at compile time against the tree being
 * compiled, by identity, so renaming the target group never breaks the reference.
 *
 * @since 1.0.0
 */
public record Backreference(NodeId id, NodeId target) implements Node {

    public Backreference {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
    }

    public Backreference(NodeId target) {
        this(NodeId.next(), target);
    }

    /** Reference to {@code group}, which must be capturing. */
    public static Backreference to(Group group) {
        if (!group.capturing()) {
            throw new IllegalArgumentException("can only reference a capturing group; got non-capturing " + group.id());
        }
        return new Backreference(group.id());
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBackreference(this);
    }
}
