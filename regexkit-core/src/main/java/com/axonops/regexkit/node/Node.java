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

/**
 * An immutable regular expression tree node.
 *
 * <p>Nodes form an ownership tree: a parent exclusively owns the nodes returned by {@link
 * #children()}. {@link Backreference} and {@link Conditional} additionally hold a non-owning
 * {@link NodeId} that names a capturing {@link Group} elsewhere in the same tree.
 *
 * <p>Thread-safe: nodes are never mutated after construction and may be shared freely between
 * trees and threads. Transformations ({@code rename}, lowering) build new trees.
 *
 * <p>Every compiler pass dispatches through {@link NodeVisitor}, so adding a variant here is a
 * compile error in every pass until it is handled.
 *
 * @since 1.0.0
 */
public sealed interface Node
    permits Literal,
            CharClass,
            Concat,
            Alternation,
            Repetition,
            Group,
            Backreference,
            Lookaround,
            Conditional,
            AtomicGroup,
            Comment,
            Special,
            ScopedFlags {

    /** Identity of this node, assigned at construction. */
    NodeId id();

    /** Owned children in emission (left-to-right) order. */
    List<Node> children();

    <R> R accept(NodeVisitor<R> visitor);
}
