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

package com.axonops.regexkit.compiler;

import com.axonops.regexkit.node.AtomicGroup;
import com.axonops.regexkit.node.Backreference;
import com.axonops.regexkit.node.Concat;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Lookaround;
import com.axonops.regexkit.node.Node;
import java.util.List;

/**
 * Rewrites atomic groups for engines without native support.
 *
 * <p>{@code (?>X)} becomes {@code (?=(X))\N}, where {@code N} numbers a new internal capturing
 * group. The lookahead commits to the first way {@code X} matches without consuming input, and
 * the backreference then consumes exactly that text, so nothing inside {@code X} is retried when
 * the rest of the pattern fails.
 *
 * <p>Inside a lookbehind the engine cannot refer back to a group defined in the same lookbehind, so
 * there the atomic group becomes a plain non-capturing group. A fixed-length lookbehind body
 * matches the same text either way.
 *
 * <p>When the engine supports atomic groups natively the tree is returned unchanged. Must run
 * before group numbering so the internal groups are numbered in place.
 *
 * @since 1.0.0
 */
public final class AtomicGroupLowering extends TreeRewriter {

    private final boolean nativeSupport;
    private int lowered;
    private int lookbehindDepth;

    public AtomicGroupLowering(boolean nativeSupport) {
        this.nativeSupport = nativeSupport;
    }

    public Node lower(Node root) {
        return nativeSupport ? root : rewrite(root);
    }

    /** Number of atomic groups rewritten so far. */
    public int lowered() {
        return lowered;
    }

    @Override
    public Node visitAtomicGroup(AtomicGroup atomicGroup) {
        Node child = rewrite(atomicGroup.child());
        if (nativeSupport) {
            return child == atomicGroup.child() ? atomicGroup : atomicGroup.withChild(child);
        }
        lowered++;
        if (lookbehindDepth > 0) {
            return new Group(child, null, false);
        }
        Group internal = Group.internal(child);
        return new Concat(List.of(
            new Lookaround(internal, Lookaround.Direction.AHEAD, false),
            new Backreference(internal.id())));
    }

    @Override
    public Node visitLookaround(Lookaround lookaround) {
        if (lookaround.direction() != Lookaround.Direction.BEHIND) {
            return super.visitLookaround(lookaround);
        }
        lookbehindDepth++;
        try {
            return super.visitLookaround(lookaround);
        } finally {
            lookbehindDepth--;
        }
    }
}
