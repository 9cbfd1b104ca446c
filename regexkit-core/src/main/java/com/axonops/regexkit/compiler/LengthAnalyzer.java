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

import com.axonops.regexkit.node.Alternation;
import com.axonops.regexkit.node.AtomicGroup;
import com.axonops.regexkit.node.Backreference;
import com.axonops.regexkit.node.CharClass;
import com.axonops.regexkit.node.Comment;
import com.axonops.regexkit.node.Concat;
import com.axonops.regexkit.node.Conditional;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Literal;
import com.axonops.regexkit.node.Lookaround;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.NodeId;
import com.axonops.regexkit.node.NodeVisitor;
import com.axonops.regexkit.node.RepeatCounts;
import com.axonops.regexkit.node.Repetition;
import com.axonops.regexkit.node.ScopedFlags;
import com.axonops.regexkit.node.Special;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes {@link LengthBounds} for the nodes of one tree.
 *
 * <p>Backreferences take the bounds of the group they target, looked up in the tree the analyzer
 * was created for. A reference that cannot be resolved, or that refers back into a group still
 * being measured, is treated as {@link LengthBounds#ANY}. The analysis never fails.
 *
 * <p>Not thread-safe; create one per compilation.
 *
 * @since 1.0.0
 */
public final class LengthAnalyzer implements NodeVisitor<LengthBounds> {

    private final Map<NodeId, Group> groups;
    private final Map<NodeId, LengthBounds> groupBounds = new HashMap<>();
    private final Set<NodeId> inProgress = new HashSet<>();
    private int cycles;

    private LengthAnalyzer(Map<NodeId, Group> groups) {
        this.groups = groups;
    }

    /** Analyzer resolving backreferences against the capturing groups of {@code root}. */
    public static LengthAnalyzer forTree(Node root) {
        Map<NodeId, Group> groups = new HashMap<>();
        collectGroups(root, groups);
        return new LengthAnalyzer(groups);
    }

    /** Analyzer resolving backreferences against an already built registry. */
    public static LengthAnalyzer forRegistry(CaptureRegistry registry) {
        return new LengthAnalyzer(registry.groupsById());
    }

    private static void collectGroups(Node node, Map<NodeId, Group> groups) {
        if (node instanceof Group group && group.capturing()) {
            groups.putIfAbsent(group.id(), group);
        }
        for (Node child : node.children()) {
            collectGroups(child, groups);
        }
    }

    public LengthBounds bounds(Node node) {
        return Objects.requireNonNull(node, "node cannot be null").accept(this);
    }

    @Override
    public LengthBounds visitLiteral(Literal literal) {
        return LengthBounds.exactly(literal.length());
    }

    @Override
    public LengthBounds visitCharClass(CharClass charClass) {
        return LengthBounds.ONE;
    }

    @Override
    public LengthBounds visitConcat(Concat concat) {
        LengthBounds total = LengthBounds.ZERO;
        for (Node child : concat.children()) {
            total = total.plus(bounds(child));
        }
        return total;
    }

    @Override
    public LengthBounds visitAlternation(Alternation alternation) {
        LengthBounds result = null;
        for (Node child : alternation.children()) {
            LengthBounds childBounds = bounds(child);
            result = result == null ? childBounds : result.union(childBounds);
        }
        // matches nothing, so consumes nothing
        return result == null ? LengthBounds.ZERO : result;
    }

    @Override
    public LengthBounds visitRepetition(Repetition repetition) {
        LengthBounds child = bounds(repetition.child());
        RepeatCounts counts = repetition.counts();
        int min = LengthBounds.multiply(child.min(), counts.min());
        int max;
        if (child.max() == 0) {
            max = 0;
        } else if (counts.unbounded()) {
            max = LengthBounds.UNBOUNDED;
        } else {
            max = LengthBounds.multiply(child.max(), counts.lastFinite());
        }
        return new LengthBounds(Math.min(min, max), max);
    }

    @Override
    public LengthBounds visitGroup(Group group) {
        LengthBounds cached = groupBounds.get(group.id());
        if (cached != null) {
            return cached;
        }
        int cyclesBefore = cycles;
        boolean added = inProgress.add(group.id());
        try {
            LengthBounds result = bounds(group.child());
            if (cycles == cyclesBefore) {
                groupBounds.put(group.id(), result);
            }
            return result;
        } finally {
            if (added) {
                inProgress.remove(group.id());
            }
        }
    }

    @Override
    public LengthBounds visitBackreference(Backreference backreference) {
        Group target = groups.get(backreference.target());
        if (target == null) {
            return LengthBounds.ANY;
        }
        if (inProgress.contains(target.id())) {
            cycles++;
            return LengthBounds.ANY;
        }
        return bounds(target);
    }

    @Override
    public LengthBounds visitLookaround(Lookaround lookaround) {
        return LengthBounds.ZERO;
    }

    @Override
    public LengthBounds visitConditional(Conditional conditional) {
        return bounds(conditional.thenBranch()).union(bounds(conditional.elseBranch()));
    }

    @Override
    public LengthBounds visitAtomicGroup(AtomicGroup atomicGroup) {
        return bounds(atomicGroup.child());
    }

    @Override
    public LengthBounds visitComment(Comment comment) {
        return LengthBounds.ZERO;
    }

    @Override
    public LengthBounds visitSpecial(Special special) {
        return special.kind().isZeroWidth() ? LengthBounds.ZERO : LengthBounds.ONE;
    }

    @Override
    public LengthBounds visitScopedFlags(ScopedFlags scopedFlags) {
        return bounds(scopedFlags.child());
    }
}
