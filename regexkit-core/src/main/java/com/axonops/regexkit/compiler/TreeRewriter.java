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
import com.axonops.regexkit.node.Repetition;
import com.axonops.regexkit.node.ScopedFlags;
import com.axonops.regexkit.node.Special;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for passes that rebuild a tree.
 *
 * <p>Every visit method rewrites the children first and rebuilds the node around them. By default
 * the rebuilt node keeps the identity of the original, references keep their targets, and a node
 * whose children and identity are unchanged is returned as is. Subclasses override the visit
 * methods for the variants they transform, and {@link #idOf}/{@link #referenceTo} to reassign
 * identities.
 *
 * @since 1.0.0
 */
public abstract class TreeRewriter implements NodeVisitor<Node> {

    public Node rewrite(Node node) {
        return node.accept(this);
    }

    /** Identity of the node rebuilt from {@code original}. */
    protected NodeId idOf(Node original) {
        return original.id();
    }

    /** Target of a rebuilt reference that pointed at {@code target}. */
    protected NodeId referenceTo(NodeId target) {
        return target;
    }

    protected List<Node> rewriteAll(List<Node> nodes) {
        List<Node> rewritten = new ArrayList<>(nodes.size());
        boolean changed = false;
        for (Node node : nodes) {
            Node result = rewrite(node);
            changed |= result != node;
            rewritten.add(result);
        }
        return changed ? rewritten : nodes;
    }

    @Override
    public Node visitLiteral(Literal literal) {
        NodeId id = idOf(literal);
        return id.equals(literal.id()) ? literal : new Literal(id, literal.text());
    }

    @Override
    public Node visitCharClass(CharClass charClass) {
        NodeId id = idOf(charClass);
        return id.equals(charClass.id())
            ? charClass
            : new CharClass(id, charClass.ranges(), charClass.escapes(), charClass.negated());
    }

    @Override
    public Node visitConcat(Concat concat) {
        NodeId id = idOf(concat);
        List<Node> children = rewriteAll(concat.children());
        return id.equals(concat.id()) && children == concat.children() ? concat : new Concat(id, children);
    }

    @Override
    public Node visitAlternation(Alternation alternation) {
        NodeId id = idOf(alternation);
        List<Node> children = rewriteAll(alternation.children());
        return id.equals(alternation.id()) && children == alternation.children()
            ? alternation
            : new Alternation(id, children);
    }

    @Override
    public Node visitRepetition(Repetition repetition) {
        NodeId id = idOf(repetition);
        Node child = rewrite(repetition.child());
        return id.equals(repetition.id()) && child == repetition.child()
            ? repetition
            : new Repetition(id, child, repetition.counts(), repetition.lazy());
    }

    @Override
    public Node visitGroup(Group group) {
        NodeId id = idOf(group);
        Node child = rewrite(group.child());
        return id.equals(group.id()) && child == group.child()
            ? group
            : new Group(id, child, group.name(), group.capturing(), group.internal());
    }

    @Override
    public Node visitBackreference(Backreference backreference) {
        NodeId id = idOf(backreference);
        NodeId target = referenceTo(backreference.target());
        return id.equals(backreference.id()) && target.equals(backreference.target())
            ? backreference
            : new Backreference(id, target);
    }

    @Override
    public Node visitLookaround(Lookaround lookaround) {
        NodeId id = idOf(lookaround);
        Node child = rewrite(lookaround.child());
        return id.equals(lookaround.id()) && child == lookaround.child()
            ? lookaround
            : new Lookaround(id, child, lookaround.direction(), lookaround.negated());
    }

    @Override
    public Node visitConditional(Conditional conditional) {
        NodeId id = idOf(conditional);
        NodeId test = referenceTo(conditional.test());
        Node thenBranch = rewrite(conditional.thenBranch());
        Node elseBranch = rewrite(conditional.elseBranch());
        boolean unchanged = id.equals(conditional.id())
            && test.equals(conditional.test())
            && thenBranch == conditional.thenBranch()
            && elseBranch == conditional.elseBranch();
        return unchanged ? conditional : new Conditional(id, test, thenBranch, elseBranch);
    }

    @Override
    public Node visitAtomicGroup(AtomicGroup atomicGroup) {
        NodeId id = idOf(atomicGroup);
        Node child = rewrite(atomicGroup.child());
        return id.equals(atomicGroup.id()) && child == atomicGroup.child()
            ? atomicGroup
            : new AtomicGroup(id, child);
    }

    @Override
    public Node visitComment(Comment comment) {
        NodeId id = idOf(comment);
        return id.equals(comment.id()) ? comment : new Comment(id, comment.text());
    }

    @Override
    public Node visitSpecial(Special special) {
        NodeId id = idOf(special);
        return id.equals(special.id()) ? special : new Special(id, special.kind());
    }

    @Override
    public Node visitScopedFlags(ScopedFlags scopedFlags) {
        NodeId id = idOf(scopedFlags);
        Node child = rewrite(scopedFlags.child());
        return id.equals(scopedFlags.id()) && child == scopedFlags.child()
            ? scopedFlags
            : new ScopedFlags(id, child, scopedFlags.enabled(), scopedFlags.disabled());
    }
}
