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

import com.axonops.regexkit.api.CaptureGroupInfo;
import com.axonops.regexkit.api.DuplicateGroupNameException;
import com.axonops.regexkit.api.UnresolvedBackreferenceException;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Literal;
import com.axonops.regexkit.node.Node;
import org.junit.jupiter.api.Test;

import static com.axonops.regexkit.node.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Group numbering and reference resolution.
 */
class CaptureRegistryTest {

    // ===== Numbering Tests =====

    @Test
    void testGroupsNumberedByOpeningParenthesis() {
        Group inner = named("inner", literal("b"));
        Group outer = named("outer", concat(literal("a"), inner));
        Group last = capture(literal("c"));
        Node root = concat(outer, group(literal("x")), last);

        CaptureRegistry registry = CaptureRegistry.build(root);

        assertThat(registry.groupCount()).isEqualTo(3);
        assertThat(registry.indexOf(outer.id())).hasValue(1);
        assertThat(registry.indexOf(inner.id())).hasValue(2);
        assertThat(registry.indexOf(last.id())).hasValue(3);
        assertThat(registry.publicNames()).containsExactly(entry("outer", 1), entry("inner", 2));
    }

    @Test
    void testNonCapturingGroupsNotNumbered() {
        CaptureRegistry registry = CaptureRegistry.build(group(group(literal("x"))));

        assertThat(registry.groupCount()).isZero();
        assertThat(registry.publicNames()).isEmpty();
    }

    @Test
    void testGroupsInsideConditionalBranchesNumbered() {
        Group test = capture(literal("t"));
        Group then = named("then", literal("a"));
        Group otherwise = named("otherwise", literal("b"));
        Node root = concat(test, conditional(test, then, otherwise));

        CaptureRegistry registry = CaptureRegistry.build(root);

        assertThat(registry.publicNames()).containsExactly(entry("then", 2), entry("otherwise", 3));
    }

    @Test
    void testSharedGroupTakesOneIndexPerOccurrence() {
        Group shared = capture(literal("x"));
        Node root = concat(shared, literal("-"), shared);

        CaptureRegistry registry = CaptureRegistry.build(root);

        assertThat(registry.groupCount()).isEqualTo(2);
        assertThat(registry.indexOf(shared.id())).hasValue(1);
        assertThat(registry.groups()).extracting(CaptureGroupInfo::index).containsExactly(1, 2);
    }

    @Test
    void testInternalGroupsLeftOutOfPublicNames() {
        Group internal = Group.internal(literal("x"));
        Node root = concat(named("a", literal("a")), internal);

        CaptureRegistry registry = CaptureRegistry.build(root);

        assertThat(registry.groupCount()).isEqualTo(2);
        assertThat(registry.publicNames()).containsOnlyKeys("a");
        assertThat(registry.groups().get(1).internal()).isTrue();
    }

    @Test
    void testDuplicateNameRejected() {
        Node root = alternation(named("word", literal("a")), named("word", literal("b")));

        assertThatThrownBy(() -> CaptureRegistry.build(root))
            .isInstanceOfSatisfying(DuplicateGroupNameException.class,
                e -> assertThat(e.getGroupName()).isEqualTo("word"));
    }

    @Test
    void testSharedNamedGroupIsDuplicate() {
        Group shared = named("word", literal("x"));

        assertThatThrownBy(() -> CaptureRegistry.build(concat(shared, shared)))
            .isInstanceOf(DuplicateGroupNameException.class);
    }

    @Test
    void testDeepTreeDoesNotOverflow() {
        Node node = literal("x");
        for (int i = 0; i < 50_000; i++) {
            node = capture(node);
        }

        assertThat(CaptureRegistry.build(node).groupCount()).isEqualTo(50_000);
    }

    // ===== Resolution Tests =====

    @Test
    void testResolveNamedAndNumbered() {
        Group named = named("year", literal("2024"));
        Group numbered = capture(literal("x"));
        Node root = concat(named, numbered, backreference(named), backreference(numbered));
        BackreferenceResolver resolver = new BackreferenceResolver(CaptureRegistry.build(root));

        assertThat(resolver.resolve(named.id())).isEqualTo(new GroupReference(1, "year"));
        assertThat(resolver.resolve(numbered.id())).isEqualTo(new GroupReference(2, null));
        assertThat(resolver.resolve(numbered.id()).isNamed()).isFalse();
        assertThat(resolver.resolveAll(root)).isEqualTo(2);
    }

    @Test
    void testForwardReferenceRejected() {
        Group later = capture(literal("x"));
        Node root = concat(backreference(later), later);
        BackreferenceResolver resolver = new BackreferenceResolver(CaptureRegistry.build(root));

        assertThatThrownBy(() -> resolver.resolveAll(root))
            .isInstanceOfSatisfying(UnresolvedBackreferenceException.class,
                e -> assertThat(e.getTarget()).isEqualTo(later.id()))
            .hasMessageContaining("open or not yet matched");
    }

    @Test
    void testReferenceInsideOwnGroupRejected() {
        Literal body = literal("a");
        Group placeholder = capture(body);
        // same identity, child now refers back to the group itself
        Group open = new Group(placeholder.id(), concat(body, backreference(placeholder)), null, true, false);
        BackreferenceResolver resolver = new BackreferenceResolver(CaptureRegistry.build(open));

        assertThatThrownBy(() -> resolver.resolveAll(open))
            .isInstanceOf(UnresolvedBackreferenceException.class);
    }

    @Test
    void testReferenceAfterClosedGroupResolves() {
        Group first = capture(literal("x"));
        Node root = concat(first, repeat(concat(capture(literal("y")), backreference(first)), 2), backreference(first));

        assertThat(new BackreferenceResolver(CaptureRegistry.build(root)).resolveAll(root)).isEqualTo(2);
    }

    @Test
    void testConditionalMayPrecedeItsGroup() {
        Group later = capture(literal("x"));
        Node root = concat(conditional(later, literal("a"), literal("b")), later);

        assertThat(new BackreferenceResolver(CaptureRegistry.build(root)).resolveAll(root)).isEqualTo(1);
    }

    @Test
    void testReferenceToSharedGroupAfterFirstOccurrence() {
        Group shared = capture(literal("s"));
        Node root = concat(shared, backreference(shared), shared);

        assertThat(new BackreferenceResolver(CaptureRegistry.build(root)).resolveAll(root)).isEqualTo(1);
    }

    @Test
    void testReferenceToGroupOutsideTreeUnresolved() {
        Group unrelated = capture(literal("x"));
        Node root = concat(literal("a"), backreference(unrelated));
        BackreferenceResolver resolver = new BackreferenceResolver(CaptureRegistry.build(root));

        assertThatThrownBy(() -> resolver.resolveAll(root))
            .isInstanceOfSatisfying(UnresolvedBackreferenceException.class,
                e -> assertThat(e.getTarget()).isEqualTo(unrelated.id()));
    }

    @Test
    void testConditionalTestUnresolved() {
        Group unrelated = capture(literal("x"));
        Node root = conditional(unrelated, literal("a"), literal("b"));
        BackreferenceResolver resolver = new BackreferenceResolver(CaptureRegistry.build(root));

        assertThatThrownBy(() -> resolver.resolveAll(root))
            .isInstanceOf(UnresolvedBackreferenceException.class);
    }
}
