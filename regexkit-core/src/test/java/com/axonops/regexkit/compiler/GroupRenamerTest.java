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

import com.axonops.regexkit.api.DuplicateGroupNameException;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.Renaming;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.axonops.regexkit.node.Nodes.*;
import static org.assertj.core.api.Assertions.*;

class GroupRenamerTest {

    private Group foo;
    private Group bar;
    private Group foobar;

    private static String emit(Node root) {
        CaptureRegistry registry = CaptureRegistry.build(root);
        return new PatternEmitter(RegexDialect.PYTHON, new BackreferenceResolver(registry), false).emit(root);
    }

    @BeforeEach
    void setUp() {
        foo = named("foo", literal("foo"));
        bar = named("bar", literal("bar"));
        foobar = named("foobar", concat(foo, conditional(foo, bar, concat())));
    }

    // ===== Rename Tests =====

    @Test
    void testOriginalPattern() {
        assertThat(emit(foobar)).isEqualTo("(?P<foobar>(?P<foo>foo)(?(foo)(?P<bar>bar)|))");
    }

    @Test
    void testRenameKeepsConditionalWorking() {
        Node renamed = GroupRenamer.rename(foobar, Renaming.of(Map.of("foo", "food", "bar", "barn")));

        assertThat(emit(renamed)).isEqualTo("(?P<foobar>(?P<food>foo)(?(food)(?P<barn>bar)|))");
    }

    @Test
    void testRenameWithFunction() {
        Node renamed = GroupRenamer.rename(foobar, name -> Optional.of(name.toUpperCase()));

        assertThat(emit(renamed)).isEqualTo("(?P<FOOBAR>(?P<FOO>foo)(?(FOO)(?P<BAR>bar)|))");
    }

    @Test
    void testRenameDoesNotMutateOriginal() {
        GroupRenamer.rename(foobar, Renaming.of(Map.of("foo", "food")));

        assertThat(foo.name()).isEqualTo("foo");
        assertThat(emit(foobar)).contains("(?P<foo>foo)");
    }

    @Test
    void testRenameKeepsIdentities() {
        Group renamed = (Group) GroupRenamer.rename(foobar, Renaming.of(Map.of("foobar", "all")));

        assertThat(renamed.id()).isEqualTo(foobar.id());
        assertThat(renamed.name()).isEqualTo("all");
    }

    @Test
    void testRenameIsDeterministic() {
        Renaming renaming = Renaming.of(Map.of("foo", "food"));

        assertThat(GroupRenamer.rename(foobar, renaming)).isEqualTo(GroupRenamer.rename(foobar, renaming));
    }

    @Test
    void testUnchangedTreeReturnedAsIs() {
        assertThat(GroupRenamer.rename(foobar, Renaming.of(Map.of("unused", "x")))).isSameAs(foobar);
    }

    @Test
    void testBackreferenceFollowsRename() {
        Group word = named("word", oneOrMore(range('a', 'z')));
        Node root = concat(word, literal(" "), backreference(word));

        Node renamed = GroupRenamer.rename(root, Renaming.of(Map.of("word", "w")));

        assertThat(emit(renamed)).isEqualTo("(?P<w>[a-z]+)\\ (?P=w)");
    }

    @Test
    void testRenameToExistingNameRejected() {
        assertThatThrownBy(() -> GroupRenamer.rename(foobar, Renaming.of(Map.of("foo", "bar"))))
            .isInstanceOfSatisfying(DuplicateGroupNameException.class,
                e -> assertThat(e.getGroupName()).isEqualTo("bar"));
    }

    @Test
    void testRenameTwoGroupsToSameNameRejected() {
        assertThatThrownBy(() -> GroupRenamer.rename(foobar, Renaming.of(Map.of("foo", "x", "bar", "x"))))
            .isInstanceOf(DuplicateGroupNameException.class);
    }

    @Test
    void testSwapNames() {
        Node swapped = GroupRenamer.rename(foobar, Renaming.of(Map.of("foo", "bar", "bar", "foo")));

        assertThat(emit(swapped)).isEqualTo("(?P<foobar>(?P<bar>foo)(?(bar)(?P<foo>bar)|))");
    }

    @Test
    void testInvalidNewNameRejected() {
        assertThatThrownBy(() -> GroupRenamer.rename(foobar, Renaming.of(Map.of("foo", "not valid"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ===== Drop Names Tests =====

    @Test
    void testDropNamesFallsBackToNumbers() {
        Node unnamed = GroupRenamer.dropNames(foobar);

        assertThat(emit(unnamed)).isEqualTo("((foo)(?(2)(bar)|))");
    }

    @Test
    void testDropSelectedNames() {
        Node partial = GroupRenamer.rename(foobar, Renaming.of(Map.of(), Set.of("foo")));

        assertThat(emit(partial)).isEqualTo("(?P<foobar>(foo)(?(2)(?P<bar>bar)|))");
    }

    @Test
    void testDropNamesKeepsGroupCount() {
        Node unnamed = GroupRenamer.dropNames(foobar);
        CaptureRegistry before = CaptureRegistry.build(foobar);
        CaptureRegistry after = CaptureRegistry.build(unnamed);

        assertThat(after.groupCount()).isEqualTo(before.groupCount());
        assertThat(after.publicNames()).isEmpty();
    }

    @Test
    void testDropNamesMakesReferencesNumeric() {
        Group first = named("first", literal("a"));
        Group second = named("other", literal("b"));
        Node unnamed = GroupRenamer.dropNames(concat(first, second, backreference(second)));

        assertThat(emit(unnamed)).isEqualTo("(a)(b)\\2");
    }
}
