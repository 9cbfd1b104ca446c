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

import com.axonops.regexkit.node.Lookaround.Direction;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Static factories for building expression trees.
 *
 * <p>Example:
 * <pre>{@code
 * Group word = named("word", oneOrMore(special(SpecialKind.WORD_CHAR)));
 * Node doubled = concat(word, literal(" "), backreference(word));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Nodes {

    private Nodes() {
    }

    public static Literal literal(String text) {
        return new Literal(text);
    }

    /** Class of the individual characters of {@code chars}. */
    public static CharClass charClass(String chars) {
        return CharClass.of(chars);
    }

    public static CharClass charClass(CharRange... ranges) {
        return CharClass.of(ranges);
    }

    /** Class containing every code point from {@code start} to {@code end} inclusive. */
    public static CharClass range(int start, int end) {
        return CharClass.range(start, end);
    }

    public static CharClass escapes(SpecialKind... kinds) {
        return new CharClass(List.of(), Set.of(kinds), false);
    }

    public static Concat concat(Node... children) {
        return new Concat(List.of(children));
    }

    public static Concat concat(List<? extends Node> children) {
        return new Concat(List.copyOf(children));
    }

    public static Alternation alternation(Node... children) {
        return new Alternation(List.of(children));
    }

    public static Alternation alternation(List<? extends Node> children) {
        return new Alternation(List.copyOf(children));
    }

    public static Repetition repeat(Node child, RepeatCounts counts) {
        return new Repetition(child, counts);
    }

    /**
     * Repetition by explicit counts.
     *
     * @param counts strictly ascending counts; the last may be {@link RepeatCounts#UNBOUNDED}
     */
    public static Repetition repeat(Node child, int... counts) {
        return new Repetition(child, RepeatCounts.of(counts));
    }

    public static Repetition lazy(Node child, RepeatCounts counts) {
        return new Repetition(child, counts, true);
    }

    public static Repetition optional(Node child) {
        return repeat(child, RepeatCounts.optional());
    }

    public static Repetition zeroOrMore(Node child) {
        return repeat(child, RepeatCounts.zeroOrMore());
    }

    public static Repetition oneOrMore(Node child) {
        return repeat(child, RepeatCounts.oneOrMore());
    }

    /** Unnamed capturing group. */
    public static Group capture(Node child) {
        return new Group(child, null, true);
    }

    public static Group named(String name, Node child) {
        return new Group(child, name, true);
    }

    /** Non-capturing group. */
    public static Group group(Node child) {
        return new Group(child, null, false);
    }

    public static Backreference backreference(Group target) {
        return Backreference.to(target);
    }

    public static Lookaround lookahead(Node child) {
        return new Lookaround(child, Direction.AHEAD, false);
    }

    public static Lookaround lookbehind(Node child) {
        return new Lookaround(child, Direction.BEHIND, false);
    }

    public static Lookaround negativeLookahead(Node child) {
        return new Lookaround(child, Direction.AHEAD, true);
    }

    public static Lookaround negativeLookbehind(Node child) {
        return new Lookaround(child, Direction.BEHIND, true);
    }

    public static Conditional conditional(Group test, Node thenBranch, Node elseBranch) {
        if (!test.capturing()) {
            throw new IllegalArgumentException("conditional must test a capturing group; got non-capturing " + test.id());
        }
        return new Conditional(test.id(), thenBranch, elseBranch);
    }

    public static AtomicGroup atomic(Node child) {
        return new AtomicGroup(child);
    }

    public static Comment comment(String text) {
        return new Comment(text);
    }

    /** {@code node} followed by an inline comment. */
    public static Concat commented(Node node, String text) {
        return concat(node, comment(text));
    }

    public static Special special(SpecialKind kind) {
        return new Special(kind);
    }

    /**
     * Enables {@code flags} for {@code node}. Flags of an existing scope are merged rather than
     * nested.
     */
    public static ScopedFlags withFlags(Node node, RegexFlag... flags) {
        if (node instanceof ScopedFlags scoped) {
            return new ScopedFlags(scoped.id(), scoped.child(), union(scoped.enabled(), flags), scoped.disabled());
        }
        return new ScopedFlags(node, union(Set.of(), flags), Set.of());
    }

    /**
     * Disables {@code flags} for {@code node}. Flags of an existing scope are merged rather than
     * nested.
     */
    public static ScopedFlags withoutFlags(Node node, RegexFlag... flags) {
        if (node instanceof ScopedFlags scoped) {
            return new ScopedFlags(scoped.id(), scoped.child(), scoped.enabled(), union(scoped.disabled(), flags));
        }
        return new ScopedFlags(node, Set.of(), union(Set.of(), flags));
    }

    /** Matches any text that does not begin with a match of {@code node}. */
    public static Concat anythingBut(Node node) {
        return concat(negativeLookahead(node), zeroOrMore(special(SpecialKind.ANY_CHAR)));
    }

    private static Set<RegexFlag> union(Set<RegexFlag> existing, RegexFlag... more) {
        EnumSet<RegexFlag> flags = EnumSet.noneOf(RegexFlag.class);
        flags.addAll(existing);
        flags.addAll(Arrays.asList(more));
        return flags;
    }
}
