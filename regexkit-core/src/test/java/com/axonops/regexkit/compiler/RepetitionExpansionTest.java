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
import com.axonops.regexkit.node.Alternation;
import com.axonops.regexkit.node.Backreference;
import com.axonops.regexkit.node.Concat;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.RepeatCounts;
import com.axonops.regexkit.node.Repetition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.regex.Pattern;

import static com.axonops.regexkit.node.Nodes.*;
import static org.assertj.core.api.Assertions.*;

class RepetitionExpansionTest {

    private static String expandAndEmit(Node root, RegexDialect dialect) {
        Node expanded = new RepetitionExpansion().expand(root);
        CaptureRegistry registry = CaptureRegistry.build(expanded);
        BackreferenceResolver resolver = new BackreferenceResolver(registry);
        resolver.resolveAll(expanded);
        return new PatternEmitter(dialect, resolver, true).emit(expanded);
    }

    private static String expandAndEmit(Node root) {
        return expandAndEmit(root, RegexDialect.PYTHON);
    }

    // ===== Finite Count Set Tests =====

    @Test
    void testIrregularCountsLargestFirst() {
        assertThat(expandAndEmit(repeat(literal("a"), 1, 3, 5))).isEqualTo("a{5}|a{3}|a");
    }

    @Test
    void testIrregularCountsLazySmallestFirst() {
        assertThat(expandAndEmit(lazy(literal("a"), RepeatCounts.of(1, 3, 5)))).isEqualTo("a|a{3}|a{5}");
    }

    @Test
    void testContiguousRunsKeptTogether() {
        assertThat(expandAndEmit(repeat(literal("a"), 0, 1, 2, 5, 6))).isEqualTo("a{5,6}|a{0,2}");
    }

    @Test
    void testExpansionWrappedWhenEmbedded() {
        assertThat(expandAndEmit(concat(repeat(literal("foo"), 1, 3, 5), literal("!"))))
            .isEqualTo("(?:(?:foo){5}|(?:foo){3}|foo)!");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6})
    void testStridedRepetitionMatchesExactlyItsCounts(int times) {
        Pattern pattern = Pattern.compile(expandAndEmit(repeat(literal("foo"), 1, 3, 5), RegexDialect.JAVA));

        assertThat(pattern.matcher("foo".repeat(times)).matches()).isEqualTo(times % 2 == 1);
    }

    // ===== Unbounded Stride Tests =====

    @Test
    void testEvenCounts() {
        assertThat(expandAndEmit(repeat(literal("a"), RepeatCounts.atLeast(0, 2)))).isEqualTo("(?:a{2})*");
    }

    @Test
    void testOddCounts() {
        assertThat(expandAndEmit(repeat(literal("a"), RepeatCounts.atLeast(1, 2)))).isEqualTo("a(?:a{2})*");
    }

    @Test
    void testStridedTailAfterIrregularHead() {
        assertThat(expandAndEmit(repeat(literal("a"), 1, 2, 5, 7, RepeatCounts.UNBOUNDED)))
            .isEqualTo("a{5}(?:a{2})*|a{1,2}");
    }

    @Test
    void testStrideOneTailAfterIrregularHead() {
        assertThat(expandAndEmit(repeat(literal("a"), 1, 3, 4, RepeatCounts.UNBOUNDED))).isEqualTo("a{3,}|a");
    }

    @Test
    void testLazyTailPlacedLast() {
        assertThat(expandAndEmit(lazy(literal("a"), RepeatCounts.of(1, 2, 4, 7, RepeatCounts.UNBOUNDED))))
            .isEqualTo("a{1,2}?|a{4}(?:a{3})*?");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 8, 9})
    void testUnboundedStrideMatchesProgression(int times) {
        RepeatCounts counts = RepeatCounts.atLeast(2, 3);
        Pattern pattern = Pattern.compile(expandAndEmit(repeat(literal("x"), counts), RegexDialect.JAVA));

        assertThat(pattern.matcher("x".repeat(times)).matches()).isEqualTo(counts.contains(times));
    }

    // ===== Group Copy Tests =====

    @Test
    void testSimpleRepetitionUntouched() {
        Node root = concat(oneOrMore(capture(literal("a"))), repeat(literal("b"), 2, 3));
        RepetitionExpansion expansion = new RepetitionExpansion();

        assertThat(expansion.expand(root)).isSameAs(root);
        assertThat(expansion.expanded()).isZero();
    }

    @Test
    void testCopiedGroupsNumberedSeparately() {
        Group group = capture(literal("x"));
        Node expanded = new RepetitionExpansion().expand(repeat(group, 1, 3));

        assertThat(CaptureRegistry.build(expanded).groupCount()).isEqualTo(2);
        assertThat(expandAndEmit(repeat(group, 1, 3))).isEqualTo("(x){3}|(x)");
    }

    @Test
    void testReferencesInsideCopyFollowCopy() {
        Group inner = capture(literal("x"));
        Node body = concat(inner, backreference(inner));
        Node expanded = new RepetitionExpansion().expand(repeat(body, 1, 3));

        assertThat(expandAndEmit(repeat(body, 1, 3))).isEqualTo("(?:(x)\\1){3}|(x)\\2");
        Alternation alternation = (Alternation) expanded;
        Concat copied = (Concat) ((Repetition) alternation.children().get(0)).child();
        Group copiedGroup = (Group) copied.children().get(0);
        Backreference copiedReference = (Backreference) copied.children().get(1);

        assertThat(copiedGroup.id()).isNotEqualTo(inner.id());
        assertThat(copiedReference.target()).isEqualTo(copiedGroup.id());
    }

    @Test
    void testReferencesOutsideCopyKeepTarget() {
        Group before = capture(literal("y"));
        Node root = concat(before, repeat(backreference(before), 1, 3));

        assertThat(expandAndEmit(root)).isEqualTo("(y)(?:\\1{3}|\\1)");
    }

    @Test
    void testNamedGroupInsideExpandedRepetitionIsDuplicate() {
        Node root = repeat(named("word", literal("x")), 1, 3);

        assertThatThrownBy(() -> expandAndEmit(root))
            .isInstanceOf(DuplicateGroupNameException.class);
    }
}
