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

import com.axonops.regexkit.api.UnsupportedConstructException;
import com.axonops.regexkit.node.CharClass;
import com.axonops.regexkit.node.CharRange;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.RegexFlag;
import com.axonops.regexkit.node.RepeatCounts;
import com.axonops.regexkit.node.SpecialKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.axonops.regexkit.node.Nodes.*;
import static org.assertj.core.api.Assertions.*;

class PatternEmitterTest {

    private static String emit(Node root) {
        return emit(root, RegexDialect.PYTHON);
    }

    private static String emit(Node root, RegexDialect dialect) {
        CaptureRegistry registry = CaptureRegistry.build(root);
        return new PatternEmitter(dialect, new BackreferenceResolver(registry), true).emit(root);
    }

    // ===== Literal Escaping Tests =====

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "abc       | abc",
        "a.b*c     | a\\.b\\*c",
        "(x)       | \\(x\\)",
        "[y]{1,2}  | \\[y\\]\\{1,2\\}",
        "^a$       | \\^a\\$",
        "a-b&c~d#e | a\\-b\\&c\\~d\\#e",
        "1+1?      | 1\\+1\\?"
    })
    void testLiteralMetacharactersEscaped(String text, String expected) {
        assertThat(emit(literal(text))).isEqualTo(expected);
    }

    @Test
    void testLiteralSpaceAndControlCharacters() {
        assertThat(emit(literal("a b"))).isEqualTo("a\\ b");
        assertThat(emit(literal("\t\n\r\f"))).isEqualTo("\\t\\n\\r\\f");
        assertThat(emit(literal("\u0001\u007f"))).isEqualTo("\\u0001\\u007f");
    }

    @Test
    void testNonAsciiLiteralUnchanged() {
        assertThat(emit(literal("café 😀"))).isEqualTo("café\\ 😀");
    }

    // ===== Precedence Tests =====

    @Test
    void testRepetitionBindsTighterThanConcatenation() {
        assertThat(emit(concat(literal("a"), zeroOrMore(literal("b"))))).isEqualTo("ab*");
        assertThat(emit(zeroOrMore(literal("ab")))).isEqualTo("(?:ab)*");
    }

    @Test
    void testAlternationWrappedInsideConcatenation() {
        Node node = concat(alternation(literal("ab"), literal("cd")), literal("e"));

        assertThat(emit(node)).isEqualTo("(?:ab|cd)e");
    }

    @Test
    void testAlternationWrappedInsideRepetition() {
        assertThat(emit(oneOrMore(alternation(literal("ab"), literal("cd"))))).isEqualTo("(?:ab|cd)+");
    }

    @Test
    void testTopLevelAlternationNotWrapped() {
        assertThat(emit(alternation(literal("ab"), literal("cd")))).isEqualTo("ab|cd");
    }

    @Test
    void testGroupBodyNotWrapped() {
        assertThat(emit(capture(alternation(literal("a"), literal("bc"))))).isEqualTo("(a|bc)");
        assertThat(emit(group(alternation(literal("a"), literal("bc"))))).isEqualTo("(?:a|bc)");
    }

    @Test
    void testRepeatedRepetitionWrapped() {
        Node node = repeat(repeat(literal("a"), RepeatCounts.exactly(2)), RepeatCounts.zeroOrMore());

        assertThat(emit(node)).isEqualTo("(?:a{2})*");
    }

    @Test
    void testRepeatedAnchorWrapped() {
        assertThat(emit(optional(special(SpecialKind.START_LINE)))).isEqualTo("(?:^)?");
    }

    @Test
    void testConcatenationAssociativity() {
        Node left = concat(concat(literal("a"), literal("b")), literal("c"));
        Node right = concat(literal("a"), concat(literal("b"), literal("c")));

        assertThat(emit(left)).isEqualTo("abc");
        assertThat(emit(right)).isEqualTo("abc");
    }

    @Test
    void testEmptyConcatenationEmitsNothing() {
        assertThat(emit(concat())).isEmpty();
        assertThat(emit(oneOrMore(literal("")))).isEqualTo("(?:)+");
    }

    // ===== Quantifier Tests =====

    @ParameterizedTest
    @CsvSource({
        "0, 1, false, a?",
        "0, 1, true, a??",
        "2, 4, false, 'a{2,4}'",
        "2, 4, true, 'a{2,4}?'",
        "3, 3, false, 'a{3}'",
        "3, 3, true, 'a{3}'",
        "1, 1, false, a"
    })
    void testBoundedQuantifiers(int min, int max, boolean lazy, String expected) {
        Node node = lazy
            ? lazy(literal("a"), RepeatCounts.between(min, max))
            : repeat(literal("a"), RepeatCounts.between(min, max));

        assertThat(emit(node)).isEqualTo(expected);
    }

    @Test
    void testUnboundedQuantifiers() {
        assertThat(emit(zeroOrMore(literal("a")))).isEqualTo("a*");
        assertThat(emit(oneOrMore(literal("a")))).isEqualTo("a+");
        assertThat(emit(repeat(literal("a"), RepeatCounts.atLeast(3)))).isEqualTo("a{3,}");
        assertThat(emit(lazy(literal("a"), RepeatCounts.atLeast(3)))).isEqualTo("a{3,}?");
        assertThat(emit(lazy(literal("a"), RepeatCounts.zeroOrMore()))).isEqualTo("a*?");
    }

    @Test
    void testNonSimpleRepetitionMustBeExpanded() {
        assertThatThrownBy(() -> emit(repeat(literal("a"), 1, 3, 5)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be expanded");
    }

    // ===== Character Class Tests =====

    @Test
    void testAdjacentClassesInAlternationMerged() {
        Node node = alternation(range('a', 'z'), range('0', '9'));

        assertThat(emit(node)).isEqualTo("[0-9a-z]");
    }

    @Test
    void testNegatedClassNotMerged() {
        Node node = alternation(range('a', 'z'), range('0', '9').negate());

        assertThat(emit(node)).isEqualTo("[a-z]|[^0-9]");
    }

    @Test
    void testClassMergeKeepsOtherBranches() {
        Node node = alternation(charClass("x"), charClass("y"), literal("foo"), charClass("z"));

        assertThat(emit(node)).isEqualTo("[xy]|foo|[z]");
    }

    @Test
    void testClassRangesCoalesced() {
        assertThat(emit(charClass("abc"))).isEqualTo("[a-c]");
        assertThat(emit(charClass("ab"))).isEqualTo("[ab]");
        assertThat(emit(charClass(CharRange.of('a', 'f'), CharRange.of('d', 'k'), CharRange.of('x')))).isEqualTo("[a-kx]");
    }

    @Test
    void testClassMetacharactersEscaped() {
        assertThat(emit(charClass("-"))).isEqualTo("[\\-]");
        assertThat(emit(charClass("]^"))).isEqualTo("[\\]\\^]");
        assertThat(emit(charClass("\\&~"))).isEqualTo("[\\&\\\\\\~]");
        assertThat(emit(charClass(".*"))).isEqualTo("[*.]");
        assertThat(emit(charClass(" #a"))).isEqualTo("[\\ \\#a]");
    }

    @Test
    void testClassEscapesFollowMembers() {
        CharClass node = new CharClass(List.of(CharRange.of('_')), Set.of(SpecialKind.WORD_CHAR, SpecialKind.DIGIT), false);

        assertThat(emit(node)).isEqualTo("[_\\d\\w]");
        assertThat(emit(node.negate())).isEqualTo("[^_\\d\\w]");
    }

    @Test
    void testEmptyClasses() {
        CharClass empty = new CharClass(List.of(), Set.of(), false);

        assertThat(emit(empty)).isEqualTo("(?!)");
        assertThat(emit(empty.negate())).isEqualTo("[\\s\\S]");
    }

    @Test
    void testEmptyAlternationNeverMatches() {
        assertThat(emit(alternation())).isEqualTo("(?!)");
        assertThat(emit(concat(literal("a"), alternation()))).isEqualTo("a(?!)");
    }

    // ===== Reference Tests =====

    @Test
    void testNumericBackreferenceSeparatedFromDigit() {
        Group group = capture(literal("a"));

        assertThat(emit(concat(group, backreference(group), literal("1")))).isEqualTo("(a)\\1(?:)1");
        assertThat(emit(concat(group, backreference(group), literal("x")))).isEqualTo("(a)\\1x");
    }

    @Test
    void testNumericBackreferenceSeparatedFromDigitAcrossNesting() {
        Group group = capture(literal("a"));
        Node node = concat(concat(group, backreference(group)), concat(literal("0"), literal("b")));

        assertThat(emit(node)).isEqualTo("(a)\\1(?:)0b");
    }

    @Test
    void testNamedBackreferencePython() {
        Group word = named("word", oneOrMore(special(SpecialKind.WORD_CHAR)));

        assertThat(emit(concat(word, literal(" "), backreference(word))))
            .isEqualTo("(?P<word>\\w+)\\ (?P=word)");
    }

    @Test
    void testNamedBackreferenceJava() {
        Group word = named("word", oneOrMore(special(SpecialKind.WORD_CHAR)));

        assertThat(emit(concat(word, literal(" "), backreference(word)), RegexDialect.JAVA))
            .isEqualTo("(?<word>\\w+)\\ \\k<word>");
    }

    @Test
    void testPythonBackreferenceAboveNinetyNineUnsupported() {
        List<Node> items = new ArrayList<>();
        Group last = null;
        for (int i = 0; i < 100; i++) {
            last = capture(literal("a"));
            items.add(last);
        }
        items.add(backreference(last));
        Node node = concat(items);

        assertThatThrownBy(() -> emit(node))
            .isInstanceOf(UnsupportedConstructException.class)
            .hasMessageContaining("100");
        assertThat(emit(node, RegexDialect.JAVA)).endsWith("(a)\\100");
    }

    @Test
    void testConditionalPython() {
        Group foo = capture(literal("foo"));
        Node node = concat(optional(foo), conditional(foo, literal("bar"), literal("baz")));

        assertThat(emit(node)).isEqualTo("(foo)?(?(1)bar|baz)");
    }

    @Test
    void testConditionalOnNamedGroupUsesName() {
        Group foo = named("foo", literal("foo"));
        Node node = concat(foo, conditional(foo, alternation(literal("a"), literal("b")), concat()));

        assertThat(emit(node)).isEqualTo("(?P<foo>foo)(?(foo)(?:a|b)|)");
    }

    @Test
    void testConditionalUnsupportedInJava() {
        Group foo = capture(literal("foo"));
        Node node = concat(optional(foo), conditional(foo, literal("bar"), literal("baz")));

        assertThatThrownBy(() -> emit(node, RegexDialect.JAVA))
            .isInstanceOfSatisfying(UnsupportedConstructException.class, e -> {
                assertThat(e.getDialect()).isEqualTo(RegexDialect.JAVA);
                assertThat(e.getConstruct()).isEqualTo("conditional");
            });
    }

    // ===== Assertion and Special Tests =====

    @Test
    void testLookarounds() {
        Node node = concat(lookbehind(literal("a")), literal("b"), negativeLookahead(literal("c")),
            negativeLookbehind(literal("d")), lookahead(literal("e")));

        assertThat(emit(node)).isEqualTo("(?<=a)b(?!c)(?<!d)(?=e)");
    }

    @Test
    void testAtomicGroupNative() {
        assertThat(emit(atomic(oneOrMore(literal("a"))))).isEqualTo("(?>a+)");
    }

    @Test
    void testAtomicGroupWithoutNativeSupportMustBeLowered() {
        Node node = atomic(literal("a"));
        CaptureRegistry registry = CaptureRegistry.build(node);
        PatternEmitter emitter = new PatternEmitter(RegexDialect.PYTHON, new BackreferenceResolver(registry), false);

        assertThatThrownBy(() -> emitter.emit(node))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be lowered");
    }

    @Test
    void testSpecialsPerDialect() {
        Node node = concat(special(SpecialKind.START_STRING), special(SpecialKind.DIGIT), special(SpecialKind.END_STRING));

        assertThat(emit(node)).isEqualTo("\\A\\d\\Z");
        assertThat(emit(node, RegexDialect.JAVA)).isEqualTo("\\A\\d\\z");
    }

    @Test
    void testCommentPerDialect() {
        Node node = commented(literal("a"), "the letter a");

        assertThat(emit(node)).isEqualTo("a(?#the letter a)");
        assertThat(emit(node, RegexDialect.JAVA)).isEqualTo("a");
    }

    // ===== Scoped Flags Tests =====

    @Test
    void testFlagLettersSorted() {
        assertThat(emit(withFlags(literal("foobar"), RegexFlag.IGNORECASE, RegexFlag.ASCII))).isEqualTo("(?ai:foobar)");
        assertThat(emit(withFlags(literal("foobar"), RegexFlag.VERBOSE, RegexFlag.IGNORECASE)))
            .isEqualTo("(?ix:foobar)");
    }

    @Test
    void testJavaFlagLetters() {
        assertThat(emit(withFlags(literal("foobar"), RegexFlag.IGNORECASE, RegexFlag.UNICODE), RegexDialect.JAVA))
            .isEqualTo("(?Ui:foobar)");
        assertThatThrownBy(() -> emit(withFlags(literal("foobar"), RegexFlag.ASCII), RegexDialect.JAVA))
            .isInstanceOf(UnsupportedConstructException.class);
    }

    @Test
    void testJavaGroupNamesRestricted() {
        assertThat(emit(named("year2", literal("x")), RegexDialect.JAVA)).isEqualTo("(?<year2>x)");
        assertThatThrownBy(() -> emit(named("first_name", literal("x")), RegexDialect.JAVA))
            .isInstanceOf(UnsupportedConstructException.class)
            .hasMessageContaining("first_name");
    }

    // ===== Helper Tests =====

    @Test
    void testCoalesce() {
        List<CharRange> ranges = List.of(CharRange.of('m', 'p'), CharRange.of('a'), CharRange.of('b', 'c'), CharRange.of('o', 'z'));

        assertThat(PatternEmitter.coalesce(ranges)).containsExactly(CharRange.of('a', 'c'), CharRange.of('m', 'z'));
    }

    @Test
    void testMergeCharClassesLeavesSingleClassAlone() {
        CharClass single = range('a', 'z');

        assertThat(PatternEmitter.mergeCharClasses(List.of(single, literal("x")))).first().isSameAs(single);
    }
}
