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
import com.axonops.regexkit.node.CharRange;
import com.axonops.regexkit.node.Comment;
import com.axonops.regexkit.node.Concat;
import com.axonops.regexkit.node.Conditional;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Literal;
import com.axonops.regexkit.node.Lookaround;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.NodeVisitor;
import com.axonops.regexkit.node.RepeatCounts;
import com.axonops.regexkit.node.Repetition;
import com.axonops.regexkit.node.ScopedFlags;
import com.axonops.regexkit.node.Special;
import com.axonops.regexkit.node.SpecialKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Serializes a lowered, expanded and resolved tree to pattern text.
 *
 * <h2>Precedence</h2>
 *
 * <p>Every emitted fragment has a binding strength, from loosest to tightest: alternation,
 * sequence, quantified, atom. A fragment used where a tighter one is needed is wrapped in
 * {@code (?:...)}:
 * <ul>
 *   <li>alternation branches, concatenated items and conditional branches need a sequence;
 *   <li>a repeated item needs an atom, so {@code ab*} is emitted for {@code a} followed by
 *       {@code b*}, and {@code (?:ab)*} for {@code ab} repeated;
 *   <li>the whole pattern, and the body of a group, lookaround or flag scope, take anything.
 * </ul>
 * Single characters, character classes, groups and backreferences are atoms. Zero-width
 * anchors, lookarounds, conditionals and comments are sequences, so repeating one wraps it.
 *
 * <h2>Other rules</h2>
 *
 * <ul>
 *   <li>Adjacent non-negated character classes in an alternation are merged into one class.
 *   <li>A numeric backreference followed by a digit is separated from it by {@code (?:)}.
 *   <li>An empty alternation or empty class emits {@code (?!)}, which never matches; an empty
 *       negated class emits {@code [\s\S]}.
 * </ul>
 *
 * @since 1.0.0
 */
public final class PatternEmitter implements NodeVisitor<PatternEmitter.Emitted> {

    private static final String LITERAL_METACHARACTERS = "()[]{}?*+-|^$\\.&~# ";
    private static final String CLASS_METACHARACTERS = "\\][^-&~# ";
    private static final String NEVER = "(?!)";

    private final RegexDialect dialect;
    private final BackreferenceResolver resolver;
    private final boolean atomicGroupNativeSupport;

    public PatternEmitter(RegexDialect dialect, BackreferenceResolver resolver, boolean atomicGroupNativeSupport) {
        this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
        this.atomicGroupNativeSupport = atomicGroupNativeSupport;
    }

    public String emit(Node root) {
        return root.accept(this).text();
    }

    enum Precedence {
        ALTERNATION,
        SEQUENCE,
        QUANTIFIED,
        ATOM
    }

    /**
     * One emitted fragment.
     *
     * @param text pattern text
     * @param precedence binding strength of the text
     * @param trailingNumericReference whether the text ends with a numeric backreference
     */
    record Emitted(String text, Precedence precedence, boolean trailingNumericReference) {

        static Emitted of(String text, Precedence precedence) {
            return new Emitted(text, precedence, false);
        }

        Emitted atLeast(Precedence required) {
            if (precedence.compareTo(required) >= 0) {
                return this;
            }
            return of("(?:" + text + ")", Precedence.ATOM);
        }
    }

    private Emitted operand(Node node, Precedence required) {
        return node.accept(this).atLeast(required);
    }

    @Override
    public Emitted visitLiteral(Literal literal) {
        StringBuilder sb = new StringBuilder(literal.text().length() + 8);
        literal.text().codePoints().forEach(cp -> appendLiteral(sb, cp));
        return Emitted.of(sb.toString(), literal.length() == 1 ? Precedence.ATOM : Precedence.SEQUENCE);
    }

    @Override
    public Emitted visitCharClass(CharClass charClass) {
        if (charClass.isEmpty()) {
            return charClass.negated() ? Emitted.of("[\\s\\S]", Precedence.ATOM) : Emitted.of(NEVER, Precedence.SEQUENCE);
        }
        StringBuilder sb = new StringBuilder("[");
        if (charClass.negated()) {
            sb.append('^');
        }
        for (CharRange range : coalesce(charClass.ranges())) {
            appendClassMember(sb, range.start());
            if (range.size() > 2) {
                sb.append('-');
            }
            if (range.size() > 1) {
                appendClassMember(sb, range.end());
            }
        }
        Set<SpecialKind> escapes = charClass.escapes().isEmpty()
            ? Set.of()
            : EnumSet.copyOf(charClass.escapes());
        for (SpecialKind escape : escapes) {
            sb.append(escape.token());
        }
        return Emitted.of(sb.append(']').toString(), Precedence.ATOM);
    }

    @Override
    public Emitted visitConcat(Concat concat) {
        List<Node> children = concat.children();
        if (children.size() == 1) {
            return children.get(0).accept(this);
        }
        StringBuilder sb = new StringBuilder();
        Emitted only = null;
        int pieces = 0;
        boolean trailingReference = false;
        for (Node child : children) {
            Emitted piece = operand(child, Precedence.SEQUENCE);
            if (piece.text().isEmpty()) {
                continue;
            }
            if (trailingReference && startsWithDigit(piece.text())) {
                sb.append("(?:)");
            }
            sb.append(piece.text());
            trailingReference = piece.trailingNumericReference();
            only = piece;
            pieces++;
        }
        if (pieces == 1) {
            return only;
        }
        return new Emitted(sb.toString(), Precedence.SEQUENCE, trailingReference);
    }

    @Override
    public Emitted visitAlternation(Alternation alternation) {
        List<Node> branches = mergeCharClasses(alternation.children());
        if (branches.isEmpty()) {
            return Emitted.of(NEVER, Precedence.SEQUENCE);
        }
        if (branches.size() == 1) {
            return branches.get(0).accept(this);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < branches.size(); i++) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(operand(branches.get(i), Precedence.SEQUENCE).text());
        }
        return Emitted.of(sb.toString(), Precedence.ALTERNATION);
    }

    @Override
    public Emitted visitRepetition(Repetition repetition) {
        RepeatCounts counts = repetition.counts();
        if (!counts.isSimple()) {
            throw new IllegalStateException("repetition " + repetition.id() + " with counts " + counts
                + " must be expanded before emission");
        }
        if (counts.isExactly(1)) {
            return repetition.child().accept(this);
        }
        String quantifier;
        boolean exact = false;
        int min = counts.min();
        if (counts.unbounded()) {
            quantifier = min == 0 ? "*" : min == 1 ? "+" : "{" + min + ",}";
        } else if (min == counts.max()) {
            quantifier = "{" + min + "}";
            exact = true;
        } else if (min == 0 && counts.max() == 1) {
            quantifier = "?";
        } else {
            quantifier = "{" + min + "," + counts.max() + "}";
        }
        String lazy = repetition.lazy() && !exact ? "?" : "";
        Emitted child = operand(repetition.child(), Precedence.ATOM);
        return Emitted.of(child.text() + quantifier + lazy, Precedence.QUANTIFIED);
    }

    @Override
    public Emitted visitGroup(Group group) {
        String open;
        if (!group.capturing()) {
            open = "(?:";
        } else if (group.name() != null) {
            open = dialect.openNamedGroup(group.name());
        } else {
            open = "(";
        }
        return Emitted.of(open + group.child().accept(this).text() + ")", Precedence.ATOM);
    }

    @Override
    public Emitted visitBackreference(Backreference backreference) {
        GroupReference target = resolver.resolve(backreference.target());
        if (target.isNamed()) {
            return Emitted.of(dialect.namedBackreference(target.name()), Precedence.ATOM);
        }
        return new Emitted(dialect.numericBackreference(target.index()), Precedence.ATOM, true);
    }

    @Override
    public Emitted visitLookaround(Lookaround lookaround) {
        String open = (lookaround.isBehind() ? "(?<" : "(?") + (lookaround.negated() ? "!" : "=");
        return Emitted.of(open + lookaround.child().accept(this).text() + ")", Precedence.SEQUENCE);
    }

    @Override
    public Emitted visitConditional(Conditional conditional) {
        String open = dialect.openConditional(resolver.resolve(conditional.test()));
        String thenText = operand(conditional.thenBranch(), Precedence.SEQUENCE).text();
        String elseText = operand(conditional.elseBranch(), Precedence.SEQUENCE).text();
        return Emitted.of(open + thenText + "|" + elseText + ")", Precedence.SEQUENCE);
    }

    @Override
    public Emitted visitAtomicGroup(AtomicGroup atomicGroup) {
        if (!atomicGroupNativeSupport) {
            throw new IllegalStateException("atomic group " + atomicGroup.id() + " must be lowered before emission");
        }
        return Emitted.of("(?>" + atomicGroup.child().accept(this).text() + ")", Precedence.ATOM);
    }

    @Override
    public Emitted visitComment(Comment comment) {
        return Emitted.of(dialect.comment(comment.text()), Precedence.SEQUENCE);
    }

    @Override
    public Emitted visitSpecial(Special special) {
        return Emitted.of(dialect.special(special.kind()),
            special.kind().isZeroWidth() ? Precedence.SEQUENCE : Precedence.ATOM);
    }

    @Override
    public Emitted visitScopedFlags(ScopedFlags scopedFlags) {
        String flags = dialect.flags(scopedFlags.enabled(), scopedFlags.disabled());
        return Emitted.of("(?" + flags + ":" + scopedFlags.child().accept(this).text() + ")", Precedence.ATOM);
    }

    /** Replaces each run of two or more adjacent non-negated classes with their union. */
    static List<Node> mergeCharClasses(List<Node> branches) {
        List<Node> merged = new ArrayList<>(branches.size());
        List<CharClass> run = new ArrayList<>();
        for (Node branch : branches) {
            if (branch instanceof CharClass charClass && !charClass.negated()) {
                run.add(charClass);
                continue;
            }
            flush(run, merged);
            merged.add(branch);
        }
        flush(run, merged);
        return merged;
    }

    private static void flush(List<CharClass> run, List<Node> merged) {
        if (run.size() == 1) {
            merged.add(run.get(0));
        } else if (run.size() > 1) {
            List<CharRange> ranges = new ArrayList<>();
            Set<SpecialKind> escapes = EnumSet.noneOf(SpecialKind.class);
            for (CharClass charClass : run) {
                ranges.addAll(charClass.ranges());
                escapes.addAll(charClass.escapes());
            }
            merged.add(new CharClass(ranges, escapes, false));
        }
        run.clear();
    }

    /** Sorted ranges with overlapping and adjacent ones joined. */
    static List<CharRange> coalesce(List<CharRange> ranges) {
        List<CharRange> sorted = new ArrayList<>(ranges);
        sorted.sort(null);
        List<CharRange> result = new ArrayList<>(sorted.size());
        CharRange current = null;
        for (CharRange range : sorted) {
            if (current == null) {
                current = range;
            } else if (range.start() <= current.end() + 1) {
                current = CharRange.of(current.start(), Math.max(current.end(), range.end()));
            } else {
                result.add(current);
                current = range;
            }
        }
        if (current != null) {
            result.add(current);
        }
        return result;
    }

    static void appendLiteral(StringBuilder sb, int codePoint) {
        if (codePoint < 0x80 && LITERAL_METACHARACTERS.indexOf(codePoint) >= 0) {
            sb.append('\\').append((char) codePoint);
        } else {
            appendCharacter(sb, codePoint);
        }
    }

    static void appendClassMember(StringBuilder sb, int codePoint) {
        if (codePoint < 0x80 && CLASS_METACHARACTERS.indexOf(codePoint) >= 0) {
            sb.append('\\').append((char) codePoint);
        } else {
            appendCharacter(sb, codePoint);
        }
    }

    private static void appendCharacter(StringBuilder sb, int codePoint) {
        switch (codePoint) {
            case '\t':
                sb.append("\\t");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\f':
                sb.append("\\f");
                break;
            default:
                if (codePoint < 0x20 || codePoint == 0x7F) {
                    sb.append(String.format("\\u%04x", codePoint));
                } else {
                    sb.appendCodePoint(codePoint);
                }
        }
    }

    private static boolean startsWithDigit(String text) {
        char first = text.charAt(0);
        return first >= '0' && first <= '9';
    }
}
