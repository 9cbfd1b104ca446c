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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Matches exactly one character from a set of code point ranges and class escapes, or from its
 * complement when {@code negated}.
 *
 * <p>Ranges are kept as given; the emitter sorts and coalesces them. An empty non-negated class
 * matches nothing.
 *
 * @param id node identity
 * @param ranges code point ranges (single characters are one-point ranges)
 * @param escapes class escapes such as {@link SpecialKind#DIGIT}
 * @param negated whether the class matches the complement of its members
 * @since 1.0.0
 */
public record CharClass(NodeId id, List<CharRange> ranges, Set<SpecialKind> escapes, boolean negated)
    implements Node {

    public CharClass {
        Objects.requireNonNull(id, "id cannot be null");
        ranges = List.copyOf(ranges);
        escapes = escapes.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(escapes));
        for (SpecialKind escape : escapes) {
            if (!escape.isClassEscape()) {
                throw new IllegalArgumentException(escape + " cannot appear inside a character class");
            }
        }
    }

    public CharClass(Collection<CharRange> ranges, Set<SpecialKind> escapes, boolean negated) {
        this(NodeId.next(), List.copyOf(ranges), escapes, negated);
    }

    /** Class of the individual characters of {@code chars}. */
    public static CharClass of(String chars) {
        List<CharRange> ranges = new ArrayList<>();
        chars.codePoints().forEach(cp -> ranges.add(CharRange.of(cp)));
        return new CharClass(ranges, Set.of(), false);
    }

    public static CharClass of(CharRange... ranges) {
        return new CharClass(List.of(ranges), Set.of(), false);
    }

    public static CharClass range(int start, int end) {
        return of(CharRange.of(start, end));
    }

    /** Same members, complemented. Keeps the identity. */
    public CharClass negate() {
        return new CharClass(id, ranges, escapes, !negated);
    }

    public boolean isEmpty() {
        return ranges.isEmpty() && escapes.isEmpty();
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCharClass(this);
    }
}
