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
import com.axonops.regexkit.node.Concat;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.RepeatCounts;
import com.axonops.regexkit.node.Repetition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites repetitions whose counts no single quantifier can express.
 *
 * <p>No common engine syntax has a stride quantifier, so a count set such as {@code {1,3,5}} is
 * emitted as an alternation of quantifiers over its maximal contiguous runs, largest counts first
 * ({@code X{5}|X{3}|X}), or smallest first for lazy repetitions. An unbounded progression with
 * stride {@code s > 1} that starts at {@code t} becomes {@code X{t}(?:X{s})*} and is tried before
 * the finite runs (after them when lazy).
 *
 * <p>Every use of {@code X} after the first is a {@link FreshCopy}, so that the capturing groups of
 * each copy are numbered separately and references inside a copy point at that copy's groups.
 *
 * @since 1.0.0
 */
public final class RepetitionExpansion extends TreeRewriter {

    private int expanded;

    public Node expand(Node root) {
        return rewrite(root);
    }

    /** Number of repetitions rewritten so far. */
    public int expanded() {
        return expanded;
    }

    @Override
    public Node visitRepetition(Repetition repetition) {
        Node child = rewrite(repetition.child());
        RepeatCounts counts = repetition.counts();
        if (counts.isSimple()) {
            return child == repetition.child() ? repetition : repetition.withChild(child);
        }
        expanded++;

        List<Integer> finite = counts.finite();
        int headEnd = finite.size();
        Node tail = null;
        Copies copies = new Copies(child);
        if (counts.unbounded()) {
            int stride = counts.stride();
            headEnd = finite.size() - 1;
            while (headEnd > 0 && finite.get(headEnd) - finite.get(headEnd - 1) == stride) {
                headEnd--;
            }
            tail = unboundedTail(copies, finite.get(headEnd), stride, repetition.lazy());
        }

        List<Node> runs = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= headEnd; i++) {
            if (i == headEnd || finite.get(i) != finite.get(i - 1) + 1) {
                RepeatCounts run = RepeatCounts.between(finite.get(start), finite.get(i - 1));
                runs.add(new Repetition(copies.next(), run, repetition.lazy()));
                start = i;
            }
        }
        if (!repetition.lazy()) {
            Collections.reverse(runs);
        }

        List<Node> alternatives = new ArrayList<>(runs.size() + 1);
        if (tail != null && !repetition.lazy()) {
            alternatives.add(tail);
        }
        alternatives.addAll(runs);
        if (tail != null && repetition.lazy()) {
            alternatives.add(tail);
        }
        return alternatives.size() == 1
            ? alternatives.get(0)
            : new Alternation(repetition.id(), alternatives);
    }

    private static Node unboundedTail(Copies copies, int start, int stride, boolean lazy) {
        if (stride == 1) {
            return new Repetition(copies.next(), RepeatCounts.atLeast(start), lazy);
        }
        Node step = new Repetition(
            new Repetition(copies.next(), RepeatCounts.exactly(stride)), RepeatCounts.zeroOrMore(), lazy);
        if (start == 0) {
            return step;
        }
        Node prefix = new Repetition(copies.next(), RepeatCounts.exactly(start));
        return new Concat(List.of(prefix, step));
    }

    private static final class Copies {
        private final Node original;
        private boolean used;

        Copies(Node original) {
            this.original = original;
        }

        Node next() {
            if (!used) {
                used = true;
                return original;
            }
            return FreshCopy.of(original);
        }
    }
}
