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

/**
 * Exhaustive dispatch over the {@link Node} variants.
 *
 * <p>Children are not visited automatically; each implementation decides the traversal order.
 *
 * @param <R> result of visiting a node
 * @since 1.0.0
 */
public interface NodeVisitor<R> {

    R visitLiteral(Literal literal);

    R visitCharClass(CharClass charClass);

    R visitConcat(Concat concat);

    R visitAlternation(Alternation alternation);

    R visitRepetition(Repetition repetition);

    R visitGroup(Group group);

    R visitBackreference(Backreference backreference);

    R visitLookaround(Lookaround lookaround);

    R visitConditional(Conditional conditional);

    R visitAtomicGroup(AtomicGroup atomicGroup);

    R visitComment(Comment comment);

    R visitSpecial(Special special);

    R visitScopedFlags(ScopedFlags scopedFlags);
}
