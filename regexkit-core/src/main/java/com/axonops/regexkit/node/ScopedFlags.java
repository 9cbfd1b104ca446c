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

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Applies inline flags to {@code child} only, as in {@code (?i-m:...)}.
 *
 * <p>A flag listed both as enabled and disabled cancels out and appears in neither set.
 *
 * @since 1.0.0
 */
public record ScopedFlags(NodeId id, Node child, Set<RegexFlag> enabled, Set<RegexFlag> disabled)
    implements Node {

    public ScopedFlags {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(child, "child cannot be null");
        EnumSet<RegexFlag> on = copy(enabled);
        EnumSet<RegexFlag> off = copy(disabled);
        for (RegexFlag flag : off) {
            if (flag.isCharset()) {
                throw new IllegalArgumentException("flag " + flag + " cannot be turned off; enable another charset flag instead");
            }
        }
        if (on.stream().filter(RegexFlag::isCharset).count() > 1) {
            throw new IllegalArgumentException("flags " + on + " are incompatible: ASCII, LOCALE and UNICODE are exclusive");
        }
        EnumSet<RegexFlag> both = EnumSet.copyOf(on);
        both.retainAll(off);
        on.removeAll(both);
        off.removeAll(both);
        enabled = Set.copyOf(on);
        disabled = Set.copyOf(off);
    }

    public ScopedFlags(Node child, Set<RegexFlag> enabled, Set<RegexFlag> disabled) {
        this(NodeId.next(), child, enabled, disabled);
    }

    public ScopedFlags withChild(Node newChild) {
        return new ScopedFlags(id, newChild, enabled, disabled);
    }

    private static EnumSet<RegexFlag> copy(Set<RegexFlag> flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        return flags.isEmpty() ? EnumSet.noneOf(RegexFlag.class) : EnumSet.copyOf(flags);
    }

    @Override
    public List<Node> children() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitScopedFlags(this);
    }
}
