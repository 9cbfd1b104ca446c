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

package com.axonops.regexkit.api;

import com.axonops.regexkit.compiler.RegexDialect;
import com.axonops.regexkit.node.Group;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Result of compiling a tree: the pattern text and what its groups mean.
 *
 * <p>{@code groupIndex} maps each public group name to its number. {@code groups} lists every
 * capturing group in the emitted text, internal ones included, so its size matches the group
 * count the engine reports.
 *
 * @param pattern emitted pattern text
 * @param groupIndex public group name to group number
 * @param groups all capturing groups, in number order
 * @param dialect syntax the pattern was emitted in
 * @since 1.0.0
 */
public record CompiledRegex(
    String pattern, Map<String, Integer> groupIndex, List<CaptureGroupInfo> groups, RegexDialect dialect) {

    public CompiledRegex {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(dialect, "dialect cannot be null");
        groupIndex = Map.copyOf(groupIndex);
        groups = List.copyOf(groups);
    }

    /** Number of capturing groups in the pattern, internal ones included. */
    public int groupCount() {
        return groups.size();
    }

    public OptionalInt indexOf(String name) {
        Integer index = groupIndex.get(name);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Number of {@code group} in this pattern. Follows the group across renames, since renaming
     * keeps its identity.
     *
     * @return the number of its first occurrence, or empty if it is not a capturing group of the
     *     compiled tree
     */
    public OptionalInt indexOf(Group group) {
        for (CaptureGroupInfo info : groups) {
            if (info.nodeId().equals(group.id())) {
                return OptionalInt.of(info.index());
            }
        }
        return OptionalInt.empty();
    }

    public Pattern toJavaPattern() {
        return toJavaPattern(0);
    }

    /**
     * Compiles the pattern with {@link java.util.regex.Pattern}.
     *
     * @param flags {@link Pattern} flags
     * @throws IllegalStateException if the pattern was not emitted in the {@link RegexDialect#JAVA} dialect
     */
    public Pattern toJavaPattern(int flags) {
        if (dialect != RegexDialect.JAVA) {
            throw new IllegalStateException("pattern was compiled for the " + dialect
                + " dialect; compile with RegexDialect.JAVA to use java.util.regex");
        }
        return Pattern.compile(pattern, flags);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
