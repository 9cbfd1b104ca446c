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

import com.axonops.regexkit.api.CaptureGroupInfo;
import com.axonops.regexkit.api.DuplicateGroupNameException;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.NodeId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Group numbering for one tree.
 *
 * <p>Capturing groups are numbered from 1 in the order their opening parentheses appear in the
 * emitted pattern, i.e. a pre-order, left-to-right walk. A group node that occurs at several
 * positions takes one number per occurrence; lookups by identity return the first.
 *
 * <p>Internal groups are numbered like any other but are left out of {@link #publicNames()}.
 *
 * @since 1.0.0
 */
public final class CaptureRegistry {

    private final List<CaptureGroupInfo> groups;
    private final Map<NodeId, Integer> indexById;
    private final Map<NodeId, Group> groupsById;
    private final Map<String, Integer> publicNames;

    private CaptureRegistry(List<CaptureGroupInfo> groups, Map<NodeId, Integer> indexById,
                            Map<NodeId, Group> groupsById, Map<String, Integer> publicNames) {
        this.groups = Collections.unmodifiableList(groups);
        this.indexById = Collections.unmodifiableMap(indexById);
        this.groupsById = Collections.unmodifiableMap(groupsById);
        this.publicNames = Collections.unmodifiableMap(publicNames);
    }

    /**
     * Numbers the capturing groups of {@code root}.
     *
     * @throws DuplicateGroupNameException if two capturing groups carry the same name
     */
    public static CaptureRegistry build(Node root) {
        Builder builder = new Builder();
        builder.walk(root);
        return new CaptureRegistry(builder.groups, builder.indexById, builder.groupsById, builder.publicNames);
    }

    /** Every capturing group in index order, internal ones included. */
    public List<CaptureGroupInfo> groups() {
        return groups;
    }

    public int groupCount() {
        return groups.size();
    }

    /** Index of the first occurrence of the capturing group with identity {@code id}. */
    public OptionalInt indexOf(NodeId id) {
        Integer index = indexById.get(id);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public Optional<Group> group(NodeId id) {
        return Optional.ofNullable(groupsById.get(id));
    }

    Map<NodeId, Group> groupsById() {
        return groupsById;
    }

    /** Name to index, in index order, for named groups. */
    public Map<String, Integer> publicNames() {
        return publicNames;
    }

    private static final class Builder {
        private final List<CaptureGroupInfo> groups = new ArrayList<>();
        private final Map<NodeId, Integer> indexById = new HashMap<>();
        private final Map<NodeId, Group> groupsById = new HashMap<>();
        private final Map<String, Integer> publicNames = new LinkedHashMap<>();

        void walk(Node root) {
            List<Node> stack = new ArrayList<>();
            stack.add(root);
            while (!stack.isEmpty()) {
                Node node = stack.remove(stack.size() - 1);
                if (node instanceof Group group && group.capturing()) {
                    register(group);
                }
                List<Node> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.add(children.get(i));
                }
            }
        }

        private void register(Group group) {
            int index = groups.size() + 1;
            if (group.name() != null) {
                if (publicNames.containsKey(group.name())) {
                    throw new DuplicateGroupNameException(group.name());
                }
                publicNames.put(group.name(), index);
            }
            groups.add(new CaptureGroupInfo(index, group.name(), group.internal(), group.id()));
            indexById.putIfAbsent(group.id(), index);
            groupsById.putIfAbsent(group.id(), group);
        }
    }
}
