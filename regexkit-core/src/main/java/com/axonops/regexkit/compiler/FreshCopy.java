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

import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.NodeId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep copy of a sub-tree in which every node gets a fresh identity.
 *
 * <p>References from inside the copy to capturing groups inside the copy follow those groups to
 * their new identities; references to groups outside the copy are left pointing where they were.
 */
final class FreshCopy extends TreeRewriter {

    private final Map<NodeId, NodeId> groupIds = new HashMap<>();

    private FreshCopy(Node root) {
        List<Node> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            Node node = stack.remove(stack.size() - 1);
            if (node instanceof Group group) {
                groupIds.computeIfAbsent(group.id(), id -> NodeId.next());
            }
            stack.addAll(node.children());
        }
    }

    static Node of(Node root) {
        return new FreshCopy(root).rewrite(root);
    }

    @Override
    protected NodeId idOf(Node original) {
        NodeId mapped = groupIds.get(original.id());
        return mapped != null && original instanceof Group ? mapped : NodeId.next();
    }

    @Override
    protected NodeId referenceTo(NodeId target) {
        return groupIds.getOrDefault(target, target);
    }
}
