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

import com.axonops.regexkit.api.UnresolvedBackreferenceException;
import com.axonops.regexkit.node.Backreference;
import com.axonops.regexkit.node.Conditional;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.NodeId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Resolves the non-owning group references of a tree against its {@link CaptureRegistry}.
 *
 * <p>A backreference resolves when a capturing group with the target identity has closed before the
 * reference in emission order; engines reject references to later groups and to groups still
 * open around the reference. A conditional only needs its group somewhere in the tree. Where a
 * group occurs several times the first occurrence gives the number.
 *
 * @since 1.0.0
 */
public final class BackreferenceResolver {

    private final CaptureRegistry registry;

    public BackreferenceResolver(CaptureRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    /**
     * Resolves one target.
     *
     * @throws UnresolvedBackreferenceException if no capturing group has identity {@code target}
     */
    public GroupReference resolve(NodeId target) {
        OptionalInt index = registry.indexOf(target);
        if (index.isEmpty()) {
            throw new UnresolvedBackreferenceException(target);
        }
        String name = registry.group(target).map(Group::name).orElse(null);
        return new GroupReference(index.getAsInt(), name);
    }

    /**
     * Checks every backreference and conditional test of {@code root}, in emission order.
     *
     * @return number of references checked
     * @throws UnresolvedBackreferenceException on the first reference that does not resolve, or on
     *     a backreference whose group has not closed before it
     */
    public int resolveAll(Node root) {
        int resolved = 0;
        Set<NodeId> closed = new HashSet<>();
        List<Object> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            Object item = stack.remove(stack.size() - 1);
            if (item instanceof GroupEnd end) {
                closed.add(end.id());
                continue;
            }
            Node node = (Node) item;
            if (node instanceof Backreference backreference) {
                resolve(backreference.target());
                if (!closed.contains(backreference.target())) {
                    throw new UnresolvedBackreferenceException(backreference.target(),
                        "the group is open or not yet matched at the reference");
                }
                resolved++;
            } else if (node instanceof Conditional conditional) {
                resolve(conditional.test());
                resolved++;
            } else if (node instanceof Group group && group.capturing()) {
                stack.add(new GroupEnd(group.id()));
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
        return resolved;
    }

    // marks the closing parenthesis of a capturing group during the walk
    private record GroupEnd(NodeId id) {
    }
}
