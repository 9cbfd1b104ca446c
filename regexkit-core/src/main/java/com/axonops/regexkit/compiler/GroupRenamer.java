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

import com.axonops.regexkit.api.DuplicateGroupNameException;
import com.axonops.regexkit.node.Group;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.Renaming;
import java.util.Objects;

/**
 * Renames or drops capture group names.
 *
 * <p>The result has the same shape and node identities as the input; only group names differ.
 * Backreferences and conditionals target groups by identity, so they keep working whatever the
 * new names are. A group whose name is dropped stays capturing and keeps its number.
 *
 * @since 1.0.0
 */
public final class GroupRenamer extends TreeRewriter {

    private final Renaming renaming;

    private GroupRenamer(Renaming renaming) {
        this.renaming = renaming;
    }

    /**
     * Applies {@code renaming} to every named group of {@code root}.
     *
     * @throws DuplicateGroupNameException if two groups end up with the same name
     * @throws IllegalArgumentException if a new name is not a valid identifier
     */
    public static Node rename(Node root, Renaming renaming) {
        Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(renaming, "renaming cannot be null");
        Node renamed = new GroupRenamer(renaming).rewrite(root);
        CaptureRegistry.build(renamed);
        return renamed;
    }

    /** Turns every named group of {@code root} into an unnamed capturing group. */
    public static Node dropNames(Node root) {
        return rename(root, Renaming.dropAll());
    }

    @Override
    public Node visitGroup(Group group) {
        Node child = rewrite(group.child());
        String name = group.name();
        if (name != null) {
            name = Objects.requireNonNull(renaming.apply(name), "renaming returned null for '" + name + "'")
                .orElse(null);
        }
        if (child == group.child() && Objects.equals(name, group.name())) {
            return group;
        }
        return new Group(group.id(), child, name, group.capturing(), group.internal());
    }
}
