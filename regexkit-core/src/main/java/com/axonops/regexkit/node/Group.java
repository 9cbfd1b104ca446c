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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Capturing or non-capturing grouping.
 *
 * <p>A capturing group takes the next group index in left-to-right order when compiled; its
 * optional name must be unique within the compiled tree. Internal groups are inserted by atomic
 * group lowering: they occupy an index in the pattern but are left out of the public group table.
 *
 * @param id node identity, the target of backreferences
 * @param child grouped sub-expression
 * @param name group name, or {@code null}
 * @param capturing whether the group captures
 * @param internal whether the group was synthesised by the compiler
 * @since 1.0.0
 */
public record Group(NodeId id, Node child, String name, boolean capturing, boolean internal)
    implements Node {

    public Group {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(child, "child cannot be null");
        if (name != null) {
            if (!capturing) {
                throw new IllegalArgumentException("non-capturing group cannot be named");
            }
            validateName(name);
        }
        if (internal && (!capturing || name != null)) {
            throw new IllegalArgumentException("internal groups are unnamed capturing groups");
        }
    }

    public Group(Node child, String name, boolean capturing) {
        this(NodeId.next(), child, name, capturing, false);
    }

    /** Unnamed capturing group synthesised by the compiler. */
    public static Group internal(Node child) {
        return new Group(NodeId.next(), child, null, true, true);
    }

    public Optional<String> optionalName() {
        return Optional.ofNullable(name);
    }

    public boolean isNamed() {
        return name != null;
    }

    /** Same group under another name ({@code null} drops the name). Keeps the identity. */
    public Group withName(String newName) {
        return new Group(id, child, newName, capturing, internal);
    }

    public Group withChild(Node newChild) {
        return new Group(id, newChild, name, capturing, internal);
    }

    @Override
    public List<Node> children() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    /**
     * Checks that {@code name} is an identifier: a letter or underscore followed by letters, digits
     * or underscores.
     *
     * @throws IllegalArgumentException if it is not
     */
    public static String validateName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        boolean valid = !name.isEmpty();
        for (int i = 0; valid && i < name.length(); i++) {
            char c = name.charAt(i);
            valid = c != '$'
                && (i == 0 ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c))
                && !Character.isIdentifierIgnorable(c);
        }
        if (!valid) {
            throw new IllegalArgumentException("group name must be a valid identifier; got '" + name + "'");
        }
        return name;
    }
}
