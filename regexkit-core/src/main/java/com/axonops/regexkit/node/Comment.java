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

/**
 * Zero-width annotation. Has no effect on matching.
 *
 * @since 1.0.0
 */
public record Comment(NodeId id, String text) implements Node {

    public Comment {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
        // ')' would close the inline comment token early and a backslash would escape it
        if (text.indexOf(')') >= 0 || text.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("comment text cannot contain ')' or '\\'; got '" + text + "'");
        }
    }

    public Comment(String text) {
        this(NodeId.next(), text);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
