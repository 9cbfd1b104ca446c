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

import com.axonops.regexkit.node.NodeId;
import java.util.Objects;
import java.util.Optional;

/**
 * One capturing group of a compiled pattern.
 *
 * @param index group number in the emitted pattern, starting at 1
 * @param name group name, or {@code null} if unnamed
 * @param internal whether the group was synthesised by the compiler rather than written by the caller
 * @param nodeId identity of the {@link com.axonops.regexkit.node.Group} that produced it
 * @since 1.0.0
 */
public record CaptureGroupInfo(int index, String name, boolean internal, NodeId nodeId) {

    public CaptureGroupInfo {
        if (index < 1) {
            throw new IllegalArgumentException("group index must be >= 1; got " + index);
        }
        Objects.requireNonNull(nodeId, "nodeId cannot be null");
    }

    public Optional<String> optionalName() {
        return Optional.ofNullable(name);
    }
}
