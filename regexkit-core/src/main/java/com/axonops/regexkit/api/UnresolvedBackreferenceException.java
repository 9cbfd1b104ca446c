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

/**
 * Thrown when a backreference or conditional test points at a node that is not a capturing group
 * of the tree being compiled, or when a backreference precedes or sits inside the group it refers
 * to.
 *
 * @since 1.0.0
 */
public final class UnresolvedBackreferenceException extends RegexKitException {

    private final NodeId target;

    public UnresolvedBackreferenceException(NodeId target) {
        this(target, "no capturing group with this identity in the compiled tree");
    }

    public UnresolvedBackreferenceException(NodeId target, String reason) {
        super("RegexKit: Unresolved backreference to " + target + " - " + reason);
        this.target = target;
    }

    public NodeId getTarget() {
        return target;
    }
}
