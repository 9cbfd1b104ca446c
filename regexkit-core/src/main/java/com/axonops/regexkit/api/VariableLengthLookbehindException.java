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

import com.axonops.regexkit.compiler.LengthBounds;
import com.axonops.regexkit.node.Lookaround;

/**
 * Thrown when a lookbehind assertion wraps a sub-expression whose length the target engine cannot
 * accept.
 *
 * @since 1.0.0
 */
public final class VariableLengthLookbehindException extends RegexKitException {

    private final Lookaround lookbehind;
    private final LengthBounds bounds;

    public VariableLengthLookbehindException(Lookaround lookbehind, LengthBounds bounds) {
        super("RegexKit: Lookbehind " + lookbehind.id() + " has variable length " + bounds);
        this.lookbehind = lookbehind;
        this.bounds = bounds;
    }

    public Lookaround getLookbehind() {
        return lookbehind;
    }

    public LengthBounds getBounds() {
        return bounds;
    }
}
