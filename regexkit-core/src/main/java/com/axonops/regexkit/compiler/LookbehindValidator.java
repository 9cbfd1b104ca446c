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

import com.axonops.regexkit.api.VariableLengthLookbehindException;
import com.axonops.regexkit.node.Lookaround;
import com.axonops.regexkit.node.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that every lookbehind of a tree has a length the target engine accepts.
 *
 * @since 1.0.0
 */
public final class LookbehindValidator {

    private final LengthAnalyzer analyzer;
    private final boolean requireFixedLength;
    private final boolean requireBounded;

    public LookbehindValidator(LengthAnalyzer analyzer, boolean requireFixedLength, RegexDialect dialect) {
        this.analyzer = analyzer;
        this.requireFixedLength = requireFixedLength;
        this.requireBounded = dialect.requiresBoundedLookbehind();
    }

    /**
     * @return number of lookbehinds checked
     * @throws VariableLengthLookbehindException for the first lookbehind, in emission order, whose
     *     child is not fixed-length (when required) or has no upper bound (when the dialect needs one)
     */
    public int validate(Node root) {
        int checked = 0;
        List<Node> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            Node node = stack.remove(stack.size() - 1);
            if (node instanceof Lookaround lookaround && lookaround.isBehind()) {
                LengthBounds bounds = analyzer.bounds(lookaround.child());
                if ((requireFixedLength && !bounds.isFixed()) || (requireBounded && !bounds.isBounded())) {
                    throw new VariableLengthLookbehindException(lookaround, bounds);
                }
                checked++;
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
        return checked;
    }
}
