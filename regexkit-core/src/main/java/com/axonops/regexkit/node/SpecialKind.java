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

/**
 * Fixed anchors and single-character classes.
 *
 * <p>Zero-width kinds match a position; the others match exactly one character. Kinds that are
 * class escapes may also appear as members of a {@link CharClass}.
 *
 * @since 1.0.0
 */
public enum SpecialKind {
    START_LINE("^", true, false),
    END_LINE("$", true, false),
    START_STRING("\\A", true, false),
    /** End of input. Python spells it {@code \Z}, Java {@code \z}. */
    END_STRING("\\Z", true, false),
    WORD_BOUNDARY("\\b", true, false),
    NON_WORD_BOUNDARY("\\B", true, false),
    ANY_CHAR(".", false, false),
    DIGIT("\\d", false, true),
    NON_DIGIT("\\D", false, true),
    WHITESPACE("\\s", false, true),
    NON_WHITESPACE("\\S", false, true),
    WORD_CHAR("\\w", false, true),
    NON_WORD_CHAR("\\W", false, true),
    TAB("\\t", false, true),
    NEWLINE("\\n", false, true),
    CARRIAGE_RETURN("\\r", false, true);

    private final String token;
    private final boolean zeroWidth;
    private final boolean classEscape;

    SpecialKind(String token, boolean zeroWidth, boolean classEscape) {
        this.token = token;
        this.zeroWidth = zeroWidth;
        this.classEscape = classEscape;
    }

    /** Pattern token shared by the supported dialects. */
    public String token() {
        return token;
    }

    public boolean isZeroWidth() {
        return zeroWidth;
    }

    /** Whether this kind may appear inside a bracketed character class. */
    public boolean isClassEscape() {
        return classEscape;
    }
}
