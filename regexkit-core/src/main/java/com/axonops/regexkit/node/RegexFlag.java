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
 * Inline flags that a {@link ScopedFlags} node turns on or off for its child.
 *
 * @since 1.0.0
 */
public enum RegexFlag {
    /** ASCII-only matching of {@code \w}, {@code \b}, {@code \d} and {@code \s}. */
    ASCII('a', true),
    IGNORECASE('i', false),
    /** Locale-dependent matching. Python bytes patterns only. */
    LOCALE('L', true),
    MULTILINE('m', false),
    DOTALL('s', false),
    UNICODE('u', true),
    VERBOSE('x', false);

    private final char letter;
    private final boolean charset;

    RegexFlag(char letter, boolean charset) {
        this.letter = letter;
        this.charset = charset;
    }

    public char letter() {
        return letter;
    }

    /**
     * Whether this flag selects the character set semantics. At most one such flag may be enabled
     * in a scope, and none of them may be disabled.
     */
    public boolean isCharset() {
        return charset;
    }
}
