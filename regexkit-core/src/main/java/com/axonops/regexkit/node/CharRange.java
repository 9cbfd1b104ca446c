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

import com.axonops.regexkit.api.InvalidRangeException;

/**
 * Inclusive range of Unicode code points inside a {@link CharClass}. A single character is a range
 * whose start equals its end.
 *
 * @param start first code point
 * @param end last code point (inclusive)
 * @since 1.0.0
 */
public record CharRange(int start, int end) implements Comparable<CharRange> {

    public CharRange {
        if (start < 0 || start > Character.MAX_CODE_POINT) {
            throw new InvalidRangeException("invalid code point " + start);
        }
        if (end < 0 || end > Character.MAX_CODE_POINT) {
            throw new InvalidRangeException("invalid code point " + end);
        }
        if (start > end) {
            throw new InvalidRangeException("range start '" + new String(Character.toChars(start))
                + "' (" + start + ") is greater than end '" + new String(Character.toChars(end))
                + "' (" + end + ")");
        }
    }

    public static CharRange of(int codePoint) {
        return new CharRange(codePoint, codePoint);
    }

    public static CharRange of(int start, int end) {
        return new CharRange(start, end);
    }

    public boolean contains(int codePoint) {
        return start <= codePoint && codePoint <= end;
    }

    public int size() {
        return end - start + 1;
    }

    @Override
    public int compareTo(CharRange other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }
}
