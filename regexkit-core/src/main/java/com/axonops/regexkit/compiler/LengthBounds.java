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

/**
 * Minimum and maximum number of characters a sub-expression can match.
 *
 * <p>{@link #UNBOUNDED} as {@code max} means there is no upper limit. All arithmetic saturates at
 * {@link #UNBOUNDED}.
 *
 * @param min fewest characters matched
 * @param max most characters matched, or {@link #UNBOUNDED}
 * @since 1.0.0
 */
public record LengthBounds(int min, int max) {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final LengthBounds ZERO = new LengthBounds(0, 0);
    public static final LengthBounds ONE = new LengthBounds(1, 1);
    public static final LengthBounds ANY = new LengthBounds(0, UNBOUNDED);

    public LengthBounds {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("invalid length bounds (" + min + ", " + max + ")");
        }
    }

    public static LengthBounds exactly(int length) {
        return new LengthBounds(length, length);
    }

    public boolean isFixed() {
        return min == max && max != UNBOUNDED;
    }

    public boolean isBounded() {
        return max != UNBOUNDED;
    }

    /** Bounds of this followed by {@code other}. */
    public LengthBounds plus(LengthBounds other) {
        return new LengthBounds(add(min, other.min), add(max, other.max));
    }

    /** Bounds of a choice between this and {@code other}. */
    public LengthBounds union(LengthBounds other) {
        return new LengthBounds(Math.min(min, other.min), Math.max(max, other.max));
    }

    static int add(int a, int b) {
        if (a == UNBOUNDED || b == UNBOUNDED) {
            return UNBOUNDED;
        }
        long sum = (long) a + b;
        return sum >= UNBOUNDED ? UNBOUNDED : (int) sum;
    }

    static int multiply(int a, int b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        if (a == UNBOUNDED || b == UNBOUNDED) {
            return UNBOUNDED;
        }
        long product = (long) a * b;
        return product >= UNBOUNDED ? UNBOUNDED : (int) product;
    }

    @Override
    public String toString() {
        return "(" + min + ", " + (max == UNBOUNDED ? "unbounded" : String.valueOf(max)) + ")";
    }
}
