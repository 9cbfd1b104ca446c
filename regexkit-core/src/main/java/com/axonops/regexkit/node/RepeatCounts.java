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
import java.util.ArrayList;
import java.util.List;

/**
 * The set of repetition counts a {@link Repetition} accepts.
 *
 * <p>Holds a non-empty, strictly ascending list of finite counts, optionally followed by the
 * {@link #UNBOUNDED} sentinel. The sentinel continues the progression forever with a stride equal
 * to the difference of the last two finite counts, or 1 when there is only one:
 *
 * <ul>
 *   <li>{@code of(0, UNBOUNDED)} - zero or more
 *   <li>{@code of(1, UNBOUNDED)} - one or more
 *   <li>{@code of(2, 4, UNBOUNDED)} - every even count from 2
 *   <li>{@code of(1, 3, 5)} - exactly 1, 3 or 5
 * </ul>
 *
 * @param finite finite counts, ascending
 * @param unbounded whether the progression continues forever
 * @since 1.0.0
 */
public record RepeatCounts(List<Integer> finite, boolean unbounded) {

    /** Sentinel for "and so on, forever". Only valid as the last element. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public RepeatCounts {
        finite = List.copyOf(finite);
        if (finite.isEmpty()) {
            throw new InvalidRangeException("repetition counts must contain at least one finite count");
        }
        int previous = -1;
        for (int count : finite) {
            if (count < 0) {
                throw new InvalidRangeException("repetition count must be >= 0; got " + count);
            }
            if (count == UNBOUNDED) {
                throw new InvalidRangeException("unbounded sentinel may only be the last count");
            }
            if (count <= previous) {
                throw new InvalidRangeException("repetition counts must be strictly ascending; got "
                    + previous + " before " + count);
            }
            previous = count;
        }
    }

    /**
     * Builds counts from explicit values; the last may be {@link #UNBOUNDED}.
     *
     * @throws InvalidRangeException if the values are empty, unsorted, duplicated or negative
     */
    public static RepeatCounts of(int... counts) {
        if (counts.length == 0) {
            throw new InvalidRangeException("repetition counts cannot be empty");
        }
        boolean unbounded = counts[counts.length - 1] == UNBOUNDED;
        List<Integer> finite = new ArrayList<>(counts.length);
        for (int i = 0; i < (unbounded ? counts.length - 1 : counts.length); i++) {
            finite.add(counts[i]);
        }
        return new RepeatCounts(finite, unbounded);
    }

    public static RepeatCounts exactly(int count) {
        return of(count);
    }

    /** Every count from {@code min} to {@code max} inclusive. */
    public static RepeatCounts between(int min, int max) {
        return between(min, max, 1);
    }

    /** {@code min}, {@code min + step}, ... up to {@code max} inclusive. */
    public static RepeatCounts between(int min, int max, int step) {
        validateBounds(min, max, step);
        List<Integer> counts = new ArrayList<>();
        for (long count = min; count <= max; count += step) {
            counts.add((int) count);
        }
        return new RepeatCounts(counts, false);
    }

    public static RepeatCounts atLeast(int min) {
        return atLeast(min, 1);
    }

    /** {@code min}, {@code min + step}, ... without upper bound. */
    public static RepeatCounts atLeast(int min, int step) {
        validateBounds(min, min, step);
        if (step == 1) {
            return new RepeatCounts(List.of(min), true);
        }
        if ((long) min + step >= UNBOUNDED) {
            throw new InvalidRangeException("repetition count overflow: " + min + " + " + step);
        }
        return new RepeatCounts(List.of(min, min + step), true);
    }

    public static RepeatCounts optional() {
        return between(0, 1);
    }

    public static RepeatCounts zeroOrMore() {
        return atLeast(0);
    }

    public static RepeatCounts oneOrMore() {
        return atLeast(1);
    }

    private static void validateBounds(int min, int max, int step) {
        if (min < 0) {
            throw new InvalidRangeException("minimum repetitions cannot be negative; got " + min);
        }
        if (max < min) {
            throw new InvalidRangeException("maximum repetitions (" + max
                + ") cannot be less than minimum repetitions (" + min + ")");
        }
        if (step < 1) {
            throw new InvalidRangeException("repetition step must be >= 1; got " + step);
        }
        if (max == UNBOUNDED) {
            throw new InvalidRangeException("use atLeast() for repetitions without upper bound");
        }
    }

    public int min() {
        return finite.get(0);
    }

    /** Largest count, or {@link #UNBOUNDED}. */
    public int max() {
        return unbounded ? UNBOUNDED : finite.get(finite.size() - 1);
    }

    public int lastFinite() {
        return finite.get(finite.size() - 1);
    }

    /** Stride of the unbounded continuation. */
    public int stride() {
        int size = finite.size();
        return size < 2 ? 1 : finite.get(size - 1) - finite.get(size - 2);
    }

    public boolean isExactly(int count) {
        return !unbounded && finite.size() == 1 && finite.get(0) == count;
    }

    /** Whether the finite counts have no gaps. */
    public boolean isContiguous() {
        return lastFinite() - min() == finite.size() - 1;
    }

    /**
     * Whether a single engine quantifier ({@code {n}}, {@code {m,n}}, {@code {m,}}, {@code ?},
     * {@code *}, {@code +}) expresses these counts.
     */
    public boolean isSimple() {
        return isContiguous() && (!unbounded || stride() == 1);
    }

    public boolean contains(int count) {
        if (count < 0) {
            return false;
        }
        if (finite.contains(count)) {
            return true;
        }
        int last = lastFinite();
        return unbounded && count > last && (count - last) % stride() == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < finite.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(finite.get(i));
        }
        if (unbounded) {
            sb.append(",...");
        }
        return sb.append('}').toString();
    }
}
