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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.axonops.regexkit.node.RepeatCounts.UNBOUNDED;
import static org.assertj.core.api.Assertions.*;

class RepeatCountsTest {

    // ===== Construction Tests =====

    @Test
    void testOfSplitsUnboundedSentinel() {
        RepeatCounts counts = RepeatCounts.of(2, 4, UNBOUNDED);

        assertThat(counts.finite()).containsExactly(2, 4);
        assertThat(counts.unbounded()).isTrue();
        assertThat(counts.stride()).isEqualTo(2);
        assertThat(counts.max()).isEqualTo(UNBOUNDED);
    }

    @Test
    void testBetweenWithStep() {
        assertThat(RepeatCounts.between(1, 9, 4).finite()).containsExactly(1, 5, 9);
        assertThat(RepeatCounts.between(1, 8, 4).finite()).containsExactly(1, 5);
    }

    @Test
    void testAtLeastWithStep() {
        RepeatCounts counts = RepeatCounts.atLeast(3, 5);

        assertThat(counts.finite()).containsExactly(3, 8);
        assertThat(counts.unbounded()).isTrue();
        assertThat(counts.stride()).isEqualTo(5);
    }

    @Test
    void testLoneUnboundedSentinelRejected() {
        assertThatThrownBy(() -> RepeatCounts.of(UNBOUNDED))
            .isInstanceOf(InvalidRangeException.class);
    }

    @Test
    void testMisplacedUnboundedSentinelRejected() {
        assertThatThrownBy(() -> RepeatCounts.of(1, UNBOUNDED, 3))
            .isInstanceOf(InvalidRangeException.class);
    }

    @Test
    void testEmptyCountsRejected() {
        assertThatThrownBy(RepeatCounts::of)
            .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> new RepeatCounts(List.of(), true))
            .isInstanceOf(InvalidRangeException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "3, 1",
        "2, 2",
        "-1, 4"
    })
    void testUnsortedDuplicateOrNegativeRejected(int first, int second) {
        assertThatThrownBy(() -> RepeatCounts.of(first, second))
            .isInstanceOf(InvalidRangeException.class)
            .hasMessageContaining("RegexKit: Invalid range");
    }

    @Test
    void testBetweenBoundsValidated() {
        assertThatThrownBy(() -> RepeatCounts.between(5, 2))
            .isInstanceOf(InvalidRangeException.class)
            .hasMessageContaining("cannot be less than minimum");
        assertThatThrownBy(() -> RepeatCounts.between(0, 4, 0))
            .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> RepeatCounts.atLeast(-1))
            .isInstanceOf(InvalidRangeException.class);
    }

    // ===== Classification Tests =====

    @Test
    void testSimpleCounts() {
        assertThat(RepeatCounts.exactly(3).isSimple()).isTrue();
        assertThat(RepeatCounts.between(2, 5).isSimple()).isTrue();
        assertThat(RepeatCounts.zeroOrMore().isSimple()).isTrue();
        assertThat(RepeatCounts.of(2, 3, UNBOUNDED).isSimple()).isTrue();
    }

    @Test
    void testNonSimpleCounts() {
        assertThat(RepeatCounts.of(1, 3, 5).isSimple()).isFalse();
        assertThat(RepeatCounts.atLeast(0, 2).isSimple()).isFalse();
        assertThat(RepeatCounts.of(1, 2, 4, UNBOUNDED).isSimple()).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "0, true",
        "1, false",
        "2, true",
        "7, false",
        "100, true"
    })
    void testContainsFollowsStride(int count, boolean expected) {
        assertThat(RepeatCounts.atLeast(0, 2).contains(count)).isEqualTo(expected);
    }

    @Test
    void testToString() {
        assertThat(RepeatCounts.of(1, 3, UNBOUNDED)).hasToString("{1,3,...}");
        assertThat(RepeatCounts.exactly(4)).hasToString("{4}");
    }
}
