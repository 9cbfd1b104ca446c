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

package com.axonops.regexkit.metrics;

/**
 * Metric name constants for regexkit instrumentation.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Compilation</h2>
 *
 * <p>Every call to {@link com.axonops.regexkit.api.RegexCompiler#compile} counts once in
 * {@link #COMPILATIONS}, whether it is served from the cache or not. {@link #COMPILATION_LATENCY}
 * times the passes only, so cache hits are not recorded there. A failing call counts in {@link
 * #COMPILATIONS_FAILED} and in the error counter for its exception type.
 *
 * <h2>Cache</h2>
 *
 * <p>Hits and misses are counted per lookup; evictions when the least-recently-used entry is
 * dropped to make room. {@link #CACHE_SIZE} is a gauge registered when the cache is created.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * CompilerConfig config = RegexKitMetricsConfig.withMetrics(registry, "myapp.regexkit", false);
 * RegexCompiler compiler = new RegexCompiler(config);
 *
 * Counter compilations = registry.counter(
 *     MetricRegistry.name("myapp.regexkit", MetricNames.COMPILATIONS));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MetricNames {

    private MetricNames() {
        // Utility class
    }

    // ========================================
    // Compilation
    // ========================================

    /** Compile calls, including cache hits. Counter. */
    public static final String COMPILATIONS = "compilations.total.count";

    /** Time spent running the compiler passes on a cache miss. Timer. */
    public static final String COMPILATION_LATENCY = "compilations.latency";

    /** Compile calls that threw. Counter. */
    public static final String COMPILATIONS_FAILED = "compilations.failed.total.count";

    /** Atomic groups rewritten into lookahead plus backreference. Counter. */
    public static final String ATOMIC_GROUPS_LOWERED = "lowering.atomic.groups.total.count";

    /** Repetitions rewritten into alternations of simple quantifiers. Counter. */
    public static final String REPETITIONS_EXPANDED = "lowering.repetitions.total.count";

    /** Rename and drop-names calls that succeeded. Counter. */
    public static final String RENAMES = "renames.total.count";

    // ========================================
    // Errors
    // ========================================

    /** Compilations rejected because two groups share a name. Counter. */
    public static final String ERRORS_DUPLICATE_GROUP_NAME = "errors.duplicate.group.name.total.count";

    /** Compilations rejected because a reference has no target group. Counter. */
    public static final String ERRORS_UNRESOLVED_BACKREFERENCE = "errors.unresolved.backreference.total.count";

    /** Compilations rejected because of a lookbehind length. Counter. */
    public static final String ERRORS_VARIABLE_LENGTH_LOOKBEHIND = "errors.variable.length.lookbehind.total.count";

    /** Compilations rejected because the dialect lacks a construct. Counter. */
    public static final String ERRORS_UNSUPPORTED_CONSTRUCT = "errors.unsupported.construct.total.count";

    // ========================================
    // Cache
    // ========================================

    /** Lookups answered from the cache. Counter. */
    public static final String CACHE_HITS = "cache.hits.total.count";

    /** Lookups that had to compile. Counter. */
    public static final String CACHE_MISSES = "cache.misses.total.count";

    /** Entries dropped because the cache was full. Counter. */
    public static final String CACHE_EVICTIONS = "cache.evictions.total.count";

    /** Entries currently cached. Gauge. */
    public static final String CACHE_SIZE = "cache.size.current.count";
}
