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

import java.util.function.Supplier;

/**
 * Metrics sink used by the compiler and its cache.
 *
 * <p>Use {@link NoOpMetricsRegistry} to disable metrics or {@link DropwizardMetricsAdapter} to
 * publish them to a Dropwizard {@code MetricRegistry}.
 *
 * <p>Timer durations are in nanoseconds. Gauges are read lazily from their supplier.
 * Implementations must be thread-safe: one registry is shared by every compilation using the same
 * {@link com.axonops.regexkit.api.CompilerConfig}.
 *
 * @since 1.0.0
 * @see MetricNames
 */
public interface RegexKitMetricsRegistry {

    /** @param name metric name, one of the {@link MetricNames} constants */
    void incrementCounter(String name);

    /** Adds {@code delta}, which is never negative, to a counter. */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "compilations.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on-demand. Replaces any gauge with the same name.
     *
     * @param name metric name (e.g., "cache.size.current.count")
     * @param valueSupplier function that returns the current value; must be fast and non-blocking
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a previously registered gauge. No-op if none is registered under {@code name}.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
