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

package com.axonops.regexkit.dropwizard;

import com.axonops.regexkit.api.CompilerConfig;
import com.axonops.regexkit.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory for {@link CompilerConfig} instances reporting to a Dropwizard {@link MetricRegistry}.
 *
 * <p>Optionally exposes the registry via JMX, so compilation, cache and error metrics show up in
 * any JMX console without further setup.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Python re target, metrics under the default prefix:
 * MetricRegistry registry = new MetricRegistry();
 * CompilerConfig config = RegexKitMetricsConfig.withMetrics(registry);
 * RegexCompiler compiler = new RegexCompiler(config);
 *
 * // java.util.regex target, application prefix, no JMX:
 * CompilerConfig javaConfig = RegexKitMetricsConfig.withMetrics(
 *     CompilerConfig.JAVA, registry, "com.myapp.regex", false);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RegexKitMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegexKitMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private RegexKitMetricsConfig() {
        // Utility class
    }

    /**
     * Default configuration reporting to {@code registry} under {@code metricPrefix}, with JMX.
     */
    public static CompilerConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Default configuration reporting to {@code registry} under {@code metricPrefix}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JMX reporter for the registry
     * @return {@link CompilerConfig#DEFAULT} with metrics enabled
     */
    public static CompilerConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(CompilerConfig.DEFAULT, registry, metricPrefix, enableJmx);
    }

    /**
     * Default configuration with metrics under {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}, with JMX.
     */
    public static CompilerConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * {@code base} with its metrics registry replaced by one reporting to {@code registry}.
     *
     * @param base engine and cache options to keep
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JMX reporter for the registry
     * @return configured CompilerConfig with metrics enabled
     */
    public static CompilerConfig withMetrics(CompilerConfig base, MetricRegistry registry,
                                             String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return base.toBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Starts one JmxReporter per JVM; later calls are no-ops.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("RegexKit: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("RegexKit: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal: the application may expose the registry itself
                logger.warn("RegexKit: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /** Whether a reporter started by this class is running. */
    static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /** Stops the JMX reporter started by this class, if any. */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("RegexKit: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
