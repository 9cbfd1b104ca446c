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

package com.axonops.regexkit.api;

import com.axonops.regexkit.compiler.RegexDialect;
import com.axonops.regexkit.metrics.NoOpMetricsRegistry;
import com.axonops.regexkit.metrics.RegexKitMetricsRegistry;
import java.util.Objects;

/**
 * Options for one compilation.
 *
 * <p>Immutable. A compile call reads the configuration it is given once, at the start, so
 * concurrent calls with different configurations never interfere.
 *
 * <h2>Engine capabilities</h2>
 *
 * <ul>
 *   <li><b>atomicGroupNativeSupport</b> - emit {@code (?>...)} for atomic groups instead of the
 *       lookahead-plus-backreference rewrite. Needs Python 3.11+ or {@code java.util.regex}.
 *   <li><b>requireFixedLengthLookbehind</b> - reject lookbehinds whose body can match texts of
 *       different lengths. Python's {@code re} requires this; {@code java.util.regex} accepts any
 *       bounded length.
 *   <li><b>dialect</b> - target syntax, see {@link RegexDialect}.
 * </ul>
 *
 * <h2>Caching</h2>
 *
 * <p>Compiled results are cached per tree and per engine options. The cache holds at most {@code
 * maxCacheSize} entries and drops the least recently used when full. {@code cacheEnabled} is read
 * per call; {@code maxCacheSize} and {@code metricsRegistry} of the configuration a {@link
 * RegexCompiler} is created with size and instrument its cache.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Python re, all defaults
 * CompilerConfig config = CompilerConfig.DEFAULT;
 *
 * // java.util.regex with Dropwizard metrics
 * CompilerConfig config = CompilerConfig.JAVA.toBuilder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.regexkit"))
 *     .build();
 * }</pre>
 *
 * @param atomicGroupNativeSupport whether the engine has native atomic groups (default false)
 * @param requireFixedLengthLookbehind whether lookbehind bodies must be fixed-length (default true)
 * @param dialect target syntax (default {@link RegexDialect#PYTHON})
 * @param cacheEnabled whether compiled results are cached (default true)
 * @param maxCacheSize cache capacity (must be > 0 if cache enabled; default 10,000)
 * @param metricsRegistry metrics implementation (default {@link NoOpMetricsRegistry})
 * @since 1.0.0
 * @see com.axonops.regexkit.metrics.MetricNames
 */
public record CompilerConfig(
    boolean atomicGroupNativeSupport,
    boolean requireFixedLengthLookbehind,
    RegexDialect dialect,
    boolean cacheEnabled,
    int maxCacheSize,
    RegexKitMetricsRegistry metricsRegistry) {

  /** Python {@code re} syntax, atomic groups lowered, fixed-length lookbehind, cache enabled. */
  public static final CompilerConfig DEFAULT =
      new CompilerConfig(
          false, // Lower atomic groups
          true, // Fixed-length lookbehind
          RegexDialect.PYTHON,
          true, // Cache enabled
          10_000, // Max 10K cached results
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** {@code java.util.regex} syntax: native atomic groups, any bounded lookbehind. */
  public static final CompilerConfig JAVA =
      new CompilerConfig(
          true, // Native (?>...)
          false, // Bounded lookbehind is enough
          RegexDialect.JAVA,
          true,
          10_000,
          NoOpMetricsRegistry.INSTANCE);

  /** Defaults with caching disabled. */
  public static final CompilerConfig NO_CACHE =
      new CompilerConfig(
          false,
          true,
          RegexDialect.PYTHON,
          false, // Cache disabled
          0, // Ignored when cache disabled
          NoOpMetricsRegistry.INSTANCE);

  public CompilerConfig {
    Objects.requireNonNull(dialect, "dialect cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (cacheEnabled && maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
    }
    if (maxCacheSize < 0) {
      throw new IllegalArgumentException("maxCacheSize cannot be negative");
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * <pre>{@code
   * CompilerConfig config = CompilerConfig.builder()
   *     .requireFixedLengthLookbehind(false)
   *     .maxCacheSize(1_000)
   *     .build();
   * }</pre>
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Creates a builder starting from this configuration. */
  public Builder toBuilder() {
    return new Builder()
        .atomicGroupNativeSupport(atomicGroupNativeSupport)
        .requireFixedLengthLookbehind(requireFixedLengthLookbehind)
        .dialect(dialect)
        .cacheEnabled(cacheEnabled)
        .maxCacheSize(maxCacheSize)
        .metricsRegistry(metricsRegistry);
  }

  /** Builder for {@link CompilerConfig}. */
  public static class Builder {
    private boolean atomicGroupNativeSupport = false;
    private boolean requireFixedLengthLookbehind = true;
    private RegexDialect dialect = RegexDialect.PYTHON;
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10_000;
    private RegexKitMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Emit atomic groups natively instead of rewriting them.
     *
     * <p><b>Default: false</b>
     *
     * @param supported true if the target engine understands {@code (?>...)}
     * @return this builder
     */
    public Builder atomicGroupNativeSupport(boolean supported) {
      this.atomicGroupNativeSupport = supported;
      return this;
    }

    /**
     * Reject lookbehinds whose body is not fixed-length.
     *
     * <p><b>Default: true</b>
     *
     * @param required false to allow variable-length lookbehind
     * @return this builder
     */
    public Builder requireFixedLengthLookbehind(boolean required) {
      this.requireFixedLengthLookbehind = required;
      return this;
    }

    /**
     * @param dialect target syntax (must not be null)
     * @return this builder
     * @throws NullPointerException if dialect is null
     */
    public Builder dialect(RegexDialect dialect) {
      this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
      return this;
    }

    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of cached results before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * @param size maximum cached results (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry} (zero overhead)</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(RegexKitMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public CompilerConfig build() {
      return new CompilerConfig(
          atomicGroupNativeSupport,
          requireFixedLengthLookbehind,
          dialect,
          cacheEnabled,
          maxCacheSize,
          metricsRegistry);
    }
  }
}
