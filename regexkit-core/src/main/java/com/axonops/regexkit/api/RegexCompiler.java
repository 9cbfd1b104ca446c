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

import com.axonops.regexkit.cache.CacheStatistics;
import com.axonops.regexkit.cache.CompilationCache;
import com.axonops.regexkit.compiler.AtomicGroupLowering;
import com.axonops.regexkit.compiler.BackreferenceResolver;
import com.axonops.regexkit.compiler.CaptureRegistry;
import com.axonops.regexkit.compiler.GroupRenamer;
import com.axonops.regexkit.compiler.LengthAnalyzer;
import com.axonops.regexkit.compiler.LookbehindValidator;
import com.axonops.regexkit.compiler.PatternEmitter;
import com.axonops.regexkit.compiler.RepetitionExpansion;
import com.axonops.regexkit.metrics.MetricNames;
import com.axonops.regexkit.metrics.RegexKitMetricsRegistry;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.Renaming;
import com.axonops.regexkit.util.PatternHasher;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles expression trees to pattern text.
 *
 * <p>One compilation runs these passes over the tree, each producing a new tree or a lookup
 * structure and none mutating its input:
 * <ol>
 *   <li>atomic group lowering (skipped with native support)
 *   <li>repetition expansion
 *   <li>group numbering, which rejects duplicate names
 *   <li>reference resolution, which rejects references to groups absent from the tree
 *   <li>lookbehind length validation
 *   <li>emission
 * </ol>
 * A compilation either returns a complete result or throws a {@link RegexKitException}; it never
 * produces partial output.
 *
 * <p>Thread-safe. The configuration passed to a call is used for that call only.
 *
 * @since 1.0.0
 */
public final class RegexCompiler {
    private static final Logger logger = LoggerFactory.getLogger(RegexCompiler.class);

    private final CompilerConfig config;
    private final CompilationCache cache;

    public RegexCompiler() {
        this(CompilerConfig.DEFAULT);
    }

    /**
     * @param config defaults for {@link #compile(Node)}; its cache size and metrics registry also
     *     configure this compiler's cache
     */
    public RegexCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.cache = config.cacheEnabled() ? new CompilationCache(config.maxCacheSize(), config.metricsRegistry()) : null;
        logger.debug("RegexKit: Compiler created - dialect: {}, atomicNative: {}, fixedLookbehind: {}, cache: {}",
            config.dialect(), config.atomicGroupNativeSupport(), config.requireFixedLengthLookbehind(),
            config.cacheEnabled() ? config.maxCacheSize() : "disabled");
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public CompiledRegex compile(Node root) {
        return compile(root, config);
    }

    /**
     * Compiles {@code root} with {@code callConfig} instead of this compiler's defaults.
     *
     * @throws DuplicateGroupNameException if two capturing groups share a name
     * @throws UnresolvedBackreferenceException if a reference targets a group that is not in the tree
     * @throws VariableLengthLookbehindException if a lookbehind body has a length the engine rejects
     * @throws UnsupportedConstructException if the dialect cannot express a construct of the tree
     */
    public CompiledRegex compile(Node root, CompilerConfig callConfig) {
        Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(callConfig, "config cannot be null");
        RegexKitMetricsRegistry metrics = callConfig.metricsRegistry();
        metrics.incrementCounter(MetricNames.COMPILATIONS);
        try {
            if (cache != null && callConfig.cacheEnabled()) {
                return cache.getOrCompile(root, callConfig, () -> doCompile(root, callConfig));
            }
            return doCompile(root, callConfig);
        } catch (RegexKitException e) {
            metrics.incrementCounter(MetricNames.COMPILATIONS_FAILED);
            String errorMetric = errorMetric(e);
            if (errorMetric != null) {
                metrics.incrementCounter(errorMetric);
            }
            logger.debug("RegexKit: Compilation failed - tree: {}, error: {}", PatternHasher.hash(root), e.getMessage());
            throw e;
        }
    }

    private static CompiledRegex doCompile(Node root, CompilerConfig config) {
        RegexKitMetricsRegistry metrics = config.metricsRegistry();
        long startNanos = System.nanoTime();

        AtomicGroupLowering lowering = new AtomicGroupLowering(config.atomicGroupNativeSupport());
        Node tree = lowering.lower(root);
        RepetitionExpansion expansion = new RepetitionExpansion();
        tree = expansion.expand(tree);

        CaptureRegistry registry = CaptureRegistry.build(tree);
        BackreferenceResolver resolver = new BackreferenceResolver(registry);
        int references = resolver.resolveAll(tree);
        int lookbehinds = new LookbehindValidator(LengthAnalyzer.forRegistry(registry),
            config.requireFixedLengthLookbehind(), config.dialect()).validate(tree);

        String pattern = new PatternEmitter(config.dialect(), resolver, config.atomicGroupNativeSupport()).emit(tree);
        CompiledRegex compiled = new CompiledRegex(pattern, registry.publicNames(), registry.groups(), config.dialect());

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.COMPILATION_LATENCY, durationNanos);
        if (lowering.lowered() > 0) {
            metrics.incrementCounter(MetricNames.ATOMIC_GROUPS_LOWERED, lowering.lowered());
        }
        if (expansion.expanded() > 0) {
            metrics.incrementCounter(MetricNames.REPETITIONS_EXPANDED, expansion.expanded());
        }
        logger.trace("RegexKit: Tree compiled - tree: {}, hash: {}, dialect: {}, groups: {}, references: {}, "
                + "lookbehinds: {}, atomicLowered: {}, repetitionsExpanded: {}, timeNs: {}",
            root.id(), PatternHasher.hash(pattern), config.dialect(), registry.groupCount(), references,
            lookbehinds, lowering.lowered(), expansion.expanded(), durationNanos);
        return compiled;
    }

    private static String errorMetric(RegexKitException e) {
        if (e instanceof DuplicateGroupNameException) {
            return MetricNames.ERRORS_DUPLICATE_GROUP_NAME;
        }
        if (e instanceof UnresolvedBackreferenceException) {
            return MetricNames.ERRORS_UNRESOLVED_BACKREFERENCE;
        }
        if (e instanceof VariableLengthLookbehindException) {
            return MetricNames.ERRORS_VARIABLE_LENGTH_LOOKBEHIND;
        }
        if (e instanceof UnsupportedConstructException) {
            return MetricNames.ERRORS_UNSUPPORTED_CONSTRUCT;
        }
        return null;
    }

    /**
     * Renames capture groups of {@code root}; see {@link GroupRenamer#rename}.
     *
     * @throws DuplicateGroupNameException if two groups end up with the same name
     */
    public Node rename(Node root, Renaming renaming) {
        Node renamed = GroupRenamer.rename(root, renaming);
        config.metricsRegistry().incrementCounter(MetricNames.RENAMES);
        return renamed;
    }

    /** Renames per {@code renames}; names not in the map are kept. */
    public Node rename(Node root, Map<String, String> renames) {
        return rename(root, Renaming.of(renames));
    }

    /** Makes every named group of {@code root} unnamed; group numbers do not change. */
    public Node dropNames(Node root) {
        return rename(root, Renaming.dropAll());
    }

    /**
     * @return cache statistics, or all zeros if caching is disabled
     */
    public CacheStatistics getCacheStatistics() {
        return cache != null ? cache.getStatistics() : new CacheStatistics(0, 0, 0, 0, 0);
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /** Releases the cache and its metrics. The compiler remains usable without cached results. */
    public void shutdown() {
        if (cache != null) {
            cache.shutdown();
        }
    }
}
