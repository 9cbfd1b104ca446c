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

package com.axonops.regexkit.cache;

import com.axonops.regexkit.api.CompiledRegex;
import com.axonops.regexkit.api.CompilerConfig;
import com.axonops.regexkit.compiler.RegexDialect;
import com.axonops.regexkit.metrics.MetricNames;
import com.axonops.regexkit.metrics.RegexKitMetricsRegistry;
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.util.PatternHasher;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU cache of compilation results.
 *
 * <p>Entries are keyed by the tree itself, compared by value, together with the options that change
 * the emitted text. Trees are immutable and equal trees compile to equal results, so a renamed tree
 * (same identities, different names) never collides with its original.
 *
 * <p>Thread-safe. Compilation runs outside the lock; two threads missing on the same key may both
 * compile it, and the later result replaces the earlier. Failed compilations are never cached.
 *
 * @since 1.0.0
 */
public final class CompilationCache {
  private static final Logger logger = LoggerFactory.getLogger(CompilationCache.class);

  private final int maxSize;
  private final RegexKitMetricsRegistry metrics;
  private final ReentrantLock lock = new ReentrantLock();

  // access order: iteration starts at the least recently used entry
  private final LinkedHashMap<CacheKey, CompiledRegex> entries = new LinkedHashMap<>(16, 0.75f, true);

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong evictions = new AtomicLong();

  /**
   * @param maxSize maximum number of entries (must be > 0)
   * @param metrics registry for cache counters and the size gauge
   */
  public CompilationCache(int maxSize, RegexKitMetricsRegistry metrics) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive; got " + maxSize);
    }
    this.maxSize = maxSize;
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    metrics.registerGauge(MetricNames.CACHE_SIZE, this::size);
    logger.debug("RegexKit: Compilation cache initialized - maxSize: {}", maxSize);
  }

  /**
   * Returns the cached result for {@code root} under {@code config}, compiling and caching it on a
   * miss.
   *
   * @param compiler runs the compilation on a miss; exceptions propagate and nothing is cached
   */
  public CompiledRegex getOrCompile(Node root, CompilerConfig config, Supplier<CompiledRegex> compiler) {
    CacheKey key = new CacheKey(root, config.atomicGroupNativeSupport(),
        config.requireFixedLengthLookbehind(), config.dialect());

    CompiledRegex cached;
    lock.lock();
    try {
      cached = entries.get(key);
    } finally {
      lock.unlock();
    }
    if (cached != null) {
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.CACHE_HITS);
      logger.trace("RegexKit: Cache hit - hash: {}", PatternHasher.hash(cached.pattern()));
      return cached;
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.CACHE_MISSES);
    logger.trace("RegexKit: Cache miss - tree: {}, compiling", root.id());

    CompiledRegex compiled = compiler.get();
    int evicted = 0;
    lock.lock();
    try {
      entries.put(key, compiled);
      Iterator<CacheKey> eldest = entries.keySet().iterator();
      while (entries.size() > maxSize) {
        eldest.next();
        eldest.remove();
        evicted++;
      }
    } finally {
      lock.unlock();
    }
    if (evicted > 0) {
      evictions.addAndGet(evicted);
      metrics.incrementCounter(MetricNames.CACHE_EVICTIONS, evicted);
      logger.trace("RegexKit: LRU evicted {} entries", evicted);
    }
    return compiled;
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(hits.get(), misses.get(), evictions.get(), size(), maxSize);
  }

  public void clear() {
    int cleared;
    lock.lock();
    try {
      cleared = entries.size();
      entries.clear();
    } finally {
      lock.unlock();
    }
    logger.debug("RegexKit: Clearing cache - {} entries", cleared);
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictions.set(0);
    logger.trace("RegexKit: Cache statistics reset");
  }

  /** Clears the cache and removes its gauge from the metrics registry. */
  public void shutdown() {
    CacheStatistics stats = getStatistics();
    logger.info("RegexKit: Shutting down compilation cache - requests: {}, hitRate: {}, evictions: {}",
        stats.totalRequests(), String.format("%.3f", stats.hitRate()), stats.evictions());
    clear();
    metrics.removeGauge(MetricNames.CACHE_SIZE);
  }

  private record CacheKey(Node root, boolean atomicGroupNativeSupport, boolean requireFixedLengthLookbehind,
                          RegexDialect dialect) {
    @Override
    public String toString() {
      return root.id() + " (dialect=" + dialect + ", atomic=" + atomicGroupNativeSupport
          + ", fixedLookbehind=" + requireFixedLengthLookbehind + ")";
    }
  }
}
