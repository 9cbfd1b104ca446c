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

/**
 * Point-in-time view of a {@link CompilationCache}, as returned by
 * {@link com.axonops.regexkit.api.RegexCompiler#getCacheStatistics()}.
 *
 * <p>A compiler without a cache reports all zeros.
 *
 * @param hits lookups answered from the cache
 * @param misses lookups that ran a compilation, failed ones included
 * @param evictions entries dropped to stay within {@code maxSize}
 * @param currentSize entries held now
 * @param maxSize capacity
 * @since 1.0.0
 */
public record CacheStatistics(long hits, long misses, long evictions, int currentSize, int maxSize) {

  public long totalRequests() {
    return hits + misses;
  }

  /** Fraction of lookups answered from the cache; 0.0 before the first lookup. */
  public double hitRate() {
    long total = totalRequests();
    return total == 0 ? 0.0 : (double) hits / total;
  }

  /** Fraction of capacity in use; 0.0 for a compiler without a cache. */
  public double utilization() {
    return maxSize == 0 ? 0.0 : (double) currentSize / maxSize;
  }
}
