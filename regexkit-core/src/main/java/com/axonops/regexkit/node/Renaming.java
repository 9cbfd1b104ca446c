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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps an existing capture group name to its replacement.
 *
 * <p>An empty result drops the name: the group stays capturing but becomes unnamed.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Renaming {

    /**
     * Returns the new name for {@code name}, or empty to drop it.
     */
    Optional<String> apply(String name);

    /** Renames per {@code renames}; names not in the map are kept. */
    static Renaming of(Map<String, String> renames) {
        return of(renames, Set.of());
    }

    /**
     * Renames per {@code renames} and drops the names in {@code dropped}; other names are kept.
     */
    static Renaming of(Map<String, String> renames, Set<String> dropped) {
        Map<String, String> table = Map.copyOf(renames);
        Set<String> drop = Set.copyOf(dropped);
        return name -> {
            Objects.requireNonNull(name, "name cannot be null");
            if (drop.contains(name)) {
                return Optional.empty();
            }
            return Optional.of(table.getOrDefault(name, name));
        };
    }

    static Renaming dropAll() {
        return name -> Optional.empty();
    }
}
