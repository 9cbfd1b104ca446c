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

package com.axonops.regexkit.compiler;

/**
 * Resolved target of a backreference or conditional test.
 *
 * @param index number of the target group in the emitted pattern
 * @param name name of the target group, or {@code null}
 * @since 1.0.0
 */
public record GroupReference(int index, String name) {

    public boolean isNamed() {
        return name != null;
    }
}
