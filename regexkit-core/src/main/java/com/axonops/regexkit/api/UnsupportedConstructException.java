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

/**
 * Thrown when a tree uses a construct the selected dialect cannot express.
 *
 * @since 1.0.0
 */
public final class UnsupportedConstructException extends RegexKitException {

    private final RegexDialect dialect;
    private final String construct;

    public UnsupportedConstructException(RegexDialect dialect, String construct) {
        super("RegexKit: " + dialect + " dialect does not support " + construct);
        this.dialect = dialect;
        this.construct = construct;
    }

    public RegexDialect getDialect() {
        return dialect;
    }

    public String getConstruct() {
        return construct;
    }
}
