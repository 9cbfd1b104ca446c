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
import com.axonops.regexkit.node.Node;
import com.axonops.regexkit.node.Renaming;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Static entry points backed by a process-wide {@link RegexCompiler}.
 *
 * <pre>{@code
 * Group year = named("year", repeat(escapes(SpecialKind.DIGIT), RepeatCounts.exactly(4)));
 * String text = RegexKit.pattern(concat(year, literal("-"), backreference(year)));
 * // (?P<year>[\d]{4})\-(?P=year)
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RegexKit {

    // Default compiler (replaceable for tests and for applications that configure metrics)
    private static volatile RegexCompiler compiler = new RegexCompiler(CompilerConfig.DEFAULT);

    private RegexKit() {
    }

    public static RegexCompiler getDefaultCompiler() {
        return compiler;
    }

    /**
     * Replaces the default compiler. The previous one is shut down.
     */
    public static void setDefaultCompiler(RegexCompiler newCompiler) {
        RegexCompiler previous = compiler;
        compiler = Objects.requireNonNull(newCompiler, "compiler cannot be null");
        if (previous != newCompiler) {
            previous.shutdown();
        }
    }

    public static CompiledRegex compile(Node root) {
        return compiler.compile(root);
    }

    public static CompiledRegex compile(Node root, CompilerConfig config) {
        return compiler.compile(root, config);
    }

    /** Pattern text of {@code root} under the default configuration. */
    public static String pattern(Node root) {
        return compiler.compile(root).pattern();
    }

    public static Node rename(Node root, Renaming renaming) {
        return compiler.rename(root, renaming);
    }

    public static Node rename(Node root, Map<String, String> renames) {
        return compiler.rename(root, renames);
    }

    public static Node dropNames(Node root) {
        return compiler.dropNames(root);
    }

    /**
     * Compiles {@code root} for {@code java.util.regex}: the default compiler's configuration with
     * the {@link RegexDialect#JAVA} dialect, native atomic groups and bounded lookbehind.
     */
    public static Pattern toJavaPattern(Node root) {
        return toJavaPattern(root, 0);
    }

    public static Pattern toJavaPattern(Node root, int flags) {
        RegexCompiler current = compiler;
        CompilerConfig javaConfig = current.getConfig().toBuilder()
            .dialect(RegexDialect.JAVA)
            .atomicGroupNativeSupport(true)
            .requireFixedLengthLookbehind(false)
            .build();
        return current.compile(root, javaConfig).toJavaPattern(flags);
    }
}
