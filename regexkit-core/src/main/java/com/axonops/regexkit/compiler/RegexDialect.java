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

import com.axonops.regexkit.api.UnsupportedConstructException;
import com.axonops.regexkit.node.RegexFlag;
import com.axonops.regexkit.node.SpecialKind;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Concrete syntax of the engine a pattern is emitted for.
 *
 * <p>The dialects share escaping, character classes, quantifiers, lookaround and numeric
 * backreferences. They differ in the spelling of named groups and named references, and in which
 * optional constructs they accept at all.
 *
 * @since 1.0.0
 */
public enum RegexDialect {

    /** Python {@code re} syntax. */
    PYTHON {
        @Override
        String openNamedGroup(String name) {
            return "(?P<" + name + ">";
        }

        @Override
        String namedBackreference(String name) {
            return "(?P=" + name + ")";
        }

        @Override
        String numericBackreference(int index) {
            // \100 and above are octal escapes in Python
            if (index > 99) {
                throw new UnsupportedConstructException(this, "numeric backreference to group " + index);
            }
            return "\\" + index;
        }

        @Override
        String openConditional(GroupReference test) {
            return "(?(" + (test.isNamed() ? test.name() : String.valueOf(test.index())) + ")";
        }

        @Override
        String comment(String text) {
            return "(?#" + text + ")";
        }

        @Override
        String special(SpecialKind kind) {
            return kind.token();
        }

        @Override
        char flagLetter(RegexFlag flag) {
            return flag.letter();
        }

        @Override
        boolean requiresBoundedLookbehind() {
            return false;
        }
    },

    /** {@link java.util.regex.Pattern} syntax. Conditionals are not supported. */
    JAVA {
        private final Pattern groupName = Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");

        @Override
        String openNamedGroup(String name) {
            return "(?<" + checkName(name) + ">";
        }

        @Override
        String namedBackreference(String name) {
            return "\\k<" + checkName(name) + ">";
        }

        @Override
        String numericBackreference(int index) {
            return "\\" + index;
        }

        @Override
        String openConditional(GroupReference test) {
            throw new UnsupportedConstructException(this, "conditional");
        }

        @Override
        String comment(String text) {
            return "";
        }

        @Override
        String special(SpecialKind kind) {
            return kind == SpecialKind.END_STRING ? "\\z" : kind.token();
        }

        @Override
        char flagLetter(RegexFlag flag) {
            switch (flag) {
                case UNICODE:
                    return 'U';
                case ASCII:
                case LOCALE:
                    throw new UnsupportedConstructException(this, "inline flag " + flag);
                default:
                    return flag.letter();
            }
        }

        @Override
        boolean requiresBoundedLookbehind() {
            return true;
        }

        private String checkName(String name) {
            if (!groupName.matcher(name).matches()) {
                throw new UnsupportedConstructException(this, "group name '" + name + "'");
            }
            return name;
        }
    };

    abstract String openNamedGroup(String name);

    abstract String namedBackreference(String name);

    abstract String numericBackreference(int index);

    /** Text up to and including the closing parenthesis of the test, e.g. {@code (?(1)}. */
    abstract String openConditional(GroupReference test);

    abstract String comment(String text);

    abstract String special(SpecialKind kind);

    abstract char flagLetter(RegexFlag flag);

    /** Whether lookbehind needs a bounded maximum length even when variable length is allowed. */
    abstract boolean requiresBoundedLookbehind();

    /** Flag prefix of a scoped flag group, e.g. {@code ai-m}. Letters are sorted. */
    String flags(Set<RegexFlag> enabled, Set<RegexFlag> disabled) {
        StringBuilder sb = new StringBuilder();
        appendLetters(sb, enabled);
        if (!disabled.isEmpty()) {
            sb.append('-');
            appendLetters(sb, disabled);
        }
        return sb.toString();
    }

    private void appendLetters(StringBuilder sb, Set<RegexFlag> flags) {
        Set<Character> letters = new TreeSet<>();
        for (RegexFlag flag : flags) {
            letters.add(flagLetter(flag));
        }
        letters.forEach(sb::append);
    }
}
