/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.junction.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses route path strings into tokens.
 * <p>
 * This is one of three classes that participate in turning a route path into something a router can use:
 * <ol>
 * <li>{@link PathPatternParser} splits a path string into literal text and keys.</li>
 * <li>{@link PathPattern} turns the tokens into a regular expression used to match and capture request paths.</li>
 * <li>{@link PathTemplate} turns the tokens back into a concrete path, given values for the keys.</li>
 * </ol>
 *
 * <p>
 * <b>Route path strings</b>
 *
 * <p>
 * A route path is literal text mixed with keys:
 * <ol>
 * <li>Named parameters, a {@code :} followed by word characters. {@code "/users/:id"} contains the key {@code id}, which
 * matches one path segment.</li>
 * <li>Custom parameter expressions. {@code "/users/:id(\\d+)"} only matches digits.</li>
 * <li>Unnamed groups. {@code "/files/(.*)"} contains an unnamed key, which gets a numeric name starting at
 * {@code "0"}.</li>
 * <li>A bare {@code *}, which matches anything, including slashes. It is an unnamed key.</li>
 * <li>Modifiers after a key: {@code ?} makes it optional, {@code +} repeats it one or more times and {@code *} zero or
 * more times.</li>
 * </ol>
 * <p>
 * A {@code /} or {@code .} directly in front of a key is the key's prefix: it is only matched, and only rendered, when the
 * key itself is. A backslash escapes the next character.
 */
public class PathPatternParser {

    static final String DEFAULT_DELIMITER = "/";

    /*
     * Groups: 1 escaped character, 2 prefix, 3 name, 4 custom expression of a named key, 5 unnamed group expression,
     * 6 modifier, 7 bare asterisk.
     */
    private static final Pattern PATH_REGEXP = Pattern.compile(
            "(\\\\.)"
                    + "|([\\/.])?(?:(?:\\:(\\w+)(?:\\(((?:\\\\.|[^\\\\()])+)\\))?|\\(((?:\\\\.|[^\\\\()])+)\\))([+*?])?|(\\*))");

    private static final Pattern ESCAPE_STRING = Pattern.compile("([.+*?=^!:${}()\\[\\]|/\\\\])");
    private static final Pattern ESCAPE_GROUP = Pattern.compile("([=!:$/()])");

    private PathPatternParser() {
    }

    /**
     * Parses a route path into tokens.
     *
     * @param path the route path
     * @return the tokens, literal text and keys in the order they appear
     */
    public static List<Token> parse(final String path) {
        Objects.requireNonNull(path);

        final List<Token> tokens = new ArrayList<>();
        final Matcher matcher = PATH_REGEXP.matcher(path);
        final StringBuilder literal = new StringBuilder();
        int unnamed = 0;
        int index = 0;

        while (matcher.find()) {
            final int offset = matcher.start();
            literal.append(path, index, offset);
            index = matcher.end();

            final String escaped = matcher.group(1);
            if (escaped != null) {
                literal.append(escaped.charAt(1));
                continue;
            }

            final String prefix = matcher.group(2);
            final String name = matcher.group(3);
            final String capture = matcher.group(4);
            final String group = matcher.group(5);
            final String modifier = matcher.group(6);
            final String asterisk = matcher.group(7);
            final Character next = index < path.length() ? path.charAt(index) : null;

            if (literal.length() > 0) {
                tokens.add(new Literal(literal.toString()));
                literal.setLength(0);
            }

            final boolean partial = prefix != null && next != null && next != prefix.charAt(0);
            final boolean repeat = "+".equals(modifier) || "*".equals(modifier);
            final boolean optional = "?".equals(modifier) || "*".equals(modifier);
            final String delimiter = prefix != null ? prefix : DEFAULT_DELIMITER;
            final String expression = capture != null ? capture : group;

            final String keyPattern;
            if (expression != null) {
                keyPattern = escapeGroup(expression);
            } else if (asterisk != null) {
                keyPattern = ".*";
            } else {
                keyPattern = "[^" + escapeString(delimiter) + "]+?";
            }

            tokens.add(new Key(
                    name != null ? name : Integer.toString(unnamed++),
                    name != null,
                    prefix != null ? prefix : "",
                    delimiter,
                    optional,
                    repeat,
                    partial,
                    asterisk != null,
                    keyPattern
            ));
        }

        if (index < path.length()) {
            literal.append(path, index, path.length());
        }
        if (literal.length() > 0) {
            tokens.add(new Literal(literal.toString()));
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Escapes regular expression meta characters in literal text.
     */
    static String escapeString(final String s) {
        return ESCAPE_STRING.matcher(s).replaceAll("\\\\$1");
    }

    static String escapeGroup(final String group) {
        return ESCAPE_GROUP.matcher(group).replaceAll("\\\\$1");
    }

    /**
     * A piece of a parsed route path.
     */
    public abstract static class Token {

        private Token() {
        }
    }

    /**
     * Literal text, matched as is (or case insensitively).
     */
    public static final class Literal extends Token {

        private final String text;

        Literal(final String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * A parameter of the route path. Each key corresponds to exactly one capturing group of the compiled pattern.
     */
    public static final class Key extends Token {

        private final String name;
        private final boolean named;
        private final String prefix;
        private final String delimiter;
        private final boolean optional;
        private final boolean repeat;
        private final boolean partial;
        private final boolean asterisk;
        private final String pattern;

        Key(
                final String name,
                final boolean named,
                final String prefix,
                final String delimiter,
                final boolean optional,
                final boolean repeat,
                final boolean partial,
                final boolean asterisk,
                final String pattern
        ) {
            this.name = name;
            this.named = named;
            this.prefix = prefix;
            this.delimiter = delimiter;
            this.optional = optional;
            this.repeat = repeat;
            this.partial = partial;
            this.asterisk = asterisk;
            this.pattern = pattern;
        }

        /**
         * @return the parameter name, or the position among unnamed keys for unnamed groups
         */
        public String getName() {
            return name;
        }

        /**
         * @return true for {@code :name} keys, false for unnamed groups and asterisks
         */
        public boolean isNamed() {
            return named;
        }

        public String getPrefix() {
            return prefix;
        }

        public String getDelimiter() {
            return delimiter;
        }

        public boolean isOptional() {
            return optional;
        }

        public boolean isRepeat() {
            return repeat;
        }

        /**
         * @return true if the key is followed by literal text in the same segment, as in {@code /:from-:to}
         */
        public boolean isPartial() {
            return partial;
        }

        public boolean isAsterisk() {
            return asterisk;
        }

        /**
         * @return the regular expression a single occurrence of the key matches
         */
        public String getPattern() {
            return pattern;
        }

        @Override
        public String toString() {
            if (named) {
                return prefix + ':' + name;
            }
            return asterisk ? prefix + '*' : prefix + '(' + pattern + ')';
        }
    }
}
