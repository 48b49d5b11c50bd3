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
import java.util.regex.PatternSyntaxException;

import io.junction.JunctionMessages;

/**
 * A compiled route path.
 * <p>
 * A path pattern matches request paths and extracts the values of its keys. Every key of the route path is one
 * capturing group of the underlying regular expression, so {@link #capture(String)} returns values in the same order as
 * {@link #getKeys()}.
 * <p>
 * Unless the options say otherwise matching is case insensitive, a single trailing slash is optional and the whole path
 * has to match.
 *
 * @see PathPatternParser
 */
public final class PathPattern {

    private final String path;
    private final Pattern regex;
    private final List<PathPatternParser.Key> keys;

    private PathPattern(final String path, final Pattern regex, final List<PathPatternParser.Key> keys) {
        this.path = path;
        this.regex = regex;
        this.keys = keys;
    }

    public static PathPattern compile(final String path) {
        return compile(path, PathPatternOptions.DEFAULT);
    }

    /**
     * Compiles a route path.
     *
     * @param path    the route path
     * @param options the matching options
     * @return the compiled pattern
     * @throws IllegalArgumentException if a custom parameter expression is not a valid regular expression
     */
    public static PathPattern compile(final String path, final PathPatternOptions options) {
        Objects.requireNonNull(path);
        Objects.requireNonNull(options);
        final List<PathPatternParser.Key> keys = new ArrayList<>();
        final StringBuilder route = new StringBuilder("^");

        for (PathPatternParser.Token token : PathPatternParser.parse(path)) {
            if (token instanceof PathPatternParser.Literal) {
                route.append(PathPatternParser.escapeString(((PathPatternParser.Literal) token).getText()));
                continue;
            }
            final PathPatternParser.Key key = (PathPatternParser.Key) token;
            keys.add(key);
            final String prefix = PathPatternParser.escapeString(key.getPrefix());
            String capture = "(?:" + key.getPattern() + ")";
            if (key.isRepeat()) {
                capture += "(?:" + prefix + capture + ")*";
            }
            if (key.isOptional()) {
                if (key.isPartial()) {
                    capture = prefix + "(" + capture + ")?";
                } else {
                    capture = "(?:" + prefix + "(" + capture + "))?";
                }
            } else {
                capture = prefix + "(" + capture + ")";
            }
            route.append(capture);
        }

        final String delimiter = PathPatternParser.escapeString(PathPatternParser.DEFAULT_DELIMITER);
        final boolean endsWithDelimiter = route.length() > 1 && route.toString().endsWith(delimiter);
        if (!options.isStrict()) {
            if (endsWithDelimiter) {
                route.setLength(route.length() - delimiter.length());
            }
            route.append("(?:").append(delimiter).append("(?=\\z))?");
        }
        if (options.isEnd()) {
            route.append("\\z");
        } else if (!(options.isStrict() && endsWithDelimiter)) {
            route.append("(?=").append(delimiter).append("|\\z)");
        }

        final int flags = options.isSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        try {
            return new PathPattern(path, Pattern.compile(route.toString(), flags), Collections.unmodifiableList(keys));
        } catch (PatternSyntaxException e) {
            throw JunctionMessages.MESSAGES.couldNotCompilePathPattern(path, e);
        }
    }

    /**
     * Wraps a regular expression supplied by the user. It is used as is, and each capturing group, named or not, becomes
     * an unnamed key.
     *
     * @param regex the regular expression
     * @return the pattern
     */
    public static PathPattern compile(final Pattern regex) {
        Objects.requireNonNull(regex);
        final List<PathPatternParser.Key> keys = new ArrayList<>();
        final int groupCount = regex.matcher("").groupCount();
        for (int i = 0; i < groupCount; ++i) {
            keys.add(new PathPatternParser.Key(Integer.toString(i), false, "", PathPatternParser.DEFAULT_DELIMITER,
                    false, false, false, false, ""));
        }
        return new PathPattern(regex.pattern(), regex, Collections.unmodifiableList(keys));
    }

    /**
     * @param path the request path
     * @return true if the path matches
     */
    public boolean matches(final String path) {
        return regex.matcher(path).find();
    }

    /**
     * Extracts the raw, still encoded, values of the capturing groups.
     *
     * @param path the request path
     * @return the group values, with {@code null} for groups that did not take part in the match, or an empty list if
     *         the path does not match
     */
    public List<String> capture(final String path) {
        final Matcher matcher = regex.matcher(path);
        if (!matcher.find()) {
            return Collections.emptyList();
        }
        final List<String> captures = new ArrayList<>(matcher.groupCount());
        for (int i = 1; i <= matcher.groupCount(); ++i) {
            captures.add(matcher.group(i));
        }
        return captures;
    }

    public List<PathPatternParser.Key> getKeys() {
        return keys;
    }

    public List<String> getKeyNames() {
        final List<String> names = new ArrayList<>(keys.size());
        for (PathPatternParser.Key key : keys) {
            names.add(key.getName());
        }
        return names;
    }

    /**
     * @return the route path this pattern was compiled from, or the source of a user supplied regular expression
     */
    public String getPath() {
        return path;
    }

    public Pattern getRegex() {
        return regex;
    }

    @Override
    public String toString() {
        return regex.pattern();
    }
}
