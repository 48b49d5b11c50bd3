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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Renders a route path with concrete values for its keys.
 * <p>
 * Rendering is lenient. A required key without a value is written back as its placeholder, for example {@code :id},
 * and an optional key without a value is left out together with its prefix. Values are not checked against the key's
 * expression.
 *
 * @see PathPatternParser
 */
public final class PathTemplate {

    private final String template;
    private final List<PathPatternParser.Token> tokens;

    private PathTemplate(final String template, final List<PathPatternParser.Token> tokens) {
        this.template = template;
        this.tokens = tokens;
    }

    public static PathTemplate parse(final String template) {
        return new PathTemplate(template, PathPatternParser.parse(template));
    }

    /**
     * Renders the template.
     * <p>
     * Values are converted with {@link String#valueOf(Object)} and encoded as URI components, except for {@code *}
     * keys, which keep their slashes. A repeated key accepts an {@link Iterable} or an object array, whose elements are
     * joined with the key's delimiter.
     *
     * @param values the values, by key name
     * @return the path
     */
    public String render(final Map<String, ?> values) {
        final Map<String, ?> data = values == null ? Collections.<String, Object>emptyMap() : values;
        final StringBuilder sb = new StringBuilder();
        for (PathPatternParser.Token token : tokens) {
            if (token instanceof PathPatternParser.Literal) {
                sb.append(((PathPatternParser.Literal) token).getText());
                continue;
            }
            final PathPatternParser.Key key = (PathPatternParser.Key) token;
            final Object value = data.get(key.getName());
            final List<Object> segments = key.isRepeat() ? elements(value) : null;

            if (value == null || (segments != null && segments.isEmpty())) {
                if (!key.isOptional()) {
                    sb.append(key);
                } else if (key.isPartial()) {
                    sb.append(key.getPrefix());
                }
                continue;
            }
            if (segments != null) {
                for (int i = 0; i < segments.size(); ++i) {
                    sb.append(i == 0 ? key.getPrefix() : key.getDelimiter());
                    sb.append(encode(key, segments.get(i)));
                }
            } else {
                sb.append(key.getPrefix());
                sb.append(encode(key, value));
            }
        }
        return sb.toString();
    }

    public List<PathPatternParser.Token> getTokens() {
        return tokens;
    }

    public String getTemplate() {
        return template;
    }

    private static String encode(final PathPatternParser.Key key, final Object value) {
        final String s = String.valueOf(value);
        if (key.isAsterisk()) {
            return URLUtils.encodeURI(s).replace("?", "%3F").replace("#", "%23");
        }
        return URLUtils.encodeURIComponent(s);
    }

    private static List<Object> elements(final Object value) {
        final List<Object> result = new ArrayList<>();
        if (value instanceof Iterable) {
            for (Object o : (Iterable<?>) value) {
                result.add(o);
            }
        } else if (value instanceof Object[]) {
            result.addAll(Arrays.asList((Object[]) value));
        } else if (value != null) {
            result.add(value);
        }
        return result;
    }

    @Override
    public String toString() {
        return template;
    }
}
