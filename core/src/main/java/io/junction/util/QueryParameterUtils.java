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

import java.util.Map;

/**
 * Methods for dealing with the query string
 */
public class QueryParameterUtils {

    private QueryParameterUtils() {

    }

    /**
     * Builds an encoded query string, without the leading {@code ?}.
     * <p>
     * Iterable and object array values produce one {@code key=value} pair per element, in order. A {@code null} value
     * produces the bare key.
     *
     * @param params the parameters, iterated in map order
     * @return the query string, empty if there are no parameters
     */
    public static String buildQueryString(final Map<String, ?> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            final String key = URLUtils.encodeQueryComponent(entry.getKey());
            final Object value = entry.getValue();
            if (value instanceof Iterable) {
                for (Object val : (Iterable<?>) value) {
                    appendParameter(sb, key, val);
                }
            } else if (value instanceof Object[]) {
                for (Object val : (Object[]) value) {
                    appendParameter(sb, key, val);
                }
            } else {
                appendParameter(sb, key, value);
            }
        }
        return sb.toString();
    }

    /**
     * Appends a query string to a path or URL, replacing any query string that is already present.
     *
     * @param url   the url
     * @param query the encoded query, with or without a leading {@code ?}
     * @return the url with the query string
     */
    public static String replaceQueryString(final String url, final String query) {
        String base = url;
        final int existing = base.indexOf('?');
        if (existing != -1) {
            base = base.substring(0, existing);
        }
        final String q = query.startsWith("?") ? query.substring(1) : query;
        if (q.isEmpty()) {
            return base;
        }
        return base + '?' + q;
    }

    private static void appendParameter(final StringBuilder sb, final String key, final Object value) {
        if (sb.length() > 0) {
            sb.append('&');
        }
        sb.append(key);
        if (value != null) {
            sb.append('=');
            sb.append(URLUtils.encodeQueryComponent(String.valueOf(value)));
        }
    }
}
