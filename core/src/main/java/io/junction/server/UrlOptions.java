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


package io.junction.server;

import java.util.Map;

/**
 * Options for URL generation.
 */
public final class UrlOptions {

    private final Object query;

    private UrlOptions(final Object query) {
        this.query = query;
    }

    /**
     * @param query an already encoded query string, with or without the leading {@code ?}
     */
    public static UrlOptions query(final String query) {
        return new UrlOptions(query);
    }

    /**
     * @param query the query parameters. Iterable and array values repeat the key.
     */
    public static UrlOptions query(final Map<String, ?> query) {
        return new UrlOptions(query);
    }

    /**
     * @return the query, either a {@link String} or a {@link Map}, or {@code null}
     */
    public Object getQuery() {
        return query;
    }

    @Override
    public String toString() {
        return "UrlOptions{query=" + query + '}';
    }
}
