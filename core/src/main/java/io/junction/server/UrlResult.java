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

/**
 * The outcome of generating a URL for a named route. Looking up a name that is not registered is not an error at the
 * time of the call; the result carries the exception instead.
 *
 * @see Router#url(String, Object...)
 */
public final class UrlResult {

    private final String url;
    private final RouteNotFoundException error;

    private UrlResult(final String url, final RouteNotFoundException error) {
        this.url = url;
        this.error = error;
    }

    static UrlResult of(final String url) {
        return new UrlResult(url, null);
    }

    static UrlResult notFound(final RouteNotFoundException error) {
        return new UrlResult(null, error);
    }

    public boolean isFound() {
        return error == null;
    }

    /**
     * @return the URL, or {@code null} if the route was not found
     */
    public String getUrl() {
        return url;
    }

    /**
     * @return the lookup error, or {@code null} if the route was found
     */
    public RouteNotFoundException getError() {
        return error;
    }

    /**
     * @return the URL
     * @throws RouteNotFoundException if the route was not found
     */
    public String orElseThrow() {
        if (error != null) {
            throw error;
        }
        return url;
    }

    @Override
    public String toString() {
        return error != null ? error.getMessage() : url;
    }
}
