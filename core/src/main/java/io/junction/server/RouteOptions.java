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
 * Per route settings. Settings that are left unset are inherited from the router the route is registered on.
 */
public class RouteOptions {

    private String name;
    private String prefix;
    private Boolean sensitive;
    private Boolean strict;
    private Boolean end;
    private Boolean ignoreCaptures;

    public static RouteOptions create() {
        return new RouteOptions();
    }

    public static RouteOptions named(final String name) {
        return new RouteOptions().setName(name);
    }

    public String getName() {
        return name;
    }

    /**
     * The name used to look the route up with {@link Router#route(String)} and {@link Router#url(String, Object...)}.
     */
    public RouteOptions setName(final String name) {
        this.name = name;
        return this;
    }

    public String getPrefix() {
        return prefix;
    }

    public RouteOptions setPrefix(final String prefix) {
        this.prefix = prefix;
        return this;
    }

    public Boolean getSensitive() {
        return sensitive;
    }

    public RouteOptions setSensitive(final Boolean sensitive) {
        this.sensitive = sensitive;
        return this;
    }

    public Boolean getStrict() {
        return strict;
    }

    public RouteOptions setStrict(final Boolean strict) {
        this.strict = strict;
        return this;
    }

    public Boolean getEnd() {
        return end;
    }

    /**
     * If false the route also matches paths that continue past it, as long as the match ends at a {@code /}.
     */
    public RouteOptions setEnd(final Boolean end) {
        this.end = end;
        return this;
    }

    public Boolean getIgnoreCaptures() {
        return ignoreCaptures;
    }

    /**
     * If true the route contributes no captures or params to the request.
     */
    public RouteOptions setIgnoreCaptures(final Boolean ignoreCaptures) {
        this.ignoreCaptures = ignoreCaptures;
        return this;
    }

    RouteOptions copy() {
        final RouteOptions copy = new RouteOptions();
        copy.name = name;
        copy.prefix = prefix;
        copy.sensitive = sensitive;
        copy.strict = strict;
        copy.end = end;
        copy.ignoreCaptures = ignoreCaptures;
        return copy;
    }

    @Override
    public String toString() {
        return "RouteOptions{name=" + name + ", prefix=" + prefix + ", sensitive=" + sensitive + ", strict=" + strict
                + ", end=" + end + ", ignoreCaptures=" + ignoreCaptures + '}';
    }
}
