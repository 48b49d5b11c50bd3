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

package io.junction;

import org.xnio.Option;
import org.xnio.Sequence;

/**
 * Options understood by {@link io.junction.server.Router}.
 */
public class JunctionOptions {

    /**
     * Prefix applied to every path registered on the router. A trailing slash is not stripped when the prefix is given
     * here, only when it is set through {@link io.junction.server.Router#prefix(String)}.
     */
    public static final Option<String> PREFIX = Option.simple(JunctionOptions.class, "PREFIX", String.class);

    /**
     * If literal path segments are matched case sensitively. Defaults to false.
     */
    public static final Option<Boolean> CASE_SENSITIVE = Option.simple(JunctionOptions.class, "CASE_SENSITIVE", Boolean.class);

    /**
     * If a trailing slash is significant. When false "/users" and "/users/" both match "/users". Defaults to false.
     */
    public static final Option<Boolean> STRICT_SLASH = Option.simple(JunctionOptions.class, "STRICT_SLASH", Boolean.class);

    /**
     * A fixed path the router matches against instead of the request path. Only used when the request itself does not
     * carry a match path.
     */
    public static final Option<String> ROUTER_PATH = Option.simple(JunctionOptions.class, "ROUTER_PATH", String.class);

    /**
     * The methods the router implements, used to decide between 405 and 501 responses.
     *
     * @see #DEFAULT_METHODS
     */
    public static final Option<Sequence<String>> METHODS = Option.sequence(JunctionOptions.class, "METHODS", String.class);

    public static final Sequence<String> DEFAULT_METHODS = Sequence.of("HEAD", "OPTIONS", "GET", "PUT", "PATCH", "POST", "DELETE");

    private JunctionOptions() {

    }
}
