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

import io.junction.server.Layer;
import io.junction.server.Router;
import org.xnio.OptionMap;

/**
 * Utility class with convenience methods for creating routers.
 */
public class Routing {

    /**
     * @return a new router with default options
     */
    public static Router router() {
        return new Router();
    }

    /**
     * @param options the router options, see {@link JunctionOptions}
     * @return a new router
     */
    public static Router router(final OptionMap options) {
        return new Router(options);
    }

    /**
     * Generates a URL from a route path without a router.
     *
     * <pre>
     * Routing.url("/users/:id", Map.of("id", 1)); // "/users/1"
     * </pre>
     *
     * @param path the route path
     * @param args the parameters and options, see {@link Layer#url(Object...)}
     * @return the URL
     */
    public static String url(final String path, final Object... args) {
        return Layer.toUrl(path, args);
    }

    private Routing() {

    }
}
