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


package io.junction.server.handlers;

import java.util.concurrent.CompletionStage;

import io.junction.server.Middleware;
import io.junction.server.MiddlewareChain;
import io.junction.server.Next;
import io.junction.server.RoutingContext;
import io.junction.util.StatusCodes;

/**
 * A redirect handler that redirects to a fixed location. It does not pass the request on.
 */
public class RedirectHandler implements Middleware {

    private final String location;
    private final int statusCode;

    public RedirectHandler(final String location) {
        this(location, StatusCodes.FOUND);
    }

    public RedirectHandler(final String location, final int statusCode) {
        this.location = location;
        this.statusCode = statusCode;
    }

    @Override
    public CompletionStage<Void> handle(final RoutingContext context, final Next next) {
        context.redirect(location);
        context.setStatusCode(statusCode);
        return MiddlewareChain.completed();
    }

    public String getLocation() {
        return location;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return "redirect( '" + location + "' )";
    }
}
