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

import java.util.concurrent.CompletionStage;

/**
 * Adapts a {@link ParamMiddleware} to a layer stack entry. Validators sit at the front of a layer's stack, ordered by
 * the position of their parameter in the route path.
 */
public final class ParamValidator implements Middleware {

    private final String param;
    private final ParamMiddleware handler;

    public ParamValidator(final String param, final ParamMiddleware handler) {
        this.param = param;
        this.handler = handler;
    }

    @Override
    public CompletionStage<Void> handle(final RoutingContext context, final Next next) throws Exception {
        return handler.handle(context.getParams().get(param), context, next);
    }

    public String getParam() {
        return param;
    }

    public ParamMiddleware getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return "param( " + param + " )";
    }
}
