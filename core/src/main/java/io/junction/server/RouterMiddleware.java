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
 * The dispatch middleware of a router. Passing one to {@link Router#use(Middleware...)} mounts the router instead of
 * registering it as a plain middleware.
 */
public interface RouterMiddleware extends Middleware {

    /**
     * Dispatches the request to the matching layers of the router, or to {@code next} if no route matches. Failures of
     * the layers are reported through the returned stage.
     */
    @Override
    CompletionStage<Void> handle(RoutingContext context, Next next);

    Router getRouter();
}
