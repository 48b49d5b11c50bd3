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
 * A handler for a routed request. A middleware either calls {@link Next#proceed()} to pass the request on, or
 * completes without calling it, which ends processing for the rest of the chain.
 * <p>
 * The returned stage completes when this middleware, and everything it passed the request to, has finished. A
 * {@code null} return is treated as a stage that has already completed.
 */
@FunctionalInterface
public interface Middleware {

    /**
     * Handle the request.
     *
     * @param context the request context
     * @param next    continues with the following middleware
     * @return a stage that completes when handling is done
     */
    CompletionStage<Void> handle(RoutingContext context, Next next) throws Exception;
}
