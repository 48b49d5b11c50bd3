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
 * A handler that runs before the route handlers whenever a route with the given parameter matches. It is passed the
 * decoded value of the parameter.
 *
 * @see Router#param(String, ParamMiddleware)
 */
@FunctionalInterface
public interface ParamMiddleware {

    CompletionStage<Void> handle(String value, RoutingContext context, Next next) throws Exception;
}
