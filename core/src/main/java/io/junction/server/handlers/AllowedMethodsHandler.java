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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionStage;

import io.junction.JunctionMessages;
import io.junction.server.HttpStatusException;
import io.junction.server.Layer;
import io.junction.server.Middleware;
import io.junction.server.MiddlewareChain;
import io.junction.server.Next;
import io.junction.server.RoutingContext;
import io.junction.util.Headers;
import io.junction.util.Methods;
import io.junction.util.StatusCodes;

/**
 * Handler that answers requests whose path matched a route but whose method did not. It runs after the rest of the
 * chain, and only acts if nothing set a status other than 404:
 * <ul>
 * <li>a method the router does not implement gets a 501</li>
 * <li>an {@code OPTIONS} request gets a 200 listing the allowed methods</li>
 * <li>any other method not answered by the matched routes gets a 405</li>
 * </ul>
 * The allowed methods are sent in the {@code Allow} header.
 */
public class AllowedMethodsHandler implements Middleware {

    private final List<String> implemented;
    private final AllowedMethodsOptions options;

    public AllowedMethodsHandler(final List<String> implemented, final AllowedMethodsOptions options) {
        this.implemented = Collections.unmodifiableList(new ArrayList<>(implemented));
        this.options = options == null ? AllowedMethodsOptions.create() : options;
    }

    @Override
    public CompletionStage<Void> handle(final RoutingContext context, final Next next) {
        CompletionStage<Void> result = next == null ? null : next.proceed();
        if (result == null) {
            result = MiddlewareChain.completed();
        }
        return result.thenCompose(v -> {
            try {
                handleAllowedMethods(context);
                return MiddlewareChain.completed();
            } catch (Exception e) {
                return MiddlewareChain.failed(e);
            }
        });
    }

    private void handleAllowedMethods(final RoutingContext context) throws Exception {
        if (context.getStatusCode() != StatusCodes.NOT_FOUND) {
            return;
        }
        final Set<String> allowed = new LinkedHashSet<>();
        for (Layer layer : context.getMatched()) {
            allowed.addAll(layer.getMethods());
        }
        final String allow = String.join(", ", allowed);
        final String method = context.getRequestMethod();

        if (!implemented.contains(method)) {
            if (options.isThrowErrors()) {
                throw options.getNotImplemented() != null ? options.getNotImplemented().get()
                        : new HttpStatusException(StatusCodes.NOT_IMPLEMENTED, JunctionMessages.MESSAGES.notImplemented());
            }
            context.setStatusCode(StatusCodes.NOT_IMPLEMENTED);
            context.setResponseHeader(Headers.ALLOW, allow);
        } else if (!allowed.isEmpty()) {
            if (method.equals(Methods.OPTIONS)) {
                context.setStatusCode(StatusCodes.OK);
                context.setResponseBody("");
                context.setResponseHeader(Headers.ALLOW, allow);
            } else if (!allowed.contains(method)) {
                if (options.isThrowErrors()) {
                    throw options.getMethodNotAllowed() != null ? options.getMethodNotAllowed().get()
                            : new HttpStatusException(StatusCodes.METHOD_NOT_ALLOWED, JunctionMessages.MESSAGES.methodNotAllowed());
                }
                context.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
                context.setResponseHeader(Headers.ALLOW, allow);
            }
        }
    }

    public List<String> getImplementedMethods() {
        return implemented;
    }

    public AllowedMethodsOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "allowed-methods( {" + String.join(", ", implemented) + "} )";
    }
}
