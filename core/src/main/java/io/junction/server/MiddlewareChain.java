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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.junction.JunctionMessages;

/**
 * Composes a list of middleware into a single middleware.
 * <p>
 * Each entry is passed a {@link Next} that invokes the entry after it. The {@link Next} given to the last entry invokes
 * the {@code next} the composed middleware was called with. An exception thrown by an entry, or a stage it fails,
 * fails the stage of the composed middleware.
 */
public final class MiddlewareChain implements Middleware {

    private static final CompletionStage<Void> COMPLETED = CompletableFuture.completedFuture(null);

    private final List<Middleware> middleware;

    private MiddlewareChain(final List<Middleware> middleware) {
        this.middleware = middleware;
    }

    public static MiddlewareChain compose(final List<? extends Middleware> middleware) {
        return new MiddlewareChain(Collections.unmodifiableList(new ArrayList<>(middleware)));
    }

    /**
     * @return a stage that has already completed normally
     */
    public static CompletionStage<Void> completed() {
        return COMPLETED;
    }

    /**
     * @param cause the failure
     * @return a stage that has already completed with the given exception
     */
    public static CompletionStage<Void> failed(final Throwable cause) {
        return CompletableFuture.failedFuture(cause);
    }

    @Override
    public CompletionStage<Void> handle(final RoutingContext context, final Next next) {
        return new Dispatch(context, next).dispatch(0);
    }

    public List<Middleware> getMiddleware() {
        return middleware;
    }

    @Override
    public String toString() {
        return "chain( " + middleware + " )";
    }

    private final class Dispatch {

        private final RoutingContext context;
        private final Next next;
        private int index = -1;

        Dispatch(final RoutingContext context, final Next next) {
            this.context = context;
            this.next = next;
        }

        CompletionStage<Void> dispatch(final int i) {
            if (i <= index) {
                return failed(JunctionMessages.MESSAGES.nextCalledMultipleTimes());
            }
            index = i;
            try {
                final CompletionStage<Void> result;
                if (i == middleware.size()) {
                    if (next == null) {
                        return COMPLETED;
                    }
                    result = next.proceed();
                } else {
                    result = middleware.get(i).handle(context, () -> dispatch(i + 1));
                }
                return result == null ? COMPLETED : result;
            } catch (Exception e) {
                return failed(e);
            }
        }
    }
}
